package com.mediapulse.analytics.filter;

public enum PlaceholderStyle {
    ANONYMOUS,
    POSITIONAL;

    String render(int position) {
        return this == POSITIONAL ? "$" + position : "?";
    }
}
