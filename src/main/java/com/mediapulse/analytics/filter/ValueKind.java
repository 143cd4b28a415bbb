package com.mediapulse.analytics.filter;

public enum ValueKind {
    STRING_LIST,
    INT_LIST,
    UNSUPPORTED
}
