package com.mediapulse.analytics.filter;

public enum Dimension {
    USERS("username", ValueKind.STRING_LIST),
    MEDIA_TYPES("media_type", ValueKind.STRING_LIST),
    PLATFORMS("platform", ValueKind.STRING_LIST),
    PLAYERS("player", ValueKind.STRING_LIST),
    TRANSCODE_DECISIONS("transcode_decision", ValueKind.STRING_LIST),
    VIDEO_RESOLUTIONS("video_resolution", ValueKind.STRING_LIST),
    VIDEO_CODECS("video_codec", ValueKind.STRING_LIST),
    AUDIO_CODECS("audio_codec", ValueKind.STRING_LIST),
    LIBRARIES("library_name", ValueKind.STRING_LIST),
    CONTENT_RATINGS("content_rating", ValueKind.STRING_LIST),
    YEARS("release_year", ValueKind.INT_LIST),
    LOCATION_TYPES("location_type", ValueKind.STRING_LIST),
    SERVER_IDS("server_id", ValueKind.STRING_LIST);

    private final String column;
    private final ValueKind kind;

    Dimension(String column, ValueKind kind) {
        this.column = column;
        this.kind = kind;
    }

    public String column() {
        return column;
    }

    public ValueKind kind() {
        return kind;
    }
}
