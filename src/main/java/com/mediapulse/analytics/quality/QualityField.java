package com.mediapulse.analytics.quality;

public enum QualityField {
    USER_ID("user_id", "identity", true, "user_id IS NULL", null, true),
    USERNAME("username", "identity", true, blank("username"), null, true),
    SESSION_KEY("session_key", "identity", true, blank("session_key"), null, false),
    IP_ADDRESS("ip_address", "network", true, blank("ip_address"), null, true),
    STARTED_AT("started_at", "temporal", true, "started_at IS NULL", "started_at > ?", false),
    MEDIA_TYPE("media_type", "content", true, blank("media_type"),
            "media_type NOT IN ('movie', 'episode', 'track', 'photo', 'clip')", true),
    TITLE("title", "content", true, blank("title"), null, false),
    PLATFORM("platform", "device", false, blank("platform"), null, true),
    PLAYER("player", "device", false, blank("player"), null, true),
    TRANSCODE_DECISION("transcode_decision", "quality", false, blank("transcode_decision"), null, false),
    VIDEO_RESOLUTION("video_resolution", "quality", false, blank("video_resolution"), null, false),
    PERCENT_COMPLETE("percent_complete", "engagement", false, "percent_complete IS NULL",
            "percent_complete < 0 OR percent_complete > 100", false),
    PLAY_DURATION("play_duration", "engagement", false, "play_duration IS NULL", "play_duration < 0", false);

    private final String column;
    private final String category;
    private final boolean required;
    private final String nullCheck;
    private final String invalidCheck;
    private final boolean countDistinct;

    QualityField(String column, String category, boolean required, String nullCheck, String invalidCheck, boolean countDistinct) {
        this.column = column;
        this.category = category;
        this.required = required;
        this.nullCheck = nullCheck;
        this.invalidCheck = invalidCheck;
        this.countDistinct = countDistinct;
    }

    public String column() {
        return column;
    }

    public String category() {
        return category;
    }

    public boolean required() {
        return required;
    }

    public String nullCheck() {
        return nullCheck;
    }

    public String invalidCheck() {
        return invalidCheck;
    }

    public boolean hasInvalidCheck() {
        return invalidCheck != null;
    }

    public boolean bindsNow() {
        return invalidCheck != null && invalidCheck.contains("?");
    }

    public boolean countDistinct() {
        return countDistinct;
    }

    private static String blank(String column) {
        return column + " IS NULL OR " + column + " = ''";
    }
}
