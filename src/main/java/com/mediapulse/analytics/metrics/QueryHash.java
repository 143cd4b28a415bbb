package com.mediapulse.analytics.metrics;

import org.apache.commons.codec.digest.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;

public final class QueryHash {
    private final StringBuilder canonical;

    private QueryHash(String report) {
        this.canonical = new StringBuilder(report).append('|');
    }

    public static QueryHash forReport(String report) {
        return new QueryHash(report);
    }

    public QueryHash instant(String key, Instant value) {
        if (value != null) canonical.append(key).append('=').append(DateTimeFormatter.ISO_INSTANT.format(value)).append('|');
        return this;
    }

    public QueryHash list(String key, List<?> values) {
        if (values != null && !values.isEmpty()) canonical.append(key).append('=').append(values).append('|');
        return this;
    }

    public QueryHash value(String key, Object value) {
        if (value != null) canonical.append(key).append('=').append(value).append('|');
        return this;
    }

    public String canonical() {
        return canonical.toString();
    }

    public String digest() {
        return DigestUtils.sha256Hex(canonical.toString().getBytes(StandardCharsets.UTF_8)).substring(0, 16);
    }
}
