package com.mediapulse.analytics.filter;

import java.util.regex.Pattern;

public final class SqlIdentifiers {
    private static final Pattern SAFE = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}");

    private SqlIdentifiers() {}

    public static String requireSafe(String identifier) {
        if (identifier == null || !SAFE.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Illegal SQL identifier: " + identifier);
        }
        return identifier;
    }

    public static String qualify(String alias, String column) {
        if (alias == null || alias.isEmpty()) return column;
        return requireSafe(alias) + "." + column;
    }
}
