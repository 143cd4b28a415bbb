package com.mediapulse.analytics.filter;

import java.util.List;

public final class ClauseAssembler {
    static final String SEPARATOR = " AND ";

    private ClauseAssembler() {}

    public static String buildWhereClause(List<String> fragments) {
        if (fragments == null || fragments.isEmpty()) return "";
        return "WHERE " + join(fragments);
    }

    public static String buildConjunction(List<String> fragments) {
        if (fragments == null || fragments.isEmpty()) return "1=1";
        return "1=1" + SEPARATOR + join(fragments);
    }

    public static String join(List<String> fragments) {
        if (fragments == null || fragments.isEmpty()) return "";
        return String.join(SEPARATOR, fragments);
    }
}
