package com.mediapulse.analytics.filter;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Compiles an {@link AnalyticsFilter} into parameterised boolean fragments.
 *
 * <p>Order is fixed: start date, end date, then every {@link Dimension} in
 * declaration order. Filter values only ever reach the argument list; fragment
 * text is built from column names of the enum and placeholders.
 */
public final class PredicateCompiler {
    static final String STARTED_AT = "started_at";

    private PredicateCompiler() {}

    public static CompiledPredicate compile(AnalyticsFilter filter) {
        return compile(filter, PlaceholderStyle.ANONYMOUS, 1, null);
    }

    public static CompiledPredicate compile(AnalyticsFilter filter, PlaceholderStyle style, int startPosition) {
        return compile(filter, style, startPosition, null);
    }

    public static CompiledPredicate compile(AnalyticsFilter filter, PlaceholderStyle style, int startPosition, String tableAlias) {
        List<String> fragments = new ArrayList<>();
        List<Object> args = new ArrayList<>();
        int position = Math.max(1, startPosition);
        if (filter == null) return new CompiledPredicate(fragments, args, position);

        String startedAt = SqlIdentifiers.qualify(tableAlias, STARTED_AT);
        if (filter.startDate() != null) {
            fragments.add(startedAt + " >= " + style.render(position++));
            args.add(filter.startDate());
        }
        if (filter.endDate() != null) {
            fragments.add(startedAt + " <= " + style.render(position++));
            args.add(filter.endDate());
        }

        for (Dimension dimension : Dimension.values()) {
            DimensionValues values = filter.dimensions().get(dimension);
            if (values == null) continue;
            switch (values.kind()) {
                case STRING_LIST, INT_LIST -> {
                    if (values.values().isEmpty()) continue;
                    StringJoiner placeholders = new StringJoiner(", ", "(", ")");
                    for (Object value : values.values()) {
                        placeholders.add(style.render(position++));
                        args.add(value);
                    }
                    fragments.add(SqlIdentifiers.qualify(tableAlias, dimension.column()) + " IN " + placeholders);
                }
                case UNSUPPORTED -> {
                    // no predicate for values of unknown shape
                }
            }
        }
        return new CompiledPredicate(fragments, args, position);
    }
}
