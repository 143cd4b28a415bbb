package com.mediapulse.analytics.filter;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PredicateCompilerTest {
    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-12-31T00:00:00Z");

    @Test
    void compilesDateRangeAndUsers() {
        AnalyticsFilter filter = AnalyticsFilter.builder()
                .startDate(START)
                .endDate(END)
                .users("alice", "bob")
                .build();

        CompiledPredicate compiled = PredicateCompiler.compile(filter);

        assertEquals(List.of("started_at >= ?", "started_at <= ?", "username IN (?, ?)"), compiled.fragments());
        assertEquals(List.of(START, END, "alice", "bob"), compiled.args());
    }

    @Test
    void emptyFilterIsTautologyWithoutArgs() {
        CompiledPredicate compiled = PredicateCompiler.compile(AnalyticsFilter.empty());

        assertTrue(compiled.isEmpty());
        assertEquals("1=1", compiled.conjunction());
        assertEquals("", compiled.whereClause());
        assertTrue(compiled.args().isEmpty());
    }

    @Test
    void nullFilterBehavesLikeEmpty() {
        CompiledPredicate compiled = PredicateCompiler.compile(null);
        assertEquals("1=1", compiled.conjunction());
        assertEquals(0, compiled.argArray().length);
    }

    @Test
    void placeholderCountMatchesArgsForEveryDimension() {
        AnalyticsFilter.Builder builder = AnalyticsFilter.builder().startDate(START).endDate(END);
        for (Dimension d : Dimension.values()) {
            if (d.kind() == ValueKind.INT_LIST) builder.ints(d, List.of(2019, 2020, 2021));
            else builder.strings(d, List.of("a-" + d.name(), "b-" + d.name()));
        }

        CompiledPredicate compiled = PredicateCompiler.compile(builder.build());
        String sql = compiled.conjunction();

        assertEquals(compiled.args().size(), sql.chars().filter(c -> c == '?').count());
        assertEquals(2 + Dimension.values().length, compiled.fragments().size());
        assertEquals("release_year IN (?, ?, ?)", compiled.fragments().get(2 + Dimension.YEARS.ordinal()));
    }

    @Test
    void fragmentsFollowDimensionOrderNotInsertionOrder() {
        AnalyticsFilter filter = AnalyticsFilter.builder()
                .strings(Dimension.SERVER_IDS, List.of("srv-2"))
                .platforms("Roku")
                .mediaTypes("movie")
                .build();

        assertEquals(List.of("media_type IN (?)", "platform IN (?)", "server_id IN (?)"),
                PredicateCompiler.compile(filter).fragments());
    }

    @Test
    void positionalStyleNumbersAcrossWholePredicate() {
        AnalyticsFilter filter = AnalyticsFilter.builder()
                .startDate(START)
                .users("alice", "bob")
                .platforms("Roku")
                .build();

        CompiledPredicate compiled = PredicateCompiler.compile(filter, PlaceholderStyle.POSITIONAL, 3);

        assertEquals(List.of("started_at >= $3", "username IN ($4, $5)", "platform IN ($6)"), compiled.fragments());
        assertEquals(7, compiled.nextPosition());
    }

    @Test
    void unsupportedValuesAndBlankStringsCompileToNothing() {
        AnalyticsFilter filter = AnalyticsFilter.builder()
                .raw(Dimension.PLAYERS, Map.of("k", "v"))
                .raw(Dimension.YEARS, List.of(2020, "2021"))
                .raw(Dimension.LIBRARIES, Set.of(1.5))
                .strings(Dimension.USERS, Arrays.asList(" ", null, ""))
                .build();

        CompiledPredicate compiled = PredicateCompiler.compile(filter);

        assertTrue(compiled.isEmpty());
        assertEquals("1=1", compiled.conjunction());
    }

    @Test
    void rawArraysAndListsAreClassified() {
        AnalyticsFilter filter = AnalyticsFilter.builder()
                .raw(Dimension.PLATFORMS, new String[]{"Roku", " Apple TV "})
                .raw(Dimension.YEARS, new int[]{1999})
                .build();

        CompiledPredicate compiled = PredicateCompiler.compile(filter);

        assertEquals(List.of("platform IN (?, ?)", "release_year IN (?)"), compiled.fragments());
        assertEquals(List.of("Roku", "Apple TV", 1999), compiled.args());
    }

    @Test
    void valuesNeverReachFragmentText() {
        String hostile = "x') OR 1=1 --";
        CompiledPredicate compiled = PredicateCompiler.compile(AnalyticsFilter.builder().users(hostile).build());

        assertEquals(List.of("username IN (?)"), compiled.fragments());
        assertEquals(List.of(hostile), compiled.args());
    }

    @Test
    void tableAliasQualifiesColumnsAndIsValidated() {
        AnalyticsFilter filter = AnalyticsFilter.builder().startDate(START).platforms("Roku").build();

        CompiledPredicate compiled = PredicateCompiler.compile(filter, PlaceholderStyle.ANONYMOUS, 1, "pe");
        assertEquals(List.of("pe.started_at >= ?", "pe.platform IN (?)"), compiled.fragments());

        assertThrows(IllegalArgumentException.class,
                () -> PredicateCompiler.compile(filter, PlaceholderStyle.ANONYMOUS, 1, "pe; DROP TABLE x"));
    }
}
