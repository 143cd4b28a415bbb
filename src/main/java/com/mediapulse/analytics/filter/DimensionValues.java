package com.mediapulse.analytics.filter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

public record DimensionValues(ValueKind kind, List<String> strings, List<Integer> ints) {

    private static final DimensionValues UNSUPPORTED = new DimensionValues(ValueKind.UNSUPPORTED, List.of(), List.of());

    public DimensionValues {
        Objects.requireNonNull(kind, "kind");
        strings = strings == null ? List.of() : List.copyOf(strings);
        ints = ints == null ? List.of() : List.copyOf(ints);
    }

    public static DimensionValues ofStrings(Collection<String> raw) {
        if (raw == null) return new DimensionValues(ValueKind.STRING_LIST, List.of(), List.of());
        List<String> cleaned = raw.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        return new DimensionValues(ValueKind.STRING_LIST, cleaned, List.of());
    }

    public static DimensionValues ofInts(Collection<Integer> raw) {
        if (raw == null) return new DimensionValues(ValueKind.INT_LIST, List.of(), List.of());
        return new DimensionValues(ValueKind.INT_LIST, List.of(), raw.stream().filter(Objects::nonNull).toList());
    }

    public static DimensionValues from(Object raw) {
        if (raw instanceof String[] array) return ofStrings(Arrays.asList(array));
        if (raw instanceof Integer[] array) return ofInts(Arrays.asList(array));
        if (raw instanceof int[] array) return ofInts(Arrays.stream(array).boxed().toList());
        if (!(raw instanceof Collection<?> collection)) return UNSUPPORTED;

        List<String> strings = new ArrayList<>();
        List<Integer> ints = new ArrayList<>();
        for (Object element : collection) {
            if (element == null) continue;
            if (element instanceof String s) strings.add(s);
            else if (element instanceof Integer i) ints.add(i);
            else return UNSUPPORTED;
        }
        if (!strings.isEmpty() && !ints.isEmpty()) return UNSUPPORTED;
        return ints.isEmpty() ? ofStrings(strings) : ofInts(ints);
    }

    public List<?> values() {
        return kind == ValueKind.INT_LIST ? ints : strings;
    }
}
