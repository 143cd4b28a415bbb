package com.mediapulse.analytics.filter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record CompiledPredicate(List<String> fragments, List<Object> args, int nextPosition) {

    public CompiledPredicate {
        fragments = List.copyOf(fragments);
        args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    public boolean isEmpty() {
        return fragments.isEmpty();
    }

    public String whereClause() {
        return ClauseAssembler.buildWhereClause(fragments);
    }

    public String conjunction() {
        return ClauseAssembler.buildConjunction(fragments);
    }

    public Object[] argArray() {
        return args.toArray();
    }
}
