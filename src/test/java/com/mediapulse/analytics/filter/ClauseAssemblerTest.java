package com.mediapulse.analytics.filter;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClauseAssemblerTest {

    @Test
    void rendersAllThreeForms() {
        List<String> fragments = List.of("a = ?", "b IN (?, ?)");

        assertEquals("WHERE a = ? AND b IN (?, ?)", ClauseAssembler.buildWhereClause(fragments));
        assertEquals("1=1 AND a = ? AND b IN (?, ?)", ClauseAssembler.buildConjunction(fragments));
        assertEquals("a = ? AND b IN (?, ?)", ClauseAssembler.join(fragments));
    }

    @Test
    void emptyFragmentsGiveNeutralForms() {
        assertEquals("", ClauseAssembler.buildWhereClause(List.of()));
        assertEquals("1=1", ClauseAssembler.buildConjunction(List.of()));
        assertEquals("", ClauseAssembler.join(null));
    }

    @Test
    void singleFragmentHasNoSeparator() {
        assertEquals("WHERE x = ?", ClauseAssembler.buildWhereClause(List.of("x = ?")));
        assertEquals("1=1 AND x = ?", ClauseAssembler.buildConjunction(List.of("x = ?")));
    }
}
