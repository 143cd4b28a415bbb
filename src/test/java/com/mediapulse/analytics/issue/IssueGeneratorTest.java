package com.mediapulse.analytics.issue;

import com.mediapulse.analytics.metrics.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class IssueGeneratorTest {

    @Test
    void firesOnlyStrictlyBeyondTrigger() {
        List<Issue> issues = IssueGenerator.create()
                .whenAbove(5.0, 5, () -> issue("at_trigger"))
                .whenAbove(5.1, 5, () -> issue("above"))
                .whenBelow(50.0, 50, () -> issue("at_floor"))
                .whenBelow(49.0, 50, () -> issue("below"))
                .issues();

        assertEquals(List.of("above", "below"), issues.stream().map(Issue::type).toList());
    }

    @Test
    void buildsIssueLazily() {
        AtomicInteger built = new AtomicInteger();
        IssueGenerator.create().when(false, () -> {
            built.incrementAndGet();
            return issue("never");
        });
        assertEquals(0, built.get());
    }

    @Test
    void returnedListIsImmutable() {
        List<Issue> issues = IssueGenerator.create().when(true, () -> issue("x")).issues();
        assertThrows(UnsupportedOperationException.class, () -> issues.add(issue("y")));
        assertNull(issues.get(0).relatedDimension());
    }

    private static Issue issue(String type) {
        return new Issue(type, Severity.WARNING, type, type, 1, 1.0, "none");
    }
}
