package com.mediapulse.analytics.issue;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

public final class IssueGenerator {
    private final List<Issue> issues = new ArrayList<>();

    private IssueGenerator() {}

    public static IssueGenerator create() {
        return new IssueGenerator();
    }

    public IssueGenerator whenAbove(double value, double trigger, Supplier<Issue> issue) {
        return when(value > trigger, issue);
    }

    public IssueGenerator whenBelow(double value, double trigger, Supplier<Issue> issue) {
        return when(value < trigger, issue);
    }

    public IssueGenerator when(boolean condition, Supplier<Issue> issue) {
        if (condition) issues.add(issue.get());
        return this;
    }

    public List<Issue> issues() {
        return List.copyOf(issues);
    }
}
