package com.jreinhal.compass.autonomous.accuracy;

import com.jreinhal.compass.model.TestPriority;
import java.util.Set;

/**
 * Optional suite filters. Empty sets select everything.
 */
public record TestRunOptions(Set<String> categories, Set<TestPriority> priorities) {
    public static final TestRunOptions ALL = new TestRunOptions(Set.of(), Set.of());

    public TestRunOptions {
        categories = categories == null ? Set.of() : Set.copyOf(categories);
        priorities = priorities == null ? Set.of() : Set.copyOf(priorities);
    }

    boolean accepts(String category, TestPriority priority) {
        return (categories.isEmpty() || categories.contains(category))
                && (priorities.isEmpty() || priorities.contains(priority));
    }
}
