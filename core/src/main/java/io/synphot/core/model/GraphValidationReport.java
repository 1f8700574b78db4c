package io.synphot.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Structural problems found in a graph table: nodes that cannot be reached from the start node,
 * and nodes that sit on a cycle.
 */
public record GraphValidationReport(String graphTable, SortedSet<Integer> unreachable, SortedSet<Integer> loops) {

    public GraphValidationReport {
        unreachable = Collections.unmodifiableSortedSet(new TreeSet<>(unreachable));
        loops = Collections.unmodifiableSortedSet(new TreeSet<>(loops));
    }

    public boolean isValid() {
        return unreachable.isEmpty() && loops.isEmpty();
    }

    /** Human-readable problem lines; empty when the table is valid. */
    public List<String> messages() {
        List<String> messages = new ArrayList<>();
        if (!unreachable.isEmpty()) {
            messages.add(String.format("%d unreachable nodes: %s", unreachable.size(), unreachable));
        }
        if (!loops.isEmpty()) {
            messages.add(String.format("Loop involving %d nodes: %s", loops.size(), loops));
        }
        return messages;
    }
}
