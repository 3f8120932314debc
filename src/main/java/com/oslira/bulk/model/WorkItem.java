package com.oslira.bulk.model;

import java.util.Objects;

/**
 * One unit of work submitted to a batch run, e.g. one profile username to analyze.
 */
public record WorkItem(
        String id,
        ComplexityClass complexity
) {
    public WorkItem {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(complexity, "complexity");
    }
}
