package com.oslira.bulk.model;

import java.util.List;

/**
 * Bounded-size slice of a run's work items, processed concurrently as one unit.
 *
 * @param index 0-based position of the group within the run
 * @param items items in submission order, never empty
 */
public record BatchGroup(
        int index,
        List<WorkItem> items
) {
    public BatchGroup {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("BatchGroup must contain at least one item");
        }
        items = List.copyOf(items);
    }

    public int size() {
        return items.size();
    }
}
