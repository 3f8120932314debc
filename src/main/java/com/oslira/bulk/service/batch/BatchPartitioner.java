package com.oslira.bulk.service.batch;

import com.oslira.bulk.model.BatchGroup;
import com.oslira.bulk.model.ComplexityClass;
import com.oslira.bulk.model.WorkItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a run's items into consecutive fixed-size groups.
 * Group size comes from the {@link GroupSizeTable} entry for the run's complexity class.
 */
@Component
@Slf4j
public class BatchPartitioner {

    private final GroupSizeTable groupSizes;

    public BatchPartitioner(GroupSizeTable groupSizes) {
        this.groupSizes = groupSizes;
    }

    /**
     * @return ceil(N / groupSize) groups in submission order; empty for an empty list
     */
    public List<BatchGroup> partition(List<WorkItem> items, ComplexityClass complexity) {
        int groupSize = groupSizes.groupSizeFor(complexity);
        List<BatchGroup> groups = partition(items, groupSize);
        log.debug("Partitioned {} {} items into {} groups of up to {}",
                items.size(), complexity, groups.size(), groupSize);
        return groups;
    }

    static List<BatchGroup> partition(List<WorkItem> items, int groupSize) {
        if (groupSize < 1) {
            throw new IllegalArgumentException("groupSize must be >= 1, was " + groupSize);
        }
        List<BatchGroup> groups = new ArrayList<>((items.size() + groupSize - 1) / groupSize);
        for (int i = 0; i < items.size(); i += groupSize) {
            groups.add(new BatchGroup(groups.size(), items.subList(i, Math.min(i + groupSize, items.size()))));
        }
        return groups;
    }
}
