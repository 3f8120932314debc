package com.oslira.bulk.service.batch;

import com.oslira.bulk.model.WorkItem;

/**
 * Processes one work item, e.g. scrape and analyze one profile.
 *
 * <p>Throw {@link com.oslira.bulk.exception.ItemProcessingException} to tag a failure
 * with its kind; any other exception is classified by {@link ErrorClassifier}.
 */
@FunctionalInterface
public interface ItemProcessor<T> {

    T process(WorkItem item) throws Exception;
}
