package com.stacker.elasticsearch;

import java.io.IOException;
import java.util.List;

/**
 * Raised when bulk items are still rejected after the configured retries.
 */
public class BulkIndexingException extends IOException {

    private static final long serialVersionUID = 1L;

    private final String index;
    private final List<String> failedIds;

    public BulkIndexingException(String index, List<String> failedIds, String firstReason) {
        super("Bulk indexing into " + index + " failed for " + failedIds.size()
                + " document(s), first error: " + firstReason);
        this.index = index;
        this.failedIds = List.copyOf(failedIds);
    }

    public String getIndex() {
        return index;
    }

    public List<String> getFailedIds() {
        return failedIds;
    }
}
