package com.stacker.elasticsearch;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One page of search hits together with the exact total and any aggregation results.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SearchPage implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<Hit> hits = Collections.emptyList();
    private long total;
    private Map<String, Object> aggregations;

    public boolean isEmpty() {
        return hits == null || hits.isEmpty();
    }

    /**
     * Sort values of the last hit, the cursor for the following page; {@code null} if there are no
     * hits or the search was not sorted.
     */
    public List<Object> lastSortValues() {
        if (isEmpty()) {
            return null;
        }
        List<Object> sort = hits.get(hits.size() - 1).getSort();
        return sort == null || sort.isEmpty() ? null : sort;
    }

    /**
     * A single search hit.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Hit implements Serializable {
        private static final long serialVersionUID = 1L;
        private String id;
        private Map<String, Object> source;
        private List<Object> sort;
    }
}
