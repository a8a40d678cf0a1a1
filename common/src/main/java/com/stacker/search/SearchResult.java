package com.stacker.search;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * One index's page of results, its exact total and the cursor for the next page.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SearchResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<Map<String, Object>> results;

    private long total;

    /** Sort values of the last hit; {@code null} when the page is empty or unsorted. */
    @JsonProperty("search_after")
    private List<Object> searchAfter;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Map<String, Object> aggs;
}
