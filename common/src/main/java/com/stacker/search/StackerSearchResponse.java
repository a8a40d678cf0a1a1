package com.stacker.search;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Results of a search over both indexes, with the company's total counts.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StackerSearchResponse implements Serializable {

    private static final long serialVersionUID = 1L;

    private SearchResult prospects;
    private SearchResult properties;
    private StackerCounts counts;
}
