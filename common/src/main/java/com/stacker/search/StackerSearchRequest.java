package com.stacker.search;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.Map;

/**
 * A Stacker search as submitted by a client.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StackerSearchRequest implements Serializable {

    private static final long serialVersionUID = 1L;

    @Min(10)
    @Max(100)
    @Builder.Default
    private int size = 100;

    /** Free-text searches keyed by {@code name}, {@code address}, {@code city} or {@code phone}. */
    private Map<String, String> query;

    private Map<String, Object> filters;

    @NotNull
    @Valid
    private SortSpec sort;

    @JsonProperty("search_after")
    private SearchAfter searchAfter;
}
