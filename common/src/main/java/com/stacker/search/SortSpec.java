package com.stacker.search;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Requested sort: one of the sortable fields, ascending or descending.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SortSpec implements Serializable {

    private static final long serialVersionUID = 1L;

    @NotNull
    @Pattern(regexp = "tags|campaigns|last_contact|created_date|last_modified|_score",
            message = "must be one of tags, campaigns, last_contact, created_date, last_modified, _score")
    private String field;

    @Pattern(regexp = "asc|desc", message = "must be asc or desc")
    private String order = "desc";

    public static SortSpec of(String field, String order) {
        return new SortSpec(field, order == null ? "desc" : order);
    }
}
