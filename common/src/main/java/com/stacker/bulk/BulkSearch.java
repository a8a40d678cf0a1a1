package com.stacker.bulk;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.Map;

/**
 * The query and filters of a search whose every match a bulk action applies to.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BulkSearch implements Serializable {

    private static final long serialVersionUID = 1L;

    private Map<String, String> query;
    private Map<String, Object> filters;
}
