package com.stacker.search;

import com.stacker.schema.DocumentType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.List;

/**
 * Pagination cursors, one per index. A missing cursor starts that index from the first page.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SearchAfter implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<Object> properties;
    private List<Object> prospects;

    public List<Object> forType(DocumentType type) {
        return type == DocumentType.PROPERTY ? properties : prospects;
    }
}
