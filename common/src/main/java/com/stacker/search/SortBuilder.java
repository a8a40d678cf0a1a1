package com.stacker.search;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds sort clauses with a deterministic tie-break on the document's own id, which keeps
 * {@code search_after} cursors stable.
 */
public final class SortBuilder {

    public static final String SCORE = "_score";
    static final int DEFAULT_MISSING = 0;

    private SortBuilder() {
    }

    public static List<Map<String, Object>> build(String field, String order, String idField) {
        return build(field, order, DEFAULT_MISSING, idField);
    }

    /**
     * Sorting by {@code tags} sorts by the tag count ({@code tags_length}). Documents without a
     * value for the field sort as {@code missing}.
     */
    public static List<Map<String, Object>> build(String field, String order, Object missing, String idField) {
        String sortField = "tags".equals(field) ? "tags_length" : field;

        List<Map<String, Object>> sort = new ArrayList<>();
        Map<String, Object> primary = new LinkedHashMap<>();
        primary.put("order", order);
        if (!SCORE.equals(sortField)) {
            primary.put("missing", missing);
        }
        sort.add(single(sortField, primary));

        if (!sortField.equals(idField)) {
            Map<String, Object> tieBreak = new LinkedHashMap<>();
            tieBreak.put("order", order);
            sort.add(single(idField, tieBreak));
        }
        return sort;
    }

    private static Map<String, Object> single(String key, Object value) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(key, value);
        return map;
    }
}
