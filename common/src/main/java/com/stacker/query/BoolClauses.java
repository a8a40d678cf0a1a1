package com.stacker.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Clauses destined for the occurrence lists of a {@code bool} query, produced by a filter builder
 * and merged into the compiled body.
 */
public class BoolClauses {

    public static final String FILTER = "filter";
    public static final String MUST = "must";
    public static final String MUST_NOT = "must_not";
    public static final String SHOULD = "should";

    private final Map<String, List<Map<String, Object>>> clauses = new LinkedHashMap<>();

    public BoolClauses() {
        clauses.put(MUST, new ArrayList<>());
        clauses.put(MUST_NOT, new ArrayList<>());
        clauses.put(SHOULD, new ArrayList<>());
    }

    public BoolClauses add(String occurrence, Map<String, Object> clause) {
        List<Map<String, Object>> list = clauses.get(occurrence);
        if (list == null) {
            throw new IllegalArgumentException("Unsupported bool occurrence: " + occurrence);
        }
        list.add(clause);
        return this;
    }

    public List<Map<String, Object>> get(String occurrence) {
        return Collections.unmodifiableList(clauses.getOrDefault(occurrence, Collections.emptyList()));
    }

    /**
     * The clauses as {@code {must: [...], must_not: [...], should: [...]}}.
     */
    public Map<String, List<Map<String, Object>>> asMap() {
        Map<String, List<Map<String, Object>>> copy = new LinkedHashMap<>();
        clauses.forEach((occurrence, list) -> copy.put(occurrence, new ArrayList<>(list)));
        return copy;
    }

    /**
     * Appends every clause to the matching list of a {@code bool} map.
     */
    @SuppressWarnings("unchecked")
    public void mergeInto(Map<String, Object> bool) {
        clauses.forEach((occurrence, list) ->
                ((List<Object>) bool.get(occurrence)).addAll(list));
    }
}
