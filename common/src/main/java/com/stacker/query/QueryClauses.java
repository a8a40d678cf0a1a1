package com.stacker.query;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Small builders for query DSL clauses. Every call returns freshly allocated maps and lists, so
 * callers can hand the same input value to several clauses without aliasing.
 */
public final class QueryClauses {

    private QueryClauses() {
    }

    public static Map<String, Object> term(String field, Object value) {
        return single("term", single(field, value));
    }

    public static Map<String, Object> terms(String field, Collection<?> values) {
        return single("terms", single(field, new ArrayList<>(values)));
    }

    /** {@code terms} for collections, {@code term} for anything else. */
    public static Map<String, Object> termOrTerms(String field, Object value) {
        return value instanceof Collection ? terms(field, (Collection<?>) value) : term(field, value);
    }

    public static Map<String, Object> exists(String field) {
        return single("exists", single("field", field));
    }

    public static Map<String, Object> range(String field, Map<String, ?> bounds) {
        return single("range", single(field, new LinkedHashMap<>(bounds)));
    }

    public static Map<String, Object> range(String field, String operator, Object bound) {
        return single("range", single(field, single(operator, bound)));
    }

    public static Map<String, Object> multiMatch(Object query, List<String> fields) {
        Map<String, Object> multiMatch = new LinkedHashMap<>();
        multiMatch.put("query", query);
        multiMatch.put("fields", new ArrayList<>(fields));
        return single("multi_match", multiMatch);
    }

    /** A clause of the given type ({@code term}, {@code match}, ...) over a copy of the fragment. */
    public static Map<String, Object> clause(String type, Map<String, ?> fragment) {
        return single(type, new LinkedHashMap<>(fragment));
    }

    /**
     * An empty {@code bool} with the four occurrence lists, in the order the compiler fills them.
     */
    public static Map<String, Object> emptyBool() {
        Map<String, Object> bool = new LinkedHashMap<>();
        bool.put(BoolClauses.FILTER, new ArrayList<>());
        bool.put(BoolClauses.MUST, new ArrayList<>());
        bool.put(BoolClauses.MUST_NOT, new ArrayList<>());
        bool.put(BoolClauses.SHOULD, new ArrayList<>());
        return bool;
    }

    static Map<String, Object> single(String key, Object value) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(key, value);
        return map;
    }
}
