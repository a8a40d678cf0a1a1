package com.stacker.query;

import com.stacker.model.StackerValidationException;

import java.util.List;
import java.util.Map;

/**
 * Free-text search boxes and how each one is matched. The {@code .raw} keyword sub-fields are
 * boosted so exact values rank above partial matches.
 */
public enum QueryField {

    NAME("name", List.of("name", "name.raw^6")),
    ADDRESS("address", List.of("address", "address.raw^6")),
    CITY("city", null),
    PHONE("phone", List.of("phone_raw", "phone_raw.raw^6"));

    private final String key;
    private final List<String> multiMatchFields;

    QueryField(String key, List<String> multiMatchFields) {
        this.key = key;
        this.multiMatchFields = multiMatchFields;
    }

    public String getKey() {
        return key;
    }

    /**
     * Clause matching the given value: {@code multi_match} over the boosted fields, or an exact
     * {@code term} for keyword-only fields.
     */
    public Map<String, Object> toClause(Object value) {
        if (multiMatchFields == null) {
            return QueryClauses.term(key, value);
        }
        return QueryClauses.multiMatch(value, multiMatchFields);
    }

    public static QueryField fromKey(String key) {
        for (QueryField field : values()) {
            if (field.key.equals(key)) {
                return field;
            }
        }
        throw new StackerValidationException("query." + key, "Unknown search field.");
    }
}
