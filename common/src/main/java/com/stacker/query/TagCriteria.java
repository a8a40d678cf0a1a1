package com.stacker.query;

import com.stacker.model.StackerValidationException;

import java.util.Arrays;
import java.util.List;

/**
 * Date criteria on when a tag or status was applied.
 */
public enum TagCriteria {

    BEFORE("tagBefore", "tag_prior_to", "declared_prior_to"),
    BETWEEN("tagBetween", "tag_between", "declared_between"),
    AFTER("tagAfter", "tag_after", "declared_after");

    private final List<String> names;

    TagCriteria(String... names) {
        this.names = Arrays.asList(names);
    }

    /**
     * @return the criteria, or {@code null} for a missing or blank name
     */
    public static TagCriteria parse(String field, Object name) {
        if (name == null || name.toString().isBlank()) {
            return null;
        }
        for (TagCriteria criteria : values()) {
            if (criteria.names.contains(name.toString())) {
                return criteria;
            }
        }
        throw new StackerValidationException(field, "\"" + name + "\" is not a valid choice.");
    }

    public String getName() {
        return names.get(0);
    }
}
