package com.stacker.query;

import com.stacker.model.StackerValidationException;

import java.util.Map;

/**
 * Translates a {@link TagFilter} into {@code bool} clauses.
 *
 * <p>Without a mapping each item becomes a clause on the {@code tags} field and criteria apply
 * to {@code property_status.date_utc}. With a mapping each item is looked up and its fragment
 * copied into the clause, and criteria apply to {@code prospect_status.date_utc}.</p>
 */
public final class TagFilterBuilder {

    static final String TAGS_FIELD = "tags";
    static final String PROPERTY_STATUS_DATE = "property_status.date_utc";
    static final String PROSPECT_STATUS_DATE = "prospect_status.date_utc";

    private TagFilterBuilder() {
    }

    /**
     * Property tag ids as {@code term} clauses on {@code tags}.
     */
    public static BoolClauses build(TagFilter filter) {
        return build(filter, "term", null);
    }

    public static BoolClauses build(TagFilter filter, String clauseType,
                                    Map<String, Map<String, Object>> mapping) {
        BoolClauses clauses = new BoolClauses();
        String includeOccurrence = filter.isAll() ? BoolClauses.MUST : BoolClauses.SHOULD;

        for (Object item : filter.getInclude()) {
            clauses.add(includeOccurrence, QueryClauses.clause(clauseType, fragment(item, mapping)));
        }
        for (Object item : filter.getExclude()) {
            clauses.add(BoolClauses.MUST_NOT, QueryClauses.clause(clauseType, fragment(item, mapping)));
        }

        if (filter.getCriteria() != null) {
            String field = mapping == null ? PROPERTY_STATUS_DATE : PROSPECT_STATUS_DATE;
            clauses.add(BoolClauses.MUST, dateRange(field, filter));
        }
        return clauses;
    }

    private static Map<String, Object> fragment(Object item, Map<String, Map<String, Object>> mapping) {
        if (mapping == null) {
            return QueryClauses.single(TAGS_FIELD, item);
        }
        Map<String, Object> fragment = mapping.get(String.valueOf(item));
        if (fragment == null) {
            throw new StackerValidationException("\"" + item + "\" is not a valid choice.");
        }
        return fragment;
    }

    private static Map<String, Object> dateRange(String field, TagFilter filter) {
        switch (filter.getCriteria()) {
            case BEFORE:
                return QueryClauses.range(field, "lte", required(filter.getDateTo(), "date_to"));
            case BETWEEN:
                Map<String, Object> bounds = QueryClauses.single("gte", required(filter.getDateFrom(), "date_from"));
                bounds.put("lte", required(filter.getDateTo(), "date_to"));
                return QueryClauses.range(field, bounds);
            case AFTER:
                return QueryClauses.range(field, "gte", required(filter.getDateFrom(), "date_from"));
            default:
                throw new IllegalStateException("Unhandled criteria " + filter.getCriteria());
        }
    }

    private static String required(String date, String name) {
        if (date == null) {
            throw new StackerValidationException(name, "This field is required for the selected criteria.");
        }
        return date;
    }
}
