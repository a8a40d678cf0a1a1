package com.stacker.query;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles free-text queries and structured filters into a company-scoped search body.
 *
 * <p>The body always starts as
 * <pre>
 *   {query: {bool: {filter: [{term: {company_id}}], must: [], must_not: [], should: []}}}
 * </pre>
 * and every other clause is added to it, so a body can never match another company's documents.
 * The compiler is pure: inputs are never modified and the output shares no mutable structure
 * with them, so compiling the same input twice yields equal bodies.</p>
 *
 * <h3>Filters with special handling</h3>
 * <ul>
 *   <li>{@code is_reminder}: {@code term} on {@code has_reminder}</li>
 *   <li>{@code skip_traced}: {@code exists(phone_raw)} in {@code filter} when true,
 *       in {@code must_not} when false</li>
 *   <li>{@code in_campaign} / {@code in_dm_campaign}: {@code range > 0} when true,
 *       {@code term == 0} when false</li>
 *   <li>date ranges: an {@code exists} plus a {@code range} clause on the document field</li>
 *   <li>{@code property_tags} / {@code prospect_status}: tag filters</li>
 *   <li>{@code lead_stage_id} ({@code terms}) and {@code zip_code} ({@code term})</li>
 * </ul>
 * Every other filter is a {@code terms} clause for lists and a {@code term} clause otherwise.
 */
@Slf4j
public class SearchQueryCompiler {

    public static final String COMPANY_FIELD = "company_id";

    /** Request date filter key to document field, in the order the clauses are emitted. */
    private static final Map<String, String> DATE_FILTERS = new LinkedHashMap<>();

    /** Prospect-status names to the activity title recorded when the status was set. */
    private static final Map<String, Map<String, Object>> PROSPECT_STATUS_TITLES = new LinkedHashMap<>();

    static {
        DATE_FILTERS.put("inbound_date", "last_contact_inbound");
        DATE_FILTERS.put("outbound_date", "last_contact");
        DATE_FILTERS.put("last_sold_date", "last_sold_date");
        DATE_FILTERS.put("skiptrace_date", "skiptrace_date");
        DATE_FILTERS.put("last_import_date", "last_import_date");
        DATE_FILTERS.put("first_import_date", "first_import_date");

        PROSPECT_STATUS_TITLES.put("isBlocked", QueryClauses.single("prospect_status.title", "is_blocked"));
        PROSPECT_STATUS_TITLES.put("doNotCall", QueryClauses.single("prospect_status.title", "Added to DNC"));
        PROSPECT_STATUS_TITLES.put("isPriority", QueryClauses.single("prospect_status.title", "Added as Priority"));
        PROSPECT_STATUS_TITLES.put("isQualifiedLead", QueryClauses.single("prospect_status.title", "Qualified Lead Added"));
        PROSPECT_STATUS_TITLES.put("wrongNumber", QueryClauses.single("prospect_status.title", "Added Wrong Number"));
    }

    /**
     * The body matching every document of a company.
     */
    public Map<String, Object> companyScope(int companyId) {
        return compile(QuerySpec.builder().companyId(companyId).build());
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> compile(QuerySpec spec) {
        Map<String, Object> bool = QueryClauses.emptyBool();
        List<Object> filter = (List<Object>) bool.get(BoolClauses.FILTER);
        List<Object> must = (List<Object>) bool.get(BoolClauses.MUST);
        List<Object> mustNot = (List<Object>) bool.get(BoolClauses.MUST_NOT);

        filter.add(QueryClauses.term(COMPANY_FIELD, spec.getCompanyId()));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", QueryClauses.single("bool", bool));

        if (spec.getSource() != null) {
            body.put("_source", spec.getSource());
        }

        if (spec.getExclude() != null && spec.getIdFieldName() != null) {
            mustNot.add(QueryClauses.terms(spec.getIdFieldName(), spec.getExclude()));
        }

        boolean noQueries = spec.getQueries() == null || spec.getQueries().isEmpty();
        boolean noFilters = spec.getFilters() == null || spec.getFilters().isEmpty();
        if (noQueries && noFilters) {
            attachAggregates(body, spec);
            return body;
        }

        if (!noFilters) {
            applyFilters(new LinkedHashMap<>(spec.getFilters()), bool);
        }

        if (!noQueries) {
            spec.getQueries().forEach((key, value) -> {
                QueryField field = QueryField.fromKey(key);
                if (value != null && !value.toString().isBlank()) {
                    must.add(field.toClause(value));
                }
            });
        }

        attachAggregates(body, spec);

        if (!((List<Object>) bool.get(BoolClauses.SHOULD)).isEmpty()) {
            bool.put("minimum_should_match", 1);
        }

        log.debug("Compiled search body for company {}: {}", spec.getCompanyId(), body);
        return body;
    }

    // ── Filters ──────────────────────────────────────────────────────────

    @SuppressWarnings("unchecked")
    private void applyFilters(Map<String, Object> filters, Map<String, Object> bool) {
        List<Object> filter = (List<Object>) bool.get(BoolClauses.FILTER);
        List<Object> mustNot = (List<Object>) bool.get(BoolClauses.MUST_NOT);

        Object propertyTags = filters.remove("property_tags");
        Object skipTraced = filters.remove("skip_traced");
        Object inCampaign = filters.remove("in_campaign");
        Object inDmCampaign = filters.remove("in_dm_campaign");
        Object leadStageId = filters.remove("lead_stage_id");
        Object hasReminder = filters.remove("is_reminder");
        Object zipCode = filters.remove("zip_code");
        Object prospectStatus = filters.remove("prospect_status");
        Map<String, Object> dateLookups = new LinkedHashMap<>();
        DATE_FILTERS.keySet().forEach(key -> dateLookups.put(key, filters.remove(key)));

        if (hasReminder != null) {
            filter.add(QueryClauses.term("has_reminder", hasReminder));
        }

        if (skipTraced != null) {
            if (Boolean.TRUE.equals(skipTraced)) {
                filter.add(QueryClauses.exists("phone_raw"));
            } else {
                mustNot.add(QueryClauses.exists("phone_raw"));
            }
        }

        addCampaignFilter(filter, "campaigns", inCampaign);
        addCampaignFilter(filter, "dm_campaigns", inDmCampaign);

        DATE_FILTERS.forEach((key, field) -> {
            Map<String, Object> bounds = dateBounds(dateLookups.get(key));
            if (!bounds.isEmpty()) {
                filter.add(QueryClauses.exists(field));
                filter.add(QueryClauses.range(field, bounds));
            }
        });

        if (propertyTags != null) {
            TagFilterBuilder.build(tagFilter("property_tags", propertyTags)).mergeInto(bool);
        }
        if (prospectStatus != null && !isEmptyMap(prospectStatus)) {
            TagFilterBuilder.build(tagFilter("prospect_status", prospectStatus), "match", PROSPECT_STATUS_TITLES)
                    .mergeInto(bool);
        }

        if (leadStageId instanceof Collection && !((Collection<?>) leadStageId).isEmpty()) {
            filter.add(QueryClauses.terms("lead_stage_id", (Collection<?>) leadStageId));
        }

        if (zipCode != null && !zipCode.toString().isEmpty()) {
            filter.add(QueryClauses.term("zip_code", zipCode));
        }

        filters.forEach((key, value) -> {
            if (value != null) {
                String field = "is_reminder".equals(key) ? "has_reminder" : key;
                filter.add(QueryClauses.termOrTerms(field, value));
            }
        });
    }

    private static void addCampaignFilter(List<Object> filter, String field, Object flag) {
        if (flag == null) {
            return;
        }
        if (Boolean.TRUE.equals(flag)) {
            filter.add(QueryClauses.range(field, "gt", 0));
        } else {
            filter.add(QueryClauses.term(field, 0));
        }
    }

    /** Non-null bounds of a date range lookup, copied. */
    private static Map<String, Object> dateBounds(Object lookup) {
        Map<String, Object> bounds = new LinkedHashMap<>();
        if (lookup instanceof Map) {
            ((Map<?, ?>) lookup).forEach((operator, bound) -> {
                if (bound != null) {
                    bounds.put(operator.toString(), bound);
                }
            });
        }
        return bounds;
    }

    @SuppressWarnings("unchecked")
    private static TagFilter tagFilter(String field, Object value) {
        if (value instanceof TagFilter) {
            return (TagFilter) value;
        }
        if (value instanceof Map) {
            return TagFilter.fromMap(field, (Map<String, ?>) value);
        }
        throw new IllegalArgumentException(field + " must be a tag filter, got " + value.getClass().getSimpleName());
    }

    private static boolean isEmptyMap(Object value) {
        return value instanceof Map && ((Map<?, ?>) value).isEmpty();
    }

    private static void attachAggregates(Map<String, Object> body, QuerySpec spec) {
        if (spec.getAggregates() != null) {
            body.put("aggs", deepCopy(spec.getAggregates()));
        }
    }

    static Object deepCopy(Object value) {
        if (value instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((key, item) -> copy.put(key.toString(), deepCopy(item)));
            return copy;
        }
        if (value instanceof Collection) {
            List<Object> copy = new ArrayList<>();
            ((Collection<?>) value).forEach(item -> copy.add(deepCopy(item)));
            return copy;
        }
        return value;
    }
}
