package com.stacker.query;

import com.stacker.model.StackerValidationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates request filters and brings them into the shape {@link SearchQueryCompiler} expects.
 *
 * <ul>
 *   <li>unknown keys and malformed values raise {@link StackerValidationException}</li>
 *   <li>dates are accepted as ISO-8601 or {@code MM/dd/yyyy} and emitted as ISO-8601</li>
 *   <li>{@code owner_verified_status} is renamed to the indexed {@code owner_status}</li>
 *   <li>{@code is_archived} defaults to {@code false}: archived records are hidden unless asked for</li>
 *   <li>a top-level {@code criteria}/{@code date_from}/{@code date_to} is folded into
 *       {@code property_tags}, unless that filter carries its own criteria</li>
 * </ul>
 * The input map is never modified.
 */
public class FilterNormalizer {

    private static final Set<String> ID_LISTS = Set.of(
            "prospect_id", "property_id", "address_id", "distress_indicators", "lead_stage_id");
    private static final Set<String> BOOLEANS = Set.of(
            "is_blocked", "do_not_call", "is_priority", "is_qualified_lead", "wrong_number", "opted_out",
            "is_archived", "is_reminder", "has_reminder", "recently_vacant", "in_campaign", "in_dm_campaign");
    private static final Set<String> DATE_RANGES = Set.of(
            "last_sold_date", "skiptrace_date", "inbound_date", "outbound_date",
            "first_import_date", "last_import_date");
    private static final Set<String> OWNER_STATUSES = Set.of("open", "verified", "unverified");
    private static final Set<String> PROSPECT_STATUSES = Set.of(
            "isBlocked", "doNotCall", "isPriority", "isQualifiedLead", "wrongNumber");
    private static final Set<String> CRITERIA_KEYS = Set.of("criteria", "date_from", "date_to");

    public Map<String, Object> normalize(Map<String, ?> filters) {
        if (filters == null) {
            return null;
        }

        Map<String, Object> normalized = new LinkedHashMap<>();
        normalized.put("is_archived", false);
        Map<String, Object> criteria = new LinkedHashMap<>();

        filters.forEach((key, value) -> {
            String field = "filters." + key;
            if (ID_LISTS.contains(key)) {
                normalized.put(key, idList(field, value));
            } else if (BOOLEANS.contains(key)) {
                normalized.put(key, bool(field, value, false));
            } else if (DATE_RANGES.contains(key)) {
                normalized.put(key, dateRange(field, value));
            } else if (CRITERIA_KEYS.contains(key)) {
                criteria.put(key, value);
            } else {
                switch (key) {
                    case "skip_traced":
                        normalized.put(key, bool(field, value, true));
                        break;
                    case "state":
                        normalized.put(key, stringList(field, value, 2));
                        break;
                    case "zip_code":
                        normalized.put(key, string(field, value, 5));
                        break;
                    case "owner_verified_status":
                    case "owner_status":
                        normalized.put("owner_status", choices(field, value, OWNER_STATUSES));
                        break;
                    case "property_tags":
                        normalized.put(key, tagFilter(field, value, false));
                        break;
                    case "prospect_status":
                        normalized.put(key, tagFilter(field, value, true));
                        break;
                    default:
                        throw new StackerValidationException(field, "Unknown filter.");
                }
            }
        });

        foldCriteria(normalized, criteria);
        return normalized;
    }

    @SuppressWarnings("unchecked")
    private static void foldCriteria(Map<String, Object> normalized, Map<String, Object> criteria) {
        if (criteria.isEmpty() || TagCriteria.parse("filters.criteria", criteria.get("criteria")) == null) {
            return;
        }
        Map<String, Object> tags = (Map<String, Object>) normalized.get("property_tags");
        if (tags == null) {
            tags = new TagFilter().toMap();
        } else if (tags.containsKey("criteria")) {
            return;
        }
        Map<String, Object> merged = new LinkedHashMap<>(tags);
        merged.putAll(criteria);
        normalized.put("property_tags", TagFilter.fromMap("filters", merged).toMap());
    }

    private static Map<String, Object> tagFilter(String field, Object value, boolean prospectStatus) {
        if (!(value instanceof Map)) {
            throw new StackerValidationException(field, "Expected an object.");
        }
        @SuppressWarnings("unchecked")
        TagFilter filter = TagFilter.fromMap(field, (Map<String, ?>) value);
        List<Object> include = new ArrayList<>();
        List<Object> exclude = new ArrayList<>();
        for (Object item : filter.getInclude()) {
            include.add(prospectStatus ? choice(field + ".include", item, PROSPECT_STATUSES) : id(field + ".include", item));
        }
        for (Object item : filter.getExclude()) {
            exclude.add(prospectStatus ? choice(field + ".exclude", item, PROSPECT_STATUSES) : id(field + ".exclude", item));
        }
        filter.setInclude(include);
        filter.setExclude(exclude);
        return filter.toMap();
    }

    private static Map<String, Object> dateRange(String field, Object value) {
        if (value == null) {
            return new LinkedHashMap<>();
        }
        if (!(value instanceof Map)) {
            throw new StackerValidationException(field, "Expected an object with gte and/or lte.");
        }
        Map<String, Object> range = new LinkedHashMap<>();
        ((Map<?, ?>) value).forEach((operator, bound) -> {
            if (!"gte".equals(operator) && !"lte".equals(operator)) {
                throw new StackerValidationException(field + "." + operator, "Unknown range bound.");
            }
            String date = DateValues.toIsoDate(field + "." + operator, bound);
            if (date != null) {
                range.put(operator.toString(), date);
            }
        });
        return range;
    }

    private static List<Integer> idList(String field, Object value) {
        List<Integer> ids = new ArrayList<>();
        for (Object item : collection(field, value)) {
            ids.add(id(field, item));
        }
        return ids;
    }

    private static Integer id(String field, Object value) {
        if (!(value instanceof Integer || value instanceof Long || value instanceof Short)) {
            throw new StackerValidationException(field, "A valid integer is required.");
        }
        long id = ((Number) value).longValue();
        if (id < 0 || id > Integer.MAX_VALUE) {
            throw new StackerValidationException(field, "Ensure this value is between 0 and " + Integer.MAX_VALUE + ".");
        }
        return (int) id;
    }

    private static Boolean bool(String field, Object value, boolean nullable) {
        if (value == null && nullable) {
            return null;
        }
        if (!(value instanceof Boolean)) {
            throw new StackerValidationException(field, "Must be a valid boolean.");
        }
        return (Boolean) value;
    }

    private static String string(String field, Object value, int maxLength) {
        if (!(value instanceof String)) {
            throw new StackerValidationException(field, "Not a valid string.");
        }
        String text = (String) value;
        if (text.length() > maxLength) {
            throw new StackerValidationException(field, "Ensure this field has no more than " + maxLength + " characters.");
        }
        return text;
    }

    private static List<String> stringList(String field, Object value, int maxLength) {
        List<String> strings = new ArrayList<>();
        for (Object item : collection(field, value)) {
            strings.add(string(field, item, maxLength));
        }
        return strings;
    }

    private static List<String> choices(String field, Object value, Set<String> allowed) {
        List<String> chosen = new ArrayList<>();
        for (Object item : collection(field, value)) {
            String choice = choice(field, item, allowed);
            if (!chosen.contains(choice)) {
                chosen.add(choice);
            }
        }
        return chosen;
    }

    private static String choice(String field, Object value, Set<String> allowed) {
        if (value == null || !allowed.contains(value.toString())) {
            throw new StackerValidationException(field, "\"" + value + "\" is not a valid choice.");
        }
        return value.toString();
    }

    private static Collection<?> collection(String field, Object value) {
        if (!(value instanceof Collection)) {
            throw new StackerValidationException(field, "Expected a list of items.");
        }
        return (Collection<?>) value;
    }
}
