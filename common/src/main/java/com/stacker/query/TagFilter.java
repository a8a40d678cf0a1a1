package com.stacker.query;

import com.stacker.model.StackerValidationException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A tag-style filter: property tags by id, or prospect statuses by name.
 *
 * <p>{@code option} decides whether included items must all match ({@code all}) or whether any
 * one is enough ({@code any}); excluded items must never match. {@code criteria} with
 * {@code dateFrom}/{@code dateTo} restricts when the tag or status was applied.</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TagFilter {

    public static final String OPTION_ALL = "all";
    public static final String OPTION_ANY = "any";

    @Builder.Default
    private String option = OPTION_ANY;
    @Builder.Default
    private List<Object> include = new ArrayList<>();
    @Builder.Default
    private List<Object> exclude = new ArrayList<>();
    private TagCriteria criteria;
    /** ISO-8601 date. */
    private String dateFrom;
    /** ISO-8601 date. */
    private String dateTo;

    public boolean isAll() {
        return OPTION_ALL.equals(option);
    }

    /**
     * Reads the request representation ({@code option}, {@code include}, {@code exclude},
     * {@code criteria}, {@code date_from}, {@code date_to}).
     */
    public static TagFilter fromMap(String field, Map<String, ?> value) {
        TagFilter filter = new TagFilter();

        Object option = value.get("option");
        if (option != null) {
            if (!OPTION_ALL.equals(option) && !OPTION_ANY.equals(option)) {
                throw new StackerValidationException(field + ".option", "\"" + option + "\" is not a valid choice.");
            }
            filter.setOption(option.toString());
        }
        filter.setInclude(list(field + ".include", value.get("include")));
        filter.setExclude(list(field + ".exclude", value.get("exclude")));
        filter.setCriteria(TagCriteria.parse(field + ".criteria", value.get("criteria")));
        filter.setDateFrom(DateValues.toIsoDate(field + ".date_from", value.get("date_from")));
        filter.setDateTo(DateValues.toIsoDate(field + ".date_to", value.get("date_to")));
        return filter;
    }

    /**
     * The request representation, with dates as ISO strings and absent parts left out.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("option", option);
        map.put("include", new ArrayList<>(include));
        map.put("exclude", new ArrayList<>(exclude));
        if (criteria != null) {
            map.put("criteria", criteria.getName());
        }
        if (dateFrom != null) {
            map.put("date_from", dateFrom);
        }
        if (dateTo != null) {
            map.put("date_to", dateTo);
        }
        return map;
    }

    private static List<Object> list(String field, Object value) {
        if (value == null) {
            return new ArrayList<>();
        }
        if (!(value instanceof Collection)) {
            throw new StackerValidationException(field, "Expected a list of items.");
        }
        return new ArrayList<>((Collection<?>) value);
    }
}
