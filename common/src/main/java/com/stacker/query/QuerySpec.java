package com.stacker.query;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Inputs of one query compilation. Only {@code companyId} is required.
 */
@Value
@Builder(toBuilder = true)
public class QuerySpec {

    int companyId;

    /** Free-text searches keyed by {@link QueryField#getKey()}. */
    Map<String, Object> queries;

    /** Normalised filters, see {@link FilterNormalizer}. */
    Map<String, Object> filters;

    /** Field the {@code exclude} ids refer to. */
    String idFieldName;

    /** Aggregations attached verbatim as {@code aggs}. */
    Map<String, Object> aggregates;

    /** Ids never to be matched. */
    List<?> exclude;

    /** Restricts returned {@code _source} to this field. */
    String source;
}
