package com.stacker.search;

import com.stacker.elasticsearch.DocumentStore;
import com.stacker.elasticsearch.SearchPage;
import com.stacker.model.StackerValidationException;
import com.stacker.query.SearchQueryCompiler;
import com.stacker.schema.DocumentType;
import com.stacker.schema.StackerSchema;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Façade over the property and prospect indexes.
 *
 * <p>Accepts compiled bodies from {@link SearchQueryCompiler}, adds sort, cursor and paging,
 * and shapes the hits into {@link SearchResult}s. Bodies passed in are never modified, so one
 * body can drive searches over both indexes.</p>
 */
@Slf4j
public class StackerIndex {

    /** Aggregation kinds whose results the document store converts. */
    static final Set<String> AGGREGATION_KINDS = Set.of("filter", "value_count", "cardinality", "sum");

    private final DocumentStore store;
    private final SearchQueryCompiler compiler;
    private final CompanyCountCache countCache;
    private final String indexPrefix;
    private final int scanPageSize;

    public StackerIndex(DocumentStore store, SearchQueryCompiler compiler, CompanyCountCache countCache,
                        String indexPrefix, int scanPageSize) {
        this.store = store;
        this.compiler = compiler;
        this.countCache = countCache;
        this.indexPrefix = indexPrefix;
        this.scanPageSize = scanPageSize;
    }

    public String indexName(DocumentType type) {
        return type.indexName(indexPrefix);
    }

    /**
     * Resolves an index name to its document type.
     *
     * @throws StackerValidationException for names that are not Stacker indexes
     */
    public DocumentType documentType(String indexName) {
        for (DocumentType type : DocumentType.values()) {
            if (indexName(type).equals(indexName)) {
                return type;
            }
        }
        throw new StackerValidationException("Index name " + indexName + " does not exist.");
    }

    // ── Administration ───────────────────────────────────────────────────

    /**
     * Creates both indexes from the schema; existing indexes are left alone.
     */
    public void create() throws IOException {
        for (DocumentType type : DocumentType.values()) {
            store.createIndex(indexName(type), StackerSchema.indexDefinition());
        }
    }

    /**
     * Deletes both indexes; missing indexes are ignored.
     */
    public void delete() throws IOException {
        for (DocumentType type : DocumentType.values()) {
            store.deleteIndex(indexName(type));
        }
    }

    // ── Search ───────────────────────────────────────────────────────────

    /**
     * Runs one page of a search.
     *
     * @param size        page size, or {@code null} for the store default
     * @param sort        requested sort, or {@code null} for relevance order without a cursor
     * @param searchAfter cursor from the previous page, or {@code null}/empty for the first page
     */
    public SearchResult search(String indexName, Map<String, Object> body, Integer size,
                               SortSpec sort, List<Object> searchAfter) throws IOException {
        DocumentType type = documentType(indexName);
        checkAggregations(body);

        Map<String, Object> request = new LinkedHashMap<>(body);
        if (searchAfter != null && !searchAfter.isEmpty()) {
            request.put("search_after", new ArrayList<>(searchAfter));
        }
        if (sort != null) {
            request.put("sort", SortBuilder.build(sort.getField(), sort.getOrder(), type.getIdField()));
        }
        if (size != null) {
            request.put("size", size);
        }

        SearchPage page = store.search(indexName, request);

        List<Map<String, Object>> results = new ArrayList<>();
        for (SearchPage.Hit hit : page.getHits()) {
            results.add(hit.getSource());
        }
        List<Object> nextCursor = sort != null ? page.lastSortValues() : null;
        Map<String, Object> aggs = body.containsKey("aggs") ? page.getAggregations() : null;

        return new SearchResult(results, page.getTotal(), nextCursor, aggs);
    }

    /**
     * Runs the same body against both indexes, each with its own cursor.
     */
    public StackerSearchResponse searchIndexes(Map<String, Object> body, Integer size, SortSpec sort,
                                               SearchAfter searchAfter) throws IOException {
        SearchAfter cursors = searchAfter == null ? new SearchAfter() : searchAfter;
        SearchResult prospects = search(indexName(DocumentType.PROSPECT), body, size, sort,
                cursors.forType(DocumentType.PROSPECT));
        SearchResult properties = search(indexName(DocumentType.PROPERTY), body, size, sort,
                cursors.forType(DocumentType.PROPERTY));
        return new StackerSearchResponse(prospects, properties, null);
    }

    /**
     * Total documents of a company in each index. Served from the count cache.
     */
    public StackerCounts totalCountsByCompany(int companyId) throws IOException {
        return countCache.get(companyId, () -> {
            Map<String, Object> body = compiler.companyScope(companyId);
            return new StackerCounts(
                    store.count(indexName(DocumentType.PROSPECT), body),
                    store.count(indexName(DocumentType.PROPERTY), body));
        });
    }

    /**
     * Runs a size-0 search and returns only its aggregation results.
     */
    public Map<String, Object> aggregate(String indexName, Map<String, Object> body) throws IOException {
        documentType(indexName);
        checkAggregations(body);
        Map<String, Object> request = new LinkedHashMap<>(body);
        request.put("size", 0);
        Map<String, Object> aggregations = store.search(indexName, request).getAggregations();
        return aggregations == null ? new LinkedHashMap<>() : aggregations;
    }

    /**
     * Collects {@code idField} of every document matching the body, scanning page by page in
     * document-id order.
     *
     * <p>Array-valued ids (a property's prospect ids) are flattened one level. Nulls are dropped.
     * Results mixing scalar and array values are rejected.</p>
     */
    public List<Object> getIdList(String indexName, Map<String, Object> body, String idField) throws IOException {
        DocumentType type = documentType(indexName);

        List<Object> values = new ArrayList<>();
        List<Object> cursor = null;
        while (true) {
            Map<String, Object> request = new LinkedHashMap<>(body);
            request.put("_source", idField);
            request.put("size", scanPageSize);
            request.put("sort", SortBuilder.build(type.getIdField(), "asc", type.getIdField()));
            if (cursor != null) {
                request.put("search_after", cursor);
            }

            SearchPage page = store.search(indexName, request);
            for (SearchPage.Hit hit : page.getHits()) {
                values.add(hit.getSource() == null ? null : hit.getSource().get(idField));
            }
            if (page.getHits().size() < scanPageSize) {
                break;
            }
            cursor = page.lastSortValues();
            if (cursor == null) {
                break;
            }
        }

        List<Object> ids = flatten(values, idField);
        log.debug("Resolved {} {} value(s) from {}", ids.size(), idField, indexName);
        return ids;
    }

    /**
     * Rejects aggregations outside {@link #AGGREGATION_KINDS}, including nested ones.
     */
    static void checkAggregations(Map<String, Object> body) {
        Object aggs = body.get("aggs");
        if (aggs == null) {
            return;
        }
        if (!(aggs instanceof Map)) {
            throw new StackerValidationException("aggs", "Expected an object of named aggregations.");
        }
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) aggs).entrySet()) {
            if (!(entry.getValue() instanceof Map)) {
                throw new StackerValidationException("aggs", "Aggregation " + entry.getKey() + " has no definition.");
            }
            for (Object kind : ((Map<?, ?>) entry.getValue()).keySet()) {
                if (!AGGREGATION_KINDS.contains(String.valueOf(kind))) {
                    throw new StackerValidationException("aggs",
                            "Unsupported aggregation " + kind + " in " + entry.getKey() + ".");
                }
            }
        }
    }

    private static List<Object> flatten(List<Object> values, String idField) {
        boolean sawList = false;
        boolean sawScalar = false;
        List<Object> ids = new ArrayList<>();
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            if (value instanceof Collection) {
                sawList = true;
                for (Object item : (Collection<?>) value) {
                    if (item != null) {
                        ids.add(item);
                    }
                }
            } else {
                sawScalar = true;
                ids.add(value);
            }
            if (sawList && sawScalar) {
                throw new IllegalStateException("Values of " + idField + " mix single ids and id arrays");
            }
        }
        return ids;
    }
}
