package com.stacker.elasticsearch;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * The operations the Stacker needs from its document store.
 *
 * <p>Request bodies are plain JSON-shaped maps in the store's query DSL, built by the query
 * compiler and the partial-update engine. Implementations must not modify them.</p>
 */
public interface DocumentStore {

    /**
     * Creates an index from a {@code settings}/{@code mappings} definition.
     *
     * @return {@code false} when the index already existed
     */
    boolean createIndex(String index, Map<String, Object> definition) throws IOException;

    /**
     * Deletes an index.
     *
     * @return {@code false} when the index did not exist
     */
    boolean deleteIndex(String index) throws IOException;

    /**
     * Indexes (create-or-replace) every document under the value of its {@code idField}.
     *
     * @return number of documents indexed
     * @throws BulkIndexingException if some documents still fail after the configured retries
     */
    int bulkIndex(String index, String idField, List<Map<String, Object>> documents) throws IOException;

    /**
     * Runs a search body ({@code query}, {@code sort}, {@code search_after}, {@code size},
     * {@code _source}, {@code aggs}). Total hit counts are always tracked exactly.
     */
    SearchPage search(String index, Map<String, Object> body) throws IOException;

    /**
     * Counts documents matching the {@code query} of the body.
     */
    long count(String index, Map<String, Object> body) throws IOException;

    /**
     * Applies the {@code script} of the body to every document matching its {@code query},
     * proceeding on version conflicts and refreshing the index afterwards.
     *
     * @return number of documents updated
     */
    long updateByQuery(String index, Map<String, Object> body) throws IOException;
}
