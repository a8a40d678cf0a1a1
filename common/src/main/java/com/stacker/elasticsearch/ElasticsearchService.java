package com.stacker.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.Conflicts;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.ScriptLanguage;
import co.elastic.clients.elasticsearch._types.aggregations.Aggregate;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.CountRequest;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.UpdateByQueryRequest;
import co.elastic.clients.elasticsearch.core.UpdateByQueryResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkOperation;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stacker.config.ElasticsearchConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.elasticsearch.client.RestClient;
import org.elasticsearch.client.RestClientBuilder;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link DocumentStore} backed by the Elasticsearch Java API client.
 *
 * <p>Request bodies arrive as maps in the query DSL; they are serialised with Jackson and handed
 * to the client through {@code withJson}, so the compiler never depends on client builder types.</p>
 *
 * <p>Instances hold an HTTP connection pool. In the Flink indexer they are created per operator
 * inside {@code open()}; in the search API a single instance is a Spring bean.</p>
 */
@Slf4j
public class ElasticsearchService implements DocumentStore, Closeable {

    private static final String ALREADY_EXISTS = "resource_already_exists_exception";

    private final ElasticsearchClient client;
    private final RestClient restClient;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final int maxBulkRetries;

    public ElasticsearchService(ElasticsearchConfig config) {
        HttpHost[] hosts = config.getHosts().stream()
                .map(HttpHost::create)
                .toArray(HttpHost[]::new);

        RestClientBuilder builder = RestClient.builder(hosts)
                .setRequestConfigCallback(rcb -> rcb
                        .setConnectTimeout(config.getConnectTimeoutMs())
                        .setSocketTimeout(config.getSocketTimeoutMs()));

        if (config.getUsername() != null && !config.getUsername().isEmpty()) {
            BasicCredentialsProvider credentialsProvider = new BasicCredentialsProvider();
            credentialsProvider.setCredentials(AuthScope.ANY,
                    new UsernamePasswordCredentials(config.getUsername(), config.getPassword()));
            builder.setHttpClientConfigCallback(hcb ->
                    hcb.setDefaultCredentialsProvider(credentialsProvider));
        }

        this.restClient = builder.build();
        RestClientTransport transport = new RestClientTransport(restClient, new JacksonJsonpMapper(objectMapper));
        this.client = new ElasticsearchClient(transport);
        this.maxBulkRetries = config.getMaxBulkRetries();
    }

    // ── Index administration ─────────────────────────────────────────────

    @Override
    public boolean createIndex(String index, Map<String, Object> definition) throws IOException {
        byte[] definitionBytes = objectMapper.writeValueAsBytes(definition);
        try {
            client.indices().create(CreateIndexRequest.of(b -> b
                    .index(index)
                    .withJson(new ByteArrayInputStream(definitionBytes))));
            log.info("Created index {}", index);
            return true;
        } catch (ElasticsearchException e) {
            if (e.error() != null && ALREADY_EXISTS.equals(e.error().type())) {
                log.warn("Index {} already exists, leaving it untouched", index);
                return false;
            }
            throw e;
        }
    }

    @Override
    public boolean deleteIndex(String index) throws IOException {
        try {
            client.indices().delete(d -> d.index(index));
            log.info("Deleted index {}", index);
            return true;
        } catch (ElasticsearchException e) {
            if (e.status() == 404) {
                log.warn("Index {} does not exist, nothing to delete", index);
                return false;
            }
            throw e;
        }
    }

    // ── Writes ───────────────────────────────────────────────────────────

    @Override
    public int bulkIndex(String index, String idField, List<Map<String, Object>> documents) throws IOException {
        if (documents == null || documents.isEmpty()) {
            return 0;
        }

        Map<String, Map<String, Object>> pending = new LinkedHashMap<>();
        for (Map<String, Object> document : documents) {
            Object id = document.get(idField);
            if (id == null) {
                throw new IllegalArgumentException("Document without " + idField + " cannot be indexed into " + index);
            }
            pending.put(id.toString(), document);
        }

        String firstReason = null;
        for (int attempt = 0; attempt <= maxBulkRetries && !pending.isEmpty(); attempt++) {
            if (attempt > 0) {
                log.warn("Retrying {} rejected document(s) for index {} (attempt {}/{})",
                        pending.size(), index, attempt, maxBulkRetries);
            }

            List<BulkOperation> operations = new ArrayList<>(pending.size());
            pending.forEach((id, document) -> operations.add(BulkOperation.of(o -> o
                    .index(i -> i.index(index).id(id).document(document)))));

            BulkResponse response = client.bulk(BulkRequest.of(b -> b.operations(operations)));
            if (!response.errors()) {
                pending.clear();
                break;
            }

            Map<String, Map<String, Object>> rejected = new LinkedHashMap<>();
            for (BulkResponseItem item : response.items()) {
                if (item.error() != null) {
                    rejected.put(item.id(), pending.get(item.id()));
                    if (firstReason == null) {
                        firstReason = item.error().reason();
                    }
                }
            }
            pending = rejected;
        }

        if (!pending.isEmpty()) {
            throw new BulkIndexingException(index, new ArrayList<>(pending.keySet()), firstReason);
        }
        return documents.size();
    }

    @Override
    public long updateByQuery(String index, Map<String, Object> body) throws IOException {
        byte[] queryBytes = objectMapper.writeValueAsBytes(body.get("query"));
        Map<?, ?> script = (Map<?, ?>) body.get("script");
        String source = String.valueOf(script.get("source"));

        UpdateByQueryResponse response = client.updateByQuery(UpdateByQueryRequest.of(b -> b
                .index(index)
                .query(q -> q.withJson(new ByteArrayInputStream(queryBytes)))
                .script(s -> s.inline(i -> i.source(source).lang(ScriptLanguage.Painless)))
                .conflicts(Conflicts.Proceed)
                .refresh(true)));

        long updated = response.updated() == null ? 0L : response.updated();
        log.debug("update_by_query on {} updated {} document(s)", index, updated);
        return updated;
    }

    // ── Reads ────────────────────────────────────────────────────────────

    @Override
    @SuppressWarnings({"unchecked", "rawtypes"})
    public SearchPage search(String index, Map<String, Object> body) throws IOException {
        Map<String, Object> request = new LinkedHashMap<>(body);
        request.put("track_total_hits", true);
        byte[] bodyBytes = objectMapper.writeValueAsBytes(request);
        log.debug("Searching {} with {}", index, request);

        SearchResponse<Map> response = client.search(SearchRequest.of(b -> b
                .index(index)
                .withJson(new ByteArrayInputStream(bodyBytes))), Map.class);

        List<SearchPage.Hit> hits = new ArrayList<>();
        for (Hit<Map> hit : response.hits().hits()) {
            List<Object> sort = new ArrayList<>();
            for (Object value : hit.sort()) {
                sort.add(plainValue(value));
            }
            hits.add(new SearchPage.Hit(hit.id(), (Map<String, Object>) hit.source(), sort));
        }

        long total = response.hits().total() == null ? hits.size() : response.hits().total().value();

        Map<String, Object> aggregations = null;
        if (response.aggregations() != null && !response.aggregations().isEmpty()) {
            aggregations = new LinkedHashMap<>();
            for (Map.Entry<String, Aggregate> entry : response.aggregations().entrySet()) {
                aggregations.put(entry.getKey(), aggregateValue(entry.getValue()));
            }
        }

        return new SearchPage(hits, total, aggregations);
    }

    @Override
    public long count(String index, Map<String, Object> body) throws IOException {
        byte[] queryBytes = objectMapper.writeValueAsBytes(body.get("query"));

        CountRequest.Builder countBuilder = new CountRequest.Builder().index(index);
        countBuilder.query(q -> q.withJson(new ByteArrayInputStream(queryBytes)));

        long count = client.count(countBuilder.build()).count();
        log.debug("Count for index={}: {}", index, count);
        return count;
    }

    /** Sort values come back as {@link FieldValue}s; the cursor travels as plain JSON values. */
    private static Object plainValue(Object value) {
        if (!(value instanceof FieldValue)) {
            return value;
        }
        FieldValue fieldValue = (FieldValue) value;
        if (fieldValue.isNull()) {
            return null;
        } else if (fieldValue.isLong()) {
            return fieldValue.longValue();
        } else if (fieldValue.isDouble()) {
            return fieldValue.doubleValue();
        } else if (fieldValue.isBoolean()) {
            return fieldValue.booleanValue();
        } else if (fieldValue.isString()) {
            return fieldValue.stringValue();
        }
        return String.valueOf(fieldValue._get());
    }

    private static Map<String, Object> aggregateValue(Aggregate aggregate) {
        Map<String, Object> value = new LinkedHashMap<>();
        if (aggregate.isFilter()) {
            value.put("doc_count", aggregate.filter().docCount());
        } else if (aggregate.isValueCount()) {
            value.put("value", aggregate.valueCount().value());
        } else if (aggregate.isCardinality()) {
            value.put("value", aggregate.cardinality().value());
        } else if (aggregate.isSum()) {
            value.put("value", aggregate.sum().value());
        } else {
            throw new IllegalStateException("Aggregation kind " + aggregate._kind() + " is not supported");
        }
        return value;
    }

    @Override
    public void close() throws IOException {
        if (restClient != null) {
            restClient.close();
        }
    }
}
