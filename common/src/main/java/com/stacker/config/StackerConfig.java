package com.stacker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;

/**
 * Top-level Stacker configuration.
 *
 * <p>When running inside the Spring Boot search API the properties are bound automatically
 * from {@code application.yaml} under the {@code stacker.*} prefix.  The Flink indexer job
 * has no Spring context and uses the static {@link #load(String)} and
 * {@link #loadFromClasspath(String)} helpers instead.</p>
 */
@Data
@ConfigurationProperties(prefix = "stacker")
public class StackerConfig implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private IndexSection indexes = new IndexSection();
    private ElasticsearchConfig elasticsearch = new ElasticsearchConfig();
    private DatabaseConfig database = new DatabaseConfig();
    private KafkaSection kafka = new KafkaSection();
    private LoaderConfig loader = new LoaderConfig();
    private SearchSection search = new SearchSection();

    // ── Loading ──────────────────────────────────────────────────────────

    /**
     * Loads configuration from a YAML file on disk.
     */
    public static StackerConfig load(String path) throws IOException {
        return YAML_MAPPER.readValue(new File(path), StackerConfig.class);
    }

    /**
     * Loads configuration from a classpath resource.
     */
    public static StackerConfig loadFromClasspath(String resource) throws IOException {
        try (InputStream is = StackerConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException("Resource not found on classpath: " + resource);
            }
            return YAML_MAPPER.readValue(is, StackerConfig.class);
        }
    }

    // ── Convenience accessors ────────────────────────────────────────────

    public String getIndexPrefix() {
        return indexes.getPrefix();
    }

    public String getBootstrapServers() {
        return kafka.getBootstrapServers();
    }

    public String getTaskTopic() {
        return kafka.getTaskTopic();
    }

    public String getResultTopic() {
        return kafka.getResultTopic();
    }

    // ── Nested section POJOs ─────────────────────────────────────────────

    @Data
    public static class IndexSection implements Serializable {
        private static final long serialVersionUID = 1L;

        /** Prepended to every index name; {@code test_} isolates test runs. */
        private String prefix = "";
    }

    @Data
    public static class KafkaSection implements Serializable {
        private static final long serialVersionUID = 1L;
        private String bootstrapServers;
        private String taskTopic = "stacker-index-tasks";
        private String resultTopic = "stacker-index-results";
        private String consumerGroup = "stacker-indexer";
    }

    @Data
    public static class SearchSection implements Serializable {
        private static final long serialVersionUID = 1L;

        /** How long per-company document counts may be served from cache. */
        private long countCacheTtlSeconds = 180;

        /** Page size used when scanning every matching id. */
        private int scanPageSize = 10_000;
    }
}
