package com.stacker.indexer;

import com.stacker.config.StackerConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;

class IndexerJobTest {

    @Test
    void classpathConfigIsTheDefault() throws Exception {
        StackerConfig config = IndexerJob.loadConfig(new String[0]);

        assertEquals("stacker-index-tasks", config.getTaskTopic());
        assertEquals("stacker-index-results", config.getResultTopic());
        assertEquals("", config.getIndexPrefix());
        assertEquals(5000, config.getLoader().getChunkSize());
    }

    @Test
    void fileArgumentOverridesTheDefault(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("indexer.yaml");
        Files.write(file, String.join("\n",
                "indexes:",
                "  prefix: staging-",
                "kafka:",
                "  bootstrapServers: kafka:9092",
                "  taskTopic: staging-tasks").getBytes(StandardCharsets.UTF_8));

        StackerConfig config = IndexerJob.loadConfig(new String[]{file.toString()});

        assertEquals("staging-", config.getIndexPrefix());
        assertEquals("kafka:9092", config.getBootstrapServers());
        assertEquals("staging-tasks", config.getTaskTopic());
        assertEquals("stacker-index-results", config.getResultTopic());
    }
}
