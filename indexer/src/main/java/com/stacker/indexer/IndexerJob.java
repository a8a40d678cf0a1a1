package com.stacker.indexer;

import com.stacker.config.StackerConfig;
import com.stacker.indexer.pipeline.IndexingPipelineBuilder;
import lombok.extern.slf4j.Slf4j;
import org.apache.flink.api.common.RuntimeExecutionMode;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;

/**
 * Entry point for the Stacker indexer Flink job.
 *
 * <p>Usage:
 * <pre>
 *   flink run stacker-indexer.jar [config-path]
 * </pre>
 *
 * <p>If no config path is supplied, the default classpath resource
 * {@code indexer-config.yaml} is used.</p>
 */
@Slf4j
public class IndexerJob {

    static final String DEFAULT_CONFIG_RESOURCE = "indexer-config.yaml";

    public static void main(String[] args) throws Exception {
        new IndexerJob().run(args);
    }

    public void run(String[] args) throws Exception {
        // ── Load configuration ───────────────────────────────────────────
        StackerConfig config = loadConfig(args);
        log.info("Task topic: {}, result topic: {}, index prefix: '{}'",
                config.getTaskTopic(), config.getResultTopic(), config.getIndexPrefix());

        // ── Set up Flink environment ─────────────────────────────────────
        StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
        env.setRuntimeMode(RuntimeExecutionMode.STREAMING);
        env.enableCheckpointing(60_000);

        // ── Build and execute pipeline ───────────────────────────────────
        new IndexingPipelineBuilder(config).build(env);

        env.execute("Stacker Indexer");
    }

    static StackerConfig loadConfig(String[] args) throws Exception {
        if (args.length > 0) {
            log.info("Loading configuration from file: {}", args[0]);
            return StackerConfig.load(args[0]);
        }
        log.info("Loading configuration from classpath: {}", DEFAULT_CONFIG_RESOURCE);
        return StackerConfig.loadFromClasspath(DEFAULT_CONFIG_RESOURCE);
    }
}
