package com.stacker.indexer.pipeline;

import com.stacker.config.StackerConfig;
import com.stacker.indexer.kafka.KafkaSinkFactory;
import com.stacker.indexer.kafka.KafkaSourceFactory;
import com.stacker.task.IndexTask;
import com.stacker.task.IndexTaskResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;

/**
 * Builds the indexing pipeline.
 *
 * <pre>
 *   [Task Topic] → IndexTaskFunction → [Result Topic]
 * </pre>
 *
 * Tasks are not keyed: there is no ordering between independent tasks, and a later full refresh
 * overwrites whatever earlier partial updates wrote.
 */
@Slf4j
public class IndexingPipelineBuilder {

    private final StackerConfig config;
    private final KafkaSourceFactory kafkaSourceFactory;
    private final KafkaSinkFactory kafkaSinkFactory;

    public IndexingPipelineBuilder(StackerConfig config) {
        this(config, new KafkaSourceFactory(config), new KafkaSinkFactory(config));
    }

    public IndexingPipelineBuilder(StackerConfig config,
                                   KafkaSourceFactory kafkaSourceFactory,
                                   KafkaSinkFactory kafkaSinkFactory) {
        this.config = config;
        this.kafkaSourceFactory = kafkaSourceFactory;
        this.kafkaSinkFactory = kafkaSinkFactory;
    }

    public void build(StreamExecutionEnvironment env) {
        log.info("Building indexing pipeline: {} → {}", config.getTaskTopic(), config.getResultTopic());

        DataStream<IndexTask> tasks = env
                .fromSource(kafkaSourceFactory.createTaskSource(), WatermarkStrategy.noWatermarks(),
                        "index-task-source");

        DataStream<IndexTaskResult> results = tasks
                .process(new IndexTaskFunction(config))
                .name("execute-index-task");

        results.sinkTo(kafkaSinkFactory.createResultSink())
                .name("index-result-sink");
    }
}
