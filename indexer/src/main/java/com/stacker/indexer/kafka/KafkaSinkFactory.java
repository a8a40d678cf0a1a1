package com.stacker.indexer.kafka;

import com.stacker.config.StackerConfig;
import com.stacker.indexer.serde.IndexTaskResultSerializationSchema;
import com.stacker.task.IndexTaskResult;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;

import java.io.Serializable;

/**
 * Factory that builds the Kafka sink for task results.
 */
public class KafkaSinkFactory implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String bootstrapServers;
    private final String resultTopic;

    public KafkaSinkFactory(StackerConfig config) {
        this.bootstrapServers = config.getBootstrapServers();
        this.resultTopic = config.getResultTopic();
    }

    public KafkaSink<IndexTaskResult> createResultSink() {
        return KafkaSink.<IndexTaskResult>builder()
                .setBootstrapServers(bootstrapServers)
                .setRecordSerializer(
                        KafkaRecordSerializationSchema.builder()
                                .setTopic(resultTopic)
                                .setValueSerializationSchema(new IndexTaskResultSerializationSchema())
                                .build()
                )
                .build();
    }
}
