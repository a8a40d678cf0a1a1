package com.stacker.indexer.kafka;

import com.stacker.config.StackerConfig;
import com.stacker.indexer.serde.JsonDeserializationSchema;
import com.stacker.task.IndexTask;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;

import java.io.Serializable;

/**
 * Factory that creates the Kafka source of index tasks from the Stacker configuration.
 */
public class KafkaSourceFactory implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String bootstrapServers;
    private final String taskTopic;
    private final String consumerGroup;

    public KafkaSourceFactory(StackerConfig config) {
        this.bootstrapServers = config.getBootstrapServers();
        this.taskTopic = config.getTaskTopic();
        this.consumerGroup = config.getKafka().getConsumerGroup();
    }

    /**
     * Creates a source resuming from the group's committed offsets, or the earliest offset for a
     * new group, so no published task is skipped.
     */
    public KafkaSource<IndexTask> createTaskSource() {
        return KafkaSource.<IndexTask>builder()
                .setBootstrapServers(bootstrapServers)
                .setTopics(taskTopic)
                .setGroupId(consumerGroup)
                .setStartingOffsets(OffsetsInitializer.committedOffsets(OffsetResetStrategy.EARLIEST))
                .setValueOnlyDeserializer(new JsonDeserializationSchema<>(IndexTask.class))
                .build();
    }
}
