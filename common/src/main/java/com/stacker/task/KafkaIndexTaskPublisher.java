package com.stacker.task;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;

import java.io.Closeable;
import java.util.Properties;

/**
 * Publishes index tasks as JSON to the task topic, keyed by task id.
 *
 * <p>Sends are asynchronous; a failed send is logged and the task is lost. The index is a derived
 * cache, so a lost task leaves it stale until the next refresh or population.</p>
 */
@Slf4j
public class KafkaIndexTaskPublisher implements IndexTaskPublisher, Closeable {

    private final Producer<String, byte[]> producer;
    private final String topic;
    private final ObjectMapper objectMapper;

    public KafkaIndexTaskPublisher(String bootstrapServers, String topic, ObjectMapper objectMapper) {
        this(new KafkaProducer<>(producerProperties(bootstrapServers)), topic, objectMapper);
    }

    public KafkaIndexTaskPublisher(Producer<String, byte[]> producer, String topic, ObjectMapper objectMapper) {
        this.producer = producer;
        this.topic = topic;
        this.objectMapper = objectMapper;
    }

    private static Properties producerProperties(String bootstrapServers) {
        Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        return props;
    }

    @Override
    public void publish(IndexTask task) {
        byte[] payload;
        try {
            payload = objectMapper.writeValueAsBytes(task);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize index task " + task.getTaskId(), e);
        }
        producer.send(new ProducerRecord<>(topic, task.getTaskId(), payload), (metadata, exception) -> {
            if (exception != null) {
                log.error("Failed to publish {} task {}: {}", task.getType(), task.getTaskId(),
                        exception.getMessage(), exception);
            } else {
                log.debug("Published {} task {} to {}-{}@{}", task.getType(), task.getTaskId(),
                        metadata.topic(), metadata.partition(), metadata.offset());
            }
        });
    }

    @Override
    public void close() {
        producer.close();
    }
}
