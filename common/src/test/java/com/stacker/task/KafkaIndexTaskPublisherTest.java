package com.stacker.task;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stacker.schema.EntityKind;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KafkaIndexTaskPublisherTest {

    private static final String TOPIC = "stacker-index-tasks";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockProducer<String, byte[]> producer;
    private KafkaIndexTaskPublisher publisher;

    @BeforeEach
    void setUp() {
        producer = new MockProducer<>(true, new StringSerializer(), new ByteArraySerializer());
        publisher = new KafkaIndexTaskPublisher(producer, TOPIC, objectMapper);
    }

    @Test
    void taskIsSentAsJsonKeyedByTaskId() throws Exception {
        IndexTask task = IndexTask.partialUpdate(EntityKind.PROSPECT, List.of(4, 5), Map.of("do_not_call", true));

        publisher.publish(task);

        assertEquals(1, producer.history().size());
        ProducerRecord<String, byte[]> record = producer.history().get(0);
        assertEquals(TOPIC, record.topic());
        assertEquals(task.getTaskId(), record.key());

        IndexTask sent = objectMapper.readValue(record.value(), IndexTask.class);
        assertEquals(IndexTaskType.PARTIAL_UPDATE, sent.getType());
        assertEquals(EntityKind.PROSPECT, sent.getEntityKind());
        assertEquals(List.of(4, 5), sent.getIds());
        assertEquals(Map.of("do_not_call", true), sent.getChanges());
        assertEquals(task.getCreatedAt(), sent.getCreatedAt());
    }

    @Test
    void failedSendDoesNotReachTheCaller() {
        MockProducer<String, byte[]> failing = new MockProducer<>(false, new StringSerializer(), new ByteArraySerializer());
        KafkaIndexTaskPublisher failingPublisher = new KafkaIndexTaskPublisher(failing, TOPIC, objectMapper);

        failingPublisher.publish(IndexTask.tagRefresh(List.of(1)));
        failing.errorNext(new RuntimeException("broker unavailable"));

        assertEquals(1, failing.history().size());
    }

    @Test
    void closeClosesTheProducer() {
        publisher.close();

        assertTrue(producer.closed());
    }
}
