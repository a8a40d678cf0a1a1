package com.stacker.indexer.serde;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stacker.task.IndexTaskResult;
import org.apache.flink.api.common.serialization.SerializationSchema;

/**
 * Serialises an {@link IndexTaskResult} to JSON bytes for the result topic.
 */
public class IndexTaskResultSerializationSchema implements SerializationSchema<IndexTaskResult> {

    private static final long serialVersionUID = 1L;

    private transient ObjectMapper objectMapper;

    @Override
    public void open(InitializationContext context) throws Exception {
        objectMapper = new ObjectMapper();
    }

    @Override
    public byte[] serialize(IndexTaskResult result) {
        if (objectMapper == null) {
            objectMapper = new ObjectMapper();
        }
        try {
            return objectMapper.writeValueAsBytes(result);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialise IndexTaskResult " + result.getTaskId(), e);
        }
    }
}
