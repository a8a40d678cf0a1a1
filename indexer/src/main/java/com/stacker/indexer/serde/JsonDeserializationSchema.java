package com.stacker.indexer.serde;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;

import java.io.IOException;

/**
 * Generic JSON deserialisation schema backed by Jackson.
 *
 * <p>Malformed messages are logged and skipped (deserialised to {@code null}, which the Kafka
 * source drops) instead of failing the job.</p>
 *
 * @param <T> target type
 */
@Slf4j
public class JsonDeserializationSchema<T> implements DeserializationSchema<T> {

    private static final long serialVersionUID = 1L;

    private final Class<T> targetClass;
    private transient ObjectMapper objectMapper;

    public JsonDeserializationSchema(Class<T> targetClass) {
        this.targetClass = targetClass;
    }

    @Override
    public void open(InitializationContext context) throws Exception {
        objectMapper = createObjectMapper();
    }

    @Override
    public T deserialize(byte[] message) throws IOException {
        if (objectMapper == null) {
            objectMapper = createObjectMapper();
        }
        try {
            return objectMapper.readValue(message, targetClass);
        } catch (IOException e) {
            log.error("Skipping malformed {} message: {}", targetClass.getSimpleName(), e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(T nextElement) {
        return false;
    }

    @Override
    public TypeInformation<T> getProducedType() {
        return TypeInformation.of(targetClass);
    }

    private static ObjectMapper createObjectMapper() {
        return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
}
