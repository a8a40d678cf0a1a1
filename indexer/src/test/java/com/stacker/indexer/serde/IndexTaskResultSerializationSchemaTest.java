package com.stacker.indexer.serde;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stacker.task.IndexTask;
import com.stacker.task.IndexTaskResult;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class IndexTaskResultSerializationSchemaTest {

    @Test
    void failedResultCarriesTheError() throws IOException {
        IndexTask task = IndexTask.tagRefresh(List.of(3));
        IndexTaskResult result = IndexTaskResult.failure(task, "index_not_found_exception", 12);

        byte[] bytes = new IndexTaskResultSerializationSchema().serialize(result);

        JsonNode json = new ObjectMapper().readTree(bytes);
        assertEquals(task.getTaskId(), json.get("taskId").asText());
        assertEquals("TAG_REFRESH", json.get("type").asText());
        assertFalse(json.get("success").asBoolean());
        assertEquals("index_not_found_exception", json.get("errorMessage").asText());
        assertEquals(12, json.get("durationMs").asLong());
    }
}
