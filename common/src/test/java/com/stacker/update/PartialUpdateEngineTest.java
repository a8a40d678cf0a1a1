package com.stacker.update;

import com.stacker.elasticsearch.DocumentStore;
import com.stacker.model.PropertyTags;
import com.stacker.schema.EntityKind;
import com.stacker.testing.InMemoryDocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class PartialUpdateEngineTest {

    private InMemoryDocumentStore store;
    private PartialUpdateEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        engine = new PartialUpdateEngine(store, "");

        Map<String, Object> property = new LinkedHashMap<>();
        property.put("property_id", 1);
        property.put("prospect_id", new ArrayList<>(List.of(10, 11)));
        property.put("tags", new ArrayList<>(List.of(5)));
        property.put("tags_length", 1);
        property.put("distress_indicators", 0);
        property.put("is_archived", false);
        store.bulkIndex("stacker-property", "property_id", List.of(property));
        store.bulkIndex("stacker-prospect", "prospect_id", List.of(prospect(10, 1), prospect(11, 1), prospect(12, 2)));
    }

    @Test
    void singleIdUsesTerm() {
        Map<String, Object> body = PartialUpdateEngine.buildUpdateForQueryBody(EntityKind.PROSPECT, List.of(10),
                "ctx._source.is_archived = true;");

        assertEquals(Map.of(
                "query", Map.of("bool", Map.of("must", List.of(Map.of("term", Map.of("prospect_id", 10))))),
                "script", Map.of("source", "ctx._source.is_archived = true;", "lang", "painless")), body);
    }

    @Test
    void severalIdsUseTerms() {
        Map<String, Object> body = PartialUpdateEngine.buildUpdateForQueryBody(EntityKind.ADDRESS, List.of(3, 4), "");

        assertEquals(Map.of("bool", Map.of("must", List.of(Map.of("terms", Map.of("address_id", List.of(3, 4)))))),
                body.get("query"));
    }

    @Test
    void changesReachBothIndexes() throws IOException {
        long updated = engine.apply(EntityKind.PROSPECT, List.of(10), List.of(FieldChange.of("is_archived", true)));

        assertEquals(2, updated);
        assertEquals(true, store.document("stacker-prospect", 10).get("is_archived"));
        assertEquals(true, store.document("stacker-property", 1).get("is_archived"));
        assertEquals(false, store.document("stacker-prospect", 11).get("is_archived"));
        assertEquals(2, store.getUpdateRequests().size());
    }

    @Test
    void tagChangesKeepCountsInStep() throws IOException {
        engine.updatePropertyTags(new PropertyTags(1, List.of(5, 6, 7), 2));

        Map<String, Object> property = store.document("stacker-property", 1);
        assertEquals(List.of(5, 6, 7), property.get("tags"));
        assertEquals(3, property.get("tags_length"));
        assertEquals(2, property.get("distress_indicators"));
        for (Object id : List.of(10, 11)) {
            Map<String, Object> prospect = store.document("stacker-prospect", id);
            assertEquals(List.of(5, 6, 7), prospect.get("tags"));
            assertEquals(3, prospect.get("tags_length"));
        }
        assertEquals(1, store.document("stacker-prospect", 12).get("tags_length"));
    }

    @Test
    void removingEveryTagZeroesTheCounts() throws IOException {
        engine.updatePropertyTags(new PropertyTags(1, List.of(), 0));

        Map<String, Object> property = store.document("stacker-property", 1);
        assertEquals(List.of(), property.get("tags"));
        assertEquals(0, property.get("tags_length"));
        assertEquals(0, property.get("distress_indicators"));
    }

    @Test
    void nothingToApplyMakesNoRequest() throws IOException {
        DocumentStore idle = mock(DocumentStore.class);
        PartialUpdateEngine idleEngine = new PartialUpdateEngine(idle, "");

        assertEquals(0, idleEngine.apply(EntityKind.PROPERTY, List.of(), List.of(FieldChange.of("tags", List.of()))));
        assertEquals(0, idleEngine.apply(EntityKind.PROPERTY, List.of(1), List.of()));
        verifyNoInteractions(idle);
    }

    @Test
    void storeFailureIsPropagated() throws IOException {
        DocumentStore failing = mock(DocumentStore.class);
        IOException failure = new IOException("timeout");
        when(failing.updateByQuery(anyString(), any())).thenThrow(failure);

        IOException thrown = assertThrows(IOException.class, () -> new PartialUpdateEngine(failing, "")
                .apply(EntityKind.PROPERTY, List.of(1), List.of(FieldChange.of("is_archived", true))));

        assertSame(failure, thrown);
        assertTrue(thrown.getMessage().contains("timeout"));
    }

    private static Map<String, Object> prospect(int id, int propertyId) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("prospect_id", id);
        doc.put("property_id", propertyId);
        doc.put("tags", new ArrayList<>(List.of(5)));
        doc.put("tags_length", 1);
        doc.put("is_archived", false);
        return doc;
    }
}
