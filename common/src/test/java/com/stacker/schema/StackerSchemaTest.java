package com.stacker.schema;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StackerSchemaTest {

    @Test
    void fieldsFollowTheMappingOrder() {
        List<String> fields = StackerSchema.fields();

        assertEquals(41, fields.size());
        assertEquals(List.of("company_id", "prospect_id", "property_id", "address_id"), fields.subList(0, 4));
        assertEquals("last_import_date", fields.get(fields.size() - 1));
        assertThrows(UnsupportedOperationException.class, () -> fields.add("x"));
    }

    @Test
    void knowsItsFields() {
        assertTrue(StackerSchema.hasField("tags_length"));
        assertTrue(StackerSchema.hasField("prospect_status"));
        assertFalse(StackerSchema.hasField("prospect_status.title"));
        assertFalse(StackerSchema.hasField("owner_verified_status"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void analysisWordListsAreInlined() {
        Map<String, Object> definition = StackerSchema.indexDefinition();

        Map<String, Object> analysis = (Map<String, Object>) ((Map<String, Object>) definition.get("settings")).get("analysis");
        Map<String, Object> filters = (Map<String, Object>) analysis.get("filter");
        List<String> synonyms = (List<String>) ((Map<String, Object>) filters.get("street_synonyms")).get("synonyms");
        List<String> stopWords = (List<String>) ((Map<String, Object>) filters.get("street_search_filter")).get("stopwords");

        assertTrue(synonyms.contains("avenue, ave, av"));
        assertTrue(stopWords.contains("apt"));
        assertTrue(stopWords.stream().noneMatch(word -> word.startsWith("#")));
    }

    @Test
    void definitionIsAFreshCopy() {
        Map<String, Object> first = StackerSchema.indexDefinition();
        first.remove("mappings");

        Map<String, Object> second = StackerSchema.indexDefinition();

        assertNotSame(first, second);
        assertTrue(second.containsKey("mappings"));
    }

    @Test
    void ownerStatusIsRenamedOnlyForProspects() {
        Map<String, Object> source = Map.of("owner_status", "open", "property_id", 1);

        assertEquals(Map.of("owner_verified_status", "open", "property_id", 1), DocumentType.PROSPECT.toExternal(source));
        assertEquals(source, DocumentType.PROPERTY.toExternal(source));
    }

    @Test
    void documentTypesCarryTheirIdField() {
        assertEquals("property_id", DocumentType.PROPERTY.getIdField());
        assertEquals("prospect_id", DocumentType.PROSPECT.getIdField());
        assertEquals("dev-stacker-prospect", DocumentType.PROSPECT.indexName("dev-"));
        assertEquals(DocumentType.PROSPECT, DocumentType.fromName("prospect"));
    }
}
