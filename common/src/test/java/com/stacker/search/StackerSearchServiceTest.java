package com.stacker.search;

import com.stacker.loader.BulkLoader;
import com.stacker.model.StackerValidationException;
import com.stacker.projector.ChunkHandler;
import com.stacker.projector.ProjectorQuery;
import com.stacker.projector.RowProjector;
import com.stacker.query.FilterNormalizer;
import com.stacker.query.SearchQueryCompiler;
import com.stacker.testing.InMemoryDocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StackerSearchServiceTest {

    private static final int COMPANY = 12;

    @Mock
    private RowProjector projector;

    private InMemoryDocumentStore store;
    private StackerSearchService service;

    @BeforeEach
    void setUp() throws IOException {
        store = new InMemoryDocumentStore();
        SearchQueryCompiler compiler = new SearchQueryCompiler();
        StackerIndex index = new StackerIndex(store, compiler, new CompanyCountCache(Duration.ofMinutes(15)), "", 500);
        index.create();
        service = new StackerSearchService(index, compiler, new FilterNormalizer());
    }

    @Test
    void populatedCompanyIsSearchable() throws IOException {
        Map<String, Object> property = document(100);
        property.put("prospect_id", List.of(201, 202));
        property.put("tags", List.of(9));
        property.put("tags_length", 1);
        property.put("distress_indicators", List.of());
        property.put("owner_status", List.of("verified"));
        stubProjection(ProjectorQuery.PROPERTIES_BY_COMPANY, List.of(property));
        stubProjection(ProjectorQuery.PROSPECTS_BY_COMPANY, List.of(prospect(201), prospect(202)));

        int indexed = new BulkLoader(projector, store, "", 1000).populate(List.of(COMPANY));
        StackerSearchResponse response = service.search(COMPANY, request(null, null));

        assertEquals(3, indexed);
        assertEquals(1, response.getProperties().getTotal());
        assertEquals(2, response.getProspects().getTotal());
        assertEquals(List.of(201, 202), response.getProperties().getResults().get(0).get("prospect_id"));
        assertEquals(new StackerCounts(2, 1), response.getCounts());
    }

    @Test
    void prospectsUseTheExternalOwnerStatusName() throws IOException {
        store.bulkIndex("stacker-prospect", "prospect_id", List.of(prospect(201)));
        store.bulkIndex("stacker-property", "property_id", List.of(document(100)));

        StackerSearchResponse response = service.search(COMPANY, request(null, null));

        Map<String, Object> hit = response.getProspects().getResults().get(0);
        assertEquals("open", hit.get("owner_verified_status"));
        assertFalse(hit.containsKey("owner_status"));
    }

    @Test
    void archivedRecordsAreHiddenUnlessRequested() throws IOException {
        Map<String, Object> archived = prospect(202);
        archived.put("is_archived", true);
        store.bulkIndex("stacker-prospect", "prospect_id", List.of(prospect(201), archived));

        assertEquals(1, service.search(COMPANY, request(null, Map.of())).getProspects().getTotal());
        assertEquals(1, service.search(COMPANY, request(null, Map.of("is_archived", true))).getProspects().getTotal());
        assertEquals(2, service.search(COMPANY, request(null, Map.of())).getCounts().getProspects());
    }

    @Test
    void nameQueryMatchesTokens() throws IOException {
        Map<String, Object> jane = prospect(201);
        jane.put("name", "Jane Doe");
        Map<String, Object> john = prospect(202);
        john.put("name", "John Roe");
        store.bulkIndex("stacker-prospect", "prospect_id", List.of(jane, john));

        StackerSearchResponse response = service.search(COMPANY, request(Map.of("name", "jane"), null));

        assertEquals(1, response.getProspects().getTotal());
        assertEquals(201, response.getProspects().getResults().get(0).get("prospect_id"));
    }

    @Test
    void invalidFiltersAreReported() {
        StackerValidationException e = assertThrows(StackerValidationException.class,
                () -> service.search(COMPANY, request(null, Map.of("zip_code", 75001))));

        assertTrue(e.getFieldErrors().containsKey("filters.zip_code"));
    }

    private void stubProjection(ProjectorQuery query, List<Map<String, Object>> documents) throws IOException {
        when(projector.stream(eq(query), any(), anyInt(), any())).thenAnswer(invocation -> {
            ChunkHandler handler = invocation.getArgument(3);
            handler.accept(documents);
            return documents.size();
        });
    }

    private static StackerSearchRequest request(Map<String, String> query, Map<String, Object> filters) {
        return StackerSearchRequest.builder()
                .size(10)
                .query(query)
                .filters(filters)
                .sort(SortSpec.of("created_date", "desc"))
                .build();
    }

    private static Map<String, Object> document(int propertyId) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("company_id", COMPANY);
        doc.put("property_id", propertyId);
        doc.put("is_archived", false);
        doc.put("created_date", "2021-03-01");
        return doc;
    }

    private static Map<String, Object> prospect(int prospectId) {
        Map<String, Object> doc = document(100);
        doc.put("prospect_id", prospectId);
        doc.put("owner_status", "open");
        return doc;
    }
}
