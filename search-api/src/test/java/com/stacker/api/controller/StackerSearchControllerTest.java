package com.stacker.api.controller;

import com.stacker.model.StackerValidationException;
import com.stacker.search.SearchResult;
import com.stacker.search.StackerCounts;
import com.stacker.search.StackerSearchRequest;
import com.stacker.search.StackerSearchResponse;
import com.stacker.search.StackerSearchService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class StackerSearchControllerTest {

    private static final String SEARCH = "/api/v1/stacker/search";

    @Mock
    private StackerSearchService searchService;

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new StackerSearchController(searchService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void searchReturnsBothSidesAndCounts() throws Exception {
        StackerSearchResponse response = new StackerSearchResponse(
                new SearchResult(List.of(Map.of("prospect_id", 11)), 1, List.of(3, 11), null),
                new SearchResult(List.of(Map.of("property_id", 1)), 1, List.of(3, 1), null),
                new StackerCounts(40, 25));
        when(searchService.search(eq(4), any())).thenReturn(response);

        mvc.perform(post(SEARCH)
                        .header("X-Company-Id", "4")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"size\":10,\"filters\":{\"state\":[\"TX\"]},\"sort\":{\"field\":\"tags\"},"
                                + "\"search_after\":{\"properties\":[3,1]}}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.prospects.results[0].prospect_id").value(11))
                .andExpect(jsonPath("$.properties.total").value(1))
                .andExpect(jsonPath("$.properties.search_after[1]").value(1))
                .andExpect(jsonPath("$.counts.prospects").value(40));

        ArgumentCaptor<StackerSearchRequest> request = ArgumentCaptor.forClass(StackerSearchRequest.class);
        verify(searchService).search(eq(4), request.capture());
        assertEquals(10, request.getValue().getSize());
        assertEquals("tags", request.getValue().getSort().getField());
        assertEquals("desc", request.getValue().getSort().getOrder());
        assertEquals(Map.of("state", List.of("TX")), request.getValue().getFilters());
    }

    @Test
    void sortIsRequired() throws Exception {
        mvc.perform(post(SEARCH)
                        .header("X-Company-Id", "4")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"size\":10}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.sort").exists());

        verifyNoInteractions(searchService);
    }

    @Test
    void sizeIsBounded() throws Exception {
        mvc.perform(post(SEARCH)
                        .header("X-Company-Id", "4")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"size\":500,\"sort\":{\"field\":\"campaigns\",\"order\":\"asc\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$['size']").exists());
    }

    @Test
    void unknownSortFieldIsRejected() throws Exception {
        mvc.perform(post(SEARCH)
                        .header("X-Company-Id", "4")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sort\":{\"field\":\"zip_code\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$['sort.field']").exists());
    }

    @Test
    void companyHeaderIsRequired() throws Exception {
        mvc.perform(post(SEARCH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sort\":{\"field\":\"tags\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").exists());
    }

    @Test
    void filterErrorsAreReportedPerField() throws Exception {
        when(searchService.search(eq(4), any()))
                .thenThrow(new StackerValidationException("zip_code", "Ensure this field has no more than 5 characters."));

        mvc.perform(post(SEARCH)
                        .header("X-Company-Id", "4")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"filters\":{\"zip_code\":[\"750011\"]},\"sort\":{\"field\":\"tags\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.zip_code").value("Ensure this field has no more than 5 characters."));
    }

    @Test
    void backendFailureAsksClientsToRetry() throws Exception {
        when(searchService.search(eq(4), any())).thenThrow(new IOException("connection refused"));

        mvc.perform(post(SEARCH)
                        .header("X-Company-Id", "4")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sort\":{\"field\":\"tags\"}}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.detail").value("Search backend unavailable, please retry."));
    }
}
