package com.stacker.api.controller;

import com.stacker.bulk.BulkActionOrchestrator;
import com.stacker.bulk.BulkActionRequest;
import com.stacker.bulk.IdResolutionOptions;
import com.stacker.model.StackerValidationException;
import com.stacker.schema.DocumentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class StackerBulkActionControllerTest {

    private static final String BASE = "/api/v1/stacker";

    @Mock
    private BulkActionOrchestrator orchestrator;

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new StackerBulkActionController(orchestrator))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void archiveReturnsNoContent() throws Exception {
        mvc.perform(json(patch(BASE + "/archive"),
                        "{\"type\":\"property\",\"id_list\":[1,2],\"archive\":true}"))
                .andExpect(status().isNoContent());

        ArgumentCaptor<BulkActionRequest> request = ArgumentCaptor.forClass(BulkActionRequest.class);
        verify(orchestrator).archive(eq(7), request.capture());
        assertEquals(List.of(1, 2), request.getValue().getIdList());
        assertEquals(Boolean.TRUE, request.getValue().getArchive());
    }

    @Test
    void propertyTagsAreAddedAndRemoved() throws Exception {
        mvc.perform(json(post(BASE + "/property/tag"), "{\"id_list\":[1],\"tags\":[8]}"))
                .andExpect(status().isNoContent());
        mvc.perform(json(delete(BASE + "/property/tag"), "{\"id_list\":[1],\"tags\":[8]}"))
                .andExpect(status().isNoContent());

        verify(orchestrator).tagProperties(eq(7), any(), eq(true));
        verify(orchestrator).tagProperties(eq(7), any(), eq(false));
    }

    @Test
    void prospectFlagsAreBound() throws Exception {
        mvc.perform(json(delete(BASE + "/prospect/tag"),
                        "{\"id_list\":[12],\"do_not_call\":true,\"opted_out\":false}"))
                .andExpect(status().isNoContent());

        ArgumentCaptor<BulkActionRequest> request = ArgumentCaptor.forClass(BulkActionRequest.class);
        verify(orchestrator).updateProspects(eq(7), request.capture(), eq(false));
        Map<String, Boolean> expected = new LinkedHashMap<>();
        expected.put("do_not_call", true);
        expected.put("opted_out", false);
        assertEquals(expected, request.getValue().flags());
    }

    @Test
    void previewReturnsTheSplit() throws Exception {
        Map<String, Long> preview = new LinkedHashMap<>();
        preview.put("new", 3L);
        preview.put("existing", 2L);
        when(orchestrator.previewPushToCampaign(eq(7), any())).thenReturn(preview);

        mvc.perform(json(post(BASE + "/push/preview"), "{\"type\":\"prospect\",\"search\":{\"filters\":{}}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.new").value(3))
                .andExpect(jsonPath("$.existing").value(2));
    }

    @Test
    void completedPushIsAccepted() throws Exception {
        mvc.perform(json(post(BASE + "/push/completed"), "{\"id_list\":[11,12]}"))
                .andExpect(status().isAccepted());

        verify(orchestrator).campaignPushCompleted(7, List.of(11, 12));
    }

    @Test
    void idsAreResolved() throws Exception {
        when(orchestrator.resolveIdList(eq(7), any(), eq(IdResolutionOptions.DEFAULT))).thenReturn(List.of(1, 3));

        mvc.perform(json(post(BASE + "/ids"), "{\"type\":\"property\",\"search\":{\"filters\":{}},\"exclude\":[2]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ids[0]").value(1))
                .andExpect(jsonPath("$.ids[1]").value(3));
    }

    @Test
    void skipTraceIdsAreAlwaysPropertyIds() throws Exception {
        when(orchestrator.resolveIdList(eq(7), any(), any())).thenReturn(List.of(2));

        mvc.perform(json(post(BASE + "/skiptrace/ids"), "{\"type\":\"prospect\",\"id_list\":[12]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ids[0]").value(2));

        ArgumentCaptor<IdResolutionOptions> options = ArgumentCaptor.forClass(IdResolutionOptions.class);
        verify(orchestrator).resolveIdList(eq(7), any(), options.capture());
        assertEquals(DocumentType.PROPERTY, options.getValue().getForcedType());
        assertEquals("property_id", options.getValue().getIdFieldName());
    }

    @Test
    void invalidTypeIsRejectedBeforeResolution() throws Exception {
        mvc.perform(json(post(BASE + "/ids"), "{\"type\":\"address\",\"id_list\":[1]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("must be property or prospect"));

        verifyNoInteractions(orchestrator);
    }

    @Test
    void groupMustBeAPair() throws Exception {
        mvc.perform(json(post(BASE + "/ids"), "{\"type\":\"property\",\"id_list\":[1],\"group\":[1]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.group").exists());
    }

    @Test
    void resolutionErrorsAreReported() throws Exception {
        when(orchestrator.archive(anyInt(), any()))
                .thenThrow(new StackerValidationException("Either search or id_list is required."));

        mvc.perform(json(patch(BASE + "/archive"), "{\"type\":\"property\",\"archive\":true}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Either search or id_list is required."));
    }

    @Test
    void malformedBodyIsRejected() throws Exception {
        mvc.perform(json(post(BASE + "/property/tag"), "{\"id_list\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value(startsWith("Malformed request")));

        verify(orchestrator, never()).tagProperties(anyInt(), any(), anyBoolean());
    }

    private static MockHttpServletRequestBuilder json(MockHttpServletRequestBuilder request, String body) {
        return request.header("X-Company-Id", "7").contentType(MediaType.APPLICATION_JSON).content(body);
    }
}
