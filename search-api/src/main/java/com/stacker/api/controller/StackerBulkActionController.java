package com.stacker.api.controller;

import com.stacker.bulk.BulkActionOrchestrator;
import com.stacker.bulk.BulkActionRequest;
import com.stacker.bulk.IdResolutionOptions;
import com.stacker.schema.DocumentType;
import com.stacker.schema.EntityKind;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static com.stacker.api.controller.StackerSearchController.COMPANY_HEADER;

/**
 * Bulk actions over search matches or explicit id lists.
 *
 * <p>Each endpoint resolves its request to ids, performs the relational change and schedules the
 * index update. Export, skip trace and campaign push hand-offs only need the resolved ids, which
 * the {@code ids} endpoints return.</p>
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/stacker")
public class StackerBulkActionController {

    private final BulkActionOrchestrator orchestrator;

    public StackerBulkActionController(BulkActionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PatchMapping("/archive")
    public ResponseEntity<Void> archive(@RequestHeader(COMPANY_HEADER) int companyId,
                                        @Valid @RequestBody BulkActionRequest request) throws IOException {
        orchestrator.archive(companyId, request);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/property/tag")
    public ResponseEntity<Void> addPropertyTags(@RequestHeader(COMPANY_HEADER) int companyId,
                                                @Valid @RequestBody BulkActionRequest request) throws IOException {
        orchestrator.tagProperties(companyId, request, true);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/property/tag")
    public ResponseEntity<Void> removePropertyTags(@RequestHeader(COMPANY_HEADER) int companyId,
                                                   @Valid @RequestBody BulkActionRequest request) throws IOException {
        orchestrator.tagProperties(companyId, request, false);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/prospect/tag")
    public ResponseEntity<Void> addProspectTags(@RequestHeader(COMPANY_HEADER) int companyId,
                                                @Valid @RequestBody BulkActionRequest request) throws IOException {
        orchestrator.updateProspects(companyId, request, true);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/prospect/tag")
    public ResponseEntity<Void> removeProspectTags(@RequestHeader(COMPANY_HEADER) int companyId,
                                                   @Valid @RequestBody BulkActionRequest request) throws IOException {
        orchestrator.updateProspects(companyId, request, false);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/push/preview")
    public ResponseEntity<Map<String, Long>> previewPush(@RequestHeader(COMPANY_HEADER) int companyId,
                                                         @Valid @RequestBody BulkActionRequest request)
            throws IOException {
        return ResponseEntity.ok(orchestrator.previewPushToCampaign(companyId, request));
    }

    @PostMapping("/push/completed")
    public ResponseEntity<Void> pushCompleted(@RequestHeader(COMPANY_HEADER) int companyId,
                                              @Valid @RequestBody BulkActionRequest request) throws IOException {
        log.info("Campaign push completed for company {}", companyId);
        orchestrator.campaignPushCompleted(companyId, request.getIdList());
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/ids")
    public ResponseEntity<Map<String, List<Integer>>> resolveIds(@RequestHeader(COMPANY_HEADER) int companyId,
                                                                 @Valid @RequestBody BulkActionRequest request)
            throws IOException {
        return ResponseEntity.ok(Map.of("ids",
                orchestrator.resolveIdList(companyId, request, IdResolutionOptions.DEFAULT)));
    }

    @PostMapping("/skiptrace/ids")
    public ResponseEntity<Map<String, List<Integer>>> resolveSkipTraceIds(
            @RequestHeader(COMPANY_HEADER) int companyId,
            @Valid @RequestBody BulkActionRequest request) throws IOException {
        IdResolutionOptions options = IdResolutionOptions.builder()
                .forcedType(DocumentType.PROPERTY)
                .idFieldName(EntityKind.PROPERTY.getIdField())
                .build();
        return ResponseEntity.ok(Map.of("ids", orchestrator.resolveIdList(companyId, request, options)));
    }
}
