package com.stacker.api.controller;

import com.stacker.search.StackerSearchRequest;
import com.stacker.search.StackerSearchResponse;
import com.stacker.search.StackerSearchService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;

/**
 * Faceted search over the company's properties and prospects.
 */
@RestController
@RequestMapping("/api/v1/stacker")
public class StackerSearchController {

    static final String COMPANY_HEADER = "X-Company-Id";

    private final StackerSearchService searchService;

    public StackerSearchController(StackerSearchService searchService) {
        this.searchService = searchService;
    }

    @PostMapping("/search")
    public ResponseEntity<StackerSearchResponse> search(@RequestHeader(COMPANY_HEADER) int companyId,
                                                        @Valid @RequestBody StackerSearchRequest request)
            throws IOException {
        return ResponseEntity.status(HttpStatus.CREATED).body(searchService.search(companyId, request));
    }
}
