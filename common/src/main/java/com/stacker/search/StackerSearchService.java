package com.stacker.search;

import com.stacker.query.FilterNormalizer;
import com.stacker.query.QuerySpec;
import com.stacker.query.SearchQueryCompiler;
import com.stacker.schema.DocumentType;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serves Stacker searches: normalises the request, compiles it for the company and runs it over
 * both indexes.
 *
 * <p>Prospect hits are returned in their external shape ({@code owner_status} reported as
 * {@code owner_verified_status}), and the response carries the company's unfiltered counts.</p>
 */
@Slf4j
public class StackerSearchService {

    private final StackerIndex index;
    private final SearchQueryCompiler compiler;
    private final FilterNormalizer normalizer;

    public StackerSearchService(StackerIndex index, SearchQueryCompiler compiler, FilterNormalizer normalizer) {
        this.index = index;
        this.compiler = compiler;
        this.normalizer = normalizer;
    }

    public StackerSearchResponse search(int companyId, StackerSearchRequest request) throws IOException {
        Map<String, Object> queries = request.getQuery() == null ? null : new LinkedHashMap<>(request.getQuery());
        Map<String, Object> body = compiler.compile(QuerySpec.builder()
                .companyId(companyId)
                .queries(queries)
                .filters(normalizer.normalize(request.getFilters()))
                .build());

        StackerSearchResponse response = index.searchIndexes(body, request.getSize(), request.getSort(),
                request.getSearchAfter());
        response.setProspects(toExternal(DocumentType.PROSPECT, response.getProspects()));
        response.setCounts(index.totalCountsByCompany(companyId));

        log.info("Company {} search: {} prospect(s), {} propert(ies)", companyId,
                response.getProspects().getTotal(), response.getProperties().getTotal());
        return response;
    }

    private static SearchResult toExternal(DocumentType type, SearchResult result) {
        List<Map<String, Object>> results = new ArrayList<>();
        for (Map<String, Object> document : result.getResults()) {
            results.add(type.toExternal(document));
        }
        result.setResults(results);
        return result;
    }
}
