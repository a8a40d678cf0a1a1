package com.stacker.loader;

import com.stacker.elasticsearch.DocumentStore;
import com.stacker.projector.ProjectorQuery;
import com.stacker.projector.RowProjector;
import com.stacker.schema.DocumentType;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Collection;

/**
 * Writes projected documents into the Stacker indexes.
 *
 * <p>Every document is indexed under its own id with create-or-replace semantics, so running a
 * population or refresh twice leaves the indexes unchanged. A refresh recomputes whole documents
 * from the relational store and is therefore always correct, at a higher cost than a partial
 * update.</p>
 */
@Slf4j
public class BulkLoader {

    private final RowProjector projector;
    private final DocumentStore store;
    private final String indexPrefix;
    private final int chunkSize;

    public BulkLoader(RowProjector projector, DocumentStore store, String indexPrefix, int chunkSize) {
        this.projector = projector;
        this.store = store;
        this.indexPrefix = indexPrefix;
        this.chunkSize = chunkSize;
    }

    /**
     * Indexes every property document, then every prospect document, of the given companies.
     *
     * @return number of documents indexed
     */
    public int populate(Collection<Integer> companyIds) throws IOException {
        log.info("Populating Stacker indexes for {} compan(ies)", companyIds.size());
        int properties = load(ProjectorQuery.PROPERTIES_BY_COMPANY, companyIds);
        int prospects = load(ProjectorQuery.PROSPECTS_BY_COMPANY, companyIds);
        log.info("Populated {} property and {} prospect document(s) for companies {}",
                properties, prospects, companyIds);
        return properties + prospects;
    }

    /**
     * Re-projects and re-indexes the given properties and prospects. Empty collections are skipped.
     *
     * @return number of documents indexed
     */
    public int refresh(Collection<Integer> propertyIds, Collection<Integer> prospectIds) throws IOException {
        int properties = load(ProjectorQuery.PROPERTIES_BY_ID, propertyIds);
        int prospects = load(ProjectorQuery.PROSPECTS_BY_ID, prospectIds);
        log.info("Refreshed {} property and {} prospect document(s)", properties, prospects);
        return properties + prospects;
    }

    private int load(ProjectorQuery query, Collection<Integer> ids) throws IOException {
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        DocumentType type = query.getDocumentType();
        String index = type.indexName(indexPrefix);
        return projector.stream(query, ids, chunkSize,
                documents -> store.bulkIndex(index, type.getIdField(), documents));
    }
}
