package com.stacker.projector;

import com.stacker.schema.DocumentType;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * The four projections: property- or prospect-centred documents, selected either by company
 * (full population) or by entity id (targeted refresh).
 *
 * <p>Each projection is the shared document SQL of its axis with a scope predicate taking a
 * single {@code integer[]} parameter.</p>
 */
public enum ProjectorQuery {

    PROPERTIES_BY_COMPANY(DocumentType.PROPERTY, "prop.company_id = ANY(?)"),
    PROSPECTS_BY_COMPANY(DocumentType.PROSPECT, "pros.company_id = ANY(?)"),
    PROPERTIES_BY_ID(DocumentType.PROPERTY, "prop.id = ANY(?)"),
    PROSPECTS_BY_ID(DocumentType.PROSPECT, "pros.id = ANY(?)");

    static final String SCOPE_PLACEHOLDER = "${scope}";

    private final DocumentType documentType;
    private final String scope;
    private volatile String sql;

    ProjectorQuery(DocumentType documentType, String scope) {
        this.documentType = documentType;
        this.scope = scope;
    }

    public DocumentType getDocumentType() {
        return documentType;
    }

    public String getSql() {
        String resolved = sql;
        if (resolved == null) {
            resolved = template(documentType).replace(SCOPE_PLACEHOLDER, scope);
            sql = resolved;
        }
        return resolved;
    }

    static String templateResource(DocumentType documentType) {
        return documentType == DocumentType.PROPERTY
                ? "stacker/sql/property_documents.sql"
                : "stacker/sql/prospect_documents.sql";
    }

    static String template(DocumentType documentType) {
        return readResource(templateResource(documentType));
    }

    static String readResource(String resource) {
        try (InputStream is = ProjectorQuery.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException("Resource not found on classpath: " + resource);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read SQL resource " + resource, e);
        }
    }
}
