package com.stacker.schema;

import com.stacker.model.StackerValidationException;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * The two document shapes stored in the Stacker indexes.
 *
 * <p>Both share one mapping; they differ in which entity a document is centred on, which id
 * is the document id, and which fields are arrays (a property aggregates every prospect on
 * it, a prospect carries scalars).</p>
 */
public enum DocumentType {

    PROPERTY("stacker-property", EntityKind.PROPERTY, "properties", "owner_status"),
    PROSPECT("stacker-prospect", EntityKind.PROSPECT, "prospects", "owner_verified_status");

    private static final String OWNER_STATUS = "owner_status";

    private final String baseIndexName;
    private final EntityKind entityKind;
    private final String responseKey;
    private final String externalOwnerStatusField;

    DocumentType(String baseIndexName, EntityKind entityKind, String responseKey,
                 String externalOwnerStatusField) {
        this.baseIndexName = baseIndexName;
        this.entityKind = entityKind;
        this.responseKey = responseKey;
        this.externalOwnerStatusField = externalOwnerStatusField;
    }

    public String indexName(String prefix) {
        return (prefix == null ? "" : prefix) + baseIndexName;
    }

    public EntityKind getEntityKind() {
        return entityKind;
    }

    /** Field holding this document's own id, also used as the Elasticsearch {@code _id}. */
    public String getIdField() {
        return entityKind.getIdField();
    }

    /** Key under which this type's results and cursor travel in search requests and responses. */
    public String getResponseKey() {
        return responseKey;
    }

    /**
     * Renames {@code owner_status} to the name clients know it by. Returns a new map.
     */
    public Map<String, Object> toExternal(Map<String, Object> source) {
        Map<String, Object> external = new LinkedHashMap<>();
        source.forEach((key, value) -> external.put(
                OWNER_STATUS.equals(key) ? externalOwnerStatusField : key, value));
        return external;
    }

    /**
     * Parses the {@code type} value of bulk-action requests ({@code property} / {@code prospect}).
     */
    public static DocumentType fromName(String name) {
        if (name == null) {
            throw new StackerValidationException("type", "This field is required.");
        }
        try {
            return valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new StackerValidationException("type", "\"" + name + "\" is not a valid choice.");
        }
    }
}
