package com.stacker.schema;

/**
 * Relational entities whose changes are pushed into Stacker documents by partial update.
 * Each is matched in both indexes through its id field.
 */
public enum EntityKind {

    ADDRESS("address_id"),
    PROPERTY("property_id"),
    PROSPECT("prospect_id");

    private final String idField;

    EntityKind(String idField) {
        this.idField = idField;
    }

    public String getIdField() {
        return idField;
    }
}
