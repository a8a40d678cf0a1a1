package com.stacker.bulk;

import com.stacker.schema.DocumentType;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Relational writes behind the bulk actions. Implementations only touch the relational store;
 * the orchestrator schedules the matching index updates.
 */
public interface StackerMutations {

    void setArchived(DocumentType type, int companyId, List<Integer> ids, boolean archived) throws IOException;

    void addPropertyTags(int companyId, List<Integer> propertyIds, List<Integer> tagIds) throws IOException;

    void removePropertyTags(int companyId, List<Integer> propertyIds, List<Integer> tagIds) throws IOException;

    /**
     * Sets prospect flags, keyed by column name ({@code do_not_call}, {@code is_priority}, ...).
     */
    void updateProspectFlags(int companyId, List<Integer> prospectIds, Map<String, Boolean> flags)
            throws IOException;

    /**
     * Distinct ids of the company's properties the given prospects belong to.
     */
    List<Integer> propertyIdsOfProspects(int companyId, List<Integer> prospectIds) throws IOException;
}
