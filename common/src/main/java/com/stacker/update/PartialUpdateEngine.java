package com.stacker.update;

import com.stacker.elasticsearch.DocumentStore;
import com.stacker.model.PropertyTags;
import com.stacker.query.QueryClauses;
import com.stacker.schema.DocumentType;
import com.stacker.schema.EntityKind;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies relational field changes to already indexed documents in place.
 *
 * <p>Every update runs against both indexes: property and prospect documents carry each other's
 * denormalised fields, so a change to either side has to reach both. Updates use
 * {@code conflicts=proceed} and {@code refresh=true}.</p>
 */
@Slf4j
public class PartialUpdateEngine {

    private final DocumentStore store;
    private final String indexPrefix;

    public PartialUpdateEngine(DocumentStore store, String indexPrefix) {
        this.store = store;
        this.indexPrefix = indexPrefix;
    }

    /**
     * Builds {@code {query: {bool: {must: [term|terms {<kind>_id: ids}]}}, script: {source, lang}}}.
     * A single id yields a {@code term} clause, several a {@code terms} clause.
     */
    public static Map<String, Object> buildUpdateForQueryBody(EntityKind kind, Collection<Integer> ids,
                                                             String scriptSource) {
        Object idValue = ids.size() == 1 ? ids.iterator().next() : new ArrayList<>(ids);

        List<Object> must = new ArrayList<>();
        must.add(QueryClauses.termOrTerms(kind.getIdField(), idValue));
        Map<String, Object> bool = new LinkedHashMap<>();
        bool.put("must", must);
        Map<String, Object> query = new LinkedHashMap<>();
        query.put("bool", bool);

        Map<String, Object> script = new LinkedHashMap<>();
        script.put("source", scriptSource);
        script.put("lang", PainlessScriptBuilder.LANG);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", query);
        body.put("script", script);
        return body;
    }

    /**
     * Sets the changed fields on every document referring to the given entities.
     *
     * @return number of documents updated across both indexes
     */
    public long apply(EntityKind kind, Collection<Integer> ids, List<FieldChange> changes) throws IOException {
        if (ids == null || ids.isEmpty() || changes == null || changes.isEmpty()) {
            return 0;
        }
        Map<String, Object> body = buildUpdateForQueryBody(kind, ids, PainlessScriptBuilder.build(changes));

        long updated = 0;
        for (DocumentType type : DocumentType.values()) {
            String index = type.indexName(indexPrefix);
            try {
                updated += store.updateByQuery(index, body);
            } catch (IOException e) {
                log.error("Update of {} {} id(s) in {} failed: {}", ids.size(), kind, index, e.getMessage());
                throw e;
            }
        }
        log.info("Updated {} document(s) for {} {} id(s), fields {}", updated, ids.size(), kind,
                changes.stream().map(FieldChange::getField).toList());
        return updated;
    }

    /**
     * Writes a property's tag assignment: {@code tags}, {@code tags_length} and
     * {@code distress_indicators} always change together.
     */
    public long updatePropertyTags(PropertyTags propertyTags) throws IOException {
        List<Integer> tagIds = propertyTags.getTagIds() == null ? List.of() : propertyTags.getTagIds();
        List<FieldChange> changes = List.of(
                FieldChange.of("tags", new ArrayList<>(tagIds)),
                FieldChange.of("tags_length", tagIds.size()),
                FieldChange.of("distress_indicators", propertyTags.getDistressCount()));
        return apply(EntityKind.PROPERTY, List.of(propertyTags.getPropertyId()), changes);
    }
}
