package com.stacker.bulk;

import com.stacker.model.StackerValidationException;
import com.stacker.query.FilterNormalizer;
import com.stacker.query.QuerySpec;
import com.stacker.query.SearchQueryCompiler;
import com.stacker.schema.DocumentType;
import com.stacker.schema.EntityKind;
import com.stacker.search.StackerIndex;
import com.stacker.task.IndexTask;
import com.stacker.task.IndexTaskPublisher;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves bulk-action requests to concrete id lists and runs the actions.
 *
 * <h3>Id resolution</h3>
 * <ul>
 *   <li>{@code id_list}: kept in the given order, minus {@code exclude} and minus ids the
 *       company does not own; when the options add search constraints the ids are searched
 *       instead, restricted to that list</li>
 *   <li>{@code search}: compiled for the company and scanned in full</li>
 *   <li>{@code group [start, size]}: the resolved list is cut to {@code size} ids starting at
 *       {@code start}</li>
 * </ul>
 *
 * <h3>Index consistency</h3>
 * Every relational mutation made here is followed by an index task: a partial update for field
 * changes, a tag refresh for tag assignments and a full refresh after a campaign push. Tasks run
 * asynchronously, so the indexes are eventually consistent with the relational store.
 */
@Slf4j
public class BulkActionOrchestrator {

    static final String NEW_CAMPAIGN_PROSPECTS = "new_campaign_prospects";

    private final StackerIndex index;
    private final SearchQueryCompiler compiler;
    private final FilterNormalizer normalizer;
    private final StackerMutations mutations;
    private final IndexTaskPublisher publisher;

    public BulkActionOrchestrator(StackerIndex index, SearchQueryCompiler compiler, FilterNormalizer normalizer,
                                  StackerMutations mutations, IndexTaskPublisher publisher) {
        this.index = index;
        this.compiler = compiler;
        this.normalizer = normalizer;
        this.mutations = mutations;
        this.publisher = publisher;
    }

    // ── Id resolution ────────────────────────────────────────────────────

    public List<Integer> resolveIdList(int companyId, BulkActionRequest request, IdResolutionOptions options)
            throws IOException {
        DocumentType type = documentType(request, options);
        String idField = idField(type, options);

        List<Integer> ids;
        if (request.getIdList() != null && !options.addsConstraints()) {
            ids = ownedByCompany(companyId, type, withoutExcluded(request.getIdList(), request.getExclude()));
        } else {
            Map<String, Object> body = compiler.compile(querySpec(companyId, request, type, options, null));
            String source = options.getSource() != null ? options.getSource() : idField;
            ids = toIntegers(index.getIdList(index.indexName(type), body, source));
        }

        if (request.getGroup() != null) {
            ids = group(ids, request.getGroup());
        }
        log.info("Resolved {} {} id(s) for company {}", ids.size(), type, companyId);
        return ids;
    }

    // ── Actions ──────────────────────────────────────────────────────────

    /**
     * Archives or unarchives the resolved documents.
     */
    public List<Integer> archive(int companyId, BulkActionRequest request) throws IOException {
        if (request.getArchive() == null) {
            throw new StackerValidationException("archive", "This field is required.");
        }
        DocumentType type = DocumentType.fromName(request.getType());
        List<Integer> ids = resolveIdList(companyId, request, IdResolutionOptions.DEFAULT);
        if (ids.isEmpty()) {
            return ids;
        }

        mutations.setArchived(type, companyId, ids, request.getArchive());
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("is_archived", request.getArchive());
        publisher.publish(IndexTask.partialUpdate(type.getEntityKind(), ids, changes));
        return ids;
    }

    /**
     * Adds or removes tags on the resolved properties.
     */
    public List<Integer> tagProperties(int companyId, BulkActionRequest request, boolean adding) throws IOException {
        List<Integer> tags = requireTags(request);
        List<Integer> propertyIds = resolveIdList(companyId, request, IdResolutionOptions.builder()
                .forcedType(DocumentType.PROPERTY)
                .idFieldName(EntityKind.PROPERTY.getIdField())
                .build());
        applyPropertyTags(companyId, propertyIds, tags, adding);
        return propertyIds;
    }

    /**
     * Sets flags on the resolved prospects and adds or removes tags on their properties.
     */
    public List<Integer> updateProspects(int companyId, BulkActionRequest request, boolean adding)
            throws IOException {
        List<Integer> prospectIds = resolveIdList(companyId, request, IdResolutionOptions.builder()
                .forcedType(DocumentType.PROSPECT)
                .idFieldName(EntityKind.PROSPECT.getIdField())
                .build());
        if (prospectIds.isEmpty()) {
            return prospectIds;
        }

        if (request.getTags() != null && !request.getTags().isEmpty()) {
            List<Integer> propertyIds = mutations.propertyIdsOfProspects(companyId, prospectIds);
            applyPropertyTags(companyId, propertyIds, request.getTags(), adding);
        }

        Map<String, Boolean> flags = request.flags();
        if (!flags.isEmpty()) {
            mutations.updateProspectFlags(companyId, prospectIds, flags);
            publisher.publish(IndexTask.partialUpdate(EntityKind.PROSPECT, prospectIds, flags));
        }
        return prospectIds;
    }

    /**
     * Counts how many of the skip-traced prospects a push to campaign would add as new
     * ({@code campaigns == 0}) and how many are already in a campaign.
     */
    public Map<String, Long> previewPushToCampaign(int companyId, BulkActionRequest request) throws IOException {
        IdResolutionOptions options = IdResolutionOptions.builder()
                .forcedType(DocumentType.PROSPECT)
                .idFieldName(EntityKind.PROSPECT.getIdField())
                .forceSkipTraced(true)
                .source(EntityKind.PROSPECT.getIdField())
                .build();
        List<Integer> ids = resolveIdList(companyId, request, options);

        Map<String, Object> newProspects = new LinkedHashMap<>();
        newProspects.put("filter", Map.of("term", Map.of("campaigns", 0)));
        Map<String, Object> aggregates = new LinkedHashMap<>();
        aggregates.put(NEW_CAMPAIGN_PROSPECTS, newProspects);

        Map<String, Object> body = compiler.compile(
                querySpec(companyId, request, DocumentType.PROSPECT, options, aggregates));
        Map<String, Object> aggs = index.aggregate(index.indexName(DocumentType.PROSPECT), body);

        long newCount = docCount(aggs.get(NEW_CAMPAIGN_PROSPECTS));
        Map<String, Long> preview = new LinkedHashMap<>();
        preview.put("new", newCount);
        preview.put("existing", ids.size() - newCount);
        return preview;
    }

    /**
     * Schedules a full refresh of the pushed prospects and their properties: a push changes
     * campaign counts on both document types.
     */
    public void campaignPushCompleted(int companyId, List<Integer> pushedIds) throws IOException {
        if (pushedIds == null || pushedIds.isEmpty()) {
            return;
        }
        List<Integer> prospectIds = ownedByCompany(companyId, DocumentType.PROSPECT, pushedIds);
        if (prospectIds.isEmpty()) {
            return;
        }
        List<Integer> propertyIds = mutations.propertyIdsOfProspects(companyId, prospectIds);
        publisher.publish(IndexTask.refresh(propertyIds, prospectIds));
    }

    // ── Helpers ──────────────────────────────────────────────────────────

    /**
     * Keeps the ids, in the given order, whose documents belong to the company. Index tasks match
     * documents by id alone, so foreign ids must never reach them.
     */
    private List<Integer> ownedByCompany(int companyId, DocumentType type, List<Integer> ids) throws IOException {
        if (ids.isEmpty()) {
            return ids;
        }
        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put(type.getIdField(), new ArrayList<>(ids));
        Map<String, Object> body = compiler.compile(QuerySpec.builder()
                .companyId(companyId)
                .filters(filters)
                .idFieldName(type.getIdField())
                .source(type.getIdField())
                .build());
        Set<Integer> owned = new HashSet<>(toIntegers(index.getIdList(index.indexName(type), body, type.getIdField())));

        List<Integer> kept = new ArrayList<>();
        for (Integer id : ids) {
            if (owned.contains(id)) {
                kept.add(id);
            }
        }
        if (kept.size() < ids.size()) {
            log.warn("Dropped {} {} id(s) not owned by company {}", ids.size() - kept.size(), type, companyId);
        }
        return kept;
    }

    private void applyPropertyTags(int companyId, List<Integer> propertyIds, List<Integer> tags, boolean adding)
            throws IOException {
        if (propertyIds.isEmpty()) {
            return;
        }
        if (adding) {
            mutations.addPropertyTags(companyId, propertyIds, tags);
        } else {
            mutations.removePropertyTags(companyId, propertyIds, tags);
        }
        publisher.publish(IndexTask.tagRefresh(propertyIds));
    }

    private QuerySpec querySpec(int companyId, BulkActionRequest request, DocumentType type,
                                IdResolutionOptions options, Map<String, Object> aggregates) {
        BulkSearch search = request.getSearch();
        if (search == null && request.getIdList() == null) {
            throw new StackerValidationException("Either search or id_list is required.");
        }
        String idField = idField(type, options);

        Map<String, Object> filters = search == null ? null : normalizer.normalize(search.getFilters());
        if (filters == null) {
            filters = new LinkedHashMap<>();
        }
        if (options.isForceSkipTraced()) {
            filters.put("skip_traced", true);
        }
        if (request.getIdList() != null) {
            filters.put(idField, new ArrayList<>(request.getIdList()));
        }
        if (options.isNotInCampaign()) {
            filters.put("in_campaign", false);
        }

        Map<String, Object> queries = search == null || search.getQuery() == null
                ? null : new LinkedHashMap<>(search.getQuery());

        return QuerySpec.builder()
                .companyId(companyId)
                .queries(queries)
                .filters(filters)
                .idFieldName(idField)
                .exclude(request.getExclude())
                .source(options.getSource() != null ? options.getSource() : idField)
                .aggregates(aggregates)
                .build();
    }

    private static DocumentType documentType(BulkActionRequest request, IdResolutionOptions options) {
        if (request.getType() == null && options.getForcedType() != null) {
            return options.getForcedType();
        }
        return DocumentType.fromName(request.getType());
    }

    private static String idField(DocumentType type, IdResolutionOptions options) {
        return options.getIdFieldName() != null ? options.getIdFieldName() : type.getIdField();
    }

    private static List<Integer> requireTags(BulkActionRequest request) {
        if (request.getTags() == null || request.getTags().isEmpty()) {
            throw new StackerValidationException("tags", "At least one tag is required.");
        }
        return request.getTags();
    }

    private static List<Integer> withoutExcluded(List<Integer> ids, List<Integer> exclude) {
        Set<Integer> excluded = exclude == null ? Set.of() : new HashSet<>(exclude);
        List<Integer> kept = new ArrayList<>();
        for (Integer id : ids) {
            if (!excluded.contains(id)) {
                kept.add(id);
            }
        }
        return kept;
    }

    static List<Integer> group(List<Integer> ids, List<Integer> group) {
        int start = ids.indexOf(group.get(0));
        if (start < 0) {
            throw new StackerValidationException("group", "Could not locate ID.");
        }
        int end = (int) Math.min(ids.size(), (long) start + group.get(1));
        return new ArrayList<>(ids.subList(start, end));
    }

    private static List<Integer> toIntegers(List<Object> values) {
        List<Integer> ids = new ArrayList<>(values.size());
        for (Object value : values) {
            if (value instanceof Number) {
                ids.add(((Number) value).intValue());
            } else {
                ids.add(Integer.valueOf(value.toString()));
            }
        }
        return ids;
    }

    private static long docCount(Object aggregate) {
        if (aggregate instanceof Map) {
            Object count = ((Map<?, ?>) aggregate).get("doc_count");
            if (count instanceof Number) {
                return ((Number) count).longValue();
            }
        }
        return 0;
    }
}
