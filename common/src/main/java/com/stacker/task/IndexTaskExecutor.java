package com.stacker.task;

import com.stacker.loader.BulkLoader;
import com.stacker.model.PropertyTags;
import com.stacker.model.StackerValidationException;
import com.stacker.projector.PropertyTagReader;
import com.stacker.update.FieldChange;
import com.stacker.update.PartialUpdateEngine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Executes index tasks against the loader and the partial-update engine.
 *
 * <p>A failing task never propagates: the error is logged and returned as a failed
 * {@link IndexTaskResult}, so one bad task cannot stop the worker.</p>
 */
@Slf4j
public class IndexTaskExecutor {

    private final BulkLoader loader;
    private final PartialUpdateEngine updateEngine;
    private final PropertyTagReader tagReader;

    public IndexTaskExecutor(BulkLoader loader, PartialUpdateEngine updateEngine, PropertyTagReader tagReader) {
        this.loader = loader;
        this.updateEngine = updateEngine;
        this.tagReader = tagReader;
    }

    public IndexTaskResult execute(IndexTask task) {
        long start = System.currentTimeMillis();
        try {
            long documents = dispatch(task);
            long duration = System.currentTimeMillis() - start;
            log.info("{} task {} wrote {} document(s) in {} ms", task.getType(), task.getTaskId(),
                    documents, duration);
            return IndexTaskResult.success(task, documents, duration);
        } catch (Exception e) {
            long duration = System.currentTimeMillis() - start;
            log.error("{} task {} failed: {}", task.getType(), task.getTaskId(), e.getMessage(), e);
            return IndexTaskResult.failure(task, e.getMessage(), duration);
        }
    }

    private long dispatch(IndexTask task) throws IOException {
        if (task.getType() == null) {
            throw new StackerValidationException("type", "Index task type is required.");
        }
        switch (task.getType()) {
            case POPULATE:
                return loader.populate(required(task.getCompanyIds(), "companyIds"));
            case REFRESH:
                return loader.refresh(task.getPropertyIds(), task.getProspectIds());
            case PARTIAL_UPDATE:
                return updateEngine.apply(task.getEntityKind(), required(task.getIds(), "ids"),
                        toChanges(task));
            case PROPERTY_TAGS:
                if (task.getPropertyTags() == null) {
                    throw new StackerValidationException("propertyTags", "This field is required.");
                }
                return updateEngine.updatePropertyTags(task.getPropertyTags());
            case TAG_REFRESH:
                return refreshTags(required(task.getPropertyIds(), "propertyIds"));
            default:
                throw new StackerValidationException("type", "Unsupported index task type " + task.getType());
        }
    }

    private long refreshTags(List<Integer> propertyIds) throws IOException {
        long documents = 0;
        for (PropertyTags tags : tagReader.read(propertyIds)) {
            documents += updateEngine.updatePropertyTags(tags);
        }
        return documents;
    }

    private static List<FieldChange> toChanges(IndexTask task) {
        if (task.getEntityKind() == null) {
            throw new StackerValidationException("entityKind", "This field is required.");
        }
        List<FieldChange> changes = new ArrayList<>();
        if (task.getChanges() != null) {
            task.getChanges().forEach((field, value) -> changes.add(FieldChange.of(field, value)));
        }
        return changes;
    }

    private static <T> List<T> required(List<T> values, String field) {
        if (values == null) {
            throw new StackerValidationException(field, "This field is required.");
        }
        return values;
    }
}
