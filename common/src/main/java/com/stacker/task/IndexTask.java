package com.stacker.task;

import com.stacker.model.PropertyTags;
import com.stacker.schema.EntityKind;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A unit of index maintenance published to the task topic.
 *
 * <p>Which fields are set depends on {@link #getType()}:</p>
 * <ul>
 *   <li>{@code POPULATE}: {@code companyIds}</li>
 *   <li>{@code REFRESH}: {@code propertyIds} and/or {@code prospectIds}</li>
 *   <li>{@code PARTIAL_UPDATE}: {@code entityKind}, {@code ids} and {@code changes}</li>
 *   <li>{@code PROPERTY_TAGS}: {@code propertyTags}</li>
 *   <li>{@code TAG_REFRESH}: {@code propertyIds}</li>
 * </ul>
 */
@Data
@NoArgsConstructor
public class IndexTask implements Serializable {

    private static final long serialVersionUID = 1L;

    private String taskId;
    private IndexTaskType type;
    private List<Integer> companyIds;
    private List<Integer> propertyIds;
    private List<Integer> prospectIds;
    private EntityKind entityKind;
    private List<Integer> ids;
    private Map<String, Object> changes;
    private PropertyTags propertyTags;
    private long createdAt;

    private static IndexTask of(IndexTaskType type) {
        IndexTask task = new IndexTask();
        task.taskId = UUID.randomUUID().toString();
        task.type = type;
        task.createdAt = System.currentTimeMillis();
        return task;
    }

    public static IndexTask populate(Collection<Integer> companyIds) {
        IndexTask task = of(IndexTaskType.POPULATE);
        task.companyIds = new ArrayList<>(companyIds);
        return task;
    }

    public static IndexTask refresh(Collection<Integer> propertyIds, Collection<Integer> prospectIds) {
        IndexTask task = of(IndexTaskType.REFRESH);
        task.propertyIds = propertyIds == null ? new ArrayList<>() : new ArrayList<>(propertyIds);
        task.prospectIds = prospectIds == null ? new ArrayList<>() : new ArrayList<>(prospectIds);
        return task;
    }

    public static IndexTask partialUpdate(EntityKind kind, Collection<Integer> ids, Map<String, ?> changes) {
        IndexTask task = of(IndexTaskType.PARTIAL_UPDATE);
        task.entityKind = kind;
        task.ids = new ArrayList<>(ids);
        task.changes = new LinkedHashMap<>(changes);
        return task;
    }

    public static IndexTask propertyTags(PropertyTags propertyTags) {
        IndexTask task = of(IndexTaskType.PROPERTY_TAGS);
        task.propertyTags = propertyTags;
        return task;
    }

    public static IndexTask tagRefresh(Collection<Integer> propertyIds) {
        IndexTask task = of(IndexTaskType.TAG_REFRESH);
        task.propertyIds = new ArrayList<>(propertyIds);
        return task;
    }
}
