package com.stacker.task;

/**
 * Kinds of background index maintenance.
 */
public enum IndexTaskType {
    /** Index every document of the given companies. */
    POPULATE,
    /** Re-project the given properties and prospects from the relational store. */
    REFRESH,
    /** Set changed fields on documents referring to the given entities. */
    PARTIAL_UPDATE,
    /** Write a property's tag assignment as carried by the task. */
    PROPERTY_TAGS,
    /** Read the current tag assignment of the given properties and write it. */
    TAG_REFRESH
}
