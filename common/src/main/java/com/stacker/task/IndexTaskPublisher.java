package com.stacker.task;

/**
 * Hands index tasks to the background workers. Publishing does not wait for execution.
 */
public interface IndexTaskPublisher {

    void publish(IndexTask task);
}
