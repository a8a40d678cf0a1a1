package com.stacker.indexer.pipeline;

import com.stacker.config.StackerConfig;
import com.stacker.task.IndexTask;
import com.stacker.task.IndexTaskExecutor;
import com.stacker.task.IndexTaskResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.flink.api.common.functions.OpenContext;
import org.apache.flink.streaming.api.functions.ProcessFunction;
import org.apache.flink.util.Collector;

/**
 * Executes each index task and emits its result.
 *
 * <p>Task failures are turned into failed results by {@link IndexTaskExecutor}, so a bad task
 * is reported on the result topic and never restarts the job. Document-store calls block the
 * operator until they return; parallelism comes from running several operator instances.</p>
 */
@Slf4j
public class IndexTaskFunction extends ProcessFunction<IndexTask, IndexTaskResult> {

    private static final long serialVersionUID = 1L;

    private final StackerConfig config;

    private transient IndexingResources resources;
    private transient IndexTaskExecutor executor;

    public IndexTaskFunction(StackerConfig config) {
        this.config = config;
    }

    IndexTaskFunction(IndexTaskExecutor executor) {
        this.config = null;
        this.executor = executor;
    }

    @Override
    public void open(OpenContext openContext) throws Exception {
        super.open(openContext);
        if (executor == null) {
            resources = IndexingResources.open(config);
            executor = resources.getExecutor();
        }
    }

    @Override
    public void processElement(IndexTask task, Context ctx, Collector<IndexTaskResult> out) {
        log.debug("Executing {} task {}", task.getType(), task.getTaskId());
        out.collect(executor.execute(task));
    }

    @Override
    public void close() throws Exception {
        if (resources != null) {
            resources.close();
        }
        super.close();
    }
}
