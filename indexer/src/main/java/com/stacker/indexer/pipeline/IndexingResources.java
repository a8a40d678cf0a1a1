package com.stacker.indexer.pipeline;

import com.stacker.config.StackerConfig;
import com.stacker.elasticsearch.ElasticsearchService;
import com.stacker.loader.BulkLoader;
import com.stacker.projector.PropertyTagReader;
import com.stacker.projector.RowProjector;
import com.stacker.task.IndexTaskExecutor;
import com.stacker.update.PartialUpdateEngine;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;

/**
 * Connections held by one task-manager operator instance: the Elasticsearch client, the
 * relational connection pool and the executor built on them.
 */
@Slf4j
public class IndexingResources implements Closeable {

    private final ElasticsearchService elasticsearch;
    private final HikariDataSource dataSource;
    private final IndexTaskExecutor executor;

    private IndexingResources(ElasticsearchService elasticsearch, HikariDataSource dataSource,
                              IndexTaskExecutor executor) {
        this.elasticsearch = elasticsearch;
        this.dataSource = dataSource;
        this.executor = executor;
    }

    public static IndexingResources open(StackerConfig config) {
        ElasticsearchService elasticsearch = new ElasticsearchService(config.getElasticsearch());
        HikariDataSource dataSource = config.getDatabase().createDataSource();
        String prefix = config.getIndexPrefix();

        BulkLoader loader = new BulkLoader(new RowProjector(dataSource), elasticsearch, prefix,
                config.getLoader().getChunkSize());
        PartialUpdateEngine updateEngine = new PartialUpdateEngine(elasticsearch, prefix);
        IndexTaskExecutor executor = new IndexTaskExecutor(loader, updateEngine, new PropertyTagReader(dataSource));

        log.info("Opened indexing resources (index prefix '{}')", prefix);
        return new IndexingResources(elasticsearch, dataSource, executor);
    }

    public IndexTaskExecutor getExecutor() {
        return executor;
    }

    @Override
    public void close() throws IOException {
        try {
            elasticsearch.close();
        } finally {
            dataSource.close();
        }
    }
}
