package com.stacker.indexer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stacker.config.StackerConfig;
import com.stacker.elasticsearch.ElasticsearchService;
import com.stacker.projector.CompanyDirectory;
import com.stacker.query.SearchQueryCompiler;
import com.stacker.search.CompanyCountCache;
import com.stacker.search.StackerIndex;
import com.stacker.task.IndexTask;
import com.stacker.task.IndexTaskPublisher;
import com.stacker.task.KafkaIndexTaskPublisher;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Command line administration of the Stacker indexes.
 *
 * <pre>
 *   IndexAdmin create
 *   IndexAdmin delete
 *   IndexAdmin populate [company-id ...]
 * </pre>
 *
 * {@code populate} without ids populates every company with an active subscription. Population
 * is published as a task and executed by the indexer job. The configuration is read from the
 * file named by the {@code stacker.config} system property, or from {@code indexer-config.yaml}.
 */
@Slf4j
public class IndexAdmin {

    private final StackerIndex index;
    private final CompanyDirectory companyDirectory;
    private final IndexTaskPublisher publisher;

    public IndexAdmin(StackerIndex index, CompanyDirectory companyDirectory, IndexTaskPublisher publisher) {
        this.index = index;
        this.companyDirectory = companyDirectory;
        this.publisher = publisher;
    }

    public static void main(String[] args) throws Exception {
        String path = System.getProperty("stacker.config");
        StackerConfig config = path != null
                ? StackerConfig.load(path)
                : StackerConfig.loadFromClasspath(IndexerJob.DEFAULT_CONFIG_RESOURCE);

        try (ElasticsearchService elasticsearch = new ElasticsearchService(config.getElasticsearch());
             HikariDataSource dataSource = config.getDatabase().createDataSource();
             KafkaIndexTaskPublisher publisher = new KafkaIndexTaskPublisher(
                     config.getBootstrapServers(), config.getTaskTopic(), new ObjectMapper())) {
            StackerIndex index = new StackerIndex(elasticsearch, new SearchQueryCompiler(),
                    new CompanyCountCache(Duration.ofSeconds(config.getSearch().getCountCacheTtlSeconds())),
                    config.getIndexPrefix(), config.getSearch().getScanPageSize());
            new IndexAdmin(index, new CompanyDirectory(dataSource), publisher).run(Arrays.asList(args));
        }
    }

    public void run(List<String> args) throws IOException {
        if (args.isEmpty()) {
            throw new IllegalArgumentException("Usage: IndexAdmin create|delete|populate [company-id ...]");
        }
        switch (args.get(0)) {
            case "create":
                index.create();
                log.info("Stacker indexes created");
                break;
            case "delete":
                index.delete();
                log.info("Stacker indexes deleted");
                break;
            case "populate":
                populate(args.subList(1, args.size()));
                break;
            default:
                throw new IllegalArgumentException("Unknown command: " + args.get(0));
        }
    }

    private void populate(List<String> ids) throws IOException {
        List<Integer> companyIds = new ArrayList<>();
        for (String id : ids) {
            companyIds.add(Integer.parseInt(id));
        }
        if (companyIds.isEmpty()) {
            companyIds = companyDirectory.activeCompanyIds();
        }
        if (companyIds.isEmpty()) {
            log.warn("No companies to populate");
            return;
        }
        publisher.publish(IndexTask.populate(companyIds));
        log.info("Scheduled population of {} compan(ies)", companyIds.size());
    }
}
