package com.stacker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stacker.bulk.BulkActionOrchestrator;
import com.stacker.bulk.StackerMutations;
import com.stacker.elasticsearch.ElasticsearchService;
import com.stacker.query.FilterNormalizer;
import com.stacker.query.SearchQueryCompiler;
import com.stacker.search.CompanyCountCache;
import com.stacker.search.StackerIndex;
import com.stacker.search.StackerSearchService;
import com.stacker.task.IndexTaskPublisher;
import com.stacker.task.KafkaIndexTaskPublisher;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Spring configuration that wires the search and bulk-action beans.
 *
 * <p>Discovered via component-scanning from the search API's {@code @SpringBootApplication}
 * (which scans {@code com.stacker.*}).  The Flink indexer has no Spring context and builds the
 * indexing side itself.  A {@link StackerMutations} bean has to be supplied by the
 * application.</p>
 */
@Configuration
@EnableConfigurationProperties(StackerConfig.class)
public class StackerAutoConfiguration {

    @Bean
    public ElasticsearchService elasticsearchService(StackerConfig config) {
        return new ElasticsearchService(config.getElasticsearch());
    }

    @Bean
    public SearchQueryCompiler searchQueryCompiler() {
        return new SearchQueryCompiler();
    }

    @Bean
    public FilterNormalizer filterNormalizer() {
        return new FilterNormalizer();
    }

    @Bean
    public CompanyCountCache companyCountCache(StackerConfig config) {
        return new CompanyCountCache(Duration.ofSeconds(config.getSearch().getCountCacheTtlSeconds()));
    }

    @Bean
    public StackerIndex stackerIndex(StackerConfig config, ElasticsearchService elasticsearchService,
                                     SearchQueryCompiler compiler, CompanyCountCache countCache) {
        return new StackerIndex(elasticsearchService, compiler, countCache,
                config.getIndexPrefix(), config.getSearch().getScanPageSize());
    }

    @Bean
    public StackerSearchService stackerSearchService(StackerIndex stackerIndex, SearchQueryCompiler compiler,
                                                     FilterNormalizer normalizer) {
        return new StackerSearchService(stackerIndex, compiler, normalizer);
    }

    @Bean
    public KafkaIndexTaskPublisher indexTaskPublisher(StackerConfig config, ObjectMapper objectMapper) {
        return new KafkaIndexTaskPublisher(config.getBootstrapServers(), config.getTaskTopic(), objectMapper);
    }

    @Bean
    public BulkActionOrchestrator bulkActionOrchestrator(StackerIndex stackerIndex, SearchQueryCompiler compiler,
                                                         FilterNormalizer normalizer, StackerMutations mutations,
                                                         IndexTaskPublisher indexTaskPublisher) {
        return new BulkActionOrchestrator(stackerIndex, compiler, normalizer, mutations, indexTaskPublisher);
    }
}
