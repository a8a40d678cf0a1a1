package com.stacker.search;

import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;

/**
 * Per-company document counts, served from memory for a fixed time after they were computed.
 *
 * <p>Entries are never invalidated by writes: a count may lag the indexes by up to the TTL.</p>
 */
public class CompanyCountCache {

    /** Computes the counts on a cache miss. */
    @FunctionalInterface
    public interface CountLoader {
        StackerCounts load() throws IOException;
    }

    private final Cache<Integer, StackerCounts> cache;

    public CompanyCountCache(Duration ttl) {
        this(ttl, Ticker.systemTicker());
    }

    public CompanyCountCache(Duration ttl, Ticker ticker) {
        this.cache = CacheBuilder.newBuilder()
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .maximumSize(10_000)
                .build();
    }

    public StackerCounts get(int companyId, CountLoader loader) throws IOException {
        try {
            return cache.get(companyId, loader::load);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof IOException) {
                throw (IOException) e.getCause();
            }
            throw new IOException("Failed to count documents of company " + companyId, e.getCause());
        }
    }
}
