package com.terradrift.core.source;

import com.terradrift.core.cache.TtlCache;
import com.terradrift.core.model.ConfigValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Decorates a fetcher with a TTL cache of successful results.
 *
 * <p>Failures are not cached. Two workers missing the same key at the same moment may both
 * call the delegate; the later result wins.
 */
public class CachingResourceFetcher implements LiveResourceFetcher {

    private static final Logger log = LoggerFactory.getLogger(CachingResourceFetcher.class);

    private final LiveResourceFetcher delegate;
    private final TtlCache<String, ConfigValue> cache;

    public CachingResourceFetcher(LiveResourceFetcher delegate, TtlCache<String, ConfigValue> cache) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
    }

    @Override
    public ConfigValue fetch(String resourceId) {
        Optional<ConfigValue> cached = cache.get(resourceId);
        if (cached.isPresent()) {
            log.debug("Cache hit for {}", resourceId);
            return cached.get();
        }

        log.debug("Cache miss for {}", resourceId);
        ConfigValue fetched = delegate.fetch(resourceId);
        cache.put(resourceId, fetched);
        return fetched;
    }
}
