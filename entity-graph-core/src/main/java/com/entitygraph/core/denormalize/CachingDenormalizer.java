package com.entitygraph.core.denormalize;

import com.entitygraph.core.model.NormalizedEntities;
import com.entitygraph.core.schema.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Denormalizer bound to one schema that caches results across calls.
 *
 * <p>Entries are keyed by input, options and store instance, so a new store (every
 * store update returns one) never sees stale views. The cache holds at most
 * {@code maxEntries} results and evicts the least recently used entry first.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * CachingDenormalizer posts = new CachingDenormalizer(postSchema, DenormalizeOptions.defaults(), 128);
 * Object view = posts.denormalize("1", store);
 * }</pre>
 */
public class CachingDenormalizer {

    private static final Logger log = LoggerFactory.getLogger(CachingDenormalizer.class);

    /** Default cache bound. */
    public static final int DEFAULT_MAX_ENTRIES = 256;

    private final Schema schema;
    private final DenormalizeOptions defaultOptions;
    private final Map<CacheKey, Object> cache;
    private final int maxEntries;

    /**
     * Creates a caching denormalizer with the default bound.
     *
     * @param schema schema of the inputs
     * @param defaultOptions options used when a call supplies none
     */
    public CachingDenormalizer(Schema schema, DenormalizeOptions defaultOptions) {
        this(schema, defaultOptions, DEFAULT_MAX_ENTRIES);
    }

    /**
     * Creates a caching denormalizer.
     *
     * @param schema schema of the inputs
     * @param defaultOptions options used when a call supplies none
     * @param maxEntries cache bound, must be positive
     */
    public CachingDenormalizer(Schema schema, DenormalizeOptions defaultOptions, int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be > 0, was " + maxEntries);
        }
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.defaultOptions = defaultOptions != null ? defaultOptions : DenormalizeOptions.defaults();
        this.maxEntries = maxEntries;
        this.cache = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<CacheKey, Object> eldest) {
                return size() > CachingDenormalizer.this.maxEntries;
            }
        };
    }

    /**
     * Denormalizes with the default options.
     *
     * @param input normalized value
     * @param entities store
     * @return nested view, or null
     */
    public Object denormalize(Object input, NormalizedEntities entities) {
        return denormalize(input, entities, defaultOptions);
    }

    /**
     * Denormalizes with explicit options. Results of calls with {@code memoize=false}
     * are neither read from nor written to the cache; null results are never cached.
     *
     * @param input normalized value
     * @param entities store
     * @param options options for this call
     * @return nested view, or null
     */
    public synchronized Object denormalize(Object input, NormalizedEntities entities, DenormalizeOptions options) {
        DenormalizeOptions effective = options != null ? options : defaultOptions;
        if (!effective.memoize()) {
            return Denormalizer.denormalize(input, schema, entities, effective);
        }

        CacheKey key = new CacheKey(input, effective, entities);
        Object cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        Object result = Denormalizer.denormalize(input, schema, entities, effective);
        if (result != null) {
            cache.put(key, result);
        }
        return result;
    }

    /**
     * @return number of cached results
     */
    public synchronized int size() {
        return cache.size();
    }

    public int maxEntries() {
        return maxEntries;
    }

    /**
     * Drops every cached result.
     */
    public synchronized void reset() {
        log.debug("Clearing {} cached views", cache.size());
        cache.clear();
    }

    /**
     * Cache key comparing input and options by value and the store by identity.
     */
    private static final class CacheKey {
        private final Object input;
        private final DenormalizeOptions options;
        private final NormalizedEntities store;

        private CacheKey(Object input, DenormalizeOptions options, NormalizedEntities store) {
            this.input = input;
            this.options = options;
            this.store = store;
        }

        @Override
        public boolean equals(Object other) {
            if (this == other) {
                return true;
            }
            if (!(other instanceof CacheKey key)) {
                return false;
            }
            return store == key.store
                && Objects.equals(input, key.input)
                && options.equals(key.options);
        }

        @Override
        public int hashCode() {
            return Objects.hash(input, options, System.identityHashCode(store));
        }
    }
}
