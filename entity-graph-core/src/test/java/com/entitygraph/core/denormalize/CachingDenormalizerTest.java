package com.entitygraph.core.denormalize;

import com.entitygraph.core.model.Entity;
import com.entitygraph.core.model.NormalizedEntities;
import com.entitygraph.core.schema.EntitySchema;
import com.entitygraph.core.schema.Schemas;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link CachingDenormalizer}.
 */
class CachingDenormalizerTest {

    private EntitySchema posts;
    private NormalizedEntities store;

    @BeforeEach
    void setUp() {
        posts = Schemas.entity("posts", Map.of("author", Schemas.entity("users")));
        store = NormalizedEntities.of(Map.of(
            "users", Map.of("9", Entity.of(Map.of("id", "9", "name", "Alice"))),
            "posts", Map.of("1", Entity.of(Map.of("id", "1", "author", "9")))));
    }

    @Test
    void constructor_withNonPositiveBound_throwsException() {
        assertThatThrownBy(() -> new CachingDenormalizer(posts, null, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxEntries must be > 0");
    }

    @Test
    void denormalize_sameInputAndStore_returnsCachedView() {
        CachingDenormalizer denormalizer = new CachingDenormalizer(posts, DenormalizeOptions.defaults());

        Object first = denormalizer.denormalize("1", store);
        Object second = denormalizer.denormalize("1", store);

        assertThat(second).isSameAs(first);
        assertThat(denormalizer.size()).isEqualTo(1);
        assertThat(denormalizer.maxEntries()).isEqualTo(CachingDenormalizer.DEFAULT_MAX_ENTRIES);
    }

    @Test
    void denormalize_equalButDistinctStore_missesCache() {
        CachingDenormalizer denormalizer = new CachingDenormalizer(posts, DenormalizeOptions.defaults());
        NormalizedEntities copy = NormalizedEntities.of(store.types());

        Object first = denormalizer.denormalize("1", store);
        Object second = denormalizer.denormalize("1", copy);

        assertThat(second).isEqualTo(first).isNotSameAs(first);
        assertThat(denormalizer.size()).isEqualTo(2);
    }

    @Test
    void denormalize_withoutMemoize_bypassesCache() {
        CachingDenormalizer denormalizer = new CachingDenormalizer(posts, DenormalizeOptions.defaults());
        DenormalizeOptions uncached = DenormalizeOptions.builder().memoize(false).build();

        denormalizer.denormalize("1", store, uncached);

        assertThat(denormalizer.size()).isZero();
    }

    @Test
    void denormalize_nullResult_isNotCached() {
        CachingDenormalizer denormalizer = new CachingDenormalizer(posts, DenormalizeOptions.defaults());

        assertThat(denormalizer.denormalize(null, store)).isNull();
        assertThat(denormalizer.size()).isZero();
    }

    @Test
    void denormalize_beyondBound_evictsLeastRecentlyUsed() {
        CachingDenormalizer denormalizer = new CachingDenormalizer(posts, DenormalizeOptions.defaults(), 1);

        Object first = denormalizer.denormalize("1", store);
        denormalizer.denormalize("2", store);
        Object again = denormalizer.denormalize("1", store);

        assertThat(denormalizer.size()).isEqualTo(1);
        assertThat(again).isEqualTo(first).isNotSameAs(first);
    }

    @Test
    void reset_clearsCache() {
        CachingDenormalizer denormalizer = new CachingDenormalizer(posts, null);
        denormalizer.denormalize("1", store);

        denormalizer.reset();

        assertThat(denormalizer.size()).isZero();
    }
}
