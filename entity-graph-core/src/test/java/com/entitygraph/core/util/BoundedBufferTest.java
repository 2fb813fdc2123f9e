package com.entitygraph.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link BoundedBuffer}.
 */
class BoundedBufferTest {

    @ParameterizedTest
    @ValueSource(ints = {0, -1, -100})
    void constructor_withNonPositiveCapacity_throwsException(int capacity) {
        assertThatThrownBy(() -> new BoundedBuffer<String>(capacity))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("capacity must be > 0");
    }

    @Test
    void add_overCapacity_evictsOldestFirst() {
        BoundedBuffer<Integer> buffer = new BoundedBuffer<>(3);

        for (int i = 1; i <= 5; i++) {
            buffer.add(i);
        }

        assertThat(buffer.toList()).containsExactly(3, 4, 5);
        assertThat(buffer.size()).isEqualTo(3);
        assertThat(buffer.capacity()).isEqualTo(3);
    }

    @Test
    void last_returnsNewestOrEmpty() {
        BoundedBuffer<String> buffer = new BoundedBuffer<>(2);
        assertThat(buffer.last()).isEmpty();

        buffer.add("a");
        buffer.add("b");

        assertThat(buffer.last()).contains("b");
    }

    @Test
    void find_returnsOldestMatch() {
        BoundedBuffer<String> buffer = new BoundedBuffer<>(5);
        buffer.add("apple");
        buffer.add("avocado");
        buffer.add("banana");

        assertThat(buffer.find(value -> value.startsWith("a"))).contains("apple");
        assertThat(buffer.find(value -> value.startsWith("z"))).isEmpty();
    }

    @Test
    void toList_returnsImmutableSnapshot() {
        BoundedBuffer<String> buffer = new BoundedBuffer<>(5);
        buffer.add("a");

        List<String> snapshot = buffer.toList();
        buffer.add("b");

        assertThat(snapshot).containsExactly("a");
        assertThatThrownBy(() -> snapshot.add("c")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void clear_removesEverything() {
        BoundedBuffer<String> buffer = new BoundedBuffer<>(5);
        buffer.add("a");

        buffer.clear();

        assertThat(buffer.size()).isZero();
        assertThat(buffer.last()).isEmpty();
    }

    @Test
    void add_fromManyThreads_neverExceedsCapacity() throws InterruptedException {
        BoundedBuffer<Integer> buffer = new BoundedBuffer<>(50);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(4);
        List<Throwable> failures = new ArrayList<>();

        for (int t = 0; t < 4; t++) {
            executor.execute(() -> {
                try {
                    for (int i = 0; i < 1_000; i++) {
                        buffer.add(i);
                        buffer.toList();
                    }
                } catch (Throwable e) {
                    synchronized (failures) {
                        failures.add(e);
                    }
                } finally {
                    done.countDown();
                }
            });
        }

        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdownNow();
        assertThat(failures).isEmpty();
        assertThat(buffer.size()).isEqualTo(50);
    }
}
