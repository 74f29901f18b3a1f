package io.changestream.store;

import io.changestream.core.ChangeEvent;
import io.changestream.core.CursorId;
import io.changestream.core.CursorNotFoundException;
import io.changestream.core.OffsetOutOfRangeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CursorRegistryTest {

    private MutableClock clock;
    private InMemoryEventStore store;
    private CursorRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-09-16T12:00:00Z"));
        store = new InMemoryEventStore(clock);
        registry = new CursorRegistry(store, clock);
    }

    @Test
    void subscribe_acceptsZeroToNextOffsetOnly() {
        appendEvents(3);

        assertThat(registry.subscribe(0, "a")).isNotNull();
        assertThat(registry.subscribe(3, "a")).isNotNull();
        assertThatThrownBy(() -> registry.subscribe(4, "a")).isInstanceOf(OffsetOutOfRangeException.class);
        assertThatThrownBy(() -> registry.subscribe(-1, "a")).isInstanceOf(OffsetOutOfRangeException.class);
    }

    @Test
    void read_advancesByNumberOfEventsReturned() {
        appendEvents(3);
        var cursor = registry.subscribe(0, "a");

        assertThat(registry.read(cursor, 2)).extracting(ChangeEvent::offset).containsExactly(0L, 1L);
        assertThat(registry.cursor(cursor).orElseThrow().position()).isEqualTo(2);
        assertThat(registry.read(cursor, 10)).extracting(ChangeEvent::offset).containsExactly(2L);
        assertThat(registry.read(cursor, 10)).isEmpty();
        assertThat(registry.cursor(cursor).orElseThrow().position()).isEqualTo(3);
    }

    @Test
    void subscribeAtEnd_seesOnlyFutureEvents() {
        appendEvents(2);
        var cursor = registry.subscribeAtEnd("a");

        assertThat(registry.read(cursor, 10)).isEmpty();
        store.append("LATER", null, null, "svc");
        assertThat(registry.read(cursor, 10)).extracting(ChangeEvent::eventType).containsExactly("LATER");
    }

    @Test
    void read_rejectsNonPositiveMax() {
        var cursor = registry.subscribe(0, "a");

        assertThatThrownBy(() -> registry.read(cursor, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unsubscribe_makesCursorUnknown() {
        var cursor = registry.subscribe(0, "a");
        registry.unsubscribe(cursor);

        assertThatThrownBy(() -> registry.read(cursor, 1)).isInstanceOf(CursorNotFoundException.class);
        assertThatThrownBy(() -> registry.unsubscribe(cursor)).isInstanceOf(CursorNotFoundException.class);
        assertThatThrownBy(() -> registry.read(CursorId.random(), 1)).isInstanceOf(CursorNotFoundException.class);
        assertThat(registry.cursor(cursor)).isEmpty();
    }

    @Test
    void concurrentReadsOnOneCursor_neverReturnAnEventTwice() throws Exception {
        appendEvents(1_000);
        var cursor = registry.subscribe(0, "a");
        var seen = new ConcurrentLinkedQueue<Long>();
        var pool = Executors.newFixedThreadPool(8);
        try {
            var futures = new ArrayList<Future<?>>();
            for (int t = 0; t < 8; t++) {
                futures.add(pool.submit(() -> {
                    var batch = registry.read(cursor, 7);
                    while (!batch.isEmpty()) {
                        batch.forEach(e -> seen.add(e.offset()));
                        batch = registry.read(cursor, 7);
                    }
                }));
            }
            for (var f : futures) f.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(seen).hasSize(1_000).doesNotHaveDuplicates();
    }

    @Test
    void cursorsAreIndependent() {
        appendEvents(4);
        var a = registry.subscribe(0, "a");
        var b = registry.subscribe(2, "b");

        registry.read(a, 3);

        assertThat(registry.read(b, 10)).extracting(ChangeEvent::offset).containsExactly(2L, 3L);
        assertThat(registry.read(a, 10)).extracting(ChangeEvent::offset).containsExactly(3L);
    }

    @Test
    void unsubscribeAll_releasesOnlyThatOwner() {
        registry.subscribe(0, "a");
        registry.subscribe(0, "a");
        var other = registry.subscribe(0, "b");

        assertThat(registry.unsubscribeAll("a")).isEqualTo(2);
        assertThat(registry.cursors("a")).isEmpty();
        assertThat(registry.cursors("b")).extracting(v -> v.id()).containsExactly(other);
    }

    @Test
    void expireIdle_releasesCursorsNotReadWithinTimeout() {
        var idle = registry.subscribe(0, "a");
        var busy = registry.subscribe(0, "a");

        clock.advance(Duration.ofMinutes(10));
        registry.read(busy, 1);
        clock.advance(Duration.ofMinutes(10));

        assertThat(registry.expireIdle(Duration.ofMinutes(15))).isEqualTo(1);
        assertThat(registry.cursor(idle)).isEmpty();
        assertThat(registry.cursor(busy)).isPresent();
    }

    private void appendEvents(int n) {
        for (int i = 0; i < n; i++) store.append("E" + i, null, null, "svc");
    }
}
