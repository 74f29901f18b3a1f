package io.changestream.api;

import io.changestream.store.ChangeLog;
import io.changestream.store.InMemoryConsumerProgressStore;
import io.changestream.store.InMemoryEventStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class CursorReaperTest {

    @Test
    void reapsCursorsIdleLongerThanConfigured() {
        var clock = new MutableClock(Instant.parse("2025-09-16T12:00:00Z"));
        var changeLog = new ChangeLog(new InMemoryEventStore(clock), new InMemoryConsumerProgressStore(), clock);
        var props = new ChangeStreamProperties(
                new ChangeStreamProperties.Read(100, 10000),
                new ChangeStreamProperties.Stream(Duration.ofMinutes(10)),
                new ChangeStreamProperties.Cursor(Duration.ofMinutes(15), Duration.ofMinutes(1)));
        var reaper = new CursorReaper(changeLog, props);
        var cursor = changeLog.subscribeAtEnd("gone");

        clock.advance(Duration.ofMinutes(5));
        assertThat(reaper.reap()).isZero();

        clock.advance(Duration.ofMinutes(11));
        assertThat(reaper.reap()).isEqualTo(1);
        assertThat(changeLog.cursor(cursor)).isEmpty();
    }
}
