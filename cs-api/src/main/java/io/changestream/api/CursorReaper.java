package io.changestream.api;

import io.changestream.store.ChangeLog;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Releases cursors whose clients stopped reading without unsubscribing. */
@Component
public class CursorReaper {
    private final ChangeLog changeLog;
    private final ChangeStreamProperties props;

    public CursorReaper(ChangeLog changeLog, ChangeStreamProperties props) {
        this.changeLog = changeLog;
        this.props = props;
    }

    @Scheduled(fixedDelayString = "${changestream.cursor.reap-interval:PT1M}")
    public int reap() {
        return changeLog.expireIdleCursors(props.cursor().idleTimeout());
    }
}
