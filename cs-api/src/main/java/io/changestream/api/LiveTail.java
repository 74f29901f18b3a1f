package io.changestream.api;

import io.changestream.core.ChangeLogException;
import io.changestream.core.CursorId;
import io.changestream.core.CursorNotFoundException;
import io.changestream.store.ChangeLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pushes events to an SSE client through a private cursor.
 * <p>
 * Append notifications only wake the tail up; events always come from the cursor, so a dropped
 * notification delays delivery until the next one and never skips an event. Drains run on the
 * notification thread, one at a time, which keeps the emitted events in offset order.
 */
final class LiveTail implements Flow.Subscriber<Long> {
    private static final Logger log = LoggerFactory.getLogger(LiveTail.class);

    private final ChangeLog changeLog;
    private final CursorId cursorId;
    private final SseEmitter emitter;
    private final int batchSize;
    private final AtomicBoolean stopped = new AtomicBoolean();
    private volatile Flow.Subscription subscription;

    LiveTail(ChangeLog changeLog, CursorId cursorId, SseEmitter emitter, int batchSize) {
        this.changeLog = changeLog;
        this.cursorId = cursorId;
        this.emitter = emitter;
        this.batchSize = batchSize;
    }

    /** Hooks the tail to the emitter lifecycle and starts listening for appends. */
    void start() {
        emitter.onCompletion(this::stop);
        emitter.onTimeout(this::stop);
        emitter.onError(t -> stop());
        changeLog.store().appendNotifications().subscribe(this);
    }

    @Override
    public void onSubscribe(Flow.Subscription s) {
        this.subscription = s;
        if (stopped.get()) {
            s.cancel();
            return;
        }
        s.request(Long.MAX_VALUE);
        drain();
    }

    @Override
    public void onNext(Long nextOffset) {
        drain();
    }

    @Override
    public void onError(Throwable t) {
        log.warn("Append notifications failed for cursor {}", cursorId, t);
        emitter.completeWithError(t);
        stop();
    }

    /** The store was closed. */
    @Override
    public void onComplete() {
        emitter.complete();
        stop();
    }

    void stop() {
        if (!stopped.compareAndSet(false, true)) return;
        var s = subscription;
        if (s != null) s.cancel();
        try {
            changeLog.unsubscribe(cursorId);
        } catch (CursorNotFoundException e) {
            log.debug("Cursor {} was already released", cursorId);
        }
    }

    boolean stopped() {
        return stopped.get();
    }

    private void drain() {
        try {
            while (!stopped.get()) {
                var events = changeLog.read(cursorId, batchSize);
                if (events.isEmpty()) return;
                for (var e : events) {
                    emitter.send(SseEmitter.event()
                            .id(Long.toString(e.offset()))
                            .name("change")
                            .data(EventView.of(e)));
                }
            }
        } catch (IOException e) {
            log.debug("Client of cursor {} went away", cursorId, e);
            emitter.completeWithError(e);
            stop();
        } catch (ChangeLogException e) {
            log.info("Live tail on cursor {} ended: {}", cursorId, e.getMessage());
            emitter.complete();
            stop();
        }
    }
}
