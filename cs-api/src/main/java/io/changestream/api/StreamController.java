package io.changestream.api;

import io.changestream.core.CursorId;
import io.changestream.store.ChangeLog;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api/stream")
public class StreamController {

    private final ChangeLog changeLog;
    private final ChangeStreamProperties props;

    public StreamController(ChangeLog changeLog, ChangeStreamProperties props) {
        this.changeLog = changeLog;
        this.props = props;
    }

    /**
     * Live tail from {@code from} (or the end of the log). A reconnecting client sending
     * {@code Last-Event-ID} continues after that offset.
     */
    @GetMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestParam(name = "from", required = false) Long from,
                             @RequestHeader(name = "Last-Event-ID", required = false) Long lastEventId,
                             @RequestAttribute(name = IdentityFilter.ATTRIBUTE, required = false) String identity) {
        var cursorId = openCursor(from, lastEventId, IdentityFilter.orAnonymous(identity));

        var emitter = new SseEmitter(props.stream().timeout().toMillis());
        new LiveTail(changeLog, cursorId, emitter, props.read().maxBatchSize()).start();
        return emitter;
    }

    /** {@code Last-Event-ID} wins over {@code from}; neither means the end of the log. */
    CursorId openCursor(Long from, Long lastEventId, String owner) {
        if (lastEventId != null) return changeLog.subscribe(lastEventId + 1, owner);
        if (from != null) return changeLog.subscribe(from, owner);
        return changeLog.subscribeAtEnd(owner);
    }
}
