package io.changestream.api;

import io.changestream.core.AppendResult;
import io.changestream.core.EventNotFoundException;
import io.changestream.store.ChangeLog;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/events")
public class EventController {
    private final ChangeLog changeLog;
    private final ChangeStreamProperties props;

    public EventController(ChangeLog changeLog, ChangeStreamProperties props) {
        this.changeLog = changeLog;
        this.props = props;
    }

    record AppendReq(String eventType, byte[] before, byte[] after, String source) {}

    @PostMapping
    public ResponseEntity<AppendResult> append(@RequestBody AppendReq req,
                                               @RequestAttribute(name = IdentityFilter.ATTRIBUTE, required = false) String identity) {
        if (req.eventType() == null || req.eventType().isBlank()) {
            throw new IllegalArgumentException("eventType is required");
        }
        var source = (req.source() == null || req.source().isBlank()) ? IdentityFilter.orAnonymous(identity) : req.source();
        var result = changeLog.append(req.eventType(), req.before(), req.after(), source);
        return ResponseEntity.created(URI.create("/api/events/" + result.offset())).body(result);
    }

    /** Inclusive replay of {@code [from, to]}, at most {@code read.max-replay-size} events wide. */
    @GetMapping
    public ResponseEntity<List<EventView>> replay(@RequestParam("from") long from, @RequestParam("to") long to) {
        int limit = props.read().maxReplaySize();
        if (from >= 0 && to >= from && to - from >= limit) {
            throw new IllegalArgumentException("replay of [" + from + ", " + to + "] exceeds " + limit + " events; split the range");
        }
        return ResponseEntity.ok(changeLog.replay(from, to).stream().map(EventView::of).toList());
    }

    @GetMapping("/{offset}")
    public ResponseEntity<EventView> get(@PathVariable("offset") long offset) {
        var event = changeLog.get(offset).orElseThrow(() -> new EventNotFoundException(offset));
        return ResponseEntity.ok(EventView.of(event));
    }

    @GetMapping("/next-offset")
    public ResponseEntity<Map<String, Long>> nextOffset() {
        return ResponseEntity.ok(Map.of("nextOffset", changeLog.nextOffset()));
    }
}
