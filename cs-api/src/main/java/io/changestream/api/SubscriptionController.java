package io.changestream.api;

import io.changestream.core.CursorId;
import io.changestream.core.CursorNotFoundException;
import io.changestream.core.CursorView;
import io.changestream.store.ChangeLog;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/subscriptions")
public class SubscriptionController {
    private final ChangeLog changeLog;
    private final ChangeStreamProperties props;

    public SubscriptionController(ChangeLog changeLog, ChangeStreamProperties props) {
        this.changeLog = changeLog;
        this.props = props;
    }

    public record Batch(String cursorId, List<EventView> events, long position) {}

    /** Opens a cursor at {@code from}, or at the end of the log when omitted. */
    @PostMapping
    public ResponseEntity<CursorView> subscribe(@RequestParam(name = "from", required = false) Long from,
                                                @RequestAttribute(name = IdentityFilter.ATTRIBUTE, required = false) String identity) {
        var owner = IdentityFilter.orAnonymous(identity);
        var id = from == null ? changeLog.subscribeAtEnd(owner) : changeLog.subscribe(from, owner);
        return ResponseEntity.status(HttpStatus.CREATED).body(view(id));
    }

    @PostMapping("/resume/{consumerId}")
    public ResponseEntity<CursorView> resume(@PathVariable("consumerId") String consumerId,
                                             @RequestAttribute(name = IdentityFilter.ATTRIBUTE, required = false) String identity) {
        var id = changeLog.resume(consumerId, IdentityFilter.orAnonymous(identity));
        return ResponseEntity.status(HttpStatus.CREATED).body(view(id));
    }

    @GetMapping("/{cursorId}")
    public ResponseEntity<Batch> read(@PathVariable("cursorId") String cursorId,
                                      @RequestParam(name = "max", required = false) Integer max) {
        var id = CursorId.parse(cursorId);
        int limit = props.read().maxBatchSize();
        int count = (max == null) ? limit : Math.min(max, limit);
        var events = changeLog.read(id, count).stream().map(EventView::of).toList();
        long position = events.isEmpty() ? view(id).position() : events.get(events.size() - 1).offset() + 1;
        return ResponseEntity.ok(new Batch(id.toString(), events, position));
    }

    @GetMapping("/{cursorId}/position")
    public ResponseEntity<CursorView> position(@PathVariable("cursorId") String cursorId) {
        return ResponseEntity.ok(view(CursorId.parse(cursorId)));
    }

    @GetMapping
    public ResponseEntity<List<CursorView>> list(@RequestAttribute(name = IdentityFilter.ATTRIBUTE, required = false) String identity) {
        return ResponseEntity.ok(changeLog.cursors(IdentityFilter.orAnonymous(identity)));
    }

    @DeleteMapping("/{cursorId}")
    public ResponseEntity<Void> unsubscribe(@PathVariable("cursorId") String cursorId) {
        changeLog.unsubscribe(CursorId.parse(cursorId));
        return ResponseEntity.noContent().build();
    }

    /** Releases all cursors of {@code owner} (the caller when omitted). */
    @DeleteMapping
    public ResponseEntity<Map<String, Integer>> unsubscribeAll(@RequestParam(name = "owner", required = false) String owner,
                                                               @RequestAttribute(name = IdentityFilter.ATTRIBUTE, required = false) String identity) {
        var target = (owner == null || owner.isBlank()) ? IdentityFilter.orAnonymous(identity) : owner;
        return ResponseEntity.ok(Map.of("released", changeLog.unsubscribeAll(target)));
    }

    private CursorView view(CursorId id) {
        return changeLog.cursor(id).orElseThrow(() -> new CursorNotFoundException(id));
    }
}
