package io.changestream.api;

import io.changestream.core.ConsumerProgress;
import io.changestream.store.ChangeLog;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/consumers")
public class ConsumerController {
    private final ChangeLog changeLog;

    public ConsumerController(ChangeLog changeLog) { this.changeLog = changeLog; }

    @PostMapping("/{consumerId}/ack")
    public ResponseEntity<ConsumerProgress> acknowledge(@PathVariable("consumerId") String consumerId,
                                                        @RequestParam("offset") long offset) {
        return ResponseEntity.ok(changeLog.acknowledge(consumerId, offset));
    }

    /** Never 404: a consumer without acknowledgments reports offset -1. */
    @GetMapping("/{consumerId}/progress")
    public ResponseEntity<ConsumerProgress> progress(@PathVariable("consumerId") String consumerId) {
        return ResponseEntity.ok(changeLog.progress(consumerId));
    }

    @DeleteMapping("/{consumerId}/progress")
    public ResponseEntity<Void> reset(@PathVariable("consumerId") String consumerId) {
        return changeLog.resetProgress(consumerId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @GetMapping
    public ResponseEntity<List<ConsumerProgress>> list() {
        return ResponseEntity.ok(changeLog.consumers());
    }
}
