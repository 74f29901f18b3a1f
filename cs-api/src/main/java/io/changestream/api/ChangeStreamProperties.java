package io.changestream.api;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/** Tunables under {@code changestream.*}. */
@ConfigurationProperties("changestream")
public record ChangeStreamProperties(@DefaultValue Read read,
                                     @DefaultValue Stream stream,
                                     @DefaultValue Cursor cursor) {

    /**
     * {@code maxBatchSize} bounds one cursor read, whatever {@code max} the caller asks for;
     * {@code maxReplaySize} bounds the width of one replay request.
     */
    public record Read(@DefaultValue("500") int maxBatchSize,
                       @DefaultValue("10000") int maxReplaySize) {
        public Read {
            if (maxBatchSize <= 0) throw new IllegalArgumentException("changestream.read.max-batch-size must be > 0");
            if (maxReplaySize <= 0) throw new IllegalArgumentException("changestream.read.max-replay-size must be > 0");
        }
    }

    /** Lifetime of one live-tail connection. Keep it below the cursor idle timeout. */
    public record Stream(@DefaultValue("10m") Duration timeout) {}

    public record Cursor(@DefaultValue("15m") Duration idleTimeout,
                         @DefaultValue("PT1M") Duration reapInterval) {}
}
