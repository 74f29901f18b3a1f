package io.changestream.store;

import io.changestream.core.ChangeEvent;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryEventStore extends AbstractEventStore {
    private final Map<Long, ChangeEvent> byOffset = new ConcurrentHashMap<>();

    public InMemoryEventStore() {
        this(Clock.systemUTC());
    }

    public InMemoryEventStore(Clock clock) {
        super(clock, 0L);
    }

    @Override
    protected void persist(ChangeEvent event) {
        byOffset.put(event.offset(), event);
    }

    @Override
    protected ChangeEvent load(long offset) {
        return byOffset.get(offset);
    }

    @Override
    protected List<ChangeEvent> loadRange(long fromOffset, long toOffset) {
        var events = new ArrayList<ChangeEvent>((int) Math.min(toOffset - fromOffset + 1, 1024));
        for (long o = fromOffset; o <= toOffset; o++) {
            events.add(byOffset.get(o));
        }
        return List.copyOf(events);
    }
}
