package io.changestream.store;

import io.changestream.core.ConsumerProgress;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public final class InMemoryConsumerProgressStore implements ConsumerProgressStore {
    private final ConcurrentMap<String, ConsumerProgress> byConsumer = new ConcurrentHashMap<>();

    @Override
    public ConsumerProgress acknowledge(String consumerId, long offset, Instant at) {
        var candidate = new ConsumerProgress(consumerId, offset, at);
        return byConsumer.merge(consumerId, candidate,
                (current, update) -> update.acknowledgedOffset() > current.acknowledgedOffset() ? update : current);
    }

    @Override
    public Optional<ConsumerProgress> find(String consumerId) {
        return Optional.ofNullable(byConsumer.get(consumerId));
    }

    @Override
    public boolean delete(String consumerId) {
        return byConsumer.remove(consumerId) != null;
    }

    @Override
    public List<ConsumerProgress> findAll() {
        return byConsumer.values().stream()
                .sorted(Comparator.comparing(ConsumerProgress::consumerId))
                .toList();
    }
}
