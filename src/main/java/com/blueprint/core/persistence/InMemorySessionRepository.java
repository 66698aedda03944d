package com.blueprint.core.persistence;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * {@link SessionRepository} over a {@link ConcurrentHashMap}. Each write swaps a whole
 * snapshot atomically, so readers never see a partially written session.
 */
public abstract class InMemorySessionRepository<T> implements SessionRepository<T> {

    private final ConcurrentHashMap<String, T> sessions = new ConcurrentHashMap<>();
    private final Function<T, String> keyExtractor;

    protected InMemorySessionRepository(Function<T, String> keyExtractor) {
        this.keyExtractor = keyExtractor;
    }

    @Override
    public Optional<T> get(String ideaId) {
        return ideaId == null ? Optional.empty() : Optional.ofNullable(sessions.get(ideaId));
    }

    @Override
    public void upsert(T session) {
        sessions.put(keyExtractor.apply(session), session);
    }

    @Override
    public boolean replace(T expected, T updated) {
        return sessions.replace(keyExtractor.apply(updated), expected, updated);
    }

    @Override
    public boolean delete(String ideaId) {
        return sessions.remove(ideaId) != null;
    }

    @Override
    public List<T> findAll() {
        return List.copyOf(sessions.values());
    }

    @Override
    public int count() {
        return sessions.size();
    }
}
