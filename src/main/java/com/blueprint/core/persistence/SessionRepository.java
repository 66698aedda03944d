package com.blueprint.core.persistence;

import java.util.List;
import java.util.Optional;

/**
 * Store of immutable session snapshots keyed by idea id.
 * <p>
 * Last write wins; a caller always reads its own writes.
 *
 * @param <T> session type
 */
public interface SessionRepository<T> {

    Optional<T> get(String ideaId);

    /** Inserts or replaces the session stored under its idea id. */
    void upsert(T session);

    /**
     * Stores {@code updated} only if the current snapshot equals {@code expected}.
     *
     * @return false when another writer replaced the snapshot first
     */
    boolean replace(T expected, T updated);

    boolean delete(String ideaId);

    List<T> findAll();

    int count();
}
