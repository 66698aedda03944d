package com.blueprint.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while an idea is clarified or broken down.
 *
 * @param eventType event type (e.g. "clarification.answered", "breakdown.stage")
 * @param ideaId    the idea this event belongs to
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record BlueprintEvent(
    String eventType,
    String ideaId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public BlueprintEvent {
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }
}
