package com.example.spherecombat.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fan-out of {@link CombatEvent}s to registered listeners.
 * A failing listener is logged and skipped; it never disturbs the publisher.
 */
public class CombatEventBus {
    private static final Logger logger = LoggerFactory.getLogger(CombatEventBus.class);

    private final List<Consumer<CombatEvent>> listeners = new CopyOnWriteArrayList<>();

    public void subscribe(Consumer<CombatEvent> listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public boolean unsubscribe(Consumer<CombatEvent> listener) {
        return listeners.remove(listener);
    }

    public void publish(CombatEvent event) {
        for (Consumer<CombatEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                logger.warn("[CombatEventBus] Listener failed on {}: {}", event.getType(), e.getMessage(), e);
            }
        }
    }

    public void publish(CombatEventType type, long actorSerial, long otherSerial, String detail, long timestamp) {
        if (listeners.isEmpty()) return;
        publish(new CombatEvent(type, actorSerial, otherSerial, detail, timestamp));
    }

    public void publish(CombatEventType type, long actorSerial, long otherSerial, String detail,
                        long durationMs, long timestamp) {
        if (listeners.isEmpty()) return;
        publish(new CombatEvent(type, actorSerial, otherSerial, detail, durationMs, timestamp));
    }

    public int getListenerCount() {
        return listeners.size();
    }
}
