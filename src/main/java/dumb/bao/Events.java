package dumb.bao;

import dumb.bao.util.Log;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/** Listener registry keyed by event class. Delivery is synchronous, on the emitting thread. */
public class Events {
    final ConcurrentMap<Class<? extends GameEvent>, CopyOnWriteArrayList<Consumer<GameEvent>>> listeners = new ConcurrentHashMap<>();

    private static void exeSafe(Consumer<GameEvent> listener, GameEvent event) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            Log.error("Error processing listener for " + event.getEventType() + ": " + e.getMessage(), e);
        }
    }

    public <T extends GameEvent> void on(Class<T> eventType, Consumer<T> listener) {
        listeners.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(event -> listener.accept(eventType.cast(event)));
    }

    public void emit(GameEvent event) {
        listeners.getOrDefault(event.getClass(), new CopyOnWriteArrayList<>()).forEach(listener -> exeSafe(listener, event));
    }

    public void clear() {
        listeners.clear();
    }

    int count(Class<? extends GameEvent> eventType) {
        return listeners.getOrDefault(eventType, new CopyOnWriteArrayList<>()).size();
    }
}
