package dumb.bao;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventsTest {

    @Test
    void deliversByExactType() {
        var events = new Events();
        var won = new ArrayList<GameEvent.LevelWonEvent>();
        events.on(GameEvent.LevelWonEvent.class, won::add);
        events.emit(new GameEvent.LevelWonEvent("l", 3));
        events.emit(new GameEvent.HistoryEvent(GameEvent.HistoryEvent.Direction.UNDO, List.of()));
        assertEquals(1, won.size());
        assertEquals(3, won.get(0).moves());
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        var events = new Events();
        var seen = new ArrayList<String>();
        events.on(GameEvent.LevelWonEvent.class, e -> {
            throw new IllegalStateException("boom");
        });
        events.on(GameEvent.LevelWonEvent.class, e -> seen.add(e.levelId()));
        events.emit(new GameEvent.LevelWonEvent("l", 1));
        assertEquals(List.of("l"), seen);
        assertEquals(2, events.count(GameEvent.LevelWonEvent.class));
        events.clear();
        assertEquals(0, events.count(GameEvent.LevelWonEvent.class));
    }

    @Test
    void eventJson() {
        var json = new GameEvent.LevelWonEvent("l", 2).toJson();
        assertEquals("LevelWonEvent", json.get("eventType").asText());
        assertEquals(2, json.get("moves").asInt());
    }
}
