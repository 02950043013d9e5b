package dumb.bao;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.bao.util.Json;

import java.util.List;

import static java.util.Objects.requireNonNull;

/** Notifications emitted by a {@link Game} after its state changes. */
public interface GameEvent {

    default JsonNode toJson() {
        return Json.node(this);
    }

    String getEventType();

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record LevelLoadedEvent(String levelId, List<Form> forest, Game.Status status) implements GameEvent {
        public LevelLoadedEvent {
            requireNonNull(levelId);
            forest = List.copyOf(forest);
            requireNonNull(status);
        }

        @Override
        public String getEventType() {
            return "LevelLoadedEvent";
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record OperationAppliedEvent(Op op, List<Form> forest, int moves) implements GameEvent {
        public OperationAppliedEvent {
            requireNonNull(op);
            forest = List.copyOf(forest);
        }

        @Override
        public String getEventType() {
            return "OperationAppliedEvent";
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record OperationRejectedEvent(Op op, Dispatcher.Outcome.Status status, String reason) implements GameEvent {
        public OperationRejectedEvent {
            requireNonNull(op);
            requireNonNull(status);
            requireNonNull(reason);
        }

        @Override
        public String getEventType() {
            return "OperationRejectedEvent";
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record HistoryEvent(Direction direction, List<Form> forest) implements GameEvent {
        public HistoryEvent {
            requireNonNull(direction);
            forest = List.copyOf(forest);
        }

        @Override
        public String getEventType() {
            return "HistoryEvent";
        }

        public enum Direction {UNDO, REDO}
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record LevelWonEvent(String levelId, int moves) implements GameEvent {
        public LevelWonEvent {
            requireNonNull(levelId);
        }

        @Override
        public String getEventType() {
            return "LevelWonEvent";
        }
    }
}
