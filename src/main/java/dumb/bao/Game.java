package dumb.bao;

import dumb.bao.util.Log;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static dumb.bao.util.Log.message;
import static java.util.Objects.requireNonNull;

/**
 * Mutable play session over one level: the current forest, selection, history and win state.
 * Forms are immutable, so the forest handed out and carried by events is the live one and its ids
 * are the ones to select.
 */
public class Game {

    static final String LOAD_LEVEL_REASON = "Load a level to use axiom actions.";
    static final String SANDBOX_REASON = "Enable sandbox mode to edit forms freely.";

    public final Events events = new Events();

    private final History history;

    private @Nullable Level level;
    private Dispatcher dispatcher = new Dispatcher();
    private List<Form> current = List.of();
    private List<Form> goal = List.of();
    private Status status = Status.IDLE;
    private final LinkedHashSet<String> selection = new LinkedHashSet<>();
    private @Nullable String selectedParent;
    private boolean sandbox;
    private int moves;

    public Game(int historyLimit, boolean sandbox) {
        this.history = new History(historyLimit);
        this.sandbox = sandbox;
    }

    public Game() {
        this(0, false);
    }

    public static Game of(Configuration config) {
        return new Game(config.historyLimit(), config.sandbox());
    }

    public void load(Level level) {
        this.level = requireNonNull(level);
        this.dispatcher = Dispatcher.of(level);
        this.goal = Forest.deepClone(level.goal());
        restart(level.start());
        message("Loaded level " + level.id() + " (" + level.name() + ")" + (status == Status.WON ? ", already solved" : ""));
        events.emit(new GameEvent.LevelLoadedEvent(level.id(), current, status));
    }

    /** Restores the level's start forest and clears history, selection and moves. */
    public void reset() {
        if (level == null) return;
        restart(level.start());
        message("Reset level " + level.id());
        events.emit(new GameEvent.LevelLoadedEvent(level.id(), current, status));
    }

    private void restart(List<Form> start) {
        current = List.copyOf(Forest.deepClone(start));
        history.clear();
        moves = 0;
        clearSelections();
        status = Forest.solves(current, goal) ? Status.WON : Status.PLAYING;
    }

    /** Dispatches {@code op} against the current forest and commits it when it changes something. */
    public Dispatcher.Outcome apply(Op op) {
        var outcome = preview(op);
        if (!outcome.isChanged()) {
            Log.debug("Rejected " + op.key() + ": " + outcome.reason());
            events.emit(new GameEvent.OperationRejectedEvent(op, outcome.status(), outcome.reason()));
            return outcome;
        }

        history.commit(current);
        current = outcome.forest();
        moves++;
        clearSelections();
        Log.debug("Applied " + op.key() + " -> " + Forest.notation(current));
        events.emit(new GameEvent.OperationAppliedEvent(op, current, moves));
        checkWin();
        return outcome;
    }

    /** What {@link #apply} would produce, with nothing committed. */
    public Dispatcher.Outcome preview(Op op) {
        requireNonNull(op);
        if (status == Status.IDLE) return Dispatcher.Outcome.rejected(LOAD_LEVEL_REASON);
        if (op.sandbox() && !sandbox) return Dispatcher.Outcome.rejected(SANDBOX_REASON);
        return dispatcher.apply(current, op);
    }

    public boolean undo() {
        var previous = history.undo(current);
        if (previous.isEmpty()) return false;
        current = List.copyOf(previous.get());
        moves = Math.max(0, moves - 1);
        return afterHistory(GameEvent.HistoryEvent.Direction.UNDO);
    }

    public boolean redo() {
        var next = history.redo(current);
        if (next.isEmpty()) return false;
        current = List.copyOf(next.get());
        moves++;
        return afterHistory(GameEvent.HistoryEvent.Direction.REDO);
    }

    private boolean afterHistory(GameEvent.HistoryEvent.Direction direction) {
        clearSelections();
        status = Status.PLAYING;
        message(direction + " -> " + Forest.notation(current));
        events.emit(new GameEvent.HistoryEvent(direction, current));
        checkWin();
        return true;
    }

    private void checkWin() {
        if (!Forest.solves(current, goal)) {
            status = Status.PLAYING;
            return;
        }
        status = Status.WON;
        var id = level == null ? "" : level.id();
        message("Level " + id + " solved in " + moves + " moves");
        events.emit(new GameEvent.LevelWonEvent(id, moves));
    }

    public void toggleSelection(String id) {
        if (!selection.remove(requireNonNull(id))) selection.add(id);
    }

    public void select(String... ids) {
        selection.clear();
        for (var id : ids) selection.add(requireNonNull(id));
    }

    public void clearSelection() {
        selection.clear();
    }

    /** Chooses the parent for insertions; null selects the root. */
    public void selectParent(@Nullable String id) {
        selectedParent = id;
    }

    public void clearParentSelection() {
        selectedParent = null;
    }

    private void clearSelections() {
        selection.clear();
        selectedParent = null;
    }

    public Map<Op.Key, Availability> availability() {
        return Availability.evaluate(status, current, selection(), selectedParent, dispatcher);
    }

    public void setSandbox(boolean sandbox) {
        this.sandbox = sandbox;
    }

    public boolean sandbox() {
        return sandbox;
    }

    /** The current forest; its ids are valid for selection until the next change. */
    public List<Form> forest() {
        return current;
    }

    public List<Form> goal() {
        return Forest.deepClone(goal);
    }

    public Status status() {
        return status;
    }

    public @Nullable Level level() {
        return level;
    }

    public List<String> selection() {
        return List.copyOf(selection);
    }

    public @Nullable String selectedParent() {
        return selectedParent;
    }

    public int moves() {
        return moves;
    }

    public History history() {
        return history;
    }

    public enum Status {IDLE, PLAYING, WON}
}
