package dumb.bao;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Undo and redo stacks of forest snapshots. Snapshots are deep clones on the way in and out,
 * so nothing stored here aliases a live forest.
 */
public class History {

    private final Deque<List<Form>> past = new ArrayDeque<>();
    private final Deque<List<Form>> future = new ArrayDeque<>();

    /** Maximum undo depth; 0 is unbounded. */
    private final int limit;

    public History(int limit) {
        if (limit < 0) throw new IllegalArgumentException("History limit must be >= 0: " + limit);
        this.limit = limit;
    }

    public History() {
        this(0);
    }

    /** Records the forest that a committed operation replaced; invalidates redo. */
    public void commit(List<Form> previous) {
        push(past, previous);
        future.clear();
    }

    /** Swaps {@code current} for the latest past snapshot. */
    public Optional<List<Form>> undo(List<Form> current) {
        if (past.isEmpty()) return Optional.empty();
        var previous = past.pop();
        future.push(Forest.deepClone(current));
        return Optional.of(Forest.deepClone(previous));
    }

    /** Swaps {@code current} for the earliest future snapshot. */
    public Optional<List<Form>> redo(List<Form> current) {
        if (future.isEmpty()) return Optional.empty();
        var next = future.pop();
        push(past, current);
        return Optional.of(Forest.deepClone(next));
    }

    private void push(Deque<List<Form>> stack, List<Form> forest) {
        stack.push(Forest.deepClone(forest));
        if (limit > 0)
            while (stack.size() > limit) stack.removeLast();
    }

    public void clear() {
        past.clear();
        future.clear();
    }

    public boolean canUndo() {
        return !past.isEmpty();
    }

    public boolean canRedo() {
        return !future.isEmpty();
    }

    public int undoDepth() {
        return past.size();
    }

    public int redoDepth() {
        return future.size();
    }
}
