package dumb.bao;

import dumb.bao.axiom.Axiom;
import org.jetbrains.annotations.Nullable;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * A hydrated puzzle: live start and goal forests plus the operations it permits.
 * Empty allow-lists permit everything.
 */
public record Level(String id, String name, @Nullable String description, int difficulty,
                    List<Form> start, List<Form> goal, @Nullable Integer maxMoves,
                    Set<Axiom> allowedAxioms, Set<Op.Key> allowedOperations, List<String> hints) {
    public Level {
        requireNonNull(id);
        requireNonNull(name);
        start = List.copyOf(start);
        goal = List.copyOf(goal);
        allowedAxioms = allowedAxioms.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(allowedAxioms));
        allowedOperations = allowedOperations.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(allowedOperations));
        hints = hints == null ? List.of() : List.copyOf(hints);
    }

    /** An ad hoc level with no restrictions, e.g. for a sandbox or a test. */
    public static Level of(String id, List<Form> start, List<Form> goal) {
        return new Level(id, id, null, 1, start, goal, null, Set.of(), Set.of(), List.of());
    }

    public Level allow(Axiom... axioms) {
        return new Level(id, name, description, difficulty, start, goal, maxMoves, Set.of(axioms), allowedOperations, hints);
    }

    public Level allow(Op.Key... operations) {
        return new Level(id, name, description, difficulty, start, goal, maxMoves, allowedAxioms, Set.of(operations), hints);
    }
}
