package dumb.bao;

import com.fasterxml.jackson.annotation.JsonInclude;
import dumb.bao.axiom.Arrangement;
import dumb.bao.axiom.Axiom;
import dumb.bao.axiom.Inversion;
import dumb.bao.axiom.Reflection;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Maps {@link Op}s onto the rewrite engine and the axioms under a level's allow-lists.
 * Pure: the input forest is never modified, so it also serves speculative previews.
 */
public class Dispatcher {

    static final String SELECTION_STALE_REASON = "Selected form is no longer available.";
    static final String PARENT_STALE_REASON = "Selected parent is no longer available.";
    static final String PARENT_MISMATCH_REASON = "Select sibling nodes that share the same parent.";
    static final String UNCHANGED_REASON = "That would not change anything.";
    static final String ATOM_PARENT_REASON = "Variables cannot contain other forms.";

    private final Set<Axiom> allowedAxioms;
    private final Set<Op.Key> allowedOperations;

    /** Empty allow-lists permit everything. */
    public Dispatcher(Set<Axiom> allowedAxioms, Set<Op.Key> allowedOperations) {
        this.allowedAxioms = allowedAxioms.isEmpty() ? EnumSet.allOf(Axiom.class) : EnumSet.copyOf(allowedAxioms);
        this.allowedOperations = allowedOperations.isEmpty() ? EnumSet.allOf(Op.Key.class) : EnumSet.copyOf(allowedOperations);
    }

    public Dispatcher() {
        this(Set.of(), Set.of());
    }

    public static Dispatcher of(Level level) {
        return new Dispatcher(level.allowedAxioms(), level.allowedOperations());
    }

    static String disabledReason(Axiom axiom) {
        return "This level disables " + axiom + " actions.";
    }

    static String disabledReason(Op.Key key) {
        return "This level disables the " + key + " operation.";
    }

    static String hint(Op.Key key) {
        return switch (key) {
            case CLARIFY -> "Select a round-square pair to clarify.";
            case ENFOLD_FRAME -> "Select sibling forms or choose a parent to add a frame.";
            case ENFOLD_MARK -> "Select sibling forms or choose a parent to add a mark.";
            case DISPERSE -> "Select contents inside a single square to disperse.";
            case COLLECT -> "Select round frames that share the same context to collect.";
            case CANCEL -> "Select a form and its reflection (or an empty angle) to cancel.";
            case CREATE -> "Choose a parent or template to create a reflection pair.";
            case ADD_ROUND, ADD_SQUARE, ADD_ANGLE -> "Select sibling forms or choose a parent to add a boundary.";
            case ADD_VARIABLE -> "Enter a non-empty variable name.";
        };
    }

    public boolean allows(Axiom axiom) {
        return allowedAxioms.contains(axiom);
    }

    public boolean allows(Op.Key key) {
        return key.axiom() == null || allowedOperations.contains(key);
    }

    /** The reason {@code op} is disabled by the allow-lists, or null when it is permitted. */
    public @Nullable String disabled(Op op) {
        var axiom = op.axiom();
        if (axiom == null) return null;
        if (!allows(axiom)) return disabledReason(axiom);
        if (!allows(op.key())) return disabledReason(op.key());
        return null;
    }

    public Outcome apply(List<Form> forest, Op op) {
        requireNonNull(forest);
        var reason = disabled(requireNonNull(op));
        if (reason != null) return Outcome.rejected(reason);

        Outcome result;
        if (op instanceof Op.Clarify o) result = clarify(forest, o);
        else if (op instanceof Op.Enfold o) result = enfold(forest, o);
        else if (op instanceof Op.Disperse o) result = disperse(forest, o);
        else if (op instanceof Op.Collect o) result = collect(forest, o);
        else if (op instanceof Op.Cancel o) result = cancel(forest, o);
        else if (op instanceof Op.Create o) result = create(forest, o);
        else if (op instanceof Op.AddBoundary o) result = addBoundary(forest, o);
        else if (op instanceof Op.AddVariable o) result = addVariable(forest, o);
        else throw new IllegalStateException("Unhandled operation: " + op);

        if (result.isChanged() && Forest.equivalent(result.forest(), forest))
            return Outcome.unchanged(UNCHANGED_REASON);
        return result;
    }

    private static Outcome of(Optional<List<Form>> attempt, Op.Key key) {
        return attempt.map(Outcome::changed).orElseGet(() -> Outcome.rejected(hint(key)));
    }

    private Outcome clarify(List<Form> forest, Op.Clarify op) {
        var attempt = Rewrite.single(forest, op.targetId(), Inversion::clarify);
        if (attempt.isEmpty()) return Outcome.rejected(SELECTION_STALE_REASON);
        if (!Forest.equivalent(attempt.get(), forest)) return Outcome.changed(attempt.get());

        // the child of an invertible pair stands for its parent
        var parent = Rewrite.locate(forest, op.targetId()).map(Rewrite.Located::parent).orElse(null);
        if (parent == null || !Inversion.isClarifyApplicable(parent)) return Outcome.rejected(hint(op.key()));
        return of(Rewrite.single(forest, parent.id, Inversion::clarify), op.key());
    }

    private Outcome enfold(List<Form> forest, Op.Enfold op) {
        if (op.targetIds().isEmpty()) {
            return add(forest, op.parentId(), List.of(Inversion.enfold(op.variant())));
        }
        return siblings(forest, op.targetIds(), nodes -> List.of(Inversion.enfold(op.variant(), nodes)), op.key());
    }

    private Outcome disperse(List<Form> forest, Op.Disperse op) {
        if (op.frameId() != null)
            return of(Rewrite.single(forest, op.frameId(), f -> Arrangement.disperse(f, op.squareId(), op.contentIds())), op.key());

        var ids = new LinkedHashSet<>(op.contentIds());
        if (ids.isEmpty()) return Outcome.rejected(hint(op.key()));
        var located = Rewrite.locate(forest, ids);
        if (located.size() != ids.size()) return Outcome.rejected(SELECTION_STALE_REASON);
        if (!Rewrite.shareParent(located.values())) return Outcome.rejected(PARENT_MISMATCH_REASON);

        var first = located.get(ids.iterator().next());
        if (ids.size() == 1 && first.node().is(Boundary.SQUARE) && first.parent() != null && Arrangement.isFrame(first.parent())) {
            // a selected square disperses all of its contents
            var square = first.node();
            return of(Rewrite.single(forest, first.parent().id, f -> Arrangement.disperse(f, square.id, null)), op.key());
        }

        var square = first.parent();
        if (square == null || !square.is(Boundary.SQUARE)) return Outcome.rejected(hint(op.key()));
        var frame = Rewrite.locate(forest, square.id).map(Rewrite.Located::parent).orElse(null);
        if (frame == null) return Outcome.rejected(hint(op.key()));
        return of(Rewrite.single(forest, frame.id, f -> Arrangement.disperse(f, square.id, op.contentIds())), op.key());
    }

    private Outcome collect(List<Form> forest, Op.Collect op) {
        var ids = new LinkedHashSet<>(op.targetIds());
        if (ids.isEmpty()) return Outcome.rejected(hint(op.key()));
        var located = Rewrite.locate(forest, ids);

        var frameIds = new LinkedHashSet<String>();
        var hints = new HashMap<String, String>();
        for (var id : ids) {
            var entry = located.get(id);
            if (entry == null) continue;
            if (entry.node().is(Boundary.ROUND)) {
                frameIds.add(id);
            } else if (entry.node().is(Boundary.SQUARE) && entry.parent() != null && entry.parent().is(Boundary.ROUND)) {
                // a selected square points at its enclosing frame and is tried first there
                hints.putIfAbsent(entry.parent().id, entry.node().signature());
            }
        }
        if (frameIds.isEmpty() && hints.isEmpty()) return Outcome.rejected(hint(op.key()));

        var ordered = new LinkedHashSet<String>();
        frameIds.stream().filter(hints::containsKey).forEach(ordered::add);
        hints.keySet().stream().filter(id -> !frameIds.contains(id)).forEach(ordered::add);
        ordered.addAll(frameIds);

        return siblings(forest, ordered, frames -> {
            var clones = new ArrayList<Form>(frames.size());
            for (var f : frames) {
                var hint = hints.get(f.id);
                clones.add(hint == null ? f.deepClone() : preferSquare(f, hint));
            }
            return Arrangement.collect(clones);
        }, op.key());
    }

    /** Clone of {@code frame} whose square children are reordered so the hinted one comes first. */
    private static Form preferSquare(Form frame, String squareSignature) {
        var squares = Arrangement.squares(frame);
        var preferred = squares.stream().filter(s -> s.signature().equals(squareSignature)).findFirst().orElse(null);
        if (preferred == null) return frame.deepClone();

        var order = new ArrayList<Form>(squares.size());
        order.add(preferred);
        squares.stream().filter(s -> s != preferred).forEach(order::add);

        var children = new ArrayList<Form>(frame.size());
        var next = 0;
        for (var c : frame.children)
            children.add((c.is(Boundary.SQUARE) ? order.get(next++) : c).deepClone());
        return Form.of(frame.boundary, children);
    }

    private Outcome cancel(List<Form> forest, Op.Cancel op) {
        var ids = withPartners(forest, op.targetIds());
        return siblings(forest, ids, forms -> Reflection.isCancelApplicable(forms) ? Reflection.cancel(forms) : forms, op.key());
    }

    /**
     * Completes a cancel selection with the missing side of a reflection pair among the same
     * siblings: a selected base brings an angle reflecting it, a selected single-child angle brings
     * a sibling matching that child.
     */
    static List<String> withPartners(List<Form> forest, List<String> targetIds) {
        var ids = new LinkedHashSet<>(targetIds);
        if (ids.isEmpty()) return List.copyOf(ids);
        var located = Rewrite.locate(forest, ids);
        if (located.size() != ids.size() || !Rewrite.shareParent(located.values())) return List.copyOf(ids);

        var parent = located.get(ids.iterator().next()).parent();
        var siblings = parent == null ? forest : parent.children;
        var augmented = new LinkedHashSet<>(ids);
        for (var id : ids) {
            var form = located.get(id).node();
            if (form.is(Boundary.ANGLE)) {
                if (form.size() != 1) continue;
                var inner = form.children.get(0).signature();
                siblings.stream()
                        .filter(s -> s != form && s.signature().equals(inner))
                        .findFirst()
                        .ifPresent(s -> augmented.add(s.id));
            } else {
                siblings.stream()
                        .filter(s -> s != form && s.is(Boundary.ANGLE) && s.size() == 1)
                        .filter(s -> s.children.get(0).signature().equals(form.signature()))
                        .findFirst()
                        .ifPresent(s -> augmented.add(s.id));
            }
        }
        return List.copyOf(augmented);
    }

    private Outcome create(List<Form> forest, Op.Create op) {
        var templates = new ArrayList<Form>();
        String inferredParent = null;
        var found = false;
        if (!op.templateIds().isEmpty()) {
            var located = Rewrite.locate(forest, op.templateIds());
            for (var id : new LinkedHashSet<>(op.templateIds())) {
                var match = located.get(id);
                if (match == null) continue;
                templates.add(match.node().deepClone());
                if (!found) {
                    inferredParent = match.parentId();
                    found = true;
                }
            }
        }
        var parentId = op.parentId() != null ? op.parentId() : inferredParent;
        return add(forest, parentId, Reflection.create(templates));
    }

    private Outcome addBoundary(List<Form> forest, Op.AddBoundary op) {
        if (op.targetIds().isEmpty()) {
            return add(forest, op.parentId(), List.of(Form.of(op.boundary())));
        }
        return siblings(forest, op.targetIds(), nodes -> List.of(Form.of(op.boundary(), nodes)), op.key());
    }

    private Outcome addVariable(List<Form> forest, Op.AddVariable op) {
        var label = op.label().trim();
        if (label.isEmpty()) return Outcome.rejected(hint(op.key()));
        return add(forest, op.parentId(), List.of(Form.atom(label)));
    }

    private static Outcome add(List<Form> forest, @Nullable String parentId, List<Form> additions) {
        if (parentId != null) {
            var parent = Rewrite.locate(forest, parentId);
            if (parent.isEmpty()) return Outcome.rejected(PARENT_STALE_REASON);
            if (parent.get().node().is(Boundary.ATOM)) return Outcome.rejected(ATOM_PARENT_REASON);
        }
        return Rewrite.add(forest, parentId, additions).map(Outcome::changed)
                .orElseGet(() -> Outcome.rejected(PARENT_STALE_REASON));
    }

    private static Outcome siblings(List<Form> forest, Collection<String> ids, Function<List<Form>, List<Form>> transform, Op.Key key) {
        var attempt = Rewrite.siblings(forest, ids, transform);
        if (attempt.isPresent()) return Outcome.changed(attempt.get());
        var unique = new LinkedHashSet<>(ids);
        var located = Rewrite.locate(forest, unique);
        if (located.size() != unique.size()) return Outcome.rejected(SELECTION_STALE_REASON);
        if (!located.isEmpty() && !Rewrite.shareParent(located.values())) return Outcome.rejected(PARENT_MISMATCH_REASON);
        return Outcome.rejected(hint(key));
    }

    /** Result of dispatching one operation; {@code reason} is advisory text for the UI. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Outcome(Status status, List<Form> forest, @Nullable String reason) {
        public Outcome {
            requireNonNull(status);
            forest = List.copyOf(forest);
        }

        static Outcome changed(List<Form> forest) {
            return new Outcome(Status.CHANGED, forest, null);
        }

        static Outcome unchanged(String reason) {
            return new Outcome(Status.UNCHANGED, List.of(), reason);
        }

        static Outcome rejected(String reason) {
            return new Outcome(Status.REJECTED, List.of(), reason);
        }

        public boolean isChanged() {
            return status == Status.CHANGED;
        }

        public enum Status {CHANGED, UNCHANGED, REJECTED}
    }
}
