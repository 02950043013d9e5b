package dumb.bao.axiom;

import dumb.bao.Boundary;
import dumb.bao.Forest;
import dumb.bao.Form;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Arrangement axiom: {@code (A [B C]) = (A [B])(A [C])}.
 * Disperse distributes a frame's square contents into separate frames sharing the context,
 * Collect merges frames with a common context back into one.
 * An empty square dominates: a frame around it is void.
 */
public final class Arrangement {

    private Arrangement() {
    }

    public static List<Form> squares(Form form) {
        return form.children.stream().filter(c -> c.is(Boundary.SQUARE)).toList();
    }

    /** A round with at least one square child. */
    public static boolean isFrame(Form form) {
        return form.is(Boundary.ROUND) && form.children.stream().anyMatch(c -> c.is(Boundary.SQUARE));
    }

    public static List<Form> disperse(Form form) {
        return disperse(form, null, null);
    }

    /**
     * @param squareId   square child to distribute; the first square when null
     * @param contentIds contents of that square to split off; all of them when null or empty
     * @return the distributed frames, empty when the target square is empty, or a single fresh clone
     * of {@code form} when the selection does not apply
     */
    public static List<Form> disperse(Form form, @Nullable String squareId, @Nullable Collection<String> contentIds) {
        if (!isFrame(form)) return noop(form);

        var frameSquares = squares(form);
        var target = squareId == null
                ? frameSquares.get(0)
                : frameSquares.stream().filter(s -> s.id.equals(squareId)).findFirst().orElse(null);
        if (target == null) return noop(form);

        if (target.children.isEmpty()) return List.of();

        var selection = partition(target.children, contentIds);
        if (selection == null) return noop(form);

        var context = form.children.stream().filter(c -> c != target).toList();
        var frames = new ArrayList<Form>(selection.picked().size() + 1);
        if (!selection.remaining().isEmpty())
            frames.add(frame(context, selection.remaining()));
        for (var content : selection.picked())
            frames.add(frame(context, List.of(content)));
        return frames;
    }

    /**
     * Splits {@code available} into the requested and the remaining contents. Null means any
     * requested id is unknown, which makes the whole selection inapplicable.
     */
    static @Nullable Partition partition(List<Form> available, @Nullable Collection<String> requestedIds) {
        if (requestedIds == null || requestedIds.isEmpty())
            return new Partition(available, List.of());

        var byId = new LinkedHashMap<String, Form>();
        available.forEach(f -> byId.put(f.id, f));

        var picked = new ArrayList<Form>();
        for (var id : new LinkedHashSet<>(requestedIds)) {
            var match = byId.remove(id);
            if (match == null) return null;
            picked.add(match);
        }
        return new Partition(picked, List.copyOf(byId.values()));
    }

    /** {@code (context... [contents...])}, everything cloned. */
    static Form frame(List<Form> context, List<Form> contents) {
        var children = new ArrayList<Form>(context.size() + 1);
        context.forEach(c -> children.add(c.deepClone()));
        children.add(Form.of(Boundary.SQUARE, contents.stream().map(Form::deepClone).toList()));
        return Form.of(Boundary.ROUND, children);
    }

    private static List<String> contextSignature(Form frame, Form square) {
        return Forest.signatures(frame.children.stream().filter(c -> c != square).toList());
    }

    /**
     * Finds a square in every frame such that all frames share the same context around it.
     * Candidate squares are taken from the first frame only, in child order.
     */
    public static Optional<CollectTarget> collectTarget(List<Form> forms) {
        if (forms.isEmpty()) return Optional.empty();
        var template = forms.get(0);
        if (!isFrame(template)) return Optional.empty();
        for (var candidate : squares(template)) {
            var target = attempt(candidate, forms);
            if (target != null) return Optional.of(target);
        }
        return Optional.empty();
    }

    private static @Nullable CollectTarget attempt(Form candidate, List<Form> frames) {
        if (candidate.children.isEmpty()) return null;

        var template = frames.get(0);
        var templateSignature = contextSignature(template, candidate);
        var matches = new ArrayList<Form>(frames.size());
        matches.add(candidate);
        for (var frame : frames.subList(1, frames.size())) {
            if (!isFrame(frame)) return null;
            var match = squares(frame).stream()
                    .filter(s -> !s.children.isEmpty())
                    .filter(s -> contextSignature(frame, s).equals(templateSignature))
                    .findFirst();
            if (match.isEmpty()) return null;
            matches.add(match.get());
        }
        var context = template.children.stream().filter(c -> c != candidate).toList();
        return new CollectTarget(context, matches);
    }

    public static boolean isCollectApplicable(List<Form> forms) {
        return collectTarget(forms).isPresent();
    }

    /**
     * Merges frames sharing a context into {@code (context [all contents])}. When no common
     * context exists the result is fresh clones of every input.
     */
    public static List<Form> collect(List<Form> forms) {
        var target = collectTarget(forms);
        if (target.isEmpty()) return Forest.deepClone(forms);

        var contents = target.get().contents().toList();
        if (contents.isEmpty()) return List.of();

        return List.of(frame(target.get().context(), contents));
    }

    public static List<Form> collect(Form... forms) {
        return collect(List.of(forms));
    }

    private static List<Form> noop(Form form) {
        return List.of(form.deepClone());
    }

    record Partition(List<Form> picked, List<Form> remaining) {
    }

    /**
     * @param context the first frame's children other than its matched square
     * @param squares one matched square per input frame, in input order
     */
    public record CollectTarget(List<Form> context, List<Form> squares) {
        public CollectTarget {
            context = List.copyOf(context);
            squares = List.copyOf(squares);
        }

        public Stream<Form> contents() {
            return squares.stream().flatMap(s -> s.children.stream());
        }
    }
}
