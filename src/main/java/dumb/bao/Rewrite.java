package dumb.bao;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Locating nodes in a forest and rebuilding it around a change by path copying.
 * <p>
 * Inputs are never mutated. Ancestors of a change keep their id but get a fresh child list;
 * untouched subtrees are shared by reference with the input. An empty {@link Optional}
 * means "not modified", which is distinct from a present but empty forest.
 */
public final class Rewrite {

    private Rewrite() {
    }

    /** Depth-first lookup; ids that are not present are simply absent from the result. */
    public static Map<String, Located> locate(List<Form> forest, Collection<String> ids) {
        var wanted = ids instanceof Set<String> s ? s : new LinkedHashSet<>(ids);
        var found = new HashMap<String, Located>();
        var stack = new ArrayDeque<Located>();
        for (var i = forest.size() - 1; i >= 0; i--) stack.push(new Located(forest.get(i), null));
        while (!stack.isEmpty() && found.size() < wanted.size()) {
            var current = stack.pop();
            if (wanted.contains(current.node().id)) found.put(current.node().id, current);
            var children = current.node().children;
            for (var i = children.size() - 1; i >= 0; i--) stack.push(new Located(children.get(i), current.node()));
        }
        return found;
    }

    public static Optional<Located> locate(List<Form> forest, String id) {
        return Optional.ofNullable(locate(forest, Set.of(id)).get(id));
    }

    /**
     * Replaces the node {@code targetId} by {@code transform}'s output, in place among its siblings,
     * rebuilding every ancestor on the way up.
     */
    public static Optional<List<Form>> single(List<Form> forest, String targetId, Function<Form, List<Form>> transform) {
        var parents = new IdentityHashMap<Form, Form>();
        Form target = null;
        var stack = new ArrayDeque<Form>(forest);
        while (!stack.isEmpty()) {
            var node = stack.pop();
            if (node.id.equals(targetId)) {
                target = node;
                break;
            }
            for (var c : node.children) {
                parents.put(c, node);
                stack.push(c);
            }
        }
        if (target == null) return Optional.empty();

        var current = target;
        var replacement = transform.apply(target);
        Form parent;
        while ((parent = parents.get(current)) != null) {
            replacement = List.of(parent.withChildren(splice(parent.children, current, replacement)));
            current = parent;
        }
        return Optional.of(splice(forest, current, replacement));
    }

    /**
     * Applies {@code transform} to the resolved siblings (in request order) and splices its output
     * where the first of them stood. Not modified unless every id resolves and all share one parent
     * (or are all roots).
     */
    public static Optional<List<Form>> siblings(List<Form> forest, Collection<String> targetIds, Function<List<Form>, List<Form>> transform) {
        var ids = new LinkedHashSet<>(targetIds);
        if (ids.isEmpty()) return Optional.empty();

        var located = locate(forest, ids);
        if (located.size() != ids.size()) return Optional.empty();

        if (!shareParent(located.values())) return Optional.empty();

        var nodes = ids.stream().map(id -> located.get(id).node()).toList();
        var parent = located.get(ids.iterator().next()).parent();
        var replacement = transform.apply(nodes);
        if (parent == null) return Optional.of(replace(forest, ids, replacement));
        return single(forest, parent.id, current -> List.of(current.withChildren(replace(current.children, ids, replacement))));
    }

    /** True when every entry has the same parent, counting the forest itself as one parent. */
    public static boolean shareParent(Collection<Located> entries) {
        return entries.stream().map(Located::parentKey).distinct().count() == 1;
    }

    /** Appends {@code additions} to the children of {@code parentId}, or to the roots when null. */
    public static Optional<List<Form>> add(List<Form> forest, @Nullable String parentId, List<Form> additions) {
        if (parentId == null) {
            var roots = new ArrayList<Form>(forest.size() + additions.size());
            roots.addAll(forest);
            roots.addAll(additions);
            return Optional.of(roots);
        }
        return single(forest, parentId, parent -> {
            var children = new ArrayList<Form>(parent.size() + additions.size());
            children.addAll(parent.children);
            children.addAll(additions);
            return List.of(parent.withChildren(children));
        });
    }

    private static List<Form> splice(List<Form> siblings, Form removed, List<Form> replacement) {
        var result = new ArrayList<Form>(siblings.size() - 1 + replacement.size());
        for (var s : siblings) {
            if (s == removed) result.addAll(replacement);
            else result.add(s);
        }
        return result;
    }

    private static List<Form> replace(List<Form> siblings, Set<String> removed, List<Form> replacement) {
        var result = new ArrayList<Form>(siblings.size() + replacement.size());
        var spliced = false;
        for (var s : siblings) {
            if (!removed.contains(s.id)) {
                result.add(s);
            } else if (!spliced) {
                result.addAll(replacement);
                spliced = true;
            }
        }
        if (!spliced) result.addAll(replacement);
        return result;
    }

    /** A node and its immediate parent, null for a root. */
    public record Located(Form node, @Nullable Form parent) {
        private static final String ROOT = "";

        public @Nullable String parentId() {
            return parent == null ? null : parent.id;
        }

        String parentKey() {
            return parent == null ? ROOT : parent.id;
        }
    }
}
