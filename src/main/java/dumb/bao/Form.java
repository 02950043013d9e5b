package dumb.bao;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Immutable node of a boundary tree.
 * <p>
 * Identity is the {@link #id}: two nodes with the same structure are still distinct siblings, and
 * {@link #equals(Object)} is reference equality. Structural sameness is decided by {@link #signature()}.
 * Every constructor except {@link #withChildren(List)} allocates a fresh id.
 */
public final class Form {

    public static final String ID_PREFIX = "form_";

    private static final Pattern SAFE_LABEL_PATTERN = Pattern.compile("^[^\\s()\\[\\]<>\";]+$");

    public final String id;
    public final Boundary boundary;
    public final List<Form> children;
    public final @Nullable String label;

    private volatile String signatureCache;

    private Form(String id, Boundary boundary, List<Form> children, @Nullable String label) {
        this.id = requireNonNull(id);
        this.boundary = requireNonNull(boundary);
        this.label = label;
        this.children = distinct(children);
        if (boundary == Boundary.ATOM) {
            if (label == null || label.isEmpty())
                throw new IllegalArgumentException("Atom requires a non-empty label");
            if (!this.children.isEmpty())
                throw new IllegalArgumentException("Atom '" + label + "' cannot have children");
        } else if (label != null) {
            throw new IllegalArgumentException("Only atoms carry a label: " + boundary + " labelled '" + label + "'");
        }
    }

    /** Children are held once each by reference; structurally equal but distinct nodes are kept. */
    private static List<Form> distinct(List<Form> children) {
        requireNonNull(children);
        var seen = Collections.newSetFromMap(new IdentityHashMap<Form, Boolean>(children.size()));
        var list = new ArrayList<Form>(children.size());
        for (var c : children)
            if (seen.add(requireNonNull(c))) list.add(c);
        return Collections.unmodifiableList(list);
    }

    public static Form of(Boundary boundary, Form... children) {
        return of(boundary, List.of(children));
    }

    public static Form of(Boundary boundary, List<Form> children) {
        return new Form(Bao.id(ID_PREFIX), boundary, children, null);
    }

    public static Form round(Form... children) {
        return of(Boundary.ROUND, children);
    }

    public static Form square(Form... children) {
        return of(Boundary.SQUARE, children);
    }

    public static Form angle(Form... children) {
        return of(Boundary.ANGLE, children);
    }

    public static Form atom(String label) {
        return new Form(Bao.id(ID_PREFIX), Boundary.ATOM, List.of(), requireNonNull(label));
    }

    /** Same node identity holding a new child list; for path copying in the rewrite engine. */
    Form withChildren(List<Form> children) {
        return new Form(id, boundary, children, label);
    }

    public boolean is(Boundary b) {
        return boundary == b;
    }

    public int size() {
        return children.size();
    }

    /**
     * Rebuilds the whole subtree with fresh ids; the copy shares no node with this tree. A node
     * reachable along two paths is copied once per path.
     */
    public Form deepClone() {
        var stack = new ArrayDeque<Cloning>();
        stack.push(new Cloning(this));
        Form done = null;
        while (!stack.isEmpty()) {
            var top = stack.peek();
            if (top.copied.size() < top.source.children.size()) {
                stack.push(new Cloning(top.source.children.get(top.copied.size())));
                continue;
            }
            stack.pop();
            var copy = new Form(Bao.id(ID_PREFIX), top.source.boundary, top.copied, top.source.label);
            if (stack.isEmpty()) done = copy;
            else stack.peek().copied.add(copy);
        }
        return done;
    }

    /** A node being cloned, with the copies of its children made so far. */
    private static final class Cloning {
        final Form source;
        final List<Form> copied;

        Cloning(Form source) {
            this.source = source;
            this.copied = new ArrayList<>(source.children.size());
        }
    }

    /**
     * Order-invariant structural fingerprint: {@code boundary:label[sortedChildSignatures]}.
     * Ids are not part of it.
     */
    public String signature() {
        var s = signatureCache;
        if (s != null) return s;
        var stack = new ArrayDeque<Form>();
        stack.push(this);
        while (!stack.isEmpty()) {
            var f = stack.peek();
            if (f.signatureCache != null) {
                stack.pop();
                continue;
            }
            var pending = false;
            for (var c : f.children) {
                if (c.signatureCache == null) {
                    stack.push(c);
                    pending = true;
                }
            }
            if (pending) continue;
            stack.pop();
            f.signatureCache = f.boundary.key() + ':' + (f.label == null ? "" : f.label)
                    + f.children.stream().map(c -> c.signatureCache).sorted().collect(Collectors.joining(",", "[", "]"));
        }
        return signatureCache;
    }

    public boolean equivalent(Form other) {
        return this == other || signature().equals(other.signature());
    }

    /** Visits every node once, parents before their children. */
    public void traverse(Consumer<Form> visitor) {
        var stack = new ArrayDeque<Form>();
        stack.push(this);
        while (!stack.isEmpty()) {
            var f = stack.pop();
            visitor.accept(f);
            for (var i = f.children.size() - 1; i >= 0; i--) stack.push(f.children.get(i));
        }
    }

    public Set<String> ids() {
        var ids = new LinkedHashSet<String>();
        traverse(f -> ids.add(f.id));
        return ids;
    }

    public Optional<Form> find(String id) {
        var stack = new ArrayDeque<Form>();
        stack.push(this);
        while (!stack.isEmpty()) {
            var f = stack.pop();
            if (f.id.equals(id)) return Optional.of(f);
            f.children.forEach(stack::push);
        }
        return Optional.empty();
    }

    /** Bracket notation: {@code (x [a b])}, {@code <()>}, atoms as bare or quoted labels. */
    public String notation() {
        var sb = new StringBuilder();
        notation(sb, false);
        return sb.toString();
    }

    void notation(StringBuilder sb, boolean withIds) {
        if (boundary == Boundary.ATOM) {
            sb.append(quote(label));
        } else {
            sb.append(boundary.open);
            for (var i = 0; i < children.size(); i++) {
                if (i > 0) sb.append(' ');
                children.get(i).notation(sb, withIds);
            }
            sb.append(boundary.close);
        }
        if (withIds) sb.append('#').append(id);
    }

    static String quote(String label) {
        return SAFE_LABEL_PATTERN.matcher(label).matches() && label.indexOf('#') < 0
                ? label
                : '"' + label.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }

    @Override
    public String toString() {
        return "Form[" + id + ' ' + notation() + ']';
    }
}
