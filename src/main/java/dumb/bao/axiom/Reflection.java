package dumb.bao.axiom;

import dumb.bao.Boundary;
import dumb.bao.Forest;
import dumb.bao.Form;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reflection axiom: {@code A <A> = void}.
 * Cancel removes a form together with a reflection of it, Create introduces such a pair.
 */
public final class Reflection {

    private Reflection() {
    }

    /** {@code <A>}, wrapping a clone of {@code form}. */
    public static Form reflect(Form form) {
        return Form.angle(form.deepClone());
    }

    /**
     * Locates one cancellation among sibling forms. Angles with a single child are scanned in order
     * for another position carrying that child's signature; only when no such pair exists does the
     * first empty angle cancel on its own.
     */
    public static Optional<Pair> findPair(List<Form> forms) {
        var signatures = forms.stream().map(Form::signature).toList();
        var empty = -1;
        for (var r = 0; r < forms.size(); r++) {
            var reflection = forms.get(r);
            if (!reflection.is(Boundary.ANGLE)) continue;
            if (reflection.children.isEmpty()) {
                if (empty < 0) empty = r;
                continue;
            }
            if (reflection.size() != 1) continue;
            var inner = reflection.children.get(0).signature();
            for (var b = 0; b < forms.size(); b++) {
                if (b != r && signatures.get(b).equals(inner)) return Optional.of(new Pair(r, b));
            }
        }
        return empty < 0 ? Optional.empty() : Optional.of(new Pair(empty, -1));
    }

    public static boolean isCancelApplicable(List<Form> forms) {
        return findPair(forms).isPresent();
    }

    /**
     * Removes one reflection pair and returns clones of the survivors in their original order.
     * Without any pair the result is fresh clones of every input.
     */
    public static List<Form> cancel(List<Form> forms) {
        var found = findPair(forms);
        if (found.isEmpty()) return Forest.deepClone(forms);

        var pair = found.get();
        var survivors = new ArrayList<Form>(forms.size());
        for (var i = 0; i < forms.size(); i++) {
            if (i != pair.base() && i != pair.reflection()) survivors.add(forms.get(i).deepClone());
        }
        return survivors;
    }

    public static List<Form> cancel(Form... forms) {
        return cancel(List.of(forms));
    }

    /**
     * With no templates, a lone empty angle. Otherwise clones of each template followed by one
     * angle holding further clones of all of them.
     */
    public static List<Form> create(List<Form> templates) {
        if (templates.isEmpty()) return List.of(Form.angle());
        var created = new ArrayList<Form>(templates.size() + 1);
        templates.forEach(t -> created.add(t.deepClone()));
        created.add(Form.of(Boundary.ANGLE, templates.stream().map(Form::deepClone).toList()));
        return created;
    }

    public static List<Form> create(Form... templates) {
        return create(List.of(templates));
    }

    /**
     * @param reflection index of the angle
     * @param base       index of the partner, or -1 for a self-cancelling empty angle
     */
    public record Pair(int reflection, int base) {
        public boolean isVoid() {
            return base < 0;
        }
    }
}
