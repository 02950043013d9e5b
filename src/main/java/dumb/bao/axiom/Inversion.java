package dumb.bao.axiom;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import dumb.bao.Boundary;
import dumb.bao.Form;
import org.jetbrains.annotations.Nullable;

import java.util.List;

import static dumb.bao.Boundary.ROUND;
import static dumb.bao.Boundary.SQUARE;

/**
 * Inversion axiom: {@code ([A]) = A = [(A)]}.
 * Clarify removes a round-square (or square-round) pair, Enfold adds one.
 */
public final class Inversion {

    private Inversion() {
    }

    private static boolean invertiblePair(Boundary outer, Boundary inner) {
        return (outer == ROUND && inner == SQUARE) || (outer == SQUARE && inner == ROUND);
    }

    /** The sole child forming an invertible pair with {@code form}, if any. */
    public static @Nullable Form invertibleChild(Form form) {
        if (form.size() != 1) return null;
        var child = form.children.get(0);
        return invertiblePair(form.boundary, child.boundary) ? child : null;
    }

    public static boolean isClarifyApplicable(Form form) {
        return invertibleChild(form) != null;
    }

    /**
     * Strips both boundary layers, exposing clones of what was nested two levels down.
     * An empty result is void. When not applicable the result is a single fresh clone of the input.
     */
    public static List<Form> clarify(Form form) {
        var child = invertibleChild(form);
        if (child == null) return List.of(form.deepClone());
        return child.children.stream().map(Form::deepClone).toList();
    }

    /** Wraps clones of {@code forms} in a new pair; with no forms the pair is empty. */
    public static Form enfold(Variant variant, List<Form> forms) {
        var clones = forms.stream().map(Form::deepClone).toList();
        return Form.of(variant.outer, Form.of(variant.inner, clones));
    }

    public static Form enfold(Variant variant, Form... forms) {
        return enfold(variant, List.of(forms));
    }

    public static Form enfoldRoundSquare(Form form) {
        return enfold(Variant.FRAME, form);
    }

    public static Form enfoldSquareRound(Form form) {
        return enfold(Variant.MARK, form);
    }

    public enum Variant {
        /** {@code ([...])} */
        FRAME("frame", ROUND, SQUARE),
        /** {@code [(...)]} */
        MARK("mark", SQUARE, ROUND);

        private final String key;
        final Boundary outer, inner;

        Variant(String key, Boundary outer, Boundary inner) {
            this.key = key;
            this.outer = outer;
            this.inner = inner;
        }

        @JsonCreator
        public static Variant of(String key) {
            for (var v : values())
                if (v.key.equals(key)) return v;
            throw new IllegalArgumentException("Unknown enfold variant: " + key);
        }

        @JsonValue
        public String key() {
            return key;
        }
    }
}
