package dumb.bao;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;

import java.util.ArrayList;

/** Random Forms of bounded depth for property tests. */
public final class FormArbitraries {

    private FormArbitraries() {
    }

    public static Arbitrary<Form> atoms() {
        return Arbitraries.of("a", "b", "c", "x").map(Form::atom);
    }

    public static Arbitrary<Boundary> boundaries() {
        return Arbitraries.of(Boundary.ROUND, Boundary.SQUARE, Boundary.ANGLE);
    }

    public static Arbitrary<Form> forms(int depth) {
        Arbitrary<Form> empty = boundaries().map(b -> Form.of(b));
        if (depth <= 0) return Arbitraries.oneOf(atoms(), empty);
        Arbitrary<Form> nested = Combinators.combine(boundaries(), forms(depth - 1).list().ofMaxSize(3))
                .as((b, children) -> Form.of(b, children));
        return Arbitraries.oneOf(atoms(), empty, nested, nested);
    }

    /** {@code (context... [contents...])} with a non-empty square and no other square in the context. */
    public static Arbitrary<Form> frames(int depth) {
        var context = forms(depth).filter(f -> !f.is(Boundary.SQUARE)).list().ofMaxSize(2);
        var contents = forms(depth).list().ofMinSize(1).ofMaxSize(3);
        return Combinators.combine(context, contents).as((ctx, items) -> {
            var children = new ArrayList<>(ctx);
            children.add(Form.of(Boundary.SQUARE, items));
            return Form.of(Boundary.ROUND, children);
        });
    }
}
