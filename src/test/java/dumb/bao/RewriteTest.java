package dumb.bao;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RewriteTest extends AbstractTest {

    @Test
    void locate() {
        var f = forest("(a [b]) c");
        var b = at(f, 0, 1, 0);
        var located = Rewrite.locate(f, b.id).orElseThrow();
        assertSame(b, located.node());
        assertSame(at(f, 0, 1), located.parent());
        assertNull(Rewrite.locate(f, f.get(1).id).orElseThrow().parentId());
        assertTrue(Rewrite.locate(f, "missing").isEmpty());
        assertEquals(2, Rewrite.locate(f, Set.of(b.id, f.get(1).id, "missing")).size());
    }

    @Test
    void singleRebuildsAncestorsOnly() {
        var f = forest("(x [a b]) (y)");
        var a = at(f, 0, 1, 0);
        var result = Rewrite.single(f, a.id, n -> List.of(Form.round(), Form.round())).orElseThrow();

        assertForest("(x [() () b]) (y)", result);
        assertEquals(f.get(0).id, result.get(0).id);
        assertEquals(at(f, 0, 1).id, at(result, 0, 1).id);
        assertSame(f.get(1), result.get(1));
        assertSame(at(f, 0, 0), at(result, 0, 0));
        assertSame(at(f, 0, 1, 1), at(result, 0, 1, 2));
        assertForest("(x [a b]) (y)", f);
    }

    @Test
    void singleRemovesAndNotFound() {
        var f = forest("(x) y");
        assertForest("y", Rewrite.single(f, f.get(0).id, n -> List.of()).orElseThrow());
        assertTrue(Rewrite.single(f, "missing", n -> List.of()).isEmpty());
    }

    @Test
    void siblingsSpliceAtFirstTarget() {
        var f = forest("p a q b r");
        var result = Rewrite.siblings(f, List.of(f.get(3).id, f.get(1).id), nodes -> List.of(Form.of(Boundary.ROUND, nodes))).orElseThrow();
        assertEquals("p (b a) q r", Forest.notation(result));
    }

    @Test
    void siblingsTransformSeesRequestOrder() {
        var f = forest("(a b c)");
        var seen = new ArrayList<String>();
        Rewrite.siblings(f, List.of(at(f, 0, 2).id, at(f, 0, 0).id), nodes -> {
            nodes.forEach(n -> seen.add(n.label));
            return nodes;
        });
        assertEquals(List.of("c", "a"), seen);
    }

    @Test
    void siblingsRequireSharedParent() {
        var f = forest("(a) b");
        assertTrue(Rewrite.siblings(f, List.of(at(f, 0, 0).id, f.get(1).id), n -> List.of()).isEmpty());
        assertTrue(Rewrite.siblings(f, List.of(f.get(1).id, "missing"), n -> List.of()).isEmpty());
        assertTrue(Rewrite.siblings(f, List.of(), n -> List.of()).isEmpty());
    }

    @Test
    void siblingsNested() {
        var f = forest("(x [a b])");
        var square = at(f, 0, 1);
        var result = Rewrite.siblings(f, List.of(at(f, 0, 1, 0).id, at(f, 0, 1, 1).id), n -> List.of()).orElseThrow();
        assertForest("(x [])", result);
        assertEquals(square.id, at(result, 0, 1).id);
    }

    @Test
    void add() {
        var f = forest("(x)");
        assertForest("(x) <>", Rewrite.add(f, null, List.of(Form.angle())).orElseThrow());
        assertForest("(x <>)", Rewrite.add(f, f.get(0).id, List.of(Form.angle())).orElseThrow());
        assertTrue(Rewrite.add(f, "missing", List.of(Form.angle())).isEmpty());
    }

    @Test
    void emptyResultDiffersFromNotModified() {
        var f = forest("()");
        var result = Rewrite.single(f, f.get(0).id, n -> List.of());
        assertTrue(result.isPresent());
        assertTrue(result.get().isEmpty());
    }
}
