package dumb.bao.axiom;

import dumb.bao.AbstractTest;
import dumb.bao.Forest;
import dumb.bao.Form;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReflectionTest extends AbstractTest {

    @Test
    void cancelPair() {
        assertTrue(Reflection.cancel(Form.round(), Form.angle(Form.round())).isEmpty());
        assertTrue(Reflection.cancel(forest("<(x [y])> ([y] x)")).isEmpty());
    }

    @Test
    void cancelEmptyAngle() {
        assertTrue(Reflection.cancel(Form.angle()).isEmpty());
        assertForest("a", Reflection.cancel(forest("a <>")));
    }

    @Test
    void cancelKeepsOthersInOrder() {
        var result = Reflection.cancel(forest("p a q <a> r"));
        assertEquals("p q r", Forest.notation(result));
    }

    @Test
    void cancelOnePairPerCall() {
        assertForest("b <b>", Reflection.cancel(forest("a <a> b <b>")));
    }

    @Test
    void angleWithSeveralChildrenIsNotAReflection() {
        var forms = forest("a <a b>");
        assertFalse(Reflection.isCancelApplicable(forms));
        var result = Reflection.cancel(forms);
        assertEquals(2, result.size());
        assertForest("a <a b>", result);
        assertNotEquals(forms.get(0).id, result.get(0).id);
        assertNotEquals(forms.get(1).id, result.get(1).id);
    }

    @Test
    void cancelPrefersPairOverEmptyAngle() {
        var pair = Reflection.findPair(forest("<> x <x>")).orElseThrow();
        assertFalse(pair.isVoid());
        assertEquals(2, pair.reflection());
        assertEquals(1, pair.base());
        assertForest("<>", Reflection.cancel(forest("<> x <x>")));
    }

    @Test
    void cancelWithoutPairClones() {
        var forms = forest("a <b>");
        assertFalse(Reflection.isCancelApplicable(forms));
        var result = Reflection.cancel(forms);
        assertForest("a <b>", result);
        assertNotEquals(forms.get(0).id, result.get(0).id);
    }

    @Test
    void create() {
        assertForest("<>", Reflection.create());
        assertForest("a b <a b>", Reflection.create(Form.atom("a"), Form.atom("b")));
        assertForm("<(x)>", Reflection.reflect(form("(x)")));
    }

    @Test
    void createThenCancelIsVoid() {
        for (var text : new String[]{"a", "(x [y])", "<>", "<a>"}) {
            assertTrue(Reflection.cancel(Reflection.create(form(text))).isEmpty(), text);
        }
        assertTrue(Reflection.cancel(Reflection.create(List.of())).isEmpty());
    }
}
