package dumb.bao.axiom;

import dumb.bao.Forest;
import dumb.bao.Form;
import dumb.bao.FormArbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AxiomPropertiesTest {

    @Provide
    Arbitrary<Form> forms() {
        return FormArbitraries.forms(3);
    }

    @Provide
    Arbitrary<Form> frames() {
        return FormArbitraries.frames(2);
    }

    @Property
    @Label("clarify undoes enfold")
    void clarifyAfterEnfold(@ForAll("forms") Form f, @ForAll Inversion.Variant variant) {
        assertTrue(Forest.equivalent(List.of(f), Inversion.clarify(Inversion.enfold(variant, f))));
    }

    @Property
    @Label("collect undoes disperse")
    void collectAfterDisperse(@ForAll("frames") Form frame) {
        assertTrue(Forest.equivalent(List.of(frame), Arrangement.collect(Arrangement.disperse(frame))));
    }

    @Property
    @Label("disperse yields one frame per square content")
    void disperseCount(@ForAll("frames") Form frame) {
        var square = Arrangement.squares(frame).get(0);
        assertEquals(square.size(), Arrangement.disperse(frame).size());
    }

    @Property
    @Label("cancel removes what create introduced")
    void cancelAfterCreate(@ForAll("forms") Form f) {
        assertTrue(Reflection.cancel(Reflection.create(f)).isEmpty());
    }

    @Property
    @Label("a form cancels against its reflection")
    void cancelReflection(@ForAll("forms") Form f) {
        assertTrue(Reflection.cancel(f, Reflection.reflect(f)).isEmpty());
    }

    @Property
    @Label("inapplicable rewrites return fresh equivalent clones")
    void noOpsAreClones(@ForAll("forms") Form f) {
        var clarified = Inversion.clarify(f);
        if (!Inversion.isClarifyApplicable(f)) {
            assertEquals(1, clarified.size());
            assertTrue(f.equivalent(clarified.get(0)));
            assertNotEquals(f.id, clarified.get(0).id);
        }
    }
}
