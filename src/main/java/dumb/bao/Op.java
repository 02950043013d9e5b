package dumb.bao;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonValue;
import dumb.bao.axiom.Axiom;
import dumb.bao.axiom.Inversion;
import org.jetbrains.annotations.Nullable;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A user-requested operation. Fields identify targets by id only; the dispatcher resolves them
 * against the current forest.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Op.Clarify.class, name = "clarify"),
        @JsonSubTypes.Type(value = Op.Enfold.class, name = "enfold"),
        @JsonSubTypes.Type(value = Op.Disperse.class, name = "disperse"),
        @JsonSubTypes.Type(value = Op.Collect.class, name = "collect"),
        @JsonSubTypes.Type(value = Op.Cancel.class, name = "cancel"),
        @JsonSubTypes.Type(value = Op.Create.class, name = "create"),
        @JsonSubTypes.Type(value = Op.AddBoundary.class, name = "addBoundary"),
        @JsonSubTypes.Type(value = Op.AddVariable.class, name = "addVariable")
})
@JsonInclude(JsonInclude.Include.NON_NULL)
public sealed interface Op permits Op.Clarify, Op.Enfold, Op.Disperse, Op.Collect, Op.Cancel, Op.Create, Op.AddBoundary, Op.AddVariable {

    @JsonIgnore
    Key key();

    @JsonIgnore
    default @Nullable Axiom axiom() {
        return key().axiom;
    }

    /** Free editing outside the axioms; bypasses level allow-lists but needs sandbox mode. */
    @JsonIgnore
    default boolean sandbox() {
        return key().axiom == null;
    }

    private static List<String> ids(@Nullable List<String> ids) {
        return ids == null ? List.of() : List.copyOf(ids);
    }

    record Clarify(String targetId) implements Op {
        public Clarify {
            requireNonNull(targetId);
        }

        @Override
        public Key key() {
            return Key.CLARIFY;
        }
    }

    record Enfold(List<String> targetIds, Inversion.Variant variant, @Nullable String parentId) implements Op {
        public Enfold {
            targetIds = ids(targetIds);
            if (variant == null) variant = Inversion.Variant.FRAME;
        }

        public Enfold(List<String> targetIds, Inversion.Variant variant) {
            this(targetIds, variant, null);
        }

        @Override
        public Key key() {
            return variant == Inversion.Variant.MARK ? Key.ENFOLD_MARK : Key.ENFOLD_FRAME;
        }
    }

    record Disperse(List<String> contentIds, @Nullable String squareId, @Nullable String frameId) implements Op {
        public Disperse {
            contentIds = ids(contentIds);
        }

        public Disperse(List<String> contentIds) {
            this(contentIds, null, null);
        }

        @Override
        public Key key() {
            return Key.DISPERSE;
        }
    }

    record Collect(List<String> targetIds) implements Op {
        public Collect {
            targetIds = ids(targetIds);
        }

        @Override
        public Key key() {
            return Key.COLLECT;
        }
    }

    record Cancel(List<String> targetIds) implements Op {
        public Cancel {
            targetIds = ids(targetIds);
        }

        @Override
        public Key key() {
            return Key.CANCEL;
        }
    }

    record Create(@Nullable String parentId, List<String> templateIds) implements Op {
        public Create {
            templateIds = ids(templateIds);
        }

        @Override
        public Key key() {
            return Key.CREATE;
        }
    }

    record AddBoundary(List<String> targetIds, Boundary boundary, @Nullable String parentId) implements Op {
        public AddBoundary {
            targetIds = ids(targetIds);
            requireNonNull(boundary);
            if (boundary == Boundary.ATOM)
                throw new IllegalArgumentException("Atoms are added as variables, not boundaries");
        }

        @Override
        public Key key() {
            return switch (boundary) {
                case SQUARE -> Key.ADD_SQUARE;
                case ANGLE -> Key.ADD_ANGLE;
                default -> Key.ADD_ROUND;
            };
        }
    }

    record AddVariable(String label, @Nullable String parentId) implements Op {
        public AddVariable {
            requireNonNull(label);
        }

        @Override
        public Key key() {
            return Key.ADD_VARIABLE;
        }
    }

    /** Operation keys as named by level allow-lists. */
    enum Key {
        CLARIFY("clarify", Axiom.INVERSION),
        ENFOLD_FRAME("enfoldFrame", Axiom.INVERSION),
        ENFOLD_MARK("enfoldMark", Axiom.INVERSION),
        DISPERSE("disperse", Axiom.ARRANGEMENT),
        COLLECT("collect", Axiom.ARRANGEMENT),
        CANCEL("cancel", Axiom.REFLECTION),
        CREATE("create", Axiom.REFLECTION),
        ADD_ROUND("addRound", null),
        ADD_SQUARE("addSquare", null),
        ADD_ANGLE("addAngle", null),
        ADD_VARIABLE("addVariable", null);

        /** The seven axiom operations, in panel order. */
        public static final List<Key> PUZZLE = List.of(CLARIFY, ENFOLD_FRAME, ENFOLD_MARK, DISPERSE, COLLECT, CANCEL, CREATE);

        private final String key;
        final @Nullable Axiom axiom;

        Key(String key, @Nullable Axiom axiom) {
            this.key = key;
            this.axiom = axiom;
        }

        @JsonCreator
        public static Key of(String key) {
            for (var k : values())
                if (k.key.equals(key)) return k;
            throw new IllegalArgumentException("Unknown operation: " + key);
        }

        public @Nullable Axiom axiom() {
            return axiom;
        }

        @JsonValue
        public String key() {
            return key;
        }

        @Override
        public String toString() {
            return key;
        }
    }
}
