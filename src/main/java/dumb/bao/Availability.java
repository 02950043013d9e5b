package dumb.bao;

import com.fasterxml.jackson.annotation.JsonInclude;
import dumb.bao.axiom.Axiom;
import dumb.bao.axiom.Inversion;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Whether each puzzle operation can currently do something, and if not, why.
 * Decided by dry runs through the {@link Dispatcher}; nothing is committed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Availability(boolean available, @Nullable String reason) {

    static final Availability AVAILABLE = new Availability(true, null);

    static Availability unavailable(String reason) {
        return new Availability(false, reason);
    }

    public static Map<Op.Key, Availability> evaluate(Game.Status status, List<Form> forest, List<String> selection,
                                                     @Nullable String parentId, Dispatcher dispatcher) {
        var map = new EnumMap<Op.Key, Availability>(Op.Key.class);
        if (status == Game.Status.IDLE) {
            for (var key : Op.Key.PUZZLE) map.put(key, unavailable(Game.LOAD_LEVEL_REASON));
            return Collections.unmodifiableMap(map);
        }
        new Evaluation(forest, selection, parentId, dispatcher, map).run();
        return Collections.unmodifiableMap(map);
    }

    private static final class Evaluation {
        private final List<Form> forest;
        private final List<String> selection;
        private final @Nullable String parentId;
        private final Dispatcher dispatcher;
        private final Map<Op.Key, Availability> map;
        private final Map<String, Rewrite.Located> index;

        Evaluation(List<Form> forest, List<String> selection, @Nullable String parentId, Dispatcher dispatcher,
                   Map<Op.Key, Availability> map) {
            this.forest = forest;
            this.selection = List.copyOf(new LinkedHashSet<>(selection));
            this.parentId = parentId;
            this.dispatcher = dispatcher;
            this.map = map;
            var wanted = new LinkedHashSet<>(this.selection);
            if (parentId != null) wanted.add(parentId);
            this.index = Rewrite.locate(forest, wanted);
        }

        void run() {
            for (var key : Op.Key.PUZZLE) map.put(key, unavailable(Dispatcher.hint(key)));

            if (!guardAxiom(Op.Key.CLARIFY)) clarify();

            for (var variant : Inversion.Variant.values()) {
                var key = variant == Inversion.Variant.MARK ? Op.Key.ENFOLD_MARK : Op.Key.ENFOLD_FRAME;
                if (!guardAxiom(key) && !guardParent(key) && !guardSiblings(key))
                    preview(key, new Op.Enfold(selection, variant, parentId));
            }

            if (!guardAxiom(Op.Key.DISPERSE) && !guardParent(Op.Key.DISPERSE))
                preview(Op.Key.DISPERSE, new Op.Disperse(selection, null, parentId));

            if (!guardAxiom(Op.Key.COLLECT)) {
                var hasFrame = selection.stream().map(index::get)
                        .anyMatch(e -> e != null && e.node().is(Boundary.ROUND));
                if (hasFrame) preview(Op.Key.COLLECT, new Op.Collect(selection));
            }

            if (!guardAxiom(Op.Key.CANCEL)) preview(Op.Key.CANCEL, new Op.Cancel(selection));

            if (!guardAxiom(Op.Key.CREATE) && !guardParent(Op.Key.CREATE))
                preview(Op.Key.CREATE, new Op.Create(parentId, selection));
        }

        private void clarify() {
            if (selection.isEmpty()) return;
            var target = index.get(selection.get(0));
            if (target == null) {
                map.put(Op.Key.CLARIFY, unavailable(Dispatcher.SELECTION_STALE_REASON));
                return;
            }
            preview(Op.Key.CLARIFY, new Op.Clarify(target.node().id));
        }

        private void preview(Op.Key key, Op op) {
            var outcome = dispatcher.apply(forest, op);
            if (outcome.isChanged()) map.put(key, AVAILABLE);
        }

        private boolean guardAxiom(Op.Key key) {
            Axiom axiom = key.axiom();
            if (axiom != null && !dispatcher.allows(axiom)) {
                map.put(key, unavailable(Dispatcher.disabledReason(axiom)));
                return true;
            }
            if (!dispatcher.allows(key)) {
                map.put(key, unavailable(Dispatcher.disabledReason(key)));
                return true;
            }
            return false;
        }

        private boolean guardParent(Op.Key key) {
            if (parentId == null || index.containsKey(parentId)) return false;
            map.put(key, unavailable(Dispatcher.PARENT_STALE_REASON));
            return true;
        }

        private boolean guardSiblings(Op.Key key) {
            if (selection.isEmpty()) return false;
            var entries = selection.stream().map(index::get).toList();
            if (entries.contains(null)) {
                map.put(key, unavailable(Dispatcher.SELECTION_STALE_REASON));
                return true;
            }
            if (!Rewrite.shareParent(entries)) {
                map.put(key, unavailable(Dispatcher.PARENT_MISMATCH_REASON));
                return true;
            }
            return false;
        }
    }
}
