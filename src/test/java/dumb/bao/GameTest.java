package dumb.bao;

import dumb.bao.Dispatcher.Outcome.Status;
import dumb.bao.axiom.Axiom;
import dumb.bao.axiom.Inversion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GameTest extends AbstractTest {

    private Game game;
    private List<GameEvent> events;

    @BeforeEach
    void setUp() {
        game = new Game();
        events = new ArrayList<>();
        game.events.on(GameEvent.LevelLoadedEvent.class, events::add);
        game.events.on(GameEvent.OperationAppliedEvent.class, events::add);
        game.events.on(GameEvent.OperationRejectedEvent.class, events::add);
        game.events.on(GameEvent.HistoryEvent.class, events::add);
        game.events.on(GameEvent.LevelWonEvent.class, events::add);
    }

    private Level unwrap() {
        return Level.of("unwrap", forest("([()])"), forest("()")).allow(Axiom.INVERSION);
    }

    @Test
    void idleRejectsOperations() {
        assertEquals(Game.Status.IDLE, game.status());
        var outcome = game.apply(new Op.Create(null, List.of()));
        assertEquals(Status.REJECTED, outcome.status());
        assertEquals(Game.LOAD_LEVEL_REASON, outcome.reason());
        assertTrue(game.forest().isEmpty());
    }

    @Test
    void loadClonesLevelForests() {
        var level = unwrap();
        game.load(level);
        assertEquals(Game.Status.PLAYING, game.status());
        assertForest("([()])", game.forest());
        assertNotEquals(level.start().get(0).id, game.forest().get(0).id);
        assertNotEquals(level.goal().get(0).id, game.goal().get(0).id);
        assertInstanceOf(GameEvent.LevelLoadedEvent.class, events.get(0));
    }

    @Test
    void eventForestsCarrySelectableIds() {
        game.load(Level.of("twice", forest("([([()])])"), forest("()")).allow(Axiom.INVERSION));
        var loaded = (GameEvent.LevelLoadedEvent) events.get(0);
        assertEquals(game.forest().get(0).id, loaded.forest().get(0).id);

        assertEquals(Status.CHANGED, game.apply(new Op.Clarify(loaded.forest().get(0).id)).status());
        var applied = (GameEvent.OperationAppliedEvent) events.get(1);
        assertForest("([()])", applied.forest());

        assertEquals(Status.CHANGED, game.apply(new Op.Clarify(applied.forest().get(0).id)).status());
        assertEquals(Game.Status.WON, game.status());
    }

    @Test
    void loadingSolvedLevelIsWon() {
        game.load(Level.of("done", forest("() a"), forest("a ()")));
        assertEquals(Game.Status.WON, game.status());
    }

    @Test
    void applyUndoRedo() {
        game.load(unwrap());
        var root = game.forest().get(0).id;
        game.toggleSelection(root);
        var outcome = game.apply(new Op.Clarify(root));

        assertTrue(outcome.isChanged());
        assertForest("()", game.forest());
        assertEquals(Game.Status.WON, game.status());
        assertEquals(1, game.moves());
        assertTrue(game.selection().isEmpty());
        assertTrue(game.history().canUndo());
        assertInstanceOf(GameEvent.LevelWonEvent.class, events.get(events.size() - 1));

        assertTrue(game.undo());
        assertForest("([()])", game.forest());
        assertEquals(Game.Status.PLAYING, game.status());
        assertEquals(0, game.moves());
        assertTrue(game.history().canRedo());

        assertTrue(game.redo());
        assertForest("()", game.forest());
        assertEquals(Game.Status.WON, game.status());
        assertFalse(game.redo());
    }

    @Test
    void newOperationClearsRedo() {
        game.load(Level.of("free", forest("a"), forest("b")));
        game.apply(new Op.Enfold(ids(game.forest().get(0)), Inversion.Variant.FRAME));
        game.undo();
        assertTrue(game.history().canRedo());
        game.apply(new Op.Enfold(ids(game.forest().get(0)), Inversion.Variant.MARK));
        assertFalse(game.history().canRedo());
        assertForest("[(a)]", game.forest());
    }

    @Test
    void rejectedOperationLeavesStateAlone() {
        game.load(unwrap());
        var before = game.forest();
        game.toggleSelection(before.get(0).id);
        var outcome = game.apply(new Op.Cancel(ids(before.get(0))));
        assertEquals(Status.REJECTED, outcome.status());
        assertSame(before, game.forest());
        assertEquals(0, game.moves());
        assertEquals(List.of(before.get(0).id), game.selection());
        var rejected = (GameEvent.OperationRejectedEvent) events.get(events.size() - 1);
        assertEquals("This level disables reflection actions.", rejected.reason());
    }

    @Test
    void sandboxOperationsNeedSandbox() {
        game.load(Level.of("free", forest(""), forest("x")));
        var add = new Op.AddVariable("x", null);
        assertEquals(Game.SANDBOX_REASON, game.apply(add).reason());
        game.setSandbox(true);
        assertTrue(game.apply(add).isChanged());
        assertEquals(Game.Status.WON, game.status());
    }

    @Test
    void selection() {
        game.load(unwrap());
        game.toggleSelection("a");
        game.toggleSelection("b");
        game.toggleSelection("a");
        assertEquals(List.of("b"), game.selection());
        game.selectParent("p");
        assertEquals("p", game.selectedParent());
        game.clearParentSelection();
        assertNull(game.selectedParent());
        game.clearSelection();
        assertTrue(game.selection().isEmpty());
    }

    @Test
    void resetRestoresStart() {
        game.load(unwrap());
        game.apply(new Op.Clarify(game.forest().get(0).id));
        game.reset();
        assertForest("([()])", game.forest());
        assertEquals(0, game.moves());
        assertFalse(game.history().canUndo());
        assertEquals(Game.Status.PLAYING, game.status());
    }

    @Test
    void previewCommitsNothing() {
        game.load(unwrap());
        var before = game.forest();
        assertTrue(game.preview(new Op.Clarify(before.get(0).id)).isChanged());
        assertSame(before, game.forest());
        assertEquals(0, game.moves());
    }

    @Test
    void historyLimit() {
        var bounded = new Game(2, false);
        bounded.load(Level.of("free", forest("a"), forest("b")));
        for (var i = 0; i < 4; i++)
            bounded.apply(new Op.Enfold(ids(bounded.forest().get(0)), Inversion.Variant.FRAME));
        assertEquals(2, bounded.history().undoDepth());
        assertTrue(bounded.undo());
        assertTrue(bounded.undo());
        assertFalse(bounded.undo());
    }

    @Test
    void listenerFailureDoesNotAbortOperation() {
        game.events.on(GameEvent.OperationAppliedEvent.class, e -> {
            throw new IllegalStateException("listener");
        });
        game.load(unwrap());
        assertTrue(game.apply(new Op.Clarify(game.forest().get(0).id)).isChanged());
        assertEquals(Game.Status.WON, game.status());
    }
}
