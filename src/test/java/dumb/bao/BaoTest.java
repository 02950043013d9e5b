package dumb.bao;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class BaoTest extends AbstractTest {

    private Game game;
    private ByteArrayOutputStream buffer;
    private Bao bao;

    @BeforeEach
    void setUp() throws Levels.LevelException {
        game = new Game();
        buffer = new ByteArrayOutputStream();
        bao = new Bao(game, Levels.builtin(), new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void freshIds() {
        var a = Bao.id("x_");
        var b = Bao.id("x_");
        assertTrue(a.startsWith("x_"));
        assertNotEquals(a, b);
    }

    @Test
    void solveFirstLevel() {
        bao.execute("levels");
        assertTrue(output().contains("level-01  First Unwrap"));
        bao.execute("load level-01");
        bao.execute("select " + game.forest().get(0).id);
        bao.execute("avail");
        assertTrue(output().contains("clarify: yes"), output());
        bao.execute("clarify");
        assertEquals(Game.Status.WON, game.status());
        assertTrue(output().contains("* Solved in 1 moves"), output());
        bao.execute("undo");
        assertEquals(Game.Status.PLAYING, game.status());
        bao.execute("redo");
        assertEquals(Game.Status.WON, game.status());
    }

    @Test
    void rejectionsArePrinted() {
        bao.execute("load level-01");
        bao.execute("cancel");
        assertTrue(output().contains("! This level disables reflection actions."), output());
        bao.execute("load nowhere");
        assertTrue(output().contains("! Unknown level: nowhere"));
        bao.execute("jump");
        assertTrue(output().contains("! Unknown command: jump"));
        bao.execute("clarify");
        assertTrue(output().contains("! " + Dispatcher.hint(Op.Key.CLARIFY)));
    }

    @Test
    void sandboxEditing() {
        bao.execute("load level-03");
        game.setSandbox(true);
        bao.execute("var  two words ");
        bao.execute("add square");
        assertForest("\"two words\" []", game.forest());
        bao.execute("parent " + game.forest().get(1).id);
        bao.execute("create");
        assertForest("\"two words\" [<>]", game.forest());
        bao.execute("add hexagon");
        assertTrue(output().contains("! add <round|square|angle>"));
    }

    @Test
    void runStopsAtQuit() throws IOException {
        bao.run(new BufferedReader(new StringReader("load level-03\ncreate\nquit\nreset\n")));
        assertEquals(Game.Status.WON, game.status());
        assertEquals(1, game.moves());
    }
}
