package dumb.bao;

import dumb.bao.axiom.Inversion;
import dumb.bao.util.Log;
import org.jetbrains.annotations.Nullable;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static dumb.bao.util.Log.error;

/** Entry point: a line-oriented console over a {@link Game}. */
public class Bao {

    public static final AtomicLong id = new AtomicLong(System.currentTimeMillis());

    private final Game game;
    private final List<Level> levels;
    private final PrintStream out;

    public Bao(Game game, List<Level> levels, PrintStream out) {
        this.game = game;
        this.levels = List.copyOf(levels);
        this.out = out;
        game.events.on(GameEvent.OperationRejectedEvent.class, e -> out.println("! " + e.reason()));
        game.events.on(GameEvent.LevelWonEvent.class, e -> out.println("* Solved in " + e.moves() + " moves"));
    }

    public static String id(String prefix) {
        return prefix + id.incrementAndGet();
    }

    public static void main(String[] args) {
        Path configFile = null;
        String levelId = null;
        var sandbox = false;

        for (var i = 0; i < args.length; i++) {
            try {
                switch (args[i]) {
                    case "-c", "--config" -> configFile = Path.of(args[++i]);
                    case "-l", "--level" -> levelId = args[++i];
                    case "--sandbox" -> sandbox = true;
                    default -> Log.warning("Unknown option: " + args[i]);
                }
            } catch (ArrayIndexOutOfBoundsException e) {
                error("Missing value for " + args[i - 1]);
                printUsageAndExit();
            }
        }

        try {
            var config = Configuration.load(configFile);
            if (sandbox) config = config.withSandbox(true);
            var bao = new Bao(Game.of(config), Levels.resource(config.levels()), System.out);
            if (levelId != null) bao.execute("load " + levelId);
            bao.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        } catch (IOException | Levels.LevelException e) {
            error("Startup failed: " + e.getMessage(), e);
            System.exit(1);
        }
    }

    private static void printUsageAndExit() {
        System.err.println("Usage: java -jar bao.jar [-c|--config <file>] [-l|--level <id>] [--sandbox]");
        System.exit(1);
    }

    public void run(BufferedReader in) throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            if (!execute(line)) break;
        }
    }

    /** Runs one command line; false once the session should end. */
    public boolean execute(String line) {
        var words = line.trim().split("\\s+");
        if (words.length == 0 || words[0].isEmpty()) return true;
        var args = Arrays.asList(words).subList(1, words.length);
        var parent = game.selectedParent();
        var selection = game.selection();
        switch (words[0]) {
            case "quit", "exit" -> {
                return false;
            }
            case "levels" -> levels.forEach(l -> out.println(l.id() + "  " + l.name() + "  (difficulty " + l.difficulty() + ")"));
            case "load" -> {
                var level = args.isEmpty() ? null : level(args.get(0));
                if (level == null) out.println("! Unknown level" + (args.isEmpty() ? "" : ": " + args.get(0)));
                else {
                    game.load(level);
                    show();
                }
            }
            case "show" -> show();
            case "select" -> {
                args.forEach(game::toggleSelection);
                out.println("selection: " + game.selection());
            }
            case "parent" -> {
                game.selectParent(args.isEmpty() || args.get(0).equals("root") ? null : args.get(0));
                out.println("parent: " + (game.selectedParent() == null ? "root" : game.selectedParent()));
            }
            case "clarify" -> {
                if (selection.isEmpty()) out.println("! " + Dispatcher.hint(Op.Key.CLARIFY));
                else apply(new Op.Clarify(selection.get(0)));
            }
            case "frame" -> apply(new Op.Enfold(selection, Inversion.Variant.FRAME, parent));
            case "mark" -> apply(new Op.Enfold(selection, Inversion.Variant.MARK, parent));
            case "disperse" -> apply(new Op.Disperse(selection, null, parent));
            case "collect" -> apply(new Op.Collect(selection));
            case "cancel" -> apply(new Op.Cancel(selection));
            case "create" -> apply(new Op.Create(parent, selection));
            case "add" -> {
                var boundary = args.isEmpty() ? null : boundary(args.get(0));
                if (boundary == null) out.println("! add <round|square|angle>");
                else apply(new Op.AddBoundary(selection, boundary, parent));
            }
            case "var" -> apply(new Op.AddVariable(String.join(" ", args), parent));
            case "undo" -> {
                if (game.undo()) show();
                else out.println("! Nothing to undo");
            }
            case "redo" -> {
                if (game.redo()) show();
                else out.println("! Nothing to redo");
            }
            case "reset" -> {
                game.reset();
                show();
            }
            case "avail" -> game.availability().forEach((key, a) ->
                    out.println(key + ": " + (a.available() ? "yes" : "no, " + a.reason())));
            default -> out.println("! Unknown command: " + words[0]);
        }
        return true;
    }

    private void apply(Op op) {
        if (game.apply(op).isChanged()) show();
    }

    private void show() {
        out.println(Forest.notation(game.forest(), true));
        out.println("goal: " + Forest.notation(game.goal()) + "  moves: " + game.moves() + "  " + game.status());
    }

    private @Nullable Level level(String id) {
        return levels.stream().filter(l -> l.id().equals(id)).findFirst().orElse(null);
    }

    private static @Nullable Boundary boundary(String key) {
        try {
            var b = Boundary.of(key);
            return b == Boundary.ATOM ? null : b;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
