package dumb.bao;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import dumb.bao.axiom.Axiom;
import dumb.bao.util.Json;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

import static dumb.bao.util.Log.message;

/** Level definitions as JSON, hydrated into live Forms with fresh ids. */
public final class Levels {

    public static final String BUILTIN_RESOURCE = "levels.json";

    private static final TypeReference<List<RawLevel>> RAW_LEVELS = new TypeReference<>() {
    };

    private Levels() {
    }

    public static Form instantiate(RawForm node) throws LevelException {
        if (node.boundary() == null) throw new LevelException("Form without boundary");
        var children = new ArrayList<Form>();
        for (var child : node.children()) children.add(instantiate(child));
        if (node.boundary() == Boundary.ATOM) {
            if (node.label() == null || node.label().isEmpty()) throw new LevelException("Atom without label");
            if (!children.isEmpty()) throw new LevelException("Atom '" + node.label() + "' has children");
            return Form.atom(node.label());
        }
        if (node.label() != null) throw new LevelException(node.boundary() + " form carries label '" + node.label() + "'");
        return Form.of(node.boundary(), children);
    }

    public static List<Form> instantiate(List<RawForm> nodes) throws LevelException {
        var forms = new ArrayList<Form>(nodes.size());
        for (var n : nodes) forms.add(instantiate(n));
        return forms;
    }

    public static Level hydrate(RawLevel raw) throws LevelException {
        if (raw.id() == null || raw.id().isBlank()) throw new LevelException("Level without id");
        if (raw.difficulty() < 1 || raw.difficulty() > 5)
            throw new LevelException("Level " + raw.id() + " difficulty must be 1..5: " + raw.difficulty());
        try {
            return new Level(raw.id(), raw.name() == null ? raw.id() : raw.name(), raw.description(), raw.difficulty(),
                    instantiate(raw.start()), instantiate(raw.goal()), raw.maxMoves(),
                    raw.allowedAxioms(), raw.allowedOperations(), raw.hints());
        } catch (LevelException e) {
            throw new LevelException("Level " + raw.id() + ": " + e.getMessage());
        }
    }

    public static List<Level> hydrate(List<RawLevel> raws) throws LevelException {
        var levels = new ArrayList<Level>(raws.size());
        for (var r : raws) levels.add(hydrate(r));
        return levels;
    }

    public static List<Level> load(String json) throws LevelException {
        try {
            return hydrate(Json.obj(json, RAW_LEVELS));
        } catch (JsonProcessingException e) {
            throw new LevelException("Invalid level JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static List<Level> load(InputStream json) throws LevelException {
        try {
            return hydrate(Json.obj(json, RAW_LEVELS));
        } catch (IOException e) {
            throw new LevelException("Invalid level JSON: " + e.getMessage(), e);
        }
    }

    public static List<Level> load(Path file) throws LevelException {
        try (var in = Files.newInputStream(file)) {
            return load(in);
        } catch (IOException e) {
            throw new LevelException("Cannot read " + file + ": " + e.getMessage(), e);
        }
    }

    /** Loads a classpath resource, or a file when no such resource exists. */
    public static List<Level> resource(String name) throws LevelException {
        var in = Levels.class.getClassLoader().getResourceAsStream(name);
        if (in == null) return load(Path.of(name));
        try (in) {
            var levels = load(in);
            message("Loaded " + levels.size() + " levels from " + name);
            return levels;
        } catch (IOException e) {
            throw new LevelException("Cannot read " + name + ": " + e.getMessage(), e);
        }
    }

    public static List<Level> builtin() throws LevelException {
        return resource(BUILTIN_RESOURCE);
    }

    /** Canonical export: roots and children sorted by signature, ids dropped. */
    public static List<RawForm> serialize(List<Form> forms) {
        return forms.stream().sorted(Comparator.comparing(Form::signature)).map(Levels::serialize).toList();
    }

    public static RawForm serialize(Form form) {
        return new RawForm(form.boundary, form.label, serialize(form.children));
    }

    public static String toJson(List<Form> forms) {
        return Json.str(serialize(forms));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RawForm(Boundary boundary, @Nullable String label, List<RawForm> children) {
        public RawForm {
            children = children == null ? List.of() : List.copyOf(children);
        }

        public static RawForm atom(String label) {
            return new RawForm(Boundary.ATOM, label, List.of());
        }

        public static RawForm of(Boundary boundary, RawForm... children) {
            return new RawForm(boundary, null, List.of(children));
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RawLevel(String id, @Nullable String name, @Nullable String description, int difficulty,
                           List<RawForm> start, List<RawForm> goal, @Nullable Integer maxMoves,
                           Set<Axiom> allowedAxioms, Set<Op.Key> allowedOperations, List<String> hints) {
        public RawLevel {
            start = start == null ? List.of() : List.copyOf(start);
            goal = goal == null ? List.of() : List.copyOf(goal);
            allowedAxioms = allowedAxioms == null ? Set.of() : Set.copyOf(allowedAxioms);
            allowedOperations = allowedOperations == null ? Set.of() : Set.copyOf(allowedOperations);
            hints = hints == null ? List.of() : List.copyOf(hints);
        }
    }

    public static class LevelException extends Exception {
        public LevelException(String message) {
            super(message);
        }

        public LevelException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
