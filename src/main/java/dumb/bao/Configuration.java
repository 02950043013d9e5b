package dumb.bao;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.bao.util.Json;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static dumb.bao.util.Log.message;
import static dumb.bao.util.Log.warning;

/**
 * Session settings.
 *
 * @param sandbox      start with free editing enabled
 * @param levels       classpath resource or file holding the level list
 * @param historyLimit undo depth, 0 for unbounded
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Configuration(@JsonProperty("sandbox") boolean sandbox,
                            @JsonProperty("levels") String levels,
                            @JsonProperty("historyLimit") int historyLimit) {

    public static final String RESOURCE = "bao.json";
    public static final Configuration DEFAULT = new Configuration(false, Levels.BUILTIN_RESOURCE, 0);

    public Configuration {
        if (levels == null || levels.isBlank()) levels = Levels.BUILTIN_RESOURCE;
        if (historyLimit < 0) throw new IllegalArgumentException("historyLimit must be >= 0: " + historyLimit);
    }

    public Configuration withSandbox(boolean sandbox) {
        return new Configuration(sandbox, levels, historyLimit);
    }

    /** The bundled {@value #RESOURCE}, or defaults when it is missing or unreadable. */
    public static Configuration load() {
        try (var in = Configuration.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) return DEFAULT;
            return Json.obj(in, Configuration.class);
        } catch (IOException e) {
            warning("Ignoring unreadable " + RESOURCE + ": " + e.getMessage());
            return DEFAULT;
        }
    }

    public static Configuration load(@Nullable Path file) throws IOException {
        if (file == null) return load();
        try (var in = Files.newInputStream(file)) {
            var c = Json.obj(in, Configuration.class);
            message("Configuration loaded from " + file);
            return c;
        }
    }
}
