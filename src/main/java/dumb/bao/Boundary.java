package dumb.bao;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Boundary {
    ROUND("round", '(', ')'),
    SQUARE("square", '[', ']'),
    ANGLE("angle", '<', '>'),
    ATOM("atom", '\0', '\0');

    private final String key;
    final char open, close;

    Boundary(String key, char open, char close) {
        this.key = key;
        this.open = open;
        this.close = close;
    }

    @JsonCreator
    public static Boundary of(String key) {
        for (var b : values())
            if (b.key.equals(key)) return b;
        throw new IllegalArgumentException("Unknown boundary: " + key);
    }

    static Boundary opening(int c) {
        for (var b : values())
            if (b != ATOM && b.open == c) return b;
        return null;
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
