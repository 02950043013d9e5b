package dumb.bao.axiom;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** The three axiom families a level can enable or disable. */
public enum Axiom {
    INVERSION("inversion"),
    ARRANGEMENT("arrangement"),
    REFLECTION("reflection");

    private final String key;

    Axiom(String key) {
        this.key = key;
    }

    @JsonCreator
    public static Axiom of(String key) {
        for (var a : values())
            if (a.key.equals(key)) return a;
        throw new IllegalArgumentException("Unknown axiom: " + key);
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
