package stableid.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How recorded text is compared against live text.
 */
public enum MatchMode {
    EXACT("exact"),
    PARTIAL("partial");

    private final String code;

    MatchMode(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() { return code; }

    @JsonCreator
    public static MatchMode fromCode(String code) {
        for (MatchMode value : values()) {
            if (value.code.equalsIgnoreCase(code) || value.name().equalsIgnoreCase(code)) return value;
        }
        throw new IllegalArgumentException("Unknown MatchMode: " + code);
    }

    @Override
    public String toString() { return code; }
}
