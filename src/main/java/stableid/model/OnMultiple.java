package stableid.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Policy applied when several candidates survive every constraint.
 */
public enum OnMultiple {
    FIRST("first"),
    BEST_SCORE("best-score"),
    ALLOW_MULTIPLE("allow-multiple");

    private final String code;

    OnMultiple(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() { return code; }

    @JsonCreator
    public static OnMultiple fromCode(String code) {
        for (OnMultiple value : values()) {
            if (value.code.equalsIgnoreCase(code) || value.name().equalsIgnoreCase(code)) return value;
        }
        throw new IllegalArgumentException("Unknown OnMultiple: " + code);
    }

    @Override
    public String toString() { return code; }
}
