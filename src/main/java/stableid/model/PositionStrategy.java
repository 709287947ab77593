package stableid.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Tie-break used by a {@code position} constraint.
 */
public enum PositionStrategy {
    FIRST_IN_DOM("first-in-dom"),
    TOP_MOST("top-most"),
    LEFT_MOST("left-most");

    private final String code;

    PositionStrategy(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() { return code; }

    @JsonCreator
    public static PositionStrategy fromCode(String code) {
        for (PositionStrategy value : values()) {
            if (value.code.equalsIgnoreCase(code) || value.name().equalsIgnoreCase(code)) return value;
        }
        throw new IllegalArgumentException("Unknown PositionStrategy: " + code);
    }

    @Override
    public String toString() { return code; }
}
