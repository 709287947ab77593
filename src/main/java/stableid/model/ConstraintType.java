package stableid.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of disambiguation rule carried by a descriptor.
 */
public enum ConstraintType {
    UNIQUENESS("uniqueness"),
    TEXT_PROXIMITY("text-proximity"),
    POSITION("position");

    private final String code;

    ConstraintType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() { return code; }

    @JsonCreator
    public static ConstraintType fromCode(String code) {
        for (ConstraintType value : values()) {
            if (value.code.equalsIgnoreCase(code) || value.name().equalsIgnoreCase(code)) return value;
        }
        throw new IllegalArgumentException("Unknown ConstraintType: " + code);
    }

    @Override
    public String toString() { return code; }
}
