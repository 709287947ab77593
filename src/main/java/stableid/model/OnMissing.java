package stableid.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Policy applied when nothing matches the target.
 */
public enum OnMissing {
    ANCHOR_ONLY("anchor-only"),
    STRICT("strict"),
    NONE("none");

    private final String code;

    OnMissing(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() { return code; }

    @JsonCreator
    public static OnMissing fromCode(String code) {
        for (OnMissing value : values()) {
            if (value.code.equalsIgnoreCase(code) || value.name().equalsIgnoreCase(code)) return value;
        }
        throw new IllegalArgumentException("Unknown OnMissing: " + code);
    }

    @Override
    public String toString() { return code; }
}
