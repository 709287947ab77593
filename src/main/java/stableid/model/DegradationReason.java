package stableid.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Reason codes attached to every degraded generation or resolution outcome.
 */
public enum DegradationReason {
    ANCHOR_FALLBACK("anchor-fallback"),
    PATH_DEPTH_EXCEEDED("path-depth-exceeded"),
    STRICT_NOT_FOUND("strict-not-found"),
    OVER_CONSTRAINED("over-constrained"),
    AMBIGUOUS("ambiguous"),
    BEST_OF_MULTIPLE("best-of-multiple"),
    RELAXED_TEXT_MATCHING("relaxed-text-matching"),
    INVALID_SELECTOR("invalid-selector"),
    INVALID_CONTEXT("invalid-context"),
    NOT_FOUND("not-found"),
    ANCHOR_NOT_FOUND("anchor-not-found");

    private final String code;

    DegradationReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() { return code; }

    @JsonCreator
    public static DegradationReason fromCode(String code) {
        for (DegradationReason value : values()) {
            if (value.code.equalsIgnoreCase(code) || value.name().equalsIgnoreCase(code)) return value;
        }
        throw new IllegalArgumentException("Unknown DegradationReason: " + code);
    }

    @Override
    public String toString() { return code; }
}
