package stableid.resolver;

import com.fasterxml.jackson.annotation.JsonValue;

/** Terminal status of a resolution. */
public enum ResolveStatus {
    SUCCESS("success"),
    AMBIGUOUS("ambiguous"),
    DEGRADED_FALLBACK("degraded-fallback"),
    ERROR("error");

    private final String code;

    ResolveStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() { return code; }

    @Override
    public String toString() { return code; }
}
