package stableid.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Disambiguation rule applied when more than one candidate matches.
 * Higher {@code priority} runs first.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Constraint(ConstraintType type, Map<String, Object> params, int priority) {

    public static final String PARAM_REFERENCE    = "reference";
    public static final String PARAM_MAX_DISTANCE = "maxDistance";
    public static final String PARAM_STRATEGY     = "strategy";
    public static final String PARAM_MODE         = "mode";

    public Constraint {
        Objects.requireNonNull(type, "type");
        params = params == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static Constraint uniqueness(int priority) {
        return new Constraint(ConstraintType.UNIQUENESS, Map.of(PARAM_MODE, "strict"), priority);
    }

    public static Constraint textProximity(String reference, int maxDistance, int priority) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(PARAM_REFERENCE, reference);
        params.put(PARAM_MAX_DISTANCE, maxDistance);
        return new Constraint(ConstraintType.TEXT_PROXIMITY, params, priority);
    }

    public static Constraint position(PositionStrategy strategy, int priority) {
        return new Constraint(ConstraintType.POSITION, Map.of(PARAM_STRATEGY, strategy.code()), priority);
    }

    public String stringParam(String key) {
        Object value = params.get(key);
        return value == null ? null : value.toString();
    }

    public int intParam(String key, int defaultValue) {
        Object value = params.get(key);
        if (value instanceof Number n) return n.intValue();
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }
}
