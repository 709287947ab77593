package stableid.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Element Identity Descriptor: a durable, semantic description of one node.
 *
 * <p>The target is reached from the anchor through the ordered {@code path}
 * (anchor and target excluded). Instances are immutable and are consumed
 * read-only by resolution.
 *
 * <p>Unknown JSON properties are ignored so older readers accept descriptors
 * written by newer generators.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ElementIdentity(
        String version,
        NodeDescriptor anchor,
        List<NodeDescriptor> path,
        NodeDescriptor target,
        List<Constraint> constraints,
        FallbackRules fallback,
        EidMeta meta) {

    public static final String CURRENT_VERSION = "1.0";

    public ElementIdentity {
        path = path == null ? List.of() : List.copyOf(path);
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
    }

    /** Fallback rules, or the defaults when the descriptor carries none. */
    public FallbackRules fallbackOrDefault() {
        return fallback != null ? fallback : FallbackRules.DEFAULT;
    }

    @JsonIgnore
    public double confidence() {
        return meta != null ? meta.confidence() : 0.0;
    }

    @JsonIgnore
    public boolean isVersionSupported() {
        return CURRENT_VERSION.equals(version);
    }
}
