package stableid.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * One node of a descriptor: anchor, path step or target.
 *
 * <p>{@code nthChild} is the 1-based position among all element siblings at
 * generation time. It only ever breaks ties between candidates that already
 * match semantically.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record NodeDescriptor(
        String tag,
        Semantics semantics,
        double score,
        Integer nthChild,
        boolean degraded) {

    public NodeDescriptor {
        Objects.requireNonNull(tag, "tag");
        if (semantics == null) semantics = Semantics.EMPTY;
        score = Math.max(0.0, Math.min(1.0, score));
    }

    public NodeDescriptor(String tag, Semantics semantics, double score, Integer nthChild) {
        this(tag, semantics, score, nthChild, false);
    }
}
