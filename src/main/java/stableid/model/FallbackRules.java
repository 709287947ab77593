package stableid.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * What resolution does when the target is missing or ambiguous.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FallbackRules(OnMissing onMissing, OnMultiple onMultiple, int maxDepth) {

    public static final FallbackRules DEFAULT =
            new FallbackRules(OnMissing.ANCHOR_ONLY, OnMultiple.BEST_SCORE, 3);

    public FallbackRules {
        if (onMissing == null) onMissing = OnMissing.ANCHOR_ONLY;
        if (onMultiple == null) onMultiple = OnMultiple.BEST_SCORE;
    }
}
