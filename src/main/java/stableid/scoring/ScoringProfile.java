package stableid.scoring;

import java.util.Objects;

/**
 * Every empirical weight used by generation and resolution, in one place.
 */
public record ScoringProfile(
        ConfidenceWeights confidence,
        ElementScoreWeights element,
        AnchorWeights anchor,
        MatchWeights match) {

    public static final ScoringProfile DEFAULT = new ScoringProfile(
            ConfidenceWeights.DEFAULT, ElementScoreWeights.DEFAULT, AnchorWeights.DEFAULT, MatchWeights.DEFAULT);

    public ScoringProfile {
        Objects.requireNonNull(confidence, "confidence");
        Objects.requireNonNull(element, "element");
        Objects.requireNonNull(anchor, "anchor");
        Objects.requireNonNull(match, "match");
    }
}
