package stableid.scoring;

/**
 * Anchor tier scores and bonuses.
 *
 * @param semanticTag           tier A base score
 * @param landmarkRole          tier B base score, also the role bonus for tier A
 * @param ariaLabel             bonus for aria-label / aria-labelledby
 * @param stableId              bonus for a stable id
 * @param testMarker            tier C base score
 * @param depthPenaltyThreshold depth after which the penalty applies
 * @param depthPenaltyFactor    penalty per level beyond the threshold
 * @param degradedCap           maximum score of a fallback anchor
 */
public record AnchorWeights(
        double semanticTag,
        double landmarkRole,
        double ariaLabel,
        double stableId,
        double testMarker,
        int depthPenaltyThreshold,
        double depthPenaltyFactor,
        double degradedCap) {

    public static final AnchorWeights DEFAULT = new AnchorWeights(0.5, 0.3, 0.1, 0.1, 0.05, 5, 0.05, 0.3);

    public AnchorWeights {
        Weights.unit("semanticTag", semanticTag);
        Weights.unit("landmarkRole", landmarkRole);
        Weights.unit("ariaLabel", ariaLabel);
        Weights.unit("stableId", stableId);
        Weights.unit("testMarker", testMarker);
        Weights.unit("depthPenaltyFactor", depthPenaltyFactor);
        Weights.unit("degradedCap", degradedCap);
        if (depthPenaltyThreshold < 0) {
            throw new IllegalArgumentException("depthPenaltyThreshold must be >= 0, got " + depthPenaltyThreshold);
        }
    }
}
