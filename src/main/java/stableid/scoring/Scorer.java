package stableid.scoring;

import stableid.model.Semantics;

import java.util.List;

/**
 * Per-node scores and the overall descriptor confidence.
 */
public class Scorer {

    private final ConfidenceWeights confidence;
    private final ElementScoreWeights element;

    public Scorer(ScoringProfile profile) {
        this.confidence = profile.confidence();
        this.element = profile.element();
    }

    /**
     * Score of one node from its captured features, capped at 1.0.
     * The role attribute does not count twice: it earns the role bonus only.
     */
    public double elementScore(Semantics semantics) {
        double score = element.base();
        if (semantics.hasId()) score += element.stableId();
        if (semantics.role() != null) score += element.role();

        int features = 0;
        if (!semantics.classes().isEmpty()) features++;
        if (hasNonRoleAttribute(semantics)) features++;
        if (semantics.hasText()) features++;
        if (semantics.geometry() != null) features++;
        score += Math.min(element.featureCap(), features * element.perFeature());

        return Math.min(1.0, score);
    }

    /**
     * Combines stage scores into a confidence in [0,1].
     *
     * @param uniqueness 1.0 if the descriptor's selector was unique at generation time
     * @param degraded   whether any stage fell back to a degraded strategy
     */
    public double confidence(double anchorScore, List<Double> pathScores, double targetScore,
                             double uniqueness, boolean degraded) {
        double avgPath = pathScores.isEmpty()
                ? confidence.emptyPathScore()
                : pathScores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);

        double raw = anchorScore * confidence.anchor()
                + avgPath * confidence.path()
                + targetScore * confidence.target()
                + uniqueness * confidence.uniqueness();
        if (degraded) raw -= confidence.degradationPenalty();
        return Weights.clamp01(raw);
    }

    private static boolean hasNonRoleAttribute(Semantics semantics) {
        for (String name : semantics.attributes().keySet()) {
            if (!"role".equals(name)) return true;
        }
        return false;
    }
}
