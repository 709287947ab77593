package stableid.scoring;

/**
 * Weights of the overall descriptor confidence.
 *
 * <p>{@code confidence = anchor·a + avgPath·p + target·t + uniquenessBonus·u},
 * with {@code avgPath = emptyPathScore} for an empty path, minus
 * {@code degradationPenalty} when any stage degraded.
 */
public record ConfidenceWeights(
        double anchor,
        double path,
        double target,
        double uniqueness,
        double emptyPathScore,
        double degradationPenalty) {

    public static final ConfidenceWeights DEFAULT = new ConfidenceWeights(0.4, 0.3, 0.2, 0.1, 0.5, 0.2);

    public ConfidenceWeights {
        Weights.unit("anchor", anchor);
        Weights.unit("path", path);
        Weights.unit("target", target);
        Weights.unit("uniqueness", uniqueness);
        Weights.unit("emptyPathScore", emptyPathScore);
        Weights.unit("degradationPenalty", degradationPenalty);
    }
}
