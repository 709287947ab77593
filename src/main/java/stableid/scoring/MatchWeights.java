package stableid.scoring;

/**
 * Rubric of the {@code best-score} rescoring of ambiguous candidates.
 * A criterion only counts towards the normalizing maximum when the recorded
 * target carries the corresponding feature (visibility always counts).
 */
public record MatchWeights(
        double visibility,
        double id,
        double classOverlap,
        double attributeOverlap,
        double role,
        double text) {

    public static final MatchWeights DEFAULT = new MatchWeights(0.4, 0.3, 0.25, 0.2, 0.15, 0.1);

    public MatchWeights {
        Weights.unit("visibility", visibility);
        Weights.unit("id", id);
        Weights.unit("classOverlap", classOverlap);
        Weights.unit("attributeOverlap", attributeOverlap);
        Weights.unit("role", role);
        Weights.unit("text", text);
    }
}
