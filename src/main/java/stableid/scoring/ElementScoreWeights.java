package stableid.scoring;

/**
 * Weights of a single node's score: base, stable id bonus, role bonus, and a
 * per-feature bonus capped at {@code featureCap}.
 */
public record ElementScoreWeights(
        double base,
        double stableId,
        double role,
        double perFeature,
        double featureCap) {

    public static final ElementScoreWeights DEFAULT = new ElementScoreWeights(0.5, 0.2, 0.15, 0.05, 0.15);

    public ElementScoreWeights {
        Weights.unit("base", base);
        Weights.unit("stableId", stableId);
        Weights.unit("role", role);
        Weights.unit("perFeature", perFeature);
        Weights.unit("featureCap", featureCap);
    }
}
