package stableid.scoring;

/**
 * Range checks shared by the weight records.
 */
final class Weights {

    private Weights() {}

    static double unit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be in [0,1], got " + value);
        }
        return value;
    }

    static double clamp01(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
