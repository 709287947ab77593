package stableid.resolver;

import stableid.scoring.ScoringProfile;

import java.util.Objects;

/**
 * Immutable resolution options.
 */
public final class ResolverOptions {

    public static final int DEFAULT_MAX_CANDIDATES = 100;

    private final boolean strictMode;
    private final boolean requireUniqueness;
    private final boolean enableFallback;
    private final int maxCandidates;
    private final int maxSelectorClasses;
    private final ScoringProfile scoring;

    private ResolverOptions(Builder b) {
        this.strictMode = b.strictMode;
        this.requireUniqueness = b.requireUniqueness;
        this.enableFallback = b.enableFallback;
        this.maxCandidates = b.maxCandidates;
        this.maxSelectorClasses = b.maxSelectorClasses;
        this.scoring = b.scoring;
    }

    public static ResolverOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .strictMode(strictMode)
                .requireUniqueness(requireUniqueness)
                .enableFallback(enableFallback)
                .maxCandidates(maxCandidates)
                .maxSelectorClasses(maxSelectorClasses)
                .scoring(scoring);
    }

    /** Return residual ambiguity as {@code ambiguous} instead of applying {@code onMultiple}. */
    public boolean isStrictMode()          { return strictMode; }
    /** Turn every multi-node outcome into an error. */
    public boolean isRequireUniqueness()   { return requireUniqueness; }
    public boolean isEnableFallback()      { return enableFallback; }
    public int getMaxCandidates()          { return maxCandidates; }
    public int getMaxSelectorClasses()     { return maxSelectorClasses; }
    public ScoringProfile getScoring()     { return scoring; }

    @Override
    public String toString() {
        return "ResolverOptions{strictMode=" + strictMode
                + ", requireUniqueness=" + requireUniqueness
                + ", enableFallback=" + enableFallback
                + ", maxCandidates=" + maxCandidates
                + ", maxSelectorClasses=" + maxSelectorClasses + '}';
    }

    // ── Builder ───────────────────────────────────────────────────────────

    public static final class Builder {

        private boolean strictMode;
        private boolean requireUniqueness;
        private boolean enableFallback = true;
        private int maxCandidates = DEFAULT_MAX_CANDIDATES;
        private int maxSelectorClasses = SelectorSynthesizer.DEFAULT_MAX_CLASSES;
        private ScoringProfile scoring = ScoringProfile.DEFAULT;

        private Builder() {}

        public Builder strictMode(boolean v)          { this.strictMode = v; return this; }
        public Builder requireUniqueness(boolean v)   { this.requireUniqueness = v; return this; }
        public Builder enableFallback(boolean v)      { this.enableFallback = v; return this; }
        public Builder maxCandidates(int v)           { this.maxCandidates = v; return this; }
        public Builder maxSelectorClasses(int v)      { this.maxSelectorClasses = v; return this; }
        public Builder scoring(ScoringProfile v)      { this.scoring = v; return this; }

        /**
         * @throws IllegalArgumentException if a value is out of range
         */
        public ResolverOptions build() {
            if (maxCandidates < 1) {
                throw new IllegalArgumentException("maxCandidates must be >= 1, got " + maxCandidates);
            }
            if (maxSelectorClasses < 0) {
                throw new IllegalArgumentException("maxSelectorClasses must be >= 0, got " + maxSelectorClasses);
            }
            Objects.requireNonNull(scoring, "scoring");
            return new ResolverOptions(this);
        }
    }
}
