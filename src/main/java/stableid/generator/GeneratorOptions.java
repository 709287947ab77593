package stableid.generator;

import stableid.cache.EidCache;
import stableid.model.FallbackRules;
import stableid.scoring.ScoringProfile;
import stableid.tree.TreeNode;
import stableid.util.ClassClassifier;

import java.time.Clock;
import java.util.Objects;

/**
 * Immutable options for {@link EidGenerator}. Build with {@link #builder()};
 * {@link #defaults()} matches the documented defaults.
 */
public final class GeneratorOptions {

    public static final int    DEFAULT_MAX_PATH_DEPTH       = 10;
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.1;
    public static final String DEFAULT_SOURCE               = "dom";
    public static final int    DEFAULT_MAX_SELECTOR_CLASSES = 3;

    private static final GeneratorOptions DEFAULTS = builder().build();

    private final int maxPathDepth;
    private final boolean enableGeometryFingerprint;
    private final double confidenceThreshold;
    private final boolean fallbackToDocumentRoot;
    private final EidCache cache;
    private final boolean includeUtilityClasses;
    private final double classScoreThreshold;
    private final int maxSelectorClasses;
    private final String source;
    private final Clock clock;
    private final TreeNode root;
    private final ScoringProfile scoring;
    private final FallbackRules fallbackRules;

    private GeneratorOptions(Builder b) {
        this.maxPathDepth = b.maxPathDepth;
        this.enableGeometryFingerprint = b.enableGeometryFingerprint;
        this.confidenceThreshold = b.confidenceThreshold;
        this.fallbackToDocumentRoot = b.fallbackToDocumentRoot;
        this.cache = b.cache;
        this.includeUtilityClasses = b.includeUtilityClasses;
        this.classScoreThreshold = b.classScoreThreshold;
        this.maxSelectorClasses = b.maxSelectorClasses;
        this.source = b.source;
        this.clock = b.clock;
        this.root = b.root;
        this.scoring = b.scoring;
        this.fallbackRules = b.fallbackRules;
    }

    public static GeneratorOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder seeded with this instance's values. */
    public Builder toBuilder() {
        return new Builder()
                .maxPathDepth(maxPathDepth)
                .enableGeometryFingerprint(enableGeometryFingerprint)
                .confidenceThreshold(confidenceThreshold)
                .fallbackToDocumentRoot(fallbackToDocumentRoot)
                .cache(cache)
                .includeUtilityClasses(includeUtilityClasses)
                .classScoreThreshold(classScoreThreshold)
                .maxSelectorClasses(maxSelectorClasses)
                .source(source)
                .clock(clock)
                .root(root)
                .scoring(scoring)
                .fallbackRules(fallbackRules);
    }

    public int getMaxPathDepth()                { return maxPathDepth; }
    public boolean isGeometryFingerprintEnabled() { return enableGeometryFingerprint; }
    public double getConfidenceThreshold()      { return confidenceThreshold; }
    public boolean isFallbackToDocumentRoot()   { return fallbackToDocumentRoot; }
    /** Optional cache; {@code null} disables caching. */
    public EidCache getCache()                  { return cache; }
    public boolean isIncludeUtilityClasses()    { return includeUtilityClasses; }
    public double getClassScoreThreshold()      { return classScoreThreshold; }
    /** Classes per node when rendering uniqueness-check selectors. */
    public int getMaxSelectorClasses()          { return maxSelectorClasses; }
    public String getSource()                   { return source; }
    public Clock getClock()                     { return clock; }
    /** Optional root the target must share a document with; {@code null} skips the check. */
    public TreeNode getRoot()                   { return root; }
    public ScoringProfile getScoring()          { return scoring; }
    public FallbackRules getFallbackRules()     { return fallbackRules; }

    // ── Builder ───────────────────────────────────────────────────────────

    public static final class Builder {

        private int maxPathDepth = DEFAULT_MAX_PATH_DEPTH;
        private boolean enableGeometryFingerprint = true;
        private double confidenceThreshold = DEFAULT_CONFIDENCE_THRESHOLD;
        private boolean fallbackToDocumentRoot = true;
        private EidCache cache;
        private boolean includeUtilityClasses;
        private double classScoreThreshold = ClassClassifier.DEFAULT_THRESHOLD;
        private int maxSelectorClasses = DEFAULT_MAX_SELECTOR_CLASSES;
        private String source = DEFAULT_SOURCE;
        private Clock clock = Clock.systemUTC();
        private TreeNode root;
        private ScoringProfile scoring = ScoringProfile.DEFAULT;
        private FallbackRules fallbackRules = FallbackRules.DEFAULT;

        private Builder() {}

        public Builder maxPathDepth(int v)                    { this.maxPathDepth = v; return this; }
        public Builder enableGeometryFingerprint(boolean v)   { this.enableGeometryFingerprint = v; return this; }
        public Builder confidenceThreshold(double v)          { this.confidenceThreshold = v; return this; }
        public Builder fallbackToDocumentRoot(boolean v)      { this.fallbackToDocumentRoot = v; return this; }
        public Builder cache(EidCache v)                      { this.cache = v; return this; }
        public Builder includeUtilityClasses(boolean v)       { this.includeUtilityClasses = v; return this; }
        public Builder classScoreThreshold(double v)          { this.classScoreThreshold = v; return this; }
        public Builder maxSelectorClasses(int v)              { this.maxSelectorClasses = v; return this; }
        public Builder source(String v)                       { this.source = v; return this; }
        public Builder clock(Clock v)                         { this.clock = v; return this; }
        public Builder root(TreeNode v)                       { this.root = v; return this; }
        public Builder scoring(ScoringProfile v)              { this.scoring = v; return this; }
        public Builder fallbackRules(FallbackRules v)         { this.fallbackRules = v; return this; }

        /**
         * @throws IllegalArgumentException if a value is out of range
         */
        public GeneratorOptions build() {
            if (maxPathDepth < 1) {
                throw new IllegalArgumentException("maxPathDepth must be >= 1, got " + maxPathDepth);
            }
            if (Double.isNaN(confidenceThreshold) || confidenceThreshold < 0 || confidenceThreshold > 1) {
                throw new IllegalArgumentException("confidenceThreshold must be in [0,1], got " + confidenceThreshold);
            }
            if (Double.isNaN(classScoreThreshold) || classScoreThreshold < 0 || classScoreThreshold > 1) {
                throw new IllegalArgumentException("classScoreThreshold must be in [0,1], got " + classScoreThreshold);
            }
            if (maxSelectorClasses < 0) {
                throw new IllegalArgumentException("maxSelectorClasses must be >= 0, got " + maxSelectorClasses);
            }
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(scoring, "scoring");
            Objects.requireNonNull(fallbackRules, "fallbackRules");
            if (source == null || source.isBlank()) source = DEFAULT_SOURCE;
            return new GeneratorOptions(this);
        }
    }
}
