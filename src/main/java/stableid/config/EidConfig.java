package stableid.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stableid.StableIdException;
import stableid.cache.EidCache;
import stableid.generator.GeneratorOptions;
import stableid.model.FallbackRules;
import stableid.model.OnMissing;
import stableid.model.OnMultiple;
import stableid.resolver.ResolverOptions;
import stableid.scoring.AnchorWeights;
import stableid.scoring.ConfidenceWeights;
import stableid.scoring.ElementScoreWeights;
import stableid.scoring.MatchWeights;
import stableid.scoring.ScoringProfile;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.function.Function;

/**
 * Reads {@code stableid.properties} from the classpath and exposes typed
 * generation, resolution and scoring settings with documented defaults.
 *
 * <p>Values can be overridden by a {@code stableid.local.properties} file on
 * the classpath, or by an explicit file through {@link #load(Path)}.
 * Unparseable values log a warning and fall back to the default; values that
 * parse but are out of range are rejected by the option builders.
 */
public class EidConfig {

    private static final Logger log = LoggerFactory.getLogger(EidConfig.class);

    private static final String CONFIG_FILE       = "stableid.properties";
    private static final String CONFIG_LOCAL_FILE = "stableid.local.properties";

    // Generation
    static final String KEY_MAX_PATH_DEPTH         = "generator.max.path.depth";
    static final String KEY_CONFIDENCE_THRESHOLD   = "generator.confidence.threshold";
    static final String KEY_GEOMETRY_ENABLED       = "generator.geometry.enabled";
    static final String KEY_DOCUMENT_ROOT_FALLBACK = "generator.document.root.fallback";
    static final String KEY_INCLUDE_UTILITY        = "generator.include.utility.classes";
    static final String KEY_CLASS_THRESHOLD        = "generator.class.score.threshold";
    static final String KEY_SOURCE                 = "generator.source";
    static final String KEY_MAX_SELECTOR_CLASSES   = "selector.max.classes";

    // Fallback rules written into new descriptors
    static final String KEY_ON_MISSING             = "fallback.on.missing";
    static final String KEY_ON_MULTIPLE            = "fallback.on.multiple";
    static final String KEY_FALLBACK_MAX_DEPTH     = "fallback.max.depth";

    // Resolution
    static final String KEY_STRICT_MODE            = "resolver.strict.mode";
    static final String KEY_REQUIRE_UNIQUENESS     = "resolver.require.uniqueness";
    static final String KEY_FALLBACK_ENABLED       = "resolver.fallback.enabled";
    static final String KEY_MAX_CANDIDATES         = "resolver.max.candidates";

    // Infrastructure
    static final String KEY_CACHE_CAPACITY         = "cache.selector.capacity";
    static final String KEY_PROGRESS_INTERVAL      = "batch.progress.interval";

    static final int DEFAULT_PROGRESS_INTERVAL = 100;

    private final Properties props;

    /**
     * Loads configuration from the classpath.
     *
     * @throws StableIdException if {@code stableid.properties} cannot be loaded
     */
    public EidConfig() {
        this(loadClasspath());
    }

    /** Package-private constructor for tests. */
    EidConfig(Properties props) {
        this.props = props;
    }

    /**
     * Classpath configuration overlaid with the given file.
     *
     * @throws IOException if the file cannot be read
     */
    public static EidConfig load(Path overrides) throws IOException {
        Properties props = loadClasspath();
        try (Reader reader = Files.newBufferedReader(overrides)) {
            props.load(reader);
        }
        log.debug("Applied overrides from {}", overrides);
        return new EidConfig(props);
    }

    private static Properties loadClasspath() {
        Properties props = new Properties();
        ClassLoader loader = EidConfig.class.getClassLoader();

        try (InputStream base = loader.getResourceAsStream(CONFIG_FILE)) {
            if (base == null) throw new IOException("Classpath resource not found: " + CONFIG_FILE);
            props.load(base);
            log.debug("Loaded base config from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new StableIdException("Cannot load " + CONFIG_FILE, e);
        }

        try (InputStream local = loader.getResourceAsStream(CONFIG_LOCAL_FILE)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", CONFIG_LOCAL_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {}, using base config only: {}", CONFIG_LOCAL_FILE, e.getMessage());
        }
        return props;
    }

    // ── Options ───────────────────────────────────────────────────────────

    /** Generator options builder seeded from this configuration. */
    public GeneratorOptions.Builder generatorOptions() {
        return GeneratorOptions.builder()
                .maxPathDepth(getInt(KEY_MAX_PATH_DEPTH, GeneratorOptions.DEFAULT_MAX_PATH_DEPTH))
                .confidenceThreshold(getDouble(KEY_CONFIDENCE_THRESHOLD, GeneratorOptions.DEFAULT_CONFIDENCE_THRESHOLD))
                .enableGeometryFingerprint(getBool(KEY_GEOMETRY_ENABLED, true))
                .fallbackToDocumentRoot(getBool(KEY_DOCUMENT_ROOT_FALLBACK, true))
                .includeUtilityClasses(getBool(KEY_INCLUDE_UTILITY, false))
                .classScoreThreshold(getDouble(KEY_CLASS_THRESHOLD, 0.3))
                .maxSelectorClasses(getInt(KEY_MAX_SELECTOR_CLASSES, GeneratorOptions.DEFAULT_MAX_SELECTOR_CLASSES))
                .source(props.getProperty(KEY_SOURCE, GeneratorOptions.DEFAULT_SOURCE).trim())
                .scoring(scoringProfile())
                .fallbackRules(fallbackRules());
    }

    /** Resolver options builder seeded from this configuration. */
    public ResolverOptions.Builder resolverOptions() {
        return ResolverOptions.builder()
                .strictMode(getBool(KEY_STRICT_MODE, false))
                .requireUniqueness(getBool(KEY_REQUIRE_UNIQUENESS, false))
                .enableFallback(getBool(KEY_FALLBACK_ENABLED, true))
                .maxCandidates(getInt(KEY_MAX_CANDIDATES, ResolverOptions.DEFAULT_MAX_CANDIDATES))
                .maxSelectorClasses(getInt(KEY_MAX_SELECTOR_CLASSES, GeneratorOptions.DEFAULT_MAX_SELECTOR_CLASSES))
                .scoring(scoringProfile());
    }

    public FallbackRules fallbackRules() {
        FallbackRules d = FallbackRules.DEFAULT;
        return new FallbackRules(
                getEnum(KEY_ON_MISSING, d.onMissing(), OnMissing::fromCode),
                getEnum(KEY_ON_MULTIPLE, d.onMultiple(), OnMultiple::fromCode),
                getInt(KEY_FALLBACK_MAX_DEPTH, d.maxDepth()));
    }

    /** New cache sized from this configuration. */
    public EidCache newCache() {
        return new EidCache(getInt(KEY_CACHE_CAPACITY, EidCache.DEFAULT_SELECTOR_CAPACITY));
    }

    /** Nodes between batch progress callbacks (default: 100). */
    public int getProgressInterval() {
        return getInt(KEY_PROGRESS_INTERVAL, DEFAULT_PROGRESS_INTERVAL);
    }

    // ── Weights ───────────────────────────────────────────────────────────

    public ScoringProfile scoringProfile() {
        return new ScoringProfile(confidenceWeights(), elementWeights(), anchorWeights(), matchWeights());
    }

    ConfidenceWeights confidenceWeights() {
        ConfidenceWeights d = ConfidenceWeights.DEFAULT;
        return new ConfidenceWeights(
                getDouble("weights.confidence.anchor", d.anchor()),
                getDouble("weights.confidence.path", d.path()),
                getDouble("weights.confidence.target", d.target()),
                getDouble("weights.confidence.uniqueness", d.uniqueness()),
                getDouble("weights.confidence.empty.path", d.emptyPathScore()),
                getDouble("weights.confidence.degradation.penalty", d.degradationPenalty()));
    }

    ElementScoreWeights elementWeights() {
        ElementScoreWeights d = ElementScoreWeights.DEFAULT;
        return new ElementScoreWeights(
                getDouble("weights.element.base", d.base()),
                getDouble("weights.element.stable.id", d.stableId()),
                getDouble("weights.element.role", d.role()),
                getDouble("weights.element.per.feature", d.perFeature()),
                getDouble("weights.element.feature.cap", d.featureCap()));
    }

    AnchorWeights anchorWeights() {
        AnchorWeights d = AnchorWeights.DEFAULT;
        return new AnchorWeights(
                getDouble("weights.anchor.semantic.tag", d.semanticTag()),
                getDouble("weights.anchor.landmark.role", d.landmarkRole()),
                getDouble("weights.anchor.aria.label", d.ariaLabel()),
                getDouble("weights.anchor.stable.id", d.stableId()),
                getDouble("weights.anchor.test.marker", d.testMarker()),
                getInt("weights.anchor.depth.threshold", d.depthPenaltyThreshold()),
                getDouble("weights.anchor.depth.factor", d.depthPenaltyFactor()),
                getDouble("weights.anchor.degraded.cap", d.degradedCap()));
    }

    MatchWeights matchWeights() {
        MatchWeights d = MatchWeights.DEFAULT;
        return new MatchWeights(
                getDouble("weights.match.visibility", d.visibility()),
                getDouble("weights.match.id", d.id()),
                getDouble("weights.match.class", d.classOverlap()),
                getDouble("weights.match.attribute", d.attributeOverlap()),
                getDouble("weights.match.role", d.role()),
                getDouble("weights.match.text", d.text()));
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private int getInt(String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private double getDouble(String key, double defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid number for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private boolean getBool(String key, boolean defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        return Boolean.parseBoolean(raw.trim());
    }

    private <E extends Enum<E>> E getEnum(String key, E defaultValue, Function<String, E> parser) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return parser.apply(raw.trim());
        } catch (IllegalArgumentException e) {
            log.warn("Invalid value for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }
}
