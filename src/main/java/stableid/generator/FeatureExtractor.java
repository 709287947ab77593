package stableid.generator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stableid.cache.EidCache;
import stableid.model.MatchMode;
import stableid.model.Semantics;
import stableid.model.TextContent;
import stableid.tree.TreeNode;
import stableid.util.AttributeRules;
import stableid.util.ClassClassifier;
import stableid.util.IdHeuristics;
import stableid.util.TextNormalizer;
import stableid.util.UrlCleaner;
import stableid.util.Vocabulary;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Extracts the stable semantic features of a single node.
 *
 * <p>Only features that survive re-renders are kept: ids that do not look
 * generated, classes that pass the utility/generated-name filter, and
 * allow-listed attributes ordered by priority, with URL values cleaned.
 * Text is captured for text-bearing tags, direct child text first.
 */
public class FeatureExtractor {

    private static final Logger log = LoggerFactory.getLogger(FeatureExtractor.class);

    private final GeometryFingerprinter fingerprinter;
    private final boolean includeGeometry;
    private final boolean includeUtilityClasses;
    private final double classThreshold;
    private final EidCache cache;

    public FeatureExtractor(GeneratorOptions options) {
        this(new GeometryFingerprinter(), options);
    }

    public FeatureExtractor(GeometryFingerprinter fingerprinter, GeneratorOptions options) {
        this.fingerprinter = fingerprinter;
        this.includeGeometry = options.isGeometryFingerprintEnabled();
        this.includeUtilityClasses = options.isIncludeUtilityClasses();
        this.classThreshold = options.getClassScoreThreshold();
        this.cache = options.getCache();
    }

    // ── Public API ────────────────────────────────────────────────────────

    public Semantics extract(TreeNode node) {
        if (cache != null) {
            Optional<Semantics> cached = cache.getSemantics(node);
            if (cached.isPresent()) return cached.get();
        }

        Semantics semantics = new Semantics(
                stableId(node),
                classes(node),
                attributes(node),
                role(node),
                text(node),
                null);
        if (includeGeometry && fingerprinter.isVectorShape(node)) {
            semantics = semantics.withGeometry(fingerprinter.fingerprint(node));
        }

        if (cache != null) cache.putSemantics(node, semantics);
        return semantics;
    }

    /**
     * Text of a node as compared during resolution: normalized direct child
     * text when present, otherwise normalized subtree text.
     */
    public static String liveText(TreeNode node) {
        String own = TextNormalizer.normalize(node.ownText());
        return own.isEmpty() ? TextNormalizer.normalize(node.textContent()) : own;
    }

    // ── Features ──────────────────────────────────────────────────────────

    private String stableId(TreeNode node) {
        String id = node.id();
        if (id == null) return null;
        if (IdHeuristics.isDynamicId(id)) {
            log.debug("Ignoring generated id '{}' on <{}>", id, node.tagName());
            return null;
        }
        return id;
    }

    private List<String> classes(TreeNode node) {
        List<String> all = node.classNames();
        if (all.isEmpty()) return List.of();
        if (!includeUtilityClasses) return ClassClassifier.filterStable(all, classThreshold);

        List<String> kept = new ArrayList<>();
        for (String cls : all) {
            if (!ClassClassifier.isDynamic(cls)) kept.add(cls);
        }
        return kept;
    }

    private Map<String, String> attributes(TreeNode node) {
        List<String> names = new ArrayList<>();
        Map<String, String> values = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : node.attributes().entrySet()) {
            String name = e.getKey();
            if (!AttributeRules.shouldCapture(name, e.getValue())) continue;
            String cleaned = UrlCleaner.clean(name, e.getValue().trim());
            if (cleaned == null || cleaned.isEmpty()) continue;
            names.add(name);
            values.put(name, cleaned);
        }
        names.sort(AttributeRules.BY_PRIORITY);

        Map<String, String> ordered = new LinkedHashMap<>();
        for (String name : names) ordered.put(name, values.get(name));
        return ordered;
    }

    private String role(TreeNode node) {
        String role = node.attribute("role");
        return role == null || role.isBlank() ? null : role.trim();
    }

    private TextContent text(TreeNode node) {
        if (!Vocabulary.TEXT_TAGS.contains(node.tagName())) return null;

        String raw = node.ownText();
        if (TextNormalizer.normalize(raw).isEmpty()) raw = node.textContent();
        String normalized = TextNormalizer.normalize(raw);
        if (normalized.isEmpty()) return null;

        if (TextNormalizer.isTruncated(normalized)) {
            String truncated = TextNormalizer.truncate(normalized);
            return new TextContent(truncated, truncated, MatchMode.PARTIAL);
        }
        return new TextContent(raw, normalized, MatchMode.EXACT);
    }
}
