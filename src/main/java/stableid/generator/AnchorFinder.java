package stableid.generator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stableid.cache.EidCache;
import stableid.model.Semantics;
import stableid.resolver.SelectorSynthesizer;
import stableid.scoring.AnchorWeights;
import stableid.tree.TreeNode;
import stableid.util.AttributeRules;
import stableid.util.ClassClassifier;
import stableid.util.IdHeuristics;
import stableid.util.Vocabulary;

import java.util.Optional;

/**
 * Picks the semantic scoping root of a target.
 *
 * <p>Walks up from the target's parent, at most {@code maxPathDepth} levels
 * and never past {@code body}. The first structural tag (tier A) or landmark
 * role (tier B) wins. A test marker (tier C) is remembered and used only when
 * the walk finds no A/B anchor. Framework roots, elements carrying nothing
 * but utility classes and bare {@code div}/{@code span} wrappers never
 * qualify.
 *
 * <p>Without a tiered anchor the nearest ancestor whose own selector is
 * unique in the document is used, degraded; failing that the document root
 * boundary ({@code body}, or the top-most ancestor) is used, also degraded.
 */
public class AnchorFinder {

    private static final Logger log = LoggerFactory.getLogger(AnchorFinder.class);

    private final int maxDepth;
    private final boolean fallbackToDocumentRoot;
    private final AnchorWeights weights;
    private final EidCache cache;
    private final FeatureExtractor extractor;
    private final SelectorSynthesizer synthesizer;
    private final NodeQuery query;

    public AnchorFinder(GeneratorOptions options, FeatureExtractor extractor, SelectorSynthesizer synthesizer) {
        this.maxDepth = options.getMaxPathDepth();
        this.fallbackToDocumentRoot = options.isFallbackToDocumentRoot();
        this.weights = options.getScoring().anchor();
        this.cache = options.getCache();
        this.extractor = extractor;
        this.synthesizer = synthesizer;
        this.query = new NodeQuery(cache);
    }

    /**
     * @return the anchor, or empty when only the document root would qualify
     *         and document-root fallback is disabled
     */
    public Optional<AnchorResult> find(TreeNode target) {
        if (cache != null) {
            Optional<AnchorResult> cached = cache.getAnchor(target);
            if (cached.isPresent()) return cached;
        }

        Optional<AnchorResult> result = search(target);
        result.ifPresent(r -> {
            log.debug("Anchor for <{}>: <{}> tier={} score={}", target.tagName(), r.element().tagName(),
                    r.tier(), r.score());
            if (cache != null) cache.putAnchor(target, r);
        });
        return result;
    }

    private Optional<AnchorResult> search(TreeNode target) {
        AnchorResult marker = null;
        int depth = 0;
        for (TreeNode current = target.parent();
             current != null && depth < maxDepth && !isDocumentBoundary(current);
             current = current.parent(), depth++) {

            if (isForbidden(current)) continue;
            AnchorTier tier = tierOf(current);
            if (tier == null) continue;

            AnchorResult candidate = new AnchorResult(current, penalize(rawScore(current, tier), depth), tier, depth);
            if (tier != AnchorTier.TEST_MARKER) return Optional.of(candidate);
            if (marker == null) marker = candidate;
        }
        if (marker != null) return Optional.of(marker);

        Optional<AnchorResult> feature = featureFallback(target);
        if (feature.isPresent()) return feature;

        return documentRoot(target);
    }

    // ── Tiers ─────────────────────────────────────────────────────────────

    static AnchorTier tierOf(TreeNode node) {
        if (Vocabulary.ANCHOR_TAGS.contains(node.tagName())) return AnchorTier.SEMANTIC_TAG;
        if (hasLandmarkRole(node)) return AnchorTier.LANDMARK_ROLE;
        for (String name : node.attributes().keySet()) {
            if (AttributeRules.isTestMarker(name)) return AnchorTier.TEST_MARKER;
        }
        return null;
    }

    private double rawScore(TreeNode node, AnchorTier tier) {
        double score = switch (tier) {
            case SEMANTIC_TAG -> weights.semanticTag() + (hasLandmarkRole(node) ? weights.landmarkRole() : 0.0);
            case LANDMARK_ROLE -> weights.landmarkRole();
            default -> weights.testMarker();
        };
        if (node.hasAttribute("aria-label") || node.hasAttribute("aria-labelledby")) score += weights.ariaLabel();
        String id = node.id();
        if (id != null && IdHeuristics.isStableId(id)) score += weights.stableId();
        return Math.min(1.0, score);
    }

    private double penalize(double score, int depth) {
        int over = depth - weights.depthPenaltyThreshold();
        return over > 0 ? Math.max(0.0, score - over * weights.depthPenaltyFactor()) : score;
    }

    private static boolean hasLandmarkRole(TreeNode node) {
        String role = node.attribute("role");
        return role != null && Vocabulary.LANDMARK_ROLES.contains(role.trim());
    }

    // ── Exclusions ────────────────────────────────────────────────────────

    private static boolean isDocumentBoundary(TreeNode node) {
        return "body".equals(node.tagName()) || "html".equals(node.tagName());
    }

    /** Framework roots, utility-class-only elements and bare layout wrappers. */
    static boolean isForbidden(TreeNode node) {
        String id = node.id();
        if (id != null && Vocabulary.FRAMEWORK_ROOT_IDS.contains(id)) return true;
        for (String name : node.attributes().keySet()) {
            if (Vocabulary.FRAMEWORK_ROOT_ATTRIBUTES.contains(name)) return true;
        }
        if (hasLandmarkRole(node) || Vocabulary.ANCHOR_TAGS.contains(node.tagName())) return false;

        boolean otherFeatures = id != null && IdHeuristics.isStableId(id);
        for (String name : node.attributes().keySet()) {
            if (!name.equals("class") && !name.equals("style") && !name.equals("id")) otherFeatures = true;
        }
        if (otherFeatures) return false;

        if (!node.classNames().isEmpty() && ClassClassifier.allUtility(node.classNames())) return true;
        return Vocabulary.LAYOUT_TAGS.contains(node.tagName()) && node.classNames().isEmpty();
    }

    // ── Fallbacks ─────────────────────────────────────────────────────────

    private Optional<AnchorResult> featureFallback(TreeNode target) {
        TreeNode document = target.document();
        if (document == null) return Optional.empty();

        int depth = 0;
        for (TreeNode current = target.parent();
             current != null && depth < maxDepth && !isDocumentBoundary(current);
             current = current.parent(), depth++) {
            if (isForbidden(current)) continue;
            Semantics semantics = extractor.extract(current);
            if (semantics.isEmpty()) continue;
            String selector = synthesizer.nodeSelector(current.tagName(), semantics);
            if (query.matchesOnly(document, selector, current)) {
                double score = Math.min(weights.degradedCap(), penalize(weights.semanticTag(), depth));
                return Optional.of(new AnchorResult(current, score, AnchorTier.FEATURE_FALLBACK, depth));
            }
        }
        return Optional.empty();
    }

    private Optional<AnchorResult> documentRoot(TreeNode target) {
        if (!fallbackToDocumentRoot) {
            log.debug("No anchor for <{}> and document-root fallback is disabled", target.tagName());
            return Optional.empty();
        }
        TreeNode root = target;
        int depth = -1;
        for (TreeNode current = target.parent(); current != null; current = current.parent()) {
            root = current;
            depth++;
            if ("body".equals(current.tagName())) break;
        }
        return Optional.of(new AnchorResult(root, weights.degradedCap(), AnchorTier.DOCUMENT_ROOT, Math.max(0, depth)));
    }
}
