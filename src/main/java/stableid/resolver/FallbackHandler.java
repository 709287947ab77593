package stableid.resolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stableid.generator.FeatureExtractor;
import stableid.model.DegradationReason;
import stableid.model.ElementIdentity;
import stableid.model.Semantics;
import stableid.scoring.MatchWeights;
import stableid.tree.BoundingBox;
import stableid.tree.SelectorException;
import stableid.tree.TreeNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Applies the descriptor's fallback rules when the target is missing
 * ({@code onMissing}) or still ambiguous after constraints ({@code onMultiple}).
 */
public class FallbackHandler {

    private static final Logger log = LoggerFactory.getLogger(FallbackHandler.class);

    static final double ANCHOR_FACTOR = 0.3;
    static final double FIRST_FACTOR = 0.7;
    static final double BEST_SCORE_BASE = 0.7;
    static final double BEST_SCORE_SPAN = 0.2;
    static final double ALLOW_MULTIPLE_FACTOR = 0.5;
    static final double TIE_EPSILON = 1e-9;

    private final SelectorSynthesizer synthesizer;
    private final MatchWeights weights;

    public FallbackHandler(SelectorSynthesizer synthesizer, MatchWeights weights) {
        this.synthesizer = synthesizer;
        this.weights = weights;
    }

    // ── onMissing ─────────────────────────────────────────────────────────

    public ResolveResult handleMissing(ElementIdentity eid, TreeNode root) {
        return switch (eid.fallbackOrDefault().onMissing()) {
            case ANCHOR_ONLY -> anchorOnly(eid, root);
            case STRICT -> ResolveResult.error(DegradationReason.STRICT_NOT_FOUND, "Element not found (strict mode)");
            case NONE -> ResolveResult.error(DegradationReason.NOT_FOUND, "Element not found");
        };
    }

    private ResolveResult anchorOnly(ElementIdentity eid, TreeNode root) {
        String selector = null;
        try {
            selector = synthesizer.anchorSelector(eid, root);
            List<TreeNode> anchors = root.select(selector);
            if (!anchors.isEmpty()) {
                log.debug("Target missing, falling back to anchor '{}'", selector);
                return ResolveResult.degraded(ResolveStatus.DEGRADED_FALLBACK, List.of(anchors.get(0)),
                        eid.confidence() * ANCHOR_FACTOR, DegradationReason.ANCHOR_FALLBACK,
                        "Target not found, returning anchor");
            }
        } catch (SelectorException e) {
            return ResolveResult.error(DegradationReason.INVALID_SELECTOR,
                    "Invalid anchor selector: " + e.getSelector(), "Error: " + e.getMessage());
        }
        return ResolveResult.error(DegradationReason.ANCHOR_NOT_FOUND,
                "Anchor also not found: " + selector);
    }

    // ── onMultiple ────────────────────────────────────────────────────────

    /**
     * @param candidates two or more candidates in document order
     * @param root       query root, used to break best-score ties by recorded position
     */
    public ResolveResult handleAmbiguous(List<TreeNode> candidates, ElementIdentity eid, TreeNode root) {
        return switch (eid.fallbackOrDefault().onMultiple()) {
            case FIRST -> ResolveResult.degraded(ResolveStatus.SUCCESS, List.of(candidates.get(0)),
                    eid.confidence() * FIRST_FACTOR, DegradationReason.AMBIGUOUS,
                    "Multiple matches (" + candidates.size() + "), returning first");
            case BEST_SCORE -> bestScore(candidates, eid, root);
            case ALLOW_MULTIPLE -> ResolveResult.degraded(ResolveStatus.AMBIGUOUS, candidates,
                    eid.confidence() * ALLOW_MULTIPLE_FACTOR, DegradationReason.AMBIGUOUS,
                    "Multiple matches: " + candidates.size());
        };
    }

    private ResolveResult bestScore(List<TreeNode> candidates, ElementIdentity eid, TreeNode root) {
        Semantics target = eid.target().semantics();
        List<TreeNode> tied = new ArrayList<>();
        double bestScore = -1.0;
        for (TreeNode candidate : candidates) {
            double s = score(candidate, target);
            if (s > bestScore + TIE_EPSILON) {
                bestScore = s;
                tied.clear();
            }
            if (s > bestScore - TIE_EPSILON) tied.add(candidate);
        }
        TreeNode best = tied.size() == 1 ? tied.get(0) : synthesizer.bestRouteTarget(eid, root, tied);
        log.debug("best-score picked {} with {}", best, bestScore);
        return ResolveResult.degraded(ResolveStatus.SUCCESS, List.of(best),
                eid.confidence() * (BEST_SCORE_BASE + bestScore * BEST_SCORE_SPAN),
                DegradationReason.BEST_OF_MULTIPLE,
                "Multiple matches (" + candidates.size() + "), selected best-scoring element");
    }

    // ── Rescoring ─────────────────────────────────────────────────────────

    /**
     * Weighted match of a live candidate against the recorded semantics,
     * normalized by the weights of the criteria that apply.
     *
     * @return score in [0,1]
     */
    public double score(TreeNode candidate, Semantics recorded) {
        double score = 0.0;
        double max = weights.visibility();
        if (isVisible(candidate)) score += weights.visibility();

        if (recorded.hasId()) {
            max += weights.id();
            if (recorded.id().equals(candidate.id())) score += weights.id();
        }

        if (!recorded.classes().isEmpty()) {
            max += weights.classOverlap();
            List<String> live = candidate.classNames();
            long common = recorded.classes().stream().filter(live::contains).count();
            score += weights.classOverlap() * common / recorded.classes().size();
        }

        if (!recorded.attributes().isEmpty()) {
            max += weights.attributeOverlap();
            int agree = 0;
            for (Map.Entry<String, String> e : recorded.attributes().entrySet()) {
                if (RouteScorer.attributeEquals(e.getKey(), e.getValue(), candidate.attribute(e.getKey()))) agree++;
            }
            score += weights.attributeOverlap() * agree / recorded.attributes().size();
        }

        if (recorded.role() != null) {
            max += weights.role();
            if (recorded.role().equals(candidate.attribute("role"))) score += weights.role();
        }

        if (recorded.hasText()) {
            max += weights.text();
            String live = FeatureExtractor.liveText(candidate);
            String expected = recorded.text().normalized();
            if (live.equals(expected)) score += weights.text();
            else if (live.contains(expected)) score += weights.text() / 2;
        }

        return max > 0 ? score / max : 0.0;
    }

    /**
     * False if the node or an ancestor is hidden by the {@code hidden}
     * attribute or by inline {@code display:none}, {@code visibility:hidden}
     * or {@code opacity:0}, or if the node has live geometry with no area.
     */
    public static boolean isVisible(TreeNode node) {
        for (TreeNode n = node; n != null; n = n.parent()) {
            if (n.hasAttribute("hidden") || hiddenByStyle(n.attribute("style"))) return false;
        }
        Optional<BoundingBox> box = node.boundingBox();
        return box.isEmpty() || !box.get().isEmpty();
    }

    private static boolean hiddenByStyle(String style) {
        if (style == null || style.isBlank()) return false;
        for (String declaration : style.split(";")) {
            int colon = declaration.indexOf(':');
            if (colon < 0) continue;
            String property = declaration.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = declaration.substring(colon + 1).replace("!important", "").trim().toLowerCase(Locale.ROOT);
            switch (property) {
                case "display" -> { if (value.equals("none")) return true; }
                case "visibility" -> { if (value.equals("hidden") || value.equals("collapse")) return true; }
                case "opacity" -> { if (isZero(value)) return true; }
                default -> { }
            }
        }
        return false;
    }

    private static boolean isZero(String value) {
        try {
            return Double.parseDouble(value) == 0.0;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
