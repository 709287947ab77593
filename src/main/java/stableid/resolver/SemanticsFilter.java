package stableid.resolver;

import stableid.generator.FeatureExtractor;
import stableid.generator.GeometryFingerprinter;
import stableid.model.GeometryFingerprint;
import stableid.model.MatchMode;
import stableid.model.Semantics;
import stableid.model.TextContent;
import stableid.tree.TreeNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Keeps candidates whose live features match the recorded target: text,
 * attributes and geometry fingerprint.
 *
 * <p>The strict pass compares text per the recorded match mode. The lenient
 * pass accepts text when either side contains the other; the resolver uses it
 * only as an explicit, penalized retry.
 */
public class SemanticsFilter {

    private final GeometryFingerprinter fingerprinter;

    public SemanticsFilter() {
        this(new GeometryFingerprinter());
    }

    public SemanticsFilter(GeometryFingerprinter fingerprinter) {
        this.fingerprinter = fingerprinter;
    }

    public List<TreeNode> filter(List<TreeNode> candidates, Semantics recorded, boolean lenient) {
        List<TreeNode> kept = new ArrayList<>();
        for (TreeNode candidate : candidates) {
            if (matches(candidate, recorded, lenient)) kept.add(candidate);
        }
        return kept;
    }

    public boolean matches(TreeNode candidate, Semantics recorded, boolean lenient) {
        return textMatches(candidate, recorded.text(), lenient)
                && attributesMatch(candidate, recorded.attributes())
                && geometryMatches(candidate, recorded.geometry());
    }

    // ── Criteria ──────────────────────────────────────────────────────────

    boolean textMatches(TreeNode candidate, TextContent recorded, boolean lenient) {
        if (recorded == null || recorded.normalized().isEmpty()) return true;
        String live = FeatureExtractor.liveText(candidate);
        String expected = recorded.normalized();

        if (lenient) {
            return !live.isEmpty() && (live.contains(expected) || expected.contains(live));
        }
        return recorded.matchMode() == MatchMode.PARTIAL ? live.contains(expected) : live.equals(expected);
    }

    boolean attributesMatch(TreeNode candidate, Map<String, String> recorded) {
        for (Map.Entry<String, String> e : recorded.entrySet()) {
            if (!RouteScorer.attributeEquals(e.getKey(), e.getValue(), candidate.attribute(e.getKey()))) {
                return false;
            }
        }
        return true;
    }

    boolean geometryMatches(TreeNode candidate, GeometryFingerprint recorded) {
        if (recorded == null) return true;
        if (!fingerprinter.isVectorShape(candidate)) return false;
        GeometryFingerprint live = fingerprinter.fingerprint(candidate);

        if (recorded.shape() != live.shape()) return false;
        if (recorded.titleText() != null && !recorded.titleText().equals(live.titleText())) return false;
        // Animated shapes change their geometry over time; shape and title are enough.
        if (recorded.hasAnimation()) return true;
        if (recorded.dHash() != null && !Objects.equals(recorded.dHash(), live.dHash())) return false;
        return recorded.geomHash() == null || Objects.equals(recorded.geomHash(), live.geomHash());
    }
}
