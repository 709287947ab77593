package stableid.resolver;

import stableid.model.NodeDescriptor;
import stableid.model.Semantics;
import stableid.tree.TreeNode;
import stableid.util.AttributeRules;
import stableid.util.UrlCleaner;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Scores a live route between anchor and target against the recorded path.
 *
 * <p>The recorded path is a subsequence of the live route (noise nodes were
 * dropped at generation), so recorded nodes are aligned in order to the
 * first following live node with the same tag. Each recorded node then earns
 * up to {@link #TAG} for being found, {@link #OVERLAP} for class/attribute
 * agreement and {@link #POSITION} when its recorded sibling position still
 * holds; the target earns the overlap and position parts as well. The sum is
 * normalized to [0,1] and every unaligned live node costs
 * {@link #EXTRA_NODE_PENALTY}.
 */
final class RouteScorer {

    static final double TAG = 1.0;
    static final double OVERLAP = 0.5;
    static final double POSITION = 0.5;
    static final double EXTRA_NODE_PENALTY = 0.02;

    /** Live node aligned to each recorded node, {@code null} where none was found. */
    List<TreeNode> align(List<NodeDescriptor> recorded, List<TreeNode> live) {
        TreeNode[] aligned = new TreeNode[recorded.size()];
        int from = 0;
        for (int i = 0; i < recorded.size(); i++) {
            String tag = recorded.get(i).tag();
            for (int j = from; j < live.size(); j++) {
                if (live.get(j).tagName().equals(tag)) {
                    aligned[i] = live.get(j);
                    from = j + 1;
                    break;
                }
            }
        }
        return new ArrayList<>(Arrays.asList(aligned));
    }

    double score(List<NodeDescriptor> recorded, List<TreeNode> aligned, int liveLength,
                 NodeDescriptor target, TreeNode candidate) {
        double total = 0.0;
        double max = 0.0;
        int matched = 0;

        for (int i = 0; i < recorded.size(); i++) {
            NodeDescriptor node = recorded.get(i);
            max += TAG + OVERLAP + (node.nthChild() != null ? POSITION : 0.0);
            TreeNode live = aligned.get(i);
            if (live == null) continue;
            matched++;
            total += TAG + OVERLAP * overlap(node.semantics(), live) + positionScore(node, live);
        }

        max += OVERLAP + (target.nthChild() != null ? POSITION : 0.0);
        total += OVERLAP * overlap(target.semantics(), candidate) + positionScore(target, candidate);

        double normalized = max == 0.0 ? 1.0 : total / max;
        int extra = Math.max(0, liveLength - matched);
        return normalized - extra * EXTRA_NODE_PENALTY;
    }

    private static double positionScore(NodeDescriptor node, TreeNode live) {
        Integer nth = node.nthChild();
        return nth != null && nth == live.siblingIndex() ? POSITION : 0.0;
    }

    /**
     * Mean of class Jaccard similarity and attribute agreement, over the
     * features the recorded node has; 1.0 when it has neither.
     */
    static double overlap(Semantics recorded, TreeNode live) {
        double sum = 0.0;
        int parts = 0;

        if (!recorded.classes().isEmpty()) {
            List<String> liveClasses = live.classNames();
            int common = 0;
            for (String cls : recorded.classes()) {
                if (liveClasses.contains(cls)) common++;
            }
            int union = recorded.classes().size() + liveClasses.size() - common;
            sum += union == 0 ? 0.0 : (double) common / union;
            parts++;
        }

        if (!recorded.attributes().isEmpty()) {
            int agree = 0;
            for (Map.Entry<String, String> e : recorded.attributes().entrySet()) {
                if (attributeEquals(e.getKey(), e.getValue(), live.attribute(e.getKey()))) agree++;
            }
            sum += (double) agree / recorded.attributes().size();
            parts++;
        }

        return parts == 0 ? 1.0 : sum / parts;
    }

    static boolean attributeEquals(String name, String recorded, String live) {
        if (live == null) return false;
        if (AttributeRules.URL_ATTRIBUTES.contains(name)) {
            return UrlCleaner.pathOnly(recorded).equals(UrlCleaner.pathOnly(live.trim()));
        }
        return recorded.equals(live.trim());
    }
}
