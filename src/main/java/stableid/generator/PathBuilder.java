package stableid.generator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stableid.resolver.SelectorSynthesizer;
import stableid.tree.TreeNode;
import stableid.util.AttributeRules;
import stableid.util.ClassClassifier;
import stableid.util.IdHeuristics;
import stableid.util.Vocabulary;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Collects the semantic nodes between anchor and target.
 *
 * <p>Layout noise is dropped. If the selector derived from the kept nodes is
 * not unique in the document, dropped nodes are put back one at a time,
 * nearest to the target first, until it is. Walks longer than
 * {@code maxPathDepth} keep the nodes nearest the target and are degraded.
 */
public class PathBuilder {

    private static final Logger log = LoggerFactory.getLogger(PathBuilder.class);

    private final int maxDepth;
    private final FeatureExtractor extractor;
    private final SelectorSynthesizer synthesizer;
    private final NodeQuery query;

    public PathBuilder(GeneratorOptions options, FeatureExtractor extractor, SelectorSynthesizer synthesizer) {
        this.maxDepth = options.getMaxPathDepth();
        this.extractor = extractor;
        this.synthesizer = synthesizer;
        this.query = new NodeQuery(options.getCache());
    }

    public PathResult build(TreeNode anchor, TreeNode target) {
        if (anchor.equals(target)) return new PathResult(List.of(), false, isUnique(anchor, List.of(), target));

        List<TreeNode> raw = new ArrayList<>();
        for (TreeNode n = target.parent(); n != null && !n.equals(anchor); n = n.parent()) {
            raw.add(0, n);
        }

        boolean degraded = false;
        if (raw.size() > maxDepth) {
            log.debug("Path to <{}> has {} levels, truncating to {}", target.tagName(), raw.size(), maxDepth);
            raw = new ArrayList<>(raw.subList(raw.size() - maxDepth, raw.size()));
            degraded = true;
        }

        List<TreeNode> kept = new ArrayList<>();
        List<TreeNode> dropped = new ArrayList<>();
        for (TreeNode node : raw) {
            if (isSemantic(node)) kept.add(node);
            else dropped.add(node);
        }

        boolean unique = isUnique(anchor, kept, target);
        for (int i = dropped.size() - 1; i >= 0 && !unique; i--) {
            kept = insertInOrder(kept, dropped.get(i), raw);
            unique = isUnique(anchor, kept, target);
        }
        if (!unique) log.debug("Path to <{}> is not unique even with every node restored", target.tagName());

        return new PathResult(kept, degraded, unique);
    }

    /**
     * Semantic tag, captured attribute, stable class, interactive role,
     * stable id, or vector content (vector steps are joined by child
     * combinators and cannot skip levels).
     */
    static boolean isSemantic(TreeNode node) {
        String tag = node.tagName();
        if (Vocabulary.SEMANTIC_TAGS.contains(tag)) return true;
        if ("svg".equals(tag) || Vocabulary.SVG_CHILD_TAGS.contains(tag)) return true;

        String role = node.attribute("role");
        if (role != null && Vocabulary.INTERACTIVE_ROLES.contains(role.trim())) return true;

        String id = node.id();
        if (id != null && IdHeuristics.isStableId(id)) return true;

        for (Map.Entry<String, String> e : node.attributes().entrySet()) {
            if (e.getKey().startsWith("aria-") || AttributeRules.shouldCapture(e.getKey(), e.getValue())) return true;
        }
        for (String cls : node.classNames()) {
            if (ClassClassifier.isStable(cls)) return true;
        }
        return false;
    }

    private boolean isUnique(TreeNode anchor, List<TreeNode> path, TreeNode target) {
        TreeNode document = target.document();
        if (document == null) return false;

        List<String> tags = new ArrayList<>();
        List<String> fragments = new ArrayList<>();
        if (!anchor.equals(target)) add(anchor, tags, fragments);
        for (TreeNode node : path) add(node, tags, fragments);
        add(target, tags, fragments);

        return query.matchesOnly(document, SelectorSynthesizer.join(tags, fragments), target);
    }

    private void add(TreeNode node, List<String> tags, List<String> fragments) {
        tags.add(node.tagName());
        fragments.add(synthesizer.nodeSelector(node.tagName(), extractor.extract(node)));
    }

    private static List<TreeNode> insertInOrder(List<TreeNode> kept, TreeNode node, List<TreeNode> raw) {
        int position = raw.indexOf(node);
        List<TreeNode> result = new ArrayList<>(kept);
        int at = 0;
        while (at < result.size() && raw.indexOf(result.get(at)) < position) at++;
        result.add(at, node);
        return result;
    }
}
