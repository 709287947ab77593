package stableid.generator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stableid.cache.EidCache;
import stableid.tree.SelectorException;
import stableid.tree.TreeNode;

import java.util.List;
import java.util.Optional;

/**
 * Selector evaluation for generation-time uniqueness checks, backed by the
 * optional cache. A selector that fails to evaluate counts as matching
 * nothing; generation never propagates query errors.
 */
final class NodeQuery {

    private static final Logger log = LoggerFactory.getLogger(NodeQuery.class);

    private final EidCache cache;

    NodeQuery(EidCache cache) {
        this.cache = cache;
    }

    List<TreeNode> select(TreeNode root, String selector) {
        if (cache != null) {
            Optional<List<TreeNode>> cached = cache.getSelectorResults(root, selector);
            if (cached.isPresent()) return cached.get();
        }
        List<TreeNode> matches;
        try {
            matches = root.select(selector);
        } catch (SelectorException e) {
            log.debug("Uniqueness check skipped for '{}': {}", selector, e.getMessage());
            return List.of();
        }
        if (cache != null) cache.putSelectorResults(root, selector, matches);
        return matches;
    }

    /** True if the selector matches exactly {@code expected} and nothing else. */
    boolean matchesOnly(TreeNode root, String selector, TreeNode expected) {
        List<TreeNode> matches = select(root, selector);
        return matches.size() == 1 && matches.get(0).equals(expected);
    }
}
