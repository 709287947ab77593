package stableid.generator;

import stableid.tree.TreeNode;

import java.util.List;

/**
 * Kept path nodes in anchor-to-target order.
 *
 * @param nodes    kept intermediate nodes, anchor and target excluded
 * @param degraded true if the walk exceeded the maximum depth and was truncated
 * @param unique   true if the derived selector matched exactly the target at build time
 */
public record PathResult(List<TreeNode> nodes, boolean degraded, boolean unique) {

    public PathResult {
        nodes = List.copyOf(nodes);
    }
}
