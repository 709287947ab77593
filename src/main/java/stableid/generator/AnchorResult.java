package stableid.generator;

import stableid.tree.TreeNode;

/**
 * Outcome of the anchor search.
 *
 * @param element the chosen anchor
 * @param score   anchor score in [0,1]
 * @param tier    how the anchor was chosen
 * @param depth   levels above the target's parent (0 = the parent itself)
 */
public record AnchorResult(TreeNode element, double score, AnchorTier tier, int depth) {

    public boolean degraded() {
        return tier.isDegraded();
    }
}
