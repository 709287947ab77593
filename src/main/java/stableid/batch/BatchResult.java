package stableid.batch;

import stableid.model.ElementIdentity;
import stableid.tree.TreeNode;

import java.util.List;

/**
 * Outcome of a batch generation run.
 *
 * @param results descriptors in processing order
 * @param failed  nodes whose generation raised an error
 * @param stats   counters for the run
 */
public record BatchResult(List<Entry> results, List<Failure> failed, Stats stats) {

    public BatchResult {
        results = List.copyOf(results);
        failed = List.copyOf(failed);
    }

    /** @param fromCache true if the descriptor was served by the cache */
    public record Entry(TreeNode node, ElementIdentity eid, boolean fromCache) {}

    public record Failure(TreeNode node, String error) {}

    /**
     * @param total             nodes selected for processing (after skipping and limit)
     * @param generated         descriptors produced
     * @param failed            nodes that raised an error
     * @param skipped           nodes without a descriptor (detached or below threshold)
     * @param cancelled         true if the run stopped early
     * @param averageConfidence mean confidence of the produced descriptors, 0 when none
     * @param elapsedMillis     wall time of the run
     * @param cacheHitRate      cache hit rate at the end of the run
     */
    public record Stats(int total, int generated, int failed, int skipped, boolean cancelled,
                        double averageConfidence, long elapsedMillis, double cacheHitRate) {}
}
