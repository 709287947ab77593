package stableid.cache;

/**
 * Snapshot of {@link EidCache} counters.
 */
public record CacheStats(
        long eidHits,
        long eidMisses,
        long anchorHits,
        long anchorMisses,
        long semanticsHits,
        long semanticsMisses,
        long selectorHits,
        long selectorMisses,
        int eidEntries,
        int selectorEntries) {

    public long totalHits() {
        return eidHits + anchorHits + semanticsHits + selectorHits;
    }

    public long totalMisses() {
        return eidMisses + anchorMisses + semanticsMisses + selectorMisses;
    }

    /** Hit ratio over all lookups, 0 when nothing was looked up. */
    public double hitRate() {
        long total = totalHits() + totalMisses();
        return total == 0 ? 0.0 : (double) totalHits() / total;
    }
}
