package stableid.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stableid.generator.AnchorResult;
import stableid.generator.AnchorTier;
import stableid.model.ElementIdentity;
import stableid.model.Semantics;
import stableid.tree.TreeNode;

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.WeakHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Injectable cache for generation work: per-node descriptors, anchor results
 * and semantics, plus per-root selector query results.
 *
 * <p>Node-keyed maps hold their keys weakly, and cached values never hold a
 * strong reference to another node, so a node that leaves the tree does not
 * keep its entries alive. Selector results are kept per query root in an LRU
 * of bounded size.
 *
 * <p>All access goes through one lock; lookups are plain map reads and never
 * wait on a computation. A miss simply returns empty and the caller
 * recomputes. Cached entries describe the tree at the time they were
 * written: callers that mutate a tree must {@link #clear()} the cache.
 */
public class EidCache {

    private static final Logger log = LoggerFactory.getLogger(EidCache.class);

    public static final int DEFAULT_SELECTOR_CAPACITY = 1000;

    private static volatile EidCache shared;

    private final Object lock = new Object();
    private final int selectorCapacity;

    private final Map<TreeNode, ElementIdentity> eids = new WeakHashMap<>();
    private final Map<TreeNode, CachedAnchor> anchors = new WeakHashMap<>();
    private final Map<TreeNode, Semantics> semantics = new WeakHashMap<>();
    private final Map<TreeNode, SelectorLru> selectorResults = new WeakHashMap<>();

    private final AtomicLong eidHits = new AtomicLong();
    private final AtomicLong eidMisses = new AtomicLong();
    private final AtomicLong anchorHits = new AtomicLong();
    private final AtomicLong anchorMisses = new AtomicLong();
    private final AtomicLong semanticsHits = new AtomicLong();
    private final AtomicLong semanticsMisses = new AtomicLong();
    private final AtomicLong selectorHits = new AtomicLong();
    private final AtomicLong selectorMisses = new AtomicLong();

    public EidCache() {
        this(DEFAULT_SELECTOR_CAPACITY);
    }

    public EidCache(int selectorCapacity) {
        if (selectorCapacity < 1) {
            throw new IllegalArgumentException("selectorCapacity must be >= 1, got " + selectorCapacity);
        }
        this.selectorCapacity = selectorCapacity;
    }

    // ── Default instance ──────────────────────────────────────────────────

    /**
     * Process-wide default instance, created on first use. Nothing in the
     * generator uses it unless it is passed in explicitly.
     */
    public static EidCache shared() {
        if (shared == null) {
            synchronized (EidCache.class) {
                if (shared == null) {
                    shared = new EidCache();
                    log.debug("Created shared EidCache");
                }
            }
        }
        return shared;
    }

    /** Drops the default instance; the next {@link #shared()} call creates a fresh one. */
    public static void resetShared() {
        synchronized (EidCache.class) {
            if (shared != null) shared.clear();
            shared = null;
        }
    }

    // ── Descriptors ───────────────────────────────────────────────────────

    public Optional<ElementIdentity> getEid(TreeNode node) {
        ElementIdentity eid;
        synchronized (lock) {
            eid = eids.get(node);
        }
        count(eid != null, eidHits, eidMisses);
        return Optional.ofNullable(eid);
    }

    public void putEid(TreeNode node, ElementIdentity eid) {
        synchronized (lock) {
            eids.put(node, eid);
        }
    }

    // ── Anchors ───────────────────────────────────────────────────────────

    public Optional<AnchorResult> getAnchor(TreeNode node) {
        CachedAnchor cached;
        synchronized (lock) {
            cached = anchors.get(node);
        }
        TreeNode anchor = cached == null ? null : cached.element().get();
        if (cached != null && anchor == null) {
            synchronized (lock) {
                anchors.remove(node);
            }
        }
        count(anchor != null, anchorHits, anchorMisses);
        return anchor == null
                ? Optional.empty()
                : Optional.of(new AnchorResult(anchor, cached.score(), cached.tier(), cached.depth()));
    }

    public void putAnchor(TreeNode node, AnchorResult result) {
        CachedAnchor cached = new CachedAnchor(
                new WeakReference<>(result.element()), result.score(), result.tier(), result.depth());
        synchronized (lock) {
            anchors.put(node, cached);
        }
    }

    // ── Semantics ─────────────────────────────────────────────────────────

    public Optional<Semantics> getSemantics(TreeNode node) {
        Semantics value;
        synchronized (lock) {
            value = semantics.get(node);
        }
        count(value != null, semanticsHits, semanticsMisses);
        return Optional.ofNullable(value);
    }

    public void putSemantics(TreeNode node, Semantics value) {
        synchronized (lock) {
            semantics.put(node, value);
        }
    }

    // ── Selector results ──────────────────────────────────────────────────

    /**
     * Cached matches of {@code selector} evaluated against {@code root}; empty
     * when absent or when any matched node has since been collected.
     */
    public Optional<List<TreeNode>> getSelectorResults(TreeNode root, String selector) {
        List<WeakReference<TreeNode>> refs;
        synchronized (lock) {
            SelectorLru lru = selectorResults.get(root);
            refs = lru == null ? null : lru.get(selector);
        }
        if (refs == null) {
            selectorMisses.incrementAndGet();
            return Optional.empty();
        }
        List<TreeNode> nodes = new ArrayList<>(refs.size());
        for (WeakReference<TreeNode> ref : refs) {
            TreeNode n = ref.get();
            if (n == null) {
                selectorMisses.incrementAndGet();
                return Optional.empty();
            }
            nodes.add(n);
        }
        selectorHits.incrementAndGet();
        return Optional.of(List.copyOf(nodes));
    }

    public void putSelectorResults(TreeNode root, String selector, List<TreeNode> matches) {
        List<WeakReference<TreeNode>> refs = new ArrayList<>(matches.size());
        for (TreeNode n : matches) refs.add(new WeakReference<>(n));
        synchronized (lock) {
            selectorResults.computeIfAbsent(root, r -> new SelectorLru(selectorCapacity)).put(selector, refs);
        }
    }

    // ── Maintenance ───────────────────────────────────────────────────────

    public void clear() {
        synchronized (lock) {
            eids.clear();
            anchors.clear();
            semantics.clear();
            selectorResults.clear();
        }
        for (AtomicLong counter : List.of(eidHits, eidMisses, anchorHits, anchorMisses,
                semanticsHits, semanticsMisses, selectorHits, selectorMisses)) {
            counter.set(0);
        }
    }

    public CacheStats stats() {
        int eidEntries;
        int selectorEntries = 0;
        synchronized (lock) {
            eidEntries = eids.size();
            for (SelectorLru lru : selectorResults.values()) selectorEntries += lru.size();
        }
        return new CacheStats(
                eidHits.get(), eidMisses.get(),
                anchorHits.get(), anchorMisses.get(),
                semanticsHits.get(), semanticsMisses.get(),
                selectorHits.get(), selectorMisses.get(),
                eidEntries, selectorEntries);
    }

    private static void count(boolean hit, AtomicLong hits, AtomicLong misses) {
        (hit ? hits : misses).incrementAndGet();
    }

    // ── Internals ─────────────────────────────────────────────────────────

    private record CachedAnchor(WeakReference<TreeNode> element, double score, AnchorTier tier, int depth) {}

    private static final class SelectorLru extends LinkedHashMap<String, List<WeakReference<TreeNode>>> {

        private final int capacity;

        SelectorLru(int capacity) {
            super(16, 0.75f, true);
            this.capacity = capacity;
        }

        @Override
        protected boolean removeEldestEntry(Map.Entry<String, List<WeakReference<TreeNode>>> eldest) {
            return size() > capacity;
        }
    }
}
