package stableid.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stableid.StableIdException;
import stableid.cache.EidCache;
import stableid.generator.EidGenerator;
import stableid.generator.GeneratorOptions;
import stableid.model.ElementIdentity;
import stableid.resolver.ResolveResult;
import stableid.resolver.Resolver;
import stableid.tree.TreeNode;
import stableid.util.AttributeRules;
import stableid.util.IdHeuristics;
import stableid.util.Vocabulary;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Generates descriptors for many nodes, or resolves many descriptors, with
 * progress reporting and cooperative cancellation between nodes.
 *
 * <p>All generation in one batch shares one cache: the one configured in the
 * generator options, or a private cache created for this generator.
 */
public class BatchGenerator {

    private static final Logger log = LoggerFactory.getLogger(BatchGenerator.class);

    /** Tags worth describing even without ids, roles or markers. */
    static final Set<String> MEANINGFUL_TAGS = Set.of(
            "form", "main", "nav", "section", "article", "footer", "header",
            "button", "a", "input", "label", "select", "textarea");

    private static final int PRIORITY_HIGH = 3;
    private static final int PRIORITY_MEDIUM = 2;
    private static final int PRIORITY_LOW = 1;

    private final EidCache cache;
    private final EidGenerator generator;

    public BatchGenerator() {
        this(GeneratorOptions.defaults());
    }

    public BatchGenerator(GeneratorOptions options) {
        this.cache = options.getCache() != null ? options.getCache() : new EidCache();
        this.generator = new EidGenerator(options.toBuilder().cache(cache).build());
    }

    public EidCache getCache() {
        return cache;
    }

    // ── Generation ────────────────────────────────────────────────────────

    /** Every element below {@code root} (and {@code root} itself if it is an element). */
    public BatchResult generate(TreeNode root, BatchOptions options) {
        return generate(root.select("*"), options);
    }

    public BatchResult generate(List<TreeNode> nodes, BatchOptions options) {
        long start = System.currentTimeMillis();

        List<TreeNode> selected = new ArrayList<>();
        for (TreeNode node : nodes) {
            if (!shouldSkip(node, options.isSkipNonSemantic())) selected.add(node);
        }
        if (options.isPrioritize()) {
            selected.sort(Comparator.comparingInt(BatchGenerator::priority).reversed());
        }
        if (selected.size() > options.getLimit()) selected = selected.subList(0, options.getLimit());

        List<BatchResult.Entry> results = new ArrayList<>();
        List<BatchResult.Failure> failed = new ArrayList<>();
        int skipped = 0;
        boolean cancelled = false;
        double confidenceSum = 0.0;
        int total = selected.size();

        for (int i = 0; i < total; i++) {
            if (options.getCancelled().getAsBoolean()) {
                cancelled = true;
                log.info("Batch cancelled after {} of {} nodes", i, total);
                break;
            }
            TreeNode node = selected.get(i);
            try {
                boolean cached = cache.getEid(node).isPresent();
                Optional<ElementIdentity> eid = generator.generate(node);
                if (eid.isPresent()) {
                    results.add(new BatchResult.Entry(node, eid.get(), cached));
                    confidenceSum += eid.get().confidence();
                } else {
                    skipped++;
                }
            } catch (StableIdException e) {
                log.debug("Generation failed for <{}>: {}", node.tagName(), e.getMessage());
                failed.add(new BatchResult.Failure(node, e.getMessage()));
            }
            if ((i + 1) % options.getProgressInterval() == 0) {
                options.getProgressListener().onProgress(i + 1, total);
            }
        }
        options.getProgressListener().onProgress(cancelled ? results.size() + failed.size() + skipped : total, total);

        long elapsed = System.currentTimeMillis() - start;
        double average = results.isEmpty() ? 0.0 : confidenceSum / results.size();
        BatchResult.Stats stats = new BatchResult.Stats(total, results.size(), failed.size(), skipped, cancelled,
                average, elapsed, cache.stats().hitRate());
        log.info("Batch generated {} descriptor(s) for {} node(s) in {} ms ({} failed, {} skipped)",
                results.size(), total, elapsed, failed.size(), skipped);
        return new BatchResult(results, failed, stats);
    }

    // ── Resolution ────────────────────────────────────────────────────────

    /**
     * Resolves each descriptor against {@code root}. Stops early, returning
     * the results so far, when the options report cancellation.
     */
    public List<ResolveResult> resolveAll(List<ElementIdentity> eids, TreeNode root, Resolver resolver,
                                          BatchOptions options) {
        List<ResolveResult> results = new ArrayList<>(eids.size());
        for (int i = 0; i < eids.size(); i++) {
            if (options.getCancelled().getAsBoolean()) {
                log.info("Resolution batch cancelled after {} of {} descriptors", i, eids.size());
                break;
            }
            results.add(resolver.resolve(eids.get(i), root));
            if ((i + 1) % options.getProgressInterval() == 0) {
                options.getProgressListener().onProgress(i + 1, eids.size());
            }
        }
        options.getProgressListener().onProgress(results.size(), eids.size());
        return results;
    }

    public List<ResolveResult> resolveAll(List<ElementIdentity> eids, TreeNode root) {
        return resolveAll(eids, root, new Resolver(), BatchOptions.defaults());
    }

    // ── Selection ─────────────────────────────────────────────────────────

    static boolean shouldSkip(TreeNode node, boolean skipNonSemantic) {
        if (node.isDocument() || Vocabulary.NON_CONTENT_TAGS.contains(node.tagName())) return true;
        return skipNonSemantic && priority(node) == PRIORITY_LOW && !MEANINGFUL_TAGS.contains(node.tagName());
    }

    static int priority(TreeNode node) {
        String id = node.id();
        if (id != null && IdHeuristics.isStableId(id)) return PRIORITY_HIGH;
        if (node.hasAttribute("role") || node.hasAttribute("aria-label") || node.hasAttribute("aria-labelledby")) {
            return PRIORITY_MEDIUM;
        }
        for (String name : node.attributes().keySet()) {
            if (AttributeRules.isTestMarker(name)) return PRIORITY_MEDIUM;
        }
        return PRIORITY_LOW;
    }
}
