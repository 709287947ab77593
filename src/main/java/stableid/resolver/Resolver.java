package stableid.resolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stableid.model.Constraint;
import stableid.model.DegradationReason;
import stableid.model.ElementIdentity;
import stableid.model.NodeDescriptor;
import stableid.tree.SelectorException;
import stableid.tree.TreeAccessException;
import stableid.tree.TreeNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resolves a descriptor back to live nodes in five phases:
 * <ol>
 *   <li>narrowing: query the base selector, capped at {@code maxCandidates};
 *       when nothing matches, try a reconciled selector before giving up;</li>
 *   <li>filtering: keep candidates whose live semantics match, with one
 *       penalized lenient-text retry;</li>
 *   <li>exactly one candidate is a success;</li>
 *   <li>constraints in priority order until one candidate is left;</li>
 *   <li>residual ambiguity through strict mode or the {@code onMultiple} rule.</li>
 * </ol>
 *
 * <p>Never throws for expected outcomes. Query failures become {@code error}
 * results with reason {@code invalid-selector}, tree access failures
 * {@code invalid-context}. Instances hold no per-call state and may be reused.
 */
public class Resolver {

    private static final Logger log = LoggerFactory.getLogger(Resolver.class);

    static final double RELAXED_FACTOR = 0.8;
    static final double CONSTRAINED_FACTOR = 0.9;
    static final double STRICT_AMBIGUOUS_FACTOR = 0.7;

    private final ResolverOptions options;
    private final SelectorSynthesizer synthesizer;
    private final SemanticsFilter filter;
    private final ConstraintEvaluator evaluator;
    private final FallbackHandler fallback;

    public Resolver() {
        this(ResolverOptions.defaults());
    }

    public Resolver(ResolverOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.filter = new SemanticsFilter();
        this.synthesizer = new SelectorSynthesizer(options.getMaxSelectorClasses(), filter);
        this.evaluator = new ConstraintEvaluator();
        this.fallback = new FallbackHandler(synthesizer, options.getScoring().match());
    }

    public ResolverOptions getOptions() {
        return options;
    }

    /**
     * @param eid  descriptor to resolve
     * @param root query root: a document or an element of one
     */
    public ResolveResult resolve(ElementIdentity eid, TreeNode root) {
        Objects.requireNonNull(eid, "eid");
        Objects.requireNonNull(root, "root");

        if (eid.anchor() == null || eid.target() == null) {
            return ResolveResult.error(DegradationReason.INVALID_SELECTOR, "Descriptor has no anchor or target");
        }
        try {
            if (!root.isDocument() && !root.isConnected()) {
                return ResolveResult.error(DegradationReason.INVALID_CONTEXT,
                        "Failed to resolve document context", "Root <" + root.tagName() + "> is detached");
            }
            ResolveResult result = resolveConnected(eid, root);
            if (result.meta().degraded()) {
                log.debug("Resolved <{}> as {} ({})", eid.target().tag(), result.status(), result.reason());
            }
            return result;
        } catch (SelectorException e) {
            log.debug("Query failed: {}", e.getMessage());
            return ResolveResult.error(DegradationReason.INVALID_SELECTOR,
                    "Invalid CSS selector: " + e.getSelector(), "Error: " + causeMessage(e));
        } catch (TreeAccessException e) {
            log.debug("Tree access failed: {}", e.getMessage());
            return ResolveResult.error(DegradationReason.INVALID_CONTEXT,
                    "Failed to read the tree", "Error: " + e.getMessage());
        }
    }

    private ResolveResult resolveConnected(ElementIdentity eid, TreeNode root) {
        NodeDescriptor target = eid.target();
        List<String> notes = new ArrayList<>();

        // ── Phase 1: narrowing ──
        String selector = synthesizer.baseSelector(eid);
        List<TreeNode> candidates = root.select(selector);
        log.debug("Narrowing '{}' -> {} candidate(s)", selector, candidates.size());

        if (candidates.isEmpty()) {
            SelectorSynthesizer.SelectorResult recovered = synthesizer.synthesize(eid, root);
            if (recovered.unique()) {
                candidates = root.select(recovered.selector());
                notes.add("Base selector matched nothing, recovered via " + recovered.strategy()
                        + " selector: " + recovered.selector());
                log.debug("Drift recovery '{}' -> {} candidate(s)", recovered.selector(), candidates.size());
            }
        }

        int queried = candidates.size();
        if (queried > options.getMaxCandidates()) {
            candidates = candidates.subList(0, options.getMaxCandidates());
            notes.add("Candidates truncated to " + options.getMaxCandidates() + " of " + queried);
        }

        // ── Phase 2: filtering ──
        List<TreeNode> filtered = filter.filter(candidates, target.semantics(), false);
        log.debug("Filtering kept {}/{}", filtered.size(), candidates.size());

        if (filtered.isEmpty() && queried > 0 && target.semantics().hasText()) {
            List<TreeNode> lenient = filter.filter(candidates, target.semantics(), true);
            if (lenient.size() == 1) {
                return ResolveResult.degraded(ResolveStatus.SUCCESS, lenient, eid.confidence() * RELAXED_FACTOR,
                        DegradationReason.RELAXED_TEXT_MATCHING,
                        "Used relaxed text matching due to exact match failure").withWarnings(notes);
            }
            if (lenient.size() > 1) {
                ResolveResult settled = constrainAndSettle(lenient, eid, root);
                if (settled.status() == ResolveStatus.SUCCESS || settled.status() == ResolveStatus.AMBIGUOUS) {
                    return relaxed(settled).withWarnings(notes);
                }
            }
        }

        // ── Phase 3: unique ──
        if (filtered.size() == 1) {
            return new ResolveResult(ResolveStatus.SUCCESS, filtered, eid.confidence(), notes,
                    ResolveResult.ResolveMeta.CLEAN);
        }

        if (filtered.isEmpty()) {
            String diagnostic = queried > 0
                    ? "Selector found " + queried + " candidate(s) but semantic filtering rejected all"
                    : "Selector found no candidates";
            notes.add(diagnostic);
            if (options.isEnableFallback()) {
                return fallback.handleMissing(eid, root).withWarnings(notes);
            }
            return ResolveResult.error(DegradationReason.NOT_FOUND, "No matching elements found").withWarnings(notes);
        }

        // ── Phases 4 and 5 ──
        return constrainAndSettle(filtered, eid, root).withWarnings(notes);
    }

    private ResolveResult constrainAndSettle(List<TreeNode> candidates, ElementIdentity eid, TreeNode root) {
        List<TreeNode> remaining = candidates;
        boolean positional = false;

        for (Constraint constraint : ConstraintEvaluator.byPriority(eid.constraints())) {
            ConstraintEvaluator.Outcome outcome = evaluator.apply(remaining, constraint);
            remaining = outcome.candidates();
            positional |= outcome.degraded();
            log.debug("Constraint {} -> {} candidate(s)", constraint.type(), remaining.size());

            if (remaining.size() == 1) {
                double confidence = eid.confidence() * CONSTRAINED_FACTOR;
                if (positional) {
                    return ResolveResult.degraded(ResolveStatus.SUCCESS, remaining, confidence,
                            DegradationReason.AMBIGUOUS,
                            "Position constraint picked one of " + candidates.size() + " candidates");
                }
                return ResolveResult.success(remaining.get(0), confidence);
            }
            if (remaining.isEmpty()) {
                if (options.isEnableFallback()) return fallback.handleMissing(eid, root);
                return ResolveResult.error(DegradationReason.OVER_CONSTRAINED, "Constraints eliminated all candidates");
            }
        }

        // ── Phase 5: residual ambiguity ──
        if (options.isRequireUniqueness()) {
            return ResolveResult.error(DegradationReason.AMBIGUOUS,
                    "Non-unique resolution: " + remaining.size() + " matches (uniqueness required)");
        }
        if (options.isStrictMode()) {
            return ResolveResult.degraded(ResolveStatus.AMBIGUOUS, remaining,
                    eid.confidence() * STRICT_AMBIGUOUS_FACTOR, DegradationReason.AMBIGUOUS,
                    "Non-unique resolution: " + remaining.size() + " matches");
        }
        return fallback.handleAmbiguous(remaining, eid, root);
    }

    private ResolveResult relaxed(ResolveResult settled) {
        ResolveResult.ResolveMeta meta = settled.meta().degraded()
                ? settled.meta()
                : ResolveResult.ResolveMeta.degraded(DegradationReason.RELAXED_TEXT_MATCHING);
        List<String> warnings = new ArrayList<>(settled.warnings());
        warnings.add("Used relaxed text matching");
        return new ResolveResult(settled.status(), settled.matches(), settled.confidence() * RELAXED_FACTOR,
                warnings, meta);
    }

    private static String causeMessage(SelectorException e) {
        return e.getCause() != null && e.getCause().getMessage() != null ? e.getCause().getMessage() : e.getMessage();
    }
}
