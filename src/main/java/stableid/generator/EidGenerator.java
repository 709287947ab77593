package stableid.generator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stableid.cache.EidCache;
import stableid.model.Constraint;
import stableid.model.DegradationReason;
import stableid.model.EidMeta;
import stableid.model.ElementIdentity;
import stableid.model.NodeDescriptor;
import stableid.model.Semantics;
import stableid.resolver.SelectorSynthesizer;
import stableid.resolver.SemanticsFilter;
import stableid.scoring.Scorer;
import stableid.tree.TreeNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Produces an {@link ElementIdentity} for a node: anchor, semantic path,
 * target features, constraints, fallback rules and confidence.
 *
 * <p>Generation never throws for expected failures. The result is empty when
 * the node is the document or detached from it, when it belongs to a
 * different document than {@link GeneratorOptions#getRoot()}, when no anchor
 * can be found, or when confidence falls below the configured threshold.
 */
public class EidGenerator {

    private static final Logger log = LoggerFactory.getLogger(EidGenerator.class);

    static final int UNIQUENESS_PRIORITY = 100;
    static final int TEXT_PROXIMITY_PRIORITY = 60;

    private final GeneratorOptions options;
    private final FeatureExtractor extractor;
    private final AnchorFinder anchorFinder;
    private final PathBuilder pathBuilder;
    private final Scorer scorer;

    public EidGenerator() {
        this(GeneratorOptions.defaults());
    }

    public EidGenerator(GeneratorOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.extractor = new FeatureExtractor(options);
        SelectorSynthesizer synthesizer = new SelectorSynthesizer(
                options.getMaxSelectorClasses(), new SemanticsFilter());
        this.anchorFinder = new AnchorFinder(options, extractor, synthesizer);
        this.pathBuilder = new PathBuilder(options, extractor, synthesizer);
        this.scorer = new Scorer(options.getScoring());
    }

    public GeneratorOptions getOptions() {
        return options;
    }

    public Optional<ElementIdentity> generate(TreeNode target) {
        Objects.requireNonNull(target, "target");
        if (target.isDocument()) {
            log.debug("Cannot describe the document node itself");
            return Optional.empty();
        }
        if (!target.isConnected()) {
            log.debug("<{}> is detached, no descriptor", target.tagName());
            return Optional.empty();
        }
        if (isCrossDocument(target)) {
            log.warn("<{}> belongs to a different document than the configured root", target.tagName());
            return Optional.empty();
        }

        EidCache cache = options.getCache();
        if (cache != null) {
            Optional<ElementIdentity> cached = cache.getEid(target);
            if (cached.isPresent()) return cached;
        }

        Optional<AnchorResult> anchorResult = anchorFinder.find(target);
        if (anchorResult.isEmpty()) return Optional.empty();
        AnchorResult anchor = anchorResult.get();

        PathResult path = pathBuilder.build(anchor.element(), target);

        NodeDescriptor anchorNode = new NodeDescriptor(anchor.element().tagName(),
                extractor.extract(anchor.element()), anchor.score(), anchor.element().siblingIndex(),
                anchor.degraded());

        List<NodeDescriptor> pathNodes = new ArrayList<>();
        List<Double> pathScores = new ArrayList<>();
        for (TreeNode node : path.nodes()) {
            NodeDescriptor descriptor = describe(node);
            pathNodes.add(descriptor);
            pathScores.add(descriptor.score());
        }
        NodeDescriptor targetNode = describe(target);

        // A truncated path is only possible under a document-root anchor, whose
        // own degraded flag still records the fallback.
        boolean degraded = anchor.degraded() || path.degraded();
        DegradationReason reason = path.degraded() ? DegradationReason.PATH_DEPTH_EXCEEDED
                : anchor.degraded() ? DegradationReason.ANCHOR_FALLBACK
                : null;

        double confidence = scorer.confidence(anchor.score(), pathScores, targetNode.score(),
                path.unique() ? 1.0 : 0.0, degraded);
        if (confidence < options.getConfidenceThreshold()) {
            log.debug("Confidence {} for <{}> is below threshold {}", confidence, target.tagName(),
                    options.getConfidenceThreshold());
            return Optional.empty();
        }
        if (degraded) log.debug("Descriptor for <{}> is degraded: {}", target.tagName(), reason);

        EidMeta meta = new EidMeta(confidence, degraded, reason, options.getClock().instant(),
                EidMeta.GENERATOR, options.getSource());
        ElementIdentity eid = new ElementIdentity(ElementIdentity.CURRENT_VERSION, anchorNode, pathNodes,
                targetNode, constraints(targetNode.semantics()), options.getFallbackRules(), meta);

        if (cache != null) cache.putEid(target, eid);
        return Optional.of(eid);
    }

    private NodeDescriptor describe(TreeNode node) {
        Semantics semantics = extractor.extract(node);
        return new NodeDescriptor(node.tagName(), semantics, scorer.elementScore(semantics), node.siblingIndex());
    }

    /** Uniqueness always; text proximity when the target has text. */
    static List<Constraint> constraints(Semantics target) {
        List<Constraint> constraints = new ArrayList<>();
        constraints.add(Constraint.uniqueness(UNIQUENESS_PRIORITY));
        if (target.hasText()) {
            String reference = target.text().normalized();
            constraints.add(Constraint.textProximity(reference, Math.max(1, reference.length() / 5),
                    TEXT_PROXIMITY_PRIORITY));
        }
        return constraints;
    }

    private boolean isCrossDocument(TreeNode target) {
        TreeNode root = options.getRoot();
        if (root == null) return false;
        TreeNode rootDocument = root.isDocument() ? root : root.document();
        return rootDocument != null && !rootDocument.equals(target.document());
    }
}
