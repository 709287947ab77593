package stableid.resolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stableid.generator.GeneratorOptions;
import stableid.model.ElementIdentity;
import stableid.model.NodeDescriptor;
import stableid.model.Semantics;
import stableid.tree.TreeNode;
import stableid.util.AttributeRules;
import stableid.util.ClassClassifier;
import stableid.util.CssSyntax;
import stableid.util.UrlCleaner;
import stableid.util.Vocabulary;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Renders CSS selectors from a descriptor.
 *
 * <p>Per node the priority is id, then allow-listed attributes in priority
 * order, then role, then up to {@code maxClasses} stable classes.
 * {@link #baseSelector} joins anchor, path and target with descendant
 * combinators (child combinators inside {@code svg}) and is what resolution
 * queries first. {@link #synthesize} additionally tries to make the selector
 * unique in a live tree, stopping at the first strategy that succeeds:
 * <ol start="0">
 *   <li>attributes only, no classes anywhere;</li>
 *   <li>strict parent-linked live route, ambiguous steps disambiguated by
 *       attribute, else one stable class, else sibling position;</li>
 *   <li>the same with descendant linkage over recorded path nodes only;</li>
 *   <li>one stable class added to the target;</li>
 *   <li>sibling position on the target; row/cell tags use position among all
 *       siblings, other tags position among same-tag siblings.</li>
 * </ol>
 * The anchor is disambiguated first with the same attribute &gt; class &gt;
 * position ladder. Strategies that depend on the live route use routes found
 * by path reconciliation, best-scoring first.
 */
public class SelectorSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(SelectorSynthesizer.class);

    public static final int DEFAULT_MAX_CLASSES = GeneratorOptions.DEFAULT_MAX_SELECTOR_CLASSES;

    static final int MAX_ANCHOR_CANDIDATES = 20;
    static final int MAX_ROUTES = 50;

    /** Which strategy produced a {@link SelectorResult}. */
    public enum Strategy {
        BASE, ATTRIBUTES_ONLY, CHILD_LINKED, DESCENDANT_LINKED, TARGET_CLASS, TARGET_POSITION
    }

    /**
     * @param selector the rendered selector
     * @param unique   true if it matched exactly one node in the live tree
     * @param strategy the strategy that produced it
     */
    public record SelectorResult(String selector, boolean unique, Strategy strategy) {}

    private final int maxClasses;
    private final SemanticsFilter filter;
    private final RouteScorer routeScorer = new RouteScorer();

    public SelectorSynthesizer() {
        this(DEFAULT_MAX_CLASSES, new SemanticsFilter());
    }

    public SelectorSynthesizer(int maxClasses, SemanticsFilter filter) {
        if (maxClasses < 0) throw new IllegalArgumentException("maxClasses must be >= 0, got " + maxClasses);
        this.maxClasses = maxClasses;
        this.filter = filter;
    }

    // ── Node rendering ────────────────────────────────────────────────────

    /** Full per-node selector: id, or attributes + role + stable classes. */
    public String nodeSelector(String tag, Semantics semantics) {
        return render(tag, semantics, maxClasses);
    }

    /** Per-node selector without classes. */
    public String attributeSelector(String tag, Semantics semantics) {
        return render(tag, semantics, 0);
    }

    private String render(String tag, Semantics s, int classLimit) {
        StringBuilder sb = new StringBuilder(tag);
        if (s.hasId()) {
            Optional<String> id = CssSyntax.id(s.id());
            if (id.isPresent()) return sb.append(id.get()).toString();
        }
        for (String part : attributeParts(s)) sb.append(part);
        int added = 0;
        for (String cls : s.classes()) {
            if (added >= classLimit) break;
            Optional<String> c = CssSyntax.className(cls);
            if (c.isPresent()) {
                sb.append(c.get());
                added++;
            }
        }
        return sb.toString();
    }

    private List<String> attributeParts(Semantics s) {
        List<String> names = new ArrayList<>(s.attributes().keySet());
        names.sort(AttributeRules.BY_PRIORITY);
        List<String> parts = new ArrayList<>();
        for (String name : names) {
            attributePart(name, s.attributes().get(name)).ifPresent(parts::add);
        }
        if (s.role() != null && !s.attributes().containsKey("role")) {
            CssSyntax.attribute("role", s.role()).ifPresent(parts::add);
        }
        return parts;
    }

    private static Optional<String> attributePart(String name, String value) {
        if (AttributeRules.URL_ATTRIBUTES.contains(name)) {
            return CssSyntax.attributePrefix(name, UrlCleaner.pathOnly(value));
        }
        return CssSyntax.attribute(name, value);
    }

    // ── Base selector ─────────────────────────────────────────────────────

    /**
     * Anchor, path and target joined into one selector. Never encodes sibling
     * position.
     */
    public String baseSelector(ElementIdentity eid) {
        NodeDescriptor target = eid.target();
        if (isAnchorSameAsTarget(eid)) return nodeSelector(target.tag(), target.semantics());

        List<String> tags = new ArrayList<>();
        List<String> fragments = new ArrayList<>();
        tags.add(eid.anchor().tag());
        fragments.add(nodeSelector(eid.anchor().tag(), eid.anchor().semantics()));
        for (NodeDescriptor node : eid.path()) {
            tags.add(node.tag());
            fragments.add(nodeSelector(node.tag(), node.semantics()));
        }
        tags.add(target.tag());
        fragments.add(nodeSelector(target.tag(), target.semantics()));
        return join(tags, fragments);
    }

    /** Selector for the anchor alone, without disambiguation. */
    public String plainAnchorSelector(ElementIdentity eid) {
        return nodeSelector(eid.anchor().tag(), eid.anchor().semantics());
    }

    /**
     * True when the descriptor's anchor is the target itself, which happens
     * when the target has no usable ancestor.
     */
    public static boolean isAnchorSameAsTarget(ElementIdentity eid) {
        return eid.path().isEmpty()
                && eid.anchor().tag().equals(eid.target().tag())
                && eid.anchor().semantics().equals(eid.target().semantics());
    }

    /** Joins per-node fragments with the combinator each tag pair calls for. */
    public static String join(List<String> tags, List<String> fragments) {
        StringBuilder sb = new StringBuilder(fragments.get(0));
        for (int i = 1; i < fragments.size(); i++) {
            sb.append(combinator(tags.get(i - 1), tags.get(i))).append(fragments.get(i));
        }
        return sb.toString();
    }

    /** Child combinator between vector nodes, descendant combinator everywhere else. */
    static String combinator(String previousTag, String nextTag) {
        boolean previousIsVector = "svg".equals(previousTag) || Vocabulary.SVG_CHILD_TAGS.contains(previousTag);
        return previousIsVector && Vocabulary.SVG_CHILD_TAGS.contains(nextTag) ? " > " : " ";
    }

    // ── Anchor disambiguation ─────────────────────────────────────────────

    /**
     * Selector matching the recorded anchor as uniquely as possible in
     * {@code root}: tag, then attributes, then one class, then position.
     * Falls back to the full anchor selector when nothing is unique.
     */
    public String anchorSelector(ElementIdentity eid, TreeNode root) {
        NodeDescriptor anchor = eid.anchor();
        String tag = anchor.tag();
        Semantics s = anchor.semantics();
        String full = nodeSelector(tag, s);

        Set<String> ladder = new LinkedHashSet<>();
        if (s.hasId()) ladder.add(full);
        ladder.add(tag);
        List<String> attrs = attributeParts(s);
        for (String part : attrs) ladder.add(tag + part);
        String attributesOnly = tag + String.join("", attrs);
        ladder.add(attributesOnly);
        for (String cls : s.classes()) {
            Optional<String> c = CssSyntax.className(cls);
            if (c.isPresent()) {
                ladder.add(tag + c.get());
                ladder.add(attributesOnly + c.get());
                break;
            }
        }
        ladder.add(full);

        for (String option : ladder) {
            if (root.select(option).size() == 1) return option;
        }

        List<TreeNode> matches = root.select(full);
        if (matches.isEmpty()) matches = root.select(tag);
        if (!matches.isEmpty()) {
            TreeNode pick = preferByPosition(matches, anchor.nthChild());
            String positioned = full + positionSuffix(pick);
            if (root.select(positioned).size() == 1) return positioned;
        }
        log.debug("Anchor selector '{}' is not unique", full);
        return full;
    }

    // ── Progressive disambiguation ────────────────────────────────────────

    /**
     * Tries to render a selector that matches exactly one node in {@code root}.
     * The result is non-unique (with the base selector) when no strategy
     * succeeds.
     *
     * @throws stableid.tree.SelectorException if the tree rejects a rendered selector
     */
    public SelectorResult synthesize(ElementIdentity eid, TreeNode root) {
        String base = baseSelector(eid);
        if (root.select(base).size() == 1) return new SelectorResult(base, true, Strategy.BASE);

        NodeDescriptor target = eid.target();
        if (isAnchorSameAsTarget(eid)) {
            return synthesizeSelfAnchored(target, root, base);
        }

        String anchorSel = anchorSelector(eid, root);
        String recordedPrefix = recordedPrefix(anchorSel, eid);
        String targetAttrs = attributeSelector(target.tag(), target.semantics());
        String lastTag = eid.path().isEmpty() ? eid.anchor().tag() : eid.path().get(eid.path().size() - 1).tag();
        String targetJoin = combinator(lastTag, target.tag());

        // (0) attributes only
        String attributesOnly = recordedPrefix + targetJoin + targetAttrs;
        if (root.select(attributesOnly).size() == 1) {
            return new SelectorResult(attributesOnly, true, Strategy.ATTRIBUTES_ONLY);
        }

        List<Route> routes = routes(eid, root, anchorSel);

        // (1) strict parent-linked live route
        for (Route route : routes) {
            String sel = childLinked(root, anchorSel, route, targetAttrs);
            if (matchesOnly(root, sel, route.target())) return new SelectorResult(sel, true, Strategy.CHILD_LINKED);
        }

        // (2) descendant-linked over recorded path nodes
        for (Route route : routes) {
            String sel = descendantLinked(root, anchorSel, route, targetAttrs);
            if (matchesOnly(root, sel, route.target())) return new SelectorResult(sel, true, Strategy.DESCENDANT_LINKED);
        }

        // (3) one stable class on the target
        for (String cls : target.semantics().classes()) {
            Optional<String> c = CssSyntax.className(cls);
            if (c.isEmpty()) continue;
            String sel = attributesOnly + c.get();
            if (root.select(sel).size() == 1) return new SelectorResult(sel, true, Strategy.TARGET_CLASS);
        }

        // (4) sibling position on the target
        for (Route route : routes) {
            String sel = attributesOnly + positionSuffix(route.target());
            if (matchesOnly(root, sel, route.target())) return new SelectorResult(sel, true, Strategy.TARGET_POSITION);
        }

        log.debug("No unique selector for <{}>; {} live route(s) considered", target.tag(), routes.size());
        return new SelectorResult(base, false, Strategy.BASE);
    }

    private SelectorResult synthesizeSelfAnchored(NodeDescriptor target, TreeNode root, String base) {
        String attrs = attributeSelector(target.tag(), target.semantics());
        if (root.select(attrs).size() == 1) return new SelectorResult(attrs, true, Strategy.ATTRIBUTES_ONLY);
        List<TreeNode> matches = filter.filter(root.select(attrs), target.semantics(), false);
        if (!matches.isEmpty()) {
            TreeNode pick = preferByPosition(matches, target.nthChild());
            String sel = attrs + positionSuffix(pick);
            if (matchesOnly(root, sel, pick)) return new SelectorResult(sel, true, Strategy.TARGET_POSITION);
        }
        return new SelectorResult(base, false, Strategy.BASE);
    }

    private String recordedPrefix(String anchorSel, ElementIdentity eid) {
        StringBuilder sb = new StringBuilder(anchorSel);
        String previous = eid.anchor().tag();
        for (NodeDescriptor node : eid.path()) {
            sb.append(combinator(previous, node.tag())).append(attributeSelector(node.tag(), node.semantics()));
            previous = node.tag();
        }
        return sb.toString();
    }

    private String childLinked(TreeNode root, String anchorSel, Route route, String targetAttrs) {
        String prefix = anchorSel;
        for (TreeNode node : route.nodes()) {
            prefix = prefix + " > " + disambiguate(root, prefix, " > ", node);
        }
        return prefix + " > " + targetAttrs;
    }

    private String descendantLinked(TreeNode root, String anchorSel, Route route, String targetAttrs) {
        String prefix = anchorSel;
        for (TreeNode node : route.aligned()) {
            if (node == null) continue;
            String step = node.tagName();
            if (root.select(prefix + " " + step).size() > 1) step = disambiguate(root, prefix, " ", node);
            prefix = prefix + " " + step;
        }
        return prefix + " " + targetAttrs;
    }

    /** Shortest fragment for {@code node} below {@code prefix}: tag, attribute, class, position. */
    private String disambiguate(TreeNode root, String prefix, String combinator, TreeNode node) {
        String tag = node.tagName();
        if (root.select(prefix + combinator + tag).size() <= 1) return tag;

        for (Map.Entry<String, String> e : node.attributes().entrySet()) {
            if (!AttributeRules.shouldCapture(e.getKey(), e.getValue())) continue;
            Optional<String> part = attributePart(e.getKey(), e.getValue());
            if (part.isPresent() && matchesOnly(root, prefix + combinator + tag + part.get(), node)) {
                return tag + part.get();
            }
        }
        for (String cls : node.classNames()) {
            if (!ClassClassifier.isStable(cls)) continue;
            Optional<String> c = CssSyntax.className(cls);
            if (c.isPresent() && matchesOnly(root, prefix + combinator + tag + c.get(), node)) {
                return tag + c.get();
            }
            break;
        }
        return tag + positionSuffix(node);
    }

    private static String positionSuffix(TreeNode node) {
        if (Vocabulary.TABLE_TAGS.contains(node.tagName())) {
            return ":nth-child(" + node.siblingIndex() + ")";
        }
        return ":nth-of-type(" + node.sameTagIndex() + ")";
    }

    private static TreeNode preferByPosition(List<TreeNode> matches, Integer nthChild) {
        if (nthChild != null) {
            for (TreeNode m : matches) {
                if (m.siblingIndex() == nthChild) return m;
            }
        }
        return matches.get(0);
    }

    private static boolean matchesOnly(TreeNode root, String selector, TreeNode expected) {
        List<TreeNode> found = root.select(selector);
        return found.size() == 1 && found.get(0).equals(expected);
    }

    // ── Path reconciliation ───────────────────────────────────────────────

    /**
     * One live route from an anchor candidate to a target candidate.
     *
     * @param nodes   live nodes strictly between anchor and target, anchor first
     * @param aligned live node matched to each recorded path node, or null
     */
    record Route(TreeNode anchor, List<TreeNode> nodes, TreeNode target, List<TreeNode> aligned, double score) {}

    /**
     * Live routes whose target plausibly matches the recorded target, best
     * reconciliation score first; ties keep document order.
     */
    List<Route> routes(ElementIdentity eid, TreeNode root, String anchorSel) {
        NodeDescriptor target = eid.target();
        String targetSel = attributeSelector(target.tag(), target.semantics());

        List<Route> routes = new ArrayList<>();
        List<TreeNode> anchors = root.select(anchorSel);
        outer:
        for (TreeNode anchor : anchors.subList(0, Math.min(anchors.size(), MAX_ANCHOR_CANDIDATES))) {
            for (TreeNode candidate : anchor.select(targetSel)) {
                if (candidate.equals(anchor)) continue;
                if (!filter.matches(candidate, target.semantics(), true)) continue;
                List<TreeNode> between = between(anchor, candidate);
                List<TreeNode> aligned = routeScorer.align(eid.path(), between);
                double score = routeScorer.score(eid.path(), aligned, between.size(), target, candidate);
                routes.add(new Route(anchor, between, candidate, aligned, score));
                if (routes.size() >= MAX_ROUTES) break outer;
            }
        }
        routes.sort(Comparator.comparingDouble(Route::score).reversed());
        return routes;
    }

    /**
     * Among candidates that match equally well, the one whose live route best
     * agrees with the recorded path and sibling positions; the first candidate
     * when no route reaches any of them.
     */
    public TreeNode bestRouteTarget(ElementIdentity eid, TreeNode root, List<TreeNode> candidates) {
        if (!isAnchorSameAsTarget(eid)) {
            for (Route route : routes(eid, root, anchorSelector(eid, root))) {
                if (candidates.contains(route.target())) return route.target();
            }
        }
        return preferByPosition(candidates, eid.target().nthChild());
    }

    private static List<TreeNode> between(TreeNode anchor, TreeNode descendant) {
        List<TreeNode> nodes = new ArrayList<>();
        for (TreeNode n = descendant.parent(); n != null && !n.equals(anchor); n = n.parent()) {
            nodes.add(0, n);
        }
        return nodes;
    }
}
