package stableid;

import stableid.codec.EidQueryCodec;
import stableid.codec.EidSyntaxException;
import stableid.generator.EidGenerator;
import stableid.generator.GeneratorOptions;
import stableid.model.DegradationReason;
import stableid.model.ElementIdentity;
import stableid.resolver.ResolveResult;
import stableid.resolver.Resolver;
import stableid.resolver.ResolverOptions;
import stableid.resolver.SelectorSynthesizer;
import stableid.tree.TreeNode;

import java.util.Optional;

/**
 * Entry points for generating, resolving and encoding element identity
 * descriptors.
 *
 * <pre>{@code
 * JsoupTree tree = JsoupTree.parse(html);
 * ElementIdentity eid = StableId.generate(tree.selectFirst("form button")).orElseThrow();
 * String token = StableId.encode(eid);
 *
 * ResolveResult result = StableId.resolve(token, JsoupTree.parse(laterHtml).root());
 * }</pre>
 *
 * <p>The no-options variants use default options and no cache.
 */
public final class StableId {

    private StableId() {}

    // ── Generation ────────────────────────────────────────────────────────

    public static Optional<ElementIdentity> generate(TreeNode target) {
        return generate(target, GeneratorOptions.defaults());
    }

    public static Optional<ElementIdentity> generate(TreeNode target, GeneratorOptions options) {
        return new EidGenerator(options).generate(target);
    }

    // ── Resolution ────────────────────────────────────────────────────────

    public static ResolveResult resolve(ElementIdentity eid, TreeNode root) {
        return resolve(eid, root, ResolverOptions.defaults());
    }

    public static ResolveResult resolve(ElementIdentity eid, TreeNode root, ResolverOptions options) {
        return new Resolver(options).resolve(eid, root);
    }

    /**
     * Decodes a transport-encoded descriptor and resolves it. A string that
     * does not parse yields an {@code error} result with reason
     * {@code invalid-selector}.
     */
    public static ResolveResult resolve(String encoded, TreeNode root) {
        ElementIdentity eid;
        try {
            eid = EidQueryCodec.decode(encoded);
        } catch (EidSyntaxException e) {
            return ResolveResult.error(DegradationReason.INVALID_SELECTOR,
                    "Invalid descriptor encoding: " + e.getMessage());
        }
        return resolve(eid, root);
    }

    /**
     * Renders the most specific selector for the descriptor in {@code root};
     * {@link SelectorSynthesizer.SelectorResult#unique()} tells whether it
     * matches exactly one node.
     */
    public static SelectorSynthesizer.SelectorResult toSelector(ElementIdentity eid, TreeNode root) {
        return new SelectorSynthesizer().synthesize(eid, root);
    }

    // ── Encoding ──────────────────────────────────────────────────────────

    public static String encode(ElementIdentity eid) {
        return EidQueryCodec.encode(eid);
    }

    /**
     * @throws EidSyntaxException if {@code text} is not a valid encoding
     */
    public static ElementIdentity decode(String text) {
        return EidQueryCodec.decode(text);
    }
}
