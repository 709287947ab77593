package stableid.resolver;

import org.testng.annotations.Test;
import stableid.Fixtures;
import stableid.generator.EidGenerator;
import stableid.model.DegradationReason;
import stableid.model.ElementIdentity;
import stableid.model.FallbackRules;
import stableid.model.NodeDescriptor;
import stableid.model.OnMissing;
import stableid.model.OnMultiple;
import stableid.model.Semantics;
import stableid.tree.JsoupTree;
import stableid.tree.TreeNode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * End-to-end resolution tests: descriptors are generated from one page and
 * resolved against the same or a changed page.
 */
public class ResolverTest {

    private final Resolver resolver = new Resolver();

    private static ElementIdentity generate(String html, String selector) {
        return generate(html, selector, 0);
    }

    private static ElementIdentity generate(String html, String selector, int index) {
        JsoupTree tree = JsoupTree.parse(html);
        return new EidGenerator(Fixtures.fixedClockOptions()).generate(tree.select(selector).get(index)).orElseThrow();
    }

    private static ElementIdentity withFallback(ElementIdentity eid, OnMissing onMissing, OnMultiple onMultiple) {
        return new ElementIdentity(eid.version(), eid.anchor(), eid.path(), eid.target(), eid.constraints(),
                new FallbackRules(onMissing, onMultiple, 3), eid.meta());
    }

    // ── Unique matches ──────────────────────────────────────────────────

    @Test(description = "A descriptor resolves to its own node on an unchanged page")
    public void testResolveUnchanged() {
        ElementIdentity eid = generate(Fixtures.LOGIN_FORM, "button");
        JsoupTree page = JsoupTree.parse(Fixtures.LOGIN_FORM);

        ResolveResult result = resolver.resolve(eid, page.root());

        assertThat(result.status()).isEqualTo(ResolveStatus.SUCCESS);
        assertThat(result.matches()).containsExactly(page.selectFirst("button"));
        assertThat(result.confidence()).isCloseTo(0.61, within(1e-9));
        assertThat(result.meta().degraded()).isFalse();
        assertThat(result.warnings()).isEmpty();
    }

    @Test(description = "Resolving twice gives the same answer")
    public void testIdempotent() {
        ElementIdentity eid = generate(Fixtures.TWIN_ITEMS, "button", 1);
        JsoupTree page = JsoupTree.parse(Fixtures.TWIN_ITEMS);

        assertThat(resolver.resolve(eid, page.root())).isEqualTo(resolver.resolve(eid, page.root()));
    }

    @Test(description = "Renamed classes are recovered through an attributes-only selector")
    public void testDriftRecovery() {
        ElementIdentity eid = generate(
                "<nav><ul class=\"menu-list\"><li><a href=\"/docs\">Docs</a></li></ul></nav>", "a");
        JsoupTree page = JsoupTree.parse(
                "<nav><ul class=\"nav-items\"><li><a href=\"/docs\">Docs</a></li></ul></nav>");

        ResolveResult result = resolver.resolve(eid, page.root());

        assertThat(result.status()).isEqualTo(ResolveStatus.SUCCESS);
        assertThat(result.firstMatch()).isEqualTo(page.selectFirst("a"));
        assertThat(result.warnings()).anyMatch(w -> w.contains("recovered via ATTRIBUTES_ONLY"));
    }

    @Test(description = "Changed text is matched leniently at reduced confidence")
    public void testRelaxedText() {
        ElementIdentity eid = generate("<form id=\"editor\"><button type=\"button\">Save</button></form>", "button");
        JsoupTree page = JsoupTree.parse("<form id=\"editor\"><button type=\"button\">Save draft</button></form>");

        ResolveResult result = resolver.resolve(eid, page.root());

        assertThat(result.status()).isEqualTo(ResolveStatus.SUCCESS);
        assertThat(result.reason()).isEqualTo(DegradationReason.RELAXED_TEXT_MATCHING);
        assertThat(result.confidence()).isCloseTo(eid.confidence() * 0.8, within(1e-9));
        assertThat(result.warnings()).isNotEmpty();
    }

    // ── Missing target ──────────────────────────────────────────────────

    @Test(description = "A missing target falls back to its anchor")
    public void testAnchorFallback() {
        ElementIdentity eid = generate(Fixtures.LOGIN_FORM, "button");
        JsoupTree page = JsoupTree.parse(Fixtures.LOGIN_FORM_WITHOUT_BUTTON);

        ResolveResult result = resolver.resolve(eid, page.root());

        assertThat(result.status()).isEqualTo(ResolveStatus.DEGRADED_FALLBACK);
        assertThat(result.matches()).containsExactly(page.selectFirst("form"));
        assertThat(result.confidence()).isCloseTo(0.61 * 0.3, within(1e-9));
        assertThat(result.reason()).isEqualTo(DegradationReason.ANCHOR_FALLBACK);
        assertThat(result.warnings()).contains("Target not found, returning anchor", "Selector found no candidates");
    }

    @Test(description = "Strict onMissing reports an error instead of the anchor")
    public void testStrictOnMissing() {
        ElementIdentity eid = withFallback(generate(Fixtures.LOGIN_FORM, "button"),
                OnMissing.STRICT, OnMultiple.BEST_SCORE);
        JsoupTree page = JsoupTree.parse(Fixtures.LOGIN_FORM_WITHOUT_BUTTON);

        ResolveResult result = resolver.resolve(eid, page.root());

        assertThat(result.status()).isEqualTo(ResolveStatus.ERROR);
        assertThat(result.reason()).isEqualTo(DegradationReason.STRICT_NOT_FOUND);
        assertThat(result.matches()).isEmpty();
        assertThat(result.confidence()).isZero();
    }

    @Test(description = "Disabling fallback turns a missing target into not-found")
    public void testFallbackDisabled() {
        ElementIdentity eid = generate(Fixtures.LOGIN_FORM, "button");
        JsoupTree page = JsoupTree.parse(Fixtures.LOGIN_FORM_WITHOUT_BUTTON);
        Resolver noFallback = new Resolver(ResolverOptions.builder().enableFallback(false).build());

        ResolveResult result = noFallback.resolve(eid, page.root());

        assertThat(result.status()).isEqualTo(ResolveStatus.ERROR);
        assertThat(result.reason()).isEqualTo(DegradationReason.NOT_FOUND);
    }

    @Test(description = "A missing anchor is reported as such")
    public void testAnchorAlsoMissing() {
        ElementIdentity eid = generate(Fixtures.LOGIN_FORM, "button");
        JsoupTree page = JsoupTree.parse("<main><p>Nothing here</p></main>");

        ResolveResult result = resolver.resolve(eid, page.root());

        assertThat(result.status()).isEqualTo(ResolveStatus.ERROR);
        assertThat(result.reason()).isEqualTo(DegradationReason.ANCHOR_NOT_FOUND);
    }

    // ── Ambiguity ───────────────────────────────────────────────────────

    @Test(description = "best-score prefers a visible candidate over hidden copies")
    public void testBestScoreSkipsHidden() {
        ElementIdentity eid = generate(Fixtures.SHOP, "button");
        JsoupTree page = JsoupTree.parse(Fixtures.SHOP_WITH_HIDDEN_COPIES);

        ResolveResult result = resolver.resolve(eid, page.root());

        assertThat(eid.confidence()).isCloseTo(0.62, within(1e-9));
        assertThat(result.status()).isEqualTo(ResolveStatus.SUCCESS);
        assertThat(result.firstMatch()).isEqualTo(page.select("button").get(1));
        assertThat(result.reason()).isEqualTo(DegradationReason.BEST_OF_MULTIPLE);
        assertThat(result.confidence()).isCloseTo(0.62 * 0.9, within(1e-9));
    }

    @Test(description = "Identical candidates are told apart by their recorded position")
    public void testTieBrokenByRoute() {
        ElementIdentity eid = generate(Fixtures.TWIN_ITEMS, "button", 1);
        JsoupTree page = JsoupTree.parse(Fixtures.TWIN_ITEMS);

        ResolveResult result = resolver.resolve(eid, page.root());

        assertThat(result.status()).isEqualTo(ResolveStatus.SUCCESS);
        assertThat(result.firstMatch()).isEqualTo(page.select("button").get(1));
        assertThat(result.confidence()).isCloseTo(eid.confidence() * 0.9, within(1e-9));
    }

    @Test(description = "onMultiple=first takes the first candidate in document order")
    public void testFirstOnMultiple() {
        ElementIdentity eid = withFallback(generate(Fixtures.TWIN_ITEMS, "button", 1),
                OnMissing.ANCHOR_ONLY, OnMultiple.FIRST);
        JsoupTree page = JsoupTree.parse(Fixtures.TWIN_ITEMS);

        ResolveResult result = resolver.resolve(eid, page.root());

        assertThat(result.status()).isEqualTo(ResolveStatus.SUCCESS);
        assertThat(result.firstMatch()).isEqualTo(page.select("button").get(0));
        assertThat(result.reason()).isEqualTo(DegradationReason.AMBIGUOUS);
        assertThat(result.confidence()).isCloseTo(eid.confidence() * 0.7, within(1e-9));
    }

    @Test(description = "onMultiple=allow-multiple returns every candidate")
    public void testAllowMultiple() {
        ElementIdentity eid = withFallback(generate(Fixtures.TWIN_ITEMS, "button", 1),
                OnMissing.ANCHOR_ONLY, OnMultiple.ALLOW_MULTIPLE);
        JsoupTree page = JsoupTree.parse(Fixtures.TWIN_ITEMS);

        ResolveResult result = resolver.resolve(eid, page.root());

        assertThat(result.status()).isEqualTo(ResolveStatus.AMBIGUOUS);
        assertThat(result.matches()).hasSize(2);
        assertThat(result.confidence()).isCloseTo(eid.confidence() * 0.5, within(1e-9));
    }

    @Test(description = "Strict mode reports residual ambiguity")
    public void testStrictModeAmbiguous() {
        ElementIdentity eid = generate(Fixtures.TWIN_ITEMS, "button", 1);
        JsoupTree page = JsoupTree.parse(Fixtures.TWIN_ITEMS);
        Resolver strict = new Resolver(ResolverOptions.builder().strictMode(true).build());

        ResolveResult result = strict.resolve(eid, page.root());

        assertThat(result.status()).isEqualTo(ResolveStatus.AMBIGUOUS);
        assertThat(result.matches()).hasSize(2);
        assertThat(result.reason()).isEqualTo(DegradationReason.AMBIGUOUS);
        assertThat(result.confidence()).isCloseTo(eid.confidence() * 0.7, within(1e-9));
    }

    @Test(description = "requireUniqueness turns ambiguity into an error")
    public void testRequireUniqueness() {
        ElementIdentity eid = generate(Fixtures.TWIN_ITEMS, "button", 1);
        JsoupTree page = JsoupTree.parse(Fixtures.TWIN_ITEMS);
        Resolver unique = new Resolver(ResolverOptions.builder().requireUniqueness(true).build());

        ResolveResult result = unique.resolve(eid, page.root());

        assertThat(result.status()).isEqualTo(ResolveStatus.ERROR);
        assertThat(result.reason()).isEqualTo(DegradationReason.AMBIGUOUS);
        assertThat(result.matches()).isEmpty();
    }

    // ── Errors ──────────────────────────────────────────────────────────

    @Test(description = "A detached root cannot be resolved against")
    public void testDetachedRoot() {
        ElementIdentity eid = generate(Fixtures.LOGIN_FORM, "button");
        JsoupTree page = JsoupTree.parse(Fixtures.LOGIN_FORM);
        TreeNode form = page.selectFirst("form");
        page.document().selectFirst("form").remove();

        ResolveResult result = resolver.resolve(eid, form);

        assertThat(result.status()).isEqualTo(ResolveStatus.ERROR);
        assertThat(result.reason()).isEqualTo(DegradationReason.INVALID_CONTEXT);
    }

    @Test(description = "A tag that breaks the selector grammar is an invalid-selector error")
    public void testInvalidSelector() {
        ElementIdentity eid = generate(Fixtures.LOGIN_FORM, "button");
        ElementIdentity broken = new ElementIdentity(eid.version(), eid.anchor(), eid.path(),
                new NodeDescriptor("button[", Semantics.EMPTY, 0.5, 1), eid.constraints(), eid.fallback(), eid.meta());

        ResolveResult result = resolver.resolve(broken, JsoupTree.parse(Fixtures.LOGIN_FORM).root());

        assertThat(result.status()).isEqualTo(ResolveStatus.ERROR);
        assertThat(result.reason()).isEqualTo(DegradationReason.INVALID_SELECTOR);
        assertThat(result.warnings()).isNotEmpty();
    }

    @Test(description = "Resolution can be scoped to a subtree")
    public void testScopedRoot() {
        ElementIdentity eid = generate(Fixtures.LOGIN_FORM, "button");
        JsoupTree page = JsoupTree.parse(Fixtures.LOGIN_FORM);

        ResolveResult result = resolver.resolve(eid, page.body());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.firstMatch()).isEqualTo(page.selectFirst("button"));
    }
}
