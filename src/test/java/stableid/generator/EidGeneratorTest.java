package stableid.generator;

import org.testng.annotations.Test;
import stableid.Fixtures;
import stableid.cache.EidCache;
import stableid.model.ConstraintType;
import stableid.model.DegradationReason;
import stableid.model.ElementIdentity;
import stableid.model.MatchMode;
import stableid.model.ShapeKind;
import stableid.tree.JsoupTree;
import stableid.tree.TreeNode;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link EidGenerator}.
 */
public class EidGeneratorTest {

    @Test(description = "A form button is anchored on its form with an empty path")
    public void testGenerateFormButton() {
        JsoupTree tree = JsoupTree.parse(Fixtures.LOGIN_FORM);
        EidGenerator generator = new EidGenerator(Fixtures.fixedClockOptions());

        ElementIdentity eid = generator.generate(tree.selectFirst("button")).orElseThrow();

        assertThat(eid.version()).isEqualTo(ElementIdentity.CURRENT_VERSION);
        assertThat(eid.anchor().tag()).isEqualTo("form");
        assertThat(eid.anchor().semantics().id()).isEqualTo("login");
        assertThat(eid.anchor().score()).isCloseTo(0.6, within(1e-9));
        assertThat(eid.path()).isEmpty();
        assertThat(eid.target().tag()).isEqualTo("button");
        assertThat(eid.target().nthChild()).isEqualTo(2);
        assertThat(eid.target().semantics().attributes()).containsEntry("type", "submit");
        assertThat(eid.target().semantics().text().normalized()).isEqualTo("Sign in");
        assertThat(eid.target().semantics().text().matchMode()).isEqualTo(MatchMode.EXACT);
        assertThat(eid.meta().confidence()).isCloseTo(0.61, within(1e-9));
        assertThat(eid.meta().degraded()).isFalse();
        assertThat(eid.meta().generatedAt()).isEqualTo(Fixtures.GENERATED_AT);
        assertThat(eid.meta().source()).isEqualTo("dom");
    }

    @Test(description = "Uniqueness and text proximity constraints are attached")
    public void testConstraints() {
        JsoupTree tree = JsoupTree.parse(Fixtures.LOGIN_FORM);
        ElementIdentity eid = new EidGenerator().generate(tree.selectFirst("button")).orElseThrow();

        assertThat(eid.constraints()).extracting(c -> c.type())
                .containsExactly(ConstraintType.UNIQUENESS, ConstraintType.TEXT_PROXIMITY);
        assertThat(eid.constraints().get(0).priority()).isEqualTo(100);
        assertThat(eid.constraints().get(1).stringParam("reference")).isEqualTo("Sign in");
        assertThat(eid.constraints().get(1).intParam("maxDistance", -1)).isEqualTo(1);
        assertThat(eid.constraints().get(1).priority()).isEqualTo(60);
    }

    @Test(description = "Same input and clock give the same descriptor")
    public void testDeterministic() {
        JsoupTree tree = JsoupTree.parse(Fixtures.LOGIN_FORM);
        EidGenerator generator = new EidGenerator(Fixtures.fixedClockOptions());
        TreeNode button = tree.selectFirst("button");

        assertThat(generator.generate(button)).isEqualTo(generator.generate(button));
    }

    @Test(description = "Nodes outside a document produce nothing")
    public void testUndescribableNodes() {
        JsoupTree tree = JsoupTree.parse(Fixtures.LOGIN_FORM);
        TreeNode button = tree.selectFirst("button");
        EidGenerator generator = new EidGenerator();

        assertThat(generator.generate(tree.root())).isEmpty();

        tree.document().selectFirst("button").remove();
        assertThat(generator.generate(button)).isEmpty();
    }

    @Test(description = "A root from another document rejects the target")
    public void testCrossDocumentRoot() {
        JsoupTree first = JsoupTree.parse(Fixtures.LOGIN_FORM);
        JsoupTree second = JsoupTree.parse(Fixtures.LOGIN_FORM);
        GeneratorOptions options = GeneratorOptions.builder().root(second.root()).build();

        assertThat(new EidGenerator(options).generate(first.selectFirst("button"))).isEmpty();
        assertThat(new EidGenerator(options).generate(second.selectFirst("button"))).isPresent();
    }

    @Test(description = "Generated ids are not captured")
    public void testDynamicIdDropped() {
        JsoupTree tree = JsoupTree.parse("<form id=\"login\"><button id=\"item-42\">Go</button></form>");
        ElementIdentity eid = new EidGenerator().generate(tree.selectFirst("button")).orElseThrow();

        assertThat(eid.target().semantics().id()).isNull();
        assertThat(eid.anchor().semantics().id()).isEqualTo("login");
    }

    @Test(description = "Long text is truncated and compared as a prefix")
    public void testLongTextPartial() {
        String text = "word ".repeat(40).trim();
        JsoupTree tree = JsoupTree.parse("<main><p>" + text + "</p></main>");
        ElementIdentity eid = new EidGenerator().generate(tree.selectFirst("p")).orElseThrow();

        assertThat(eid.target().semantics().text().matchMode()).isEqualTo(MatchMode.PARTIAL);
        assertThat(eid.target().semantics().text().normalized().length()).isLessThanOrEqualTo(100);
    }

    @Test(description = "Vector shapes carry a geometry fingerprint unless disabled")
    public void testGeometryToggle() {
        String html = "<main><svg viewBox=\"0 0 10 10\"><rect width=\"100\" height=\"50\"></rect></svg></main>";
        JsoupTree tree = JsoupTree.parse(html);
        TreeNode rect = tree.selectFirst("rect");

        ElementIdentity with = new EidGenerator().generate(rect).orElseThrow();
        assertThat(with.target().semantics().geometry()).isNotNull();
        assertThat(with.target().semantics().geometry().shape()).isEqualTo(ShapeKind.RECT);

        GeneratorOptions off = GeneratorOptions.builder().enableGeometryFingerprint(false).build();
        ElementIdentity without = new EidGenerator(off).generate(rect).orElseThrow();
        assertThat(without.target().semantics().geometry()).isNull();
    }

    @Test(description = "Only utility-class wrappers above the target fall back to the document root")
    public void testDocumentRootFallback() {
        JsoupTree tree = JsoupTree.parse(
                "<div id=\"root\"><div class=\"flex\"><button>Go</button></div></div>");
        ElementIdentity eid = new EidGenerator().generate(tree.selectFirst("button")).orElseThrow();

        assertThat(eid.anchor().tag()).isEqualTo("body");
        assertThat(eid.anchor().degraded()).isTrue();
        assertThat(eid.meta().degraded()).isTrue();
        assertThat(eid.meta().degradationReason()).isEqualTo(DegradationReason.ANCHOR_FALLBACK);
        assertThat(eid.path()).extracting(n -> n.semantics().id()).containsExactly("root");
        assertThat(eid.meta().confidence()).isCloseTo(0.34, within(1e-9));
    }

    @Test(description = "A walk deeper than maxPathDepth is truncated and reported as such")
    public void testPathDepthExceeded() {
        String html = "<div>".repeat(14) + "<button type=\"submit\">Go</button>" + "</div>".repeat(14);
        JsoupTree tree = JsoupTree.parse(html);
        GeneratorOptions options = GeneratorOptions.builder().confidenceThreshold(0.0).build();

        ElementIdentity eid = new EidGenerator(options).generate(tree.selectFirst("button")).orElseThrow();

        assertThat(eid.anchor().tag()).isEqualTo("body");
        assertThat(eid.anchor().degraded()).isTrue();
        assertThat(eid.path().size()).isLessThanOrEqualTo(GeneratorOptions.DEFAULT_MAX_PATH_DEPTH);
        assertThat(eid.meta().degraded()).isTrue();
        assertThat(eid.meta().degradationReason()).isEqualTo(DegradationReason.PATH_DEPTH_EXCEEDED);
    }

    @Test(description = "No descriptor when document-root fallback is off and nothing else qualifies")
    public void testNoAnchorWithoutFallback() {
        JsoupTree tree = JsoupTree.parse("<div><div class=\"flex\"><button>Go</button></div></div>");
        GeneratorOptions options = GeneratorOptions.builder().fallbackToDocumentRoot(false).build();

        assertThat(new EidGenerator(options).generate(tree.selectFirst("button"))).isEmpty();
    }

    @Test(description = "Descriptors below the confidence threshold are not returned")
    public void testConfidenceThreshold() {
        JsoupTree tree = JsoupTree.parse(Fixtures.LOGIN_FORM);
        GeneratorOptions strict = GeneratorOptions.builder().confidenceThreshold(0.9).build();

        assertThat(new EidGenerator(strict).generate(tree.selectFirst("button"))).isEmpty();
    }

    @Test(description = "A second generation for the same node is served from the cache")
    public void testCacheHit() {
        JsoupTree tree = JsoupTree.parse(Fixtures.LOGIN_FORM);
        EidCache cache = new EidCache(16);
        EidGenerator generator = new EidGenerator(GeneratorOptions.builder().cache(cache).build());
        TreeNode button = tree.selectFirst("button");

        Optional<ElementIdentity> first = generator.generate(button);
        Optional<ElementIdentity> second = generator.generate(button);

        assertThat(second).isEqualTo(first);
        assertThat(cache.stats().eidHits()).isEqualTo(1);
        assertThat(cache.stats().eidMisses()).isEqualTo(1);
    }
}
