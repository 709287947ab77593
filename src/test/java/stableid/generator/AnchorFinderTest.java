package stableid.generator;

import org.testng.annotations.Test;
import stableid.resolver.SelectorSynthesizer;
import stableid.resolver.SemanticsFilter;
import stableid.tree.JsoupTree;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class AnchorFinderTest {

    private static AnchorFinder finder(GeneratorOptions options) {
        return new AnchorFinder(options, new FeatureExtractor(options),
                new SelectorSynthesizer(options.getMaxSelectorClasses(), new SemanticsFilter()));
    }

    private static AnchorResult find(String html, String target) {
        JsoupTree tree = JsoupTree.parse(html);
        return finder(GeneratorOptions.defaults()).find(tree.selectFirst(target)).orElseThrow();
    }

    @Test
    public void semanticTag_winsAndScoresStableId() {
        AnchorResult anchor = find("<form id=\"login\"><button>Go</button></form>", "button");
        assertThat(anchor.element().tagName()).isEqualTo("form");
        assertThat(anchor.tier()).isEqualTo(AnchorTier.SEMANTIC_TAG);
        assertThat(anchor.score()).isCloseTo(0.6, within(1e-9));
        assertThat(anchor.depth()).isZero();
        assertThat(anchor.degraded()).isFalse();
    }

    @Test
    public void landmarkRole_qualifiesPlainContainer() {
        AnchorResult anchor = find("<div role=\"navigation\"><a href=\"/x\">X</a></div>", "a");
        assertThat(anchor.tier()).isEqualTo(AnchorTier.LANDMARK_ROLE);
        assertThat(anchor.score()).isCloseTo(0.3, within(1e-9));
    }

    @Test
    public void testMarker_losesToHigherSemanticAncestor() {
        AnchorResult anchor = find(
                "<main><div data-testid=\"card\"><button>Go</button></div></main>", "button");
        assertThat(anchor.element().tagName()).isEqualTo("main");
        assertThat(anchor.depth()).isEqualTo(1);
    }

    @Test
    public void testMarker_usedWhenNothingBetter() {
        AnchorResult anchor = find("<div data-testid=\"card\"><button>Go</button></div>", "button");
        assertThat(anchor.tier()).isEqualTo(AnchorTier.TEST_MARKER);
        assertThat(anchor.score()).isCloseTo(0.05, within(1e-9));
    }

    @Test
    public void utilityOnlyAndFrameworkRoots_areSkipped() {
        AnchorResult anchor = find("<div id=\"root\"><section class=\"card\"><div class=\"flex mt-4\">"
                + "<span class=\"p-2\"><a href=\"/docs\">Docs</a></span></div></section></div>", "a");
        assertThat(anchor.element().tagName()).isEqualTo("section");
        assertThat(anchor.depth()).isEqualTo(2);
    }

    @Test
    public void uniqueFeature_isDegradedFallback() {
        AnchorResult anchor = find("<div class=\"product-card\"><button>Go</button></div>", "button");
        assertThat(anchor.element().classNames()).containsExactly("product-card");
        assertThat(anchor.tier()).isEqualTo(AnchorTier.FEATURE_FALLBACK);
        assertThat(anchor.degraded()).isTrue();
        assertThat(anchor.score()).isLessThanOrEqualTo(0.3);
    }

    @Test
    public void documentRoot_isBodyWhenNothingQualifies() {
        AnchorResult anchor = find("<div><div class=\"flex\"><button>Go</button></div></div>", "button");
        assertThat(anchor.element().tagName()).isEqualTo("body");
        assertThat(anchor.tier()).isEqualTo(AnchorTier.DOCUMENT_ROOT);
        assertThat(anchor.score()).isCloseTo(0.3, within(1e-9));
    }

    @Test
    public void documentRoot_canBeDisabled() {
        JsoupTree tree = JsoupTree.parse("<div><div class=\"flex\"><button>Go</button></div></div>");
        GeneratorOptions options = GeneratorOptions.builder().fallbackToDocumentRoot(false).build();

        Optional<AnchorResult> anchor = finder(options).find(tree.selectFirst("button"));

        assertThat(anchor).isEmpty();
    }

    @Test
    public void walk_stopsAtMaxDepth() {
        JsoupTree tree = JsoupTree.parse("<nav><ul><li><a href=\"/docs\">Docs</a></li></ul></nav>");
        GeneratorOptions options = GeneratorOptions.builder().maxPathDepth(2).build();

        AnchorResult anchor = finder(options).find(tree.selectFirst("a")).orElseThrow();

        assertThat(anchor.element().tagName()).isNotEqualTo("nav");
        assertThat(anchor.degraded()).isTrue();
    }
}
