package stableid.generator;

import org.testng.annotations.Test;
import stableid.cache.EidCache;
import stableid.model.MatchMode;
import stableid.model.Semantics;
import stableid.tree.JsoupTree;
import stableid.tree.TreeNode;

import static org.assertj.core.api.Assertions.assertThat;

public class FeatureExtractorTest {

    private final FeatureExtractor extractor = new FeatureExtractor(GeneratorOptions.defaults());

    @Test
    public void extract_ordersAttributesByPriorityAndCleansUrls() {
        JsoupTree tree = JsoupTree.parse("<a href=\"/docs?ref=nav\" aria-label=\"Documentation\" "
                + "data-testid=\"docs-link\" onclick=\"go()\" style=\"color:red\">Docs</a>");

        Semantics s = extractor.extract(tree.selectFirst("a"));

        assertThat(s.attributes().keySet()).containsExactly("data-testid", "aria-label", "href");
        assertThat(s.attributes()).containsEntry("href", "/docs");
    }

    @Test
    public void extract_filtersUtilityAndGeneratedClasses() {
        JsoupTree tree = JsoupTree.parse("<div class=\"product-card flex mt-4 p-2\"></div>");

        Semantics s = extractor.extract(tree.selectFirst("div"));

        assertThat(s.classes()).containsExactly("product-card");
    }

    @Test
    public void extract_keepsStableIdAndRole() {
        JsoupTree tree = JsoupTree.parse("<div id=\"cart\" role=\"region\"></div><div id=\"item-42\"></div>");

        assertThat(extractor.extract(tree.selectFirst("#cart")).id()).isEqualTo("cart");
        assertThat(extractor.extract(tree.selectFirst("#cart")).role()).isEqualTo("region");
        assertThat(extractor.extract(tree.select("div").get(1)).id()).isNull();
    }

    @Test
    public void extract_capturesTextOnlyForTextTags() {
        JsoupTree tree = JsoupTree.parse("<button>  Save\n  changes </button><div>Plain</div>");

        Semantics button = extractor.extract(tree.selectFirst("button"));
        assertThat(button.text().normalized()).isEqualTo("Save changes");
        assertThat(button.text().matchMode()).isEqualTo(MatchMode.EXACT);
        assertThat(extractor.extract(tree.selectFirst("div")).text()).isNull();
    }

    @Test
    public void extract_fallsBackToSubtreeText() {
        JsoupTree tree = JsoupTree.parse("<a href=\"/x\"><span>Open</span> <b>file</b></a>");

        Semantics s = extractor.extract(tree.selectFirst("a"));

        assertThat(s.text().normalized()).isEqualTo("Open file");
    }

    @Test
    public void extract_usesCacheForRepeatedNodes() {
        EidCache cache = new EidCache(8);
        FeatureExtractor cached = new FeatureExtractor(GeneratorOptions.builder().cache(cache).build());
        TreeNode node = JsoupTree.parse("<button>Go</button>").selectFirst("button");

        Semantics first = cached.extract(node);
        Semantics second = cached.extract(node);

        assertThat(second).isSameAs(first);
        assertThat(cache.stats().semanticsHits()).isEqualTo(1);
    }

    @Test
    public void liveText_prefersOwnText() {
        JsoupTree tree = JsoupTree.parse("<li>Item <span>badge</span></li><li><span>Only child</span></li>");

        assertThat(FeatureExtractor.liveText(tree.select("li").get(0))).isEqualTo("Item");
        assertThat(FeatureExtractor.liveText(tree.select("li").get(1))).isEqualTo("Only child");
    }
}
