package stableid.generator;

import org.testng.annotations.Test;
import stableid.resolver.SelectorSynthesizer;
import stableid.resolver.SemanticsFilter;
import stableid.tree.JsoupTree;
import stableid.tree.TreeNode;

import static org.assertj.core.api.Assertions.assertThat;

public class PathBuilderTest {

    private static PathBuilder builder(GeneratorOptions options) {
        return new PathBuilder(options, new FeatureExtractor(options),
                new SelectorSynthesizer(options.getMaxSelectorClasses(), new SemanticsFilter()));
    }

    @Test
    public void build_dropsLayoutWrappersWhenUnique() {
        JsoupTree tree = JsoupTree.parse("<main><div><ul class=\"menu-list\"><li><a href=\"/a\">A</a></li>"
                + "</ul></div></main>");

        PathResult path = builder(GeneratorOptions.defaults()).build(tree.selectFirst("main"), tree.selectFirst("a"));

        assertThat(path.nodes()).extracting(TreeNode::tagName).containsExactly("ul", "li");
        assertThat(path.unique()).isTrue();
        assertThat(path.degraded()).isFalse();
    }

    @Test
    public void build_restoresDroppedNodesNearestFirst() {
        JsoupTree tree = JsoupTree.parse("<main><div><span><button>Go</button></span></div>"
                + "<span><button>Go</button></span></main>");
        TreeNode first = tree.select("button").get(0);

        PathResult path = builder(GeneratorOptions.defaults()).build(tree.selectFirst("main"), first);

        assertThat(path.nodes()).extracting(TreeNode::tagName).containsExactly("div", "span");
        assertThat(path.unique()).isTrue();
    }

    @Test
    public void build_truncatesLongWalks() {
        JsoupTree tree = JsoupTree.parse("<div class=\"flex\"><div class=\"flex\"><div class=\"flex\">"
                + "<button>Go</button></div></div></div>");
        GeneratorOptions options = GeneratorOptions.builder().maxPathDepth(2).build();

        PathResult path = builder(options).build(tree.body(), tree.selectFirst("button"));

        assertThat(path.degraded()).isTrue();
        assertThat(path.unique()).isTrue();
        assertThat(path.nodes().size()).isLessThanOrEqualTo(2);
    }

    @Test
    public void build_isEmptyWhenAnchorIsTarget() {
        JsoupTree tree = JsoupTree.parse("<form id=\"login\"></form>");
        TreeNode form = tree.selectFirst("form");

        PathResult path = builder(GeneratorOptions.defaults()).build(form, form);

        assertThat(path.nodes()).isEmpty();
    }

    @Test
    public void isSemantic_recognizesMeaningfulNodes() {
        JsoupTree tree = JsoupTree.parse("<div id=\"cart\"></div><div aria-hidden=\"true\"></div>"
                + "<div class=\"flex\"></div><div role=\"button\"></div><ul></ul><div></div>");

        assertThat(PathBuilder.isSemantic(tree.selectFirst("#cart"))).isTrue();
        assertThat(PathBuilder.isSemantic(tree.selectFirst("[aria-hidden]"))).isTrue();
        assertThat(PathBuilder.isSemantic(tree.selectFirst(".flex"))).isFalse();
        assertThat(PathBuilder.isSemantic(tree.selectFirst("[role]"))).isTrue();
        assertThat(PathBuilder.isSemantic(tree.selectFirst("ul"))).isTrue();
        assertThat(PathBuilder.isSemantic(tree.select("div").get(4))).isFalse();
    }
}
