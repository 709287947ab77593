package stableid.tree;

import org.jsoup.nodes.Element;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JsoupTree} and its node wrappers.
 */
public class JsoupTreeTest {

    private static final String HTML = """
            <html><body>
              <nav id="top" class="menu menu">
                <a HREF="/home" Data-TestId="home">Home</a>
                <span>one</span><a href="/docs">Docs <b>now</b></a>
              </nav>
            </body></html>
            """;

    private JsoupTree tree;

    @BeforeMethod
    public void setUp() {
        tree = JsoupTree.parse(HTML);
    }

    @Test(description = "Each element has exactly one wrapper")
    public void testCanonicalWrappers() {
        TreeNode first = tree.selectFirst("a");
        TreeNode again = tree.select("nav a").get(0);
        assertThat(again).isSameAs(first);
        assertThat(first.parent()).isSameAs(tree.selectFirst("nav"));
    }

    @Test(description = "Attribute names are lower-cased and classes de-duplicated")
    public void testAttributesAndClasses() {
        TreeNode link = tree.selectFirst("a");
        assertThat(link.attributes()).containsEntry("href", "/home").containsEntry("data-testid", "home");
        assertThat(link.hasAttribute("data-testid")).isTrue();
        assertThat(tree.selectFirst("nav").classNames()).containsExactly("menu");
        assertThat(tree.selectFirst("nav").id()).isEqualTo("top");
    }

    @Test
    public void siblingPositions_countElementsOnly() {
        List<TreeNode> links = tree.select("a");
        TreeNode second = links.get(1);
        assertThat(second.siblingIndex()).isEqualTo(3);
        assertThat(second.sameTagIndex()).isEqualTo(2);
        assertThat(second.sameTagCount()).isEqualTo(2);
    }

    @Test
    public void text_ownTextExcludesDescendants() {
        TreeNode docs = tree.select("a").get(1);
        assertThat(docs.ownText().trim()).isEqualTo("Docs");
        assertThat(docs.textContent()).isEqualTo("Docs now");
    }

    @Test
    public void root_isDocumentAndTopElementHasNoParent() {
        TreeNode root = tree.root();
        assertThat(root.isDocument()).isTrue();
        assertThat(root.tagName()).isEqualTo("#document");
        assertThat(tree.selectFirst("html").parent()).isNull();
        assertThat(root.select("*")).doesNotContain(root);
        assertThat(tree.body().tagName()).isEqualTo("body");
    }

    @Test
    public void ancestors_stopBelowDocument() {
        TreeNode link = tree.selectFirst("a");
        assertThat(link.ancestors()).extracting(TreeNode::tagName).containsExactly("nav", "body", "html");
        assertThat(link.isDescendantOf(tree.body())).isTrue();
    }

    @Test
    public void removedElements_reportDetached() {
        TreeNode link = tree.selectFirst("a");
        assertThat(link.isConnected()).isTrue();
        tree.document().selectFirst("a").remove();
        assertThat(link.isConnected()).isFalse();
        assertThat(link.document()).isNull();
    }

    @Test
    public void prune_dropsOnlyDetachedWrappers() {
        TreeNode link = tree.selectFirst("a");
        TreeNode nav = tree.selectFirst("nav");
        Element removed = tree.document().selectFirst("a");
        removed.remove();

        assertThat(tree.prune()).isEqualTo(1);
        assertThat(tree.prune()).isZero();
        assertThat(tree.node(removed)).isNotSameAs(link);
        assertThat(tree.selectFirst("nav")).isSameAs(nav);
    }

    @Test
    public void attributeNames_ignoreDefaultLocale() {
        Locale saved = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            JsoupTree turkish = JsoupTree.parse("<input TITLE=\"Name\" ID=\"name\">");
            assertThat(turkish.selectFirst("input").attributes())
                    .containsEntry("title", "Name")
                    .containsEntry("id", "name");
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    public void select_wrapsParseErrors() {
        assertThatThrownBy(() -> tree.root().select("button["))
                .isInstanceOf(SelectorException.class)
                .satisfies(e -> assertThat(((SelectorException) e).getSelector()).isEqualTo("button["));
    }

    @Test
    public void boundingBox_isAbsentWithoutLayout() {
        assertThat(tree.selectFirst("nav").boundingBox()).isEmpty();
    }
}
