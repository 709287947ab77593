package stableid.resolver;

import org.testng.annotations.Test;
import stableid.Fixtures;
import stableid.generator.EidGenerator;
import stableid.model.ElementIdentity;
import stableid.model.Semantics;
import stableid.tree.JsoupTree;
import stableid.tree.TreeNode;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SelectorSynthesizer}.
 */
public class SelectorSynthesizerTest {

    private final SelectorSynthesizer synthesizer = new SelectorSynthesizer();

    @Test(description = "An id replaces every other feature")
    public void testNodeSelectorWithId() {
        Semantics s = new Semantics("login", List.of("login-form"), Map.of("name", "x"), null, null, null);
        assertThat(synthesizer.nodeSelector("form", s)).isEqualTo("form#login");
    }

    @Test(description = "Attributes in priority order, then role, then classes")
    public void testNodeSelectorOrdering() {
        Semantics s = new Semantics(null, List.of("primary-action", "wide-button"),
                Map.of("type", "submit", "data-testid", "save"), "button", null, null);

        assertThat(synthesizer.nodeSelector("button", s))
                .isEqualTo("button[data-testid=\"save\"][type=\"submit\"][role=\"button\"].primary-action.wide-button");
        assertThat(synthesizer.attributeSelector("button", s))
                .isEqualTo("button[data-testid=\"save\"][type=\"submit\"][role=\"button\"]");
    }

    @Test(description = "Class count is capped")
    public void testMaxClasses() {
        SelectorSynthesizer one = new SelectorSynthesizer(1, new SemanticsFilter());
        Semantics s = new Semantics(null, List.of("card", "card-body"), null, null, null, null);

        assertThat(one.nodeSelector("div", s)).isEqualTo("div.card");
        assertThatThrownBy(() -> new SelectorSynthesizer(-1, new SemanticsFilter()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test(description = "Vector children are joined with the child combinator")
    public void testCombinators() {
        assertThat(SelectorSynthesizer.join(List.of("svg", "g", "path"), List.of("svg", "g", "path")))
                .isEqualTo("svg > g > path");
        assertThat(SelectorSynthesizer.join(List.of("nav", "ul", "a"), List.of("nav", "ul", "a")))
                .isEqualTo("nav ul a");
        assertThat(SelectorSynthesizer.combinator("div", "rect")).isEqualTo(" ");
    }

    @Test(description = "The base selector is unique on an unchanged page")
    public void testSynthesizeBase() {
        JsoupTree tree = JsoupTree.parse(Fixtures.LOGIN_FORM);
        ElementIdentity eid = new EidGenerator().generate(tree.selectFirst("button")).orElseThrow();

        SelectorSynthesizer.SelectorResult result = synthesizer.synthesize(eid, tree.root());

        assertThat(result.selector()).isEqualTo("form#login button[type=\"submit\"]");
        assertThat(result.unique()).isTrue();
        assertThat(result.strategy()).isEqualTo(SelectorSynthesizer.Strategy.BASE);
    }

    @Test(description = "Identical siblings are told apart by position")
    public void testSynthesizePositional() {
        JsoupTree tree = JsoupTree.parse(Fixtures.TWIN_ITEMS);
        TreeNode second = tree.select("button").get(1);
        ElementIdentity eid = new EidGenerator().generate(second).orElseThrow();

        SelectorSynthesizer.SelectorResult result = synthesizer.synthesize(eid, tree.root());

        assertThat(result.unique()).isTrue();
        assertThat(result.strategy()).isNotEqualTo(SelectorSynthesizer.Strategy.BASE);
        assertThat(tree.root().select(result.selector())).containsExactly(second);
    }

    @Test(description = "The anchor ladder stops at the first unique option")
    public void testAnchorSelector() {
        JsoupTree tree = JsoupTree.parse(Fixtures.TWIN_ITEMS);
        ElementIdentity eid = new EidGenerator().generate(tree.select("button").get(0)).orElseThrow();

        assertThat(synthesizer.anchorSelector(eid, tree.root())).isEqualTo("main");
    }

    @Test(description = "Route ties prefer the recorded sibling position")
    public void testBestRouteTarget() {
        JsoupTree tree = JsoupTree.parse(Fixtures.TWIN_ITEMS);
        List<TreeNode> buttons = tree.select("button");
        ElementIdentity eid = new EidGenerator().generate(buttons.get(1)).orElseThrow();

        assertThat(synthesizer.bestRouteTarget(eid, tree.root(), buttons)).isEqualTo(buttons.get(1));
    }
}
