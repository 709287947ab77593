package stableid.webdriver;

import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.openqa.selenium.By;
import org.openqa.selenium.Dimension;
import org.openqa.selenium.InvalidSelectorException;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.Point;
import org.openqa.selenium.Rectangle;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import stableid.tree.BoundingBox;
import stableid.tree.SelectorException;
import stableid.tree.TreeAccessException;
import stableid.tree.TreeNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class WebDriverTreeTest {

    @Mock
    private WebElement button;

    @Mock
    private WebElement form;

    private WebDriver driver;
    private JavascriptExecutor js;
    private WebDriverTree tree;
    private AutoCloseable mocks;

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        driver = mock(WebDriver.class, withSettings().extraInterfaces(JavascriptExecutor.class));
        js = (JavascriptExecutor) driver;
        tree = new WebDriverTree(driver);
    }

    @AfterMethod
    public void tearDown() throws Exception {
        mocks.close();
    }

    @Test
    public void driver_without_javascript_is_rejected() {
        WebDriver plain = mock(WebDriver.class);

        assertThatThrownBy(() -> new WebDriverTree(plain))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("JavaScript");
    }

    @Test
    public void each_element_gets_one_wrapper() {
        TreeNode first = tree.node(button);
        TreeNode second = tree.node(button);

        assertThat(second).isSameAs(first);
        assertThat(tree.node(form)).isNotEqualTo(first);
    }

    @Test
    public void root_is_the_document() {
        TreeNode root = tree.root();

        assertThat(root.isDocument()).isTrue();
        assertThat(root.tagName()).isEqualTo("#document");
        assertThat(root.parent()).isNull();
        assertThat(root.document()).isSameAs(root);
    }

    @Test
    public void tag_name_is_lowercased() {
        when(button.getTagName()).thenReturn("BUTTON");

        assertThat(tree.node(button).tagName()).isEqualTo("button");
    }

    @Test
    public void stale_element_raises_tree_access_exception() {
        when(button.getTagName()).thenThrow(new StaleElementReferenceException("gone"));

        assertThatThrownBy(() -> tree.node(button).tagName())
                .isInstanceOf(TreeAccessException.class)
                .hasCauseInstanceOf(StaleElementReferenceException.class);
    }

    @Test
    public void attributes_come_from_the_page_with_lowercased_names() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("Data-TestId", "save");
        raw.put("class", "primary  primary wide");
        when(js.executeScript(WebElementNode.ATTRIBUTES_SCRIPT, button)).thenReturn(raw);

        TreeNode node = tree.node(button);

        assertThat(node.attributes()).containsEntry("data-testid", "save");
        assertThat(node.classNames()).containsExactly("primary", "wide");
    }

    @Test
    public void parent_and_children_are_canonical_wrappers() {
        when(js.executeScript(WebElementNode.PARENT_SCRIPT, button)).thenReturn(form);
        when(js.executeScript(WebElementNode.CHILDREN_SCRIPT, form)).thenReturn(List.of(button));

        TreeNode node = tree.node(button);

        assertThat(node.parent()).isSameAs(tree.node(form));
        assertThat(tree.node(form).children()).containsExactly(node);
    }

    @Test
    public void element_without_parent_element_has_null_parent() {
        when(js.executeScript(WebElementNode.PARENT_SCRIPT, button)).thenReturn(null);

        assertThat(tree.node(button).parent()).isNull();
    }

    @Test
    public void text_is_read_through_scripts() {
        when(js.executeScript(WebElementNode.OWN_TEXT_SCRIPT, button)).thenReturn("Save");
        when(js.executeScript(WebElementNode.TEXT_SCRIPT, button)).thenReturn("Save draft");

        TreeNode node = tree.node(button);

        assertThat(node.ownText()).isEqualTo("Save");
        assertThat(node.textContent()).isEqualTo("Save draft");
    }

    @Test
    public void bounding_box_comes_from_rect() {
        when(button.getRect()).thenReturn(new Rectangle(new Point(10, 20), new Dimension(100, 40)));

        BoundingBox box = tree.node(button).boundingBox().orElseThrow();

        assertThat(box).isEqualTo(new BoundingBox(10, 20, 100, 40));
    }

    @Test
    public void document_is_null_once_detached() {
        when(js.executeScript(WebElementNode.CONNECTED_SCRIPT, button)).thenReturn(true);
        when(js.executeScript(WebElementNode.CONNECTED_SCRIPT, form))
                .thenThrow(new StaleElementReferenceException("gone"));

        assertThat(tree.node(button).document()).isSameAs(tree.root());
        assertThat(tree.node(form).document()).isNull();
    }

    @Test
    public void page_query_wraps_found_elements() {
        when(driver.findElements(By.cssSelector("form button"))).thenReturn(List.of(button));

        assertThat(tree.select("form button")).containsExactly(tree.node(button));
    }

    @Test
    public void invalid_selector_raises_selector_exception() {
        when(driver.findElements(any(By.class))).thenThrow(new InvalidSelectorException("bad"));

        assertThatThrownBy(() -> tree.select("button["))
                .isInstanceOf(SelectorException.class)
                .extracting(e -> ((SelectorException) e).getSelector())
                .isEqualTo("button[");
    }

    @Test
    public void element_query_includes_the_element_itself_when_it_matches() {
        when(form.findElements(By.cssSelector("form, button"))).thenReturn(List.of(button));
        when(js.executeScript(WebElementNode.MATCHES_SCRIPT, form, "form, button")).thenReturn(true);

        List<TreeNode> found = tree.node(form).select("form, button");

        assertThat(found).containsExactly(tree.node(form), tree.node(button));
    }

    @Test
    public void element_query_excludes_non_matching_element() {
        when(form.findElements(By.cssSelector("button"))).thenReturn(List.of(button));
        when(js.executeScript(WebElementNode.MATCHES_SCRIPT, form, "button")).thenReturn(false);

        assertThat(tree.node(form).select("button")).containsExactly(tree.node(button));
    }
}
