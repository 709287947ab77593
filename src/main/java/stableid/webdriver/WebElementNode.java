package stableid.webdriver;

import org.openqa.selenium.By;
import org.openqa.selenium.InvalidSelectorException;
import org.openqa.selenium.Rectangle;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import stableid.tree.BoundingBox;
import stableid.tree.SelectorException;
import stableid.tree.TreeAccessException;
import stableid.tree.TreeNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link TreeNode} over a Selenium {@link WebElement}. Obtain instances
 * through {@link WebDriverTree#node(WebElement)}.
 */
final class WebElementNode implements TreeNode {

    static final String ATTRIBUTES_SCRIPT =
            "var r = {}; var a = arguments[0].attributes;"
            + "for (var i = 0; i < a.length; i++) { r[a[i].name] = a[i].value; } return r;";
    static final String PARENT_SCRIPT = "return arguments[0].parentElement;";
    static final String CHILDREN_SCRIPT = "return Array.from(arguments[0].children);";
    static final String OWN_TEXT_SCRIPT =
            "return Array.from(arguments[0].childNodes)"
            + ".filter(function (n) { return n.nodeType === 3 && n.nodeValue.trim().length > 0; })"
            + ".map(function (n) { return n.nodeValue; }).join(' ');";
    static final String TEXT_SCRIPT = "return arguments[0].textContent;";
    static final String CONNECTED_SCRIPT = "return arguments[0].isConnected;";
    static final String MATCHES_SCRIPT = "return arguments[0].matches(arguments[1]);";

    private final WebDriverTree tree;
    private final WebElement element;

    WebElementNode(WebDriverTree tree, WebElement element) {
        this.tree = tree;
        this.element = element;
    }

    WebElement element() { return element; }

    @Override
    public String tagName() {
        try {
            return element.getTagName().toLowerCase();
        } catch (StaleElementReferenceException e) {
            throw new TreeAccessException("Element is no longer attached to the page", e);
        }
    }

    @Override
    public Map<String, String> attributes() {
        Object raw = tree.script(ATTRIBUTES_SCRIPT, element);
        Map<String, String> result = new LinkedHashMap<>();
        if (raw instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> e : map.entrySet()) {
                result.put(String.valueOf(e.getKey()).toLowerCase(), e.getValue() == null ? "" : e.getValue().toString());
            }
        }
        return Collections.unmodifiableMap(result);
    }

    @Override
    public List<String> classNames() {
        String cls = attribute("class");
        if (cls == null || cls.isBlank()) return List.of();
        return List.copyOf(new LinkedHashSet<>(List.of(cls.trim().split("\\s+"))));
    }

    @Override
    public TreeNode parent() {
        Object raw = tree.script(PARENT_SCRIPT, element);
        return raw instanceof WebElement parent ? tree.node(parent) : null;
    }

    @Override
    public List<TreeNode> children() {
        return tree.wrap(tree.script(CHILDREN_SCRIPT, element));
    }

    @Override
    public String ownText() {
        Object raw = tree.script(OWN_TEXT_SCRIPT, element);
        return raw == null ? "" : raw.toString();
    }

    @Override
    public String textContent() {
        Object raw = tree.script(TEXT_SCRIPT, element);
        return raw == null ? "" : raw.toString();
    }

    @Override
    public List<TreeNode> select(String cssQuery) {
        List<WebElement> found;
        try {
            found = element.findElements(By.cssSelector(cssQuery));
        } catch (InvalidSelectorException e) {
            throw new SelectorException(cssQuery, e);
        } catch (StaleElementReferenceException e) {
            throw new TreeAccessException("Element is no longer attached to the page", e);
        } catch (WebDriverException e) {
            throw new TreeAccessException("Query failed for '" + cssQuery + "': " + e.getMessage(), e);
        }
        List<TreeNode> result = new ArrayList<>(found.size() + 1);
        if (Boolean.TRUE.equals(tree.script(MATCHES_SCRIPT, element, cssQuery))) result.add(this);
        result.addAll(tree.wrapElements(found));
        return Collections.unmodifiableList(result);
    }

    @Override
    public Optional<BoundingBox> boundingBox() {
        try {
            Rectangle rect = element.getRect();
            return Optional.of(new BoundingBox(rect.getX(), rect.getY(), rect.getWidth(), rect.getHeight()));
        } catch (StaleElementReferenceException e) {
            throw new TreeAccessException("Element is no longer attached to the page", e);
        }
    }

    /** The page's document node, or {@code null} once the element has been removed. */
    @Override
    public TreeNode document() {
        try {
            return Boolean.TRUE.equals(tree.script(CONNECTED_SCRIPT, element)) ? tree.root() : null;
        } catch (TreeAccessException e) {
            if (e.getCause() instanceof StaleElementReferenceException) return null;
            throw e;
        }
    }

    // ── Identity ──────────────────────────────────────────────────────────

    @Override
    public boolean equals(Object o) {
        return o instanceof WebElementNode other && other.element.equals(element);
    }

    @Override
    public int hashCode() {
        return element.hashCode();
    }

    @Override
    public String toString() {
        return "WebElementNode[" + element + "]";
    }
}
