package stableid.webdriver;

import org.openqa.selenium.By;
import org.openqa.selenium.InvalidSelectorException;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stableid.tree.BoundingBox;
import stableid.tree.SelectorException;
import stableid.tree.TreeAccessException;
import stableid.tree.TreeNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Live browser tree backed by a Selenium {@link WebDriver}.
 *
 * <p>Attributes, text and structure are read through {@link JavascriptExecutor};
 * queries go through {@code By.cssSelector}; geometry comes from
 * {@link WebElement#getRect()}. Each element gets one canonical wrapper per
 * tree, keyed by the driver's element reference.
 *
 * <pre>{@code
 * WebDriverTree tree = new WebDriverTree(driver);
 * TreeNode button = tree.node(driver.findElement(By.id("submit")));
 * Optional<ElementIdentity> eid = StableId.generate(button);
 * }</pre>
 */
public final class WebDriverTree {

    private static final Logger log = LoggerFactory.getLogger(WebDriverTree.class);

    private final WebDriver driver;
    private final JavascriptExecutor js;
    private final DocumentNode root = new DocumentNode();
    private final Map<WebElement, WebElementNode> nodes = new HashMap<>();

    public WebDriverTree(WebDriver driver) {
        this.driver = Objects.requireNonNull(driver, "driver");
        if (!(driver instanceof JavascriptExecutor executor)) {
            throw new IllegalArgumentException("Driver must support JavaScript execution: "
                    + driver.getClass().getName());
        }
        this.js = executor;
    }

    // ── Access ────────────────────────────────────────────────────────────

    /** The document node, usable as a resolution root. */
    public TreeNode root() {
        return root;
    }

    /** Canonical wrapper for an element of the current page. */
    public synchronized TreeNode node(WebElement element) {
        Objects.requireNonNull(element, "element");
        return nodes.computeIfAbsent(element, e -> new WebElementNode(this, e));
    }

    public List<TreeNode> select(String cssQuery) {
        return root.select(cssQuery);
    }

    public WebDriver driver() {
        return driver;
    }

    // ── Driver plumbing ───────────────────────────────────────────────────

    Object script(String script, Object... args) {
        try {
            return js.executeScript(script, args);
        } catch (StaleElementReferenceException e) {
            throw new TreeAccessException("Element is no longer attached to the page", e);
        } catch (WebDriverException e) {
            throw new TreeAccessException("Script execution failed: " + e.getMessage(), e);
        }
    }

    List<TreeNode> wrap(Object scriptResult) {
        if (!(scriptResult instanceof List<?> list)) return List.of();
        List<TreeNode> result = new ArrayList<>(list.size());
        for (Object item : list) {
            if (item instanceof WebElement element) result.add(node(element));
        }
        return Collections.unmodifiableList(result);
    }

    List<TreeNode> wrapElements(List<WebElement> elements) {
        List<TreeNode> result = new ArrayList<>(elements.size());
        for (WebElement element : elements) result.add(node(element));
        return Collections.unmodifiableList(result);
    }

    List<TreeNode> find(String cssQuery) {
        try {
            return wrapElements(driver.findElements(By.cssSelector(cssQuery)));
        } catch (InvalidSelectorException e) {
            throw new SelectorException(cssQuery, e);
        } catch (WebDriverException e) {
            throw new TreeAccessException("Query failed for '" + cssQuery + "': " + e.getMessage(), e);
        }
    }

    // ── Document ──────────────────────────────────────────────────────────

    private final class DocumentNode implements TreeNode {

        @Override public String tagName()                           { return "#document"; }
        @Override public Map<String, String> attributes()           { return Map.of(); }
        @Override public List<String> classNames()                  { return List.of(); }
        @Override public TreeNode parent()                          { return null; }
        @Override public String ownText()                           { return ""; }
        @Override public Optional<BoundingBox> boundingBox()        { return Optional.empty(); }
        @Override public TreeNode document()                        { return this; }
        @Override public boolean isDocument()                       { return true; }

        @Override
        public List<TreeNode> children() {
            return wrap(script("return document.documentElement ? [document.documentElement] : [];"));
        }

        @Override
        public String textContent() {
            Object text = script("return document.documentElement ? document.documentElement.textContent : '';");
            return text == null ? "" : text.toString();
        }

        @Override
        public List<TreeNode> select(String cssQuery) {
            log.debug("Querying page for '{}'", cssQuery);
            return find(cssQuery);
        }

        @Override
        public String toString() {
            return "#document";
        }
    }
}
