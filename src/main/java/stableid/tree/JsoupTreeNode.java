package stableid.tree;

import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@link TreeNode} over a jsoup {@link Element}. Obtain instances through
 * {@link JsoupTree#node(Element)}.
 */
final class JsoupTreeNode implements TreeNode {

    private final JsoupTree tree;
    private final Element element;

    JsoupTreeNode(JsoupTree tree, Element element) {
        this.tree = tree;
        this.element = element;
    }

    Element element() { return element; }

    @Override
    public String tagName() {
        return element instanceof Document ? "#document" : element.normalName();
    }

    @Override
    public Map<String, String> attributes() {
        Map<String, String> result = new LinkedHashMap<>();
        for (Attribute attribute : element.attributes()) {
            result.put(attribute.getKey().toLowerCase(Locale.ROOT), attribute.getValue());
        }
        return Collections.unmodifiableMap(result);
    }

    @Override
    public String attribute(String name) {
        return element.hasAttr(name) ? element.attr(name) : null;
    }

    @Override
    public boolean hasAttribute(String name) {
        return element.hasAttr(name);
    }

    @Override
    public List<String> classNames() {
        return List.copyOf(element.classNames());
    }

    @Override
    public TreeNode parent() {
        Element parent = element.parent();
        if (parent == null || parent instanceof Document) return null;
        return tree.node(parent);
    }

    @Override
    public List<TreeNode> children() {
        return wrap(element.children());
    }

    @Override
    public String ownText() {
        List<String> parts = new ArrayList<>();
        for (TextNode text : element.textNodes()) {
            String value = text.getWholeText();
            if (!value.isBlank()) parts.add(value);
        }
        return String.join(" ", parts);
    }

    @Override
    public String textContent() {
        return element.wholeText();
    }

    @Override
    public List<TreeNode> select(String cssQuery) {
        Elements found;
        try {
            found = element.select(cssQuery);
        } catch (Selector.SelectorParseException | IllegalArgumentException e) {
            throw new SelectorException(cssQuery, e);
        }
        return wrap(found);
    }

    @Override
    public Optional<BoundingBox> boundingBox() {
        return Optional.empty();
    }

    @Override
    public TreeNode document() {
        Document owner = element.ownerDocument();
        return owner == tree.document() ? tree.root() : null;
    }

    @Override
    public boolean isDocument() {
        return element instanceof Document;
    }

    @Override
    public int siblingIndex() {
        return parent() == null ? 1 : element.elementSiblingIndex() + 1;
    }

    // ── Identity ──────────────────────────────────────────────────────────

    @Override
    public boolean equals(Object o) {
        return o instanceof JsoupTreeNode other && other.element == element;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(element);
    }

    @Override
    public String toString() {
        return isDocument() ? "#document" : element.cssSelector();
    }

    private List<TreeNode> wrap(List<Element> elements) {
        List<TreeNode> result = new ArrayList<>(elements.size());
        for (Element e : elements) {
            if (!(e instanceof Document)) result.add(tree.node(e));
        }
        return Collections.unmodifiableList(result);
    }
}
