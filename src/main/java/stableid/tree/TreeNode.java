package stableid.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal capability contract the generation and resolution pipelines need
 * from a tree node.
 *
 * <p>Implementations exist for a headless jsoup tree ({@link JsoupTree}) and
 * for a live browser DOM ({@code stableid.webdriver.WebDriverTree}). The
 * algorithms never touch anything beyond this interface.
 *
 * <p>Every element node belongs to at most one document. The document itself
 * is also a {@code TreeNode} ({@link #isDocument()} is {@code true}) so that it
 * can serve as a query root, but it is never returned by {@link #parent()}:
 * the top-most element reports a {@code null} parent.
 *
 * <p>Implementations must define {@code equals}/{@code hashCode} by underlying
 * node identity.
 */
public interface TreeNode {

    /** Lower-case tag name; {@code "#document"} for the document node. */
    String tagName();

    /** Attributes in document order, keyed by lower-case name. Never null. */
    Map<String, String> attributes();

    /** Class names in document order, without duplicates. Never null. */
    List<String> classNames();

    /** Parent element, or {@code null} for the top-most element, the document, or a detached root. */
    TreeNode parent();

    /** Element children in document order. */
    List<TreeNode> children();

    /** Direct child text nodes joined by a single space, unnormalized. Empty when there are none. */
    String ownText();

    /** Full subtree text, unnormalized. */
    String textContent();

    /**
     * Evaluates a CSS query against this node and its descendants.
     *
     * @return matches in document order (may include this node)
     * @throws SelectorException if the query cannot be parsed or evaluated
     */
    List<TreeNode> select(String cssQuery);

    /** Live layout geometry; empty for trees without layout. */
    Optional<BoundingBox> boundingBox();

    /** The document this node currently belongs to, or {@code null} when detached. */
    TreeNode document();

    default boolean isDocument() {
        return false;
    }

    default boolean isConnected() {
        return document() != null;
    }

    default String attribute(String name) {
        return attributes().get(name);
    }

    default boolean hasAttribute(String name) {
        return attributes().containsKey(name);
    }

    /** Non-blank {@code id} attribute, or {@code null}. */
    default String id() {
        String id = attribute("id");
        return id == null || id.isBlank() ? null : id;
    }

    /** 1-based position among all element siblings. */
    default int siblingIndex() {
        TreeNode parent = parent();
        if (parent == null) return 1;
        return parent.children().indexOf(this) + 1;
    }

    /** 1-based position among element siblings sharing this node's tag. */
    default int sameTagIndex() {
        TreeNode parent = parent();
        if (parent == null) return 1;
        int index = 0;
        for (TreeNode sibling : parent.children()) {
            if (sibling.tagName().equals(tagName())) index++;
            if (sibling.equals(this)) return index;
        }
        return 1;
    }

    /** Number of element siblings (including this node) sharing this node's tag. */
    default int sameTagCount() {
        TreeNode parent = parent();
        if (parent == null) return 1;
        int count = 0;
        for (TreeNode sibling : parent.children()) {
            if (sibling.tagName().equals(tagName())) count++;
        }
        return count;
    }

    /** Ancestors from the parent upwards, excluding the document. */
    default List<TreeNode> ancestors() {
        List<TreeNode> result = new ArrayList<>();
        for (TreeNode n = parent(); n != null; n = n.parent()) {
            result.add(n);
        }
        return Collections.unmodifiableList(result);
    }

    /** True if {@code other} is a strict ancestor of this node. */
    default boolean isDescendantOf(TreeNode other) {
        for (TreeNode n = parent(); n != null; n = n.parent()) {
            if (n.equals(other)) return true;
        }
        return false;
    }
}
