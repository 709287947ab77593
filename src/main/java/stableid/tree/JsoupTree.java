package stableid.tree;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Headless tree backed by a jsoup {@link Document}.
 *
 * <p>Each element is represented by exactly one {@link TreeNode} wrapper for
 * the lifetime of the tree, so node identity is stable across calls and
 * weak-keyed caches work as expected. Wrappers of removed elements stay
 * valid but report {@link TreeNode#isConnected()} as {@code false}; the tree
 * keeps them reachable until {@link #prune()} drops them.
 *
 * <p>Not thread-safe beyond wrapper creation; mutate and query a tree from one
 * thread at a time.
 */
public final class JsoupTree {

    private static final Logger log = LoggerFactory.getLogger(JsoupTree.class);

    private final Document document;
    private final Map<Element, JsoupTreeNode> nodes = new IdentityHashMap<>();

    private JsoupTree(Document document) {
        this.document = Objects.requireNonNull(document, "document");
    }

    // ── Factories ─────────────────────────────────────────────────────────

    public static JsoupTree parse(String html) {
        return new JsoupTree(Jsoup.parse(html));
    }

    public static JsoupTree parse(Path file) throws IOException {
        log.debug("Parsing HTML from {}", file);
        return new JsoupTree(Jsoup.parse(file.toFile(), StandardCharsets.UTF_8.name()));
    }

    public static JsoupTree of(Document document) {
        return new JsoupTree(document);
    }

    // ── Access ────────────────────────────────────────────────────────────

    /** The document node, usable as a resolution root. */
    public TreeNode root() {
        return node(document);
    }

    /** The body element, or the document node when there is none. */
    public TreeNode body() {
        Element body = document.body();
        return body != null ? node(body) : root();
    }

    /**
     * Drops wrappers of elements no longer attached to this document, so
     * caches keyed on them can release their entries.
     *
     * @return number of wrappers dropped
     */
    public synchronized int prune() {
        int before = nodes.size();
        nodes.keySet().removeIf(e -> e.ownerDocument() != document);
        int dropped = before - nodes.size();
        if (dropped > 0) log.debug("Pruned {} detached wrapper(s)", dropped);
        return dropped;
    }

    /** Canonical wrapper for an element of this tree. */
    public synchronized TreeNode node(Element element) {
        Objects.requireNonNull(element, "element");
        return nodes.computeIfAbsent(element, e -> new JsoupTreeNode(this, e));
    }

    /** First element matching the query, or {@code null}. */
    public TreeNode selectFirst(String cssQuery) {
        List<TreeNode> matches = root().select(cssQuery);
        return matches.isEmpty() ? null : matches.get(0);
    }

    public List<TreeNode> select(String cssQuery) {
        return root().select(cssQuery);
    }

    public Document document() {
        return document;
    }
}
