package stableid.util;

import java.util.Set;

/**
 * Fixed HTML/ARIA/SVG vocabularies shared by the generator and resolver.
 */
public final class Vocabulary {

    private Vocabulary() {}

    /** Tier A anchor tags. */
    public static final Set<String> ANCHOR_TAGS = Set.of(
            "form", "main", "nav", "section", "article", "header", "footer");

    /** Tier B anchor roles: ARIA landmarks and container roles. */
    public static final Set<String> LANDMARK_ROLES = Set.of(
            "form", "navigation", "main", "region", "contentinfo", "complementary",
            "banner", "search", "dialog", "alertdialog", "tabpanel", "list",
            "listbox", "menu", "menubar", "tree", "grid", "table", "toolbar");

    /** Tags that carry meaning on their own and are kept in a path. */
    public static final Set<String> SEMANTIC_TAGS = Set.of(
            // HTML5 sectioning
            "article", "aside", "details", "figcaption", "figure", "footer", "header",
            "main", "mark", "nav", "section", "summary", "time",
            // forms
            "button", "datalist", "fieldset", "form", "input", "label", "legend", "meter",
            "optgroup", "option", "output", "progress", "select", "textarea",
            // interactive and media
            "a", "audio", "video", "canvas", "dialog", "menu", "img",
            // text content
            "blockquote", "dd", "dl", "dt", "hr", "li", "ol", "ul", "p", "pre",
            "h1", "h2", "h3", "h4", "h5", "h6",
            // tables
            "caption", "col", "colgroup", "table", "tbody", "td", "tfoot", "th", "thead", "tr",
            // vector
            "svg", "path", "circle", "rect", "line", "polyline", "polygon", "ellipse",
            "g", "text", "use");

    /** Roles of interactive widgets; a node carrying one is kept in a path. */
    public static final Set<String> INTERACTIVE_ROLES = Set.of(
            "button", "link", "checkbox", "radio", "switch", "tab", "menuitem",
            "menuitemcheckbox", "menuitemradio", "option", "textbox", "searchbox",
            "combobox", "slider", "spinbutton", "treeitem", "gridcell", "row", "cell",
            "listitem", "heading");

    /** Tags whose text is captured as a semantic feature. */
    public static final Set<String> TEXT_TAGS = Set.of(
            "button", "a", "label", "h1", "h2", "h3", "h4", "h5", "h6", "p", "span",
            "li", "th", "td", "dt", "dd", "legend", "figcaption", "summary", "option",
            "caption", "title");

    /** Row/cell tags; siblings commonly share a tag, so position is taken over all siblings. */
    public static final Set<String> TABLE_TAGS = Set.of(
            "tr", "td", "th", "thead", "tbody", "tfoot");

    /** Vector child tags selected with the child combinator below an {@code svg}. */
    public static final Set<String> SVG_CHILD_TAGS = Set.of(
            "rect", "path", "circle", "line", "polyline", "polygon", "ellipse",
            "g", "text", "use", "defs", "clippath", "mask");

    /** Native SVG animation elements. */
    public static final Set<String> SVG_ANIMATION_TAGS = Set.of(
            "animate", "animatetransform", "animatemotion", "set");

    /** Test/automation marker attributes (anchor tier C). */
    public static final Set<String> TEST_MARKER_ATTRIBUTES = Set.of(
            "data-testid", "data-test-id", "data-test", "data-qa", "data-cy", "data-automation-id");

    /** Ids used by frameworks for their mount point. */
    public static final Set<String> FRAMEWORK_ROOT_IDS = Set.of(
            "root", "app", "__next", "__nuxt", "___gatsby", "svelte");

    /** Attributes frameworks put on their mount point. */
    public static final Set<String> FRAMEWORK_ROOT_ATTRIBUTES = Set.of(
            "data-reactroot", "ng-version", "data-v-app", "data-server-rendered");

    /** Generic layout containers that carry no meaning without other features. */
    public static final Set<String> LAYOUT_TAGS = Set.of("div", "span");

    /** Tags never worth describing. */
    public static final Set<String> NON_CONTENT_TAGS = Set.of(
            "script", "style", "noscript", "meta", "link", "head", "title", "template", "base");
}
