package stableid.util;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Allow-list, priority table and volatility checks for node attributes.
 *
 * <p>An attribute is captured only if it is stable ({@link #isStable}),
 * has a positive {@link #priority}, and its value is not volatile.
 */
public final class AttributeRules {

    private AttributeRules() {}

    private static final Map<String, Integer> PRIORITY = Map.ofEntries(
            Map.entry("data-testid", 100),
            Map.entry("data-qa", 99),
            Map.entry("data-cy", 98),
            Map.entry("data-test", 97),
            Map.entry("data-test-id", 96),
            Map.entry("aria-label", 90),
            Map.entry("aria-labelledby", 85),
            Map.entry("aria-describedby", 80),
            Map.entry("name", 75),
            Map.entry("href", 70),
            Map.entry("src", 70),
            Map.entry("type", 65),
            Map.entry("role", 60),
            Map.entry("alt", 55),
            Map.entry("title", 50),
            Map.entry("for", 45),
            Map.entry("placeholder", 40));

    private static final int DATA_PRIORITY = 30;
    private static final int ARIA_PRIORITY = 25;

    /** href and src hold URLs; their values are cleaned and compared by path. */
    public static final Set<String> URL_ATTRIBUTES = Set.of("href", "src");

    private static final Set<String> IGNORED = Set.of(
            "id", "class", "style", "xmlns", "tabindex", "contenteditable");

    private static final Set<String> ARIA_STABLE = Set.of(
            "role", "aria-label", "aria-labelledby", "aria-describedby", "aria-controls",
            "aria-owns", "aria-level", "aria-posinset", "aria-setsize", "aria-haspopup");

    private static final Set<String> ARIA_STATE = Set.of(
            "aria-selected", "aria-checked", "aria-pressed", "aria-expanded", "aria-hidden",
            "aria-disabled", "aria-current", "aria-busy", "aria-invalid", "aria-grabbed",
            "aria-live", "aria-atomic", "aria-valuenow", "aria-valuetext", "aria-activedescendant");

    private static final Set<String> DATA_STATE = Set.of(
            "data-state", "data-active", "data-inactive", "data-selected", "data-open",
            "data-closed", "data-visible", "data-hidden", "data-disabled", "data-enabled",
            "data-loading", "data-error", "data-success", "data-highlighted", "data-focused",
            "data-hover", "data-orientation", "data-theme", "data-side", "data-align");

    private static final List<String> LIBRARY_PREFIXES = List.of(
            "data-radix-", "data-headlessui-", "data-reach-", "data-mui-", "data-chakra-",
            "data-mantine-", "data-tw-", "data-react", "data-v-", "ng-", "_ng");

    private static final Set<String> DATA_ID = Set.of(
            "data-testid", "data-test-id", "data-test", "data-cy", "data-qa",
            "data-automation-id", "data-id", "data-component");

    private static final Set<String> HTML_STABLE = Set.of(
            "name", "type", "placeholder", "title", "for", "alt", "href", "src");

    private static final Set<String> HTML_STATE = Set.of(
            "disabled", "checked", "selected", "hidden", "readonly", "required", "value");

    private static final List<Pattern> VOLATILE_VALUES = List.of(
            Pattern.compile("^[a-f0-9]{32,}$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^\\d{10,}$"),
            Pattern.compile("^(undefined|null|\\[object)"),
            Pattern.compile("^\\{\\{.*}}$"));

    /** Orders attribute names by descending priority, then by name. */
    public static final Comparator<String> BY_PRIORITY =
            Comparator.comparingInt(AttributeRules::priority).reversed()
                    .thenComparing(Comparator.naturalOrder());

    // ── Rules ─────────────────────────────────────────────────────────────

    public static int priority(String name) {
        Integer fixed = PRIORITY.get(name);
        if (fixed != null) return fixed;
        if (name.startsWith("data-")) return DATA_PRIORITY;
        if (name.startsWith("aria-")) return ARIA_PRIORITY;
        return 0;
    }

    /** Attributes never captured: handled separately, presentational or event handlers. */
    public static boolean isIgnored(String name) {
        if (IGNORED.contains(name)) return true;
        if (name.startsWith("on")) return true;
        for (String prefix : LIBRARY_PREFIXES) {
            if (name.startsWith(prefix)) return true;
        }
        return false;
    }

    /**
     * True if the attribute identifies rather than describes state.
     */
    public static boolean isStable(String name) {
        if (ARIA_STABLE.contains(name)) return true;
        if (ARIA_STATE.contains(name)) return false;
        if (DATA_STATE.contains(name)) return false;
        for (String prefix : LIBRARY_PREFIXES) {
            if (name.startsWith(prefix)) return false;
        }
        if (DATA_ID.contains(name)) return true;
        if (name.startsWith("data-") && name.endsWith("-id")) return true;
        if (HTML_STABLE.contains(name)) return true;
        if (HTML_STATE.contains(name)) return false;
        return name.startsWith("data-");
    }

    public static boolean isVolatileValue(String value) {
        for (Pattern p : VOLATILE_VALUES) {
            if (p.matcher(value).find()) return true;
        }
        return false;
    }

    /**
     * Full capture decision for one attribute, given its raw value.
     */
    public static boolean shouldCapture(String name, String value) {
        if (value == null || value.isBlank()) return false;
        if (isIgnored(name) || !isStable(name) || priority(name) <= 0) return false;
        if (IdHeuristics.ID_REFERENCE_ATTRIBUTES.contains(name)
                && IdHeuristics.hasDynamicIdReference(value)) {
            return false;
        }
        return !isVolatileValue(value);
    }

    public static boolean isTestMarker(String name) {
        return Vocabulary.TEST_MARKER_ATTRIBUTES.contains(name);
    }
}
