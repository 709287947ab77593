package stableid.util;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Detects generated ids (hashes, counters, framework-assigned ids) that will
 * not survive a re-render.
 */
public final class IdHeuristics {

    private IdHeuristics() {}

    private static final List<Pattern> DYNAMIC_ID_PATTERNS = List.of(
            Pattern.compile("^[a-z]+-\\d+$", Pattern.CASE_INSENSITIVE),              // item-42
            Pattern.compile("^[a-z]+(-[a-z]+)+-\\d+$", Pattern.CASE_INSENSITIVE),    // list-item-42
            Pattern.compile("^[a-z]+(_[a-z]+)*_\\d+$", Pattern.CASE_INSENSITIVE),    // field_7
            Pattern.compile("^\\d+$"),
            Pattern.compile("^:[a-z0-9]+:$", Pattern.CASE_INSENSITIVE),             // React useId
            Pattern.compile("^[a-f0-9]{8}-[a-f0-9]{4}-[a-f0-9]{4}-[a-f0-9]{4}-[a-f0-9]{12}$",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("^[a-f0-9]{16,}$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^(radix|headlessui|react-aria|ember|mantine)-"),
            Pattern.compile("^mui-\\d+$"));

    private static final Pattern SHORT_PREFIX_HASH = Pattern.compile("^[a-z]{1,3}[A-Za-z0-9]{8,}$");
    private static final Pattern HAS_DIGIT = Pattern.compile("\\d");
    private static final Pattern HAS_UPPER = Pattern.compile("[A-Z]");

    /** Attributes whose value is a space-separated list of element ids. */
    public static final Set<String> ID_REFERENCE_ATTRIBUTES = Set.of(
            "aria-labelledby", "aria-describedby", "aria-controls", "aria-owns",
            "aria-activedescendant", "aria-details", "aria-errormessage", "aria-flowto",
            "for", "form", "list", "headers");

    public static boolean isDynamicId(String id) {
        if (id == null || id.isEmpty()) return false;
        for (Pattern p : DYNAMIC_ID_PATTERNS) {
            if (p.matcher(id).find()) return true;
        }
        if (SHORT_PREFIX_HASH.matcher(id).matches()) {
            boolean mixed = HAS_DIGIT.matcher(id).find() && HAS_UPPER.matcher(id).find();
            return mixed || id.length() >= 20;
        }
        return false;
    }

    public static boolean isStableId(String id) {
        return id != null && !id.isBlank() && !isDynamicId(id);
    }

    /** True if any id referenced by an id-list attribute value looks generated. */
    public static boolean hasDynamicIdReference(String value) {
        if (value == null || value.isBlank()) return false;
        for (String ref : value.trim().split("\\s+")) {
            if (isDynamicId(ref)) return true;
        }
        return false;
    }
}
