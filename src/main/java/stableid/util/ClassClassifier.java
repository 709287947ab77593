package stableid.util;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Separates meaningful class names from utility-framework and
 * CSS-in-JS generated ones.
 *
 * <p>Two stages: a fast deny-list (utility prefixes, generated-name patterns)
 * followed by a heuristic {@link #score(String)}. Short names, embedded digits
 * and responsive breakpoint tokens lower the score; names below
 * {@link #DEFAULT_THRESHOLD} are dropped.
 */
public final class ClassClassifier {

    private ClassClassifier() {}

    public static final double DEFAULT_THRESHOLD = 0.3;

    private static final List<Pattern> DYNAMIC_PATTERNS = compile(
            "^css-[a-z0-9]+$",
            "^sc-[a-z0-9]+(-\\d+)?$",
            "^Mui[A-Z]\\w+-\\w+-\\w+",
            "^makeStyles-\\w+-\\d+$",
            "^jss\\d+$",
            "^(emotion|linaria)-[a-z0-9]+",
            "^(chakra|tw-|ant-)[a-z0-9]+-\\w+",
            "-(?=[a-f]*\\d)[a-f0-9]{6,}$",
            "^_[a-z0-9]{5,}$",
            "^[A-Za-z]+_(?=[a-z0-9]*\\d)[a-z0-9]{5}$",   // CSS modules: button_x7k2p
            "\\d{5,}");

    private static final List<Pattern> UTILITY_PATTERNS = compile(
            "^\\[",
            "^(first|last|odd|even|only|hover|focus|active|disabled|checked|focus-within|focus-visible|visited|group-hover|peer-focus):",
            "^(sm|md|lg|xl|2xl):",
            "^(dark|rtl|ltr):",
            "/([\\d.]+|full|auto|screen)$",
            "^(inset|top|right|bottom|left)(-|$)",
            "^(flex|inline-flex|grid|block|inline|inline-block|hidden|visible|invisible|contents)$",
            "^(absolute|relative|fixed|sticky|static)$",
            "^(items|justify|content|self|place)-",
            "^flex-(row|col|wrap|nowrap|1|auto|initial|none|grow|shrink)",
            "^grid-(cols|rows|flow)",
            "^(gap|space)-",
            "^-?[mp][trblxyse]?-(\\d+(\\.\\d+)?|auto|px)$",
            "^(w|h|min-w|min-h|max-w|max-h|size)-",
            "^text-(center|left|right|justify|start|end|xs|sm|base|lg|xl|\\dxl)$",
            "^text-(uppercase|lowercase|capitalize|normal-case|underline|line-through|no-underline|truncate|ellipsis|clip|nowrap|wrap)$",
            "^text-(muted|primary|secondary|success|danger|warning|info|light|dark|white|black)$",
            "^text-[a-z]+-\\d{2,3}$",
            "^(bg|border|ring|shadow|outline|divide|from|via|to|fill|stroke)-",
            "^rounded(-|$)",
            "^(font|leading|tracking|whitespace|break|truncate|line-clamp)-",
            "^(uppercase|lowercase|capitalize|truncate|italic|underline)$",
            "^(transform|transition|duration|delay|ease|animate)(-|$)",
            "^(scale|rotate|translate|skew|origin)-",
            "^(backdrop|blur|brightness|contrast|grayscale)-",
            "^(motion|fade|slide|zoom|bounce|pulse|spin|ping)-",
            "^(overflow|overscroll|scroll)-",
            "^(cursor|pointer-events|select|resize|appearance)-",
            "^(opacity|z|order)-",
            "^d-(none|inline|inline-block|block|grid|table|flex)$",
            "^d-(sm|md|lg|xl)-",
            "^(float|clearfix|align|justify|order)-",
            "^(position|start|end)-(static|relative|absolute|fixed|sticky|\\d+)$",
            "^col(-(sm|md|lg|xl|xxl))?(-\\d+|-auto)?$",
            "^offset(-(sm|md|lg|xl|xxl))?-\\d+$",
            "^row(-cols)?(-(sm|md|lg|xl))?(-\\d+)?$",
            "^g[xy]?-\\d$",
            "^(container|container-fluid)$",
            "^(show|hide|clearfix|sr-only|visually-hidden)$",
            "^btn-(sm|lg|block)$",
            "^pull-(left|right)$");

    private static final List<Pattern> SEMANTIC_PATTERNS = compile(
            "^(nav|menu|header|footer|sidebar|topbar|navbar|breadcrumb)",
            "(navigation|dropdown|megamenu)$",
            "^(btn|button|link|card|modal|dialog|popup|tooltip|alert|badge|chip)",
            "^(form|input|select|checkbox|radio|textarea|label|fieldset)",
            "^(table|list|item|row|cell|column)",
            "^(accordion|tab|carousel|slider|gallery)",
            "^(content|main|article|post|comment|title|subtitle|description|caption)",
            "^(hero|banner|section|panel|widget|toolbar)",
            "^(user|profile|avatar|account|auth|login|logout|signup)",
            "^(product|price|cart|checkout|order)",
            "^(submit|cancel|close|delete|edit|save|back|next|prev|search)");

    private static final Pattern BREAKPOINT_TOKEN = Pattern.compile("(^|[-_])(xs|sm|md|lg|xl|xxl)([-_]|$)");
    private static final Pattern DIGIT = Pattern.compile("\\d");

    // ── Classification ────────────────────────────────────────────────────

    public static boolean isDynamic(String cls) {
        return matchesAny(DYNAMIC_PATTERNS, cls);
    }

    public static boolean isUtility(String cls) {
        if (cls.length() <= 2) return true;
        if (Character.isDigit(cls.charAt(0))) return true;
        return matchesAny(UTILITY_PATTERNS, cls);
    }

    public static boolean isSemantic(String cls) {
        return !isDynamic(cls) && !isUtility(cls) && matchesAny(SEMANTIC_PATTERNS, cls);
    }

    /**
     * Heuristic stability score in [0,1]; 0 for deny-listed names.
     */
    public static double score(String cls) {
        if (cls == null || cls.isEmpty() || isDynamic(cls) || isUtility(cls)) return 0.0;

        double score = matchesAny(SEMANTIC_PATTERNS, cls) ? 0.8 : 0.5;
        if (cls.length() < 3) {
            score *= 0.3;
        } else if (cls.length() < 5) {
            score *= 0.6;
        }
        if (DIGIT.matcher(cls).find()) score *= 0.7;
        if (BREAKPOINT_TOKEN.matcher(cls).find()) score *= 0.5;
        return Math.min(score, 1.0);
    }

    public static boolean isStable(String cls) {
        return score(cls) >= DEFAULT_THRESHOLD;
    }

    /** True when every class is utility or generated (or there are none). */
    public static boolean allUtility(List<String> classes) {
        for (String cls : classes) {
            if (isStable(cls)) return false;
        }
        return true;
    }

    /**
     * Keeps classes scoring at or above {@code threshold}, in input order.
     */
    public static List<String> filterStable(List<String> classes, double threshold) {
        List<String> kept = new ArrayList<>();
        for (String cls : classes) {
            if (score(cls) >= threshold) kept.add(cls);
        }
        return kept;
    }

    public static List<String> filterStable(List<String> classes) {
        return filterStable(classes, DEFAULT_THRESHOLD);
    }

    private static boolean matchesAny(List<Pattern> patterns, String value) {
        for (Pattern p : patterns) {
            if (p.matcher(value).find()) return true;
        }
        return false;
    }

    private static List<Pattern> compile(String... regexes) {
        List<Pattern> out = new ArrayList<>(regexes.length);
        for (String r : regexes) out.add(Pattern.compile(r));
        return List.copyOf(out);
    }
}
