package stableid.generator;

import stableid.model.GeometryFingerprint;
import stableid.model.ShapeKind;
import stableid.tree.TreeNode;
import stableid.util.TextNormalizer;
import stableid.util.Vocabulary;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fingerprints vector-shape nodes so they can be recognized after
 * animation or layout changes.
 *
 * <p>Path-like shapes hash their first drawing commands with operands rounded
 * to one decimal ({@code dHash}). Primitive shapes hash shape-intrinsic
 * ratios only ({@code geomHash}): rect width/height, ellipse rx/ry, line
 * angle. Raw coordinates, transforms and viewBox values are never hashed.
 */
public class GeometryFingerprinter {

    static final int MAX_PATH_COMMANDS = 5;

    private static final Pattern PATH_COMMAND = Pattern.compile("[MLHVCSQTAZ][^MLHVCSQTAZ]*", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBER = Pattern.compile("-?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][-+]?\\d+)?");
    private static final Pattern ANIMATED_STYLE = Pattern.compile("(animation|transition)(-[a-z-]+)?\\s*:\\s*+(?!none)", Pattern.CASE_INSENSITIVE);

    /** True for shape tags inside an {@code svg} subtree, and for {@code svg} itself. */
    public boolean isVectorShape(TreeNode node) {
        String tag = node.tagName();
        if ("svg".equals(tag)) return true;
        if (ShapeKind.fromTag(tag) == ShapeKind.OTHER) return false;
        for (TreeNode n = node.parent(); n != null; n = n.parent()) {
            if ("svg".equals(n.tagName())) return true;
        }
        return false;
    }

    public GeometryFingerprint fingerprint(TreeNode node) {
        ShapeKind shape = ShapeKind.fromTag(node.tagName());
        String dHash = null;
        String geomHash = null;

        switch (shape) {
            case PATH -> dHash = pathHash(node.attribute("d"));
            case POLYLINE, POLYGON -> dHash = pointsHash(node.attribute("points"));
            case RECT -> geomHash = ratioHash("rect", node.attribute("width"), node.attribute("height"));
            case ELLIPSE -> geomHash = ratioHash("ellipse", node.attribute("rx"), node.attribute("ry"));
            case CIRCLE -> geomHash = hash("circle:ratio=1.00");
            case LINE -> geomHash = lineHash(node);
            default -> { }
        }

        String role = node.attribute("role");
        return new GeometryFingerprint(shape, dHash, geomHash, hasAnimation(node),
                role == null || role.isBlank() ? null : role, titleText(node));
    }

    // ── Hashes ────────────────────────────────────────────────────────────

    String pathHash(String d) {
        if (d == null || d.isBlank()) return null;
        Matcher m = PATH_COMMAND.matcher(d);
        List<String> commands = new ArrayList<>();
        while (m.find() && commands.size() < MAX_PATH_COMMANDS) {
            String cmd = m.group();
            StringBuilder normalized = new StringBuilder().append(cmd.charAt(0));
            Matcher n = NUMBER.matcher(cmd.substring(1));
            while (n.find()) {
                normalized.append(' ').append(round1(n.group()));
            }
            commands.add(normalized.toString());
        }
        return commands.isEmpty() ? null : hash(String.join(" ", commands));
    }

    private String pointsHash(String points) {
        if (points == null || points.isBlank()) return null;
        Matcher n = NUMBER.matcher(points);
        List<String> coords = new ArrayList<>();
        while (n.find() && coords.size() < MAX_PATH_COMMANDS * 2) {
            coords.add(round1(n.group()));
        }
        return coords.isEmpty() ? null : hash("points " + String.join(" ", coords));
    }

    private String ratioHash(String kind, String a, String b) {
        Double x = parseLength(a);
        Double y = parseLength(b);
        if (x == null || y == null || y == 0.0) return null;
        return hash(kind + ":ratio=" + String.format(Locale.ROOT, "%.2f", x / y));
    }

    private String lineHash(TreeNode node) {
        Double x1 = parseLength(node.attribute("x1"));
        Double y1 = parseLength(node.attribute("y1"));
        Double x2 = parseLength(node.attribute("x2"));
        Double y2 = parseLength(node.attribute("y2"));
        if (x1 == null || y1 == null || x2 == null || y2 == null) return null;
        double angle = Math.atan2(y2 - y1, x2 - x1);
        return hash("line:angle=" + String.format(Locale.ROOT, "%.2f", angle));
    }

    /** 32-bit string hash rendered as 8 hex digits. */
    static String hash(String value) {
        return String.format("%08x", value.hashCode());
    }

    // ── Animation and title ───────────────────────────────────────────────

    boolean hasAnimation(TreeNode node) {
        if (hasAnimationChild(node)) return true;
        String style = node.attribute("style");
        if (style != null && ANIMATED_STYLE.matcher(style).find()) return true;
        for (String cls : node.classNames()) {
            String c = cls.toLowerCase(Locale.ROOT);
            if (c.startsWith("animate") || c.startsWith("transition")
                    || c.equals("spin") || c.equals("pulse") || c.equals("bounce")) {
                return true;
            }
        }
        return false;
    }

    private boolean hasAnimationChild(TreeNode node) {
        for (TreeNode child : node.children()) {
            if (Vocabulary.SVG_ANIMATION_TAGS.contains(child.tagName().toLowerCase(Locale.ROOT))) return true;
            if (hasAnimationChild(child)) return true;
        }
        return false;
    }

    private String titleText(TreeNode node) {
        for (TreeNode child : node.children()) {
            if ("title".equals(child.tagName())) {
                String text = TextNormalizer.normalize(child.textContent());
                return text.isEmpty() ? null : text;
            }
        }
        return null;
    }

    private static String round1(String number) {
        try {
            return String.format(Locale.ROOT, "%.1f", Double.parseDouble(number));
        } catch (NumberFormatException e) {
            return number;
        }
    }

    private static Double parseLength(String raw) {
        if (raw == null) return null;
        String v = raw.trim().toLowerCase(Locale.ROOT);
        if (v.endsWith("px")) v = v.substring(0, v.length() - 2).trim();
        if (v.isEmpty() || v.endsWith("%")) return null;
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
