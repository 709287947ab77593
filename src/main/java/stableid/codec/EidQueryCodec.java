package stableid.codec;

import stableid.model.Constraint;
import stableid.model.ConstraintType;
import stableid.model.EidMeta;
import stableid.model.ElementIdentity;
import stableid.model.FallbackRules;
import stableid.model.NodeDescriptor;
import stableid.model.PositionStrategy;
import stableid.model.Semantics;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonical single-line form of a descriptor, for storage and analytics:
 * <pre>
 *   v1: footer :: ul.menu &gt; li#3 &gt; a[href="/contact"]
 *   v1: main :: div.card &gt; button[type="submit"] {pos=top-most,unique=true}
 * </pre>
 *
 * <p>Each node is {@code tag(.class)*[name="value",...]#n}: classes and
 * attributes sorted, the stable id and role written as attributes, and the
 * sibling position written only for path and target nodes past the first
 * position. In values {@code \ " > :} are backslash-escaped.
 *
 * <p>Recorded text is never written, and neither are {@code mailto:} or
 * {@code tel:} links, so no personal content leaves the page. The constraint
 * block lists {@code unique=true} and {@code pos=<strategy>} and is omitted
 * when it would only repeat the uniqueness constraint every descriptor has.
 *
 * <p>Decoded descriptors score every node 0.7, get confidence 0.7, default
 * fallback rules and always carry a uniqueness constraint. The encoding is
 * never used as a live query; decode it first.
 */
public final class EidQueryCodec {

    public static final String PREFIX = "v1";
    public static final double PARSED_SCORE = 0.7;
    public static final String PARSED_SOURCE = "query";

    static final int UNIQUENESS_PRIORITY = 100;
    static final int POSITION_PRIORITY = 70;
    static final int TEXT_PRIORITY = 60;

    private static final Pattern TAG = Pattern.compile("[a-z][a-z0-9_-]*");
    private static final Pattern CLASS = Pattern.compile("[A-Za-z0-9_-]+");

    private EidQueryCodec() {}

    // ── Encoding ──────────────────────────────────────────────────────────

    public static String encode(ElementIdentity eid) {
        StringBuilder sb = new StringBuilder(PREFIX).append(": ");
        sb.append(node(eid.anchor(), false)).append(" :: ");
        for (NodeDescriptor step : eid.path()) {
            sb.append(node(step, true)).append(" > ");
        }
        sb.append(node(eid.target(), true));
        sb.append(constraints(eid.constraints()));
        return sb.toString();
    }

    private static String node(NodeDescriptor node, boolean withPosition) {
        Semantics s = node.semantics();
        StringBuilder sb = new StringBuilder(node.tag());

        s.classes().stream()
                .filter(c -> CLASS.matcher(c).matches())
                .sorted()
                .distinct()
                .forEach(c -> sb.append('.').append(c));

        Map<String, String> attrs = new TreeMap<>();
        for (Map.Entry<String, String> e : s.attributes().entrySet()) {
            if (!isPersonal(e.getValue())) attrs.put(e.getKey(), e.getValue());
        }
        if (s.hasId()) attrs.put("id", s.id());
        if (s.role() != null) attrs.putIfAbsent("role", s.role());
        if (!attrs.isEmpty()) {
            sb.append('[');
            boolean first = true;
            for (Map.Entry<String, String> e : attrs.entrySet()) {
                if (!first) sb.append(',');
                sb.append(e.getKey()).append("=\"").append(escape(e.getValue())).append('"');
                first = false;
            }
            sb.append(']');
        }

        if (withPosition && node.nthChild() != null && node.nthChild() > 1) {
            sb.append('#').append(node.nthChild());
        }
        return sb.toString();
    }

    private static String constraints(List<Constraint> constraints) {
        List<String> pairs = new ArrayList<>();
        boolean informative = false;
        for (Constraint c : constraints) {
            if (c.type() == ConstraintType.UNIQUENESS) {
                pairs.add("unique=true");
            } else if (c.type() == ConstraintType.POSITION && c.stringParam(Constraint.PARAM_STRATEGY) != null) {
                pairs.add("pos=" + c.stringParam(Constraint.PARAM_STRATEGY));
                informative = true;
            }
        }
        if (!informative) return "";
        return " {" + String.join(",", pairs.stream().sorted().distinct().toList()) + "}";
    }

    private static boolean isPersonal(String value) {
        String v = value.trim().toLowerCase(Locale.ROOT);
        return v.startsWith("mailto:") || v.startsWith("tel:");
    }

    static String escape(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (c == '\\' || c == '"' || c == '>' || c == ':') sb.append('\\');
            sb.append(c);
        }
        return sb.toString();
    }

    // ── Decoding ──────────────────────────────────────────────────────────

    /**
     * @throws EidSyntaxException if the text is not a valid encoding
     */
    public static ElementIdentity decode(String text) {
        if (text == null) throw new EidSyntaxException("Empty descriptor query", "", 0);
        return new Parser(text.trim()).parse();
    }

    private static final class Parser {

        private final String in;
        private int pos;

        Parser(String in) {
            this.in = in;
        }

        ElementIdentity parse() {
            expect('v');
            int start = pos;
            while (pos < in.length() && (Character.isDigit(peek()) || peek() == '.')) pos++;
            String version = in.substring(start, pos);
            if (!version.equals("1") && !version.equals("1.0")) {
                throw error("Unsupported version 'v" + version + "' (expected v1)", start);
            }
            skipSpaces();
            expect(':');
            skipSpaces();

            NodeDescriptor anchor = node(false);
            skipSpaces();
            if (!in.startsWith("::", pos)) throw error("Expected '::' after anchor", pos);
            pos += 2;
            skipSpaces();

            List<NodeDescriptor> nodes = new ArrayList<>();
            nodes.add(node(true));
            skipSpaces();
            while (pos < in.length() && peek() == '>') {
                pos++;
                skipSpaces();
                nodes.add(node(true));
                skipSpaces();
            }

            List<Constraint> constraints = new ArrayList<>();
            if (pos < in.length() && peek() == '{') constraints.addAll(constraintBlock());
            skipSpaces();
            if (pos < in.length()) throw error("Unexpected '" + peek() + "'", pos);

            if (constraints.stream().noneMatch(c -> c.type() == ConstraintType.UNIQUENESS)) {
                constraints.add(0, Constraint.uniqueness(UNIQUENESS_PRIORITY));
            }

            NodeDescriptor target = nodes.remove(nodes.size() - 1);
            EidMeta meta = new EidMeta(PARSED_SCORE, false, null, null, EidMeta.GENERATOR, PARSED_SOURCE);
            return new ElementIdentity(ElementIdentity.CURRENT_VERSION, anchor, nodes, target, constraints,
                    FallbackRules.DEFAULT, meta);
        }

        private NodeDescriptor node(boolean withPosition) {
            int start = pos;
            String tag = match(TAG);
            if (tag == null) throw error("Expected tag name", start);

            List<String> classes = new ArrayList<>();
            while (pos < in.length() && peek() == '.') {
                pos++;
                String cls = match(CLASS);
                if (cls == null) throw error("Expected class name after '.'", pos);
                classes.add(cls);
            }

            Map<String, String> attributes = new LinkedHashMap<>();
            String id = null;
            String role = null;
            if (pos < in.length() && peek() == '[') {
                pos++;
                while (true) {
                    skipSpaces();
                    int nameStart = pos;
                    while (pos < in.length() && isNameChar(peek())) pos++;
                    if (pos == nameStart) throw error("Expected attribute name", pos);
                    String name = in.substring(nameStart, pos).toLowerCase(Locale.ROOT);
                    expect('=');
                    String value = quoted();
                    if (name.equals("id")) {
                        id = value;
                    } else {
                        attributes.put(name, value);
                        if (name.equals("role")) role = value;
                    }
                    skipSpaces();
                    if (pos < in.length() && peek() == ',') {
                        pos++;
                        continue;
                    }
                    expect(']');
                    break;
                }
            }

            Integer nth = null;
            if (pos < in.length() && peek() == '#') {
                pos++;
                int digitsStart = pos;
                while (pos < in.length() && Character.isDigit(peek())) pos++;
                if (pos == digitsStart) throw error("Expected position after '#'", pos);
                try {
                    nth = Integer.parseInt(in.substring(digitsStart, pos));
                } catch (NumberFormatException e) {
                    throw error("Position out of range", digitsStart);
                }
                if (nth < 1) throw error("Position must be >= 1", digitsStart);
                if (!withPosition) nth = null;
            }

            if (pos < in.length() && !Character.isWhitespace(peek())
                    && peek() != '>' && peek() != '{' && !in.startsWith("::", pos)) {
                throw error("Unexpected '" + peek() + "' in node", pos);
            }
            Semantics semantics = new Semantics(id, classes, attributes, role, null, null);
            return new NodeDescriptor(tag, semantics, PARSED_SCORE, nth);
        }

        private List<Constraint> constraintBlock() {
            expect('{');
            List<Constraint> constraints = new ArrayList<>();
            while (true) {
                skipSpaces();
                int keyStart = pos;
                while (pos < in.length() && Character.isLetter(peek())) pos++;
                String key = in.substring(keyStart, pos);
                if (key.isEmpty()) throw error("Expected constraint name", keyStart);
                skipSpaces();
                expect('=');
                skipSpaces();
                int valueStart = pos;
                String value = pos < in.length() && peek() == '"' ? quoted() : bare();

                switch (key) {
                    case "unique" -> {
                        if (value.equals("true")) constraints.add(Constraint.uniqueness(UNIQUENESS_PRIORITY));
                    }
                    case "pos" -> {
                        try {
                            constraints.add(Constraint.position(PositionStrategy.fromCode(value), POSITION_PRIORITY));
                        } catch (IllegalArgumentException e) {
                            throw error("Unknown position strategy '" + value + "'", valueStart);
                        }
                    }
                    case "text" -> constraints.add(Constraint.textProximity(value,
                            Math.max(1, value.length() / 5), TEXT_PRIORITY));
                    default -> {
                        // newer writers may add keys this version does not know
                    }
                }
                skipSpaces();
                if (pos < in.length() && peek() == ',') {
                    pos++;
                    continue;
                }
                expect('}');
                return constraints;
            }
        }

        private String quoted() {
            expect('"');
            StringBuilder sb = new StringBuilder();
            while (pos < in.length()) {
                char c = in.charAt(pos++);
                if (c == '\\') {
                    if (pos >= in.length()) throw error("Dangling escape", pos - 1);
                    sb.append(in.charAt(pos++));
                } else if (c == '"') {
                    return sb.toString();
                } else {
                    sb.append(c);
                }
            }
            throw error("Unterminated string", pos);
        }

        private String bare() {
            int start = pos;
            while (pos < in.length() && (Character.isLetterOrDigit(peek()) || peek() == '-' || peek() == '_')) pos++;
            if (pos == start) throw error("Expected value", start);
            return in.substring(start, pos);
        }

        private String match(Pattern pattern) {
            Matcher m = pattern.matcher(in).region(pos, in.length());
            if (!m.lookingAt()) return null;
            pos = m.end();
            return m.group();
        }

        private static boolean isNameChar(char c) {
            return Character.isLetterOrDigit(c) || c == '-' || c == '_' || c == ':' || c == '.';
        }

        private void expect(char c) {
            if (pos >= in.length() || peek() != c) throw error("Expected '" + c + "'", pos);
            pos++;
        }

        private char peek() {
            return in.charAt(pos);
        }

        private void skipSpaces() {
            while (pos < in.length() && Character.isWhitespace(peek())) pos++;
        }

        private EidSyntaxException error(String message, int at) {
            return new EidSyntaxException(message, in, at);
        }
    }
}
