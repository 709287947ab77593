package stableid.util;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Renders CSS selector fragments that every supported engine parses the
 * same way.
 *
 * <p>Values that cannot be expressed portably (quotes, backslashes, line
 * breaks) yield {@link Optional#empty()}; callers leave such features to
 * semantic filtering instead of the selector.
 */
public final class CssSyntax {

    private CssSyntax() {}

    private static final Pattern IDENTIFIER = Pattern.compile("^-?[A-Za-z_][A-Za-z0-9_-]*$");
    private static final Pattern ATTRIBUTE_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_:.-]*$");

    public static boolean isIdentifier(String value) {
        return value != null && IDENTIFIER.matcher(value).matches();
    }

    /** {@code #id} when the id is a plain identifier, else {@code [id="..."]}. */
    public static Optional<String> id(String id) {
        if (isIdentifier(id)) return Optional.of("#" + id);
        return attribute("id", id);
    }

    public static Optional<String> className(String cls) {
        return isIdentifier(cls) ? Optional.of("." + cls) : Optional.empty();
    }

    /** {@code [name="value"]}. */
    public static Optional<String> attribute(String name, String value) {
        return attribute(name, "=", value);
    }

    /** {@code [name^="value"]}: prefix match, used for cleaned URLs. */
    public static Optional<String> attributePrefix(String name, String value) {
        return attribute(name, "^=", value);
    }

    private static Optional<String> attribute(String name, String operator, String value) {
        if (name == null || !ATTRIBUTE_NAME.matcher(name).matches()) return Optional.empty();
        if (value == null || !isQuotable(value)) return Optional.empty();
        return Optional.of("[" + name + operator + "\"" + value + "\"]");
    }

    static boolean isQuotable(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '"' || c == '\\' || c == '\n' || c == '\r' || c == '\f' || c == ']') return false;
        }
        return true;
    }
}
