package stableid.util;

import java.util.regex.Pattern;

/**
 * Whitespace normalization for captured and compared text. No case folding
 * and no Unicode normalization.
 */
public final class TextNormalizer {

    private TextNormalizer() {}

    public static final int MAX_TEXT_LENGTH = 100;

    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00a0]+");

    /** Trims and collapses runs of whitespace (including no-break spaces) to one space. */
    public static String normalize(String text) {
        if (text == null) return "";
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    public static boolean isTruncated(String normalized) {
        return normalized.length() > MAX_TEXT_LENGTH;
    }

    /** First {@link #MAX_TEXT_LENGTH} characters, without a dangling trailing space. */
    public static String truncate(String normalized) {
        if (!isTruncated(normalized)) return normalized;
        return normalized.substring(0, MAX_TEXT_LENGTH).trim();
    }
}
