package stableid.util;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Strips volatile parts from {@code href}/{@code src} values.
 *
 * <p>Relative URLs lose their query string; absolute URLs keep it unless
 * {@link #pathOnly(String)} is used. Fragments that look generated (long digit
 * runs, hex hashes, session/token words) are removed in both cases.
 */
public final class UrlCleaner {

    private UrlCleaner() {}

    private static final List<Pattern> DYNAMIC_FRAGMENT = List.of(
            Pattern.compile("\\d{5,}"),
            Pattern.compile("[a-f0-9]{8,}", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(session|token|temp|random|timestamp|nonce|cache)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^\\d+$"),
            Pattern.compile("^[a-f0-9-]{32,}$", Pattern.CASE_INSENSITIVE));

    /** Cleans the value if the attribute holds a URL; other values pass through. */
    public static String clean(String attribute, String value) {
        if (value == null || value.isEmpty()) return value;
        if (!AttributeRules.URL_ATTRIBUTES.contains(attribute)) return value;
        return cleanUrl(value, true);
    }

    /** Path plus kept fragment, query always dropped; used when comparing live values. */
    public static String pathOnly(String url) {
        if (url == null || url.isEmpty()) return url;
        return cleanUrl(url, false);
    }

    static boolean isDynamicFragment(String fragment) {
        if (fragment.isEmpty()) return false;
        for (Pattern p : DYNAMIC_FRAGMENT) {
            if (p.matcher(fragment).find()) return true;
        }
        return false;
    }

    private static String cleanUrl(String value, boolean keepAbsoluteQuery) {
        boolean absolute = value.startsWith("http://") || value.startsWith("https://");

        String fragment = null;
        int hash = value.indexOf('#');
        String rest = value;
        if (hash >= 0) {
            fragment = value.substring(hash + 1);
            rest = value.substring(0, hash);
        }
        String query = null;
        int q = rest.indexOf('?');
        String base = rest;
        if (q >= 0) {
            query = rest.substring(q + 1);
            base = rest.substring(0, q);
        }

        StringBuilder cleaned = new StringBuilder(base);
        if (absolute && keepAbsoluteQuery && query != null && !query.isEmpty()) {
            cleaned.append('?').append(query);
        }
        if (fragment != null && !fragment.isEmpty() && !isDynamicFragment(fragment)) {
            cleaned.append('#').append(fragment);
        }
        return cleaned.toString();
    }
}
