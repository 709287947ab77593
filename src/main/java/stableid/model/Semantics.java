package stableid.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stable semantic features of one node.
 *
 * <p>{@code attributes} keeps the priority order assigned at extraction
 * time; {@code classes} keeps document order. Both are unmodifiable.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Semantics(
        String id,
        List<String> classes,
        Map<String, String> attributes,
        String role,
        TextContent text,
        GeometryFingerprint geometry) {

    public static final Semantics EMPTY = new Semantics(null, null, null, null, null, null);

    public Semantics {
        classes = classes == null ? List.of() : List.copyOf(classes);
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public Semantics withGeometry(GeometryFingerprint fingerprint) {
        return new Semantics(id, classes, attributes, role, text, fingerprint);
    }

    public Semantics withText(TextContent newText) {
        return new Semantics(id, classes, attributes, role, newText, geometry);
    }

    @JsonIgnore
    public boolean hasId() {
        return id != null && !id.isEmpty();
    }

    @JsonIgnore
    public boolean hasText() {
        return text != null && !text.normalized().isEmpty();
    }

    /** True when no feature at all was captured. */
    @JsonIgnore
    public boolean isEmpty() {
        return !hasId() && classes.isEmpty() && attributes.isEmpty()
                && role == null && !hasText() && geometry == null;
    }
}
