package stableid.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Vector shape classification used by geometry fingerprints.
 */
public enum ShapeKind {
    PATH("path"),
    RECT("rect"),
    CIRCLE("circle"),
    ELLIPSE("ellipse"),
    LINE("line"),
    POLYLINE("polyline"),
    POLYGON("polygon"),
    TEXT("text"),
    GROUP("g"),
    USE("use"),
    SVG("svg"),
    OTHER("other");

    private final String code;

    ShapeKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() { return code; }

    @JsonCreator
    public static ShapeKind fromCode(String code) {
        for (ShapeKind value : values()) {
            if (value.code.equalsIgnoreCase(code) || value.name().equalsIgnoreCase(code)) return value;
        }
        throw new IllegalArgumentException("Unknown ShapeKind: " + code);
    }

    /** Maps a lower-case vector tag name to its shape kind; unknown tags map to {@link #OTHER}. */
    public static ShapeKind fromTag(String tag) {
        for (ShapeKind value : values()) {
            if (value != OTHER && value.code.equals(tag)) return value;
        }
        return OTHER;
    }

    @Override
    public String toString() { return code; }
}
