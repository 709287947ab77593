package stableid.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Layout-resistant fingerprint of a vector-shape node.
 *
 * <p>{@code dHash} is set for path-like shapes, {@code geomHash} for
 * primitive shapes. When {@code hasAnimation} is set, resolution compares
 * only the shape kind and title.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record GeometryFingerprint(
        ShapeKind shape,
        @JsonProperty("dHash") String dHash,
        String geomHash,
        @JsonProperty("hasAnimation") boolean hasAnimation,
        String role,
        String titleText) {
}
