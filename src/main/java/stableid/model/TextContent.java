package stableid.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Text captured from a node: the raw form as found in the tree and the
 * whitespace-normalized form used for comparison.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TextContent(String raw, String normalized, MatchMode matchMode) {

    public TextContent {
        Objects.requireNonNull(normalized, "normalized");
        if (raw == null) raw = normalized;
        if (matchMode == null) matchMode = MatchMode.EXACT;
    }
}
