package stableid.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Generation metadata: overall confidence, degradation and provenance.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record EidMeta(
        double confidence,
        boolean degraded,
        DegradationReason degradationReason,
        Instant generatedAt,
        String generator,
        String source) {

    public static final String GENERATOR = "stableid/1.0";

    public EidMeta {
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }
}
