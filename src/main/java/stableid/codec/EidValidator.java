package stableid.codec;

import stableid.model.ElementIdentity;
import stableid.model.NodeDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Structural checks on a descriptor. Never throws; problems are reported in
 * the returned {@link ValidationResult}.
 */
public final class EidValidator {

    /**
     * @param valid    true when there are no errors (warnings are allowed)
     * @param errors   problems that make the descriptor unusable
     * @param warnings problems resolution can live with
     */
    public record ValidationResult(boolean valid, List<String> errors, List<String> warnings) {
        public ValidationResult {
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
        }
    }

    private EidValidator() {}

    public static ValidationResult validate(ElementIdentity eid) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (eid == null) {
            errors.add("Descriptor is null");
            return new ValidationResult(false, errors, warnings);
        }

        if (eid.version() == null || eid.version().isBlank()) {
            errors.add("Missing version");
        } else if (!eid.isVersionSupported()) {
            warnings.add("Unknown version: " + eid.version());
        }

        checkNode("Anchor", eid.anchor(), errors);
        for (int i = 0; i < eid.path().size(); i++) {
            checkNode("Path node " + i, eid.path().get(i), errors);
        }
        checkNode("Target", eid.target(), errors);

        if (eid.meta() == null) {
            errors.add("Missing meta");
        } else {
            double confidence = eid.meta().confidence();
            if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
                warnings.add("Confidence outside [0,1]: " + confidence);
            }
            if (eid.meta().generatedAt() == null) warnings.add("Missing generatedAt timestamp");
            if (eid.meta().degraded() && eid.meta().degradationReason() == null) {
                warnings.add("Degraded descriptor without a degradation reason");
            }
        }

        if (eid.fallback() == null) {
            warnings.add("Missing fallback rules, defaults apply");
        } else if (eid.fallback().maxDepth() < 0) {
            warnings.add("Negative fallback maxDepth: " + eid.fallback().maxDepth());
        }

        return new ValidationResult(errors.isEmpty(), errors, warnings);
    }

    private static void checkNode(String label, NodeDescriptor node, List<String> errors) {
        if (node == null) {
            errors.add("Missing " + label.toLowerCase(Locale.ROOT));
            return;
        }
        if (node.tag().isBlank()) errors.add(label + " has a blank tag");
        if (node.nthChild() != null && node.nthChild() < 1) {
            errors.add(label + " has nthChild " + node.nthChild() + " (must be >= 1)");
        }
    }
}
