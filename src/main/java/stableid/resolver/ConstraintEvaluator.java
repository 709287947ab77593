package stableid.resolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stableid.generator.FeatureExtractor;
import stableid.model.Constraint;
import stableid.model.PositionStrategy;
import stableid.tree.BoundingBox;
import stableid.tree.TreeNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Narrows a candidate list with the descriptor's constraints.
 */
public class ConstraintEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConstraintEvaluator.class);

    public static final int DEFAULT_MAX_DISTANCE = 5;

    /** Highest priority first; ties keep descriptor order. */
    public static final Comparator<Constraint> BY_PRIORITY =
            Comparator.comparingInt(Constraint::priority).reversed();

    /**
     * @param candidates remaining candidates, document order preserved
     * @param degraded   true if the constraint picked a candidate by position
     */
    public record Outcome(List<TreeNode> candidates, boolean degraded) {
        public Outcome {
            candidates = List.copyOf(candidates);
        }
    }

    public static List<Constraint> byPriority(List<Constraint> constraints) {
        List<Constraint> sorted = new ArrayList<>(constraints);
        sorted.sort(BY_PRIORITY);
        return sorted;
    }

    public Outcome apply(List<TreeNode> candidates, Constraint constraint) {
        return switch (constraint.type()) {
            case UNIQUENESS -> new Outcome(candidates, false);
            case TEXT_PROXIMITY -> new Outcome(textProximity(candidates, constraint), false);
            case POSITION -> position(candidates, constraint);
        };
    }

    // ── text-proximity ────────────────────────────────────────────────────

    /**
     * Candidates whose live text is within {@code maxDistance} edits of the
     * reference, in their original order.
     */
    private List<TreeNode> textProximity(List<TreeNode> candidates, Constraint constraint) {
        String reference = constraint.stringParam(Constraint.PARAM_REFERENCE);
        if (reference == null) return candidates;
        int maxDistance = constraint.intParam(Constraint.PARAM_MAX_DISTANCE, DEFAULT_MAX_DISTANCE);

        List<TreeNode> near = new ArrayList<>();
        for (TreeNode candidate : candidates) {
            if (editDistance(FeatureExtractor.liveText(candidate), reference) <= maxDistance) near.add(candidate);
        }
        log.debug("text-proximity kept {}/{} (max distance {})", near.size(), candidates.size(), maxDistance);
        return near;
    }

    /**
     * Levenshtein distance using one row of the dynamic-programming table.
     */
    public static int editDistance(String a, String b) {
        if (a.equals(b)) return 0;
        if (a.isEmpty()) return b.length();
        if (b.isEmpty()) return a.length();

        int[] row = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) row[j] = j;

        for (int i = 1; i <= a.length(); i++) {
            int diagonal = row[0];
            row[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int above = row[j];
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                row[j] = Math.min(Math.min(row[j - 1] + 1, above + 1), diagonal + cost);
                diagonal = above;
            }
        }
        return row[b.length()];
    }

    // ── position ──────────────────────────────────────────────────────────

    private Outcome position(List<TreeNode> candidates, Constraint constraint) {
        if (candidates.size() <= 1) return new Outcome(candidates, false);

        PositionStrategy strategy = PositionStrategy.FIRST_IN_DOM;
        String code = constraint.stringParam(Constraint.PARAM_STRATEGY);
        if (code != null) {
            try {
                strategy = PositionStrategy.fromCode(code);
            } catch (IllegalArgumentException e) {
                log.debug("Unknown position strategy '{}', using first-in-dom", code);
            }
        }

        TreeNode pick = switch (strategy) {
            case FIRST_IN_DOM -> candidates.get(0);
            case TOP_MOST -> minBy(candidates, BoundingBox::y);
            case LEFT_MOST -> minBy(candidates, BoundingBox::x);
        };
        return new Outcome(List.of(pick), true);
    }

    /** Candidate with the smallest coordinate; candidates without geometry never win over ones with it. */
    private static TreeNode minBy(List<TreeNode> candidates, ToDoubleFunction<BoundingBox> coordinate) {
        TreeNode best = candidates.get(0);
        double bestValue = Double.POSITIVE_INFINITY;
        for (TreeNode candidate : candidates) {
            Optional<BoundingBox> box = candidate.boundingBox();
            if (box.isEmpty()) continue;
            double value = coordinate.applyAsDouble(box.get());
            if (value < bestValue) {
                bestValue = value;
                best = candidate;
            }
        }
        return best;
    }
}
