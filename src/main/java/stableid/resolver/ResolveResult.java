package stableid.resolver;

import stableid.model.DegradationReason;
import stableid.tree.TreeNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one resolution. Every expected outcome, including failures, is
 * a {@code ResolveResult}; nothing is thrown for not-found or ambiguity.
 *
 * <p>When {@link ResolveMeta#degraded()} is true a reason code is always set
 * and at least one warning describes it.
 */
public record ResolveResult(
        ResolveStatus status,
        List<TreeNode> matches,
        double confidence,
        List<String> warnings,
        ResolveMeta meta) {

    /**
     * @param degraded true if the outcome came from a fallback or relaxed strategy
     * @param reason   why, or {@code null} when not degraded
     */
    public record ResolveMeta(boolean degraded, DegradationReason reason) {

        public static final ResolveMeta CLEAN = new ResolveMeta(false, null);

        public static ResolveMeta degraded(DegradationReason reason) {
            return new ResolveMeta(true, Objects.requireNonNull(reason, "reason"));
        }
    }

    public ResolveResult {
        Objects.requireNonNull(status, "status");
        matches = matches == null ? List.of() : List.copyOf(matches);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        meta = meta == null ? ResolveMeta.CLEAN : meta;
        confidence = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));
    }

    // ── Factories ─────────────────────────────────────────────────────────

    public static ResolveResult success(TreeNode match, double confidence) {
        return new ResolveResult(ResolveStatus.SUCCESS, List.of(match), confidence, List.of(), ResolveMeta.CLEAN);
    }

    public static ResolveResult degraded(ResolveStatus status, List<TreeNode> matches, double confidence,
                                         DegradationReason reason, String warning) {
        return new ResolveResult(status, matches, confidence, List.of(warning), ResolveMeta.degraded(reason));
    }

    public static ResolveResult error(DegradationReason reason, String... warnings) {
        return new ResolveResult(ResolveStatus.ERROR, List.of(), 0.0, List.of(warnings), ResolveMeta.degraded(reason));
    }

    // ── Derivations ───────────────────────────────────────────────────────

    /** Copy with extra warnings appended. */
    public ResolveResult withWarnings(List<String> extra) {
        if (extra.isEmpty()) return this;
        List<String> all = new ArrayList<>(warnings);
        all.addAll(extra);
        return new ResolveResult(status, matches, confidence, all, meta);
    }

    /** Copy with the confidence multiplied by {@code factor}. */
    public ResolveResult scaled(double factor) {
        return new ResolveResult(status, matches, confidence * factor, warnings, meta);
    }

    // ── Accessors ─────────────────────────────────────────────────────────

    public boolean isSuccess() {
        return status == ResolveStatus.SUCCESS;
    }

    /** First match, or {@code null} when nothing matched. */
    public TreeNode firstMatch() {
        return matches.isEmpty() ? null : matches.get(0);
    }

    public DegradationReason reason() {
        return meta.reason();
    }
}
