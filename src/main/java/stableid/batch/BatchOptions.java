package stableid.batch;

import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Options of one batch run.
 */
public final class BatchOptions {

    /** Receives {@code (processed, total)} every {@code progressInterval} nodes and once at the end. */
    @FunctionalInterface
    public interface ProgressListener {
        void onProgress(int processed, int total);
    }

    public static final int DEFAULT_PROGRESS_INTERVAL = 100;

    private static final ProgressListener NO_PROGRESS = (processed, total) -> { };
    private static final BooleanSupplier NEVER_CANCELLED = () -> false;

    private final boolean skipNonSemantic;
    private final boolean prioritize;
    private final int limit;
    private final int progressInterval;
    private final ProgressListener progressListener;
    private final BooleanSupplier cancelled;

    private BatchOptions(Builder b) {
        this.skipNonSemantic = b.skipNonSemantic;
        this.prioritize = b.prioritize;
        this.limit = b.limit;
        this.progressInterval = b.progressInterval;
        this.progressListener = b.progressListener;
        this.cancelled = b.cancelled;
    }

    public static BatchOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Skip nodes with no id, role, label or test marker unless their tag is meaningful. */
    public boolean isSkipNonSemantic()             { return skipNonSemantic; }
    /** Process nodes with stable ids first, then nodes with semantic attributes. */
    public boolean isPrioritize()                  { return prioritize; }
    public int getLimit()                          { return limit; }
    public int getProgressInterval()               { return progressInterval; }
    public ProgressListener getProgressListener()  { return progressListener; }
    /** Checked between nodes; a node in progress always completes. */
    public BooleanSupplier getCancelled()          { return cancelled; }

    // ── Builder ───────────────────────────────────────────────────────────

    public static final class Builder {

        private boolean skipNonSemantic = true;
        private boolean prioritize = true;
        private int limit = Integer.MAX_VALUE;
        private int progressInterval = DEFAULT_PROGRESS_INTERVAL;
        private ProgressListener progressListener = NO_PROGRESS;
        private BooleanSupplier cancelled = NEVER_CANCELLED;

        private Builder() {}

        public Builder skipNonSemantic(boolean v)              { this.skipNonSemantic = v; return this; }
        public Builder prioritize(boolean v)                   { this.prioritize = v; return this; }
        public Builder limit(int v)                            { this.limit = v; return this; }
        public Builder progressInterval(int v)                 { this.progressInterval = v; return this; }
        public Builder progressListener(ProgressListener v)    { this.progressListener = v; return this; }
        public Builder cancelled(BooleanSupplier v)            { this.cancelled = v; return this; }

        /**
         * @throws IllegalArgumentException if a value is out of range
         */
        public BatchOptions build() {
            if (limit < 0) throw new IllegalArgumentException("limit must be >= 0, got " + limit);
            if (progressInterval < 1) {
                throw new IllegalArgumentException("progressInterval must be >= 1, got " + progressInterval);
            }
            Objects.requireNonNull(progressListener, "progressListener");
            Objects.requireNonNull(cancelled, "cancelled");
            return new BatchOptions(this);
        }
    }
}
