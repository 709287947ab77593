package stableid.generator;

/**
 * How an anchor was chosen, best first.
 */
public enum AnchorTier {
    /** Native sectioning/structural tag (form, main, nav, ...). */
    SEMANTIC_TAG,
    /** ARIA landmark or container role. */
    LANDMARK_ROLE,
    /** Test/automation marker attribute; used only when no tag or role anchor exists. */
    TEST_MARKER,
    /** Nearest ancestor with a unique identifying feature. Degraded. */
    FEATURE_FALLBACK,
    /** The document root boundary itself. Degraded. */
    DOCUMENT_ROOT;

    public boolean isDegraded() {
        return this == FEATURE_FALLBACK || this == DOCUMENT_ROOT;
    }
}
