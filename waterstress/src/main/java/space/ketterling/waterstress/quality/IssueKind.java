package space.ketterling.waterstress.quality;

/**
 * Recoverable data-quality problems. None of these stop a run; each is
 * encoded as a null or flag in the output and counted in the run summary.
 */
public enum IssueKind {
    /** A region had no valid grid cells in a slice (or no slice that month). */
    MISSING_SLICE_DATA,
    /** An auxiliary key matched no region or no ISO-A3 code. */
    JOIN_MISMATCH,
    /** A value stayed missing after every imputation fallback. */
    IMPUTATION_EXHAUSTED
}
