package ai.trilingual.translator.translate;

/**
 * Which path produced the translations of a unit.
 */
public enum UnitStatus {
    /** Both targets came from the single combined call. */
    COMBINED,
    /** Both targets came from per-language fallback calls. */
    FALLBACK,
    /** One target failed in the fallback and carries the error marker. */
    PARTIAL,
    /** Every remote path failed; both targets carry the source text. */
    FAILED
}
