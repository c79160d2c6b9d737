package de.psi.defcsp.csp;

/**
 * Output class of a constraint valuation.
 */
public enum Classification {
    /** Defined user variable, printed in the answer line. */
    VISIBLE,
    /** Defined auxiliary variable, printed only on request. */
    HIDDEN_AUXILIARY,
    /** Never printed. */
    UNDEFINED;

    public static Classification of(boolean defined, boolean auxiliary) {
        if (!defined) return UNDEFINED;
        return auxiliary ? HIDDEN_AUXILIARY : VISIBLE;
    }
}
