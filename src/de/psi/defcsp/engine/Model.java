package de.psi.defcsp.engine;

import de.psi.defcsp.csp.Symbol;

/**
 * Read-only view of one solution, valid only during the model callback.
 */
public interface Model {

    /** Atoms selected for output by the program's show statements. */
    Iterable<Symbol> getShown();

    /** Valuations reported by the constraint theory, e.g. {@code __csp(x,5)}. */
    Iterable<Symbol> getTheorySymbols();

    boolean contains(Symbol atom);
}
