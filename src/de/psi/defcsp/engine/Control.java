package de.psi.defcsp.engine;

import de.psi.defcsp.ast.Statement;
import de.psi.defcsp.csp.Symbol;
import edu.mit.csail.sdg.alloy4.Err;

/**
 * Grounding and solving engine together with its constraint theory.
 * All calls are synchronous and made from a single thread.
 */
public interface Control {

    /** Sets an option of the constraint theory, e.g. {@code min-int}. */
    void configure(String key, String value) throws Err;

    /** Parses program text and passes each statement to the handler in source order. */
    void parse(String filename, String program, StatementHandler handler) throws Err;

    void add(Statement statement) throws Err;

    /** Adds program text verbatim, used for the theory definition. */
    void add(String program) throws Err;

    void ground() throws Err;

    /** Theory atoms of the ground program. Only valid after {@link #ground()}. */
    Iterable<GroundTheoryAtom> getTheoryAtoms();

    /** Whether the ground program contains the given atom. */
    boolean hasAtom(Symbol atom);

    void solve(ModelHandler onModel, StatisticsHandler onStatistics) throws Err;
}
