package de.psi.defcsp.engine;

import de.psi.defcsp.ast.Statement;
import edu.mit.csail.sdg.alloy4.Err;

public interface StatementHandler {
    void statement(Statement statement) throws Err;
}
