package de.psi.defcsp.ast;

import java.util.List;

import edu.mit.csail.sdg.alloy4.ConstList;
import edu.mit.csail.sdg.alloy4.ConstList.TempList;

/**
 * Rewritten program: the rewritten input statements in source order,
 * followed by the support rules synthesized while rewriting them.
 */
public class PreparedProgram {
    public final ConstList<Statement> statements;
    public final ConstList<Statement> generated;

    public PreparedProgram(List<Statement> statements, List<Statement> generated) {
        this.statements = ConstList.make(statements);
        this.generated = ConstList.make(generated);
    }

    public static PreparedProgram rewrite(Iterable<Statement> input, HeadBodyRewriter rewriter) {
        TempList<Statement> result = new TempList<Statement>();
        for (Statement s : input) {
            result.add(rewriter.visitThis(s));
        }
        return new PreparedProgram(result.makeConst(), rewriter.materialize());
    }

    public ConstList<Statement> getAll() {
        TempList<Statement> result = new TempList<Statement>();
        result.addAll(statements);
        result.addAll(generated);
        return result.makeConst();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Statement s : getAll()) {
            sb.append(s.toString());
            sb.append("\n");
        }
        return sb.toString();
    }
}
