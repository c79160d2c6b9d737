package de.psi.defcsp.ast;

public class Helpers {

    private static final Term.Visitor<Boolean> VARIABLE_TERM = new Term.Visitor<Boolean>() {
        @Override public Boolean visit(Term.Num x) { return false; }
        @Override public Boolean visit(Term.Str x) { return false; }
        @Override public Boolean visit(Term.Variable x) { return true; }
        @Override public Boolean visit(Term.Function x) { return !x.getName().isEmpty(); }
        @Override public Boolean visit(Term.Operation x) { return false; }
    };

    /**
     * Whether a term can name a constraint variable: a constant, a compound
     * term like {@code x(1,a)}, or a logic variable bound to one by grounding.
     */
    public static boolean isVariableTerm(Term term) {
        return VARIABLE_TERM.visitThis(term);
    }
}
