package de.psi.defcsp.csp;

import java.util.List;

/**
 * Value of a constraint variable, reported by the theory as
 * {@code __csp(variable, value)}.
 */
public final class ValuationAtom {

    public static final String CSP = "__csp";

    /** Functor of variables introduced by the translation itself. */
    public static final String AUX = "__aux";

    public final Symbol variable;
    public final Symbol value;

    public ValuationAtom(Symbol variable, Symbol value) {
        this.variable = variable;
        this.value = value;
    }

    public static boolean hasValuationName(String name) {
        return CSP.equals(name);
    }

    /**
     * Returns the valuation represented by a theory symbol, or null if the
     * symbol is not a well formed valuation.
     */
    public static ValuationAtom of(Symbol symbol) {
        return of(symbol.getName(), symbol.getArguments());
    }

    public static ValuationAtom of(String name, List<Symbol> arguments) {
        if (!hasValuationName(name) || arguments.size() != 2) return null;
        return new ValuationAtom(arguments.get(0), arguments.get(1));
    }

    public boolean isAuxiliary() {
        return AUX.equals(variable.getName());
    }

    /** Output form {@code val(variable,value)}. */
    public String toOutput() {
        return "val(" + variable + "," + value + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof ValuationAtom)) return false;
        ValuationAtom v = (ValuationAtom) obj;
        return v.variable.equals(variable) && v.value.equals(value);
    }

    @Override
    public int hashCode() {
        return variable.hashCode() * 31 + value.hashCode();
    }

    @Override
    public String toString() {
        return CSP + "(" + variable + "," + value + ")";
    }
}
