package de.psi.defcsp.csp;

import java.util.Map;

import edu.mit.csail.sdg.alloy4.ConstList;
import edu.mit.csail.sdg.alloy4.ConstMap;
import edu.mit.csail.sdg.alloy4.ErrorWarning;

/**
 * Result of {@link Translator#translate}: every well formed valuation atom
 * with its class, and the diagnostics of the malformed ones.
 */
public class Translation {
    public final ConstMap<ValuationAtom, Classification> valuations;
    public final ConstMap<Symbol, Classification> variables;
    public final ConstList<ErrorWarning> malformed;

    public Translation(Map<ValuationAtom, Classification> valuations, Map<Symbol, Classification> variables,
                       Iterable<ErrorWarning> malformed) {
        this.valuations = ConstMap.make(valuations);
        this.variables = ConstMap.make(variables);
        this.malformed = ConstList.make(malformed);
    }

    /** Variables never seen during translation are undefined. */
    public Classification classify(Symbol variable) {
        Classification c = variables.get(variable);
        return c == null ? Classification.UNDEFINED : c;
    }

    public int count(Classification c) {
        int n = 0;
        for (Classification v : valuations.values()) {
            if (v == c) n++;
        }
        return n;
    }
}
