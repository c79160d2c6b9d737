package de.psi.defcsp.csp;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Vector;

import de.psi.defcsp.engine.Control;
import de.psi.defcsp.engine.GroundTheoryAtom;
import edu.mit.csail.sdg.alloy4.A4Reporter;
import edu.mit.csail.sdg.alloy4.ErrorWarning;

/**
 * Classifies the constraint valuations of a ground program.
 * <p>
 * A valuation {@code __csp(X,V)} is visible if the ground program contains
 * the defined marker of {@code X} and {@code X} is not an auxiliary
 * variable, hidden if both hold for an auxiliary variable, and undefined
 * otherwise. Theory atoms of other names belong to the constraint theory and
 * are skipped.
 */
public class Translator {
    private final Control control;
    private final DefinedPredicate defined;
    private final Statistic stats;
    private final A4Reporter rep;

    public Translator(Control control, DefinedPredicate defined, Statistic stats, A4Reporter rep) {
        this.control = control;
        this.defined = defined;
        this.stats = stats;
        this.rep = rep == null ? A4Reporter.NOP : rep;
    }

    public Translation translate(Iterable<GroundTheoryAtom> atoms) {
        final Map<ValuationAtom, Classification> valuations = new LinkedHashMap<ValuationAtom, Classification>();
        final Map<Symbol, Classification> variables = new LinkedHashMap<Symbol, Classification>();
        final List<ErrorWarning> malformed = new Vector<ErrorWarning>();

        for (GroundTheoryAtom atom : atoms) {
            if (!ValuationAtom.hasValuationName(atom.name))
                continue;
            final ValuationAtom valuation = ValuationAtom.of(atom.name, atom.arguments);
            if (valuation == null) {
                ErrorWarning w = new ErrorWarning("malformed constraint valuation " + atom + ": expected 2 arguments but found "
                        + atom.arguments.size() + ", atom ignored");
                rep.warning(w);
                malformed.add(w);
                continue;
            }
            if (valuations.containsKey(valuation))
                continue;

            Classification c = variables.get(valuation.variable);
            if (c == null) {
                final boolean auxiliary = valuation.isAuxiliary();
                final boolean isDefined = control.hasAtom(defined.marker(valuation.variable));
                c = Classification.of(isDefined, auxiliary);
                variables.put(valuation.variable, c);
                if (auxiliary) stats.addVariable();
                if (isDefined) stats.addAtom();
            }
            valuations.put(valuation, c);
        }

        rep.debug("Classified " + valuations.size() + " constraint valuations of " + variables.size()
                + " variables, " + malformed.size() + " malformed.\n");
        return new Translation(valuations, variables, malformed);
    }
}
