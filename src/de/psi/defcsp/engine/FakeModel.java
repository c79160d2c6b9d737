package de.psi.defcsp.engine;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.Vector;

import de.psi.defcsp.csp.Symbol;

/**
 * Model with explicitly given atoms, for tests.
 */
public class FakeModel implements Model {
    private final List<Symbol> shown = new Vector<Symbol>();
    private final List<Symbol> theory = new Vector<Symbol>();
    private final Set<Symbol> trueAtoms = new LinkedHashSet<Symbol>();

    /** Adds shown atoms, which are also true. */
    public FakeModel shown(Symbol... atoms) {
        shown.addAll(Arrays.asList(atoms));
        trueAtoms.addAll(Arrays.asList(atoms));
        return this;
    }

    /** Adds atoms that are true but not shown. */
    public FakeModel hidden(Symbol... atoms) {
        trueAtoms.addAll(Arrays.asList(atoms));
        return this;
    }

    public FakeModel valuation(Symbol variable, int value) {
        theory.add(Symbol.fun("__csp", variable, Symbol.num(value)));
        return this;
    }

    public FakeModel theory(Symbol... symbols) {
        theory.addAll(Arrays.asList(symbols));
        return this;
    }

    @Override
    public Iterable<Symbol> getShown() {
        return shown;
    }

    @Override
    public Iterable<Symbol> getTheorySymbols() {
        return theory;
    }

    @Override
    public boolean contains(Symbol atom) {
        return trueAtoms.contains(atom);
    }
}
