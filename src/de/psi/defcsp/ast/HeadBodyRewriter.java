package de.psi.defcsp.ast;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.Vector;

import de.psi.defcsp.csp.DefinedPredicate;
import de.psi.defcsp.csp.Statistic;
import edu.mit.csail.sdg.alloy4.A4Reporter;
import edu.mit.csail.sdg.alloy4.ConstList;
import edu.mit.csail.sdg.alloy4.ConstList.TempList;
import edu.mit.csail.sdg.alloy4.ErrorWarning;
import edu.mit.csail.sdg.alloy4.Pair;
import edu.mit.csail.sdg.alloy4.Pos;

/**
 * Rewrites parsed statements one at a time.
 * <p>
 * A rule whose head assigns a constraint variable, e.g.
 * {@code &sum{x+y} =: z :- b.}, is emitted unchanged and additionally queues
 * the support rule {@code __def(z) :- b.}. Body atoms {@code &df{z}} are
 * replaced by {@code __def(z)}, also in rules whose assignment head names
 * no variable; those only get a warning instead of a support rule. Queued rules are only turned into statements
 * by {@link #materialize()}, once the whole input has been visited.
 */
public class HeadBodyRewriter extends Statement.Visitor<Statement> {

    public static final String ASSIGNMENT = "=:";

    public static final String DEFINED_ATOM = "df";

    public static final Set<String> ASSIGNMENT_ATOMS = new HashSet<String>(Arrays.asList("sum", "in"));

    /** Location given to every materialized rule. */
    public static final Pos GENERATED = new Pos("<string>", 1, 1);

    private final DefinedPredicate defined;
    private final Statistic stats;
    private final A4Reporter rep;
    private final List<Pair<Head, ConstList<Literal>>> rulesToAdd = new Vector<Pair<Head, ConstList<Literal>>>();

    public HeadBodyRewriter(DefinedPredicate defined, Statistic stats, A4Reporter rep) {
        this.defined = defined;
        this.stats = stats;
        this.rep = rep == null ? A4Reporter.NOP : rep;
    }

    /** Support rules queued so far, in the order they were synthesized. */
    public ConstList<Pair<Head, ConstList<Literal>>> getRulesToAdd() {
        return ConstList.make(rulesToAdd);
    }

    /**
     * Turns the queued support rules into statements and empties the queue.
     */
    public ConstList<Statement> materialize() {
        TempList<Statement> result = new TempList<Statement>();
        for (Pair<Head, ConstList<Literal>> rule : rulesToAdd) {
            result.add(new Statement.Rule(GENERATED, rule.a, rule.b));
            stats.addRule();
        }
        rulesToAdd.clear();
        return result.makeConst();
    }

    @Override
    public Statement visit(Statement.Rule x) {
        Term assigned;
        try {
            assigned = ASSIGNED_VARIABLE.visitThis(x.head);
        } catch (Ambiguity e) {
            rep.warning(new ErrorWarning(x.pos, e.getMessage()));
            assigned = null;
        }

        TempList<Literal> body = new TempList<Literal>();
        boolean changed = false;
        for (Literal l : x.body) {
            Literal nl = bodyRewriter.visitThis(l);
            changed |= nl != l;
            body.add(nl);
        }
        final Statement.Rule rule = changed ? x.change(body.makeConst()) : x;

        if (assigned != null) {
            rulesToAdd.add(new Pair<Head, ConstList<Literal>>(Head.atom(definedAtom(assigned)), rule.body));
        }
        return rule;
    }

    @Override
    public Statement visit(Statement.Directive x) {
        return x;
    }

    private Term definedAtom(Term variable) {
        return Term.fun(defined.name, variable);
    }

    /**
     * Replaces {@code &df{t}} by the defined predicate. Theory atoms of any
     * other shape are left to the engine's diagnostics.
     */
    private final Literal.Visitor<Literal> bodyRewriter = new Literal.Visitor<Literal>() {
        @Override
        public Literal visit(Literal.Symbolic x) {
            return x;
        }

        @Override
        public Literal visit(Literal.Theory x) {
            final TheoryAtom atom = x.atom;
            if (!atom.name.equals(DEFINED_ATOM) || atom.hasGuard() || atom.elements.size() != 1)
                return x;
            final TheoryAtom.Element e = atom.elements.get(0);
            if (e.terms.size() != 1 || !e.condition.isEmpty())
                return x;
            stats.addAtom();
            return new Literal.Symbolic(x.sign, definedAtom(e.terms.get(0)));
        }
    };

    /**
     * Finds the variable assigned by a head, or null when the head is not an
     * assignment.
     */
    private static final Head.Visitor<Term> ASSIGNED_VARIABLE = new Head.Visitor<Term>() {
        @Override
        public Term visitFalse() {
            return null;
        }

        @Override
        public Term visit(Head.Simple x) {
            return null;
        }

        @Override
        public Term visit(Head.Opaque x) {
            return null;
        }

        @Override
        public Term visit(Head.Theory x) {
            final TheoryAtom atom = x.atom;
            if (!ASSIGNMENT_ATOMS.contains(atom.name) || !atom.hasGuard() || !atom.guard.operator.equals(ASSIGNMENT))
                return null;
            if (!Helpers.isVariableTerm(atom.guard.term))
                throw new Ambiguity("cannot derive definedness of " + atom
                        + ": '" + atom.guard.term + "' is not a constraint variable, no support rule added");
            return atom.guard.term;
        }
    };

    private static final class Ambiguity extends RuntimeException {
        private static final long serialVersionUID = 1L;

        Ambiguity(String msg) {
            super(msg);
        }
    }
}
