package de.psi.defcsp.engine;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.Vector;

import de.psi.defcsp.ast.Head;
import de.psi.defcsp.ast.HeadBodyRewriter;
import de.psi.defcsp.ast.Statement;
import de.psi.defcsp.ast.Term;
import de.psi.defcsp.ast.TheoryAtom;
import de.psi.defcsp.csp.Symbol;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorSyntax;
import edu.mit.csail.sdg.alloy4.ErrorFatal;

/**
 * In-memory stand-in for the grounding engine.
 * <p>
 * Program texts are "parsed" by looking them up in a table filled with
 * {@link #program}. Grounding only handles facts: every added rule with a
 * ground atom head and an empty body becomes a ground atom, and every fact
 * {@code &sum{n1;...;nk} =: v} or {@code &in{l..u} =: v} yields the valuation
 * {@code __csp(v,n1+...+nk)} or {@code __csp(v,l)}. Unless models were given
 * explicitly, solving reports a single model made of these atoms.
 */
public class FakeControl implements Control {
    public final Map<String, String> configuration = new LinkedHashMap<String, String>();
    public final List<Statement> statements = new Vector<Statement>();
    public final List<String> texts = new Vector<String>();
    public final List<String> parsedFiles = new Vector<String>();
    public final List<FakeModel> models = new Vector<FakeModel>();
    public StatisticsTree statistics = null;

    private final Map<String, List<Statement>> programs = new HashMap<String, List<Statement>>();
    private final Set<Symbol> atoms = new LinkedHashSet<Symbol>();
    private final List<GroundTheoryAtom> theoryAtoms = new Vector<GroundTheoryAtom>();
    private boolean grounded = false;

    public FakeControl program(String text, Statement... parsed) {
        List<Statement> l = new Vector<Statement>();
        for (Statement s : parsed) l.add(s);
        programs.put(text, l);
        return this;
    }

    public FakeControl theoryAtom(GroundTheoryAtom atom) {
        theoryAtoms.add(atom);
        return this;
    }

    public FakeControl atom(Symbol atom) {
        atoms.add(atom);
        return this;
    }

    public FakeControl model(FakeModel model) {
        models.add(model);
        return this;
    }

    public boolean isGrounded() {
        return grounded;
    }

    @Override
    public void configure(String key, String value) {
        configuration.put(key, value);
    }

    @Override
    public void parse(String filename, String program, StatementHandler handler) throws Err {
        List<Statement> parsed = programs.get(program);
        if (parsed == null) throw new ErrorSyntax("cannot parse " + filename);
        parsedFiles.add(filename);
        for (Statement s : parsed) handler.statement(s);
    }

    @Override
    public void add(Statement statement) throws Err {
        if (grounded) throw new ErrorFatal("statement added after grounding");
        statements.add(statement);
    }

    @Override
    public void add(String program) throws Err {
        if (grounded) throw new ErrorFatal("program added after grounding");
        texts.add(program);
    }

    @Override
    public void ground() {
        for (Statement s : statements) {
            if (!(s instanceof Statement.Rule)) continue;
            Statement.Rule r = (Statement.Rule) s;
            if (!r.body.isEmpty()) continue;
            if (r.head instanceof Head.Simple) {
                Symbol atom = toSymbol(((Head.Simple) r.head).literal.atom);
                if (atom != null) atoms.add(atom);
            } else if (r.head instanceof Head.Theory) {
                GroundTheoryAtom valuation = valuation(((Head.Theory) r.head).atom);
                if (valuation != null) theoryAtoms.add(valuation);
            }
        }
        grounded = true;
    }

    @Override
    public Iterable<GroundTheoryAtom> getTheoryAtoms() {
        return theoryAtoms;
    }

    @Override
    public boolean hasAtom(Symbol atom) {
        return atoms.contains(atom);
    }

    @Override
    public void solve(ModelHandler onModel, StatisticsHandler onStatistics) {
        List<FakeModel> result = models;
        if (result.isEmpty()) {
            FakeModel m = new FakeModel();
            for (Symbol a : atoms) m.shown(a);
            for (GroundTheoryAtom t : theoryAtoms) m.theory(new Symbol.Function(t.name, t.arguments));
            result = new Vector<FakeModel>();
            result.add(m);
        }
        for (FakeModel m : result) {
            if (!onModel.model(m)) break;
        }
        statistics = new StatisticsTree();
        onStatistics.statistics(new StatisticsTree(), statistics);
    }

    private static GroundTheoryAtom valuation(TheoryAtom atom) {
        if (!atom.hasGuard() || !atom.guard.operator.equals(HeadBodyRewriter.ASSIGNMENT)) return null;
        Symbol variable = toSymbol(atom.guard.term);
        if (variable == null) return null;
        int value = 0;
        for (TheoryAtom.Element e : atom.elements) {
            if (e.terms.size() != 1) return null;
            Term t = e.terms.get(0);
            if (t instanceof Term.Operation && ((Term.Operation) t).getOperator().equals("..")) {
                t = ((Term.Operation) t).getOperands().get(0);
            }
            if (!(t instanceof Term.Num)) return null;
            value += ((Term.Num) t).getValue();
        }
        return new GroundTheoryAtom("__csp", Arrays.asList(variable, Symbol.num(value)));
    }

    private static Symbol toSymbol(Term term) {
        if (term instanceof Term.Num) return Symbol.num(((Term.Num) term).getValue());
        if (term instanceof Term.Str) return Symbol.str(((Term.Str) term).getValue());
        if (!(term instanceof Term.Function)) return null;
        Term.Function f = (Term.Function) term;
        List<Symbol> args = new Vector<Symbol>();
        for (Term arg : f.getArgs()) {
            Symbol s = toSymbol(arg);
            if (s == null) return null;
            args.add(s);
        }
        return new Symbol.Function(f.getName(), args);
    }
}
