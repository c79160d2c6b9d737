package de.psi.defcsp.app;

import static de.psi.defcsp.ast.Term.num;
import static de.psi.defcsp.ast.Term.sym;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Vector;

import org.junit.Before;
import org.junit.Test;

import de.psi.defcsp.ast.Head;
import de.psi.defcsp.ast.HeadBodyRewriter;
import de.psi.defcsp.ast.Literal;
import de.psi.defcsp.ast.Statement;
import de.psi.defcsp.ast.Term;
import de.psi.defcsp.ast.TheoryAtom;
import de.psi.defcsp.csp.Classification;
import de.psi.defcsp.csp.DefinedPredicate;
import de.psi.defcsp.csp.Statistic;
import de.psi.defcsp.csp.Symbol;
import de.psi.defcsp.csp.ValuationAtom;
import de.psi.defcsp.engine.FakeControl;
import de.psi.defcsp.engine.FakeModel;
import de.psi.defcsp.engine.GroundTheoryAtom;
import de.psi.defcsp.engine.StatisticsTree;
import edu.mit.csail.sdg.alloy4.A4Reporter;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorFatal;
import edu.mit.csail.sdg.alloy4.ErrorWarning;
import edu.mit.csail.sdg.alloy4.Pos;

public class DefinedAppTest {

    private static final String PROGRAM = "&sum{5} =: v.\n";

    private ByteArrayOutputStream buf;
    private List<ErrorWarning> warnings;
    private FakeControl control;

    @Before
    public void setUp() {
        buf = new ByteArrayOutputStream();
        warnings = new Vector<ErrorWarning>();
        control = new FakeControl().program(PROGRAM, assignment(1, "v", 5));
    }

    private static Statement assignment(int line, String variable, int value) {
        TheoryAtom.Element e = new TheoryAtom.Element(Arrays.asList(num(value)));
        TheoryAtom atom = new TheoryAtom("sum", Arrays.asList(e), new TheoryAtom.Guard(HeadBodyRewriter.ASSIGNMENT, sym(variable)));
        return new Statement.Rule(new Pos("<stdin>", 1, line), new Head.Theory(atom), Arrays.<Literal>asList());
    }

    private DefinedApp app(String... args) throws Err {
        AppConfig config = AppConfig.parse(args);
        SourceReader reader = new SourceReader(new ByteArrayInputStream(PROGRAM.getBytes(StandardCharsets.UTF_8)));
        return new DefinedApp(config, reader, new PrintStream(buf, true), new A4Reporter() {
            @Override
            public void warning(ErrorWarning msg) {
                warnings.add(msg);
            }
        });
    }

    private String output() {
        return buf.toString().replace("\r\n", "\n");
    }

    @Test
    public void singleAssignment() throws Err {
        DefinedApp app = app();
        app.run(control);

        assertEquals("v = 5 is reported", "val(v,5)\n", output());
        assertEquals(Arrays.asList("<stdin>"), control.parsedFiles);
        assertEquals("1073741823", control.configuration.get("max-int"));
        assertEquals("-1073741823", control.configuration.get("min-int"));
        assertEquals(2, control.statements.size());
        assertEquals("&sum{5} =: v.", control.statements.get(0).toString());
        assertEquals("__def(v).", control.statements.get(1).toString());
        assertTrue(control.hasAtom(DefinedPredicate.DEFAULT.marker(Symbol.sym("v"))));
        assertEquals(Classification.VISIBLE, app.getTranslation().classify(Symbol.sym("v")));
        assertEquals(1, app.getTranslation().valuations.size());
        assertTrue(warnings.isEmpty());
    }

    @Test
    public void emptyAuxiliaryLine() throws Err {
        control.model(new FakeModel()
                .hidden(DefinedPredicate.DEFAULT.marker(Symbol.sym("v")))
                .valuation(Symbol.sym("v"), 5));
        app("--print-auxvars").run(control);
        assertEquals("val(v,5)\n\n", output());
    }

    @Test
    public void shownMarkersGoToTheAuxiliaryLine() throws Err {
        app("--print-auxvars").run(control);
        assertEquals("val(v,5)\n__def(v)\n", output());
    }

    @Test
    public void theoryIsAddedBeforeGrounding() throws Err {
        app().run(control);
        assertEquals(1, control.texts.size());
        assertTrue(control.texts.get(0).contains("#theory"));
        assertTrue(control.isGrounded());
    }

    @Test
    public void boundsAreConfigured() throws Err {
        app("--min-int=-10", "--max-int=10").run(control);
        assertEquals("10", control.configuration.get("max-int"));
        assertEquals("-10", control.configuration.get("min-int"));
    }

    @Test
    public void printTranslation() throws Err {
        app("--print-translation").run(control);
        assertEquals("&sum{5} =: v.\n__def(v).\nval(v,5)\n", output());
    }

    @Test
    public void customDefinedPredicate() throws Err {
        app("--defined-predicate=known", "--print-auxvars").run(control);
        assertEquals("val(v,5)\nknown(v)\n", output());
        assertEquals("known(v).", control.statements.get(1).toString());
    }

    @Test
    public void statistics() throws Err {
        DefinedApp app = app();
        app.run(control);
        Statistic stats = app.getStatistic();
        assertEquals(1, stats.getRulesAdded());
        assertEquals(1, stats.getAtomsAdded());
        assertEquals(0, stats.getVariablesAdded());
        assertTrue(stats.getRewriteTime() >= 0);
        assertTrue(stats.getTranslateTime() >= 0);

        StatisticsTree section = control.statistics.section(Statistic.SECTION);
        assertEquals(1, section.value("Number of rules added"), 0);
        assertTrue(section.section("Translation time in seconds").contains("AST rewriting"));
    }

    @Test
    public void auxiliaryVariablesAreHidden() throws Err {
        Symbol aux = Symbol.fun(ValuationAtom.AUX, Symbol.num(1));
        control.atom(DefinedPredicate.DEFAULT.marker(aux))
                .theoryAtom(new GroundTheoryAtom(ValuationAtom.CSP, Arrays.asList(aux, Symbol.num(2))))
                .model(new FakeModel()
                        .shown(Symbol.sym("p"))
                        .hidden(DefinedPredicate.DEFAULT.marker(Symbol.sym("v")), DefinedPredicate.DEFAULT.marker(aux))
                        .valuation(Symbol.sym("v"), 5)
                        .valuation(aux, 2));

        app().run(control);
        assertEquals("p val(v,5)\n", output());

        buf.reset();
        app("--print-auxvars").run(new FakeControl().program(PROGRAM, assignment(1, "v", 5))
                .atom(DefinedPredicate.DEFAULT.marker(aux))
                .theoryAtom(new GroundTheoryAtom(ValuationAtom.CSP, Arrays.asList(aux, Symbol.num(2))))
                .model(new FakeModel()
                        .shown(Symbol.sym("p"))
                        .hidden(DefinedPredicate.DEFAULT.marker(Symbol.sym("v")), DefinedPredicate.DEFAULT.marker(aux))
                        .valuation(Symbol.sym("v"), 5)
                        .valuation(aux, 2)));
        assertEquals("p val(v,5)\nval(__aux(1),2)\n", output());
    }

    @Test
    public void undefinedVariablesAreNeverPrinted() throws Err {
        control.theoryAtom(new GroundTheoryAtom(ValuationAtom.CSP, Arrays.asList(Symbol.sym("u"), Symbol.num(9))))
                .model(new FakeModel()
                        .hidden(DefinedPredicate.DEFAULT.marker(Symbol.sym("v")))
                        .valuation(Symbol.sym("u"), 9)
                        .valuation(Symbol.sym("v"), 5));
        app("--print-auxvars").run(control);
        assertEquals("val(v,5)\n\n", output());
    }

    @Test
    public void malformedValuationIsReported() throws Err {
        control.theoryAtom(new GroundTheoryAtom(ValuationAtom.CSP, Arrays.asList(Symbol.sym("v"))));
        DefinedApp app = app();
        app.run(control);
        assertEquals("val(v,5)\n", output());
        assertEquals(1, warnings.size());
        assertEquals(1, app.getTranslation().malformed.size());
    }

    @Test
    public void rewriteOrderAcrossFiles() throws Err {
        Statement fact = new Statement.Rule(new Pos("a.lp", 1, 1), Head.atom(Term.sym("a")), Arrays.<Literal>asList());
        FakeControl c = new FakeControl()
                .program(PROGRAM, assignment(1, "v", 5), fact)
                .program("other", assignment(1, "w", 1));
        DefinedApp app = new DefinedApp(AppConfig.parse(new String[] { "-", "b.lp" }), new SourceReader(
                new ByteArrayInputStream(PROGRAM.getBytes(StandardCharsets.UTF_8))) {
            @Override
            public String read(String path) throws ErrorFatal {
                return path.equals("b.lp") ? "other" : super.read(path);
            }
        }, new PrintStream(buf, true), null);
        app.run(c);

        List<String> added = new Vector<String>();
        for (Statement s : c.statements) added.add(s.toString());
        assertEquals(Arrays.asList("&sum{5} =: v.", "a.", "&sum{1} =: w.", "__def(v).", "__def(w)."), added);
        assertEquals(Arrays.asList("<stdin>", "b.lp"), c.parsedFiles);
        assertEquals(3, app.getProgram().statements.size());
        assertEquals(2, app.getProgram().generated.size());
        assertEquals(2, app.getStatistic().getRulesAdded());
        assertFalse(output().contains("__def"));
        assertEquals("a val(v,5) val(w,1)\n", output());
    }

    @Test
    public void readErrorsAbortTheRun() {
        try {
            DefinedApp app = new DefinedApp(AppConfig.parse(new String[] { "/nonexistent/defcsp.lp" }),
                    new SourceReader(), new PrintStream(buf, true), null);
            app.run(control);
            fail();
        } catch (Err e) {
            assertTrue(e instanceof ErrorFatal);
            assertFalse(control.isGrounded());
            assertTrue(control.statements.isEmpty());
        }
    }

    @Test
    public void configurationErrorsStopBeforeAnyWork() {
        try {
            app("--defined-predicate=Bad").run(control);
            fail();
        } catch (Err e) {
            assertTrue(control.configuration.isEmpty());
            assertTrue(control.parsedFiles.isEmpty());
        }
    }

    @Test
    public void loadsTheory() throws ErrorFatal {
        String theory = DefinedApp.loadTheory();
        assertTrue(theory.startsWith("#theory"));
        assertTrue(theory.contains("&sum/0"));
        assertTrue(theory.contains("&df/0"));
    }
}
