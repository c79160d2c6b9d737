package de.psi.defcsp.app;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Vector;

import de.psi.defcsp.ast.HeadBodyRewriter;
import de.psi.defcsp.ast.PreparedProgram;
import de.psi.defcsp.ast.Statement;
import de.psi.defcsp.csp.Statistic;
import de.psi.defcsp.csp.Translation;
import de.psi.defcsp.csp.Translator;
import de.psi.defcsp.engine.Control;
import de.psi.defcsp.engine.Model;
import de.psi.defcsp.engine.ModelHandler;
import de.psi.defcsp.engine.StatementHandler;
import de.psi.defcsp.engine.StatisticsHandler;
import de.psi.defcsp.engine.StatisticsTree;
import edu.mit.csail.sdg.alloy4.A4Reporter;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorFatal;

/**
 * One run: rewrite the input, ground it together with the constraint theory,
 * classify the valuations and print every model.
 */
public class DefinedApp {
    public static final String PROGRAM_NAME = "defcsp";
    public static final String VERSION = "1.0.0";

    /** Classpath resource holding the theory definition. */
    public static final String THEORY_RESOURCE = "theory.lp";

    private final AppConfig config;
    private final SourceReader reader;
    private final PrintStream out;
    private final A4Reporter rep;
    private final Statistic stats = new Statistic();

    private PreparedProgram program = null;
    private Translation translation = null;

    public DefinedApp(AppConfig config, SourceReader reader, PrintStream out, A4Reporter rep) {
        this.config = config;
        this.reader = reader;
        this.out = out;
        this.rep = rep == null ? A4Reporter.NOP : rep;
    }

    public Statistic getStatistic() {
        return stats;
    }

    /** The rewritten program, available once {@link #run} got past rewriting. */
    public PreparedProgram getProgram() {
        return program;
    }

    /** The valuation classes, available once {@link #run} got past grounding. */
    public Translation getTranslation() {
        return translation;
    }

    public void run(Control control) throws Err {
        control.configure("max-int", String.valueOf(config.maxInt));
        control.configure("min-int", String.valueOf(config.minInt));

        long start = System.nanoTime();
        program = rewrite(control);
        for (Statement s : program.getAll()) {
            control.add(s);
        }
        stats.setRewriteTime(Statistic.seconds(start, System.nanoTime()));
        rep.debug("Rewrote " + program.statements.size() + " statements, " + program.generated.size() + " rules added.\n");
        if (config.printTranslation) {
            out.print(program.toString());
        }

        control.add(loadTheory());
        control.ground();

        start = System.nanoTime();
        translation = new Translator(control, config.defined, stats, rep).translate(control.getTheoryAtoms());
        stats.setTranslateTime(Statistic.seconds(start, System.nanoTime()));

        final ResultPresenter presenter = new ResultPresenter(config.defined, translation, config.printAux);
        control.solve(new ModelHandler() {
            @Override
            public boolean model(Model model) {
                presenter.print(model, out);
                return true;
            }
        }, new StatisticsHandler() {
            @Override
            public void statistics(StatisticsTree step, StatisticsTree accu) {
                stats.merge(accu);
            }
        });
    }

    private PreparedProgram rewrite(Control control) throws Err {
        final HeadBodyRewriter rewriter = new HeadBodyRewriter(config.defined, stats, rep);
        final List<Statement> statements = new Vector<Statement>();
        for (String file : config.files) {
            control.parse(SourceReader.displayName(file), reader.read(file), new StatementHandler() {
                @Override
                public void statement(Statement statement) {
                    statements.add(statement);
                }
            });
        }
        return PreparedProgram.rewrite(statements, rewriter);
    }

    public static String loadTheory() throws ErrorFatal {
        InputStream in = DefinedApp.class.getResourceAsStream(THEORY_RESOURCE);
        if (in == null) throw new ErrorFatal("theory definition " + THEORY_RESOURCE + " not found on the classpath");
        try {
            try {
                ByteArrayOutputStream buf = new ByteArrayOutputStream();
                byte[] b = new byte[4096];
                int n;
                while ((n = in.read(b)) > 0) buf.write(b, 0, n);
                return new String(buf.toByteArray(), StandardCharsets.UTF_8);
            } finally {
                in.close();
            }
        } catch (IOException e) {
            throw new ErrorFatal("cannot read theory definition " + THEORY_RESOURCE, e);
        }
    }
}
