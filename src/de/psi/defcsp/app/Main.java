package de.psi.defcsp.app;

import java.util.Arrays;
import java.util.Iterator;
import java.util.ServiceLoader;

import de.psi.defcsp.engine.Control;
import de.psi.defcsp.engine.EngineFactory;
import edu.mit.csail.sdg.alloy4.A4Reporter;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorFatal;
import edu.mit.csail.sdg.alloy4.ErrorWarning;

public class Main {

    private static final A4Reporter STDERR = new A4Reporter() {
        @Override
        public void warning(ErrorWarning msg) {
            System.err.println("*** Warning: " + msg.toString().trim());
        }
    };

    public static EngineFactory findEngine() throws ErrorFatal {
        Iterator<EngineFactory> it = ServiceLoader.load(EngineFactory.class).iterator();
        if (!it.hasNext())
            throw new ErrorFatal("no grounding engine found: put an implementation of "
                    + EngineFactory.class.getName() + " on the classpath");
        return it.next();
    }

    public static void main(String[] args) {
        if (Arrays.asList(args).contains("--help")) {
            System.out.println(DefinedApp.PROGRAM_NAME + " " + DefinedApp.VERSION);
            System.out.print(AppConfig.usage());
            return;
        }
        try {
            AppConfig config = AppConfig.parse(args);
            EngineFactory factory = findEngine();
            Control control = factory.create(config.engineOptions);
            new DefinedApp(config, new SourceReader(), System.out, STDERR).run(control);
        } catch (Err e) {
            System.err.println("*** Error: " + e.toString().trim());
            System.exit(1);
        }
    }
}
