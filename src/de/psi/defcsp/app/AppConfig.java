package de.psi.defcsp.app;

import java.io.File;
import java.util.Arrays;
import java.util.List;
import java.util.Vector;

import de.psi.defcsp.csp.DefinedPredicate;
import edu.mit.csail.sdg.alloy4.ConstList;
import edu.mit.csail.sdg.alloy4.ErrorSyntax;

/**
 * Application options. Everything not recognized here is either an input
 * file or an option for the engine. An engine option not written as
 * {@code --name=value} takes the next argument as its value unless that
 * argument looks like a file; see {@link #isOptionValue(String)}.
 */
public class AppConfig {
    public static final int MAX_INT = 1073741823;
    public static final int MIN_INT = -1073741823;

    public static final String STDIN = "-";

    public final boolean printAux;
    public final boolean printTranslation;
    public final int minInt;
    public final int maxInt;
    public final DefinedPredicate defined;
    public final ConstList<String> files;
    public final ConstList<String> engineOptions;

    public AppConfig(boolean printAux, boolean printTranslation, int minInt, int maxInt, DefinedPredicate defined,
                     List<String> files, List<String> engineOptions) {
        this.printAux = printAux;
        this.printTranslation = printTranslation;
        this.minInt = minInt;
        this.maxInt = maxInt;
        this.defined = defined;
        this.files = ConstList.make(files);
        this.engineOptions = ConstList.make(engineOptions);
    }

    public static AppConfig defaults() {
        return new AppConfig(false, false, MIN_INT, MAX_INT, DefinedPredicate.DEFAULT,
                Arrays.asList(STDIN), ConstList.<String>make());
    }

    /**
     * Parses the command line. Options take the form {@code --name} or
     * {@code --name=value}; the value may also be the next argument.
     *
     * @throws ErrorSyntax for an invalid option value; nothing has run yet
     */
    public static AppConfig parse(String[] args) throws ErrorSyntax {
        boolean printAux = false;
        boolean printTranslation = false;
        int minInt = MIN_INT;
        int maxInt = MAX_INT;
        DefinedPredicate defined = DefinedPredicate.DEFAULT;
        List<String> files = new Vector<String>();
        List<String> engineOptions = new Vector<String>();

        for (int i = 0; i < args.length; i++) {
            String cur = args[i];
            String value = null;
            int eq = cur.indexOf('=');
            if (cur.startsWith("--") && eq > 0) {
                value = cur.substring(eq + 1);
                cur = cur.substring(0, eq);
            }

            if (cur.equals("--print-auxvars")) {
                printAux = flag(cur, value);
            }
            else if (cur.equals("--print-translation")) {
                printTranslation = flag(cur, value);
            }
            else if (cur.equals("--defined-predicate")) {
                if (value == null) {
                    if (i + 1 >= args.length) throw new ErrorSyntax(cur + " expects an argument: the predicate name");
                    value = args[++i];
                }
                defined = DefinedPredicate.parse(value);
            }
            else if (cur.equals("--min-int") || cur.equals("--max-int")) {
                if (value == null) {
                    if (i + 1 >= args.length) throw new ErrorSyntax(cur + " expects an integer argument");
                    value = args[++i];
                }
                int n;
                try {
                    n = Integer.parseInt(value);
                } catch (NumberFormatException e) {
                    throw new ErrorSyntax(cur + " expects an integer argument, got '" + value + "'");
                }
                if (cur.equals("--min-int")) minInt = n; else maxInt = n;
            }
            else if (cur.startsWith("-") && !cur.equals(STDIN)) {
                engineOptions.add(args[i]);
                if (value == null && i + 1 < args.length && isOptionValue(args[i + 1]))
                    engineOptions.add(args[++i]);
            }
            else {
                files.add(cur);
            }
        }

        if (minInt > maxInt)
            throw new ErrorSyntax("--min-int (" + minInt + ") must not exceed --max-int (" + maxInt + ")");
        if (files.isEmpty()) files.add(STDIN);
        return new AppConfig(printAux, printTranslation, minInt, maxInt, defined, files, engineOptions);
    }

    /**
     * Whether an argument following an engine option is that option's value,
     * as in {@code -n 0} or {@code -c n=3}. Anything that could name an input
     * file (a path or a name with an extension) or is an option itself is not.
     */
    static boolean isOptionValue(String arg) {
        if (arg.isEmpty() || arg.startsWith("-")) return false;
        if (arg.indexOf('=') > 0) return true;
        return arg.indexOf('.') < 0 && arg.indexOf('/') < 0 && arg.indexOf(File.separatorChar) < 0;
    }

    private static boolean flag(String name, String value) throws ErrorSyntax {
        if (value == null || value.equals("yes") || value.equals("true")) return true;
        if (value.equals("no") || value.equals("false")) return false;
        throw new ErrorSyntax(name + " expects yes or no, got '" + value + "'");
    }

    private static String yesNo(boolean flag) {
        return flag ? "yes" : "no";
    }

    public static String usage() {
        AppConfig d = defaults();
        return "Translation Options:\n"
                + "  --print-auxvars          Print value of auxiliary variables [" + yesNo(d.printAux) + "]\n"
                + "  --print-translation      Print translation [" + yesNo(d.printTranslation) + "]\n"
                + "  --defined-predicate=NAME Name of the defined predicate [" + d.defined + "]\n"
                + "  --min-int=N              Lower bound of integer variables [" + d.minInt + "]\n"
                + "  --max-int=N              Upper bound of integer variables [" + d.maxInt + "]\n";
    }
}
