package de.psi.defcsp.app;

import java.io.PrintStream;
import java.util.List;
import java.util.Vector;

import de.psi.defcsp.csp.Classification;
import de.psi.defcsp.csp.DefinedPredicate;
import de.psi.defcsp.csp.Symbol;
import de.psi.defcsp.csp.Translation;
import de.psi.defcsp.csp.ValuationAtom;
import de.psi.defcsp.engine.Model;

/**
 * Formats models. Holds no state between models.
 */
public class ResultPresenter {
    private final DefinedPredicate defined;
    private final Translation translation;
    private final boolean printAux;

    public ResultPresenter(DefinedPredicate defined, Translation translation, boolean printAux) {
        this.defined = defined;
        this.translation = translation;
        this.printAux = printAux;
    }

    /**
     * Shown atoms without the defined markers, followed by the values of
     * visible variables.
     */
    public String answerLine(Model model) {
        List<String> items = new Vector<String>();
        for (Symbol atom : model.getShown()) {
            if (!defined.isMarker(atom)) items.add(atom.toString());
        }
        addValuations(model, Classification.VISIBLE, items);
        return join(items);
    }

    /**
     * Shown defined markers, followed by the values of defined auxiliary
     * variables.
     */
    public String auxiliaryLine(Model model) {
        List<String> items = new Vector<String>();
        for (Symbol atom : model.getShown()) {
            if (defined.isMarker(atom)) items.add(atom.toString());
        }
        addValuations(model, Classification.HIDDEN_AUXILIARY, items);
        return join(items);
    }

    public void print(Model model, PrintStream out) {
        out.println(answerLine(model));
        if (printAux) out.println(auxiliaryLine(model));
    }

    private void addValuations(Model model, Classification wanted, List<String> items) {
        for (Symbol symbol : model.getTheorySymbols()) {
            final ValuationAtom valuation = ValuationAtom.of(symbol);
            if (valuation == null) continue;
            if (translation.classify(valuation.variable) != wanted) continue;
            if (!model.contains(defined.marker(valuation.variable))) continue;
            items.add(valuation.toOutput());
        }
    }

    private static String join(List<String> items) {
        StringBuilder sb = new StringBuilder();
        boolean first = true;
        for (String s : items) {
            if (first) first = false; else sb.append(" ");
            sb.append(s);
        }
        return sb.toString();
    }
}
