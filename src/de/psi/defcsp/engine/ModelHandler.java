package de.psi.defcsp.engine;

public interface ModelHandler {
    /** Returns false to stop the search. */
    boolean model(Model model);
}
