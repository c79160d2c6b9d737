package de.psi.defcsp.engine;

import java.util.List;

import edu.mit.csail.sdg.alloy4.Err;

/**
 * Service interface through which engines are found with
 * {@link java.util.ServiceLoader}.
 */
public interface EngineFactory {

    /**
     * @param options engine options not consumed by this application
     */
    Control create(List<String> options) throws Err;
}
