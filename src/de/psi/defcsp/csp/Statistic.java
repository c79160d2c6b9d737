package de.psi.defcsp.csp;

import de.psi.defcsp.engine.StatisticsTree;

/**
 * Counters of one run. Written by the rewriting and translation passes, read
 * once when the engine asks for statistics.
 */
public class Statistic {
    public static final String SECTION = "defcsp";

    private double rewriteTime = 0;
    private double translateTime = 0;
    private int atomsAdded = 0;
    private int rulesAdded = 0;
    private int variablesAdded = 0;

    public void setRewriteTime(double seconds) {
        rewriteTime = seconds;
    }

    public void setTranslateTime(double seconds) {
        translateTime = seconds;
    }

    public void addAtom() {
        atomsAdded++;
    }

    public void addRule() {
        rulesAdded++;
    }

    public void addVariable() {
        variablesAdded++;
    }

    public double getRewriteTime() {
        return rewriteTime;
    }

    public double getTranslateTime() {
        return translateTime;
    }

    public int getAtomsAdded() {
        return atomsAdded;
    }

    public int getRulesAdded() {
        return rulesAdded;
    }

    public int getVariablesAdded() {
        return variablesAdded;
    }

    public void merge(StatisticsTree accu) {
        StatisticsTree section = accu.section(SECTION);
        StatisticsTree times = section.section("Translation time in seconds");
        times.put("AST rewriting", rewriteTime);
        times.put("Translation", translateTime);
        section.put("Number of variables added", variablesAdded);
        section.put("Number of atoms added", atomsAdded);
        section.put("Number of rules added", rulesAdded);
    }

    public static double seconds(long startNanos, long endNanos) {
        return (endNanos - startNanos) / 1e9;
    }
}
