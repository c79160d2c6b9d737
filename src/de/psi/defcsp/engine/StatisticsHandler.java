package de.psi.defcsp.engine;

public interface StatisticsHandler {
    void statistics(StatisticsTree step, StatisticsTree accu);
}
