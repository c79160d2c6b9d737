package de.psi.defcsp.engine;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Nested statistics map handed to {@link StatisticsHandler}s. Values are
 * either numbers or sub-sections; keys keep their insertion order.
 */
public class StatisticsTree {
    private final Map<String, Object> entries = new LinkedHashMap<String, Object>();

    /** Returns the sub-section under key, creating it if needed. */
    public StatisticsTree section(String key) {
        Object old = entries.get(key);
        if (old instanceof StatisticsTree) return (StatisticsTree) old;
        if (old != null) throw new IllegalStateException("statistics entry " + key + " is not a section");
        StatisticsTree result = new StatisticsTree();
        entries.put(key, result);
        return result;
    }

    public void put(String key, double value) {
        if (entries.get(key) instanceof StatisticsTree)
            throw new IllegalStateException("statistics entry " + key + " is a section");
        entries.put(key, value);
    }

    public Double value(String key) {
        Object v = entries.get(key);
        return v instanceof Double ? (Double) v : null;
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        print(sb, "");
        return sb.toString();
    }

    private void print(StringBuilder sb, String indent) {
        for (Map.Entry<String, Object> e : entries.entrySet()) {
            sb.append(indent);
            sb.append(e.getKey());
            sb.append(":");
            if (e.getValue() instanceof StatisticsTree) {
                sb.append("\n");
                ((StatisticsTree) e.getValue()).print(sb, indent + "  ");
            } else {
                sb.append(" ");
                sb.append(e.getValue());
                sb.append("\n");
            }
        }
    }
}
