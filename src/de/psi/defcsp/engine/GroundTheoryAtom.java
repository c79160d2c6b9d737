package de.psi.defcsp.engine;

import java.util.List;

import de.psi.defcsp.csp.Symbol;
import edu.mit.csail.sdg.alloy4.ConstList;

/**
 * Theory atom left by grounding, reduced to its name and ground arguments.
 */
public final class GroundTheoryAtom {
    public final String name;
    public final ConstList<Symbol> arguments;

    public GroundTheoryAtom(String name, List<Symbol> arguments) {
        this.name = name;
        this.arguments = ConstList.make(arguments);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof GroundTheoryAtom)) return false;
        return toString().equals(obj.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("&");
        sb.append(name);
        sb.append("(");
        boolean first = true;
        for (Symbol arg : arguments) {
            if (first) first = false; else sb.append(",");
            sb.append(arg.toString());
        }
        sb.append(")");
        return sb.toString();
    }
}
