package de.psi.defcsp.csp;

import java.util.Arrays;
import java.util.List;

import edu.mit.csail.sdg.alloy4.ConstList;

/**
 * Ground value as reported by the grounding engine: numbers, strings and
 * (possibly nullary) functions.
 */
public abstract class Symbol {

    public static Symbol num(int i) {
        return new Number(i);
    }

    public static Symbol str(String value) {
        return new Str(value);
    }

    public static Symbol sym(String name) {
        return new Function(name, ConstList.<Symbol>make());
    }

    public static Symbol fun(String name, Symbol... args) {
        return new Function(name, ConstList.make(Arrays.asList(args)));
    }

    /** Functor name, or null for numbers and strings. */
    public String getName() {
        return null;
    }

    public ConstList<Symbol> getArguments() {
        return ConstList.make();
    }

    public static final class Number extends Symbol {
        public final int value;

        public Number(int value) {
            this.value = value;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Number && ((Number) obj).value == value;
        }

        @Override
        public int hashCode() {
            return value;
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    public static final class Str extends Symbol {
        public final String value;

        public Str(String value) {
            this.value = value;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Str && ((Str) obj).value.equals(value);
        }

        @Override
        public int hashCode() {
            return value.hashCode() * 31 + 7;
        }

        @Override
        public String toString() {
            return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
        }
    }

    public static final class Function extends Symbol {
        public final String name;
        public final ConstList<Symbol> args;

        public Function(String name, List<Symbol> args) {
            this.name = name;
            this.args = ConstList.make(args);
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public ConstList<Symbol> getArguments() {
            return args;
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof Function)) return false;
            Function f = (Function) obj;
            if (!f.name.equals(name) || f.args.size() != args.size()) return false;
            for (int i = 0; i < args.size(); ++i) {
                if (!f.args.get(i).equals(args.get(i))) return false;
            }
            return true;
        }

        @Override
        public int hashCode() {
            int h = name.hashCode();
            for (Symbol arg : args) h = h * 17 + arg.hashCode();
            return h;
        }

        @Override
        public String toString() {
            if (args.isEmpty()) return name;
            StringBuilder sb = new StringBuilder();
            sb.append(name);
            sb.append("(");
            boolean first = true;
            for (Symbol arg : args) {
                if (first) first = false; else sb.append(",");
                sb.append(arg.toString());
            }
            sb.append(")");
            return sb.toString();
        }
    }
}
