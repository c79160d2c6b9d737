package de.psi.defcsp.ast;

import java.util.Arrays;
import java.util.List;

import edu.mit.csail.sdg.alloy4.ConstList;

/**
 * Non-ground term of the host language as it appears in parsed statements.
 */
public abstract class Term {

    public static Term num(int i) {
        return new Num(i);
    }

    public static Term sym(String name) {
        return new Function(name, ConstList.<Term>make());
    }

    public static Term str(String value) {
        return new Str(value);
    }

    public static Term var(String name) {
        return new Variable(name);
    }

    public static Term fun(String name, Term... args) {
        return new Function(name, ConstList.make(Arrays.asList(args)));
    }

    public static Term op(String operator, Term... operands) {
        return new Operation(operator, ConstList.make(Arrays.asList(operands)));
    }

    public static class Num extends Term {
        private final int value;

        public Num(int value) {
            this.value = value;
        }

        public int getValue() {
            return value;
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static class Str extends Term {
        private final String value;

        public Str(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        @Override
        public String toString() {
            return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static class Variable extends Term {
        private final String name;

        public Variable(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

        @Override
        public String toString() {
            return name;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static class Function extends Term {
        private final String name;
        private final ConstList<Term> args;

        public Function(String name, List<Term> args) {
            this.name = name;
            this.args = ConstList.make(args);
        }

        public String getName() {
            return name;
        }

        public ConstList<Term> getArgs() {
            return args;
        }

        @Override
        public String toString() {
            if (args.isEmpty()) return name;
            StringBuilder sb = new StringBuilder();
            sb.append(name);
            sb.append("(");
            boolean first = true;
            for (Term arg : args) {
                if (first) first = false; else sb.append(",");
                sb.append(arg.toString());
            }
            sb.append(")");
            return sb.toString();
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Unary or binary operator application, e.g. {@code x+y} or {@code 1..5}.
     */
    public static class Operation extends Term {
        private final String operator;
        private final ConstList<Term> operands;

        public Operation(String operator, List<Term> operands) {
            if (operands.isEmpty() || operands.size() > 2)
                throw new IllegalArgumentException("operator " + operator + " takes one or two operands");
            this.operator = operator;
            this.operands = ConstList.make(operands);
        }

        public String getOperator() {
            return operator;
        }

        public ConstList<Term> getOperands() {
            return operands;
        }

        @Override
        public String toString() {
            if (operands.size() == 1) return operator + operand(0);
            return operand(0) + operator + operand(1);
        }

        /** Nested operations are parenthesized so the printed text keeps the tree's grouping. */
        private String operand(int i) {
            Term t = operands.get(i);
            return t instanceof Operation ? "(" + t + ")" : t.toString();
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static abstract class Visitor<T> {
        public final T visitThis(Term x) { return x.accept(this); }

        public abstract T visit(Num x);

        public abstract T visit(Str x);

        public abstract T visit(Variable x);

        public abstract T visit(Function x);

        public abstract T visit(Operation x);
    }

    public abstract <T> T accept(Visitor<T> visitor);

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Term && obj.getClass() == getClass() && obj.toString().equals(toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }
}
