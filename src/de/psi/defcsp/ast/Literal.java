package de.psi.defcsp.ast;

public abstract class Literal {

    public enum Sign {
        NONE(""), NEGATION("not "), DOUBLE_NEGATION("not not ");

        private final String prefix;

        Sign(String prefix) {
            this.prefix = prefix;
        }

        public String prefix() {
            return prefix;
        }
    }

    public final Sign sign;

    protected Literal(Sign sign) {
        this.sign = sign;
    }

    public static Literal.Symbolic atom(Term atom) {
        return new Symbolic(Sign.NONE, atom);
    }

    public static Literal.Symbolic not(Term atom) {
        return new Symbolic(Sign.NEGATION, atom);
    }

    /**
     * Ordinary atom, possibly negated.
     */
    public static class Symbolic extends Literal {
        public final Term atom;

        public Symbolic(Sign sign, Term atom) {
            super(sign);
            this.atom = atom;
        }

        @Override
        public String toString() {
            return sign.prefix() + atom;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Theory atom occurring in a rule body.
     */
    public static class Theory extends Literal {
        public final TheoryAtom atom;

        public Theory(Sign sign, TheoryAtom atom) {
            super(sign);
            this.atom = atom;
        }

        @Override
        public String toString() {
            return sign.prefix() + atom;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static abstract class Visitor<T> {
        public final T visitThis(Literal x) { return x.accept(this); }

        public abstract T visit(Symbolic x);

        public abstract T visit(Theory x);
    }

    public abstract <T> T accept(Visitor<T> visitor);

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Literal && obj.getClass() == getClass() && obj.toString().equals(toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }
}
