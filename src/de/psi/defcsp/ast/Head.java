package de.psi.defcsp.ast;

/**
 * Rule head. Aggregates, disjunctions and other structured heads are kept
 * as {@link Opaque} text, the rewriter never looks into them.
 */
public abstract class Head {

    public static final Head FALSE = new Head() {
        @Override
        public String toString() {
            return "#false";
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitFalse();
        }
    };

    public static Head atom(Term atom) {
        return new Simple(Literal.atom(atom));
    }

    public static class Simple extends Head {
        public final Literal.Symbolic literal;

        public Simple(Literal.Symbolic literal) {
            this.literal = literal;
        }

        @Override
        public String toString() {
            return literal.toString();
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static class Theory extends Head {
        public final TheoryAtom atom;

        public Theory(TheoryAtom atom) {
            this.atom = atom;
        }

        @Override
        public String toString() {
            return atom.toString();
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static class Opaque extends Head {
        public final String text;

        public Opaque(String text) {
            this.text = text;
        }

        @Override
        public String toString() {
            return text;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static abstract class Visitor<T> {
        public final T visitThis(Head x) { return x.accept(this); }

        public abstract T visitFalse();

        public abstract T visit(Simple x);

        public abstract T visit(Theory x);

        public abstract T visit(Opaque x);
    }

    public abstract <T> T accept(Visitor<T> visitor);
}
