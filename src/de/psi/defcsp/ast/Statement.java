package de.psi.defcsp.ast;

import java.util.List;

import edu.mit.csail.sdg.alloy4.ConstList;
import edu.mit.csail.sdg.alloy4.Pos;

/**
 * Parsed statement of a logic program. Statements are immutable; rewriting
 * always produces new instances.
 */
public abstract class Statement {
    public final Pos pos;

    protected Statement(Pos pos) {
        this.pos = pos == null ? Pos.UNKNOWN : pos;
    }

    public static class Rule extends Statement {
        public final Head head;
        public final ConstList<Literal> body;

        public Rule(Pos pos, Head head, List<Literal> body) {
            super(pos);
            this.head = head;
            this.body = ConstList.make(body);
        }

        public Rule change(Head newHead) {
            return new Rule(pos, newHead, body);
        }

        public Rule change(List<Literal> newBody) {
            return new Rule(pos, head, newBody);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append(head.toString());
            if (!body.isEmpty()) {
                sb.append(" :- ");
                boolean first = true;
                for (Literal l : body) {
                    if (first) first = false; else sb.append("; ");
                    sb.append(l.toString());
                }
            }
            sb.append(".");
            return sb.toString();
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Any statement other than a rule ({@code #show}, {@code #const}, ...),
     * kept as its source text.
     */
    public static class Directive extends Statement {
        public final String text;

        public Directive(Pos pos, String text) {
            super(pos);
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
        public final T visitThis(Statement x) { return x.accept(this); }

        public abstract T visit(Rule x);

        public abstract T visit(Directive x);
    }

    public abstract <T> T accept(Visitor<T> visitor);
}
