package de.psi.defcsp.ast;

import java.util.List;

import edu.mit.csail.sdg.alloy4.ConstList;

/**
 * Theory atom such as {@code &sum{x; 2*y : p} =: z}. The guard is optional.
 */
public class TheoryAtom {
    public final String name;
    public final ConstList<Element> elements;
    public final Guard guard;

    public TheoryAtom(String name, List<Element> elements, Guard guard) {
        this.name = name;
        this.elements = ConstList.make(elements);
        this.guard = guard;
    }

    public TheoryAtom(String name, List<Element> elements) {
        this(name, elements, null);
    }

    public boolean hasGuard() {
        return guard != null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("&");
        sb.append(name);
        sb.append("{");
        boolean first = true;
        for (Element e : elements) {
            if (first) first = false; else sb.append("; ");
            sb.append(e.toString());
        }
        sb.append("}");
        if (guard != null) {
            sb.append(" ");
            sb.append(guard.toString());
        }
        return sb.toString();
    }

    public static class Element {
        public final ConstList<Term> terms;
        public final ConstList<Literal> condition;

        public Element(List<Term> terms, List<Literal> condition) {
            this.terms = ConstList.make(terms);
            this.condition = ConstList.make(condition);
        }

        public Element(List<Term> terms) {
            this(terms, ConstList.<Literal>make());
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            boolean first = true;
            for (Term t : terms) {
                if (first) first = false; else sb.append(",");
                sb.append(t.toString());
            }
            if (!condition.isEmpty()) {
                sb.append(": ");
                first = true;
                for (Literal l : condition) {
                    if (first) first = false; else sb.append(",");
                    sb.append(l.toString());
                }
            }
            return sb.toString();
        }
    }

    public static class Guard {
        public final String operator;
        public final Term term;

        public Guard(String operator, Term term) {
            this.operator = operator;
            this.term = term;
        }

        @Override
        public String toString() {
            return operator + " " + term;
        }
    }
}
