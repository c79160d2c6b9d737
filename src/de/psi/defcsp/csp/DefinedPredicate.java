package de.psi.defcsp.csp;

import java.util.regex.Pattern;

import edu.mit.csail.sdg.alloy4.ErrorSyntax;

/**
 * Name of the unary predicate marking a constraint variable as defined.
 */
public final class DefinedPredicate {

    public static final String DEFAULT_NAME = "__def";

    public static final DefinedPredicate DEFAULT = new DefinedPredicate(DEFAULT_NAME);

    private static final Pattern NAME = Pattern.compile("[a-z][A-Za-z0-9_]*");

    public final String name;

    private DefinedPredicate(String name) {
        this.name = name;
    }

    /**
     * Validates a user supplied predicate name.
     *
     * @throws ErrorSyntax unless the name is a lowercase letter followed by
     *         letters, digits or underscores
     */
    public static DefinedPredicate parse(String name) throws ErrorSyntax {
        if (name == null || !NAME.matcher(name).matches())
            throw new ErrorSyntax("invalid defined predicate name '" + name
                    + "': expected a lowercase letter followed by letters, digits or underscores");
        return new DefinedPredicate(name);
    }

    public Symbol marker(Symbol variable) {
        return Symbol.fun(name, variable);
    }

    public boolean isMarker(Symbol atom) {
        return name.equals(atom.getName()) && atom.getArguments().size() == 1;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof DefinedPredicate && ((DefinedPredicate) obj).name.equals(name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
