package de.psi.defcsp.ast;

import org.junit.Test;

import static de.psi.defcsp.ast.Term.fun;
import static de.psi.defcsp.ast.Term.num;
import static de.psi.defcsp.ast.Term.op;
import static de.psi.defcsp.ast.Term.str;
import static de.psi.defcsp.ast.Term.sym;
import static de.psi.defcsp.ast.Term.var;
import static org.junit.Assert.*;

public class TermTest {

    @Test
    public void simple() {
        Term t = fun("p", sym("a"), num(3), var("X"));
        assertEquals("p(a,3,X)", t.toString());
    }

    @Test
    public void operations() {
        assertEquals("x+y", op("+", sym("x"), sym("y")).toString());
        assertEquals("1..5", op("..", num(1), num(5)).toString());
        assertEquals("-x", op("-", sym("x")).toString());
    }

    @Test
    public void nestedOperationsKeepGrouping() {
        assertEquals("(a+b)*c", op("*", op("+", sym("a"), sym("b")), sym("c")).toString());
        assertEquals("a*(b+c)", op("*", sym("a"), op("+", sym("b"), sym("c"))).toString());
        assertEquals("-(a+b)", op("-", op("+", sym("a"), sym("b"))).toString());
        assertEquals("(-a)+b", op("+", op("-", sym("a")), sym("b")).toString());
        assertEquals("f(x+1)", fun("f", op("+", sym("x"), num(1))).toString());
    }

    @Test
    public void strings() {
        assertEquals("\"a\\\"b\"", str("a\"b").toString());
    }

    @Test
    public void equality() {
        assertEquals(fun("x", num(1)), fun("x", num(1)));
        assertFalse(sym("X").equals(var("X")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void operationArity() {
        op("+", num(1), num(2), num(3));
    }

    @Test
    public void variableTerms() {
        assertTrue(Helpers.isVariableTerm(sym("x")));
        assertTrue(Helpers.isVariableTerm(fun("x", num(1))));
        assertTrue(Helpers.isVariableTerm(var("X")));
        assertFalse(Helpers.isVariableTerm(num(4)));
        assertFalse(Helpers.isVariableTerm(str("x")));
        assertFalse(Helpers.isVariableTerm(op("+", sym("x"), num(1))));
    }
}
