package dumb.natded;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FreeVarsTests extends AbstractTest {

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
            "P(x);                          x",
            "P(x) & Q(y);                   x y",
            "forall x. P(x);",
            "exists x. P(x);",
            "forall x. P(x, y);             y",
            "∀x. (P(x) → Q(y));             y",
            "(∀x. P(x)) → Q(y);             y",
            "∃x. ∀y. R(x, y, z);            z",
            "forall x. exists y. R(x, y);",
            "(forall x. P(x)) & Q(x);       x",
            "P(f(x, g(y)), C);              x y",
            "⊥;",
            "p -> q;",
            "~R(z, a, z);                   a z",
            "forall x. forall x. P(x);"
    })
    void freeVariables(String text, String expected) {
        assertEquals(expected == null ? "" : expected, String.join(" ", Logic.freeVariables(parse(text))));
    }

    @Test
    void termVariables() {
        assertEquals(Set.of("x", "y"), Logic.freeVariables(term("f(x, g(y, x), C)")));
        assertEquals(Set.of(), Logic.freeVariables(term("C")));
        assertEquals(Set.of("x"), Logic.freeVariables(v("x")));
    }

    @Test
    void resultIsSortedAndUnmodifiable() {
        var vars = Logic.freeVariables(parse("R(z, y) & Q(x)"));
        assertEquals(List.of("x", "y", "z"), List.copyOf(vars));
        assertThrows(UnsupportedOperationException.class, () -> vars.add("w"));
    }

    @Test
    void closedFormulas() {
        assertTrue(parse("forall x. exists y. R(x, y)").isClosed());
        assertTrue(parse("p -> q").isClosed());
        assertFalse(parse("exists y. R(x, y)").isClosed());
    }

    @Test
    void freeFor() {
        var formula = parse("forall y. P(x, y)");
        assertFalse(Logic.isFreeFor(v("y"), v("x"), formula));
        assertFalse(Logic.isFreeFor(term("f(y)"), v("x"), formula));
        assertTrue(Logic.isFreeFor(v("z"), v("x"), formula));
        assertTrue(Logic.isFreeFor(c("C"), v("x"), formula));
        assertTrue(Logic.isFreeFor(v("y"), v("x"), parse("forall x. P(x, y)")));
        assertTrue(Logic.isFreeFor(v("y"), v("x"), parse("exists y. Q(y)")));
        assertTrue(Logic.isFreeFor(v("y"), v("x"), parse("P(x) & forall z. R(x, z)")));
        assertFalse(Logic.isFreeFor(v("z"), v("x"), parse("P(x) & ~forall z. R(x, z)")));
    }
}
