package dumb.natded;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class FormatTests extends AbstractTest {

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
            "p -> q -> r;                   p → (q → r)",
            "p & q & r;                     (p ∧ q) ∧ r",
            "p & q -> r;                    (p ∧ q) → r",
            "~(p | q);                      ¬(p ∨ q)",
            "!~p;                           ¬¬p",
            "_ -> p;                        ⊥ → p",
            "P(f(x),C);                     P(f(x), C)",
            "forall x. P(x) -> Q(x);        ∀x.(P(x) → Q(x))",
            "forall x. exists y. R(x,y);    ∀x.∃y.R(x, y)",
            "(forall x. P(x)) & Q(x);       (∀x.P(x)) ∧ Q(x)",
            "~forall x. P(x);               ¬∀x.P(x)",
            "(~forall x. P(x)) | q;         (¬∀x.P(x)) ∨ q",
            "p & forall x. q | r;           p ∧ (∀x.(q ∨ r))"
    })
    void canonicalText(String text, String expected) {
        assertEquals(expected, Logic.format(parse(text)));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "p", "⊥", "~p", "p & q", "p | q", "p -> q", "(p & q) -> r", "p -> (q -> r)", "(p -> q) -> r",
            "~(p & q) -> (~p | ~q)", "(p -> q) -> (~q -> ~p)", "p -> ~~p", "(p | q) & (r | s)",
            "P(x)", "Q(x, y)", "forall x. P(x)", "exists x. (P(x) & Q(x))", "forall x. exists y. R(x, y)",
            "∀x. (P(x) → ∃y. R(x, y))", "∀x. ∃y. (P(x) ∧ Q(y) → R(x, y))", "(forall x. P(x)) -> Q(y)",
            "~forall x. P(x) & q", "(~exists x. P(x)) & q", "p & forall x. q | r", "(exists x. P(x)) | (forall y. Q(y))",
            "R(f(g(x)), C, h(D, y))", "~~(forall x. P(x)) -> ⊥"
    })
    void formatReadsBackToTheSameTree(String text) {
        var f = parse(text);
        var formatted = Logic.format(f);
        assertEquals(f, parse(formatted), formatted);
        assertEquals(formatted, Logic.format(parse(formatted)));
    }

    @Test
    void toStringIsCanonicalText() {
        var f = parse("forall x. P(x, C) -> q");
        assertEquals(f.toText(), f.toString());
        assertEquals("f(x, C)", term("f(x,C)").toString());
    }

    @Test
    void termText() {
        assertEquals("f(x, g(C))", Logic.format(term("f( x , g(C) )")));
    }

    @Test
    void alphaEquivalence() {
        assertTrue(Logic.alphaEquivalent(parse("forall x. P(x)"), parse("forall y. P(y)")));
        assertTrue(Logic.alphaEquivalent(parse("forall x. exists y. R(x, y)"), parse("forall y. exists x. R(y, x)")));
        assertTrue(Logic.alphaEquivalent(parse("exists x. P(f(x), z)"), parse("exists w. P(f(w), z)")));
        assertFalse(Logic.alphaEquivalent(parse("forall y. P(x)"), parse("forall y. P(y)")));
        assertFalse(Logic.alphaEquivalent(parse("forall x. P(x, z)"), parse("forall z. P(z, z)")));
        assertFalse(Logic.alphaEquivalent(parse("P(x)"), parse("P(y)")));
        assertFalse(Logic.alphaEquivalent(parse("forall x. P(x)"), parse("exists x. P(x)")));
        assertFalse(Logic.alphaEquivalent(parse("p & q"), parse("p | q")));
        assertNotEquals(parse("forall x. P(x)"), parse("forall y. P(y)"));
    }
}
