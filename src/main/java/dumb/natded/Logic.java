package dumb.natded;

import java.util.HashMap;
import java.util.Map;
import java.util.SortedSet;

/**
 * Entry points of the formula front end: parsing, free variables, substitution and canonical rendering.
 * All operations are pure and safe to call concurrently.
 */
public final class Logic {

    private Logic() {
    }

    public static Formula parse(String text) throws SyntaxException {
        return Parser.parse(text);
    }

    public static Term parseTerm(String text) throws SyntaxException {
        return Parser.parseTerm(text);
    }

    public static SortedSet<String> freeVariables(Formula f) {
        return FreeVars.of(f);
    }

    public static SortedSet<String> freeVariables(Term t) {
        return FreeVars.of(t);
    }

    /**
     * Replaces the free occurrences of {@code target} in {@code f} by {@code replacement}, renaming bound variables
     * of {@code f} that would capture a variable of {@code replacement}.
     */
    public static Formula substitute(Formula f, Term.Var target, Term replacement) {
        return Subst.subst(f, target, replacement);
    }

    public static Term substitute(Term t, Term.Var target, Term replacement) {
        return Subst.subst(t, target, replacement);
    }

    public static boolean isFreeFor(Term t, Term.Var x, Formula f) {
        return FreeVars.isFreeFor(t, x, f);
    }

    /** Canonical text, which {@link #parse} reads back to an equal formula. */
    public static String format(Formula f) {
        return f.toText();
    }

    public static String format(Term t) {
        return t.toText();
    }

    /**
     * Equality up to a consistent renaming of bound variables.
     */
    public static boolean alphaEquivalent(Formula a, Formula b) {
        return alpha(a, b, Map.of(), Map.of(), 0);
    }

    private static boolean alpha(Formula a, Formula b, Map<String, Integer> scopeA, Map<String, Integer> scopeB, int depth) {
        if (a.getClass() != b.getClass()) return false;
        if (a instanceof Formula.Atom x && b instanceof Formula.Atom y) {
            if (!x.name().equals(y.name()) || x.args().size() != y.args().size()) return false;
            for (var i = 0; i < x.args().size(); i++)
                if (!alpha(x.args().get(i), y.args().get(i), scopeA, scopeB)) return false;
            return true;
        }
        if (a instanceof Formula.Not x && b instanceof Formula.Not y)
            return alpha(x.operand(), y.operand(), scopeA, scopeB, depth);
        if (a instanceof Formula.Binary x && b instanceof Formula.Binary y)
            return alpha(x.left(), y.left(), scopeA, scopeB, depth) && alpha(x.right(), y.right(), scopeA, scopeB, depth);
        if (a instanceof Formula.Quantified x && b instanceof Formula.Quantified y)
            return alpha(x.body(), y.body(), bind(scopeA, x.bound(), depth), bind(scopeB, y.bound(), depth), depth + 1);
        return a.equals(b);
    }

    private static boolean alpha(Term a, Term b, Map<String, Integer> scopeA, Map<String, Integer> scopeB) {
        if (a instanceof Term.Var x && b instanceof Term.Var y) {
            var i = scopeA.get(x.name());
            var j = scopeB.get(y.name());
            return i == null ? j == null && x.equals(y) : i.equals(j);
        }
        if (a instanceof Term.Fun x && b instanceof Term.Fun y) {
            if (!x.name().equals(y.name()) || x.arity() != y.arity()) return false;
            for (var i = 0; i < x.arity(); i++)
                if (!alpha(x.args().get(i), y.args().get(i), scopeA, scopeB)) return false;
            return true;
        }
        return a.equals(b);
    }

    private static Map<String, Integer> bind(Map<String, Integer> scope, Term.Var v, int depth) {
        var inner = new HashMap<>(scope);
        inner.put(v.name(), depth);
        return inner;
    }
}
