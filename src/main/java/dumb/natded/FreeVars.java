package dumb.natded;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Free variable sets. Results are unmodifiable and sorted by name.
 */
public final class FreeVars {

    private FreeVars() {
    }

    public static SortedSet<String> of(Formula f) {
        return f.freeVars();
    }

    public static SortedSet<String> of(Term t) {
        return t.vars();
    }

    /**
     * Whether {@code t} can replace the free occurrences of {@code x} in {@code f} without any variable of {@code t}
     * being captured by a quantifier of {@code f}.
     */
    public static boolean isFreeFor(Term t, Term.Var x, Formula f) {
        if (f instanceof Formula.Not n) return isFreeFor(t, x, n.operand());
        if (f instanceof Formula.Binary b) return isFreeFor(t, x, b.left()) && isFreeFor(t, x, b.right());
        if (f instanceof Formula.Quantified q) {
            if (!q.freeVars().contains(x.name())) return true;
            return !t.vars().contains(q.bound().name()) && isFreeFor(t, x, q.body());
        }
        return true;
    }

    static SortedSet<String> none() {
        return Collections.emptySortedSet();
    }

    static SortedSet<String> single(String name) {
        return Collections.unmodifiableSortedSet(new TreeSet<>(List.of(name)));
    }

    static SortedSet<String> of(List<Term> args) {
        if (args.size() == 1) return args.get(0).vars();
        var vars = new TreeSet<String>();
        args.forEach(arg -> vars.addAll(arg.vars()));
        return Collections.unmodifiableSortedSet(vars);
    }

    static SortedSet<String> union(SortedSet<String> a, SortedSet<String> b) {
        if (a.isEmpty() || a.equals(b)) return b;
        if (b.isEmpty()) return a;
        var vars = new TreeSet<>(a);
        vars.addAll(b);
        return Collections.unmodifiableSortedSet(vars);
    }

    static SortedSet<String> without(SortedSet<String> vars, String name) {
        if (!vars.contains(name)) return vars;
        var rest = new TreeSet<>(vars);
        rest.remove(name);
        return Collections.unmodifiableSortedSet(rest);
    }
}
