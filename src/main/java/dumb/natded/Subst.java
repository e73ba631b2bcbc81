package dumb.natded;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Capture-avoiding substitution of a term for the free occurrences of a variable.
 */
public final class Subst {

    private static final Logger logger = LoggerFactory.getLogger(Subst.class);

    private Subst() {
    }

    public static Formula subst(Formula f, Term.Var target, Term replacement) {
        check(f, target, replacement);
        return f.subst(target, replacement);
    }

    public static Term subst(Term t, Term.Var target, Term replacement) {
        check(t, target, replacement);
        return t.subst(target, replacement);
    }

    /**
     * The first of {@code base1}, {@code base2}, ... that is not in {@code excluded}.
     */
    public static String fresh(String base, Set<String> excluded) {
        for (var i = 1; ; i++) {
            var name = base + i;
            if (!excluded.contains(name)) return name;
        }
    }

    static Formula quantified(Formula.Quantified q, Term.Var target, Term replacement) {
        var bound = q.bound();
        if (bound.name().equals(target.name())) return q;

        var replacementVars = replacement.vars();
        if (!replacementVars.contains(bound.name())) {
            var body = q.body().subst(target, replacement);
            return body == q.body() ? q : q.with(bound, body);
        }

        Set<String> excluded = new HashSet<>(q.body().freeVars());
        excluded.addAll(replacementVars);
        excluded.add(target.name());
        var renamed = new Term.Var(fresh(bound.name(), excluded));
        logger.debug("Renaming bound {} to {} before substituting {} for {}", bound, renamed, replacement.toText(), target);

        var body = q.body().subst(bound, renamed).subst(target, replacement);
        return q.with(renamed, body);
    }

    /** Substitutes into each argument; returns {@code args} itself when no argument changed. */
    static List<Term> args(List<Term> args, Term.Var target, Term replacement) {
        List<Term> changed = null;
        for (var i = 0; i < args.size(); i++) {
            var arg = args.get(i);
            var substituted = arg.subst(target, replacement);
            if (changed == null && substituted != arg)
                changed = new ArrayList<>(args.subList(0, i));
            if (changed != null)
                changed.add(substituted);
        }
        return changed == null ? args : changed;
    }

    private static void check(Object node, Term.Var target, Term replacement) {
        if (node == null) throw new SubstitutionException("Nothing to substitute into");
        if (target == null) throw new SubstitutionException("Missing variable to replace");
        if (replacement == null) throw new SubstitutionException("Missing replacement term for " + target);
    }

    /**
     * A substitution was requested with arguments that do not form a tree. Parser output never triggers it.
     */
    public static class SubstitutionException extends IllegalArgumentException {
        public SubstitutionException(String message) {
            super(message);
        }
    }
}
