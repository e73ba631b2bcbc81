package dumb.natded;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dumb.natded.util.Json;

import java.util.List;
import java.util.SortedSet;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * A proposition of propositional or first-order logic.
 * <p>
 * Nodes are immutable and compare structurally; bound variable names take part in {@code equals}, see
 * {@link Logic#alphaEquivalent} for comparison up to renaming. Operations that rebuild a tree return the receiver
 * itself when nothing below it changed.
 */
public sealed interface Formula permits Formula.Atom, Formula.Bottom, Formula.Not, Formula.Binary, Formula.Quantified {

    SortedSet<String> freeVars();

    Formula subst(Term.Var target, Term replacement);

    /**
     * Canonical rendering.
     *
     * @param nested false only for the outermost node, whose binary connective is left unparenthesized
     */
    String toText(boolean nested);

    /**
     * Whether the rendering ends in a quantifier body that would swallow anything written after it.
     */
    boolean openRight();

    ObjectNode toJson();

    default String toText() {
        return toText(false);
    }

    default boolean isClosed() {
        return freeVars().isEmpty();
    }

    record Atom(String name, List<Term> args) implements Formula {
        public Atom {
            requireNonNull(name);
            if (name.isBlank())
                throw new IllegalArgumentException("Atom name must not be blank");
            args = List.copyOf(requireNonNull(args));
        }

        public Atom(String name, Term... args) {
            this(name, List.of(args));
        }

        public boolean isPropositional() {
            return args.isEmpty();
        }

        @Override
        public SortedSet<String> freeVars() {
            return FreeVars.of(args);
        }

        @Override
        public Formula subst(Term.Var target, Term replacement) {
            var substituted = Subst.args(args, target, replacement);
            return substituted == args ? this : new Atom(name, substituted);
        }

        @Override
        public String toText(boolean nested) {
            return args.isEmpty() ? name : args.stream().map(Term::toText).collect(Collectors.joining(", ", name + "(", ")"));
        }

        @Override
        public boolean openRight() {
            return false;
        }

        @Override
        public ObjectNode toJson() {
            var json = Json.node().put("type", "atom").put("name", name);
            var jsonArgs = json.putArray("args");
            args.forEach(arg -> jsonArgs.add(arg.toJson()));
            return json;
        }

        @Override
        public String toString() {
            return toText();
        }
    }

    record Bottom() implements Formula {
        public static final Bottom BOTTOM = new Bottom();

        @Override
        public SortedSet<String> freeVars() {
            return FreeVars.none();
        }

        @Override
        public Formula subst(Term.Var target, Term replacement) {
            return this;
        }

        @Override
        public String toText(boolean nested) {
            return "⊥";
        }

        @Override
        public boolean openRight() {
            return false;
        }

        @Override
        public ObjectNode toJson() {
            return Json.node().put("type", "bottom");
        }

        @Override
        public String toString() {
            return toText();
        }
    }

    record Not(Formula operand) implements Formula {
        public Not {
            requireNonNull(operand);
        }

        @Override
        public SortedSet<String> freeVars() {
            return operand.freeVars();
        }

        @Override
        public Formula subst(Term.Var target, Term replacement) {
            var o = operand.subst(target, replacement);
            return o == operand ? this : new Not(o);
        }

        @Override
        public String toText(boolean nested) {
            return "¬" + operand.toText(true);
        }

        @Override
        public boolean openRight() {
            return operand.openRight();
        }

        @Override
        public ObjectNode toJson() {
            var json = Json.node().put("type", "not");
            json.set("operand", operand.toJson());
            return json;
        }

        @Override
        public String toString() {
            return toText();
        }
    }

    /** The two-place connectives. */
    sealed interface Binary extends Formula permits And, Or, Implies {

        Formula left();

        Formula right();

        Binary with(Formula left, Formula right);

        String symbol();

        String type();

        private static String operand(Formula f) {
            return f.openRight() ? "(" + f.toText(false) + ")" : f.toText(true);
        }

        @Override
        default SortedSet<String> freeVars() {
            return FreeVars.union(left().freeVars(), right().freeVars());
        }

        @Override
        default Formula subst(Term.Var target, Term replacement) {
            var l = left().subst(target, replacement);
            var r = right().subst(target, replacement);
            return l == left() && r == right() ? this : with(l, r);
        }

        @Override
        default String toText(boolean nested) {
            var text = operand(left()) + ' ' + symbol() + ' ' + operand(right());
            return nested ? '(' + text + ')' : text;
        }

        @Override
        default boolean openRight() {
            return false;
        }

        @Override
        default ObjectNode toJson() {
            var json = Json.node().put("type", type());
            json.set("left", left().toJson());
            json.set("right", right().toJson());
            return json;
        }
    }

    record And(Formula left, Formula right) implements Binary {
        public And {
            requireNonNull(left);
            requireNonNull(right);
        }

        @Override
        public Binary with(Formula left, Formula right) {
            return new And(left, right);
        }

        @Override
        public String symbol() {
            return "∧";
        }

        @Override
        public String type() {
            return "and";
        }

        @Override
        public String toString() {
            return toText();
        }
    }

    record Or(Formula left, Formula right) implements Binary {
        public Or {
            requireNonNull(left);
            requireNonNull(right);
        }

        @Override
        public Binary with(Formula left, Formula right) {
            return new Or(left, right);
        }

        @Override
        public String symbol() {
            return "∨";
        }

        @Override
        public String type() {
            return "or";
        }

        @Override
        public String toString() {
            return toText();
        }
    }

    record Implies(Formula antecedent, Formula consequent) implements Binary {
        public Implies {
            requireNonNull(antecedent);
            requireNonNull(consequent);
        }

        @Override
        public Formula left() {
            return antecedent;
        }

        @Override
        public Formula right() {
            return consequent;
        }

        @Override
        public Binary with(Formula left, Formula right) {
            return new Implies(left, right);
        }

        @Override
        public String symbol() {
            return "→";
        }

        @Override
        public String type() {
            return "implies";
        }

        @Override
        public String toString() {
            return toText();
        }
    }

    /** {@code ∀x.φ} and {@code ∃x.φ}: {@link #bound()} binds every free occurrence of its name in {@link #body()}. */
    sealed interface Quantified extends Formula permits Forall, Exists {

        Term.Var bound();

        Formula body();

        Quantified with(Term.Var bound, Formula body);

        String symbol();

        String type();

        @Override
        default SortedSet<String> freeVars() {
            return FreeVars.without(body().freeVars(), bound().name());
        }

        @Override
        default Formula subst(Term.Var target, Term replacement) {
            return Subst.quantified(this, target, replacement);
        }

        @Override
        default String toText(boolean nested) {
            return symbol() + bound().name() + '.' + body().toText(true);
        }

        @Override
        default boolean openRight() {
            return true;
        }

        @Override
        default ObjectNode toJson() {
            var json = Json.node().put("type", type()).put("var", bound().name());
            json.set("body", body().toJson());
            return json;
        }
    }

    record Forall(Term.Var bound, Formula body) implements Quantified {
        public Forall {
            requireNonNull(bound);
            requireNonNull(body);
        }

        public Forall(String bound, Formula body) {
            this(new Term.Var(bound), body);
        }

        @Override
        public Quantified with(Term.Var bound, Formula body) {
            return new Forall(bound, body);
        }

        @Override
        public String symbol() {
            return "∀";
        }

        @Override
        public String type() {
            return "forall";
        }

        @Override
        public String toString() {
            return toText();
        }
    }

    record Exists(Term.Var bound, Formula body) implements Quantified {
        public Exists {
            requireNonNull(bound);
            requireNonNull(body);
        }

        public Exists(String bound, Formula body) {
            this(new Term.Var(bound), body);
        }

        @Override
        public Quantified with(Term.Var bound, Formula body) {
            return new Exists(bound, body);
        }

        @Override
        public String symbol() {
            return "∃";
        }

        @Override
        public String type() {
            return "exists";
        }

        @Override
        public String toString() {
            return toText();
        }
    }
}
