package dumb.natded;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dumb.natded.util.Json;

import java.util.List;
import java.util.SortedSet;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * An individual of the domain of discourse.
 * <p>
 * Whether an identifier denotes a {@link Var} or a {@link Const} is decided by the parser from its spelling only
 * (lowercase-leading names are variables). Nothing here checks that convention, so a {@code Const("c")} built by hand
 * prints as {@code c} and reads back as a variable.
 */
public sealed interface Term permits Term.Var, Term.Const, Term.Fun {

    static Fun fun(String name, Term... args) {
        return new Fun(name, List.of(args));
    }

    private static String checkName(String name) {
        requireNonNull(name);
        if (name.isBlank())
            throw new IllegalArgumentException("Name must not be blank");
        return name;
    }

    String name();

    /** All variables occurring in this term, which are all free since terms bind nothing. */
    SortedSet<String> vars();

    Term subst(Var target, Term replacement);

    String toText();

    ObjectNode toJson();

    record Var(String name) implements Term {
        public Var {
            checkName(name);
        }

        @Override
        public SortedSet<String> vars() {
            return FreeVars.single(name);
        }

        @Override
        public Term subst(Var target, Term replacement) {
            return name.equals(target.name) ? replacement : this;
        }

        @Override
        public String toText() {
            return name;
        }

        @Override
        public ObjectNode toJson() {
            return Json.node().put("type", "var").put("name", name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Const(String name) implements Term {
        public Const {
            checkName(name);
        }

        @Override
        public SortedSet<String> vars() {
            return FreeVars.none();
        }

        @Override
        public Term subst(Var target, Term replacement) {
            return this;
        }

        @Override
        public String toText() {
            return name;
        }

        @Override
        public ObjectNode toJson() {
            return Json.node().put("type", "const").put("name", name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /** {@code f(t1, ..., tn)} with n &gt;= 1; nullary symbols are {@link Const}s. */
    record Fun(String name, List<Term> args) implements Term {
        public Fun {
            checkName(name);
            args = List.copyOf(requireNonNull(args));
            if (args.isEmpty())
                throw new IllegalArgumentException("Function application needs at least one argument, use a constant instead: " + name);
        }

        public int arity() {
            return args.size();
        }

        @Override
        public SortedSet<String> vars() {
            return FreeVars.of(args);
        }

        @Override
        public Term subst(Var target, Term replacement) {
            var substituted = Subst.args(args, target, replacement);
            return substituted == args ? this : new Fun(name, substituted);
        }

        @Override
        public String toText() {
            return args.stream().map(Term::toText).collect(Collectors.joining(", ", name + "(", ")"));
        }

        @Override
        public ObjectNode toJson() {
            var json = Json.node().put("type", "fun").put("name", name);
            var jsonArgs = json.putArray("args");
            args.forEach(arg -> jsonArgs.add(arg.toJson()));
            return json;
        }

        @Override
        public String toString() {
            return toText();
        }
    }
}
