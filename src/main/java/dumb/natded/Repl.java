package dumb.natded;

import dumb.natded.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedSet;

import static java.util.Objects.requireNonNull;

/**
 * Line oriented front end. Each line is a command or a formula; a bad line is reported and the loop goes on.
 */
public class Repl {

    private static final Logger logger = LoggerFactory.getLogger(Repl.class);

    static final List<Map.Entry<String, String>> EXAMPLES = List.of(
            Map.entry("Simple atom", "p"),
            Map.entry("Negation", "~p"),
            Map.entry("Modus ponens", "(p & (p -> q)) -> q"),
            Map.entry("De Morgan", "~(p & q) -> (~p | ~q)"),
            Map.entry("Contraposition", "(p -> q) -> (~q -> ~p)"),
            Map.entry("Ex falso", "⊥ -> p"),
            Map.entry("Double negation", "p -> ~~p"),
            Map.entry("Predicate", "P(x)"),
            Map.entry("Binary relation", "R(x, y)"),
            Map.entry("Universal", "forall x. P(x)"),
            Map.entry("Existential", "exists x. P(x)"),
            Map.entry("Nested quantifiers", "forall x. exists y. R(x, y)"),
            Map.entry("Function application", "P(f(x))"),
            Map.entry("Quantified implication", "forall x. (P(x) -> exists y. R(x, y))"),
            Map.entry("Unicode quantifiers", "∀x. ∃y. (P(x) ∧ Q(y) → R(x, y))")
    );

    private static final String HELP = """
            Commands:
              <formula>                       parse and describe a formula
              parse <formula>                 same as above
              free <formula>                  list the free variables
              subst <formula> [<term>/<var>]  substitute a term for a variable
              json <formula>                  print the syntax tree as JSON
              examples                        parse the built-in examples
              help                            show this message
              quit                            leave

            Syntax:
              atoms        p, q, r, ...            predicates   P(x), Q(x, y)
              negation     ~p  ¬p  !p              functions    f(x), g(x, y)
              conjunction  p & q   p ∧ q           constants    C, D (uppercase)
              disjunction  p | q   p ∨ q           variables    x, y (lowercase)
              implication  p -> q  p → q           universal    forall x. P(x)  ∀x. P(x)
              bottom       _  ⊥                    existential  exists x. P(x)  ∃x. P(x)
            """;

    private final BufferedReader in;
    private final PrintWriter out;
    private final PrintWriter err;
    private final Config config;
    private int failures = 0;

    public Repl(BufferedReader in, PrintWriter out, PrintWriter err, Config config) {
        this.in = requireNonNull(in);
        this.out = requireNonNull(out);
        this.err = requireNonNull(err);
        this.config = requireNonNull(config);
    }

    /**
     * Reads commands until {@code quit} or end of input.
     *
     * @return the number of lines that failed
     */
    public int run() throws IOException {
        while (true) {
            out.print(config.prompt());
            out.flush();
            var line = in.readLine();
            if (line == null) break;
            line = line.strip();
            if (line.isEmpty()) continue;
            if (!handle(line)) break;
            out.flush();
            err.flush();
        }
        out.flush();
        err.flush();
        return failures;
    }

    /** @return false when the loop should stop */
    boolean handle(String line) {
        try {
            switch (line.toLowerCase(Locale.ROOT)) {
                case "quit", "exit", "q" -> {
                    return false;
                }
                case "help", "h", "?" -> out.print(HELP);
                case "examples" -> examples();
                default -> command(line);
            }
        } catch (SyntaxException | IllegalArgumentException e) {
            report(e.getMessage());
        }
        return true;
    }

    /**
     * A command word followed by its argument, or else a formula. {@code free & p} is the formula {@code free ∧ p}
     * since a connective cannot start an argument.
     */
    private void command(String line) throws SyntaxException {
        var space = line.indexOf(' ');
        if (space < 0 || startsWithConnective(line.substring(space + 1))) {
            describe(line);
            return;
        }
        var rest = line.substring(space + 1).strip();
        switch (line.substring(0, space).toLowerCase(Locale.ROOT)) {
            case "parse" -> describe(rest);
            case "free" -> out.println(braces(Logic.parse(rest).freeVars()));
            case "json" -> out.println(Json.str(Logic.parse(rest).toJson()));
            case "subst" -> subst(rest);
            default -> describe(line);
        }
    }

    private static boolean startsWithConnective(String text) {
        try {
            var kind = new Lexer(text).peek().kind();
            return kind == Token.Kind.AND || kind == Token.Kind.OR || kind == Token.Kind.IMPLIES;
        } catch (Lexer.LexException e) {
            // reported when the argument is parsed
            return false;
        }
    }

    private void describe(String text) throws SyntaxException {
        var f = Logic.parse(text);
        if (config.json()) {
            out.println(Json.str(f.toJson()));
            return;
        }
        out.println("  formula:  " + f.toText());
        out.println("  kind:     " + f.getClass().getSimpleName());
        var free = f.freeVars();
        if (!free.isEmpty() || config.showFree()) out.println("  free:     " + braces(free));
        if (f instanceof Formula.Binary b) {
            out.println("  left:     " + b.left().toText());
            out.println("  right:    " + b.right().toText());
        } else if (f instanceof Formula.Not n) {
            out.println("  operand:  " + n.operand().toText());
        } else if (f instanceof Formula.Quantified q) {
            out.println("  body:     " + q.body().toText());
        }
    }

    /** {@code <formula> [<term>/<var>]} */
    private void subst(String text) throws SyntaxException {
        var open = text.lastIndexOf('[');
        var slash = text.lastIndexOf('/');
        if (open < 0 || !text.endsWith("]") || slash < open)
            throw new IllegalArgumentException("Usage: subst <formula> [<term>/<var>]");
        var f = Logic.parse(text.substring(0, open));
        var replacement = Logic.parseTerm(text.substring(open + 1, slash));
        var target = Logic.parseTerm(text.substring(slash + 1, text.length() - 1));
        if (!(target instanceof Term.Var v))
            throw new IllegalArgumentException("Only variables can be substituted for, not " + target.toText());
        if (!Logic.isFreeFor(replacement, v, f))
            out.println("  (renaming bound variables: " + replacement.toText() + " is not free for " + v + ")");
        var result = Logic.substitute(f, v, replacement);
        out.println(config.json() ? Json.str(result.toJson()) : result.toText());
    }

    private void examples() {
        for (var example : EXAMPLES) {
            String outcome;
            try {
                Logic.parse(example.getValue());
                outcome = "✓";
            } catch (SyntaxException e) {
                failures++;
                outcome = "✗ (" + e.getMessage() + ")";
            }
            out.printf("%-24s %-40s %s%n", example.getKey(), example.getValue(), outcome);
        }
    }

    private static String braces(SortedSet<String> vars) {
        return "{" + String.join(", ", vars) + "}";
    }
}
