package dumb.natded;

import dumb.natded.Token.Kind;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for formulas.
 * <p>
 * Binding strength, tightest first: quantifiers, negation, conjunction, disjunction, implication. Conjunction and
 * disjunction associate to the left, implication to the right. A quantifier body extends as far to the right as
 * possible, so {@code forall x. P(x) -> Q(x)} quantifies the whole implication.
 * <p>
 * Inside argument lists an identifier followed by {@code (} is a function application; otherwise a lowercase-leading
 * identifier is a variable and any other identifier a constant. This is a spelling convention and is not checked
 * against quantifier scopes.
 */
public class Parser {
    private final Lexer lexer;

    private Parser(String text) {
        this.lexer = new Lexer(text);
    }

    public static Formula parse(String text) throws SyntaxException {
        var parser = new Parser(text);
        var formula = parser.formula();
        parser.end();
        return formula;
    }

    public static Term parseTerm(String text) throws SyntaxException {
        var parser = new Parser(text);
        var term = parser.term();
        parser.end();
        return term;
    }

    private void end() throws SyntaxException {
        var token = lexer.peek();
        if (token.kind() != Kind.END) throw new TrailingInputException(token, lexer.text());
    }

    private boolean accept(Kind kind) throws SyntaxException {
        if (lexer.peek().kind() != kind) return false;
        lexer.next();
        return true;
    }

    private Token expect(Kind kind, String expected) throws SyntaxException {
        var token = lexer.peek();
        if (token.kind() != kind) throw new ParseException(expected, token, lexer.text());
        return lexer.next();
    }

    private Formula formula() throws SyntaxException {
        return implication();
    }

    private Formula implication() throws SyntaxException {
        var left = disjunction();
        return accept(Kind.IMPLIES) ? new Formula.Implies(left, implication()) : left;
    }

    private Formula disjunction() throws SyntaxException {
        var left = conjunction();
        while (accept(Kind.OR)) left = new Formula.Or(left, conjunction());
        return left;
    }

    private Formula conjunction() throws SyntaxException {
        var left = unary();
        while (accept(Kind.AND)) left = new Formula.And(left, unary());
        return left;
    }

    private Formula unary() throws SyntaxException {
        if (accept(Kind.NOT)) return new Formula.Not(unary());
        var kind = lexer.peek().kind();
        return kind == Kind.FORALL || kind == Kind.EXISTS ? quantified() : primary();
    }

    private Formula quantified() throws SyntaxException {
        var quantifier = lexer.next();
        var name = lexer.peek();
        if (name.kind() != Kind.IDENT || !Character.isLowerCase(name.text().charAt(0)))
            throw new ParseException("bound variable", name, lexer.text());
        lexer.next();
        expect(Kind.DOT, "'.' after bound variable");
        var body = formula();
        var bound = new Term.Var(name.text());
        return quantifier.kind() == Kind.FORALL ? new Formula.Forall(bound, body) : new Formula.Exists(bound, body);
    }

    private Formula primary() throws SyntaxException {
        var token = lexer.peek();
        switch (token.kind()) {
            case LPAREN -> {
                lexer.next();
                var inner = formula();
                expect(Kind.RPAREN, "')'");
                return inner;
            }
            case BOTTOM -> {
                lexer.next();
                return Formula.Bottom.BOTTOM;
            }
            case IDENT -> {
                lexer.next();
                var args = lexer.peek().kind() == Kind.LPAREN ? termList() : List.<Term>of();
                return new Formula.Atom(token.text(), args);
            }
            default -> throw new ParseException("formula", token, lexer.text());
        }
    }

    private List<Term> termList() throws SyntaxException {
        expect(Kind.LPAREN, "'('");
        var terms = new ArrayList<Term>();
        terms.add(term());
        while (accept(Kind.COMMA)) terms.add(term());
        expect(Kind.RPAREN, "',' or ')'");
        return terms;
    }

    private Term term() throws SyntaxException {
        var name = expect(Kind.IDENT, "term").text();
        if (lexer.peek().kind() == Kind.LPAREN) return new Term.Fun(name, termList());
        return Character.isLowerCase(name.charAt(0)) ? new Term.Var(name) : new Term.Const(name);
    }

    public static class ParseException extends SyntaxException {
        private final String expected;
        private final Token found;

        public ParseException(String expected, Token found, String input) {
            super("Expected " + expected + " but found " + found.describe(), found.pos(), input);
            this.expected = expected;
            this.found = found;
        }

        public String expected() {
            return expected;
        }

        public Token found() {
            return found;
        }
    }

    /** A complete formula followed by more tokens. */
    public static class TrailingInputException extends ParseException {
        public TrailingInputException(Token found, String input) {
            super("end of input", found, input);
        }
    }
}
