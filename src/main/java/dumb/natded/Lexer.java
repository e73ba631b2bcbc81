package dumb.natded;

import dumb.natded.Token.Kind;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Splits formula text into tokens on demand.
 * <p>
 * Symbols may be written in ASCII or in logic notation: {@code ~ ¬ !}, {@code & ∧}, {@code | ∨}, {@code -> →},
 * {@code _ ⊥}, {@code forall ∀}, {@code exists ∃}. Identifiers are a letter followed by letters and digits, both in
 * the Unicode sense of {@link Character#isLetter} and {@link Character#isLetterOrDigit}: {@code é1} and {@code Ω} are
 * identifiers, and the case of the first letter still decides between variable and constant.
 */
public class Lexer {
    private final String text;
    private int pos = 0;
    private @Nullable Token lookahead;

    public Lexer(String text) {
        this.text = requireNonNull(text);
    }

    public static List<Token> tokenize(String text) throws LexException {
        var lexer = new Lexer(text);
        var tokens = new ArrayList<Token>();
        Token token;
        do {
            token = lexer.next();
            tokens.add(token);
        } while (token.kind() != Kind.END);
        return List.copyOf(tokens);
    }

    public String text() {
        return text;
    }

    public Token peek() throws LexException {
        if (lookahead == null) lookahead = scan();
        return lookahead;
    }

    /** Consumes the next token. Once the input is exhausted, keeps returning the same END token. */
    public Token next() throws LexException {
        var token = peek();
        if (token.kind() != Kind.END) lookahead = null;
        return token;
    }

    private Token scan() throws LexException {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) pos++;
        if (pos >= text.length()) return new Token(Kind.END, "", pos);

        var start = pos;
        var c = text.charAt(pos);
        if (Character.isLetter(c)) {
            while (pos < text.length() && Character.isLetterOrDigit(text.charAt(pos))) pos++;
            var word = text.substring(start, pos);
            var kind = switch (word) {
                case "forall" -> Kind.FORALL;
                case "exists" -> Kind.EXISTS;
                default -> Kind.IDENT;
            };
            return new Token(kind, word, start);
        }

        var kind = symbol(c);
        if (kind == null) throw new LexException(start, c, text);
        pos += kind == Kind.IMPLIES && c == '-' ? 2 : 1;
        return new Token(kind, text.substring(start, pos), start);
    }

    private @Nullable Kind symbol(char c) {
        return switch (c) {
            case '~', '¬', '!' -> Kind.NOT;
            case '&', '∧' -> Kind.AND;
            case '|', '∨' -> Kind.OR;
            case '→' -> Kind.IMPLIES;
            case '-' -> text.startsWith("->", pos) ? Kind.IMPLIES : null;
            case '⊥', '_' -> Kind.BOTTOM;
            case '∀' -> Kind.FORALL;
            case '∃' -> Kind.EXISTS;
            case '.' -> Kind.DOT;
            case ',' -> Kind.COMMA;
            case '(' -> Kind.LPAREN;
            case ')' -> Kind.RPAREN;
            default -> null;
        };
    }

    public static class LexException extends SyntaxException {
        private final char character;

        public LexException(int position, char character, String input) {
            super("Unrecognized character '" + character + "'", position, input);
            this.character = character;
        }

        public char character() {
            return character;
        }
    }
}
