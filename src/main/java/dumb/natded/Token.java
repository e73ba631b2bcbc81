package dumb.natded;

import static java.util.Objects.requireNonNull;

/**
 * A lexical unit. {@code text} holds the identifier name, or the source spelling of a symbol for messages;
 * all spellings of one symbol share a {@link Kind}.
 */
public record Token(Kind kind, String text, int pos) {

    public Token {
        requireNonNull(kind);
        requireNonNull(text);
    }

    public String describe() {
        return switch (kind) {
            case END -> kind.label;
            case IDENT -> "identifier '" + text + "'";
            default -> "'" + text + "'";
        };
    }

    public enum Kind {
        IDENT("identifier"),
        NOT("negation"),
        AND("conjunction"),
        OR("disjunction"),
        IMPLIES("implication"),
        BOTTOM("bottom"),
        FORALL("forall"),
        EXISTS("exists"),
        DOT("'.'"),
        COMMA("','"),
        LPAREN("'('"),
        RPAREN("')'"),
        END("end of input");

        public final String label;

        Kind(String label) {
            this.label = label;
        }
    }
}
