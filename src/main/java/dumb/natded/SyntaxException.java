package dumb.natded;

/**
 * Input text that is not a well-formed formula or term.
 */
public abstract class SyntaxException extends Exception {
    private static final int CONTEXT_RADIUS = 12;
    private final int position;
    private final String input;

    protected SyntaxException(String message, int position, String input) {
        super(message);
        this.position = position;
        this.input = input;
    }

    /** Zero-based offset into the input. */
    public int position() {
        return position;
    }

    public String input() {
        return input;
    }

    /** The message without location and context. */
    public String reason() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        var context = input.isEmpty() ? "" : input.substring(Math.max(0, position - CONTEXT_RADIUS), Math.min(input.length(), position + CONTEXT_RADIUS));
        var contextSnippet = context.isBlank() ? "" : " near '" + context + "'";
        return super.getMessage() + " at position " + position + contextSnippet;
    }
}
