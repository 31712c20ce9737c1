package dumb.tdfol.parse;

/**
 * Malformed formula text. Carries the 1-based line and column of the offending token and the text leading up to it.
 */
public class FormulaSyntaxException extends Exception {
    private final int line;
    private final int col;
    private final String context;

    public FormulaSyntaxException(String message) {
        this(message, -1, -1, "");
    }

    public FormulaSyntaxException(String message, int line, int col, String context) {
        super(message);
        this.line = line;
        this.col = col;
        this.context = context;
    }

    public int line() {
        return line;
    }

    public int col() {
        return col;
    }

    public String context() {
        return context;
    }

    @Override
    public String getMessage() {
        var location = (line != -1 && col != -1) ? " at line " + line + ", col " + col : "";
        var contextSnippet = context != null && !context.isEmpty() ? " near '" + context + "'" : "";
        return super.getMessage() + location + contextSnippet;
    }
}
