package dumb.tdfol.dcec;

import dumb.tdfol.parse.FormulaSyntaxException;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Character-level reader for S-expressions with {@code ;} line comments and quoted atoms.
 */
public class SexprReader {
    private static final int CONTEXT_BUFFER_SIZE = 50;
    private final Reader reader;
    private final StringBuilder contextBuffer = new StringBuilder(CONTEXT_BUFFER_SIZE);
    private int currentChar = -2;
    private int line = 1;
    private int col = 0;

    private SexprReader(Reader reader) {
        this.reader = reader;
    }

    public static List<Sexpr> read(String text) throws FormulaSyntaxException {
        try (var reader = new StringReader(text)) {
            var r = new SexprReader(reader);
            var exprs = new ArrayList<Sexpr>();
            r.skipWhitespaceAndComments();
            while (r.peek() != -1) {
                exprs.add(r.readExpr());
                r.skipWhitespaceAndComments();
            }
            return exprs;
        } catch (IOException e) {
            throw new FormulaSyntaxException("IO error reading DCEC text: " + e.getMessage());
        }
    }

    /** Reads exactly one expression. */
    public static Sexpr readOne(String text) throws FormulaSyntaxException {
        var all = read(text);
        if (all.size() != 1)
            throw new FormulaSyntaxException("Expected exactly one DCEC expression but found " + all.size());
        return all.get(0);
    }

    private int peek() throws IOException {
        if (currentChar == -2) {
            currentChar = reader.read();
            if (contextBuffer.length() >= CONTEXT_BUFFER_SIZE) contextBuffer.deleteCharAt(0);
            if (currentChar != -1) contextBuffer.append((char) currentChar);
        }
        return currentChar;
    }

    private int consumeChar() throws IOException {
        var c = peek();
        if (c != -1) {
            currentChar = -2;
            if (c == '\n') {
                line++;
                col = 0;
            } else {
                col++;
            }
        }
        return c;
    }

    private void consumeChar(char expected) throws IOException, FormulaSyntaxException {
        var actual = consumeChar();
        if (actual != expected)
            throw error("Expected '" + expected + "'", actual == -1 ? "EOF" : "'" + (char) actual + "'");
    }

    private void skipWhitespaceAndComments() throws IOException {
        while (true) {
            var c = peek();
            if (c == -1) return;
            if (Character.isWhitespace(c)) {
                consumeChar();
            } else if (c == ';') {
                while (peek() != '\n' && peek() != -1) consumeChar();
            } else {
                return;
            }
        }
    }

    private Sexpr readExpr() throws IOException, FormulaSyntaxException {
        skipWhitespaceAndComments();
        var c = peek();
        if (c == -1) throw error("Unexpected EOF while reading expression", null);
        if (c == ')') throw error("Unbalanced ')'", null);
        return c == '(' ? readList() : c == '"' ? readString() : readSymbol();
    }

    private Sexpr.Lst readList() throws IOException, FormulaSyntaxException {
        consumeChar('(');
        var items = new ArrayList<Sexpr>();
        skipWhitespaceAndComments();
        while (peek() != ')') {
            if (peek() == -1) throw error("Unexpected EOF inside list", null);
            items.add(readExpr());
            skipWhitespaceAndComments();
        }
        consumeChar(')');
        return new Sexpr.Lst(items);
    }

    private Sexpr.Atom readString() throws IOException, FormulaSyntaxException {
        consumeChar('"');
        var sb = new StringBuilder();
        while (peek() != '"') {
            if (peek() == -1) throw error("Unexpected EOF inside string literal", null);
            if (peek() == '\\') {
                consumeChar();
                var escaped = consumeChar();
                switch (escaped) {
                    case '"' -> sb.append('"');
                    case '\\' -> sb.append('\\');
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    default -> throw error("Invalid escape sequence '\\" + (char) escaped + "'", null);
                }
            } else {
                sb.append((char) consumeChar());
            }
        }
        consumeChar('"');
        return new Sexpr.Atom(sb.toString());
    }

    private Sexpr.Atom readSymbol() throws IOException {
        var sb = new StringBuilder();
        while (peek() != -1 && !Character.isWhitespace(peek()) && peek() != '(' && peek() != ')' && peek() != '"' && peek() != ';')
            sb.append((char) consumeChar());
        return new Sexpr.Atom(sb.toString());
    }

    private FormulaSyntaxException error(String message, @Nullable String found) {
        var foundInfo = found != null ? " found " + found : "";
        return new FormulaSyntaxException(message + foundInfo, line, col, contextBuffer.toString());
    }
}
