package dumb.tdfol.parse;

import java.util.ArrayList;
import java.util.List;

import static dumb.tdfol.parse.Token.Type.*;

/**
 * Splits formula text into tokens. Symbolic and ASCII spellings of an operator produce the same token type.
 * The single letters {@value #RESERVED_LETTERS} are operator keywords, so no identifier of two or more
 * characters may start with one of them.
 */
final class Lexer {

    static final String RESERVED_LETTERS = "OPFXUSGWR";

    private static final int CONTEXT_SIZE = 50;

    private final String text;
    private int pos;

    private Lexer(String text) {
        this.text = text;
    }

    static List<Token> tokenize(String text) throws FormulaSyntaxException {
        return new Lexer(text).run();
    }

    static boolean isReservedLetter(char c) {
        return RESERVED_LETTERS.indexOf(c) >= 0;
    }

    static FormulaSyntaxException error(String text, String message, int at) {
        var line = 1;
        var col = 1;
        for (var i = 0; i < at && i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                line++;
                col = 1;
            } else {
                col++;
            }
        }
        var end = Math.min(text.length(), at + 1);
        var context = text.substring(Math.max(0, end - CONTEXT_SIZE), end);
        return new FormulaSyntaxException(message, line, col, context);
    }

    private List<Token> run() throws FormulaSyntaxException {
        var tokens = new ArrayList<Token>();
        while (true) {
            skipWhitespace();
            if (pos >= text.length()) {
                tokens.add(new Token(EOF, "", pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) pos++;
    }

    private Token next() throws FormulaSyntaxException {
        var start = pos;
        var c = text.charAt(pos);
        switch (c) {
            case '(': pos++; return new Token(LPAREN, "(", start);
            case ')': pos++; return new Token(RPAREN, ")", start);
            case ',': pos++; return new Token(COMMA, ",", start);
            case '.': pos++; return new Token(DOT, ".", start);
            case ':': pos++; return new Token(COLON, ":", start);
            case '∀': pos++; return new Token(FORALL, "∀", start);
            case '∃': pos++; return new Token(EXISTS, "∃", start);
            case '∧': case '&': case '^': pos++; return new Token(AND, String.valueOf(c), start);
            case '∨': case '|': pos++; return new Token(OR, String.valueOf(c), start);
            case '→': pos++; return new Token(IMPLIES, "→", start);
            case '↔': pos++; return new Token(IFF, "↔", start);
            case '¬': case '~': case '!': pos++; return new Token(NOT, String.valueOf(c), start);
            case '□': pos++; return new Token(ALWAYS, "□", start);
            case '◊': case '◇': pos++; return new Token(EVENTUALLY, String.valueOf(c), start);
            case '"': return string();
            case '?': return variable();
        }
        if (startsWith("<->")) return symbol(IFF, "<->");
        if (startsWith("<=>")) return symbol(IFF, "<=>");
        if (startsWith("->")) return symbol(IMPLIES, "->");
        if (startsWith("=>")) return symbol(IMPLIES, "=>");
        if (startsWith("[]")) return symbol(ALWAYS, "[]");
        if (startsWith("<>")) return symbol(EVENTUALLY, "<>");
        if (Character.isDigit(c)) return number();
        if (isIdentStart(c)) return word();
        throw error(text, "Unknown operator or character '" + c + "'", start);
    }

    private boolean startsWith(String s) {
        return text.startsWith(s, pos);
    }

    private Token symbol(Token.Type type, String s) {
        var t = new Token(type, s, pos);
        pos += s.length();
        return t;
    }

    private static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private Token word() throws FormulaSyntaxException {
        var start = pos;
        while (pos < text.length() && isIdentPart(text.charAt(pos))) pos++;
        var w = text.substring(start, pos);
        if (w.equals("forall")) return new Token(FORALL, w, start);
        if (w.equals("exists")) return new Token(EXISTS, w, start);
        if (isReservedLetter(w.charAt(0))) {
            if (w.length() == 1) return new Token(RESERVED, w, start);
            throw error(text, "Identifier '" + w + "' starts with reserved operator letter '" + w.charAt(0) + "'", start);
        }
        return new Token(IDENT, w, start);
    }

    private Token number() {
        var start = pos;
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) pos++;
        if (pos + 1 < text.length() && text.charAt(pos) == '.' && Character.isDigit(text.charAt(pos + 1))) {
            pos++;
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) pos++;
        }
        return new Token(NUMBER, text.substring(start, pos), start);
    }

    private Token variable() throws FormulaSyntaxException {
        var start = pos++;
        if (pos >= text.length() || !isIdentStart(text.charAt(pos)))
            throw error(text, "Variable marker '?' must be followed by a name", start);
        while (pos < text.length() && isIdentPart(text.charAt(pos))) pos++;
        return new Token(VARIABLE, text.substring(start + 1, pos), start);
    }

    private Token string() throws FormulaSyntaxException {
        var start = pos++;
        var sb = new StringBuilder();
        while (true) {
            if (pos >= text.length()) throw error(text, "Unterminated string literal", start);
            var c = text.charAt(pos++);
            if (c == '"') return new Token(STRING, sb.toString(), start);
            if (c == '\\') {
                if (pos >= text.length()) throw error(text, "Unterminated string literal", start);
                var e = text.charAt(pos++);
                switch (e) {
                    case '"' -> sb.append('"');
                    case '\\' -> sb.append('\\');
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    default -> throw error(text, "Invalid escape sequence '\\" + e + "'", pos - 1);
                }
            } else {
                sb.append(c);
            }
        }
    }
}
