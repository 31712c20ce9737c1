package dumb.tdfol.parse;

import dumb.tdfol.Formula;
import dumb.tdfol.Term;
import dumb.tdfol.util.Log;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import static dumb.tdfol.parse.Token.Type.*;

/**
 * Recursive-descent parser for TDFOL formula text.
 * <p>
 * Precedence, tightest first: unary operators (¬ □ ◊ X O P F G and quantifiers), binary temporal
 * operators (U S W R), ∧, ∨, →, ↔. ∧ and ∨ group to the left, → to the right. A quantifier's scope runs to
 * the end of the enclosing formula or the matching parenthesis.
 * <p>
 * A reserved letter followed by a parenthesised list of terms is a predicate ({@code P(a)}); followed by any
 * other parenthesised formula it is an operator ({@code O(P(a))}); standing alone it is a proposition
 * ({@code P -> P}). Terms start with a lowercase letter, a digit, a quote or {@code ?}.
 */
public final class FormulaParser {

    private final String text;
    private final List<Token> tokens;
    private final ParseLimits limits;
    private final Deque<Term.Variable> scope = new ArrayDeque<>();
    private int pos;
    private int depth;

    private FormulaParser(String text, List<Token> tokens, ParseLimits limits) {
        this.text = text;
        this.tokens = tokens;
        this.limits = limits;
    }

    public static Formula parse(String text) throws FormulaSyntaxException {
        return parse(text, ParseLimits.DEFAULT);
    }

    public static Formula parse(String text, ParseLimits limits) throws FormulaSyntaxException {
        if (text == null || text.isBlank()) throw new FormulaSyntaxException("Empty formula");
        if (text.length() > limits.maxLength())
            throw new FormulaSyntaxException("Formula too long: " + text.length() + " > " + limits.maxLength() + " characters");
        var p = new FormulaParser(text, Lexer.tokenize(text), limits);
        var f = p.parseIff();
        if (!p.peek().is(EOF)) throw p.error("Unexpected " + p.peek().describe() + " after complete formula");
        return f;
    }

    /** Parses without throwing; failures are logged at debug level. */
    public static Optional<Formula> parseSafe(@Nullable String text) {
        try {
            return Optional.of(parse(text));
        } catch (FormulaSyntaxException e) {
            Log.debug("Formula rejected: " + e.getMessage());
            return Optional.empty();
        }
    }

    /** Parses each text in order, failing on the first malformed one. */
    public static List<Formula> parseAll(List<String> texts) throws FormulaSyntaxException {
        var out = new ArrayList<Formula>(texts.size());
        for (var t : texts) out.add(parse(t));
        return out;
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token consume() {
        var t = tokens.get(pos);
        if (!t.is(EOF)) pos++;
        return t;
    }

    private Token expect(Token.Type type, String what) throws FormulaSyntaxException {
        var t = peek();
        if (!t.is(type)) throw error("Expected " + what + " but found " + t.describe());
        return consume();
    }

    private FormulaSyntaxException error(String message) {
        return Lexer.error(text, message, peek().pos());
    }

    private void descend() throws FormulaSyntaxException {
        if (++depth > limits.maxDepth()) throw error("Formula nested deeper than " + limits.maxDepth() + " levels");
    }

    private Formula parseIff() throws FormulaSyntaxException {
        var left = parseImplies();
        while (peek().is(IFF)) {
            consume();
            left = Formula.iff(left, parseImplies());
        }
        return left;
    }

    private Formula parseImplies() throws FormulaSyntaxException {
        var left = parseOr();
        if (peek().is(IMPLIES)) {
            consume();
            descend();
            try {
                return Formula.implies(left, parseImplies());
            } finally {
                depth--;
            }
        }
        return left;
    }

    private Formula parseOr() throws FormulaSyntaxException {
        var left = parseAnd();
        while (peek().is(OR)) {
            consume();
            left = Formula.or(left, parseAnd());
        }
        return left;
    }

    private Formula parseAnd() throws FormulaSyntaxException {
        var left = parseTemporalBinary();
        while (peek().is(AND)) {
            consume();
            left = Formula.and(left, parseTemporalBinary());
        }
        return left;
    }

    private Formula parseTemporalBinary() throws FormulaSyntaxException {
        var left = parseUnary();
        while (true) {
            var op = infixOperator(peek());
            if (op == null) return left;
            consume();
            left = new Formula.BinaryTemporalFormula(op, left, parseUnary());
        }
    }

    @Nullable
    private static Formula.TemporalOperator infixOperator(Token t) {
        if (!t.is(RESERVED)) return null;
        return switch (t.text().charAt(0)) {
            case 'U' -> Formula.TemporalOperator.UNTIL;
            case 'S' -> Formula.TemporalOperator.SINCE;
            case 'W' -> Formula.TemporalOperator.WEAK_UNTIL;
            case 'R' -> Formula.TemporalOperator.RELEASE;
            default -> null;
        };
    }

    private Formula parseUnary() throws FormulaSyntaxException {
        descend();
        try {
            return unary();
        } finally {
            depth--;
        }
    }

    private Formula unary() throws FormulaSyntaxException {
        var t = peek();
        switch (t.type()) {
            case NOT -> {
                consume();
                return Formula.not(parseUnary());
            }
            case ALWAYS -> {
                consume();
                return Formula.always(parseUnary());
            }
            case EVENTUALLY -> {
                consume();
                return Formula.eventually(parseUnary());
            }
            case FORALL, EXISTS -> {
                return parseQuantified();
            }
            case RESERVED -> {
                return parseReserved();
            }
            case EOF -> throw error("Expected formula but found end of input");
            default -> {
                return parsePrimary();
            }
        }
    }

    private Formula parseReserved() throws FormulaSyntaxException {
        var letter = consume();
        var name = letter.text();
        if (!peek().is(LPAREN)) return new Formula.Predicate(name, List.of());

        var args = tryTermList();
        if (args != null) return new Formula.Predicate(name, args);

        if (infixOperator(letter) != null)
            throw Lexer.error(text, "Binary temporal operator '" + name + "' needs a left operand", letter.pos());

        consume();
        var body = parseIff();
        expect(RPAREN, "')' closing " + name + "(...)");
        return switch (name.charAt(0)) {
            case 'O' -> Formula.obligation(body);
            case 'P' -> Formula.permission(body);
            case 'F' -> Formula.prohibition(body);
            case 'X' -> Formula.next(body);
            case 'G' -> Formula.always(body);
            default -> throw Lexer.error(text, "Unknown operator '" + name + "'", letter.pos());
        };
    }

    /** Tries to read {@code (t1, ..., tn)}; on failure restores the position and returns null. */
    @Nullable
    private List<Term> tryTermList() {
        var mark = pos;
        try {
            return termList();
        } catch (FormulaSyntaxException e) {
            pos = mark;
            return null;
        }
    }

    private List<Term> termList() throws FormulaSyntaxException {
        expect(LPAREN, "'('");
        var args = new ArrayList<Term>();
        args.add(parseTerm());
        while (peek().is(COMMA)) {
            consume();
            args.add(parseTerm());
        }
        expect(RPAREN, "')' or ',' in argument list");
        return args;
    }

    private Formula parseQuantified() throws FormulaSyntaxException {
        var q = consume().is(FORALL) ? Formula.Quantifier.FORALL : Formula.Quantifier.EXISTS;
        var v = peek();
        String name;
        if (v.is(VARIABLE)) {
            name = v.text();
        } else if (v.is(IDENT) && isTermStart(v.text().charAt(0))) {
            name = v.text();
        } else {
            throw error("Malformed quantifier binding: expected variable name but found " + v.describe());
        }
        consume();
        String sort = null;
        if (peek().is(COLON)) {
            consume();
            var s = peek();
            if (!s.is(IDENT) && !s.is(RESERVED)) throw error("Expected sort name after ':' but found " + s.describe());
            sort = consume().text();
        }
        if (peek().is(DOT)) consume();
        var variable = new Term.Variable(name, sort);
        scope.push(variable);
        try {
            var body = parseIff();
            return new Formula.QuantifiedFormula(q, variable, body);
        } finally {
            scope.pop();
        }
    }

    private Formula parsePrimary() throws FormulaSyntaxException {
        var t = peek();
        if (t.is(LPAREN)) {
            consume();
            var inner = parseIff();
            expect(RPAREN, "')'");
            return inner;
        }
        if (t.is(IDENT)) {
            consume();
            if (peek().is(LPAREN)) return new Formula.Predicate(t.text(), termList());
            return new Formula.Predicate(t.text(), List.of());
        }
        throw error("Expected formula but found " + t.describe());
    }

    private static boolean isTermStart(char c) {
        return Character.isLowerCase(c) || c == '_' || Character.isDigit(c);
    }

    private Term parseTerm() throws FormulaSyntaxException {
        var t = peek();
        switch (t.type()) {
            case VARIABLE -> {
                consume();
                return bound(t.text()).orElseGet(() -> Term.var(t.text()));
            }
            case NUMBER -> {
                consume();
                return Term.constant(t.text());
            }
            case STRING -> {
                consume();
                return Term.constant(t.text());
            }
            case IDENT -> {
                if (!isTermStart(t.text().charAt(0)))
                    throw error("Term '" + t.text() + "' must start with a lowercase letter");
                consume();
                if (peek().is(LPAREN)) {
                    consume();
                    var args = new ArrayList<Term>();
                    args.add(parseTerm());
                    while (peek().is(COMMA)) {
                        consume();
                        args.add(parseTerm());
                    }
                    expect(RPAREN, "')' closing function arguments");
                    return new Term.FunctionApplication(t.text(), args);
                }
                return bound(t.text()).orElseGet(() -> Term.constant(t.text()));
            }
            default -> throw error("Expected term but found " + t.describe());
        }
    }

    private Optional<Term> bound(String name) {
        for (var v : scope)
            if (v.name().equals(name)) return Optional.of(v);
        return Optional.empty();
    }
}
