package dumb.tdfol.parse;

/**
 * Upper bounds on formula text accepted by {@link FormulaParser}: the number of characters and the nesting depth
 * of operators and parentheses.
 */
public record ParseLimits(int maxLength, int maxDepth) {

    public static final ParseLimits DEFAULT = new ParseLimits(10_000, 100);

    public ParseLimits {
        if (maxLength < 1) throw new IllegalArgumentException("maxLength must be positive: " + maxLength);
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
    }
}
