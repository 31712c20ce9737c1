package dumb.tdfol;

/**
 * A proof procedure met a connective it has no rule for. Strategies report it as an UNKNOWN result.
 */
public class UnsupportedConstructException extends RuntimeException {
    private final transient Formula construct;

    public UnsupportedConstructException(String message, Formula construct) {
        super(message + ": " + construct.toText());
        this.construct = construct;
    }

    public Formula construct() {
        return construct;
    }
}
