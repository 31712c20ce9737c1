package dumb.tdfol.backend;

import dumb.tdfol.Formula;
import dumb.tdfol.parse.FormulaSyntaxException;

/**
 * An alternate concrete syntax that maps onto the same formula AST.
 */
public interface SyntaxBridge {
    String name();

    Formula parse(String text) throws FormulaSyntaxException;

    String format(Formula formula);
}
