package dumb.tdfol.dcec;

import dumb.tdfol.Formula;
import dumb.tdfol.backend.SyntaxBridge;
import dumb.tdfol.parse.FormulaSyntaxException;

/**
 * Registers DCEC S-expression syntax with a {@link dumb.tdfol.backend.BackendRegistry}.
 */
public class DcecBridge implements SyntaxBridge {

    public static final String NAME = "dcec";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Formula parse(String text) throws FormulaSyntaxException {
        return DcecTranslator.toFormula(text);
    }

    @Override
    public String format(Formula formula) {
        return DcecTranslator.toDcec(formula);
    }
}
