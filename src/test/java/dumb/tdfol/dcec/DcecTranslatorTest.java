package dumb.tdfol.dcec;

import dumb.tdfol.AbstractProverTest;
import dumb.tdfol.parse.FormulaSyntaxException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class DcecTranslatorTest extends AbstractProverTest {

    @ParameterizedTest
    @CsvSource(delimiterString = "::", value = {
            "(forall (x) (implies (Human x) (Mortal x))) :: forall x. (Human(x) -> Mortal(x))",
            "(and A B C) :: (A & B) & C",
            "(or A (not B)) :: A | ~B",
            "(iff A B) :: A <-> B",
            "(O agent t (not (Eat agent))) :: O(~Eat(agent))",
            "(P agent t (Speak agent)) :: P(Speak(agent))",
            "(forbidden (Steal bob)) :: F(Steal(bob))",
            "(always (eventually A)) :: []<>A",
            "(next A) :: X(A)",
            "(until A B) :: A U B",
            "(release A B) :: A R B",
            "(exists ?y (Loves ?y john)) :: exists y. Loves(y, john)",
            "(Loves ?z (mother john)) :: Loves(?z, mother(john))"
    })
    void translates(String dcec, String expected) throws FormulaSyntaxException {
        assertEquals(parse(expected), DcecTranslator.toFormula(dcec));
    }

    @Test
    void commentsAreSkipped() throws FormulaSyntaxException {
        assertEquals(parse("[]A"), DcecTranslator.toFormula("; invariant\n(always A) ; trailing"));
    }

    @Test
    void formatsAsSexpr() throws FormulaSyntaxException {
        var f = parse("forall x. (Human(x) -> O(Mortal(x)))");
        var text = DcecTranslator.toDcec(f);
        assertEquals("(forall (x) (implies (Human x) (O (Mortal x))))", text);
        assertEquals(f, DcecTranslator.toFormula(text));
    }

    @ParameterizedTest
    @ValueSource(strings = {"(and A", "", "(A) (B)", "()", "(not A B)", "(forall () A)", ")"})
    void malformedInput(String text) {
        assertThrows(FormulaSyntaxException.class, () -> DcecTranslator.toFormula(text));
    }

    @Test
    void readerReportsPosition() {
        var e = assertThrows(FormulaSyntaxException.class, () -> SexprReader.read("(a\n  (b \"x\\q\"))"));
        assertEquals(2, e.line());
    }

    @Test
    void bridgeDelegates() throws FormulaSyntaxException {
        var bridge = new DcecBridge();
        assertEquals(DcecBridge.NAME, bridge.name());
        var f = bridge.parse("(implies A B)");
        assertEquals("(implies A B)", bridge.format(f));
    }
}
