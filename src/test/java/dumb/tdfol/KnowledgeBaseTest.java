package dumb.tdfol;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KnowledgeBaseTest extends AbstractProverTest {

    @Test
    void axiomsAreOrderedAndUnique() {
        assertTrue(kb.addAxiom(parse("B")));
        assertTrue(kb.addAxiom(parse("A"), "second"));
        assertFalse(kb.addAxiom(parse("B")));
        assertEquals(List.of(parse("B"), parse("A")), kb.axioms());
        assertEquals("second", kb.nameOf(parse("A")).orElseThrow());
        assertTrue(kb.nameOf(parse("B")).isEmpty());
    }

    @Test
    void theoremsFollowAxiomsInPremises() {
        kb.addTheorem(parse("C"));
        kb.addAxiom(parse("A"));
        assertEquals(List.of(parse("A"), parse("C")), kb.snapshot().all());
        assertTrue(kb.isTheorem(parse("C")));
        assertFalse(kb.isAxiom(parse("C")));
        assertEquals(2, kb.size());
    }

    @Test
    void snapshotIsDetached() {
        kb.addAxiom(parse("A"));
        var s = kb.snapshot();
        kb.addAxiom(parse("B"));
        assertEquals(1, s.size());
        assertFalse(s.isAxiom(parse("B")));
        assertThrows(UnsupportedOperationException.class, () -> s.axioms().add(parse("C")));
    }

    @Test
    void constructedFromCollection() {
        var k = new KnowledgeBase(List.of(parse("A"), parse("A"), parse("B")));
        assertEquals(2, k.size());
        assertFalse(k.isEmpty());
    }
}
