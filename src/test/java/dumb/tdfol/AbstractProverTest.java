package dumb.tdfol;

import dumb.tdfol.backend.BackendRegistry;
import dumb.tdfol.cache.ProofCache;
import dumb.tdfol.dcec.DcecBridge;
import dumb.tdfol.parse.FormulaParser;
import dumb.tdfol.parse.FormulaSyntaxException;
import dumb.tdfol.prove.Prover;
import dumb.tdfol.prove.ProverConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import static org.junit.jupiter.api.Assertions.fail;

/**
 * Fresh knowledge base, cache and prover for every test.
 */
public abstract class AbstractProverTest {

    protected KnowledgeBase kb;
    protected ProofCache cache;
    protected BackendRegistry registry;
    protected Prover prover;

    @BeforeEach
    void setUp() {
        kb = new KnowledgeBase();
        cache = new ProofCache();
        registry = new BackendRegistry().register(new DcecBridge());
        prover = new Prover(kb, cache, new ProverConfig(), registry);
    }

    @AfterEach
    void tearDown() {
        cache.clear();
        ProofCache.resetShared();
    }

    protected static Formula parse(String text) {
        try {
            return FormulaParser.parse(text);
        } catch (FormulaSyntaxException e) {
            fail("Failed to parse formula:\n" + text + "\n" + e.getMessage());
            return null;
        }
    }

    protected void axioms(String... texts) {
        for (var t : texts) kb.addAxiom(parse(t));
    }

    protected ProofResult prove(String text) {
        return prover.prove(parse(text));
    }
}
