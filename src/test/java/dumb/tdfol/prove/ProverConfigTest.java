package dumb.tdfol.prove;

import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.tdfol.parse.ParseLimits;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ProverConfigTest {

    @Test
    void defaults() {
        var c = new ProverConfig();
        assertEquals(5000, c.timeoutMs());
        assertEquals(10, c.maxDepth());
        assertEquals(Strategy.AUTO, c.strategy());
        assertTrue(c.useCache());
        assertEquals(1000, c.cacheMaxSize());
        assertEquals(Duration.ofHours(1), c.cacheTtl());
        assertEquals(ParseLimits.DEFAULT, c.parseLimits());
    }

    @Test
    void classpathResourceMatchesDefaults() {
        assertEquals(new ProverConfig(), ProverConfig.load());
    }

    @Test
    void missingFieldsTakeDefaults() throws JsonProcessingException {
        var c = ProverConfig.fromJson("{\"maxDepth\": 3, \"strategy\": \"backward-chaining\", \"cacheTtl\": \"PT10M\"}");
        assertEquals(3, c.maxDepth());
        assertEquals(Strategy.BACKWARD, c.strategy());
        assertEquals(Duration.ofMinutes(10), c.cacheTtl());
        assertEquals(ProverConfig.DEFAULT_TIMEOUT_MS, c.timeoutMs());
        assertEquals(ProverConfig.DEFAULT_MAX_WORLDS, c.maxWorlds());
    }

    @Test
    void jsonRoundTrip() throws JsonProcessingException {
        var c = new ProverConfig().withStrategy(Strategy.HYBRID).withTimeout(250);
        assertEquals(c, ProverConfig.fromJson(c.toJson()));
    }

    @Test
    void invalidValuesRejected() {
        assertThrows(JsonProcessingException.class, () -> ProverConfig.fromJson("{\"maxDepth\": -1}"));
        assertThrows(JsonProcessingException.class, () -> ProverConfig.fromJson("{\"strategy\": \"guess\"}"));
        assertThrows(IllegalArgumentException.class, () -> new ProverConfig().withTimeout(-5));
        assertThrows(JsonProcessingException.class, () -> ProverConfig.fromJson("{\"maxFormulaDepth\": 0}"));
    }

    @ParameterizedTest
    @CsvSource({
            "auto, AUTO",
            "FORWARD, FORWARD",
            "forward_chaining, FORWARD",
            "Backward, BACKWARD",
            "modal-tableaux, MODAL_TABLEAUX",
            "tableaux, MODAL_TABLEAUX",
            "hybrid, HYBRID"
    })
    void strategyNames(String text, Strategy expected) {
        assertEquals(expected, Strategy.parse(text));
    }
}
