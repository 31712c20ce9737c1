package dumb.tdfol.prove;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.tdfol.parse.ParseLimits;
import dumb.tdfol.util.Json;
import dumb.tdfol.util.Log;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Prover settings. Missing JSON fields take their defaults.
 */
public record ProverConfig(
        @JsonProperty("timeoutMs") long timeoutMs,
        @JsonProperty("maxDepth") int maxDepth,
        @JsonProperty("strategy") Strategy strategy,
        @JsonProperty("useCache") boolean useCache,
        @JsonProperty("cacheMaxSize") int cacheMaxSize,
        @JsonProperty("cacheTtl") Duration cacheTtl,
        @JsonProperty("maxBranches") int maxBranches,
        @JsonProperty("maxWorlds") int maxWorlds,
        @JsonProperty("maxKnownFormulas") int maxKnownFormulas,
        @JsonProperty("maxFormulaLength") int maxFormulaLength,
        @JsonProperty("maxFormulaDepth") int maxFormulaDepth
) {
    public static final String RESOURCE = "tdfol.json";

    public static final long DEFAULT_TIMEOUT_MS = 5000;
    public static final int DEFAULT_MAX_DEPTH = 10;
    public static final int DEFAULT_CACHE_MAX_SIZE = 1000;
    public static final Duration DEFAULT_CACHE_TTL = Duration.ofHours(1);
    public static final int DEFAULT_MAX_BRANCHES = 2000;
    public static final int DEFAULT_MAX_WORLDS = 64;
    public static final int DEFAULT_MAX_KNOWN_FORMULAS = 5000;
    public static final int DEFAULT_MAX_FORMULA_LENGTH = ParseLimits.DEFAULT.maxLength();
    public static final int DEFAULT_MAX_FORMULA_DEPTH = ParseLimits.DEFAULT.maxDepth();

    @JsonCreator
    public ProverConfig(
            @JsonProperty("timeoutMs") Long timeoutMs,
            @JsonProperty("maxDepth") Integer maxDepth,
            @JsonProperty("strategy") Strategy strategy,
            @JsonProperty("useCache") Boolean useCache,
            @JsonProperty("cacheMaxSize") Integer cacheMaxSize,
            @JsonProperty("cacheTtl") Duration cacheTtl,
            @JsonProperty("maxBranches") Integer maxBranches,
            @JsonProperty("maxWorlds") Integer maxWorlds,
            @JsonProperty("maxKnownFormulas") Integer maxKnownFormulas,
            @JsonProperty("maxFormulaLength") Integer maxFormulaLength,
            @JsonProperty("maxFormulaDepth") Integer maxFormulaDepth
    ) {
        this(
                timeoutMs != null ? timeoutMs : DEFAULT_TIMEOUT_MS,
                maxDepth != null ? maxDepth : DEFAULT_MAX_DEPTH,
                strategy != null ? strategy : Strategy.AUTO,
                useCache != null ? useCache : true,
                cacheMaxSize != null ? cacheMaxSize : DEFAULT_CACHE_MAX_SIZE,
                cacheTtl != null ? cacheTtl : DEFAULT_CACHE_TTL,
                maxBranches != null ? maxBranches : DEFAULT_MAX_BRANCHES,
                maxWorlds != null ? maxWorlds : DEFAULT_MAX_WORLDS,
                maxKnownFormulas != null ? maxKnownFormulas : DEFAULT_MAX_KNOWN_FORMULAS,
                maxFormulaLength != null ? maxFormulaLength : DEFAULT_MAX_FORMULA_LENGTH,
                maxFormulaDepth != null ? maxFormulaDepth : DEFAULT_MAX_FORMULA_DEPTH
        );
    }

    public ProverConfig() {
        this(DEFAULT_TIMEOUT_MS, DEFAULT_MAX_DEPTH, Strategy.AUTO, true, DEFAULT_CACHE_MAX_SIZE, DEFAULT_CACHE_TTL,
                DEFAULT_MAX_BRANCHES, DEFAULT_MAX_WORLDS, DEFAULT_MAX_KNOWN_FORMULAS,
                DEFAULT_MAX_FORMULA_LENGTH, DEFAULT_MAX_FORMULA_DEPTH);
    }

    public ProverConfig {
        if (timeoutMs < 0) throw new IllegalArgumentException("timeoutMs must not be negative");
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must not be negative");
        if (cacheMaxSize < 1) throw new IllegalArgumentException("cacheMaxSize must be positive");
        if (maxFormulaLength < 1 || maxFormulaDepth < 1)
            throw new IllegalArgumentException("formula limits must be positive");
    }

    public static ProverConfig fromJson(String json) throws JsonProcessingException {
        return Json.read(json, ProverConfig.class);
    }

    public static ProverConfig load(Path file) throws IOException {
        return fromJson(Files.readString(file));
    }

    /** {@value #RESOURCE} from the classpath, or the defaults when it is absent or unreadable. */
    public static ProverConfig load() {
        try (InputStream in = ProverConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) return new ProverConfig();
            return Json.read(in, ProverConfig.class);
        } catch (IOException e) {
            Log.warning("Could not read " + RESOURCE + ", using defaults: " + e.getMessage());
            return new ProverConfig();
        }
    }

    public ProverConfig withStrategy(Strategy s) {
        return new ProverConfig(timeoutMs, maxDepth, s, useCache, cacheMaxSize, cacheTtl, maxBranches, maxWorlds, maxKnownFormulas,
                maxFormulaLength, maxFormulaDepth);
    }

    public ProverConfig withTimeout(long ms) {
        return new ProverConfig(ms, maxDepth, strategy, useCache, cacheMaxSize, cacheTtl, maxBranches, maxWorlds, maxKnownFormulas,
                maxFormulaLength, maxFormulaDepth);
    }

    /** Bounds applied to formula text handed to the prover. */
    public ParseLimits parseLimits() {
        return new ParseLimits(maxFormulaLength, maxFormulaDepth);
    }

    public String toJson() {
        return Json.write(this);
    }
}
