package dumb.tdfol.backend;

/**
 * External decision procedure (an SMT solver process, for example) used as a stateless oracle.
 */
public interface ProverBackend {
    String name();

    BackendResult prove(String formulaText);
}
