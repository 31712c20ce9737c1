package dumb.tdfol;

public enum ProofStatus {
    PROVED, DISPROVED, UNKNOWN, TIMEOUT;

    public boolean conclusive() {
        return this == PROVED || this == DISPROVED;
    }
}
