package dumb.tdfol.prove;

/**
 * Time and depth allowance of one proof call. Strategies call {@link #check()} at every expansion or
 * chaining step.
 */
public final class Budget {

    private final long startNanos;
    private final long deadlineNanos;
    private final int maxDepth;

    private Budget(long timeoutMs, int maxDepth) {
        this.startNanos = System.nanoTime();
        this.deadlineNanos = startNanos + Math.max(0, timeoutMs) * 1_000_000L;
        this.maxDepth = Math.max(0, maxDepth);
    }

    public static Budget of(long timeoutMs, int maxDepth) {
        return new Budget(timeoutMs, maxDepth);
    }

    public boolean expired() {
        return System.nanoTime() - deadlineNanos >= 0;
    }

    public void check() {
        if (expired()) throw new Exhausted();
    }

    public boolean depthExceeded(int depth) {
        return depth > maxDepth;
    }

    public int maxDepth() {
        return maxDepth;
    }

    public long elapsedMillis() {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    public long remainingMillis() {
        return Math.max(0, (deadlineNanos - System.nanoTime()) / 1_000_000L);
    }

    /** Thrown by {@link #check()}; strategies turn it into a TIMEOUT result. */
    public static final class Exhausted extends RuntimeException {
        Exhausted() {
            super("Proof budget exhausted", null, false, false);
        }
    }
}
