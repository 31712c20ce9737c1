package dumb.tdfol.backend;

import dumb.tdfol.ProofStatus;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

public record BackendResult(ProofStatus status, @Nullable String detail) {
    public BackendResult {
        requireNonNull(status);
    }

    public static BackendResult of(boolean valid) {
        return new BackendResult(valid ? ProofStatus.PROVED : ProofStatus.UNKNOWN, null);
    }
}
