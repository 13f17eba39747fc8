package org.tarik.resilience.exceptions;

import org.tarik.resilience.error.FailureKind;

import static java.util.Objects.requireNonNull;

/**
 * Base exception of the platform. Every instance is tagged with the {@link FailureKind} detected at the place
 * where the failure happened, so that retry decisions can be taken on the kind instead of the Java type.
 */
public class PlatformException extends RuntimeException {
    private final FailureKind kind;

    public PlatformException(String message, FailureKind kind) {
        super(message);
        this.kind = requireNonNull(kind, "Failure kind must be provided");
    }

    public PlatformException(String message, FailureKind kind, Throwable cause) {
        super(message, cause);
        this.kind = requireNonNull(kind, "Failure kind must be provided");
    }

    public FailureKind getKind() {
        return kind;
    }

    public boolean isA(FailureKind other) {
        return kind.isA(other);
    }

    @Override
    public String toString() {
        return "%s[%s]: %s".formatted(getClass().getSimpleName(), kind, getMessage());
    }
}
