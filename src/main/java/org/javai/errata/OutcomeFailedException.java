package org.javai.errata;

/**
 * Thrown when {@link Outcome#getOrThrow()} is called on a failed outcome.
 * Unchecked: the caller should have checked {@link Outcome#isFail()} first or used pattern matching.
 */
public class OutcomeFailedException extends RuntimeException {

    private final transient ErrorKind kind;

    public OutcomeFailedException(ErrorKind kind) {
        super("Outcome failed: " + kind.describe());
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
