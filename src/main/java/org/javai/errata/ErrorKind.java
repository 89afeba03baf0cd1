package org.javai.errata;

import java.util.Objects;

/**
 * The canonical failure taxonomy. Every failure that leaves a {@link org.javai.errata.boundary.Boundary}
 * or a domain operation is exactly one of these cases.
 *
 * <p>Instances are created through {@link org.javai.errata.boundary.ErrorConversions}; downstream
 * code never inspects the foreign exception that produced them. Each case carries enough detail to
 * render itself via {@link #describe()}.
 *
 * <pre>{@code
 * if (kind instanceof ErrorKind.Io io && io.reason() == IoReason.NOT_FOUND) {
 *     // create the file
 * }
 * }</pre>
 */
public sealed interface ErrorKind permits ErrorKind.Io, ErrorKind.Parse, ErrorKind.ParseFloat, ErrorKind.Domain {

    /**
     * A storage-layer failure.
     *
     * @param reason what went wrong at the storage layer
     * @param cause the originating exception snapshot
     */
    record Io(IoReason reason, Cause cause) implements ErrorKind {

        public Io {
            Objects.requireNonNull(reason, "reason must not be null");
            Objects.requireNonNull(cause, "cause must not be null");
        }

        @Override
        public ErrorCategory category() {
            return ErrorCategory.IO;
        }

        @Override
        public FailureCode code() {
            return FailureCode.of("io", reason.codeName());
        }

        @Override
        public String detail() {
            return cause.describe();
        }
    }

    /**
     * Text that did not parse as an integer.
     *
     * @param cause the originating exception snapshot, whose detail names the rejected text
     */
    record Parse(Cause cause) implements ErrorKind {

        public Parse {
            Objects.requireNonNull(cause, "cause must not be null");
        }

        @Override
        public ErrorCategory category() {
            return ErrorCategory.PARSE;
        }

        @Override
        public FailureCode code() {
            return FailureCode.of("parse", "invalid_integer");
        }

        @Override
        public String detail() {
            return cause.describe();
        }
    }

    /**
     * Text that did not parse as a floating-point number.
     *
     * @param cause the originating exception snapshot, whose detail names the rejected text
     */
    record ParseFloat(Cause cause) implements ErrorKind {

        public ParseFloat {
            Objects.requireNonNull(cause, "cause must not be null");
        }

        @Override
        public ErrorCategory category() {
            return ErrorCategory.PARSE_FLOAT;
        }

        @Override
        public FailureCode code() {
            return FailureCode.of("parse", "invalid_float");
        }

        @Override
        public String detail() {
            return cause.describe();
        }
    }

    /**
     * A violated precondition of a numeric operation.
     *
     * @param error which precondition was violated
     */
    record Domain(DomainError error) implements ErrorKind {

        public Domain {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public ErrorCategory category() {
            return ErrorCategory.DOMAIN;
        }

        @Override
        public FailureCode code() {
            return FailureCode.of("domain", error.codeName());
        }

        @Override
        public String detail() {
            return error.description();
        }
    }

    ErrorCategory category();

    FailureCode code();

    /**
     * Returns the description of the originating failure, verbatim.
     */
    String detail();

    /**
     * Renders this failure as {@code "<category>: <detail>"}.
     */
    default String describe() {
        return category().label() + ": " + detail();
    }
}
