package org.javai.errata.boundary;

import java.util.Objects;
import org.javai.errata.ErrorKind;
import org.javai.errata.Outcome;
import org.javai.errata.ops.OpReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The boundary adapter for collaborators that signal failure by throwing.
 * Runs the work, converts the expected exception through an {@link ErrorConverter}, reports the
 * converted kind, and returns an {@link Outcome}.
 *
 * <p>This is the single point where foreign exceptions are translated into the taxonomy.
 * After passing through a Boundary, code operates entirely in outcome-space.</p>
 *
 * <p>Exceptions outside the converter's source type are defects and are not caught: runtime
 * exceptions propagate unchanged. A reporter that throws is logged and does not change the
 * returned outcome.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Boundary boundary = Boundary.withReporter(new Log4jOpReporter());
 *
 * Outcome<String> text = boundary.call(
 *     "Storage.readText",
 *     ErrorConversions.IO,
 *     () -> storage.readText(path)
 * );
 * }</pre>
 */
public final class Boundary {

    private static final Logger LOG = LoggerFactory.getLogger(Boundary.class);

    private final OpReporter reporter;

    /**
     * Creates a silent Boundary that converts failures but does not report them.
     *
     * @return a Boundary with no reporting
     */
    public static Boundary silent() {
        return new Boundary(OpReporter.noOp());
    }

    /**
     * Creates a Boundary that reports every converted failure.
     *
     * @param reporter the reporter for failure notifications
     * @return a Boundary with the given reporting
     */
    public static Boundary withReporter(OpReporter reporter) {
        return new Boundary(reporter);
    }

    public Boundary(OpReporter reporter) {
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * Executes work that may throw, translating the converter's exception type into an Outcome.
     *
     * @param operation The operation name for context and reporting
     * @param converter Converts the expected exception into an {@link ErrorKind}
     * @param work The work to execute
     * @return Ok with the result, or Fail with the converted kind
     */
    public <T, E extends Exception> Outcome<T> call(
            String operation,
            ErrorConverter<E> converter,
            ThrowingSupplier<? extends T, ? extends E> work
    ) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(converter, "converter must not be null");
        Objects.requireNonNull(work, "work must not be null");

        try {
            return Outcome.ok(work.get());
        } catch (Exception e) {
            if (converter.sourceType().isInstance(e)) {
                return handleException(operation, converter, converter.sourceType().cast(e));
            }
            if (e instanceof RuntimeException re) {
                throw re;
            }
            // Only reachable when work throws a checked exception its signature hides
            throw new IllegalStateException("Unconverted exception in operation [" + operation + "]", e);
        }
    }

    /**
     * Applies a throwing function to an input through this boundary.
     *
     * @see #call(String, ErrorConverter, ThrowingSupplier)
     */
    public <I, T, E extends Exception> Outcome<T> apply(
            String operation,
            ErrorConverter<E> converter,
            ThrowingFunction<? super I, ? extends T, ? extends E> function,
            I input
    ) {
        Objects.requireNonNull(function, "function must not be null");
        return call(operation, converter, () -> function.apply(input));
    }

    private <T, E extends Exception> Outcome<T> handleException(String operation, ErrorConverter<E> converter, E e) {
        ErrorKind kind = converter.convert(e);
        try {
            reporter.report(operation, kind);
        } catch (RuntimeException reportFailure) {
            LOG.warn("OpReporter.report failed for operation [{}] ({}): {}",
                    operation, kind.code(), reportFailure.getMessage(), reportFailure);
        }
        return Outcome.fail(kind);
    }
}
