package org.javai.errata.ops;

import org.javai.errata.ErrorKind;

/**
 * Reports converted failures for operator visibility.
 * {@link org.javai.errata.boundary.Boundary} calls it once per failure it converts.
 */
@FunctionalInterface
public interface OpReporter {

    /**
     * Reports a failure occurrence.
     *
     * @param operation The operation that failed (e.g., "Storage.readText")
     * @param kind The converted failure
     */
    void report(String operation, ErrorKind kind);

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static OpReporter noOp() {
        return (operation, kind) -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     *
     * @param reporters the reporters to delegate to
     * @return a composite reporter
     */
    static OpReporter composite(OpReporter... reporters) {
        return CompositeOpReporter.of(reporters);
    }
}
