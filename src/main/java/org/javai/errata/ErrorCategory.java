package org.javai.errata;

/**
 * The closed set of failure categories an {@link ErrorKind} can belong to.
 */
public enum ErrorCategory {
    /**
     * Storage-layer failure: file missing, unreadable, permission denied.
     */
    IO("I/O error"),

    /**
     * Text did not match the integer grammar.
     */
    PARSE("Parse error"),

    /**
     * Text did not match the floating-point grammar.
     */
    PARSE_FLOAT("Float parse error"),

    /**
     * A numeric operation's precondition was violated.
     */
    DOMAIN("Domain error");

    private final String label;

    ErrorCategory(String label) {
        this.label = label;
    }

    /**
     * Returns the human-readable name used as the prefix of {@link ErrorKind#describe()}.
     */
    public String label() {
        return label;
    }
}
