package org.javai.errata;

/**
 * Refines an {@link ErrorKind.Io} failure so callers can tell a missing file from other I/O trouble.
 */
public enum IoReason {
    NOT_FOUND("file_not_found"),
    ACCESS_DENIED("access_denied"),
    OTHER("io_error");

    private final String codeName;

    IoReason(String codeName) {
        this.codeName = codeName;
    }

    String codeName() {
        return codeName;
    }
}
