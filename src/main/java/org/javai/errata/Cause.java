package org.javai.errata;

import java.util.Objects;

/**
 * Snapshot of a foreign exception, taken when it is converted into an {@link ErrorKind}.
 * Holds everything needed to describe the failure without keeping the exception itself.
 *
 * @param type The exception class name
 * @param fingerprint A stable identifier for deduplication (exception type plus top stack frame)
 * @param detail The exception message, verbatim (may be null)
 */
public record Cause(String type, String fingerprint, String detail) {

    public Cause {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
    }

    public static Cause fromThrowable(Throwable t) {
        Objects.requireNonNull(t, "throwable must not be null");
        return new Cause(t.getClass().getName(), computeFingerprint(t), t.getMessage());
    }

    /**
     * Returns the detail, or the exception type when the exception carried no message.
     */
    public String describe() {
        return detail != null ? detail : type;
    }

    private static String computeFingerprint(Throwable t) {
        StackTraceElement[] stack = t.getStackTrace();
        if (stack.length == 0) {
            return t.getClass().getName();
        }
        StackTraceElement top = stack[0];
        return t.getClass().getSimpleName() + "@" + top.getClassName() + ":" + top.getLineNumber();
    }
}
