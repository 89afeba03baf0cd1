package org.javai.errata.boundary;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.util.Objects;
import org.javai.errata.Cause;
import org.javai.errata.DomainError;
import org.javai.errata.ErrorKind;
import org.javai.errata.IoReason;

/**
 * The conversion registry: the only sanctioned path from a foreign failure into {@link ErrorKind}.
 *
 * <p>Each foreign failure shape has one pure conversion function. {@link Boundary} applies them
 * through the typed {@link ErrorConverter} constants; domain operations call {@link #fromDomain}
 * directly.
 *
 * <p>{@link Integer#parseInt} and {@link Double#parseDouble} both throw
 * {@link NumberFormatException}, so the caller picks {@link #INTEGER_PARSE} or
 * {@link #FLOAT_PARSE} by what it was parsing.
 */
public final class ErrorConversions {

    public static final ErrorConverter<IOException> IO =
            ErrorConverter.of(IOException.class, ErrorConversions::fromIo);

    public static final ErrorConverter<NumberFormatException> INTEGER_PARSE =
            ErrorConverter.of(NumberFormatException.class, ErrorConversions::fromIntegerParse);

    public static final ErrorConverter<NumberFormatException> FLOAT_PARSE =
            ErrorConverter.of(NumberFormatException.class, ErrorConversions::fromFloatParse);

    private ErrorConversions() {
    }

    public static ErrorKind fromIo(IOException e) {
        Objects.requireNonNull(e, "exception must not be null");
        return new ErrorKind.Io(reasonFor(e), Cause.fromThrowable(e));
    }

    public static ErrorKind fromIntegerParse(NumberFormatException e) {
        Objects.requireNonNull(e, "exception must not be null");
        return new ErrorKind.Parse(Cause.fromThrowable(e));
    }

    public static ErrorKind fromFloatParse(NumberFormatException e) {
        Objects.requireNonNull(e, "exception must not be null");
        return new ErrorKind.ParseFloat(Cause.fromThrowable(e));
    }

    public static ErrorKind fromDomain(DomainError error) {
        Objects.requireNonNull(error, "error must not be null");
        return new ErrorKind.Domain(error);
    }

    private static IoReason reasonFor(IOException e) {
        if (e instanceof FileNotFoundException || e instanceof NoSuchFileException) {
            return IoReason.NOT_FOUND;
        }
        if (e instanceof AccessDeniedException) {
            return IoReason.ACCESS_DENIED;
        }
        return IoReason.OTHER;
    }
}
