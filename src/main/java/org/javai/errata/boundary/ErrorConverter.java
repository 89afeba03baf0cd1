package org.javai.errata.boundary;

import java.util.Objects;
import java.util.function.Function;
import org.javai.errata.ErrorKind;

/**
 * Converts one foreign exception type into the {@link ErrorKind} taxonomy.
 * Conversion is total: every instance of {@link #sourceType()} maps to exactly one kind.
 *
 * <p>The registry of sanctioned converters is {@link ErrorConversions}.
 *
 * @param <E> The foreign exception type this converter accepts
 */
public interface ErrorConverter<E extends Exception> {

    /**
     * The exception type this converter accepts. {@link Boundary} converts only instances of it.
     */
    Class<E> sourceType();

    /**
     * Converts the exception into a taxonomy member.
     *
     * @param failure the foreign exception
     * @return the canonical kind, never null
     */
    ErrorKind convert(E failure);

    /**
     * Creates a converter from a source type and a conversion function.
     */
    static <E extends Exception> ErrorConverter<E> of(Class<E> sourceType, Function<? super E, ? extends ErrorKind> conversion) {
        Objects.requireNonNull(sourceType, "sourceType must not be null");
        Objects.requireNonNull(conversion, "conversion must not be null");
        return new ErrorConverter<>() {
            @Override
            public Class<E> sourceType() {
                return sourceType;
            }

            @Override
            public ErrorKind convert(E failure) {
                return Objects.requireNonNull(conversion.apply(failure), "conversion must not return null");
            }

            @Override
            public String toString() {
                return "ErrorConverter[" + sourceType.getSimpleName() + "]";
            }
        };
    }
}
