package org.javai.errata.boundary;

/**
 * A supplier that may throw an exception.
 * Used by {@link Boundary} to wrap calls into collaborators that report failure by throwing.
 *
 * @param <T> The type of value supplied
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    T get() throws E;
}
