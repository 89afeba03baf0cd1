package org.javai.errata.boundary;

/**
 * A function that may throw an exception.
 *
 * @param <I> The input type
 * @param <T> The result type
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingFunction<I, T, E extends Exception> {

    T apply(I input) throws E;
}
