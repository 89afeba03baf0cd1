package org.javai.errata.chain;

import org.javai.errata.Outcome;

/**
 * One link of a {@link Chain}: maps an input to a value or an {@link org.javai.errata.ErrorKind}.
 * Implementations report failure by returning {@code Outcome.Fail}, never by throwing.
 *
 * @param <I> The input type
 * @param <O> The success value type
 */
@FunctionalInterface
public interface Step<I, O> {

    Outcome<O> apply(I input);
}
