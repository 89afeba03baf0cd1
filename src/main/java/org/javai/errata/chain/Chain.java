package org.javai.errata.chain;

import java.util.Objects;
import org.javai.errata.Outcome;
import org.javai.errata.boundary.Boundary;
import org.javai.errata.boundary.ErrorConverter;
import org.javai.errata.boundary.ThrowingFunction;

/**
 * An ordered, fail-fast composition of {@link Step}s.
 *
 * <p>Steps run strictly left to right and each receives the previous step's value. The first
 * failing step ends the run: no later step executes and its {@link org.javai.errata.ErrorKind}
 * becomes the result. A chain with no steps returns its input.
 *
 * <p>Chains are immutable; {@link #then(Step)} returns a new chain sharing this one's steps.
 * Running a chain is iterative, so its length is not bounded by the call stack.
 *
 * <pre>{@code
 * Chain<Path, Double> chain = Chain.<Path>start()
 *     .thenCall("Storage.readText", boundary, ErrorConversions.IO, storage::readText)
 *     .thenCall("Double.parseDouble", boundary, ErrorConversions.FLOAT_PARSE, Double::parseDouble)
 *     .then(Arithmetic::sqrt);
 * }</pre>
 *
 * @param <I> The input type of the first step
 * @param <O> The value type of the last step
 */
public final class Chain<I, O> {

    private final Chain<I, ?> previous;
    private final Step<Object, Object> step;
    private final int length;

    private Chain(Chain<I, ?> previous, Step<Object, Object> step, int length) {
        this.previous = previous;
        this.step = step;
        this.length = length;
    }

    /**
     * Creates the empty chain, which returns its input unchanged.
     */
    public static <T> Chain<T, T> start() {
        return new Chain<>(null, null, 0);
    }

    /**
     * Creates a chain of one step.
     */
    public static <I, O> Chain<I, O> of(Step<I, O> step) {
        return Chain.<I>start().then(step);
    }

    /**
     * Appends a step that receives this chain's value.
     */
    @SuppressWarnings("unchecked")
    public <R> Chain<I, R> then(Step<? super O, R> step) {
        Objects.requireNonNull(step, "step must not be null");
        return new Chain<>(this, (Step<Object, Object>) (Step<?, ?>) step, length + 1);
    }

    /**
     * Appends a throwing function, converting the converter's exception type through the boundary.
     *
     * @param operation The operation name reported on failure
     * @param boundary The boundary that converts and reports the failure
     * @param converter The conversion for the function's exception type
     * @param function The foreign function
     */
    public <R, E extends Exception> Chain<I, R> thenCall(
            String operation,
            Boundary boundary,
            ErrorConverter<E> converter,
            ThrowingFunction<? super O, ? extends R, ? extends E> function
    ) {
        Objects.requireNonNull(boundary, "boundary must not be null");
        return then(value -> boundary.apply(operation, converter, function, value));
    }

    /**
     * Runs the chain on {@code input}.
     *
     * @return the last step's value, or the first failure
     */
    @SuppressWarnings("unchecked")
    public Outcome<O> run(I input) {
        Object value = input;
        for (Step<Object, Object> next : steps()) {
            Outcome<Object> result = Objects.requireNonNull(next.apply(value), "step must not return null");
            if (result.isFail()) {
                return (Outcome<O>) (Outcome<?>) result;
            }
            value = result.getOrThrow();
        }
        return Outcome.ok((O) value);
    }

    /**
     * Returns the number of steps in this chain.
     */
    public int length() {
        return length;
    }

    @SuppressWarnings("unchecked")
    private Step<Object, Object>[] steps() {
        Step<Object, Object>[] steps = new Step[length];
        Chain<I, ?> node = this;
        for (int i = length - 1; i >= 0; i--) {
            steps[i] = node.step;
            node = node.previous;
        }
        return steps;
    }
}
