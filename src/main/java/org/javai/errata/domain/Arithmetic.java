package org.javai.errata.domain;

import org.javai.errata.DomainError;
import org.javai.errata.Outcome;
import org.javai.errata.boundary.ErrorConversions;

/**
 * Numeric operations with named preconditions.
 *
 * <p>Every input maps to either a value or exactly one {@link DomainError}. Inputs that violate no
 * precondition are passed to IEEE 754 arithmetic unchanged, so NaN and infinities flow through as
 * ordinary values.
 */
public final class Arithmetic {

    private Arithmetic() {
    }

    /**
     * Divides {@code a} by {@code b}.
     *
     * @return {@code a / b}, or {@link DomainError#DIVISION_BY_ZERO} when {@code b} is zero (either sign)
     */
    public static Outcome<Double> divide(double a, double b) {
        if (b == 0.0) {
            return fail(DomainError.DIVISION_BY_ZERO);
        }
        return Outcome.ok(a / b);
    }

    /**
     * Returns the principal square root of {@code x}.
     *
     * @return {@code √x}, or {@link DomainError#NEGATIVE_SQUARE_ROOT} when {@code x < 0}
     */
    public static Outcome<Double> sqrt(double x) {
        if (x < 0.0) {
            return fail(DomainError.NEGATIVE_SQUARE_ROOT);
        }
        return Outcome.ok(Math.sqrt(x));
    }

    /**
     * Multiplies {@code a} by {@code b}.
     *
     * @return {@code a * b}, or {@link DomainError#OVERFLOW} when two finite operands yield an infinite product
     */
    public static Outcome<Double> multiply(double a, double b) {
        double product = a * b;
        if (Double.isInfinite(product) && Double.isFinite(a) && Double.isFinite(b)) {
            return fail(DomainError.OVERFLOW);
        }
        return Outcome.ok(product);
    }

    private static Outcome<Double> fail(DomainError error) {
        return Outcome.fail(ErrorConversions.fromDomain(error));
    }
}
