package org.javai.errata;

/**
 * Violated preconditions of the numeric operations in {@link org.javai.errata.domain.Arithmetic}.
 */
public enum DomainError {
    DIVISION_BY_ZERO("division_by_zero", "division by zero"),
    NEGATIVE_SQUARE_ROOT("negative_square_root", "square root of a negative number"),
    OVERFLOW("overflow", "arithmetic overflow");

    private final String codeName;
    private final String description;

    DomainError(String codeName, String description) {
        this.codeName = codeName;
        this.description = description;
    }

    String codeName() {
        return codeName;
    }

    public String description() {
        return description;
    }
}
