// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.decarith;

/**
 * The outcome of a three-way comparison of two operands. The decimal
 * side of the arithmetic only ever produces {@link #LESS},
 * {@link #EQUAL} or {@link #GREATER}. {@link #UNORDERED} arises when a
 * floating-point NaN takes part, and no ordering operator holds.
 */
public enum Comparison {

    /** The left operand is less than the right. */
    LESS,

    /** The operands are equal in value. */
    EQUAL,

    /** The left operand is greater than the right. */
    GREATER,

    /** The operands have no order (one of them is NaN). */
    UNORDERED;

    /**
     * Translate the result of {@code Comparable.compareTo()} (or any
     * {@code int} following the same convention) into a
     * {@code Comparison}.
     *
     * @param c comparison result
     * @return equivalent {@code Comparison}
     */
    public static Comparison of(int c) {
        return c < 0 ? LESS : c == 0 ? EQUAL : GREATER;
    }

    /**
     * Compare two {@code double}s with the semantics of the Java
     * relational operators, so that NaN is {@link #UNORDERED} and
     * {@code -0.0} is {@link #EQUAL} to {@code 0.0}.
     *
     * @param v left operand
     * @param w right operand
     * @return the comparison of {@code v} with {@code w}
     */
    static Comparison of(double v, double w) {
        if (v < w)
            return LESS;
        else if (v > w)
            return GREATER;
        else if (v == w)
            return EQUAL;
        else
            return UNORDERED;
    }

    /**
     * The comparison seen from the other operand, e.g. {@code LESS}
     * with {@code GREATER}.
     *
     * @return swapped version of this comparison
     */
    public Comparison swapped() { return swap[this.ordinal()]; }

    // Order and number must match the constants.
    private static final Comparison[] swap =
            {GREATER, EQUAL, LESS, UNORDERED};
}
