// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.decarith;

import java.math.BigDecimal;

/**
 * The decimal arithmetic on which {@link MixedArithmetic} relies once
 * both operands are decimal. The arithmetic itself (precision, rounding,
 * the algorithms) belongs to the implementation: the dispatch layer only
 * chooses which of these methods to call, and never catches what they
 * throw.
 * <p>
 * Implementations must be immutable and safe to share between threads.
 */
public interface DecimalEngine {

    /**
     * Parse a decimal literal.
     *
     * @param text to parse
     * @return the value
     * @throws MalformedLiteralException if {@code text} is not a decimal
     */
    BigDecimal construct(String text) throws MalformedLiteralException;

    /**
     * Convert an integer exactly.
     *
     * @param v to convert
     * @return the value
     */
    BigDecimal construct(long v);

    /**
     * Convert a {@code double} through its shortest decimal rendering,
     * so that {@code 0.1} becomes exactly {@code 0.1}.
     *
     * @param v to convert
     * @return the value
     * @throws NonFiniteValueException if {@code v} is NaN or infinite
     */
    BigDecimal construct(double v) throws NonFiniteValueException;

    /**
     * Convert a {@code float} through its shortest decimal rendering
     * (as a {@code float}, not as the {@code double} it widens to).
     *
     * @param v to convert
     * @return the value
     * @throws NonFiniteValueException if {@code v} is NaN or infinite
     */
    BigDecimal construct(float v) throws NonFiniteValueException;

    /**
     * @param v left operand
     * @param w right operand
     * @return {@code v + w}
     */
    BigDecimal add(BigDecimal v, BigDecimal w);

    /**
     * @param v left operand
     * @param w right operand
     * @return {@code v - w}
     */
    BigDecimal subtract(BigDecimal v, BigDecimal w);

    /**
     * @param v left operand
     * @param w right operand
     * @return {@code v * w}
     */
    BigDecimal multiply(BigDecimal v, BigDecimal w);

    /**
     * @param v left operand
     * @param w right operand
     * @return {@code v / w}
     * @throws DivisionByZeroException if {@code w} is zero-valued
     */
    BigDecimal divide(BigDecimal v, BigDecimal w)
            throws DivisionByZeroException;

    /**
     * Three-way comparison of values (ignoring scale).
     *
     * @param v left operand
     * @param w right operand
     * @return one of {@code LESS}, {@code EQUAL} or {@code GREATER}
     */
    Comparison compare(BigDecimal v, BigDecimal w);

    /**
     * Equality of value, so that {@code 1.50} equals {@code 1.5}, unlike
     * {@code BigDecimal.equals()}.
     *
     * @param v left operand
     * @param w right operand
     * @return whether the values are numerically equal
     */
    boolean valueEqual(BigDecimal v, BigDecimal w);

    /**
     * Round to a given number of digits after the decimal point, using
     * the rounding mode of this engine.
     *
     * @param v to round
     * @param places fractional digits to keep (may be negative)
     * @return the rounded value
     */
    BigDecimal round(BigDecimal v, int places);
}
