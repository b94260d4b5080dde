// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.decarith;

/**
 * Thrown when a NaN or infinite floating-point value would have to
 * become a decimal, which has no representation for it.
 */
public class NonFiniteValueException extends ArithmeticException {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor specifying the value that could not be converted.
     *
     * @param value not convertible
     */
    public NonFiniteValueException(double value) {
        super(String.format("cannot convert float %s to decimal",
                value));
    }
}
