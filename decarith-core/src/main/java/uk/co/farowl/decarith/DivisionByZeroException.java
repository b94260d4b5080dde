// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.decarith;

/**
 * Thrown when a value is divided by a zero-valued decimal divisor. The
 * dividend is usually a decimal, but may be a native NaN or infinity
 * that never reached promotion. Division of native integers by zero
 * is not reported this way: it raises the plain
 * {@code ArithmeticException} of the JVM.
 */
public class DivisionByZeroException extends ArithmeticException {
    private static final long serialVersionUID = 1L;

    /** The value that was to be divided. */
    private final Number dividend;

    /**
     * Constructor specifying the dividend.
     *
     * @param dividend that was to be divided by zero
     */
    public DivisionByZeroException(Number dividend) {
        super(String.format("decimal division by zero: %s / 0",
                dividend));
        this.dividend = dividend;
    }

    /**
     * @return the value that was to be divided
     */
    public Number getDividend() { return dividend; }
}
