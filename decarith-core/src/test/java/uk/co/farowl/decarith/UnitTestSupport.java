// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.decarith;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import java.math.BigDecimal;
import java.util.List;

/**
 * A base class for unit tests that defines some common convenience
 * functions for which the need recurs.
 */
public class UnitTestSupport {

    /** The arithmetic under test, in the default context. */
    static final MixedArithmetic ARITH = MixedArithmetic.standard();

    /**
     * Shorthand for a decimal literal (avoiding the engine under test).
     *
     * @param text of the literal
     * @return the value
     */
    static BigDecimal dec(String text) { return new BigDecimal(text); }

    /**
     * Native operands of every kind, including some awkward values.
     * None is NaN or infinite.
     */
    static final List<Number> NATIVES = List.of((byte)-3, (short)12, 0,
            7, -42, Integer.MAX_VALUE, 5L, -9_000_000_000L, 0.5f, -2.75f,
            3.15, -0.1, 1e-7, 123456.789);

    /** Decimal operands, some differing only in scale. */
    static final List<BigDecimal> DECIMALS = List.of(dec("0"),
            dec("0.000"), dec("1.5"), dec("1.50"), dec("-2.33"),
            dec("98.01"), dec("3.15"), dec("12345678901234567890.123"),
            dec("1E+3"));

    /**
     * Assert that the actual result is a decimal numerically equal to
     * the expected value (ignoring scale).
     *
     * @param expected value
     * @param actual result
     */
    static void assertDecimal(String expected, Object actual) {
        assertDecimal(dec(expected), actual);
    }

    /**
     * Assert that the actual result is a decimal numerically equal to
     * the expected value (ignoring scale).
     *
     * @param expected value
     * @param actual result
     */
    static void assertDecimal(BigDecimal expected, Object actual) {
        BigDecimal a = assertInstanceOf(BigDecimal.class, actual);
        assertEquals(0, expected.compareTo(a),
                () -> String.format("expected %s but was %s", expected,
                        a));
    }
}
