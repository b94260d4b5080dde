// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.decarith;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Test the {@link BigDecimalEngine}, the decimal arithmetic behind
 * {@link MixedArithmetic}.
 */
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class BigDecimalEngineTest extends UnitTestSupport {

    @Nested
    @DisplayName("Constructing a decimal")
    class Construct {

        final BigDecimalEngine engine =
                new BigDecimalEngine(MathContext.DECIMAL64);

        @Test
        void from_text() {
            assertEquals(dec("1.5"), engine.construct(" 1.5 "));
            assertEquals(dec("1E+3"), engine.construct("1e3"));
            assertEquals(dec("-0.00"), engine.construct("-0.00"));
        }

        @Test
        void from_malformed_text() {
            for (String s : new String[] {"12x.3", "", "  ", "1..2",
                    "NaN", "Infinity"}) {
                MalformedLiteralException e = assertThrows(
                        MalformedLiteralException.class,
                        () -> engine.construct(s));
                assertEquals(s, e.getLiteral());
            }
        }

        @Test
        void from_null_text() {
            MalformedLiteralException e =
                    assertThrows(MalformedLiteralException.class,
                            () -> engine.construct((String)null));
            assertNull(e.getLiteral());
        }

        @Test
        void from_long() {
            assertEquals(dec("-9223372036854775808"),
                    engine.construct(Long.MIN_VALUE));
        }

        @Test
        void from_double() {
            assertEquals(dec("0.1"), engine.construct(0.1));
            assertEquals(dec("1.0E-7"), engine.construct(1e-7));
            assertThrows(NonFiniteValueException.class,
                    () -> engine.construct(Double.NEGATIVE_INFINITY));
        }

        @Test
        void from_float() {
            // Not the 0.100000001490116... of new BigDecimal(0.1f)
            assertEquals(dec("0.1"), engine.construct(0.1f));
            assertThrows(NonFiniteValueException.class,
                    () -> engine.construct(Float.NaN));
        }
    }

    @Nested
    @DisplayName("In a limited context")
    class Limited {

        final BigDecimalEngine engine = new BigDecimalEngine(
                new MathContext(5, RoundingMode.HALF_EVEN));

        @Test
        void arithmetic_rounds_to_precision() {
            assertEquals(dec("12346"),
                    engine.add(dec("12345"), dec("0.6")));
            assertEquals(dec("12344"),
                    engine.subtract(dec("12345"), dec("0.5")));
            assertEquals(dec("1.5129E+4"),
                    engine.multiply(dec("123"), dec("123.0")));
            assertEquals(dec("0.66667"), engine.divide(dec("2"), dec("3")));
        }

        @Test
        void round_uses_rounding_mode() {
            assertEquals(dec("2.34"), engine.round(dec("2.345"), 2));
            assertEquals(dec("2.4E+2"), engine.round(dec("235"), -1));
        }

        @Test
        void division_by_zero_reports_dividend() {
            BigDecimal v = dec("7.5");
            DivisionByZeroException e =
                    assertThrows(DivisionByZeroException.class,
                            () -> engine.divide(v, dec("0E-3")));
            assertSame(v, e.getDividend());
            assertEquals("decimal division by zero: 7.5 / 0",
                    e.getMessage());
        }
    }

    @Nested
    @DisplayName("In an unlimited context")
    class Unlimited {

        final BigDecimalEngine engine =
                new BigDecimalEngine(MathContext.UNLIMITED);

        @Test
        void terminating_division_is_exact() {
            assertEquals(dec("0.125"), engine.divide(dec("1"), dec("8")));
        }

        @Test
        void non_terminating_division_fails() {
            ArithmeticException e = assertThrows(ArithmeticException.class,
                    () -> engine.divide(dec("1"), dec("3")));
            assertFalse(e instanceof DivisionByZeroException);
        }
    }

    @Test
    void comparison_ignores_scale() {
        BigDecimalEngine engine = new BigDecimalEngine(MathContext.DECIMAL32);
        assertEquals(Comparison.EQUAL,
                engine.compare(dec("1.50"), dec("1.5")));
        assertEquals(Comparison.LESS, engine.compare(dec("-1"), dec("0")));
        assertEquals(Comparison.GREATER,
                engine.compare(dec("1E+1"), dec("9.99")));
        assertTrue(engine.valueEqual(dec("0"), dec("0.000")));
        assertFalse(engine.valueEqual(dec("1.00001"), dec("1.00002")));
    }
}
