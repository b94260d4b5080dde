// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.decarith;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Objects;

/**
 * Arithmetic and comparison over a mixture of native numbers (boxed
 * {@code byte}, {@code short}, {@code int}, {@code long}, {@code float}
 * and {@code double}) and {@code BigDecimal}s, without the caller having
 * to know which is which.
 * <p>
 * Every binary operation dispatches in one of three ways:
 * <ol>
 * <li>Both operands native: the Java operator is applied, after binary
 * numeric promotion, and the result is a boxed native (so
 * {@code divide(7, 2)} is {@code 3}).</li>
 * <li>Both operands decimal: the corresponding primitive of the
 * {@link DecimalEngine} is applied.</li>
 * <li>One of each: the native operand is {@link #promote(Object)
 * promoted} to decimal, then the decimal primitive is applied. The
 * result is decimal, whichever side was native.</li>
 * </ol>
 * Equality and ordering follow the same scheme. Inequality and the
 * non-strict orderings are composed from {@code equal},
 * {@code greaterThan} and {@code lessThan}, and have no implementation
 * of their own.
 * <p>
 * Failures of the engine (for example {@link DivisionByZeroException})
 * and of native arithmetic (integer division by zero) reach the caller
 * unchanged. Operands of any other type raise
 * {@link OperandTypeException}.
 * <p>
 * Instances are immutable and may be shared freely between threads.
 */
public final class MixedArithmetic {

    /** Decimal arithmetic used when either operand is decimal. */
    private final DecimalEngine engine;

    /**
     * Create the arithmetic over a given decimal engine.
     *
     * @param engine to which decimal operations are delegated
     */
    public MixedArithmetic(DecimalEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    /**
     * Create the arithmetic over {@code BigDecimal} in the given
     * context.
     *
     * @param context precision and rounding for decimal operations
     */
    public MixedArithmetic(MathContext context) {
        this(new BigDecimalEngine(context));
    }

    /**
     * The arithmetic in the context configured by system properties
     * (see {@link ArithmeticConfig}).
     *
     * @return the standard instance
     */
    public static MixedArithmetic standard() { return Standard.INSTANCE; }

    /** Holder for the standard instance. */
    private static class Standard {
        static final MixedArithmetic INSTANCE =
                new MixedArithmetic(ArithmeticConfig.DEFAULT_CONTEXT);
    }

    /**
     * @return the engine to which decimal operations are delegated
     */
    public DecimalEngine getEngine() { return engine; }

    // Arithmetic -----------------------------------------------------

    /**
     * {@code v + w}.
     *
     * @param v left operand
     * @param w right operand
     * @return {@code v + w}, native or {@code BigDecimal}
     * @throws OperandTypeException if an operand is of the wrong type
     * @throws NonFiniteValueException if a native operand is NaN or
     *     infinite and the other is decimal
     */
    public Object add(Object v, Object w) {
        return binaryOp(v, w, BinaryOperation.ADD);
    }

    /**
     * {@code v - w}.
     *
     * @param v left operand
     * @param w right operand
     * @return {@code v - w}, native or {@code BigDecimal}
     * @throws OperandTypeException if an operand is of the wrong type
     * @throws NonFiniteValueException if a native operand is NaN or
     *     infinite and the other is decimal
     */
    public Object subtract(Object v, Object w) {
        return binaryOp(v, w, BinaryOperation.SUB);
    }

    /**
     * {@code v * w}.
     *
     * @param v left operand
     * @param w right operand
     * @return {@code v * w}, native or {@code BigDecimal}
     * @throws OperandTypeException if an operand is of the wrong type
     * @throws NonFiniteValueException if a native operand is NaN or
     *     infinite and the other is decimal
     */
    public Object multiply(Object v, Object w) {
        return binaryOp(v, w, BinaryOperation.MUL);
    }

    /**
     * {@code v / w}. Two native integers divide as in Java, truncating,
     * and raise {@code ArithmeticException} when {@code w} is zero.
     *
     * @param v left operand
     * @param w right operand
     * @return {@code v / w}, native or {@code BigDecimal}
     * @throws DivisionByZeroException if the division is decimal and
     *     {@code w} is zero
     * @throws OperandTypeException if an operand is of the wrong type
     * @throws NonFiniteValueException if a native operand is NaN or
     *     infinite and the other is decimal
     */
    public Object divide(Object v, Object w) {
        return binaryOp(v, w, BinaryOperation.DIV);
    }

    // Comparison -----------------------------------------------------

    /**
     * {@code v == w}, by value, so a decimal {@code 1.50} equals
     * {@code 1.5} and equals the {@code double} {@code 1.5}.
     *
     * @param v left operand
     * @param w right operand
     * @return whether {@code v} and {@code w} are equal
     * @throws OperandTypeException if an operand is of the wrong type
     */
    public boolean equal(Object v, Object w) {
        return isEqual(v, w, "==");
    }

    /**
     * {@code v != w}, the negation of {@link #equal(Object, Object)}.
     *
     * @param v left operand
     * @param w right operand
     * @return whether {@code v} and {@code w} differ
     * @throws OperandTypeException if an operand is of the wrong type
     */
    public boolean notEqual(Object v, Object w) {
        return !isEqual(v, w, "!=");
    }

    /**
     * {@code v > w}.
     *
     * @param v left operand
     * @param w right operand
     * @return whether {@code v} is greater than {@code w}
     * @throws OperandTypeException if an operand is of the wrong type
     */
    public boolean greaterThan(Object v, Object w) {
        return threeWay(v, w, ">") == Comparison.GREATER;
    }

    /**
     * {@code v >= w}, defined as {@code v == w || v > w}.
     *
     * @param v left operand
     * @param w right operand
     * @return whether {@code v} is greater than or equal to {@code w}
     * @throws OperandTypeException if an operand is of the wrong type
     */
    public boolean greaterOrEqual(Object v, Object w) {
        checkComparable(v, w, ">=");
        return equal(v, w) || greaterThan(v, w);
    }

    /**
     * {@code v < w}.
     *
     * @param v left operand
     * @param w right operand
     * @return whether {@code v} is less than {@code w}
     * @throws OperandTypeException if an operand is of the wrong type
     */
    public boolean lessThan(Object v, Object w) {
        return threeWay(v, w, "<") == Comparison.LESS;
    }

    /**
     * {@code v <= w}, defined as {@code v == w || v < w}.
     *
     * @param v left operand
     * @param w right operand
     * @return whether {@code v} is less than or equal to {@code w}
     * @throws OperandTypeException if an operand is of the wrong type
     */
    public boolean lessOrEqual(Object v, Object w) {
        checkComparable(v, w, "<=");
        return equal(v, w) || lessThan(v, w);
    }

    /**
     * Three-way comparison of {@code v} with {@code w}. When a native
     * NaN is involved the answer is {@link Comparison#UNORDERED}. A
     * native infinity is beyond every decimal.
     *
     * @param v left operand
     * @param w right operand
     * @return the comparison
     * @throws OperandTypeException if an operand is of the wrong type
     */
    public Comparison compare(Object v, Object w) {
        return threeWay(v, w, "compare");
    }

    // Conversion -----------------------------------------------------

    /**
     * Convert a native number to an equal decimal, or return a decimal
     * unchanged. Integers convert exactly, and floating-point values
     * through their shortest decimal string, so that {@code 3.15}
     * becomes exactly {@code 3.15}.
     *
     * @param v native number or decimal
     * @return decimal equivalent
     * @throws OperandTypeException if {@code v} is of the wrong type
     * @throws NonFiniteValueException if {@code v} is NaN or infinite
     */
    public BigDecimal promote(Object v) {
        OperandKind kind = OperandKind.of(v);
        if (kind == null) { throw OperandTypeException.forPromotion(v); }
        return promote(kind, v);
    }

    /**
     * Parse a decimal literal, e.g. {@code "98.01"}.
     *
     * @param text to parse
     * @return the decimal
     * @throws MalformedLiteralException if the text is not a decimal
     */
    public BigDecimal decimalFrom(String text) {
        return engine.construct(text);
    }

    /**
     * Round a number (promoted if native) to the given number of
     * digits after the decimal point, in the rounding mode of the
     * engine.
     *
     * @param v native number or decimal
     * @param places fractional digits to keep
     * @return rounded decimal
     * @throws OperandTypeException if {@code v} is of the wrong type
     * @throws NonFiniteValueException if {@code v} is NaN or infinite
     */
    public BigDecimal round(Object v, int places) {
        return engine.round(promote(v), places);
    }

    /**
     * Test whether an object is a decimal (rather than native) operand.
     *
     * @param v to test
     * @return {@code true} iff {@code v} is a {@code BigDecimal}
     */
    public static boolean isDecimal(Object v) {
        return v instanceof BigDecimal;
    }

    // plumbing -------------------------------------------------------

    /**
     * Apply an arithmetic operation by the three-way dispatch.
     *
     * @param v left operand
     * @param w right operand
     * @param op to apply
     * @return result native or decimal
     */
    private Object binaryOp(Object v, Object w, BinaryOperation op) {
        OperandKind vKind = OperandKind.of(v), wKind = OperandKind.of(w);
        if (vKind == null || wKind == null) {
            throw OperandTypeException.forOperation(op.text, v, w);
        } else if (vKind.isNative() && wKind.isNative()) {
            return op.applyNative(OperandKind.promoted(vKind, wKind),
                    (Number)v, (Number)w);
        } else {
            // The divisor is checked before a non-finite dividend fails
            BigDecimal wd = promote(wKind, w);
            if (op == BinaryOperation.DIV && wd.signum() == 0
                    && vKind.isNonFinite(v)) {
                throw new DivisionByZeroException((Number)v);
            }
            return op.apply(engine, promote(vKind, v), wd);
        }
    }

    /**
     * Check that both operands may be compared, so that a composed
     * comparison reports the operator the caller used.
     *
     * @param v left operand
     * @param w right operand
     * @param op name of the calling operation for messages
     */
    private static void checkComparable(Object v, Object w, String op) {
        if (OperandKind.of(v) == null || OperandKind.of(w) == null) {
            throw OperandTypeException.forComparison(op, v, w);
        }
    }

    /**
     * Test equality by the three-way dispatch.
     *
     * @param v left operand
     * @param w right operand
     * @param op name of the calling operation for messages
     * @return whether equal
     */
    private boolean isEqual(Object v, Object w, String op) {
        OperandKind vKind = OperandKind.of(v), wKind = OperandKind.of(w);
        if (vKind == null || wKind == null) {
            throw OperandTypeException.forComparison(op, v, w);
        } else if (vKind.isNative() && wKind.isNative()) {
            return OperandKind.promoted(vKind, wKind)
                    .nativeEqual((Number)v, (Number)w);
        } else if (vKind.isNonFinite(v) || wKind.isNonFinite(w)) {
            // No decimal equals NaN or infinity
            return false;
        } else {
            return engine.valueEqual(promote(vKind, v),
                    promote(wKind, w));
        }
    }

    /**
     * Compare by the three-way dispatch.
     *
     * @param v left operand
     * @param w right operand
     * @param op name of the calling operation for messages
     * @return the comparison of {@code v} with {@code w}
     */
    private Comparison threeWay(Object v, Object w, String op) {
        OperandKind vKind = OperandKind.of(v), wKind = OperandKind.of(w);
        if (vKind == null || wKind == null) {
            throw OperandTypeException.forComparison(op, v, w);
        } else if (vKind.isNative() && wKind.isNative()) {
            return OperandKind.promoted(vKind, wKind)
                    .nativeCompare((Number)v, (Number)w);
        } else if (vKind.isNonFinite(v)) {
            // w is decimal and therefore finite
            return Comparison.of(((Number)v).doubleValue(), 0.0);
        } else if (wKind.isNonFinite(w)) {
            return Comparison.of(((Number)w).doubleValue(), 0.0)
                    .swapped();
        } else {
            return engine.compare(promote(vKind, v), promote(wKind, w));
        }
    }

    /**
     * Promote an operand already classified.
     *
     * @param kind of {@code v}
     * @param v operand
     * @return decimal equivalent
     */
    private BigDecimal promote(OperandKind kind, Object v) {
        switch (kind) {
            case DECIMAL:
                return (BigDecimal)v;
            case INT:
            case LONG:
                return engine.construct(((Number)v).longValue());
            case FLOAT:
                return engine.construct(((Float)v).floatValue());
            default:
                return engine.construct(((Double)v).doubleValue());
        }
    }

    @Override
    public String toString() {
        return "MixedArithmetic[" + engine + "]";
    }
}
