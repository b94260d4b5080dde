// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.decarith;

import java.math.BigDecimal;

/**
 * The representation of an operand, as far as dispatch is concerned.
 * The native kinds are declared in the order of Java binary numeric
 * promotion, so that the kind in which two natives are combined is the
 * later of the two.
 */
enum OperandKind {

    /** {@code Byte}, {@code Short} or {@code Integer}. */
    INT,
    /** {@code Long}. */
    LONG,
    /** {@code Float}. */
    FLOAT,
    /** {@code Double}. */
    DOUBLE,
    /** {@code BigDecimal}. */
    DECIMAL;

    /**
     * Classify an operand.
     *
     * @param v the operand
     * @return its kind or {@code null} if it is not an operand
     */
    static OperandKind of(Object v) {
        if (v == null) { return null; }
        Class<?> c = v.getClass();
        if (c == Integer.class || c == Short.class || c == Byte.class)
            return INT;
        else if (c == Long.class)
            return LONG;
        else if (c == Double.class)
            return DOUBLE;
        else if (c == Float.class)
            return FLOAT;
        else if (v instanceof BigDecimal)
            return DECIMAL;
        else
            return null;
    }

    /** @return whether this is a native (not decimal) kind */
    boolean isNative() { return this != DECIMAL; }

    /**
     * The kind in which Java would combine two native kinds, e.g.
     * {@code DOUBLE} for {@code LONG} and {@code DOUBLE}.
     *
     * @param v kind of left operand
     * @param w kind of right operand
     * @return kind of the arithmetic
     */
    static OperandKind promoted(OperandKind v, OperandKind w) {
        assert v.isNative() && w.isNative();
        return v.compareTo(w) >= 0 ? v : w;
    }

    /**
     * Whether an operand of this kind is a floating-point NaN or
     * infinity.
     *
     * @param v operand of this kind
     * @return {@code true} if non-finite
     */
    boolean isNonFinite(Object v) {
        switch (this) {
            case FLOAT:
            case DOUBLE:
                return !Double.isFinite(((Number)v).doubleValue());
            default:
                return false;
        }
    }

    /**
     * Apply Java {@code ==} to two natives, converted to this kind.
     *
     * @param v left operand
     * @param w right operand
     * @return {@code v == w}
     */
    boolean nativeEqual(Number v, Number w) {
        switch (this) {
            case INT:
                return v.intValue() == w.intValue();
            case LONG:
                return v.longValue() == w.longValue();
            case FLOAT:
                return v.floatValue() == w.floatValue();
            default:
                return v.doubleValue() == w.doubleValue();
        }
    }

    /**
     * Compare two natives, converted to this kind, with the semantics
     * of the Java relational operators.
     *
     * @param v left operand
     * @param w right operand
     * @return the comparison of {@code v} with {@code w}
     */
    Comparison nativeCompare(Number v, Number w) {
        switch (this) {
            case INT:
                return Comparison.of(Integer.compare(v.intValue(),
                        w.intValue()));
            case LONG:
                return Comparison.of(Long.compare(v.longValue(),
                        w.longValue()));
            case FLOAT:
                // Widening float to double is exact
                return Comparison.of((double)v.floatValue(),
                        (double)w.floatValue());
            default:
                return Comparison.of(v.doubleValue(), w.doubleValue());
        }
    }
}
