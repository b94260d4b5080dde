// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.decarith;

import java.math.BigDecimal;

/**
 * The arithmetic operators, each with an implementation for every
 * native kind (exactly the Java operator) and one for decimals (the
 * corresponding primitive of a {@link DecimalEngine}).
 */
enum BinaryOperation {

    // @formatter:off
    /** {@code v + w} */
    ADD("+") {
        @Override Object apply(int v, int w) { return v + w; }
        @Override Object apply(long v, long w) { return v + w; }
        @Override Object apply(float v, float w) { return v + w; }
        @Override Object apply(double v, double w) { return v + w; }
        @Override BigDecimal apply(DecimalEngine e, BigDecimal v,
                BigDecimal w) { return e.add(v, w); }
    },

    /** {@code v - w} */
    SUB("-") {
        @Override Object apply(int v, int w) { return v - w; }
        @Override Object apply(long v, long w) { return v - w; }
        @Override Object apply(float v, float w) { return v - w; }
        @Override Object apply(double v, double w) { return v - w; }
        @Override BigDecimal apply(DecimalEngine e, BigDecimal v,
                BigDecimal w) { return e.subtract(v, w); }
    },

    /** {@code v * w} */
    MUL("*") {
        @Override Object apply(int v, int w) { return v * w; }
        @Override Object apply(long v, long w) { return v * w; }
        @Override Object apply(float v, float w) { return v * w; }
        @Override Object apply(double v, double w) { return v * w; }
        @Override BigDecimal apply(DecimalEngine e, BigDecimal v,
                BigDecimal w) { return e.multiply(v, w); }
    },

    /** {@code v / w} (integer division for integer kinds) */
    DIV("/") {
        @Override Object apply(int v, int w) { return v / w; }
        @Override Object apply(long v, long w) { return v / w; }
        @Override Object apply(float v, float w) { return v / w; }
        @Override Object apply(double v, double w) { return v / w; }
        @Override BigDecimal apply(DecimalEngine e, BigDecimal v,
                BigDecimal w) { return e.divide(v, w); }
    };
    // @formatter:on

    /** Text of the operator, e.g. "+", for messages. */
    final String text;

    BinaryOperation(String text) { this.text = text; }

    abstract Object apply(int v, int w);

    abstract Object apply(long v, long w);

    abstract Object apply(float v, float w);

    abstract Object apply(double v, double w);

    /**
     * Apply this operation to two decimals.
     *
     * @param e engine providing decimal arithmetic
     * @param v left operand
     * @param w right operand
     * @return {@code v op w}
     */
    abstract BigDecimal apply(DecimalEngine e, BigDecimal v,
            BigDecimal w);

    /**
     * Apply this operation to two natives, after converting them to
     * the given (promoted) kind.
     *
     * @param kind in which to compute (not {@code DECIMAL})
     * @param v left operand
     * @param w right operand
     * @return boxed result of the Java operator
     */
    Object applyNative(OperandKind kind, Number v, Number w) {
        switch (kind) {
            case INT:
                return apply(v.intValue(), w.intValue());
            case LONG:
                return apply(v.longValue(), w.longValue());
            case FLOAT:
                return apply(v.floatValue(), w.floatValue());
            case DOUBLE:
                return apply(v.doubleValue(), w.doubleValue());
            default:
                throw new IllegalArgumentException(
                        "not a native kind: " + kind);
        }
    }

    @Override
    public String toString() { return text; }
}
