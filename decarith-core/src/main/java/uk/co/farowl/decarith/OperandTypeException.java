// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.decarith;

/**
 * Thrown when an operand is neither a native number (a boxed Java
 * primitive numeric type) nor a {@code BigDecimal}. The messages follow
 * the pattern familiar from Python's {@code TypeError}.
 */
public class OperandTypeException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public OperandTypeException(String msg, Object... args) {
        super(String.format(msg, args));
    }

    /**
     * Create an exception along the lines "unsupported operand type(s)
     * for OP: V and W".
     *
     * @param op text of the operator, e.g. "+"
     * @param v left operand
     * @param w right operand
     * @return the exception
     */
    static OperandTypeException forOperation(String op, Object v,
            Object w) {
        return new OperandTypeException(UNSUPPORTED_TYPES, op,
                typeName(v), typeName(w));
    }

    /**
     * Create an exception along the lines "OP not supported between
     * instances of V and W".
     *
     * @param op text of the comparison, e.g. "&lt;="
     * @param v left operand
     * @param w right operand
     * @return the exception
     */
    static OperandTypeException forComparison(String op, Object v,
            Object w) {
        return new OperandTypeException(NOT_SUPPORTED, op, typeName(v),
                typeName(w));
    }

    /**
     * Create an exception reporting that a value cannot be promoted to
     * decimal.
     *
     * @param v the value
     * @return the exception
     */
    static OperandTypeException forPromotion(Object v) {
        return new OperandTypeException(NOT_PROMOTABLE, typeName(v));
    }

    /**
     * Name of the Java class of an operand, or "null".
     *
     * @param v the operand
     * @return its type name
     */
    static String typeName(Object v) {
        return v == null ? "null" : v.getClass().getSimpleName();
    }

    private static final String UNSUPPORTED_TYPES =
            "unsupported operand type(s) for %s: '%.100s' and '%.100s'";
    private static final String NOT_SUPPORTED =
            "'%s' not supported between instances of '%.100s' and '%.100s'";
    private static final String NOT_PROMOTABLE =
            "cannot promote '%.100s' to decimal";
}
