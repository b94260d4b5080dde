// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.decarith;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Objects;

/**
 * A {@link DecimalEngine} implemented by {@code java.math.BigDecimal}
 * under a fixed {@code MathContext}. The context applies to all four
 * arithmetic operations. Division is exact when the quotient fits the
 * precision, and rounded otherwise. With
 * {@code MathContext.UNLIMITED}, a quotient that does not terminate
 * raises the {@code ArithmeticException} of {@code BigDecimal}.
 */
public final class BigDecimalEngine implements DecimalEngine {

    /** Precision and rounding for every operation. */
    private final MathContext context;

    /**
     * Create an engine that works under the given context.
     *
     * @param context precision and rounding to apply
     */
    public BigDecimalEngine(MathContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    /**
     * @return the context under which this engine works
     */
    public MathContext getContext() { return context; }

    @Override
    public BigDecimal construct(String text)
            throws MalformedLiteralException {
        if (text == null) { throw new MalformedLiteralException(null); }
        String s = text.strip();
        if (s.isEmpty()) { throw new MalformedLiteralException(text); }
        try {
            return new BigDecimal(s);
        } catch (NumberFormatException e) {
            throw new MalformedLiteralException(text, e);
        }
    }

    @Override
    public BigDecimal construct(long v) { return BigDecimal.valueOf(v); }

    @Override
    public BigDecimal construct(double v) throws NonFiniteValueException {
        if (!Double.isFinite(v)) { throw new NonFiniteValueException(v); }
        // Goes via Double.toString(v)
        return BigDecimal.valueOf(v);
    }

    @Override
    public BigDecimal construct(float v) throws NonFiniteValueException {
        if (!Float.isFinite(v)) { throw new NonFiniteValueException(v); }
        return new BigDecimal(Float.toString(v));
    }

    // @formatter:off
    @Override
    public BigDecimal add(BigDecimal v, BigDecimal w)
        { return v.add(w, context); }

    @Override
    public BigDecimal subtract(BigDecimal v, BigDecimal w)
        { return v.subtract(w, context); }

    @Override
    public BigDecimal multiply(BigDecimal v, BigDecimal w)
        { return v.multiply(w, context); }
    // @formatter:on

    @Override
    public BigDecimal divide(BigDecimal v, BigDecimal w)
            throws DivisionByZeroException {
        // BigDecimal reports 0/0 as "Division undefined": same to us.
        if (w.signum() == 0) { throw new DivisionByZeroException(v); }
        return v.divide(w, context);
    }

    @Override
    public Comparison compare(BigDecimal v, BigDecimal w) {
        return Comparison.of(v.compareTo(w));
    }

    @Override
    public boolean valueEqual(BigDecimal v, BigDecimal w) {
        return v.compareTo(w) == 0;
    }

    @Override
    public BigDecimal round(BigDecimal v, int places) {
        return v.setScale(places, context.getRoundingMode());
    }

    @Override
    public String toString() {
        return "BigDecimalEngine[" + context + "]";
    }
}
