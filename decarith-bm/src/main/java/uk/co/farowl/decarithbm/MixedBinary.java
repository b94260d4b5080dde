// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.decarithbm;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import uk.co.farowl.decarith.MixedArithmetic;

/**
 * This is a JMH benchmark for selected binary operations on native
 * numbers and decimals, through {@link MixedArithmetic}.
 *
 * Comparison is with the time for an in-line use in Java of the
 * operation that the dispatch will eventually choose to do the
 * calculation.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)

@Fork(2)
@Warmup(iterations = 20, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 10, time = 1, timeUnit = TimeUnit.SECONDS)

@State(Scope.Thread)
public class MixedBinary {

    final MixedArithmetic arith = MixedArithmetic.standard();

    int iv = 6, iw = 7;
    double v = 1.01 * iv, w = 1.01 * iw;
    BigDecimal dv = new BigDecimal("98.01"), dw = new BigDecimal("10.01");
    Object ivo = iv, iwo = iw, fvo = v, fwo = w;

    @Benchmark
    @Fork(4)  // Needs a lot of iterations to resolve short times
    @Measurement(iterations = 50)
    public double add_float_float_java() { return v + w; }

    @Benchmark
    public Object add_float_float() { return arith.add(fvo, fwo); }

    @Benchmark
    @Fork(4)  // Needs a lot of iterations to resolve short times
    @Measurement(iterations = 50)
    public int add_int_int_java() { return iv + iw; }

    @Benchmark
    public Object add_int_int() { return arith.add(ivo, iwo); }

    @Benchmark
    public BigDecimal add_dec_dec_java() { return dv.add(dw, CONTEXT); }

    @Benchmark
    public Object add_dec_dec() { return arith.add(dv, dw); }

    @Benchmark
    public BigDecimal add_dec_int_java() {
        return dv.add(BigDecimal.valueOf(iw));
    }

    @Benchmark
    public Object add_dec_int() { return arith.add(dv, iwo); }

    @Benchmark
    public BigDecimal mul_float_dec_java() {
        return BigDecimal.valueOf(v).multiply(dw);
    }

    @Benchmark
    public Object mul_float_dec() { return arith.multiply(fvo, dw); }

    @Benchmark
    public BigDecimal div_dec_int_java() {
        return dv.divide(BigDecimal.valueOf(iw), CONTEXT);
    }

    @Benchmark
    public Object div_dec_int() { return arith.divide(dv, iwo); }

    /** As the default context of the arithmetic. */
    private static final MathContext CONTEXT =
            new MathContext(28, RoundingMode.HALF_UP);
}
