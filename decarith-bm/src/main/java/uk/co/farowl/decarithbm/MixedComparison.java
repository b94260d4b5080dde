// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.decarithbm;

import java.math.BigDecimal;
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
 * JMH benchmark for comparisons through {@link MixedArithmetic}. The
 * non-strict comparisons are composed of two others, so we expect them
 * to cost roughly twice as much as the strict ones.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)

@Fork(2)
@Warmup(iterations = 20, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 10, time = 1, timeUnit = TimeUnit.SECONDS)

@State(Scope.Thread)
public class MixedComparison {

    final MixedArithmetic arith = MixedArithmetic.standard();

    double v = 3.15;
    BigDecimal dv = new BigDecimal("3.15"), dw = new BigDecimal("3.150");
    Object fvo = v, ivo = 42;

    @Benchmark
    public boolean eq_dec_dec_java() { return dv.compareTo(dw) == 0; }

    @Benchmark
    public boolean eq_dec_dec() { return arith.equal(dv, dw); }

    @Benchmark
    public boolean eq_float_dec() { return arith.equal(fvo, dw); }

    @Benchmark
    public boolean lt_int_dec() { return arith.lessThan(ivo, dw); }

    @Benchmark
    public boolean le_int_dec() { return arith.lessOrEqual(ivo, dw); }

    @Benchmark
    public boolean lt_int_float() { return arith.lessThan(ivo, fvo); }
}
