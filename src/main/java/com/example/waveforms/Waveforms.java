package com.example.waveforms;

import java.util.Objects;

/**
 * Periodic and sigmoidal signal functions evaluated through an explicit
 * {@link NumericContext}.
 *
 * <p>Amplitude and period default to one. The periodic waves throw
 * {@link ArithmeticException} for a zero period.</p>
 */
public final class Waveforms {

    private Waveforms() {
        // Utility class
    }

    public static <T> T squareWave(NumericContext<T> context, T t) {
        return squareWave(context, t, context.valueOf(1L), context.valueOf(1L));
    }

    public static <T> T squareWave(NumericContext<T> context, T t, T amplitude) {
        return squareWave(context, t, amplitude, context.valueOf(1L));
    }

    /**
     * Computes {@code A * (-1)^floor(2t / P)}.
     *
     * @param context arithmetic used for every step
     * @param t time
     * @param amplitude peak magnitude
     * @param period wave period
     * @return {@code amplitude} or its negation
     * @throws ArithmeticException when period is zero
     */
    public static <T> T squareWave(NumericContext<T> context, T t, T amplitude, T period) {
        validate(context, t, amplitude, period);
        T two = context.valueOf(2L);
        T halfPeriods = context.floor(context.divide(context.multiply(two, t), period));
        T sign = context.isOdd(halfPeriods) ? context.valueOf(-1L) : context.valueOf(1L);
        return context.multiply(amplitude, sign);
    }

    public static <T> T triangleWave(NumericContext<T> context, T t) {
        return triangleWave(context, t, context.valueOf(1L), context.valueOf(1L));
    }

    public static <T> T triangleWave(NumericContext<T> context, T t, T amplitude) {
        return triangleWave(context, t, amplitude, context.valueOf(1L));
    }

    /**
     * Computes {@code 2A * (1/2 - |1 - 2 frac(t/P + 1/4)|)}, which is zero at
     * {@code t = 0} and rising.
     *
     * @throws ArithmeticException when period is zero
     */
    public static <T> T triangleWave(NumericContext<T> context, T t, T amplitude, T period) {
        validate(context, t, amplitude, period);
        T one = context.valueOf(1L);
        T two = context.valueOf(2L);
        T phase = context.add(context.divide(t, period), context.valueOf(0.25));
        T fold = context.abs(context.subtract(one, context.multiply(two, context.frac(phase))));
        T shape = context.subtract(context.valueOf(0.5), fold);
        return context.multiply(context.multiply(two, amplitude), shape);
    }

    public static <T> T sawtoothWave(NumericContext<T> context, T t) {
        return sawtoothWave(context, t, context.valueOf(1L), context.valueOf(1L));
    }

    public static <T> T sawtoothWave(NumericContext<T> context, T t, T amplitude) {
        return sawtoothWave(context, t, amplitude, context.valueOf(1L));
    }

    /**
     * Computes {@code A * frac(t/P)}. The value at each multiple of the period is zero
     * and the magnitude stays below {@code |A|}.
     *
     * @throws ArithmeticException when period is zero
     */
    public static <T> T sawtoothWave(NumericContext<T> context, T t, T amplitude, T period) {
        validate(context, t, amplitude, period);
        return context.scaleFraction(amplitude, context.frac(context.divide(t, period)));
    }

    public static double unitTriangle(double t) {
        return unitTriangle(t, 1.0);
    }

    /**
     * Single triangular pulse of half-width one: {@code A(1 - |t|)} inside
     * {@code (-1, 1)} and zero elsewhere, including at {@code t = ±1}.
     */
    public static double unitTriangle(double t, double amplitude) {
        if (t <= -1.0 || t >= 1.0) {
            return 0.0;
        }
        return amplitude * (1.0 - Math.abs(t));
    }

    public static <T> T unitTriangle(NumericContext<T> context, T t) {
        return unitTriangle(context, t, context.valueOf(1L));
    }

    public static <T> T unitTriangle(NumericContext<T> context, T t, T amplitude) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(t, "t");
        Objects.requireNonNull(amplitude, "amplitude");
        T one = context.valueOf(1L);
        T magnitude = context.abs(t);
        if (context.compare(magnitude, one) >= 0) {
            return context.valueOf(0L);
        }
        return context.multiply(amplitude, context.subtract(one, magnitude));
    }

    public static <T> T sigmoidWave(NumericContext<T> context, T t) {
        return sigmoidWave(context, t, context.valueOf(1L));
    }

    /**
     * Computes the logistic curve {@code A / (1 + e^-t)}.
     *
     * <p>Negative {@code t} is evaluated as {@code A e^t / (1 + e^t)} so the
     * exponential only ever underflows.</p>
     */
    public static <T> T sigmoidWave(NumericContext<T> context, T t, T amplitude) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(t, "t");
        Objects.requireNonNull(amplitude, "amplitude");
        T one = context.valueOf(1L);
        if (context.compare(t, context.valueOf(0L)) < 0) {
            T growth = context.exp(t);
            return context.divide(context.multiply(amplitude, growth), context.add(one, growth));
        }
        return context.divide(amplitude, context.add(one, context.exp(context.negate(t))));
    }

    private static <T> void validate(NumericContext<T> context, T t, T amplitude, T period) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(t, "t");
        Objects.requireNonNull(amplitude, "amplitude");
        Objects.requireNonNull(period, "period");
    }
}
