package com.example.waveforms;

/**
 * Arithmetic capability the waveform functions evaluate through.
 *
 * <p>Implementations fix their working precision at construction and are
 * never mutated afterwards, so one instance can be shared by any number of
 * concurrent evaluations.</p>
 *
 * @param <T> numeric value type
 */
public interface NumericContext<T> {

    T valueOf(long value);

    /**
     * Converts a host double, rounded to this context's precision.
     */
    T valueOf(double value);

    T add(T a, T b);

    T subtract(T a, T b);

    T multiply(T a, T b);

    /**
     * Divides {@code a} by {@code b}, rounded to this context's precision.
     *
     * @throws ArithmeticException when {@code b} is zero
     */
    T divide(T a, T b);

    T negate(T value);

    /**
     * Largest integral value not greater than {@code value}.
     */
    T floor(T value);

    /**
     * Fractional part {@code value - floor(value)}, always in {@code [0, 1)}.
     *
     * @param value number to split
     * @return fractional part of the value
     */
    T frac(T value);

    /**
     * Whether an integral value is odd, exactly, whatever its magnitude.
     */
    boolean isOdd(T integral);

    /**
     * Product of an amplitude and a fraction in {@code [0, 1)}, rounded so its
     * magnitude stays strictly below {@code |amplitude|}.
     */
    T scaleFraction(T amplitude, T fraction);

    T abs(T value);

    T exp(T value);

    int compare(T a, T b);

    boolean isZero(T value);
}
