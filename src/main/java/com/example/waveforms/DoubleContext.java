package com.example.waveforms;

/**
 * Host-precision context over {@code double}.
 */
public final class DoubleContext implements NumericContext<Double> {
    public static final DoubleContext INSTANCE = new DoubleContext();

    private DoubleContext() {
    }

    @Override
    public Double valueOf(long value) {
        return (double) value;
    }

    @Override
    public Double valueOf(double value) {
        return value;
    }

    @Override
    public Double add(Double a, Double b) {
        return a + b;
    }

    @Override
    public Double subtract(Double a, Double b) {
        return a - b;
    }

    @Override
    public Double multiply(Double a, Double b) {
        return a * b;
    }

    @Override
    public Double divide(Double a, Double b) {
        if (b == 0.0) {
            throw new ArithmeticException("Division by zero");
        }
        return a / b;
    }

    @Override
    public Double negate(Double value) {
        return -value;
    }

    @Override
    public Double floor(Double value) {
        return Math.floor(value);
    }

    @Override
    public Double frac(Double value) {
        double fraction = value - Math.floor(value);
        // tiny negative inputs round up to exactly 1.0
        return fraction < 1.0 ? fraction : Math.nextDown(1.0);
    }

    @Override
    public boolean isOdd(Double integral) {
        return integral % 2.0 != 0.0;
    }

    @Override
    public Double scaleFraction(Double amplitude, Double fraction) {
        double product = amplitude * fraction;
        if (Math.abs(product) < Math.abs(amplitude) || amplitude == 0.0) {
            return product;
        }
        return amplitude - Math.copySign(Math.ulp(amplitude), amplitude);
    }

    @Override
    public Double abs(Double value) {
        return Math.abs(value);
    }

    @Override
    public Double exp(Double value) {
        return Math.exp(value);
    }

    @Override
    public int compare(Double a, Double b) {
        return Double.compare(a, b);
    }

    @Override
    public boolean isZero(Double value) {
        return value == 0.0;
    }

    @Override
    public String toString() {
        return "DoubleContext";
    }
}
