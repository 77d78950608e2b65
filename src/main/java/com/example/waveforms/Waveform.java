package com.example.waveforms;

import java.util.Objects;

/**
 * The supported signal shapes, bindable to a context and fixed parameters.
 */
public enum Waveform {
    SQUARE(true) {
        @Override
        <T> T evaluate(NumericContext<T> context, T t, T amplitude, T period) {
            return Waveforms.squareWave(context, t, amplitude, period);
        }
    },
    TRIANGLE(true) {
        @Override
        <T> T evaluate(NumericContext<T> context, T t, T amplitude, T period) {
            return Waveforms.triangleWave(context, t, amplitude, period);
        }
    },
    SAWTOOTH(true) {
        @Override
        <T> T evaluate(NumericContext<T> context, T t, T amplitude, T period) {
            return Waveforms.sawtoothWave(context, t, amplitude, period);
        }
    },
    UNIT_TRIANGLE(false) {
        @Override
        <T> T evaluate(NumericContext<T> context, T t, T amplitude, T period) {
            return Waveforms.unitTriangle(context, t, amplitude);
        }
    },
    SIGMOID(false) {
        @Override
        <T> T evaluate(NumericContext<T> context, T t, T amplitude, T period) {
            return Waveforms.sigmoidWave(context, t, amplitude);
        }
    };

    private final boolean periodic;

    Waveform(boolean periodic) {
        this.periodic = periodic;
    }

    public boolean isPeriodic() {
        return periodic;
    }

    abstract <T> T evaluate(NumericContext<T> context, T t, T amplitude, T period);

    public <T> SignalFunction<T> bind(NumericContext<T> context) {
        Objects.requireNonNull(context, "context");
        return bind(context, context.valueOf(1L), context.valueOf(1L));
    }

    /**
     * Fixes the context and parameters of this shape.
     *
     * <p>The period is ignored by shapes that are not periodic. A zero period
     * is rejected here for periodic shapes rather than on the first sample.</p>
     *
     * @param context arithmetic used by every sample
     * @param amplitude peak magnitude
     * @param period wave period
     * @return function evaluating one sample per call
     * @throws ArithmeticException when a periodic shape is given a zero period
     */
    public <T> SignalFunction<T> bind(NumericContext<T> context, T amplitude, T period) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(amplitude, "amplitude");
        Objects.requireNonNull(period, "period");
        if (periodic && context.isZero(period)) {
            throw new ArithmeticException("Division by zero");
        }
        return t -> evaluate(context, t, amplitude, period);
    }
}
