package com.example.waveforms;

import ch.obermuhlner.math.big.BigDecimalMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Arbitrary-precision context backed by {@link BigDecimal}.
 *
 * <p>Every operation rounds to the {@link MathContext} given at construction.
 * The exponential is delegated to big-math.</p>
 */
public final class BigDecimalContext implements NumericContext<BigDecimal> {
    public static final int DEFAULT_DIGITS = 15;

    private static final Logger log = LoggerFactory.getLogger(BigDecimalContext.class);

    private final MathContext mathContext;
    private final MathContext truncatingContext;

    /**
     * Creates a context rounding with the provided math context.
     *
     * @param mathContext precision and rounding mode applied to every result
     */
    public BigDecimalContext(MathContext mathContext) {
        Objects.requireNonNull(mathContext, "mathContext");
        if (mathContext.getPrecision() <= 0) {
            throw new IllegalArgumentException("Precision must be positive");
        }
        this.mathContext = mathContext;
        this.truncatingContext = new MathContext(mathContext.getPrecision(), RoundingMode.DOWN);
        log.debug("BigDecimal context created with {} significant digits, rounding {}",
                mathContext.getPrecision(), mathContext.getRoundingMode());
    }

    public static BigDecimalContext ofDigits(int digits) {
        if (digits <= 0) {
            throw new IllegalArgumentException("Precision must be positive");
        }
        return new BigDecimalContext(new MathContext(digits, RoundingMode.HALF_EVEN));
    }

    public static BigDecimalContext withDefaultPrecision() {
        return ofDigits(DEFAULT_DIGITS);
    }

    public MathContext mathContext() {
        return mathContext;
    }

    public int precision() {
        return mathContext.getPrecision();
    }

    @Override
    public BigDecimal valueOf(long value) {
        return new BigDecimal(value, mathContext);
    }

    @Override
    public BigDecimal valueOf(double value) {
        return new BigDecimal(value, mathContext);
    }

    @Override
    public BigDecimal add(BigDecimal a, BigDecimal b) {
        return a.add(b, mathContext);
    }

    @Override
    public BigDecimal subtract(BigDecimal a, BigDecimal b) {
        return a.subtract(b, mathContext);
    }

    @Override
    public BigDecimal multiply(BigDecimal a, BigDecimal b) {
        return a.multiply(b, mathContext);
    }

    @Override
    public BigDecimal divide(BigDecimal a, BigDecimal b) {
        if (b.signum() == 0) {
            throw new ArithmeticException("Division by zero");
        }
        return a.divide(b, mathContext);
    }

    @Override
    public BigDecimal negate(BigDecimal value) {
        return value.negate(mathContext);
    }

    @Override
    public BigDecimal floor(BigDecimal value) {
        return value.setScale(0, RoundingMode.FLOOR);
    }

    /**
     * Subtracts exactly and truncates, so a value just below an integer never
     * rounds up to a fractional part of one.
     */
    @Override
    public BigDecimal frac(BigDecimal value) {
        return value.subtract(floor(value)).round(truncatingContext);
    }

    @Override
    public boolean isOdd(BigDecimal integral) {
        return integral.toBigIntegerExact().testBit(0);
    }

    @Override
    public BigDecimal scaleFraction(BigDecimal amplitude, BigDecimal fraction) {
        return amplitude.multiply(fraction, truncatingContext);
    }

    @Override
    public BigDecimal abs(BigDecimal value) {
        return value.abs(mathContext);
    }

    /**
     * Exponential at the working precision. Results too small for a
     * {@link BigDecimal} scale saturate to zero; overflow is reported.
     */
    @Override
    public BigDecimal exp(BigDecimal value) {
        try {
            return BigDecimalMath.exp(value, mathContext);
        } catch (ArithmeticException e) {
            if (value.signum() >= 0) {
                throw e;
            }
            log.debug("exp({}) underflows, saturating to zero", value);
            return BigDecimal.ZERO;
        }
    }

    @Override
    public int compare(BigDecimal a, BigDecimal b) {
        return a.compareTo(b);
    }

    @Override
    public boolean isZero(BigDecimal value) {
        return value.signum() == 0;
    }

    @Override
    public String toString() {
        return "BigDecimalContext[" + mathContext + "]";
    }
}
