package com.example.waveforms;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class WaveformPropertiesTest {
    private static final String[] TIMES = {
            "-98765432109.5", "-3.7", "-0.4", "0", "0.3", "1.1", "2.65", "7.125", "123456789012.375"
    };
    private static final String[] PERIODS = {"2", "0.5", "2.5"};
    private static final String[] AMPLITUDES = {"1", "1.5", "-2"};

    private final BigDecimalContext context = BigDecimalContext.withDefaultPrecision();

    private static BigDecimal n(String value) {
        return new BigDecimal(value);
    }

    @Test
    void periodicWavesRepeatAfterOnePeriod() {
        for (String period : PERIODS) {
            BigDecimal p = n(period);
            for (String amplitude : AMPLITUDES) {
                BigDecimal a = n(amplitude);
                for (String time : TIMES) {
                    BigDecimal t = n(time);
                    BigDecimal shifted = t.add(p);
                    for (Waveform waveform : Waveform.values()) {
                        if (!waveform.isPeriodic()) {
                            continue;
                        }
                        SignalFunction<BigDecimal> signal = waveform.bind(context, a, p);
                        assertEquals(0, signal.evaluate(t).compareTo(signal.evaluate(shifted)),
                                () -> waveform + " t=" + time + " P=" + period + " A=" + amplitude);
                    }
                }
            }
        }
    }

    @Test
    void outputsStayWithinRange() {
        BigDecimal a = n("1.5");
        for (String period : PERIODS) {
            BigDecimal p = n(period);
            for (String time : TIMES) {
                BigDecimal t = n(time);

                BigDecimal square = Waveforms.squareWave(context, t, a, p);
                assertTrue(square.compareTo(a) == 0 || square.compareTo(a.negate()) == 0, "square " + time);

                BigDecimal triangle = Waveforms.triangleWave(context, t, a, p);
                assertTrue(triangle.compareTo(a.negate()) >= 0 && triangle.compareTo(a) <= 0, "triangle " + time);

                BigDecimal sawtooth = Waveforms.sawtoothWave(context, t, a, p);
                assertTrue(sawtooth.signum() >= 0 && sawtooth.compareTo(a) < 0, "sawtooth " + time);

                BigDecimal pulse = Waveforms.unitTriangle(context, t, a);
                if (t.abs().compareTo(BigDecimal.ONE) >= 0) {
                    assertEquals(0, pulse.signum(), "pulse " + time);
                } else {
                    assertTrue(pulse.signum() >= 0 && pulse.compareTo(a) <= 0, "pulse " + time);
                }

                BigDecimal sigmoid = Waveforms.sigmoidWave(context, t, a);
                if (t.abs().compareTo(n("1000")) <= 0) {
                    assertTrue(sigmoid.signum() > 0 && sigmoid.compareTo(a) < 0, "sigmoid " + time);
                } else {
                    assertTrue(sigmoid.signum() >= 0 && sigmoid.compareTo(a) <= 0, "sigmoid " + time);
                }
            }
        }
    }

    @Test
    void triangleWaveHasNoJumps() {
        BigDecimal p = n("2");
        BigDecimal epsilon = n("1E-10");
        for (int quarter = -8; quarter <= 8; quarter++) {
            BigDecimal t = p.multiply(BigDecimal.valueOf(quarter)).divide(n("4"));
            BigDecimal before = Waveforms.triangleWave(context, t.subtract(epsilon), BigDecimal.ONE, p);
            BigDecimal after = Waveforms.triangleWave(context, t.add(epsilon), BigDecimal.ONE, p);
            assertTrue(before.subtract(after).abs().compareTo(n("1E-8")) < 0, "triangle jump at " + t);
        }
    }

    @Test
    void sawtoothDropsToZeroAtEveryPeriodBoundary() {
        BigDecimal p = n("2");
        BigDecimal epsilon = n("1E-10");
        for (int k = -3; k <= 3; k++) {
            BigDecimal boundary = p.multiply(BigDecimal.valueOf(k));
            BigDecimal before = Waveforms.sawtoothWave(context, boundary.subtract(epsilon), BigDecimal.ONE, p);
            BigDecimal at = Waveforms.sawtoothWave(context, boundary, BigDecimal.ONE, p);
            assertTrue(before.compareTo(n("0.99")) > 0, "before boundary " + boundary);
            assertEquals(0, at.signum(), "at boundary " + boundary);
        }
    }

    @Test
    void sigmoidIncreasesAndSaturates() {
        BigDecimal previous = BigDecimal.ZERO;
        for (int t = -20; t <= 20; t++) {
            BigDecimal value = Waveforms.sigmoidWave(context, BigDecimal.valueOf(t));
            assertTrue(value.compareTo(previous) > 0, "sigmoid not increasing at " + t);
            previous = value;
        }
        assertTrue(Waveforms.sigmoidWave(context, n("-1000")).signum() > 0);
        assertTrue(Waveforms.sigmoidWave(context, n("1000")).compareTo(BigDecimal.ONE) <= 0);

        BigDecimal farLeft = Waveforms.sigmoidWave(context, n("-1E10"));
        BigDecimal farRight = Waveforms.sigmoidWave(context, n("1E10"));
        assertTrue(farLeft.signum() >= 0 && farLeft.compareTo(n("1E-1000")) < 0, "sigmoid(-1E10) = " + farLeft);
        assertEquals(0, BigDecimal.ONE.compareTo(farRight), "sigmoid(1E10) = " + farRight);
    }

    @Test
    void squareWaveParityHoldsBeyondWorkingPrecision() {
        BigDecimal p = n("2");
        for (String time : new String[] {"200000000000001", "-200000000000001", "-199999999999999"}) {
            BigDecimal square = Waveforms.squareWave(context, n(time), BigDecimal.ONE, p);
            assertEquals(0, n("-1").compareTo(square), "square at " + time);
        }
        assertEquals(0, BigDecimal.ONE.compareTo(Waveforms.squareWave(context, n("200000000000002"), BigDecimal.ONE, p)));
    }

    @Test
    void sameInputsGiveSameOutputs() {
        BigDecimal t = n("0.3");
        assertEquals(Waveforms.triangleWave(context, t, n("1"), n("2.5")),
                Waveforms.triangleWave(context, t, n("1"), n("2.5")));
        assertEquals(Waveforms.sigmoidWave(context, t), Waveforms.sigmoidWave(context, t));
    }

    @Test
    void concurrentEvaluationsAtDifferentPrecisionsDoNotInterfere() throws Exception {
        BigDecimalContext coarse = BigDecimalContext.ofDigits(10);
        BigDecimalContext fine = BigDecimalContext.ofDigits(40);
        BigDecimal t = n("1");
        BigDecimal coarseExpected = Waveforms.sigmoidWave(coarse, t);
        BigDecimal fineExpected = Waveforms.sigmoidWave(fine, t);
        assertTrue(coarseExpected.precision() <= 10);
        assertTrue(fineExpected.precision() > 10);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                boolean useFine = i % 2 == 0;
                results.add(executor.submit(() -> useFine
                        ? fineExpected.equals(Waveforms.sigmoidWave(fine, t))
                        : coarseExpected.equals(Waveforms.sigmoidWave(coarse, t))));
            }
            for (Future<Boolean> result : results) {
                assertTrue(result.get());
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
