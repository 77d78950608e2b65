package com.example.waveforms;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;

/**
 * Simple bootstrap logging a few samples of every waveform.
 */
public final class Application {
    private static final Logger log = LoggerFactory.getLogger(Application.class);

    private static final double[] TIMES = {-1.0, -0.5, 0.0, 0.25, 0.5, 1.0, 1.5, 2.0};

    private Application() {
    }

    public static void main(String[] args) {
        BigDecimalContext context = BigDecimalContext.ofDigits(25);
        BigDecimal amplitude = context.valueOf(1L);
        BigDecimal period = context.valueOf(2L);

        for (Waveform waveform : Waveform.values()) {
            SignalFunction<BigDecimal> signal = waveform.bind(context, amplitude, period);
            StringBuilder line = new StringBuilder();
            for (double time : TIMES) {
                BigDecimal t = context.valueOf(time);
                if (line.length() > 0) {
                    line.append(", ");
                }
                line.append(t.stripTrailingZeros().toPlainString())
                        .append(" -> ")
                        .append(signal.evaluate(t).stripTrailingZeros().toPlainString());
            }
            log.info("{} (period {}): {}", waveform, waveform.isPeriodic() ? period : "n/a", line);
        }

        log.info("Host-precision unit triangle at 0.5: {}", Waveforms.unitTriangle(0.5));
    }
}
