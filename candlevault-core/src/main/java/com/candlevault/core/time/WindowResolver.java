package com.candlevault.core.time;

import com.candlevault.core.error.CandleVaultException;
import com.candlevault.core.model.TimeWindow;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Turns explicit bounds, a lookback and an input timezone into a concrete UTC window.
 *
 * Rules, in order:
 * <ol>
 *   <li>no start and no end: [now - lookback, now], lookback required</li>
 *   <li>start only: end is now</li>
 *   <li>end only: start is end - lookback, lookback required</li>
 *   <li>both: used as given</li>
 * </ol>
 */
public class WindowResolver {

    private final Clock clock;

    public WindowResolver() {
        this(Clock.systemUTC());
    }

    public WindowResolver(Clock clock) {
        this.clock = clock;
    }

    public TimeWindow resolve(WindowRequest request) throws CandleVaultException {
        return resolve(request.start(), request.end(), request.lookback(), request.inputTz());
    }

    public TimeWindow resolve(String start, String end, String lookback, String inputTz)
            throws CandleVaultException {
        Instant now = clock.instant();
        Instant startTime = isBlank(start) ? null : TimestampParser.parse(start, inputTz);
        Instant endTime = isBlank(end) ? null : TimestampParser.parse(end, inputTz);

        if (startTime == null && endTime == null) {
            if (isBlank(lookback)) {
                throw CandleVaultException.missingWindowInput("Provide either start/end or lookback");
            }
            endTime = now;
            startTime = minus(now, Lookback.parse(lookback));
        } else if (endTime == null) {
            endTime = now;
        } else if (startTime == null) {
            if (isBlank(lookback)) {
                throw CandleVaultException.missingWindowInput("Provide start or lookback together with end");
            }
            startTime = minus(endTime, Lookback.parse(lookback));
        }

        if (startTime.isAfter(endTime)) {
            throw CandleVaultException.invalidWindow(
                "start time must be before end time: " + startTime + " > " + endTime);
        }
        return new TimeWindow(startTime, endTime);
    }

    private static Instant minus(Instant instant, Duration duration) throws CandleVaultException {
        try {
            return instant.minus(duration);
        } catch (ArithmeticException | java.time.DateTimeException e) {
            throw CandleVaultException.invalidWindow("Lookback " + duration + " reaches beyond the supported range", e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
