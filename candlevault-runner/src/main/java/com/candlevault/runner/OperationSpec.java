package com.candlevault.runner;

import com.candlevault.core.time.WindowRequest;

/**
 * One named operation after defaults have been applied.
 * The type is kept as written so an unknown type is reported when the operation runs.
 */
public record OperationSpec(
    String name,
    String type,
    String symbol,
    String interval,
    String lookback,
    String startTime,
    String endTime,
    String timeInputTimezone,
    String sliceOutputPath
) {
    public WindowRequest toWindowRequest() {
        return new WindowRequest(startTime, endTime, lookback, timeInputTimezone);
    }
}
