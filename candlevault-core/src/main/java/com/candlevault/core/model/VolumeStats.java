package com.candlevault.core.model;

/**
 * Volume aggregate over an inclusive window.
 *
 * @param rows       number of candles with a usable volume inside the window
 * @param meanVolume arithmetic mean of those volumes
 * @param p95Volume  95th percentile, linear interpolation between order statistics
 */
public record VolumeStats(
    String symbol,
    String interval,
    TimeWindow window,
    int rows,
    double meanVolume,
    double p95Volume
) {
}
