package com.candlevault.data;

import com.candlevault.core.model.VolumeStats;

import java.util.Optional;

/**
 * Sync outcome plus the volume statistics of the requested window, empty when there is no data.
 */
public record StatsResult(SyncResult sync, Optional<VolumeStats> stats) {
}
