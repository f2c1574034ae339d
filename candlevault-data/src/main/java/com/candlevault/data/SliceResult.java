package com.candlevault.data;

import java.nio.file.Path;

/**
 * Sync outcome plus where the sliced window was written and how many candles it holds.
 */
public record SliceResult(SyncResult sync, Path target, int sliceRows) {
}
