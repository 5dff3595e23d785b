package com.sandy.netwatch.monitor.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StorageStatistics {
    int keys;
    long blocksWritten;
    long compressedBlocks;
    long bytesSaved;
    long writeFailures;
    long pointsAggregated;
    long pointsDropped;
    long lastSweepEpoch;
}
