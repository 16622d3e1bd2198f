package com.lidar.overtake.model;

import lombok.Value;

/**
 * One lidar reading at its position in the trace.
 * Timestamps are epoch seconds and must be non-decreasing along the index.
 */
@Value
public class Sample {
    int index;
    double timestamp;
    int value;
}
