package com.lidar.overtake.engine.community;

import com.lidar.overtake.model.PartitionAlgorithm;

public class UnsupportedPartitionAlgorithmException extends RuntimeException {

    public UnsupportedPartitionAlgorithmException(PartitionAlgorithm algorithm) {
        super("No community detector registered for algorithm: " + algorithm);
    }
}
