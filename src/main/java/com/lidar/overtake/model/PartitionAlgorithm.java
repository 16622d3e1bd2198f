package com.lidar.overtake.model;

public enum PartitionAlgorithm {
    LOUVAIN
}
