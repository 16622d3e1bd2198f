package com.lidar.overtake.model;

public enum GraphStrategy {
    PROXIMITY,  // binary edges from the time/value closeness rule
    WEIGHTED    // inverse index/value distance weights
}
