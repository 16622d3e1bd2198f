package com.lidar.overtake.engine.graph;

import com.lidar.overtake.engine.DetectionParameters;
import com.lidar.overtake.model.GraphStrategy;
import com.lidar.overtake.model.ProximityGraph;
import com.lidar.overtake.model.Sample;

import java.util.List;

/**
 * Turns a time-ordered sample sequence into a graph over the sample indices.
 * Each implementation handles one {@link GraphStrategy}.
 */
public interface GraphBuilder {

    /**
     * The strategy this builder implements.
     */
    GraphStrategy getSupportedStrategy();

    /**
     * @param samples time-sorted samples, index i at position i
     * @param params  validated parameters
     * @return a graph whose nodes are exactly 0..samples.size()-1
     */
    ProximityGraph build(List<Sample> samples, DetectionParameters params);
}
