package com.lidar.overtake.engine.community;

import com.lidar.overtake.engine.DetectionParameters;
import com.lidar.overtake.model.PartitionAlgorithm;
import com.lidar.overtake.model.ProximityGraph;

/**
 * Interface for community detection strategies.
 * Each implementation handles a specific PartitionAlgorithm.
 */
public interface CommunityDetector {

    /**
     * The algorithm this detector implements.
     */
    PartitionAlgorithm getSupportedAlgorithm();

    /**
     * Partition a graph that has at least one edge.
     *
     * @param graph  the graph to partition
     * @param params validated run parameters (resolution, gain threshold)
     * @return the partition at every level, expressed in original node indices
     */
    CommunityHierarchy detect(ProximityGraph graph, DetectionParameters params);
}
