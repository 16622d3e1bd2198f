package com.lidar.overtake.engine.community;

import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Partitions produced at successive aggregation levels, finest first.
 * Every level is a partition of the original node indices.
 */
@Value
public class CommunityHierarchy {

    List<List<Set<Integer>>> levels;

    public List<Set<Integer>> getFinalPartition() {
        return levels.isEmpty() ? Collections.emptyList() : levels.get(levels.size() - 1);
    }

    public int getLevelCount() {
        return levels.size();
    }
}
