package com.lidar.overtake.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Community partition of the proximity graph")
public class PartitionResult {

    @Schema(description = "Disjoint sets of sample indices, ordered by smallest member", example = "[[0,1,2],[3,4,5]]")
    private List<Set<Integer>> communities;

    @Schema(description = "Modularity of the partition (0.0 for degenerate graphs)", example = "0.5")
    private double modularity;

    @Schema(description = "Algorithm that produced the partition", example = "LOUVAIN")
    private PartitionAlgorithm algorithm;

    @Schema(description = "Number of aggregation levels the algorithm went through", example = "2")
    private int levels;

    @Schema(description = "Number of graph nodes (samples)", example = "6")
    private int nodeCount;

    @Schema(description = "Number of graph edges", example = "6")
    private int edgeCount;

    @Schema(description = "True when the graph had no edges and no partition could be formed", example = "false")
    private boolean degenerate;
}
