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
@Schema(description = "Result of running the overtake detection pipeline over one trace")
public class DetectionResult {

    @Schema(description = "Detection identifier", example = "lidar_17")
    private String detectionId;

    @Schema(description = "Number of samples in the trace", example = "412")
    private int sampleCount;

    @Schema(description = "Number of edges in the proximity graph", example = "8120")
    private int edgeCount;

    @Schema(description = "Number of communities found", example = "4")
    private int communityCount;

    @Schema(description = "Communities as sets of sample indices")
    private List<Set<Integer>> communities;

    @Schema(description = "Modularity of the partition", example = "0.61")
    private double modularity;

    @Schema(description = "True when the graph had no edges", example = "false")
    private boolean partitionDegenerate;

    @Schema(description = "Whether an overtake segment was found", example = "true")
    private boolean segmentFound;

    @Schema(description = "The overtake segment, absent when none was found")
    private Segment segment;

    @Schema(description = "Explanation of the selection outcome")
    private String reason;

    @Schema(description = "Evaluation timestamp in epoch milliseconds", example = "1739886764000")
    private long detectedAt;
}
