package com.lidar.overtake.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A time-ordered lidar trace plus optional parameter overrides")
public class DetectionRequest {

    @Schema(description = "Caller-chosen identifier; generated when absent", example = "lidar_17")
    private String detectionId;

    @Schema(description = "Time-ordered readings")
    private List<SampleReading> readings;

    // Overrides: null means "use the configured default"

    @Schema(description = "Maximum time gap in seconds for a direct edge", example = "0.4")
    private Double xgap;

    @Schema(description = "Maximum value gap for any edge", example = "40.0")
    private Double ygap;

    @Schema(description = "Fraction of xgap used by the second-order closeness rule", example = "1.0")
    private Double epsilon;

    @Schema(description = "Communities with a mean below this are overtake candidates", example = "520")
    private Double lowDistanceThreshold;

    @Schema(description = "Allowed deviation from the segment median, as a fraction", example = "0.08")
    private Double outlierTolerance;

    @Schema(description = "Graph construction strategy", example = "PROXIMITY")
    private GraphStrategy graphStrategy;

    @Schema(description = "Evaluate the second-order rule against first-order neighbors only", example = "false")
    private Boolean symmetricEpsilonRule;

    @Schema(description = "Exponent applied to inverse distances by the WEIGHTED strategy", example = "1.0")
    private Double weightExponent;

    @Schema(description = "Community detection algorithm", example = "LOUVAIN")
    private PartitionAlgorithm algorithm;

    @Schema(description = "Louvain resolution; values above 1 favour smaller communities", example = "1.0")
    private Double resolution;

    @Schema(description = "Minimum modularity improvement for another aggregation level", example = "1e-7")
    private Double gainThreshold;
}
