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
@Schema(description = "Low-distance community with its outliers removed")
public class Segment {

    @Schema(description = "Position of the selected community in the partition", example = "1")
    private int communityIndex;

    @Schema(description = "Sample indices of the selected community, ascending")
    private List<Integer> members;

    @Schema(description = "Arithmetic mean of the community's values", example = "431.5")
    private double meanValue;

    @Schema(description = "Median of the community's values", example = "428.0")
    private double medianValue;

    @Schema(description = "Timestamps of the members that survived the median filter")
    private List<Double> timestamps;

    @Schema(description = "Values of the members that survived the median filter")
    private List<Integer> values;
}
