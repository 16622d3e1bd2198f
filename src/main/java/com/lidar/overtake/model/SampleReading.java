package com.lidar.overtake.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A single (timestamp, distance) reading as produced by the trace loader")
public class SampleReading {

    @Schema(description = "Epoch seconds (fractional)", example = "1718093051.02")
    private double timestamp;

    @Schema(description = "Measured distance in sensor units, null readings already coerced to 0", example = "512")
    private int value;
}
