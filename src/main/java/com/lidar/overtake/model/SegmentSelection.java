package com.lidar.overtake.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outcome of the anomalous segment selection")
public class SegmentSelection {

    @Schema(description = "Whether a community qualified as the anomalous segment", example = "true")
    private boolean found;

    @Schema(description = "The selected segment, absent when nothing qualified")
    private Segment segment;

    @Schema(description = "Human-readable explanation of the outcome")
    private String reason;

    public static SegmentSelection found(Segment segment, String reason) {
        return new SegmentSelection(true, segment, reason);
    }

    public static SegmentSelection notFound(String reason) {
        return new SegmentSelection(false, null, reason);
    }
}
