package com.lidar.overtake.controller;

import com.lidar.overtake.engine.InvalidDetectionParametersException;
import com.lidar.overtake.model.DetectionRequest;
import com.lidar.overtake.model.DetectionResult;
import com.lidar.overtake.model.PartitionResult;
import com.lidar.overtake.repository.DetectionResultRepository;
import com.lidar.overtake.service.OvertakeDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/detections")
@Tag(name = "Detections", description = "Run overtake detection over lidar traces and fetch stored results")
public class DetectionController {

    private final OvertakeDetectionService detectionService;
    private final DetectionResultRepository resultRepository;

    public DetectionController(OvertakeDetectionService detectionService,
                               DetectionResultRepository resultRepository) {
        this.detectionService = detectionService;
        this.resultRepository = resultRepository;
    }

    @Operation(summary = "Detect the overtake segment in a trace",
            description = "Builds the proximity graph, partitions it with Louvain and selects the largest " +
                    "low-distance community, filtered around its median. A trace without a qualifying " +
                    "community returns segmentFound=false.")
    @PostMapping("/evaluate")
    public ResponseEntity<?> evaluate(@RequestBody DetectionRequest request) {
        if (request.getReadings() == null) {
            return badRequest("readings must be present", "readings");
        }
        try {
            DetectionResult result = detectionService.detect(request);
            return ResponseEntity.ok(result);
        } catch (InvalidDetectionParametersException e) {
            return badRequest(e.getMessage(), e.getField());
        }
    }

    @Operation(summary = "Partition a trace into communities",
            description = "Builds and partitions the proximity graph only. Returns the communities " +
                    "(sets of sample indices) and the modularity of the partition.")
    @PostMapping("/partition")
    public ResponseEntity<?> partition(@RequestBody DetectionRequest request) {
        if (request.getReadings() == null) {
            return badRequest("readings must be present", "readings");
        }
        try {
            PartitionResult result = detectionService.partition(request);
            return ResponseEntity.ok(result);
        } catch (InvalidDetectionParametersException e) {
            return badRequest(e.getMessage(), e.getField());
        }
    }

    @Operation(summary = "Get a stored detection result",
            description = "Retrieves a previously persisted detection result by its identifier.")
    @GetMapping("/results/{detectionId}")
    public ResponseEntity<DetectionResult> getResult(
            @Parameter(description = "Detection ID", example = "lidar_17")
            @PathVariable String detectionId) {
        DetectionResult result = resultRepository.findById(detectionId);
        if (result == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(result);
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }
}
