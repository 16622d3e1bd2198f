package com.lidar.overtake.controller;

import com.lidar.overtake.config.AerospikeConfig;
import com.lidar.overtake.config.DetectionConfig;
import com.lidar.overtake.engine.DetectionParameters;
import com.lidar.overtake.engine.InvalidDetectionParametersException;
import com.lidar.overtake.model.GraphStrategy;
import com.lidar.overtake.model.PartitionAlgorithm;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify the default detection parameters")
public class ConfigController {

    private final DetectionConfig detectionConfig;
    private final AerospikeConfig aerospikeConfig;

    public ConfigController(DetectionConfig detectionConfig, AerospikeConfig aerospikeConfig) {
        this.detectionConfig = detectionConfig;
        this.aerospikeConfig = aerospikeConfig;
    }

    // ── Detection parameters ──

    @Operation(summary = "Get default detection parameters")
    @GetMapping("/detection")
    public ResponseEntity<Map<String, Object>> getDetectionConfig() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("xgap", detectionConfig.getXgap());
        response.put("ygap", detectionConfig.getYgap());
        response.put("epsilon", detectionConfig.getEpsilon());
        response.put("graphStrategy", String.valueOf(detectionConfig.getGraphStrategy()));
        response.put("symmetricEpsilonRule", detectionConfig.isSymmetricEpsilonRule());
        response.put("weightExponent", detectionConfig.getWeightExponent());
        response.put("algorithm", String.valueOf(detectionConfig.getAlgorithm()));
        response.put("resolution", detectionConfig.getResolution());
        response.put("gainThreshold", detectionConfig.getGainThreshold());
        response.put("lowDistanceThreshold", detectionConfig.getLowDistanceThreshold());
        response.put("outlierTolerance", detectionConfig.getOutlierTolerance());
        response.put("persistResults", detectionConfig.isPersistResults());
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Update default detection parameters",
            description = "Changes apply to subsequent detections but reset on restart.")
    @PutMapping("/detection")
    public ResponseEntity<?> updateDetectionConfig(@RequestBody Map<String, Object> body) {
        GraphStrategy strategy = detectionConfig.getGraphStrategy();
        Object rawStrategy = body.get("graphStrategy");
        if (rawStrategy != null) {
            try {
                strategy = GraphStrategy.valueOf(rawStrategy.toString().toUpperCase());
            } catch (IllegalArgumentException e) {
                return badRequest("graphStrategy must be one of PROXIMITY, WEIGHTED", "graphStrategy");
            }
        }

        PartitionAlgorithm algorithm = detectionConfig.getAlgorithm();
        Object rawAlgorithm = body.get("algorithm");
        if (rawAlgorithm != null) {
            try {
                algorithm = PartitionAlgorithm.valueOf(rawAlgorithm.toString().toUpperCase());
            } catch (IllegalArgumentException e) {
                return badRequest("algorithm must be one of LOUVAIN", "algorithm");
            }
        }

        DetectionParameters candidate = DetectionParameters.from(detectionConfig).toBuilder()
                .xgap(toDouble(body, "xgap", detectionConfig.getXgap()))
                .ygap(toDouble(body, "ygap", detectionConfig.getYgap()))
                .epsilon(toDouble(body, "epsilon", detectionConfig.getEpsilon()))
                .graphStrategy(strategy)
                .symmetricEpsilonRule(toBoolean(body, "symmetricEpsilonRule", detectionConfig.isSymmetricEpsilonRule()))
                .weightExponent(toDouble(body, "weightExponent", detectionConfig.getWeightExponent()))
                .algorithm(algorithm)
                .resolution(toDouble(body, "resolution", detectionConfig.getResolution()))
                .gainThreshold(toDouble(body, "gainThreshold", detectionConfig.getGainThreshold()))
                .lowDistanceThreshold(toDouble(body, "lowDistanceThreshold", detectionConfig.getLowDistanceThreshold()))
                .outlierTolerance(toDouble(body, "outlierTolerance", detectionConfig.getOutlierTolerance()))
                .build();

        try {
            candidate.validate();
        } catch (InvalidDetectionParametersException e) {
            return badRequest(e.getMessage(), e.getField());
        }

        detectionConfig.setXgap(candidate.getXgap());
        detectionConfig.setYgap(candidate.getYgap());
        detectionConfig.setEpsilon(candidate.getEpsilon());
        detectionConfig.setGraphStrategy(candidate.getGraphStrategy());
        detectionConfig.setSymmetricEpsilonRule(candidate.isSymmetricEpsilonRule());
        detectionConfig.setWeightExponent(candidate.getWeightExponent());
        detectionConfig.setAlgorithm(candidate.getAlgorithm());
        detectionConfig.setResolution(candidate.getResolution());
        detectionConfig.setGainThreshold(candidate.getGainThreshold());
        detectionConfig.setLowDistanceThreshold(candidate.getLowDistanceThreshold());
        detectionConfig.setOutlierTolerance(candidate.getOutlierTolerance());
        detectionConfig.setPersistResults(toBoolean(body, "persistResults", detectionConfig.isPersistResults()));

        return getDetectionConfig();
    }

    // ── Aerospike (read-only) ──

    @Operation(summary = "Get Aerospike connection info (read-only)")
    @GetMapping("/aerospike")
    public ResponseEntity<Map<String, Object>> getAerospikeInfo() {
        return ResponseEntity.ok(Map.of(
                "host", aerospikeConfig.getHost(),
                "port", aerospikeConfig.getPort(),
                "namespace", aerospikeConfig.getNamespace()
        ));
    }

    // ── Helpers ──

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private double toDouble(Map<String, Object> body, String key, double defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.doubleValue();
        try { return Double.parseDouble(v.toString()); } catch (NumberFormatException e) { return Double.NaN; }
    }

    private boolean toBoolean(Map<String, Object> body, String key, boolean defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Boolean b) return b;
        return Boolean.parseBoolean(v.toString());
    }
}
