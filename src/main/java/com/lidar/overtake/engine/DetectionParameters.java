package com.lidar.overtake.engine;

import com.lidar.overtake.config.DetectionConfig;
import com.lidar.overtake.model.GraphStrategy;
import com.lidar.overtake.model.PartitionAlgorithm;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of the numeric knobs for one detection run.
 * Engine components assume a validated instance and do not re-check per pair.
 */
@Value
@Builder(toBuilder = true)
public class DetectionParameters {

    double xgap;
    double ygap;
    double epsilon;
    GraphStrategy graphStrategy;
    boolean symmetricEpsilonRule;
    double weightExponent;
    PartitionAlgorithm algorithm;
    double resolution;
    double gainThreshold;
    double lowDistanceThreshold;
    double outlierTolerance;

    public static DetectionParameters from(DetectionConfig config) {
        return DetectionParameters.builder()
                .xgap(config.getXgap())
                .ygap(config.getYgap())
                .epsilon(config.getEpsilon())
                .graphStrategy(config.getGraphStrategy())
                .symmetricEpsilonRule(config.isSymmetricEpsilonRule())
                .weightExponent(config.getWeightExponent())
                .algorithm(config.getAlgorithm())
                .resolution(config.getResolution())
                .gainThreshold(config.getGainThreshold())
                .lowDistanceThreshold(config.getLowDistanceThreshold())
                .outlierTolerance(config.getOutlierTolerance())
                .build();
    }

    public static DetectionParameters defaults() {
        return from(new DetectionConfig());
    }

    /**
     * @return this instance, for chaining
     * @throws InvalidDetectionParametersException naming the first offending field
     */
    public DetectionParameters validate() {
        requireNonNegative("xgap", xgap);
        requireNonNegative("ygap", ygap);
        requireNonNegative("epsilon", epsilon);
        requireNonNegative("weightExponent", weightExponent);
        requireNonNegative("gainThreshold", gainThreshold);
        requireNonNegative("lowDistanceThreshold", lowDistanceThreshold);
        requireNonNegative("outlierTolerance", outlierTolerance);
        if (!(resolution > 0) || Double.isInfinite(resolution)) {
            throw new InvalidDetectionParametersException("resolution",
                    "resolution must be a finite number > 0, got " + resolution);
        }
        if (graphStrategy == null) {
            throw new InvalidDetectionParametersException("graphStrategy", "graphStrategy must be set");
        }
        if (algorithm == null) {
            throw new InvalidDetectionParametersException("algorithm", "algorithm must be set");
        }
        return this;
    }

    private static void requireNonNegative(String field, double value) {
        // NaN fails the comparison as well
        if (!(value >= 0) || Double.isInfinite(value)) {
            throw new InvalidDetectionParametersException(field,
                    field + " must be a finite number >= 0, got " + value);
        }
    }
}
