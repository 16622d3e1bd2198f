package com.lidar.overtake.service;

import com.lidar.overtake.config.DetectionConfig;
import com.lidar.overtake.config.MetricsConfig;
import com.lidar.overtake.engine.DetectionParameters;
import com.lidar.overtake.engine.InvalidDetectionParametersException;
import com.lidar.overtake.engine.community.ModularityPartitioner;
import com.lidar.overtake.engine.graph.GraphBuilder;
import com.lidar.overtake.engine.selection.AnomalySegmentSelector;
import com.lidar.overtake.model.DetectionRequest;
import com.lidar.overtake.model.DetectionResult;
import com.lidar.overtake.model.GraphStrategy;
import com.lidar.overtake.model.PartitionResult;
import com.lidar.overtake.model.ProximityGraph;
import com.lidar.overtake.model.Sample;
import com.lidar.overtake.model.SampleReading;
import com.lidar.overtake.model.SegmentSelection;
import com.lidar.overtake.repository.DetectionResultRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Main orchestrator for overtake detection.
 *
 * Flow:
 * 1. Resolve parameters (request overrides on top of configured defaults) and validate once
 * 2. Convert readings to indexed samples, rejecting malformed sequences
 * 3. Build the proximity graph with the selected strategy
 * 4. Partition the graph into communities
 * 5. Select and denoise the low-distance community
 * 6. Persist the result and record metrics
 */
@Service
public class OvertakeDetectionService {

    private static final Logger log = LoggerFactory.getLogger(OvertakeDetectionService.class);

    private final Map<GraphStrategy, GraphBuilder> builderMap;
    private final ModularityPartitioner partitioner;
    private final AnomalySegmentSelector selector;
    private final DetectionResultRepository resultRepository;
    private final DetectionConfig detectionConfig;
    private final MetricsConfig metricsConfig;

    public OvertakeDetectionService(List<GraphBuilder> builders,
                                    ModularityPartitioner partitioner,
                                    AnomalySegmentSelector selector,
                                    DetectionResultRepository resultRepository,
                                    DetectionConfig detectionConfig,
                                    MetricsConfig metricsConfig) {
        this.builderMap = new EnumMap<>(GraphStrategy.class);
        for (GraphBuilder builder : builders) {
            builderMap.put(builder.getSupportedStrategy(), builder);
        }
        this.partitioner = partitioner;
        this.selector = selector;
        this.resultRepository = resultRepository;
        this.detectionConfig = detectionConfig;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Run the full pipeline over one trace.
     *
     * @throws InvalidDetectionParametersException if a parameter or the readings are invalid
     */
    @Observed(name = "detection.evaluate", contextualName = "evaluate-trace")
    public DetectionResult detect(DetectionRequest request) {
        DetectionParameters params = resolveParameters(request);
        List<Sample> samples = toSamples(request.getReadings());
        String detectionId = request.getDetectionId() != null
                ? request.getDetectionId()
                : UUID.randomUUID().toString();

        log.info("{}: Processing trace of {} samples", detectionId, samples.size());

        ProximityGraph graph = buildGraph(samples, params);
        PartitionResult partition = partitioner.partition(graph, params);
        SegmentSelection selection = selector.select(samples, partition.getCommunities(), params);

        DetectionResult result = DetectionResult.builder()
                .detectionId(detectionId)
                .sampleCount(samples.size())
                .edgeCount(graph.getEdgeCount())
                .communityCount(partition.getCommunities().size())
                .communities(partition.getCommunities())
                .modularity(partition.getModularity())
                .partitionDegenerate(partition.isDegenerate())
                .segmentFound(selection.isFound())
                .segment(selection.getSegment())
                .reason(selection.getReason())
                .detectedAt(System.currentTimeMillis())
                .build();

        String outcome = partition.isDegenerate() ? "DEGENERATE" : selection.isFound() ? "FOUND" : "NOT_FOUND";
        metricsConfig.recordDetection(outcome, samples.size());

        if (detectionConfig.isPersistResults()) {
            try {
                resultRepository.save(result);
            } catch (Exception e) {
                metricsConfig.recordPersistenceFailure();
                log.error("{}: Failed to persist detection result", detectionId, e);
            }
        }

        if (selection.isFound()) {
            log.info("{}: Overtake segment found: {} of {} samples kept",
                    detectionId, selection.getSegment().getValues().size(), samples.size());
        } else {
            log.warn("{}: No overtake segment found: {}", detectionId, selection.getReason());
        }
        return result;
    }

    /**
     * Build and partition the graph without selecting a segment.
     */
    public PartitionResult partition(DetectionRequest request) {
        DetectionParameters params = resolveParameters(request);
        List<Sample> samples = toSamples(request.getReadings());
        return partitioner.partition(buildGraph(samples, params), params);
    }

    DetectionParameters resolveParameters(DetectionRequest request) {
        DetectionParameters.DetectionParametersBuilder builder =
                DetectionParameters.from(detectionConfig).toBuilder();
        if (request.getXgap() != null) builder.xgap(request.getXgap());
        if (request.getYgap() != null) builder.ygap(request.getYgap());
        if (request.getEpsilon() != null) builder.epsilon(request.getEpsilon());
        if (request.getLowDistanceThreshold() != null) builder.lowDistanceThreshold(request.getLowDistanceThreshold());
        if (request.getOutlierTolerance() != null) builder.outlierTolerance(request.getOutlierTolerance());
        if (request.getGraphStrategy() != null) builder.graphStrategy(request.getGraphStrategy());
        if (request.getSymmetricEpsilonRule() != null) builder.symmetricEpsilonRule(request.getSymmetricEpsilonRule());
        if (request.getWeightExponent() != null) builder.weightExponent(request.getWeightExponent());
        if (request.getAlgorithm() != null) builder.algorithm(request.getAlgorithm());
        if (request.getResolution() != null) builder.resolution(request.getResolution());
        if (request.getGainThreshold() != null) builder.gainThreshold(request.getGainThreshold());
        return builder.build().validate();
    }

    static List<Sample> toSamples(List<SampleReading> readings) {
        if (readings == null || readings.isEmpty()) {
            return Collections.emptyList();
        }
        List<Sample> samples = new ArrayList<>(readings.size());
        double previous = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < readings.size(); i++) {
            SampleReading reading = readings.get(i);
            if (reading == null) {
                throw new InvalidDetectionParametersException("readings", "Reading " + i + " is null");
            }
            double t = reading.getTimestamp();
            if (Double.isNaN(t) || Double.isInfinite(t)) {
                throw new InvalidDetectionParametersException("readings",
                        "Reading " + i + " has a non-finite timestamp");
            }
            if (t < previous) {
                throw new InvalidDetectionParametersException("readings",
                        "Readings must be time-ordered: reading " + i + " precedes reading " + (i - 1));
            }
            if (reading.getValue() < 0) {
                throw new InvalidDetectionParametersException("readings",
                        "Reading " + i + " has a negative value " + reading.getValue());
            }
            samples.add(new Sample(i, t, reading.getValue()));
            previous = t;
        }
        return samples;
    }

    private ProximityGraph buildGraph(List<Sample> samples, DetectionParameters params) {
        GraphBuilder builder = builderMap.get(params.getGraphStrategy());
        if (builder == null) {
            throw new InvalidDetectionParametersException("graphStrategy",
                    "No graph builder registered for strategy: " + params.getGraphStrategy());
        }
        ProximityGraph graph = builder.build(samples, params);
        metricsConfig.recordGraph(params.getGraphStrategy().name(), graph.getNodeCount(), graph.getEdgeCount());
        log.debug("Graph built with {}: {} nodes, {} edges",
                builder.getClass().getSimpleName(), graph.getNodeCount(), graph.getEdgeCount());
        return graph;
    }
}
