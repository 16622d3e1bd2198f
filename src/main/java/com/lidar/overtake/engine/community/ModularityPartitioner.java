package com.lidar.overtake.engine.community;

import com.lidar.overtake.config.MetricsConfig;
import com.lidar.overtake.engine.DetectionParameters;
import com.lidar.overtake.model.PartitionAlgorithm;
import com.lidar.overtake.model.PartitionResult;
import com.lidar.overtake.model.ProximityGraph;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Partitions a proximity graph into communities and scores the partition by modularity.
 * The algorithm is chosen by {@link PartitionAlgorithm}; each tag is served by a
 * registered {@link CommunityDetector}.
 *
 * A graph without edges cannot be partitioned meaningfully: the result is an empty,
 * degenerate partition with modularity 0.0. A single-node graph is the one exception
 * and yields its singleton community.
 */
@Component
public class ModularityPartitioner {

    private static final Logger log = LoggerFactory.getLogger(ModularityPartitioner.class);

    private final Map<PartitionAlgorithm, CommunityDetector> detectorMap;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public ModularityPartitioner(List<CommunityDetector> detectors, Tracer tracer, MetricsConfig metricsConfig) {
        this.detectorMap = new EnumMap<>(PartitionAlgorithm.class);
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        for (CommunityDetector detector : detectors) {
            detectorMap.put(detector.getSupportedAlgorithm(), detector);
            log.info("Registered community detector: {} -> {}",
                    detector.getSupportedAlgorithm(), detector.getClass().getSimpleName());
        }
    }

    public PartitionResult partition(ProximityGraph graph) {
        return partition(graph, DetectionParameters.defaults());
    }

    public PartitionResult partition(ProximityGraph graph, PartitionAlgorithm algorithm) {
        return partition(graph, DetectionParameters.defaults().toBuilder().algorithm(algorithm).build());
    }

    public PartitionResult partition(ProximityGraph graph, DetectionParameters params) {
        PartitionAlgorithm algorithm = params.getAlgorithm();
        CommunityDetector detector = detectorMap.get(algorithm);
        if (detector == null) {
            throw new UnsupportedPartitionAlgorithmException(algorithm);
        }

        int n = graph.getNodeCount();
        if (n == 1) {
            Set<Integer> only = new TreeSet<>(Set.of(0));
            return result(List.of(only), 0.0, algorithm, 0, graph, false);
        }
        if (graph.getEdgeCount() == 0 || graph.getTotalWeight() <= 0) {
            log.warn("Graph has {} edges with total weight {} over {} nodes. Cannot construct a valid partition.",
                    graph.getEdgeCount(), graph.getTotalWeight(), n);
            metricsConfig.recordDegeneratePartition(algorithm.name());
            return result(Collections.emptyList(), 0.0, algorithm, 0, graph, true);
        }

        Span span = tracer.nextSpan()
                .name("partition." + algorithm)
                .tag("graph.nodes", String.valueOf(n))
                .tag("graph.edges", String.valueOf(graph.getEdgeCount()))
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            log.info("Partitioning graph: {} nodes, {} edges, algorithm={}", n, graph.getEdgeCount(), algorithm);
            CommunityHierarchy hierarchy = detector.detect(graph, params);
            List<Set<Integer>> communities = hierarchy.getFinalPartition();
            double modularity = Modularity.compute(graph, communities);

            span.tag("partition.communities", String.valueOf(communities.size()));
            span.tag("partition.modularity", String.valueOf(modularity));
            metricsConfig.recordPartition(algorithm.name(), communities.size(), modularity);
            log.info("Done partitioning graph: {} communities over {} levels, modularity={}",
                    communities.size(), hierarchy.getLevelCount(), modularity);

            return result(communities, modularity, algorithm, hierarchy.getLevelCount(), graph, false);
        } catch (RuntimeException e) {
            span.error(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private static PartitionResult result(List<Set<Integer>> communities, double modularity,
                                          PartitionAlgorithm algorithm, int levels,
                                          ProximityGraph graph, boolean degenerate) {
        return PartitionResult.builder()
                .communities(communities)
                .modularity(modularity)
                .algorithm(algorithm)
                .levels(levels)
                .nodeCount(graph.getNodeCount())
                .edgeCount(graph.getEdgeCount())
                .degenerate(degenerate)
                .build();
    }
}
