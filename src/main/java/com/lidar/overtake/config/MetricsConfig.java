package com.lidar.overtake.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger lastCommunityCount;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.lastCommunityCount = registry.gauge("partition.last.community_count", new AtomicInteger(0));
    }

    public void recordDetection(String outcome, int sampleCount) {
        Counter.builder("detection.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();

        DistributionSummary.builder("detection.sample_count")
                .tag("outcome", outcome)
                .register(registry)
                .record(sampleCount);
    }

    public void recordGraph(String strategy, int nodeCount, int edgeCount) {
        DistributionSummary.builder("graph.edge_count")
                .tag("strategy", strategy)
                .register(registry)
                .record(edgeCount);

        DistributionSummary.builder("graph.node_count")
                .tag("strategy", strategy)
                .register(registry)
                .record(nodeCount);
    }

    public void recordPartition(String algorithm, int communityCount, double modularity) {
        DistributionSummary.builder("partition.modularity")
                .tag("algorithm", algorithm)
                .register(registry)
                .record(modularity);
        lastCommunityCount.set(communityCount);
    }

    public void recordDegeneratePartition(String algorithm) {
        Counter.builder("partition.degenerate.count")
                .tag("algorithm", algorithm)
                .register(registry)
                .increment();
    }

    public void recordPersistenceFailure() {
        Counter.builder("detection.persist.failure.count")
                .register(registry)
                .increment();
    }
}
