package com.lidar.overtake.engine.graph;

import com.lidar.overtake.engine.DetectionParameters;
import com.lidar.overtake.model.GraphStrategy;
import com.lidar.overtake.model.ProximityGraph;
import com.lidar.overtake.model.Sample;
import com.lidar.overtake.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProximityGraphBuilderTest {

    private final ProximityGraphBuilder builder = new ProximityGraphBuilder();

    @Test
    void build_noSamples_returnsEmptyGraph() {
        ProximityGraph graph = builder.build(Collections.emptyList(), 0.4, 40.0, 1.0);

        assertThat(graph.getNodeCount()).isZero();
        assertThat(graph.getEdgeCount()).isZero();
    }

    @Test
    void build_singleSample_oneNodeNoEdges() {
        ProximityGraph graph = builder.build(TestDataFactory.samples(0.0, 500), 0.4, 40.0, 1.0);

        assertThat(graph.getNodeCount()).isEqualTo(1);
        assertThat(graph.getEdgeCount()).isZero();
    }

    @Test
    void build_twoSeparatedClusters_fullyConnectedWithinNoCrossEdges() {
        ProximityGraph graph = builder.build(TestDataFactory.twoClusterSamples(), 0.4, 40.0, 1.0);

        assertThat(graph.getNodeCount()).isEqualTo(6);
        assertThat(graph.getEdgeCount()).isEqualTo(6);
        assertThat(graph.hasEdge(0, 1)).isTrue();
        assertThat(graph.hasEdge(0, 2)).isTrue();
        assertThat(graph.hasEdge(1, 2)).isTrue();
        assertThat(graph.hasEdge(3, 4)).isTrue();
        assertThat(graph.hasEdge(3, 5)).isTrue();
        assertThat(graph.hasEdge(4, 5)).isTrue();
        for (int i = 0; i < 3; i++) {
            for (int j = 3; j < 6; j++) {
                assertThat(graph.hasEdge(i, j)).isFalse();
            }
        }
    }

    @Test
    void build_valueGapEqualToYgap_noEdge() {
        ProximityGraph graph = builder.build(TestDataFactory.samples(0.0, 100, 0.1, 140), 0.4, 40.0, 1.0);

        assertThat(graph.getEdgeCount()).isZero();
    }

    @Test
    void build_timeGapEqualToXgap_noDirectEdge() {
        ProximityGraph graph = builder.build(TestDataFactory.samples(0.0, 100, 0.5, 100), 0.5, 40.0, 1.0);

        assertThat(graph.getEdgeCount()).isZero();
    }

    @Test
    void build_epsilonRule_bridgesThroughEarlierNeighbor() {
        // 0-1 and 1-2 are direct; 0-2 is 1.2s apart but 2 is within 1.0s of neighbor 1
        List<Sample> samples = TestDataFactory.samples(0.0, 0, 0.5, 0, 1.2, 0);

        ProximityGraph bridged = builder.build(samples, 1.0, 10.0, 1.0);
        ProximityGraph direct = builder.build(samples, 1.0, 10.0, 0.0);

        assertThat(bridged.hasEdge(0, 2)).isTrue();
        assertThat(bridged.getEdgeCount()).isEqualTo(3);
        assertThat(direct.hasEdge(0, 2)).isFalse();
        assertThat(direct.getEdgeCount()).isEqualTo(2);
    }

    @Test
    void build_epsilonRule_seesEdgesAddedEarlierInSameRow() {
        // (0,3) only qualifies through neighbor 2, which node 0 gained earlier in its own row
        List<Sample> samples = TestDataFactory.samples(0.0, 0, 0.5, 0, 1.2, 0, 2.0, 0);

        ProximityGraph scanOrder = builder.build(samples, 1.0, 10.0, 1.0, false);
        ProximityGraph symmetric = builder.build(samples, 1.0, 10.0, 1.0, true);

        assertThat(scanOrder.getEdgeCount()).isEqualTo(6);
        assertThat(scanOrder.hasEdge(0, 3)).isTrue();

        assertThat(symmetric.getEdgeCount()).isEqualTo(5);
        assertThat(symmetric.hasEdge(0, 2)).isTrue();
        assertThat(symmetric.hasEdge(1, 3)).isTrue();
        assertThat(symmetric.hasEdge(0, 3)).isFalse();
    }

    @Test
    void build_epsilonRule_neverLooksAheadInTheScan() {
        // node 0 has no neighbors when (0,1) and (0,2) are evaluated
        List<Sample> samples = TestDataFactory.samples(0.0, 0, 1.5, 0, 1.6, 0);

        ProximityGraph graph = builder.build(samples, 1.0, 10.0, 0.1);

        assertThat(graph.getEdgeCount()).isEqualTo(1);
        assertThat(graph.hasEdge(1, 2)).isTrue();
    }

    @Test
    void build_isSymmetricWithoutSelfLoops() {
        List<Sample> samples = TestDataFactory.overtakeTrace(120, 40, 80, 800, 430, 7L);

        ProximityGraph graph = builder.build(samples, 0.4, 40.0, 1.0);

        for (int i = 0; i < samples.size(); i++) {
            assertThat(graph.hasEdge(i, i)).isFalse();
            for (int j = i + 1; j < samples.size(); j++) {
                assertThat(graph.hasEdge(i, j)).isEqualTo(graph.hasEdge(j, i));
            }
        }
        assertThat(graph.getNodeCount()).isEqualTo(120);
    }

    @Test
    void build_sameInputTwice_identicalEdges() {
        List<Sample> samples = TestDataFactory.overtakeTrace(80, 20, 50, 700, 400, 11L);

        ProximityGraph first = builder.build(samples, 0.4, 40.0, 1.0);
        ProximityGraph second = builder.build(samples, 0.4, 40.0, 1.0);

        assertThat(second.getEdgeCount()).isEqualTo(first.getEdgeCount());
        for (int i = 0; i < samples.size(); i++) {
            assertThat(second.neighbors(i)).containsExactlyElementsOf(first.neighbors(i));
        }
    }

    @Test
    void build_withParameters_usesConfiguredRule() {
        DetectionParameters params = DetectionParameters.defaults().toBuilder()
                .xgap(1.0).ygap(10.0).epsilon(1.0).symmetricEpsilonRule(true)
                .build();
        List<Sample> samples = TestDataFactory.samples(0.0, 0, 0.5, 0, 1.2, 0, 2.0, 0);

        ProximityGraph graph = builder.build(samples, params);

        assertThat(builder.getSupportedStrategy()).isEqualTo(GraphStrategy.PROXIMITY);
        assertThat(graph.hasEdge(0, 3)).isFalse();
    }
}
