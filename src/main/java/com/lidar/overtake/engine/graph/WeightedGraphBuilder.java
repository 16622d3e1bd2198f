package com.lidar.overtake.engine.graph;

import com.lidar.overtake.engine.DetectionParameters;
import com.lidar.overtake.model.GraphStrategy;
import com.lidar.overtake.model.ProximityGraph;
import com.lidar.overtake.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Weighted alternative to {@link ProximityGraphBuilder}.
 *
 * Every pair i < j whose values differ by less than ygap is connected with weight
 * (1 / d)^exponent, where d = hypot(j - i, value[i] - value[j]) is the distance in
 * index/value space. Since j - i >= 1, d >= 1 and weights lie in (0, 1]; a pair whose
 * weight underflows to 0 gets no edge.
 */
@Component
public class WeightedGraphBuilder implements GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(WeightedGraphBuilder.class);

    @Override
    public GraphStrategy getSupportedStrategy() {
        return GraphStrategy.WEIGHTED;
    }

    @Override
    public ProximityGraph build(List<Sample> samples, DetectionParameters params) {
        return build(samples, params.getYgap(), params.getWeightExponent());
    }

    public ProximityGraph build(List<Sample> samples, double ygap, double exponent) {
        int n = samples.size();
        ProximityGraph graph = new ProximityGraph(n);

        for (int i = 0; i < n - 1; i++) {
            int vi = samples.get(i).getValue();
            for (int j = i + 1; j < n; j++) {
                int dv = vi - samples.get(j).getValue();
                if (Math.abs(dv) >= ygap) {
                    continue;
                }
                double weight = Math.pow(1.0 / Math.hypot(j - i, dv), exponent);
                // large exponents underflow to 0
                if (weight > 0) {
                    graph.addEdge(i, j, weight);
                }
            }
        }

        log.debug("Weighted graph built: {} nodes, {} edges, total weight {}",
                n, graph.getEdgeCount(), graph.getTotalWeight());
        return graph;
    }
}
