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
 * Binary proximity graph over a lidar trace.
 *
 * For each pair i < j, scanned with i ascending and, per i, j ascending:
 * <ol>
 *   <li>no edge if |value[i] - value[j]| >= ygap;</li>
 *   <li>an edge if |time[j] - time[i]| < xgap;</li>
 *   <li>otherwise an edge if some node v already adjacent to i satisfies
 *       time[j] - time[v] < epsilon * xgap.</li>
 * </ol>
 *
 * Rule 3 reads the graph as it is being built, so it sees edges (k, i) added for
 * k < i and edges (i, j') added for j' < j, but nothing later in the scan. The
 * output therefore depends on the scan order; that order is fixed here and must
 * not change. With {@code symmetricEpsilonRule} the rule instead consults the
 * first-order neighbor sets (rule 2 edges over all pairs), which makes the result
 * independent of scan order.
 */
@Component
public class ProximityGraphBuilder implements GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(ProximityGraphBuilder.class);

    @Override
    public GraphStrategy getSupportedStrategy() {
        return GraphStrategy.PROXIMITY;
    }

    @Override
    public ProximityGraph build(List<Sample> samples, DetectionParameters params) {
        return build(samples, params.getXgap(), params.getYgap(), params.getEpsilon(),
                params.isSymmetricEpsilonRule());
    }

    public ProximityGraph build(List<Sample> samples, double xgap, double ygap, double epsilon) {
        return build(samples, xgap, ygap, epsilon, false);
    }

    public ProximityGraph build(List<Sample> samples, double xgap, double ygap, double epsilon,
                                boolean symmetricEpsilonRule) {
        int n = samples.size();
        if (n == 0) {
            return ProximityGraph.empty();
        }

        double[] time = new double[n];
        int[] value = new int[n];
        for (int k = 0; k < n; k++) {
            time[k] = samples.get(k).getTimestamp();
            value[k] = samples.get(k).getValue();
        }

        log.debug("Constructing proximity graph over {} samples (xgap={}, ygap={}, epsilon={}, symmetric={})",
                n, xgap, ygap, epsilon, symmetricEpsilonRule);

        ProximityGraph graph = new ProximityGraph(n);
        // The neighbor lookup graph: the graph under construction, or the frozen first-order graph
        ProximityGraph lookup = symmetricEpsilonRule
                ? firstOrderGraph(time, value, xgap, ygap)
                : graph;

        double reach = epsilon * xgap;
        for (int i = 0; i < n - 1; i++) {
            for (int j = i + 1; j < n; j++) {
                if (Math.abs(value[i] - value[j]) >= ygap) {
                    continue;
                }
                if (Math.abs(time[j] - time[i]) < xgap || hasNearNeighbor(lookup, i, j, time, reach)) {
                    graph.addEdge(i, j);
                }
            }
        }

        log.debug("Proximity graph built: {} nodes, {} edges", n, graph.getEdgeCount());
        return graph;
    }

    private static boolean hasNearNeighbor(ProximityGraph lookup, int i, int j, double[] time, double reach) {
        for (int v : lookup.neighbors(i)) {
            if (time[j] - time[v] < reach) {
                return true;
            }
        }
        return false;
    }

    private static ProximityGraph firstOrderGraph(double[] time, int[] value, double xgap, double ygap) {
        int n = time.length;
        ProximityGraph firstOrder = new ProximityGraph(n);
        for (int i = 0; i < n - 1; i++) {
            for (int j = i + 1; j < n; j++) {
                if (Math.abs(value[i] - value[j]) < ygap && Math.abs(time[j] - time[i]) < xgap) {
                    firstOrder.addEdge(i, j);
                }
            }
        }
        return firstOrder;
    }
}
