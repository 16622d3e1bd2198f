package com.lidar.overtake.engine.community;

import com.lidar.overtake.model.ProximityGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Working graph for one Louvain level. Nodes are dense indices; self-loops are kept
 * apart from the neighbor maps so that local moving never counts a node as its own
 * neighbor. Degrees count a self-loop twice.
 */
final class LevelGraph {

    private final List<TreeMap<Integer, Double>> neighbors;
    private final double[] selfLoops;
    private final double[] degrees;

    private LevelGraph(List<TreeMap<Integer, Double>> neighbors, double[] selfLoops) {
        this.neighbors = neighbors;
        this.selfLoops = selfLoops;
        this.degrees = new double[neighbors.size()];
        for (int u = 0; u < degrees.length; u++) {
            double d = 2.0 * selfLoops[u];
            for (double w : neighbors.get(u).values()) {
                d += w;
            }
            degrees[u] = d;
        }
    }

    static LevelGraph of(ProximityGraph graph) {
        int n = graph.getNodeCount();
        List<TreeMap<Integer, Double>> neighbors = new ArrayList<>(n);
        for (int u = 0; u < n; u++) {
            neighbors.add(new TreeMap<>(graph.weightedNeighbors(u)));
        }
        return new LevelGraph(neighbors, new double[n]);
    }

    /**
     * Collapse each community into a single node. Inter-community weights are summed;
     * intra-community weight (including existing self-loops) becomes the new self-loop.
     *
     * @param community      community label per node, dense in 0..communityCount-1
     * @param communityCount number of distinct labels
     */
    LevelGraph aggregate(int[] community, int communityCount) {
        List<TreeMap<Integer, Double>> merged = new ArrayList<>(communityCount);
        for (int c = 0; c < communityCount; c++) {
            merged.add(new TreeMap<>());
        }
        double[] mergedSelf = new double[communityCount];

        for (int u = 0; u < size(); u++) {
            int cu = community[u];
            mergedSelf[cu] += selfLoops[u];
            for (Map.Entry<Integer, Double> e : neighbors.get(u).entrySet()) {
                int v = e.getKey();
                if (v < u) {
                    continue;
                }
                int cv = community[v];
                double w = e.getValue();
                if (cu == cv) {
                    mergedSelf[cu] += w;
                } else {
                    merged.get(cu).merge(cv, w, Double::sum);
                    merged.get(cv).merge(cu, w, Double::sum);
                }
            }
        }
        return new LevelGraph(merged, mergedSelf);
    }

    int size() {
        return neighbors.size();
    }

    Map<Integer, Double> neighbors(int u) {
        return neighbors.get(u);
    }

    double degree(int u) {
        return degrees[u];
    }
}
