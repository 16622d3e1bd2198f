package com.lidar.overtake.engine.community;

import com.lidar.overtake.model.ProximityGraph;

import java.util.Arrays;
import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * Newman-Girvan modularity with a resolution parameter:
 *
 * <pre>
 *   Q = sum over communities c of [ L_c / m - gamma * (d_c / 2m)^2 ]
 * </pre>
 *
 * where m is the total edge weight, L_c the weight of edges inside c and d_c the
 * summed weighted degree of c. A graph without edges has modularity 0.
 */
public final class Modularity {

    private Modularity() {}

    public static double compute(ProximityGraph graph, Collection<? extends Set<Integer>> communities) {
        return compute(graph, communities, 1.0);
    }

    public static double compute(ProximityGraph graph, Collection<? extends Set<Integer>> communities,
                                 double resolution) {
        int n = graph.getNodeCount();
        int[] communityOf = membership(n, communities);

        double m = graph.getTotalWeight();
        if (m <= 0) {
            return 0.0;
        }

        double[] internal = new double[communities.size()];
        double[] degreeSum = new double[communities.size()];
        for (int u = 0; u < n; u++) {
            int cu = communityOf[u];
            for (Map.Entry<Integer, Double> e : graph.weightedNeighbors(u).entrySet()) {
                double w = e.getValue();
                degreeSum[cu] += w;
                // each undirected edge is seen from both ends
                if (e.getKey() > u && communityOf[e.getKey()] == cu) {
                    internal[cu] += w;
                }
            }
        }

        double q = 0.0;
        for (int c = 0; c < internal.length; c++) {
            double share = degreeSum[c] / (2.0 * m);
            q += internal[c] / m - resolution * share * share;
        }
        return q;
    }

    /**
     * @throws IllegalArgumentException if the communities are not a partition of 0..n-1
     */
    static int[] membership(int n, Collection<? extends Set<Integer>> communities) {
        int[] communityOf = new int[n];
        Arrays.fill(communityOf, -1);
        int c = 0;
        int covered = 0;
        for (Set<Integer> community : communities) {
            if (community.isEmpty()) {
                throw new IllegalArgumentException("Community " + c + " is empty");
            }
            for (int node : community) {
                if (node < 0 || node >= n) {
                    throw new IllegalArgumentException("Node " + node + " is not in the graph");
                }
                if (communityOf[node] != -1) {
                    throw new IllegalArgumentException("Node " + node + " appears in more than one community");
                }
                communityOf[node] = c;
                covered++;
            }
            c++;
        }
        if (covered != n) {
            throw new IllegalArgumentException("Communities cover " + covered + " of " + n + " nodes");
        }
        return communityOf;
    }
}
