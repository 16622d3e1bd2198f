package com.lidar.overtake.engine.community;

import com.lidar.overtake.engine.DetectionParameters;
import com.lidar.overtake.model.PartitionAlgorithm;
import com.lidar.overtake.model.ProximityGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Louvain modularity maximisation (Blondel et al. 2008).
 *
 * Each level runs local moving to a local optimum, then collapses communities into
 * nodes of a coarser graph. Levels repeat until the modularity gained by a level is
 * no more than the gain threshold; the last computed level is the result.
 *
 * Visitation order is fixed so results are reproducible:
 * <ul>
 *   <li>nodes are visited in ascending index order on every pass;</li>
 *   <li>candidate communities are visited in ascending label order and a move needs a
 *       strictly larger gain, so ties go to the lowest label and staying wins over a
 *       zero gain;</li>
 *   <li>after a level, communities are relabelled in order of their lowest node.</li>
 * </ul>
 */
@Component
public class LouvainCommunityDetector implements CommunityDetector {

    private static final Logger log = LoggerFactory.getLogger(LouvainCommunityDetector.class);

    @Override
    public PartitionAlgorithm getSupportedAlgorithm() {
        return PartitionAlgorithm.LOUVAIN;
    }

    @Override
    public CommunityHierarchy detect(ProximityGraph graph, DetectionParameters params) {
        return detect(graph, params.getResolution(), params.getGainThreshold());
    }

    public CommunityHierarchy detect(ProximityGraph graph, double resolution, double gainThreshold) {
        int n = graph.getNodeCount();
        List<List<Set<Integer>>> levels = new ArrayList<>();
        if (n == 0) {
            return new CommunityHierarchy(levels);
        }

        double m = graph.getTotalWeight();
        int[] assignment = identity(n);
        if (m <= 0) {
            levels.add(toCommunities(assignment, n));
            return new CommunityHierarchy(levels);
        }

        LevelGraph level = LevelGraph.of(graph);
        double modularity = Modularity.compute(graph, toCommunities(assignment, n), resolution);
        LocalMoving moved = moveNodes(level, m, resolution);

        while (true) {
            int[] next = new int[n];
            for (int u = 0; u < n; u++) {
                next[u] = moved.community[assignment[u]];
            }
            List<Set<Integer>> partition = toCommunities(next, moved.communityCount);
            levels.add(partition);

            double newModularity = Modularity.compute(graph, partition, resolution);
            log.debug("Louvain level {}: {} communities, modularity {} -> {}",
                    levels.size(), moved.communityCount, modularity, newModularity);
            if (newModularity - modularity <= gainThreshold) {
                break;
            }
            modularity = newModularity;
            assignment = next;
            level = level.aggregate(moved.community, moved.communityCount);
            moved = moveNodes(level, m, resolution);
        }

        return new CommunityHierarchy(levels);
    }

    /**
     * Repeated passes of single-node moves until a full pass moves nothing.
     * {@code m} is the total edge weight of the original graph, which aggregation preserves.
     */
    private LocalMoving moveNodes(LevelGraph graph, double m, double resolution) {
        int size = graph.size();
        int[] community = identity(size);
        double[] totals = new double[size];
        for (int u = 0; u < size; u++) {
            totals[u] = graph.degree(u);
        }
        double twoMSquared = 2.0 * m * m;

        int passes = 0;
        boolean moved = true;
        while (moved) {
            moved = false;
            passes++;
            for (int u = 0; u < size; u++) {
                int current = community[u];
                double degree = graph.degree(u);

                TreeMap<Integer, Double> linkWeights = new TreeMap<>();
                for (Map.Entry<Integer, Double> e : graph.neighbors(u).entrySet()) {
                    linkWeights.merge(community[e.getKey()], e.getValue(), Double::sum);
                }

                totals[current] -= degree;
                double removeCost = -linkWeights.getOrDefault(current, 0.0) / m
                        + resolution * totals[current] * degree / twoMSquared;

                int best = current;
                double bestGain = 0.0;
                for (Map.Entry<Integer, Double> e : linkWeights.entrySet()) {
                    int candidate = e.getKey();
                    double gain = removeCost + e.getValue() / m
                            - resolution * totals[candidate] * degree / twoMSquared;
                    if (gain > bestGain) {
                        bestGain = gain;
                        best = candidate;
                    }
                }

                totals[best] += degree;
                if (best != current) {
                    community[u] = best;
                    moved = true;
                }
            }
        }

        // relabel densely, in order of each community's lowest node
        int[] relabel = new int[size];
        Arrays.fill(relabel, -1);
        int count = 0;
        for (int u = 0; u < size; u++) {
            if (relabel[community[u]] == -1) {
                relabel[community[u]] = count++;
            }
            community[u] = relabel[community[u]];
        }
        log.trace("Local moving converged after {} passes: {} nodes -> {} communities", passes, size, count);
        return new LocalMoving(community, count);
    }

    private static List<Set<Integer>> toCommunities(int[] communityOf, int count) {
        List<Set<Integer>> communities = new ArrayList<>(count);
        for (int c = 0; c < count; c++) {
            communities.add(new TreeSet<>());
        }
        for (int u = 0; u < communityOf.length; u++) {
            communities.get(communityOf[u]).add(u);
        }
        communities.removeIf(Set::isEmpty);
        communities.sort(Comparator.comparingInt(c -> c.iterator().next()));
        return communities;
    }

    private static int[] identity(int n) {
        int[] ids = new int[n];
        for (int i = 0; i < n; i++) {
            ids[i] = i;
        }
        return ids;
    }

    private static final class LocalMoving {
        final int[] community;
        final int communityCount;

        LocalMoving(int[] community, int communityCount) {
            this.community = community;
            this.communityCount = communityCount;
        }
    }
}
