package com.lidar.overtake.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Undirected graph over the dense index range 0..n-1.
 *
 * Each node owns an insertion-ordered neighbor map (neighbor index -> edge weight).
 * Self-loops are rejected and an edge is stored at most once per pair.
 */
public class ProximityGraph {

    private final List<Map<Integer, Double>> adjacency;
    private int edgeCount;
    private double totalWeight;

    public ProximityGraph(int nodeCount) {
        if (nodeCount < 0) {
            throw new IllegalArgumentException("nodeCount must be >= 0, got " + nodeCount);
        }
        this.adjacency = new ArrayList<>(nodeCount);
        for (int i = 0; i < nodeCount; i++) {
            adjacency.add(new LinkedHashMap<>());
        }
    }

    public static ProximityGraph empty() {
        return new ProximityGraph(0);
    }

    /**
     * Add the undirected edge {i, j}.
     *
     * @return false if the edge was already present (the stored weight is left unchanged)
     */
    public boolean addEdge(int i, int j, double weight) {
        checkNode(i);
        checkNode(j);
        if (i == j) {
            throw new IllegalArgumentException("Self-loop on node " + i + " is not allowed");
        }
        if (adjacency.get(i).containsKey(j)) {
            return false;
        }
        adjacency.get(i).put(j, weight);
        adjacency.get(j).put(i, weight);
        edgeCount++;
        totalWeight += weight;
        return true;
    }

    public boolean addEdge(int i, int j) {
        return addEdge(i, j, 1.0);
    }

    public boolean hasEdge(int i, int j) {
        checkNode(i);
        checkNode(j);
        return adjacency.get(i).containsKey(j);
    }

    public double weight(int i, int j) {
        checkNode(i);
        checkNode(j);
        return adjacency.get(i).getOrDefault(j, 0.0);
    }

    /** Neighbors of {@code node} in the order their edges were added. */
    public Set<Integer> neighbors(int node) {
        checkNode(node);
        return Collections.unmodifiableSet(adjacency.get(node).keySet());
    }

    public Map<Integer, Double> weightedNeighbors(int node) {
        checkNode(node);
        return Collections.unmodifiableMap(adjacency.get(node));
    }

    /** Sum of incident edge weights. */
    public double degree(int node) {
        checkNode(node);
        double sum = 0.0;
        for (double w : adjacency.get(node).values()) {
            sum += w;
        }
        return sum;
    }

    public int getNodeCount() {
        return adjacency.size();
    }

    public int getEdgeCount() {
        return edgeCount;
    }

    public double getTotalWeight() {
        return totalWeight;
    }

    private void checkNode(int node) {
        if (node < 0 || node >= adjacency.size()) {
            throw new IndexOutOfBoundsException("Node " + node + " outside 0.." + (adjacency.size() - 1));
        }
    }
}
