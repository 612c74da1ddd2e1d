package com.dynop.wayfinding.visibility;

import java.util.Arrays;

/**
 * Undirected mutual-visibility graph over sample indices. Adjacency lists are sorted ascending.
 */
public final class VisibilityGraph {

    private final int[][] adjacency;
    private final int edgeCount;

    VisibilityGraph(int[][] adjacency) {
        this.adjacency = adjacency;
        int degreeSum = 0;
        for (int[] neighbors : adjacency) {
            degreeSum += neighbors.length;
        }
        this.edgeCount = degreeSum / 2;
    }

    /**
     * Assemble a symmetric graph from upper-triangle rows.
     *
     * @param upperRows For each sample i, the samples j &gt; i visible from it, ascending
     */
    static VisibilityGraph fromUpperRows(int[][] upperRows) {
        int n = upperRows.length;
        int[] degree = new int[n];
        for (int i = 0; i < n; i++) {
            degree[i] += upperRows[i].length;
            for (int j : upperRows[i]) {
                degree[j]++;
            }
        }
        int[][] adjacency = new int[n][];
        int[] fill = new int[n];
        for (int i = 0; i < n; i++) {
            adjacency[i] = new int[degree[i]];
        }
        // Lower neighbors are appended first in ascending i, then the upper row, so each list stays sorted
        for (int i = 0; i < n; i++) {
            for (int j : upperRows[i]) {
                adjacency[j][fill[j]++] = i;
            }
        }
        for (int i = 0; i < n; i++) {
            for (int j : upperRows[i]) {
                adjacency[i][fill[i]++] = j;
            }
        }
        return new VisibilityGraph(adjacency);
    }

    public int size() {
        return adjacency.length;
    }

    public int edgeCount() {
        return edgeCount;
    }

    public int degree(int sample) {
        return adjacency[sample].length;
    }

    public int[] neighbors(int sample) {
        return adjacency[sample].clone();
    }

    public boolean isConnected(int a, int b) {
        return Arrays.binarySearch(adjacency[a], b) >= 0;
    }
}
