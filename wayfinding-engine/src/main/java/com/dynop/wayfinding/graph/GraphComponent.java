package com.dynop.wayfinding.graph;

import java.util.Arrays;

/**
 * Connected component of a {@link FloorGraph}, holding member node indices in ascending order.
 */
public final class GraphComponent {

    private final int id;
    private final int[] members;
    private final int hopDiameter;

    GraphComponent(int id, int[] members, int hopDiameter) {
        this.id = id;
        this.members = members;
        this.hopDiameter = hopDiameter;
    }

    public int getId() {
        return id;
    }

    /**
     * @return Member node indices, ascending (defensive copy)
     */
    public int[] getMembers() {
        return members.clone();
    }

    public int member(int i) {
        return members[i];
    }

    /**
     * @return Number of nodes k in the component
     */
    public int size() {
        return members.length;
    }

    /**
     * @return Largest BFS eccentricity in the component (0 for an isolated node)
     */
    public int getHopDiameter() {
        return hopDiameter;
    }

    @Override
    public String toString() {
        return String.format("GraphComponent{id=%d, k=%d, diameter=%d, members=%s}",
                id, members.length, hopDiameter, Arrays.toString(members));
    }
}
