package com.dynop.wayfinding.visibility;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Isovist of one sample point: the region visible from it, approximated by the polygon of ray endpoints.
 *
 * <p>Degenerate isovists (fewer than three distinct endpoints, zero area or a self-intersecting ring)
 * are kept with area, perimeter and compactness set to 0.
 */
public final class IsovistSample {

    private final int index;
    private final double x;
    private final double y;
    private final List<double[]> vertices;
    private final double area;
    private final double perimeter;
    private final double maxRadial;
    private final double meanRadial;
    private final double compactness;
    private final int visibleNeighbors;
    private final boolean degenerate;

    IsovistSample(int index, double x, double y, List<double[]> vertices, double area, double perimeter,
                  double maxRadial, double meanRadial, double compactness, int visibleNeighbors,
                  boolean degenerate) {
        this.index = index;
        this.x = x;
        this.y = y;
        this.vertices = copy(vertices);
        this.area = area;
        this.perimeter = perimeter;
        this.maxRadial = maxRadial;
        this.meanRadial = meanRadial;
        this.compactness = compactness;
        this.visibleNeighbors = visibleNeighbors;
        this.degenerate = degenerate;
    }

    private static List<double[]> copy(List<double[]> vertices) {
        List<double[]> copies = new ArrayList<>(vertices.size());
        for (double[] vertex : vertices) {
            copies.add(vertex.clone());
        }
        return Collections.unmodifiableList(copies);
    }

    IsovistSample withVisibleNeighbors(int count) {
        return new IsovistSample(index, x, y, vertices, area, perimeter, maxRadial, meanRadial, compactness,
                count, degenerate);
    }

    @JsonProperty("index")
    public int getIndex() {
        return index;
    }

    @JsonProperty("x")
    public double getX() {
        return x;
    }

    @JsonProperty("y")
    public double getY() {
        return y;
    }

    /**
     * @return Ray endpoints as [x, y] pairs in counter-clockwise order starting at angle 0 (defensive copy)
     */
    @JsonProperty("vertices")
    public List<double[]> getVertices() {
        return copy(vertices);
    }

    @JsonProperty("area")
    public double getArea() {
        return area;
    }

    @JsonProperty("perimeter")
    public double getPerimeter() {
        return perimeter;
    }

    @JsonProperty("max_radial")
    public double getMaxRadial() {
        return maxRadial;
    }

    @JsonProperty("mean_radial")
    public double getMeanRadial() {
        return meanRadial;
    }

    /**
     * @return {@code 4 * PI * area / perimeter^2}, 1 for a circle
     */
    @JsonProperty("compactness")
    public double getCompactness() {
        return compactness;
    }

    /**
     * @return Number of other samples in mutual line of sight
     */
    @JsonProperty("visible_neighbors")
    public int getVisibleNeighbors() {
        return visibleNeighbors;
    }

    @JsonProperty("degenerate")
    public boolean isDegenerate() {
        return degenerate;
    }

    @Override
    public String toString() {
        return String.format("IsovistSample{index=%d, origin=(%.3f, %.3f), area=%.3f, perimeter=%.3f, degenerate=%s}",
                index, x, y, area, perimeter, degenerate);
    }
}
