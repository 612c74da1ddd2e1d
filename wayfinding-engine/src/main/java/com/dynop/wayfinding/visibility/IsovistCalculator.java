package com.dynop.wayfinding.visibility;

import com.dynop.wayfinding.config.VisibilityConfig;
import org.locationtech.jts.algorithm.Area;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LinearRing;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Casts rays from a sample point and builds its isovist polygon.
 */
public class IsovistCalculator {

    private static final Logger LOGGER = Logger.getLogger(IsovistCalculator.class.getName());

    private static final double DISTINCT_TOLERANCE = 1e-9;

    private final FloorPlanGeometry geometry;
    private final int rayCount;
    private final double maxRange;

    public IsovistCalculator(FloorPlanGeometry geometry, VisibilityConfig config) {
        this.geometry = Objects.requireNonNull(geometry, "geometry");
        this.rayCount = config.getRayCount();
        this.maxRange = config.getMaxRange();
    }

    /**
     * @param index  Sample index
     * @param origin Sample point
     * @return Isovist with a visible-neighbor count of 0 (filled in once the visibility graph exists)
     */
    public IsovistSample compute(int index, Coordinate origin) {
        List<Coordinate> endpoints = new ArrayList<>(rayCount + 1);
        double radialSum = 0;
        double maxRadial = 0;
        for (int i = 0; i < rayCount; i++) {
            double angle = 2 * Math.PI * i / rayCount;
            double distance = geometry.castRay(origin, angle, maxRange);
            radialSum += distance;
            maxRadial = Math.max(maxRadial, distance);
            endpoints.add(new Coordinate(origin.x + Math.cos(angle) * distance, origin.y + Math.sin(angle) * distance));
        }
        double meanRadial = rayCount > 0 ? radialSum / rayCount : 0;

        List<double[]> vertices = new ArrayList<>(endpoints.size());
        for (Coordinate endpoint : endpoints) {
            vertices.add(new double[]{endpoint.x, endpoint.y});
        }

        List<Coordinate> ring = distinctConsecutive(endpoints);
        if (ring.size() < 3) {
            return degenerate(index, origin, vertices, maxRadial, meanRadial, "fewer than 3 distinct endpoints");
        }
        ring.add(new Coordinate(ring.get(0)));
        Coordinate[] coordinates = ring.toArray(new Coordinate[0]);

        double area = Area.ofRing(coordinates);
        if (area <= 0) {
            return degenerate(index, origin, vertices, maxRadial, meanRadial, "zero area");
        }
        LinearRing linearRing = geometry.getGeometryFactory().createLinearRing(coordinates);
        if (!linearRing.isSimple()) {
            return degenerate(index, origin, vertices, maxRadial, meanRadial, "self-intersecting ring");
        }

        double perimeter = linearRing.getLength();
        double compactness = perimeter > 0 ? 4 * Math.PI * area / (perimeter * perimeter) : 0;
        return new IsovistSample(index, origin.x, origin.y, vertices, area, perimeter, maxRadial, meanRadial,
                compactness, 0, false);
    }

    private static IsovistSample degenerate(int index, Coordinate origin, List<double[]> vertices,
                                            double maxRadial, double meanRadial, String reason) {
        LOGGER.fine(() -> String.format("Degenerate isovist at sample %d (%.3f, %.3f): %s",
                index, origin.x, origin.y, reason));
        return new IsovistSample(index, origin.x, origin.y, vertices, 0, 0, maxRadial, meanRadial, 0, 0, true);
    }

    private static List<Coordinate> distinctConsecutive(List<Coordinate> endpoints) {
        List<Coordinate> distinct = new ArrayList<>(endpoints.size());
        for (Coordinate endpoint : endpoints) {
            if (distinct.isEmpty() || !distinct.get(distinct.size() - 1).equals2D(endpoint, DISTINCT_TOLERANCE)) {
                distinct.add(endpoint);
            }
        }
        while (distinct.size() > 1 && distinct.get(0).equals2D(distinct.get(distinct.size() - 1), DISTINCT_TOLERANCE)) {
            distinct.remove(distinct.size() - 1);
        }
        return distinct;
    }
}
