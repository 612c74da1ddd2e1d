package com.dynop.wayfinding.visibility;

import org.jetbrains.annotations.Nullable;
import org.locationtech.jts.algorithm.RobustLineIntersector;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.locationtech.jts.index.strtree.STRtree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Read-only obstacle geometry of a floor: wall segments plus the walkable boundary.
 *
 * <p>When no boundary is supplied, the envelope of the walls is used. An explicit boundary ring
 * also blocks sight lines. Obstacles are indexed in an {@link STRtree} that is built eagerly, so all
 * queries are safe to run from several worker threads.
 */
public final class FloorPlanGeometry {

    private static final Logger LOGGER = Logger.getLogger(FloorPlanGeometry.class.getName());

    private final GeometryFactory geometryFactory = new GeometryFactory();
    private final List<WallSegment> walls;
    private final Polygon boundary;
    private final PreparedGeometry preparedBoundary;
    private final List<LineString> obstacles;
    private final STRtree obstacleIndex;

    /**
     * @param walls    Wall segments
     * @param boundary Optional walkable boundary as a list of [x, y] vertices (closed or open ring)
     * @throws IllegalArgumentException if the boundary has fewer than three vertices or is not a valid polygon
     */
    public FloorPlanGeometry(List<WallSegment> walls, @Nullable List<List<Double>> boundary) {
        this.walls = List.copyOf(Objects.requireNonNull(walls, "walls"));
        this.obstacles = new ArrayList<>();
        for (WallSegment wall : this.walls) {
            obstacles.add(wall.toLineString(geometryFactory));
        }

        if (boundary != null) {
            this.boundary = toPolygon(boundary);
            obstacles.add(this.boundary.getExteriorRing());
        } else {
            this.boundary = envelopeOfWalls();
        }
        this.preparedBoundary = PreparedGeometryFactory.prepare(this.boundary);

        this.obstacleIndex = new STRtree();
        for (LineString obstacle : obstacles) {
            obstacleIndex.insert(obstacle.getEnvelopeInternal(), obstacle);
        }
        obstacleIndex.build();

        LOGGER.fine(() -> String.format("Floor geometry indexed: %d walls, boundary area %.2f",
                this.walls.size(), this.boundary.getArea()));
    }

    public FloorPlanGeometry(List<WallSegment> walls) {
        this(walls, null);
    }

    private Polygon toPolygon(List<List<Double>> vertices) {
        List<Coordinate> coordinates = new ArrayList<>(vertices.size() + 1);
        for (List<Double> vertex : vertices) {
            if (vertex == null || vertex.size() != 2 || vertex.get(0) == null || vertex.get(1) == null
                    || !Double.isFinite(vertex.get(0)) || !Double.isFinite(vertex.get(1))) {
                throw new IllegalArgumentException("Each boundary vertex must be a finite [x, y] pair");
            }
            coordinates.add(new Coordinate(vertex.get(0), vertex.get(1)));
        }
        if (!coordinates.isEmpty() && !coordinates.get(0).equals2D(coordinates.get(coordinates.size() - 1))) {
            coordinates.add(new Coordinate(coordinates.get(0)));
        }
        if (coordinates.size() < 4) {
            throw new IllegalArgumentException("Boundary needs at least three distinct vertices");
        }
        Polygon polygon = geometryFactory.createPolygon(coordinates.toArray(new Coordinate[0]));
        if (!polygon.isValid()) {
            throw new IllegalArgumentException("Boundary polygon is not valid (self-intersecting?)");
        }
        return polygon;
    }

    private Polygon envelopeOfWalls() {
        Envelope envelope = new Envelope();
        for (LineString obstacle : obstacles) {
            envelope.expandToInclude(obstacle.getEnvelopeInternal());
        }
        if (envelope.isNull() || envelope.getWidth() == 0 || envelope.getHeight() == 0) {
            return geometryFactory.createPolygon();
        }
        return (Polygon) geometryFactory.toGeometry(envelope);
    }

    public List<WallSegment> getWalls() {
        return walls;
    }

    /**
     * @return Walkable boundary (empty polygon if neither walls nor a boundary span an area)
     */
    public Polygon getBoundary() {
        return boundary;
    }

    public Envelope getBounds() {
        return boundary.getEnvelopeInternal();
    }

    GeometryFactory getGeometryFactory() {
        return geometryFactory;
    }

    /**
     * @return true if the point lies in the interior of the walkable boundary
     */
    public boolean isStrictlyInside(double x, double y) {
        if (boundary.isEmpty()) {
            return false;
        }
        Point point = geometryFactory.createPoint(new Coordinate(x, y));
        return preparedBoundary.contains(point);
    }

    /**
     * @return true if any obstacle lies within {@code tolerance} of the point
     */
    public boolean isNearObstacle(double x, double y, double tolerance) {
        Envelope search = new Envelope(x - tolerance, x + tolerance, y - tolerance, y + tolerance);
        Point point = geometryFactory.createPoint(new Coordinate(x, y));
        for (LineString obstacle : candidates(search)) {
            if (obstacle.distance(point) <= tolerance) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return true if the segment between the two points touches or crosses an obstacle
     */
    public boolean isSightBlocked(Coordinate from, Coordinate to) {
        RobustLineIntersector intersector = new RobustLineIntersector();
        for (LineString obstacle : candidates(new Envelope(from, to))) {
            Coordinate[] coordinates = obstacle.getCoordinates();
            for (int i = 1; i < coordinates.length; i++) {
                intersector.computeIntersection(from, to, coordinates[i - 1], coordinates[i]);
                if (intersector.hasIntersection()) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Distance from the origin to the first obstacle along a ray.
     *
     * @param origin   Ray origin
     * @param angle    Direction in radians, counter-clockwise from the x axis
     * @param maxRange Ray length
     * @return Distance to the nearest hit, or {@code maxRange} when nothing is hit
     */
    public double castRay(Coordinate origin, double angle, double maxRange) {
        Coordinate end = new Coordinate(origin.x + Math.cos(angle) * maxRange, origin.y + Math.sin(angle) * maxRange);
        RobustLineIntersector intersector = new RobustLineIntersector();
        double nearest = maxRange;
        for (LineString obstacle : candidates(new Envelope(origin, end))) {
            Coordinate[] coordinates = obstacle.getCoordinates();
            for (int i = 1; i < coordinates.length; i++) {
                intersector.computeIntersection(origin, end, coordinates[i - 1], coordinates[i]);
                for (int hit = 0; hit < intersector.getIntersectionNum(); hit++) {
                    nearest = Math.min(nearest, origin.distance(intersector.getIntersection(hit)));
                }
            }
        }
        return nearest;
    }

    @SuppressWarnings("unchecked")
    private List<LineString> candidates(Envelope search) {
        List<LineString> found = obstacleIndex.query(search);
        return found != null ? found : Collections.emptyList();
    }
}
