package com.dynop.wayfinding.visibility;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;

/**
 * Straight wall segment in floor-plan coordinates.
 */
public final class WallSegment {

    private final double x1;
    private final double y1;
    private final double x2;
    private final double y2;

    @JsonCreator
    public WallSegment(
            @JsonProperty(value = "x1", required = true) double x1,
            @JsonProperty(value = "y1", required = true) double y1,
            @JsonProperty(value = "x2", required = true) double x2,
            @JsonProperty(value = "y2", required = true) double y2) {
        if (!Double.isFinite(x1) || !Double.isFinite(y1) || !Double.isFinite(x2) || !Double.isFinite(y2)) {
            throw new IllegalArgumentException("Wall coordinates must be finite");
        }
        this.x1 = x1;
        this.y1 = y1;
        this.x2 = x2;
        this.y2 = y2;
    }

    public double getX1() {
        return x1;
    }

    public double getY1() {
        return y1;
    }

    public double getX2() {
        return x2;
    }

    public double getY2() {
        return y2;
    }

    public double length() {
        return Math.hypot(x2 - x1, y2 - y1);
    }

    LineString toLineString(GeometryFactory geometryFactory) {
        return geometryFactory.createLineString(new Coordinate[]{
                new Coordinate(x1, y1),
                new Coordinate(x2, y2)
        });
    }

    @Override
    public String toString() {
        return String.format("WallSegment{(%.3f, %.3f) -> (%.3f, %.3f)}", x1, y1, x2, y2);
    }
}
