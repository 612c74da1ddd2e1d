package com.dynop.wayfinding.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Immutable node of the movement graph supplied by the floor-plan extraction step.
 *
 * <p>Positions are planar floor-plan coordinates (metres or pixels, as long as walls and
 * signage use the same unit).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SpatialNode {

    private final String id;
    private final double x;
    private final double y;
    @Nullable
    private final NodeTag tag;

    @JsonCreator
    public SpatialNode(
            @JsonProperty(value = "id", required = true) String id,
            @JsonProperty(value = "x", required = true) double x,
            @JsonProperty(value = "y", required = true) double y,
            @JsonProperty("tag") @Nullable NodeTag tag) {
        this.id = Objects.requireNonNull(id, "id");
        this.x = x;
        this.y = y;
        this.tag = tag;
    }

    public SpatialNode(String id, double x, double y) {
        this(id, x, y, null);
    }

    public String getId() {
        return id;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    @Nullable
    public NodeTag getTag() {
        return tag;
    }

    /**
     * @return Euclidean distance to another node
     */
    public double distanceTo(SpatialNode other) {
        return Math.hypot(other.x - x, other.y - y);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SpatialNode that = (SpatialNode) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return String.format("SpatialNode{id='%s', x=%.3f, y=%.3f, tag=%s}", id, x, y, tag);
    }
}
