package com.dynop.wayfinding.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Undirected connection between two {@link SpatialNode}s.
 *
 * <p>The weight is a walked or Euclidean distance. When it is omitted the graph builder
 * substitutes the Euclidean distance between the endpoints.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SpatialEdge {

    private final String from;
    private final String to;
    @Nullable
    private final Double weight;

    @JsonCreator
    public SpatialEdge(
            @JsonProperty(value = "from", required = true) String from,
            @JsonProperty(value = "to", required = true) String to,
            @JsonProperty("weight") @Nullable Double weight) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
        this.weight = weight;
    }

    public SpatialEdge(String from, String to, double weight) {
        this(from, to, Double.valueOf(weight));
    }

    /**
     * Edge weighted by the Euclidean distance between its endpoints.
     */
    public static SpatialEdge euclidean(String from, String to) {
        return new SpatialEdge(from, to, (Double) null);
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }

    /**
     * @return Explicit weight, or null if the Euclidean distance should be used
     */
    @Nullable
    public Double getWeight() {
        return weight;
    }

    /**
     * @return Stable identifier used in error messages, e.g. "A-B"
     */
    public String key() {
        return from + "-" + to;
    }

    @Override
    public String toString() {
        return String.format("SpatialEdge{%s -> %s, weight=%s}", from, to, weight);
    }
}
