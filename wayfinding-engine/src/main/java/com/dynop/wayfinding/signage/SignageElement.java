package com.dynop.wayfinding.signage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * A sign or landmark located on the floor plan.
 *
 * <p>Attributes are free-form (e.g. text, height, contrast) and passed through untouched.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class SignageElement {

    private final String id;
    private final double x;
    private final double y;
    private final SignageKind kind;
    private final Map<String, String> attributes;

    @JsonCreator
    public SignageElement(
            @JsonProperty(value = "id", required = true) String id,
            @JsonProperty(value = "x", required = true) double x,
            @JsonProperty(value = "y", required = true) double y,
            @JsonProperty(value = "kind", required = true) SignageKind kind,
            @JsonProperty("attributes") Map<String, String> attributes) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new IllegalArgumentException("Signage position must be finite: " + id);
        }
        this.x = x;
        this.y = y;
        this.attributes = attributes != null ? Map.copyOf(attributes) : Collections.emptyMap();
    }

    public SignageElement(String id, double x, double y, SignageKind kind) {
        this(id, x, y, kind, null);
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

    public SignageKind getKind() {
        return kind;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    @Override
    public String toString() {
        return String.format("SignageElement{id='%s', kind=%s, x=%.3f, y=%.3f}", id, kind, x, y);
    }
}
