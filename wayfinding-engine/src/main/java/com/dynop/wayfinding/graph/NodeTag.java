package com.dynop.wayfinding.graph;

/**
 * Optional semantic tag carried by a {@link SpatialNode}.
 *
 * <ul>
 *   <li>{@link #ROOM} - An enclosed space (office, ward, shop)</li>
 *   <li>{@link #CORRIDOR} - A circulation space</li>
 *   <li>{@link #DECISION_POINT} - An intersection flagged by the extraction step</li>
 * </ul>
 */
public enum NodeTag {
    ROOM,
    CORRIDOR,
    DECISION_POINT
}
