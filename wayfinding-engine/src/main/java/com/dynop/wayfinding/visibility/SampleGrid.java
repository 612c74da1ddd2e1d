package com.dynop.wayfinding.visibility;

import org.locationtech.jts.geom.Coordinate;

import java.util.List;

/**
 * Sample points of a visibility analysis.
 *
 * @param points     Cell-centred points, row by row from the lower-left corner
 * @param spacing    Spacing actually used
 * @param coarsened  true if the configured spacing had to be widened to respect the sample cap
 */
public record SampleGrid(List<Coordinate> points, double spacing, boolean coarsened) {

    public SampleGrid {
        points = List.copyOf(points);
    }

    public int size() {
        return points.size();
    }
}
