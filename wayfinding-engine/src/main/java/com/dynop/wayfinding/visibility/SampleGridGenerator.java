package com.dynop.wayfinding.visibility;

import com.dynop.wayfinding.AnalysisException;
import com.dynop.wayfinding.config.VisibilityConfig;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Places sample points on a regular grid inside the walkable area.
 *
 * <p>Points sit at cell centres {@code min + spacing/2 + i * spacing}. Points on or within
 * {@value #WALL_CLEARANCE} of an obstacle, or not strictly inside the boundary, are dropped. When more
 * points than the configured cap remain, the spacing is multiplied by the coarsening factor and the grid
 * is rebuilt, which keeps the outcome reproducible for a given input. If a coarsening step would leave
 * no point at all, the spacing is bisected back towards the last non-empty grid.
 */
public class SampleGridGenerator {

    private static final Logger LOGGER = Logger.getLogger(SampleGridGenerator.class.getName());

    static final double WALL_CLEARANCE = 1e-9;

    private static final int MAX_BISECTIONS = 32;
    private static final double BISECTION_TOLERANCE = 1e-9;

    private final VisibilityConfig config;

    public SampleGridGenerator(VisibilityConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * @param geometry Floor geometry
     * @return Grid respecting the sample cap
     * @throws AnalysisException with {@code EMPTY_SAMPLE_GRID} if no point falls inside the walkable area
     */
    public SampleGrid generate(FloorPlanGeometry geometry) {
        Envelope bounds = geometry.getBounds();
        if (bounds.isNull()) {
            throw new AnalysisException(AnalysisException.EMPTY_SAMPLE_GRID, null,
                    "Floor geometry has no walkable area");
        }

        double spacing = config.getGridSpacing();
        List<Coordinate> points = sample(geometry, bounds, spacing);
        if (points.isEmpty()) {
            throw new AnalysisException(AnalysisException.EMPTY_SAMPLE_GRID, null,
                    String.format("No sample point inside the walkable area at spacing %.4f", spacing));
        }

        boolean coarsened = false;
        while (points.size() > config.getMaxSamples()) {
            int previous = points.size();
            double previousSpacing = spacing;
            double nextSpacing = spacing * config.getCoarseningFactor();
            List<Coordinate> next = sample(geometry, bounds, nextSpacing);
            LOGGER.fine(() -> String.format("Coarsening grid: spacing %.4f -> %.4f, samples %d -> %d",
                    previousSpacing, nextSpacing, previous, next.size()));
            if (next.isEmpty()) {
                return narrow(geometry, bounds, spacing, points, nextSpacing);
            }
            spacing = nextSpacing;
            points = next;
            coarsened = true;
        }

        if (coarsened) {
            logCoarsened(spacing, points.size());
        }
        return new SampleGrid(points, spacing, coarsened);
    }

    /**
     * Search the spacing interval between a grid above the cap ({@code lo}) and an empty one
     * ({@code hi}) for a grid within the cap. Narrow areas can jump straight from too many points
     * to none; if bisection finds no spacing in between, every k-th point of the finest grid above
     * the cap is kept instead.
     */
    private SampleGrid narrow(FloorPlanGeometry geometry, Envelope bounds, double lo, List<Coordinate> loPoints,
                              double hi) {
        int cap = config.getMaxSamples();
        double low = lo;
        double high = hi;
        List<Coordinate> lowPoints = loPoints;
        for (int i = 0; i < MAX_BISECTIONS && high - low > low * BISECTION_TOLERANCE; i++) {
            double mid = (low + high) / 2;
            List<Coordinate> midPoints = sample(geometry, bounds, mid);
            if (midPoints.isEmpty()) {
                high = mid;
            } else if (midPoints.size() > cap) {
                low = mid;
                lowPoints = midPoints;
            } else {
                logCoarsened(mid, midPoints.size());
                return new SampleGrid(midPoints, mid, true);
            }
        }

        int stride = (lowPoints.size() + cap - 1) / cap;
        List<Coordinate> thinned = new ArrayList<>();
        for (int i = 0; i < lowPoints.size(); i += stride) {
            thinned.add(lowPoints.get(i));
        }
        int before = lowPoints.size();
        LOGGER.warning(() -> String.format(
                "No grid spacing yields between 1 and %d samples; keeping every %d-th of %d points", cap, stride, before));
        logCoarsened(low, thinned.size());
        return new SampleGrid(thinned, low, true);
    }

    private void logCoarsened(double finalSpacing, int count) {
        LOGGER.warning(() -> String.format(
                "Sample grid coarsened from spacing %.4f to %.4f to respect the cap of %d (%d samples)",
                config.getGridSpacing(), finalSpacing, config.getMaxSamples(), count));
    }

    private static List<Coordinate> sample(FloorPlanGeometry geometry, Envelope bounds, double spacing) {
        List<Coordinate> points = new ArrayList<>();
        for (int row = 0; ; row++) {
            double y = bounds.getMinY() + spacing / 2 + row * spacing;
            if (y >= bounds.getMaxY()) {
                break;
            }
            for (int col = 0; ; col++) {
                double x = bounds.getMinX() + spacing / 2 + col * spacing;
                if (x >= bounds.getMaxX()) {
                    break;
                }
                if (geometry.isStrictlyInside(x, y) && !geometry.isNearObstacle(x, y, WALL_CLEARANCE)) {
                    points.add(new Coordinate(x, y));
                }
            }
        }
        return points;
    }
}
