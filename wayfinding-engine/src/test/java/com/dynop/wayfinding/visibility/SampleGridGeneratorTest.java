package com.dynop.wayfinding.visibility;

import com.dynop.wayfinding.AnalysisException;
import com.dynop.wayfinding.config.VisibilityConfig;
import com.dynop.wayfinding.config.WayfindingConfig;
import com.graphhopper.util.PMap;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SampleGridGeneratorTest {

    private static VisibilityConfig config(PMap overrides) {
        return new WayfindingConfig(overrides).getVisibility();
    }

    @Test
    void placesPointsAtCellCentres() {
        SampleGrid grid = new SampleGridGenerator(VisibilityConfig.defaults())
                .generate(new FloorPlanGeometry(FloorPlanGeometryTest.room(4)));

        assertEquals(16, grid.points().size());
        assertFalse(grid.coarsened());
        assertEquals(1.0, grid.spacing());
        assertEquals(new Coordinate(0.5, 0.5), grid.points().get(0));
        assertEquals(new Coordinate(1.5, 0.5), grid.points().get(1));
    }

    @Test
    void dropsPointsOnInteriorWalls() {
        List<WallSegment> walls = new ArrayList<>(FloorPlanGeometryTest.room(4));
        walls.add(new WallSegment(0, 1.5, 4, 1.5));

        SampleGrid grid = new SampleGridGenerator(VisibilityConfig.defaults()).generate(new FloorPlanGeometry(walls));

        assertEquals(12, grid.points().size());
        assertTrue(grid.points().stream().noneMatch(p -> p.y == 1.5));
    }

    @Test
    void coarsensUntilCapIsRespected() {
        VisibilityConfig capped = config(new PMap().putObject(VisibilityConfig.MAX_SAMPLES, 30));

        SampleGrid grid = new SampleGridGenerator(capped).generate(new FloorPlanGeometry(FloorPlanGeometryTest.room(10)));

        assertTrue(grid.coarsened());
        assertEquals(25, grid.points().size());
        assertEquals(1.0 * 1.25 * 1.25 * 1.25, grid.spacing(), 1e-12);
    }

    @Test
    void narrowCorridorsKeepSamplesWhenCoarseningWouldEmptyTheGrid() {
        // L-shaped floor with 2 m wide arms: spacing 3.81 leaves 5 points, the next step (4.77) none
        List<List<Double>> boundary = List.of(List.of(0.0, 0.0), List.of(10.0, 0.0), List.of(10.0, 2.0),
                List.of(2.0, 2.0), List.of(2.0, 10.0), List.of(0.0, 10.0));
        FloorPlanGeometry geometry = new FloorPlanGeometry(List.of(), boundary);
        VisibilityConfig capped = config(new PMap().putObject(VisibilityConfig.MAX_SAMPLES, 4));

        SampleGrid grid = new SampleGridGenerator(capped).generate(geometry);

        assertTrue(grid.coarsened());
        assertFalse(grid.points().isEmpty());
        assertTrue(grid.size() <= 4);
        assertTrue(grid.spacing() >= Math.pow(1.25, 6) && grid.spacing() < 4.0, "spacing " + grid.spacing());
        for (Coordinate point : grid.points()) {
            assertTrue(geometry.isStrictlyInside(point.x, point.y), point.toString());
        }
    }

    @Test
    void triangleTooSmallForSpacingYieldsEmptyGrid() {
        List<List<Double>> triangle = List.of(List.of(0.0, 0.0), List.of(1.0, 0.0), List.of(0.0, 1.0));
        FloorPlanGeometry geometry = new FloorPlanGeometry(List.of(), triangle);

        AnalysisException ex = assertThrows(AnalysisException.class,
                () -> new SampleGridGenerator(VisibilityConfig.defaults()).generate(geometry));
        assertEquals(AnalysisException.EMPTY_SAMPLE_GRID, ex.getErrorCode());
    }

    @Test
    void geometryWithoutAreaYieldsEmptyGrid() {
        FloorPlanGeometry geometry = new FloorPlanGeometry(List.of(new WallSegment(0, 0, 10, 0)));

        AnalysisException ex = assertThrows(AnalysisException.class,
                () -> new SampleGridGenerator(VisibilityConfig.defaults()).generate(geometry));
        assertEquals(AnalysisException.EMPTY_SAMPLE_GRID, ex.getErrorCode());
    }
}
