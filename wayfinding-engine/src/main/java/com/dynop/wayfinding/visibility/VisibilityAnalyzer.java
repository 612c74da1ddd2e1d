package com.dynop.wayfinding.visibility;

import com.dynop.wayfinding.TaskBatches;
import com.dynop.wayfinding.config.VisibilityConfig;
import com.dynop.wayfinding.stats.Statistics;
import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.logging.Logger;

/**
 * Visibility graph analysis (VGA) of a floor plan.
 *
 * <p>This analyzer:
 * <ol>
 *   <li>Places sample points on a grid inside the walkable area</li>
 *   <li>Computes the isovist of every sample (one task per sample)</li>
 *   <li>Tests every unordered sample pair for line of sight (one task per row)</li>
 *   <li>Scores each sample with visual integration
 *       {@code 0.5 * neighbors / maxNeighbors + 0.5 * area / areaNormalization}</li>
 *   <li>Marks blind spots and wide-visibility points by percentile</li>
 * </ol>
 */
public class VisibilityAnalyzer {

    private static final Logger LOGGER = Logger.getLogger(VisibilityAnalyzer.class.getName());

    private final ExecutorService executorService;
    private final VisibilityConfig config;

    public VisibilityAnalyzer(ExecutorService executorService, VisibilityConfig config) {
        this.executorService = Objects.requireNonNull(executorService, "executorService");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * @param geometry Floor geometry
     * @return Per-sample visibility table
     * @throws com.dynop.wayfinding.AnalysisException with {@code EMPTY_SAMPLE_GRID} if no sample fits the walkable area
     */
    public VisibilityResult analyze(FloorPlanGeometry geometry) {
        SampleGrid grid = new SampleGridGenerator(config).generate(geometry);
        List<Coordinate> points = grid.points();
        int n = points.size();

        IsovistCalculator calculator = new IsovistCalculator(geometry, config);
        List<Callable<IsovistSample>> isovistTasks = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            final int index = i;
            isovistTasks.add(() -> calculator.compute(index, points.get(index)));
        }
        List<IsovistSample> isovists = TaskBatches.invokeAll(executorService, isovistTasks, "isovists");

        List<Callable<int[]>> rowTasks = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            final int row = i;
            rowTasks.add(() -> visibleAbove(geometry, points, row));
        }
        int[][] upperRows = TaskBatches.invokeAll(executorService, rowTasks, "visibility-graph")
                .toArray(new int[0][]);
        VisibilityGraph visibilityGraph = VisibilityGraph.fromUpperRows(upperRows);

        List<IsovistSample> samples = new ArrayList<>(n);
        List<String> skipped = new ArrayList<>();
        int maxNeighbors = 0;
        for (int i = 0; i < n; i++) {
            IsovistSample sample = isovists.get(i).withVisibleNeighbors(visibilityGraph.degree(i));
            samples.add(sample);
            maxNeighbors = Math.max(maxNeighbors, sample.getVisibleNeighbors());
            if (sample.isDegenerate()) {
                skipped.add("isovist[sample=" + i + "]");
            }
        }

        double[] visualIntegration = new double[n];
        double[] areas = new double[n];
        for (int i = 0; i < n; i++) {
            IsovistSample sample = samples.get(i);
            double connectivity = maxNeighbors > 0 ? (double) sample.getVisibleNeighbors() / maxNeighbors : 0.0;
            visualIntegration[i] = 0.5 * connectivity + 0.5 * (sample.getArea() / config.getAreaNormalization());
            areas[i] = sample.getArea();
        }

        double lowThreshold = Statistics.percentile(visualIntegration, config.getBlindSpotPercentile());
        double highThreshold = Statistics.percentile(visualIntegration, config.getWideVisibilityPercentile());
        List<Integer> blindSpots = new ArrayList<>();
        List<Integer> wideVisibility = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (visualIntegration[i] < lowThreshold) {
                blindSpots.add(i);
            }
            if (visualIntegration[i] > highThreshold) {
                wideVisibility.add(i);
            }
        }

        int degenerateCount = (int) samples.stream().filter(IsovistSample::isDegenerate).count();
        if (degenerateCount > 0) {
            LOGGER.warning(() -> degenerateCount + " degenerate isovists flagged and kept with zero area");
        }

        VisibilitySummary summary = new VisibilitySummary(
                n,
                visibilityGraph.edgeCount(),
                Statistics.mean(visualIntegration),
                Statistics.std(visualIntegration),
                Statistics.min(visualIntegration),
                Statistics.max(visualIntegration),
                Statistics.mean(areas),
                Statistics.std(areas),
                blindSpots.size(),
                wideVisibility.size(),
                degenerateCount,
                grid.spacing(),
                grid.coarsened());

        LOGGER.info(() -> String.format(
                "Visibility computed: %d samples (spacing %.3f), %d visibility edges, mean VI %.4f, %d blind spots",
                n, grid.spacing(), visibilityGraph.edgeCount(), summary.meanVisualIntegration(), blindSpots.size()));

        return new VisibilityResult(samples, visualIntegration, blindSpots, wideVisibility, summary,
                visibilityGraph, skipped);
    }

    private static int[] visibleAbove(FloorPlanGeometry geometry, List<Coordinate> points, int row) {
        Coordinate origin = points.get(row);
        int[] buffer = new int[points.size() - row - 1];
        int count = 0;
        for (int j = row + 1; j < points.size(); j++) {
            if (!geometry.isSightBlocked(origin, points.get(j))) {
                buffer[count++] = j;
            }
        }
        int[] visible = new int[count];
        System.arraycopy(buffer, 0, visible, 0, count);
        return visible;
    }
}
