package com.startsmart.grid;

import com.startsmart.core.ConfigurationException;
import com.startsmart.model.BoundingBox;
import com.startsmart.model.GeoPoint;
import com.startsmart.model.GridCell;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Splits a region rectangle into a regular lattice of cells of roughly {@code cellSizeM} metres.
 * The last row and column are trimmed to the region edge so that the cells partition the rectangle exactly.
 */
public final class GridPartitioner {
    private static final Logger LOG = LogManager.getLogger(GridPartitioner.class);

    public static final double MIN_CELL_SIZE_M = 50.0;
    public static final double MAX_CELL_SIZE_M = 150.0;
    public static final double DEFAULT_CELL_SIZE_M = 100.0;

    private static final double STEP_EPSILON = 1e-9;

    public List<GridCell> partition(String region, BoundingBox bounds, double cellSizeM) {
        if (region == null || region.isBlank()) {
            throw new ConfigurationException("region name must not be blank");
        }
        if (!(cellSizeM >= MIN_CELL_SIZE_M && cellSizeM <= MAX_CELL_SIZE_M)) {
            throw new ConfigurationException(String.format(
                    Locale.ROOT, "cell size %.1fm outside allowed range [%.0f, %.0f]", cellSizeM, MIN_CELL_SIZE_M, MAX_CELL_SIZE_M));
        }
        BoundingBox box = BoundingBox.validated(bounds.north(), bounds.south(), bounds.east(), bounds.west());

        double centerLat = box.center().lat();
        double latStep = GeoMath.metersToLatDegrees(cellSizeM);
        double lonStep = GeoMath.metersToLonDegrees(cellSizeM, centerLat);
        int rows = stepCount(box.latSpan(), latStep);
        int cols = stepCount(box.lonSpan(), lonStep);

        double[] latEdges = edges(box.south(), box.north(), latStep, rows);
        double[] lonEdges = edges(box.west(), box.east(), lonStep, cols);

        List<GridCell> cells = new ArrayList<>(rows * cols);
        for (int row = 0; row < rows; row++) {
            for (int col = 0; col < cols; col++) {
                BoundingBox cellBox = new BoundingBox(latEdges[row + 1], latEdges[row], lonEdges[col + 1], lonEdges[col]);
                GeoPoint center = cellBox.center();
                double heightM = GeoMath.latDegreesToMeters(cellBox.latSpan());
                double widthM = GeoMath.lonDegreesToMeters(cellBox.lonSpan(), center.lat());
                cells.add(GridCell.builder()
                        .id(cellId(region, row, col))
                        .region(region)
                        .row(row)
                        .col(col)
                        .bounds(cellBox)
                        .center(center)
                        .areaM2(heightM * widthM)
                        .build());
            }
        }
        LOG.info("partitioned region={} into {}x{} cells ({} total, size={}m)", region, rows, cols, cells.size(), cellSizeM);
        return Collections.unmodifiableList(cells);
    }

    public static String cellId(String region, int row, int col) {
        return String.format(Locale.ROOT, "%s-%03d-%03d", region, row, col);
    }

    private static int stepCount(double span, double step) {
        return Math.max(1, (int) Math.ceil(span / step - STEP_EPSILON));
    }

    private static double[] edges(double start, double end, double step, int count) {
        double[] out = new double[count + 1];
        for (int i = 0; i < count; i++) {
            out[i] = start + i * step;
        }
        out[count] = end;
        return out;
    }
}
