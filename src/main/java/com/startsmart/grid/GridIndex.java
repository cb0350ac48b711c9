package com.startsmart.grid;

import com.startsmart.core.DataIntegrityException;
import com.startsmart.core.NotFoundException;
import com.startsmart.data.GridStore;
import com.startsmart.model.BoundingBox;
import com.startsmart.model.GridCell;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of validated region partitions. Built once and passed to whoever needs it.
 * Point lookup is a binary search over each region's row and column edges.
 */
public final class GridIndex {
    private static final Logger LOG = LogManager.getLogger(GridIndex.class);

    private final Map<String, RegionLattice> regions;
    private final Map<String, GridCell> cellsById;

    private GridIndex(Map<String, RegionLattice> regions) {
        this.regions = Collections.unmodifiableMap(regions);
        Map<String, GridCell> byId = new HashMap<>();
        for (RegionLattice lattice : regions.values()) {
            for (GridCell cell : lattice.cells) {
                if (byId.put(cell.id, cell) != null) {
                    throw new DataIntegrityException("duplicate grid id across regions: " + cell.id);
                }
            }
        }
        this.cellsById = Collections.unmodifiableMap(byId);
    }

    public static GridIndex load(GridStore store, Collection<String> regionNames) {
        Map<String, List<GridCell>> cellsByRegion = new LinkedHashMap<>();
        for (String region : regionNames) {
            cellsByRegion.put(region, store.load(region));
        }
        return of(cellsByRegion);
    }

    public static GridIndex of(Map<String, List<GridCell>> cellsByRegion) {
        Map<String, RegionLattice> lattices = new LinkedHashMap<>();
        for (Map.Entry<String, List<GridCell>> entry : cellsByRegion.entrySet()) {
            lattices.put(entry.getKey(), RegionLattice.validate(entry.getKey(), entry.getValue()));
        }
        return new GridIndex(lattices);
    }

    public Collection<String> regions() {
        return regions.keySet();
    }

    public boolean hasRegion(String region) {
        return region != null && regions.containsKey(region);
    }

    public List<GridCell> cells(String region) {
        return lattice(region).cells;
    }

    public BoundingBox bounds(String region) {
        return lattice(region).bounds;
    }

    public int size() {
        return cellsById.size();
    }

    public GridCell cell(String gridId) {
        GridCell cell = gridId == null ? null : cellsById.get(gridId);
        if (cell == null) {
            throw new NotFoundException("unknown grid: " + gridId);
        }
        return cell;
    }

    public Optional<GridCell> find(String gridId) {
        return Optional.ofNullable(gridId == null ? null : cellsById.get(gridId));
    }

    /**
     * Cell containing the point across all regions, first region in load order wins.
     */
    public Optional<GridCell> assign(double lat, double lon) {
        for (RegionLattice lattice : regions.values()) {
            GridCell cell = lattice.locate(lat, lon);
            if (cell != null) {
                return Optional.of(cell);
            }
        }
        LOG.debug("point lat={} lon={} is outside every known grid", lat, lon);
        return Optional.empty();
    }

    public Optional<GridCell> assign(String region, double lat, double lon) {
        GridCell cell = lattice(region).locate(lat, lon);
        if (cell == null) {
            LOG.debug("point lat={} lon={} is outside region {}", lat, lon, region);
        }
        return Optional.ofNullable(cell);
    }

    private RegionLattice lattice(String region) {
        RegionLattice lattice = region == null ? null : regions.get(region);
        if (lattice == null) {
            throw new NotFoundException("unknown region: " + region);
        }
        return lattice;
    }

    private static final class RegionLattice {
        private final List<GridCell> cells;
        private final BoundingBox bounds;
        private final double[] latEdges;
        private final double[] lonEdges;
        private final GridCell[][] matrix;

        private RegionLattice(List<GridCell> cells, double[] latEdges, double[] lonEdges, GridCell[][] matrix) {
            this.cells = cells;
            this.latEdges = latEdges;
            this.lonEdges = lonEdges;
            this.matrix = matrix;
            this.bounds = new BoundingBox(latEdges[latEdges.length - 1], latEdges[0], lonEdges[lonEdges.length - 1], lonEdges[0]);
        }

        GridCell locate(double lat, double lon) {
            if (!bounds.contains(lat, lon)) {
                return null;
            }
            int row = edgeIndex(latEdges, lat);
            int col = edgeIndex(lonEdges, lon);
            if (row < 0 || col < 0) {
                return null;
            }
            return matrix[row][col];
        }

        private static int edgeIndex(double[] edges, double value) {
            int idx = Arrays.binarySearch(edges, value);
            if (idx >= 0) {
                return idx < edges.length - 1 ? idx : -1;
            }
            int insertion = -idx - 1;
            return insertion - 1;
        }

        /**
         * Accepts the cells only if they form a complete lattice whose neighbours share edges exactly.
         */
        static RegionLattice validate(String region, List<GridCell> rawCells) {
            if (rawCells == null || rawCells.isEmpty()) {
                throw new DataIntegrityException("region " + region + " has no cells");
            }
            int rows = 0;
            int cols = 0;
            for (GridCell cell : rawCells) {
                if (!region.equals(cell.region)) {
                    throw new DataIntegrityException("cell " + cell.id + " belongs to region " + cell.region + ", expected " + region);
                }
                if (cell.row < 0 || cell.col < 0) {
                    throw new DataIntegrityException("cell " + cell.id + " has negative row/col");
                }
                rows = Math.max(rows, cell.row + 1);
                cols = Math.max(cols, cell.col + 1);
            }
            GridCell[][] matrix = new GridCell[rows][cols];
            for (GridCell cell : rawCells) {
                if (matrix[cell.row][cell.col] != null) {
                    throw new DataIntegrityException("overlapping cells at row=" + cell.row + " col=" + cell.col + " in region " + region);
                }
                BoundingBox b = cell.bounds;
                if (!(b.north() > b.south() && b.east() > b.west())) {
                    throw new DataIntegrityException("cell " + cell.id + " has a degenerate rectangle");
                }
                matrix[cell.row][cell.col] = cell;
            }
            if (rawCells.size() != rows * cols) {
                throw new DataIntegrityException("region " + region + " lattice has gaps: "
                        + rawCells.size() + " cells for " + rows + "x" + cols);
            }

            double[] latEdges = new double[rows + 1];
            double[] lonEdges = new double[cols + 1];
            for (int r = 0; r < rows; r++) {
                latEdges[r] = matrix[r][0].bounds.south();
                latEdges[r + 1] = matrix[r][0].bounds.north();
            }
            for (int c = 0; c < cols; c++) {
                lonEdges[c] = matrix[0][c].bounds.west();
                lonEdges[c + 1] = matrix[0][c].bounds.east();
            }
            for (int r = 0; r < rows; r++) {
                for (int c = 0; c < cols; c++) {
                    BoundingBox b = matrix[r][c].bounds;
                    if (b.south() != latEdges[r] || b.north() != latEdges[r + 1]
                            || b.west() != lonEdges[c] || b.east() != lonEdges[c + 1]) {
                        throw new DataIntegrityException("cell " + matrix[r][c].id + " does not share edges with its neighbours");
                    }
                }
            }
            List<GridCell> ordered = new ArrayList<>(rawCells.size());
            for (GridCell[] rowCells : matrix) {
                ordered.addAll(Arrays.asList(rowCells));
            }
            return new RegionLattice(Collections.unmodifiableList(ordered), latEdges, lonEdges, matrix);
        }
    }
}
