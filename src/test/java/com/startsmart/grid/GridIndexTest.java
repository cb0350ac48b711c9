package com.startsmart.grid;

import com.startsmart.core.DataIntegrityException;
import com.startsmart.core.NotFoundException;
import com.startsmart.model.BoundingBox;
import com.startsmart.model.GridCell;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GridIndexTest {
    private static final BoundingBox REGION = new BoundingBox(24.8260, 24.8233, 67.05745, 67.0545);

    private List<GridCell> regionCells(String name) {
        return new GridPartitioner().partition(name, REGION, 100.0);
    }

    @Test
    void assign_shouldUseHalfOpenEdges() {
        List<GridCell> cells = regionCells("a");
        GridIndex index = GridIndex.of(Map.of("a", cells));
        GridCell first = cells.get(0);
        GridCell above = cells.get(3);

        assertEquals(first.id, index.assign(first.bounds.south(), first.bounds.west()).orElseThrow().id);
        assertEquals(above.id, index.assign(first.bounds.north(), first.bounds.west()).orElseThrow().id);
        assertEquals("a-000-001", index.assign(first.bounds.south(), first.bounds.east()).orElseThrow().id);
    }

    @Test
    void assign_shouldReturnEmptyOutsideRegion() {
        GridIndex index = GridIndex.of(Map.of("a", regionCells("a")));

        assertTrue(index.assign(REGION.north(), REGION.west()).isEmpty());
        assertTrue(index.assign(REGION.south(), REGION.east()).isEmpty());
        assertTrue(index.assign(10.0, 10.0).isEmpty());
        assertTrue(index.assign("a", REGION.south() - 1e-7, REGION.west()).isEmpty());
    }

    @Test
    void lookup_shouldThrowNotFoundForUnknownIds() {
        GridIndex index = GridIndex.of(Map.of("a", regionCells("a")));

        assertThrows(NotFoundException.class, () -> index.cells("b"));
        assertThrows(NotFoundException.class, () -> index.cell("a-009-009"));
        assertFalse(index.find("a-009-009").isPresent());
        assertEquals(9, index.size());
        assertEquals(REGION, index.bounds("a"));
    }

    @Test
    void of_shouldRejectOverlappingCells() {
        List<GridCell> cells = new ArrayList<>(regionCells("a"));
        cells.add(cells.get(4).toBuilder().id("a-dup").build());

        assertThrows(DataIntegrityException.class, () -> GridIndex.of(Map.of("a", cells)));
    }

    @Test
    void of_shouldRejectGaps() {
        List<GridCell> cells = new ArrayList<>(regionCells("a"));
        cells.remove(4);

        assertThrows(DataIntegrityException.class, () -> GridIndex.of(Map.of("a", cells)));
    }

    @Test
    void of_shouldRejectCellsThatDoNotShareEdges() {
        List<GridCell> cells = new ArrayList<>(regionCells("a"));
        GridCell shifted = cells.get(4);
        BoundingBox b = shifted.bounds;
        cells.set(4, shifted.toBuilder()
                .bounds(new BoundingBox(b.north() + 1e-6, b.south() + 1e-6, b.east(), b.west()))
                .build());

        assertThrows(DataIntegrityException.class, () -> GridIndex.of(Map.of("a", cells)));
    }

    @Test
    void of_shouldRejectDuplicateIdsAcrossRegions() {
        List<GridCell> a = regionCells("a");
        List<GridCell> b = new ArrayList<>();
        for (GridCell cell : a) {
            b.add(cell.toBuilder().region("b").build());
        }

        assertThrows(DataIntegrityException.class, () -> GridIndex.of(Map.of("a", a, "b", b)));
    }
}
