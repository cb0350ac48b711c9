package com.startsmart.grid;

import com.startsmart.core.ConfigurationException;
import com.startsmart.model.BoundingBox;
import com.startsmart.model.GridCell;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GridPartitionerTest {
    private final GridPartitioner partitioner = new GridPartitioner();

    @Test
    void partition_shouldBuildThreeByThreeForThreeHundredMetreSquare() {
        BoundingBox box = new BoundingBox(24.8260, 24.8233, 67.05745, 67.0545);

        List<GridCell> cells = partitioner.partition("DHA-Phase2", box, 100.0);

        assertEquals(9, cells.size());
        assertEquals("DHA-Phase2-000-000", cells.get(0).id);
        assertEquals("DHA-Phase2-002-002", cells.get(8).id);
        assertEquals(box.north(), cells.get(8).bounds.north(), 0.0);
        assertEquals(box.east(), cells.get(8).bounds.east(), 0.0);
        for (GridCell cell : cells) {
            assertTrue(cell.areaM2 > 8_000.0 && cell.areaM2 <= 10_001.0, cell.id + " area " + cell.areaM2);
            assertTrue(cell.contains(cell.center.lat(), cell.center.lon()));
        }
    }

    @Test
    void partition_shouldCoverRandomRectanglesExactlyOnce() {
        Random random = new Random(42L);
        for (int trial = 0; trial < 25; trial++) {
            double south = 24.70 + random.nextDouble() * 0.2;
            double west = 66.90 + random.nextDouble() * 0.2;
            double north = south + 0.0005 + random.nextDouble() * 0.01;
            double east = west + 0.0005 + random.nextDouble() * 0.01;
            double size = 50.0 + random.nextDouble() * 100.0;
            BoundingBox box = new BoundingBox(north, south, east, west);

            List<GridCell> cells = partitioner.partition("r" + trial, box, size);
            GridIndex index = GridIndex.of(Map.of("r" + trial, cells));

            for (int probe = 0; probe < 200; probe++) {
                double lat = south + random.nextDouble() * (north - south);
                double lon = west + random.nextDouble() * (east - west);
                long hits = cells.stream().filter(c -> c.contains(lat, lon)).count();
                assertEquals(1L, hits, "point must fall in exactly one cell");
                assertTrue(index.assign(lat, lon).isPresent());
            }
            for (int i = 0; i < cells.size(); i++) {
                for (int j = i + 1; j < cells.size(); j++) {
                    assertFalse(cells.get(i).bounds.overlaps(cells.get(j).bounds));
                }
            }
        }
    }

    @Test
    void partition_shouldProduceSingleCellForTinyRegion() {
        BoundingBox box = new BoundingBox(24.82001, 24.82, 67.03001, 67.03);

        List<GridCell> cells = partitioner.partition("tiny", box, 100.0);

        assertEquals(1, cells.size());
        assertEquals(box, cells.get(0).bounds);
    }

    @Test
    void partition_shouldRejectCellSizeOutsideRange() {
        BoundingBox box = new BoundingBox(24.83, 24.82, 67.04, 67.03);

        assertThrows(ConfigurationException.class, () -> partitioner.partition("r", box, 49.9));
        assertThrows(ConfigurationException.class, () -> partitioner.partition("r", box, 150.1));
        assertEquals(1, partitioner.partition("r", new BoundingBox(24.8201, 24.82, 67.0301, 67.03), 150.0).size());
    }

    @Test
    void partition_shouldRejectDegenerateBounds() {
        assertThrows(ConfigurationException.class,
                () -> partitioner.partition("r", new BoundingBox(24.82, 24.82, 67.04, 67.03), 100.0));
        assertThrows(ConfigurationException.class,
                () -> partitioner.partition("r", new BoundingBox(24.83, 24.82, 67.03, 67.04), 100.0));
        assertThrows(ConfigurationException.class,
                () -> partitioner.partition("r", new BoundingBox(Double.NaN, 24.82, 67.04, 67.03), 100.0));
    }
}
