package com.startsmart.data;

import com.startsmart.config.Config;
import com.startsmart.core.ConfigurationException;
import com.startsmart.core.NotFoundException;
import com.startsmart.grid.GridPartitioner;
import com.startsmart.model.BoundingBox;
import com.startsmart.model.GridCell;

import java.util.List;

/**
 * Regions declared in config as {@code grid.region.<name>.north|south|east|west}, partitioned on load.
 */
public final class ConfigGridStore implements GridStore {
    private final Config config;
    private final GridPartitioner partitioner;

    public ConfigGridStore(Config config) {
        this(config, new GridPartitioner());
    }

    public ConfigGridStore(Config config, GridPartitioner partitioner) {
        this.config = config;
        this.partitioner = partitioner;
    }

    @Override
    public List<String> regions() {
        return config.getList("grid.regions");
    }

    @Override
    public List<GridCell> load(String region) {
        if (region == null || !regions().contains(region)) {
            throw new NotFoundException("unknown region: " + region);
        }
        String prefix = "grid.region." + region + ".";
        BoundingBox bounds;
        try {
            bounds = BoundingBox.validated(
                    config.requireDouble(prefix + "north"),
                    config.requireDouble(prefix + "south"),
                    config.requireDouble(prefix + "east"),
                    config.requireDouble(prefix + "west")
            );
        } catch (ConfigurationException e) {
            throw new ConfigurationException("region " + region + ": " + e.getMessage(), e);
        }
        double cellSize = config.getDouble(prefix + "cell_size_m", config.getDouble("grid.cell_size_m", GridPartitioner.DEFAULT_CELL_SIZE_M));
        return partitioner.partition(region, bounds, cellSize);
    }
}
