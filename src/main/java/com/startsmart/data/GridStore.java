package com.startsmart.data;

import com.startsmart.model.GridCell;

import java.util.List;

public interface GridStore {
    List<String> regions();

    /**
     * @throws com.startsmart.core.NotFoundException when the region is not configured
     */
    List<GridCell> load(String region);
}
