package com.tactics.navigation;

import com.tactics.model.GridPoint;

import java.util.Set;

/**
 * Notified when runtime structures block or free grid cells.
 */
@FunctionalInterface
public interface ObstacleChangeListener {

    /**
     * @param cells every cell whose navigation state changed
     */
    void onCellsChanged(Set<GridPoint> cells);
}
