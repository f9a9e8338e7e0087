package com.tactics.pathfinding;

import com.tactics.model.GridPoint;
import lombok.Getter;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Bounded first-in first-out store of successful path results, indexed by the
 * cells each route touches so that a terrain change drops exactly the routes
 * that cross it.
 */
class PathCache {

    @Getter
    private final int capacity;

    private final LinkedHashMap<PathCacheKey, Entry> entries = new LinkedHashMap<>();

    private final Map<GridPoint, Set<PathCacheKey>> byCell = new HashMap<>();

    PathCache(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Cache capacity must not be negative: " + capacity);
        }
        this.capacity = capacity;
    }

    PathfindingResult get(PathCacheKey key) {
        Entry entry = entries.get(key);
        return entry != null ? entry.result() : null;
    }

    /**
     * @param cells every cell the route occupies or crosses, endpoints included
     */
    void put(PathCacheKey key, PathfindingResult result, Set<GridPoint> cells) {
        if (capacity == 0) {
            return;
        }
        remove(key);
        while (entries.size() >= capacity) {
            Iterator<PathCacheKey> oldest = entries.keySet().iterator();
            remove(oldest.next());
        }
        Set<GridPoint> indexed = Set.copyOf(cells);
        entries.put(key, new Entry(result, indexed));
        for (GridPoint cell : indexed) {
            byCell.computeIfAbsent(cell, c -> new HashSet<>()).add(key);
        }
    }

    /**
     * Drops every entry whose route touches one of the changed cells.
     *
     * @return number of entries removed
     */
    int invalidate(Set<GridPoint> changedCells) {
        Set<PathCacheKey> stale = new HashSet<>();
        for (GridPoint cell : changedCells) {
            Set<PathCacheKey> keys = byCell.get(cell);
            if (keys != null) {
                stale.addAll(keys);
            }
        }
        stale.forEach(this::remove);
        return stale.size();
    }

    void clear() {
        entries.clear();
        byCell.clear();
    }

    int size() {
        return entries.size();
    }

    private void remove(PathCacheKey key) {
        Entry entry = entries.remove(key);
        if (entry == null) {
            return;
        }
        for (GridPoint cell : entry.cells()) {
            Set<PathCacheKey> keys = byCell.get(cell);
            if (keys != null) {
                keys.remove(key);
                if (keys.isEmpty()) {
                    byCell.remove(cell);
                }
            }
        }
    }

    private record Entry(PathfindingResult result, Set<GridPoint> cells) {}
}
