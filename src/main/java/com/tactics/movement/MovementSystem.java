package com.tactics.movement;

import com.tactics.model.CellData;
import com.tactics.model.CellType;
import com.tactics.model.Grid;
import com.tactics.model.GridPoint;
import com.tactics.model.MovementType;
import com.tactics.model.TerrainProperties;
import com.tactics.model.Vector2;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves movement capability against terrain.
 * <p>
 * The rule table is static and shared. Everything mutable (the speed lookup
 * cache and any per-map rule overrides) belongs to an instance, which is
 * scoped to one map session.
 */
@Slf4j
public class MovementSystem {

    public static final int DEFAULT_SPEED_CACHE_CAPACITY = 100;

    private static final Map<CellType, TerrainProperties> DEFAULT_RULES;

    static {
        Map<CellType, TerrainProperties> rules = new EnumMap<>(CellType.class);
        rules.put(CellType.EMPTY, new TerrainProperties(true, true, false, 1.0));
        rules.put(CellType.PATH, new TerrainProperties(true, true, false, 1.2));
        rules.put(CellType.ROUGH_TERRAIN, new TerrainProperties(true, true, false, 0.5));
        // Swimming speed; flight ignores it
        rules.put(CellType.WATER, new TerrainProperties(false, true, true, 0.8));
        rules.put(CellType.BRIDGE, new TerrainProperties(true, true, false, 1.0));
        rules.put(CellType.OBSTACLE, new TerrainProperties(false, false, false, 0.0));
        rules.put(CellType.BLOCKED, new TerrainProperties(false, false, false, 0.0));
        rules.put(CellType.TOWER, new TerrainProperties(false, false, false, 0.0));
        rules.put(CellType.DECORATIVE, new TerrainProperties(true, true, false, 1.0));
        rules.put(CellType.SPAWN_ZONE, new TerrainProperties(true, true, false, 1.0));
        rules.put(CellType.BORDER, new TerrainProperties(false, false, false, 0.0));
        DEFAULT_RULES = Collections.unmodifiableMap(rules);
    }

    @Getter
    private final Grid grid;

    private final Map<CellType, TerrainProperties> rules;

    private final Map<SpeedKey, Double> speedCache;

    public MovementSystem(Grid grid) {
        this(grid, Map.of(), DEFAULT_SPEED_CACHE_CAPACITY);
    }

    /**
     * @param grid              terrain of the current map
     * @param ruleOverrides     replacements for individual terrain rules, e.g. to add damage
     * @param speedCacheCapacity maximum number of cached speed lookups
     */
    public MovementSystem(Grid grid, Map<CellType, TerrainProperties> ruleOverrides, int speedCacheCapacity) {
        this.grid = grid;
        this.rules = new EnumMap<>(DEFAULT_RULES);
        this.rules.putAll(ruleOverrides);
        this.speedCache = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<SpeedKey, Double> eldest) {
                return size() > speedCacheCapacity;
            }
        };
    }

    // ── static rule table ───────────────────────────────────────────────

    public static TerrainProperties getTerrainProperties(CellType cellType) {
        return DEFAULT_RULES.getOrDefault(cellType, DEFAULT_RULES.get(CellType.EMPTY));
    }

    /**
     * Whether an agent with the given capability may enter terrain of the given type.
     * A missing capability is treated as walking.
     */
    public static boolean canMoveOnTerrain(MovementType movementType, CellType cellType) {
        TerrainProperties props = DEFAULT_RULES.get(cellType);
        return props != null && props.allows(movementType);
    }

    /**
     * Speed factor an agent has on a cell, or 0 if it cannot enter it.
     * Flying agents are never slowed by the ground beneath them.
     */
    public static double getEffectiveSpeed(MovementType movementType, Grid grid, int x, int y) {
        if (!grid.isInBounds(x, y)) {
            return 0;
        }
        CellData data = grid.getCellData(x, y);
        return resolveSpeed(getTerrainProperties(data.getType()), data, MovementType.orDefault(movementType));
    }

    private static double resolveSpeed(TerrainProperties props, CellData data, MovementType type) {
        if (!props.allows(type)) {
            return 0;
        }
        if (type == MovementType.FLYING) {
            return 1.0;
        }
        if (data.hasSpeedOverride()) {
            return data.getMovementSpeed();
        }
        return props.speedMultiplier();
    }

    /**
     * Cost of stepping from one world position to another: cell distance divided by the
     * speed on the destination cell, or infinity if the destination cannot be entered.
     */
    public static double getMovementCost(Vector2 from, Vector2 to, Grid grid, MovementType movementType) {
        GridPoint fromCell = grid.worldToGrid(from);
        GridPoint toCell = grid.worldToGrid(to);
        if (!canMoveOnTerrain(movementType, grid.getCellType(toCell))) {
            return Double.POSITIVE_INFINITY;
        }
        double speed = getEffectiveSpeed(movementType, grid, toCell.x(), toCell.y());
        if (speed <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        return fromCell.distanceTo(toCell) / speed;
    }

    /**
     * Eases a speed value toward a target, changing by at most {@code transitionRate} per second.
     */
    public static double getSmoothTransitionSpeed(double currentSpeed, double targetSpeed,
                                                  double deltaMillis, double transitionRate) {
        double diff = targetSpeed - currentSpeed;
        double maxChange = transitionRate * (deltaMillis / 1000);
        if (Math.abs(diff) <= maxChange) {
            return targetSpeed;
        }
        return currentSpeed + Math.signum(diff) * maxChange;
    }

    // ── per-session behaviour ───────────────────────────────────────────

    public TerrainProperties getRule(CellType cellType) {
        return rules.getOrDefault(cellType, rules.get(CellType.EMPTY));
    }

    /**
     * Like {@link #getEffectiveSpeed(MovementType, Grid, int, int)}, but resolved
     * through this instance's rules, overrides included.
     */
    public double getEffectiveSpeed(MovementType movementType, int x, int y) {
        if (!grid.isInBounds(x, y)) {
            return 0;
        }
        CellData data = grid.getCellData(x, y);
        return resolveSpeed(getRule(data.getType()), data, MovementType.orDefault(movementType));
    }

    public MovementType getEntityMovementType(MobileAgent agent) {
        return MovementType.orDefault(agent.getMovementType());
    }

    public boolean canEntityMoveTo(MobileAgent agent, Vector2 position) {
        GridPoint cell = grid.worldToGrid(position);
        if (!grid.isInBounds(cell)) {
            return false;
        }
        return getRule(grid.getCellType(cell)).allows(getEntityMovementType(agent));
    }

    /**
     * Scales an agent's base speed by the terrain it currently stands on.
     */
    public double getAdjustedSpeed(MobileAgent agent, double baseSpeed) {
        GridPoint cell = grid.worldToGrid(agent.getPosition());
        MovementType type = getEntityMovementType(agent);
        SpeedKey key = new SpeedKey(cell, type);

        Double multiplier = speedCache.get(key);
        if (multiplier == null) {
            multiplier = getEffectiveSpeed(type, cell.x(), cell.y());
            speedCache.put(key, multiplier);
        }
        return baseSpeed * multiplier;
    }

    /**
     * Applies damage over time and status effects from the terrain under the agent.
     * Inert for terrain whose rule carries neither.
     */
    public void applyTerrainEffects(MobileAgent agent, double deltaMillis) {
        GridPoint cell = grid.worldToGrid(agent.getPosition());
        if (!grid.isInBounds(cell)) {
            return;
        }
        TerrainProperties props = getRule(grid.getCellType(cell));
        if (!props.hasEffects()) {
            return;
        }
        if (props.damagePerSecond() > 0) {
            agent.takeDamage(props.damagePerSecond() * (deltaMillis / 1000));
        }
        if (props.statusEffect() != null) {
            log.debug("Applying {} to agent at {}", props.statusEffect().type(), cell);
            agent.applyStatusEffect(props.statusEffect());
        }
    }

    public int getSpeedCacheSize() {
        return speedCache.size();
    }

    public void clearCache() {
        speedCache.clear();
    }

    private record SpeedKey(GridPoint cell, MovementType movementType) {}
}
