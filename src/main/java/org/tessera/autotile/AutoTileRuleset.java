package org.tessera.autotile;

import org.tessera.tilemap.GridIndexer;
import org.tessera.tilemap.TileId;

import java.util.Objects;

/**
 * A neighborhood pattern and the tile it produces when the pattern matches.
 * <p>
 * The pattern is a 5x5 grid addressed {@code grid[x][y]} and centered on the cell being
 * evaluated, so {@code grid[2][2]} is the cell itself and is never read. Most rulesets only
 * constrain the inner 3x3 ring; fill the outer ring with {@link AutoTileRulesetValue#ANY}.
 * <p>
 * Because the first index is the column, a literal {@code grid} initializer reads rotated
 * 90 degrees from the way the tiles appear on screen. {@link RulesetPatternParser} accepts
 * patterns in screen orientation.
 * <p>
 * Neighbors outside the map resolve to {@code ANY}. A pattern cell only ever matches such
 * a neighbor if it is {@code ANY} itself, so a concrete {@code NONE} or {@code TILE}
 * expectation that reaches past the map edge never matches.
 */
public final class AutoTileRuleset {

    /** Edge length of the pattern grid. */
    public static final int GRID_SIZE = 5;

    private static final int CENTER = GRID_SIZE / 2;

    private final TileId tileId;
    private final AutoTileRulesetValue[][] grid;

    /**
     * Creates a new ruleset.
     *
     * @param tileId The tile shown where this ruleset matches.
     * @param grid A 5x5 pattern addressed {@code grid[x][y]}. The array is copied.
     * @throws IllegalArgumentException if the grid is not 5x5 or contains null values.
     */
    public AutoTileRuleset(TileId tileId, AutoTileRulesetValue[][] grid) {
        this.tileId = Objects.requireNonNull(tileId, "Tile id cannot be null.");
        Objects.requireNonNull(grid, "Ruleset grid cannot be null.");
        if (grid.length != GRID_SIZE) {
            throw new IllegalArgumentException("Ruleset grid must have " + GRID_SIZE + " columns, got " + grid.length);
        }
        this.grid = new AutoTileRulesetValue[GRID_SIZE][];
        for (int x = 0; x < GRID_SIZE; x++) {
            if (grid[x] == null || grid[x].length != GRID_SIZE) {
                throw new IllegalArgumentException("Ruleset grid column " + x + " must have " + GRID_SIZE + " rows");
            }
            for (int y = 0; y < GRID_SIZE; y++) {
                if (grid[x][y] == null) {
                    throw new IllegalArgumentException("Ruleset grid value at (" + x + ", " + y + ") cannot be null");
                }
            }
            this.grid[x] = grid[x].clone();
        }
    }

    public TileId getTileId() {
        return tileId;
    }

    /**
     * Gets one pattern value.
     *
     * @param x The pattern column, 0..4.
     * @param y The pattern row, 0..4.
     * @return The expected neighbor state.
     */
    public AutoTileRulesetValue getValue(int x, int y) {
        return grid[x][y];
    }

    /**
     * @return A copy of the pattern, addressed {@code grid[x][y]}.
     */
    public AutoTileRulesetValue[][] getGrid() {
        AutoTileRulesetValue[][] copy = new AutoTileRulesetValue[GRID_SIZE][];
        for (int x = 0; x < GRID_SIZE; x++) {
            copy[x] = grid[x].clone();
        }
        return copy;
    }

    /**
     * Tests the 5x5 area centered on the given cell against this pattern.
     *
     * @param autotiles The occupancy grid, row-major.
     * @param width The occupancy grid width.
     * @param height The occupancy grid height.
     * @param x The column of the cell being evaluated.
     * @param y The row of the cell being evaluated.
     * @return true if the cell is occupied and every constrained neighbor matches.
     */
    boolean matches(AutoTile[] autotiles, int width, int height, int x, int y) {
        if (!GridIndexer.contains(x, y, width, height)
                || autotiles[GridIndexer.index(x, y, width, height)] != AutoTile.TILE) {
            return false;
        }

        for (int rx = 0; rx < GRID_SIZE; rx++) {
            for (int ry = 0; ry < GRID_SIZE; ry++) {
                if ((rx == CENTER && ry == CENTER) || grid[rx][ry] == AutoTileRulesetValue.ANY) {
                    continue;
                }
                AutoTileRulesetValue actual = resolve(autotiles, width, height, x + rx - CENTER, y + ry - CENTER);
                if (grid[rx][ry] != actual) {
                    return false;
                }
            }
        }
        return true;
    }

    private static AutoTileRulesetValue resolve(AutoTile[] autotiles, int width, int height, int x, int y) {
        // Off-map neighbors count as ANY.
        if (!GridIndexer.contains(x, y, width, height)) {
            return AutoTileRulesetValue.ANY;
        }
        return autotiles[GridIndexer.index(x, y, width, height)].toRulesetValue();
    }

    @Override
    public String toString() {
        return "AutoTileRuleset{tileId=" + tileId + "}";
    }
}
