package org.tessera.autotile;

/**
 * Occupancy marker of a single autotile cell.
 */
public enum AutoTile {
    /** The cell is empty. */
    NONE,
    /** The cell is filled and takes part in autotiling. */
    TILE;

    /**
     * @return The ruleset value a neighbor with this occupancy compares against.
     */
    AutoTileRulesetValue toRulesetValue() {
        return this == TILE ? AutoTileRulesetValue.TILE : AutoTileRulesetValue.NONE;
    }
}
