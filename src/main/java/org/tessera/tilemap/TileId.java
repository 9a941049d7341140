package org.tessera.tilemap;

/**
 * Identifies one tile graphic within a tilesheet.
 * @param value The tile index within the sheet, never negative.
 */
public record TileId(int value) {

    public TileId {
        if (value < 0) {
            throw new IllegalArgumentException("Tile id must be non-negative: " + value);
        }
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
