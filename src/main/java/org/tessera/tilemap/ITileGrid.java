package org.tessera.tilemap;

import java.util.List;
import java.util.Optional;

/**
 * The grid of final tile identifiers consumed by the renderer.
 * <p>
 * Each cell holds at most one {@link TileId}; an empty cell is drawn as nothing.
 */
public interface ITileGrid {

    /**
     * @return The number of columns.
     */
    int getWidth();

    /**
     * @return The number of rows.
     */
    int getHeight();

    /**
     * @return The pixel size of a single tile.
     */
    TileSize getTileSize();

    /**
     * @return The tilesheet the tile ids refer to.
     */
    TextureKey getTilesheet();

    /**
     * Sets or clears the tile at the given cell.
     *
     * @param x The column.
     * @param y The row.
     * @param tileId The tile to show, or {@code null} to leave the cell empty.
     * @throws TileBoundsException if the cell is outside the grid.
     */
    void setTile(int x, int y, TileId tileId);

    /**
     * Gets the tile at the given cell.
     *
     * @param x The column.
     * @param y The row.
     * @return The tile id, or empty if the cell has no tile.
     * @throws TileBoundsException if the cell is outside the grid.
     */
    Optional<TileId> getTile(int x, int y);

    /**
     * Returns all cells in row-major order.
     *
     * @return A read-only list with one entry per cell.
     */
    List<Optional<TileId>> tiles();
}
