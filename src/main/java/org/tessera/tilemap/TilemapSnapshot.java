package org.tessera.tilemap;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, serializable copy of a tile grid's contents.
 * <p>
 * Tiles are stored row-major; empty cells are {@code null} in the {@code tiles} array.
 */
public class TilemapSnapshot {
    private final int width;
    private final int height;
    private final TileSize tileSize;
    private final String tilesheet;
    private final Integer[] tiles;

    /**
     * Creates a snapshot from raw values.
     *
     * @param width The number of columns.
     * @param height The number of rows.
     * @param tileSize The pixel size of one tile.
     * @param tilesheet The tilesheet label.
     * @param tiles Row-major tile ids, {@code null} for empty cells. Length must be width * height.
     */
    @JsonCreator
    public TilemapSnapshot(@JsonProperty("width") int width,
                           @JsonProperty("height") int height,
                           @JsonProperty("tileSize") TileSize tileSize,
                           @JsonProperty("tilesheet") String tilesheet,
                           @JsonProperty("tiles") Integer[] tiles) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Snapshot dimensions must be non-negative, got " + width + "x" + height);
        }
        final int cells;
        try {
            cells = Math.multiplyExact(width, height);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Snapshot of " + width + "x" + height + " is too large", e);
        }
        if (tiles == null || tiles.length != cells) {
            throw new IllegalArgumentException("Snapshot of " + width + "x" + height
                + " needs " + cells + " tiles, got " + (tiles == null ? "none" : tiles.length));
        }
        this.width = width;
        this.height = height;
        this.tileSize = tileSize;
        this.tilesheet = tilesheet;
        this.tiles = tiles.clone();
    }

    /**
     * Captures the current contents of a tile grid.
     *
     * @param grid The grid to copy.
     * @return A snapshot detached from the grid.
     */
    public static TilemapSnapshot of(ITileGrid grid) {
        List<Optional<TileId>> cells = grid.tiles();
        Integer[] ids = new Integer[cells.size()];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = cells.get(i).map(TileId::value).orElse(null);
        }
        return new TilemapSnapshot(grid.getWidth(), grid.getHeight(), grid.getTileSize(),
            grid.getTilesheet().label(), ids);
    }

    @JsonProperty("width")
    public int getWidth() {
        return width;
    }

    @JsonProperty("height")
    public int getHeight() {
        return height;
    }

    @JsonProperty("tileSize")
    public TileSize getTileSize() {
        return tileSize;
    }

    @JsonProperty("tilesheet")
    public String getTilesheet() {
        return tilesheet;
    }

    /**
     * @return A copy of the row-major tile ids.
     */
    @JsonProperty("tiles")
    public Integer[] getTiles() {
        return tiles.clone();
    }

    /**
     * Gets the tile id at the given cell.
     *
     * @param x The column.
     * @param y The row.
     * @return The tile id, or empty if the cell has no tile.
     * @throws TileBoundsException if the cell is outside the snapshot.
     */
    public Optional<TileId> getTile(int x, int y) {
        Integer id = tiles[GridIndexer.index(x, y, width, height)];
        return id == null ? Optional.empty() : Optional.of(new TileId(id));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TilemapSnapshot other)) return false;
        return width == other.width && height == other.height
            && Objects.equals(tileSize, other.tileSize)
            && Objects.equals(tilesheet, other.tilesheet)
            && Arrays.equals(tiles, other.tiles);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(width, height, tileSize, tilesheet);
        return 31 * result + Arrays.hashCode(tiles);
    }
}
