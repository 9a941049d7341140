package org.tessera.tilemap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory tile grid backed by a flat row-major array.
 */
public class Tilemap implements ITileGrid {

    private final TextureKey tilesheet;
    private final TileSize tileSize;
    private final int width;
    private final int height;
    private final TileId[] tiles;

    /**
     * Creates an empty tilemap.
     *
     * @param tilesheet The tilesheet the tile ids refer to.
     * @param tileSize The pixel size of one tile.
     * @param width The number of columns.
     * @param height The number of rows.
     */
    public Tilemap(TextureKey tilesheet, TileSize tileSize, int width, int height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Tilemap dimensions must be non-negative, got " + width + "x" + height);
        }
        this.tilesheet = Objects.requireNonNull(tilesheet, "Tilesheet cannot be null.");
        this.tileSize = Objects.requireNonNull(tileSize, "Tile size cannot be null.");
        this.width = width;
        this.height = height;
        this.tiles = new TileId[Math.multiplyExact(width, height)];
    }

    @Override
    public int getWidth() {
        return width;
    }

    @Override
    public int getHeight() {
        return height;
    }

    @Override
    public TileSize getTileSize() {
        return tileSize;
    }

    @Override
    public TextureKey getTilesheet() {
        return tilesheet;
    }

    @Override
    public void setTile(int x, int y, TileId tileId) {
        tiles[GridIndexer.index(x, y, width, height)] = tileId;
    }

    @Override
    public Optional<TileId> getTile(int x, int y) {
        return Optional.ofNullable(tiles[GridIndexer.index(x, y, width, height)]);
    }

    @Override
    public List<Optional<TileId>> tiles() {
        List<Optional<TileId>> view = new ArrayList<>(tiles.length);
        for (TileId tile : tiles) {
            view.add(Optional.ofNullable(tile));
        }
        return Collections.unmodifiableList(view);
    }
}
