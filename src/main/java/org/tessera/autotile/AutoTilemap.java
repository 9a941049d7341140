package org.tessera.autotile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tessera.tilemap.GridIndexer;
import org.tessera.tilemap.ITileGrid;
import org.tessera.tilemap.TextureKey;
import org.tessera.tilemap.TileId;
import org.tessera.tilemap.TileSize;
import org.tessera.tilemap.Tilemap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A tilemap whose tiles are derived from per-cell occupancy and an ordered list of rulesets.
 * <p>
 * Occupancy edits are lazy: nothing in the underlying tile grid changes until {@link #bake()}
 * recomputes every cell. Rulesets are evaluated in insertion order and the first match wins,
 * so more specific rulesets must be added before more general ones.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. Callers sharing an instance across threads
 * must serialize access externally.
 */
public class AutoTilemap {

    private static final Logger log = LoggerFactory.getLogger(AutoTilemap.class);

    private final ITileGrid tilemap;
    private final List<AutoTileRuleset> rulesets;
    private final AutoTile[] autotiles;

    /**
     * Creates an autotilemap backed by a new in-memory {@link Tilemap}.
     *
     * @param tilesheet The tilesheet the ruleset tile ids refer to.
     * @param tileSize The pixel size of one tile.
     * @param width The number of columns.
     * @param height The number of rows.
     * @param rulesets The initial rulesets in precedence order.
     */
    public AutoTilemap(TextureKey tilesheet, TileSize tileSize, int width, int height, List<AutoTileRuleset> rulesets) {
        this(new Tilemap(tilesheet, tileSize, width, height), rulesets);
    }

    /**
     * Creates an autotilemap that bakes into the given tile grid.
     * Every cell starts out as {@link AutoTile#NONE}.
     *
     * @param tilemap The grid receiving baked tile ids. Owned by this instance from now on.
     * @param rulesets The initial rulesets in precedence order.
     */
    public AutoTilemap(ITileGrid tilemap, List<AutoTileRuleset> rulesets) {
        this.tilemap = Objects.requireNonNull(tilemap, "Tilemap cannot be null.");
        Objects.requireNonNull(rulesets, "Rulesets cannot be null.");
        this.rulesets = new ArrayList<>(rulesets.size());
        for (AutoTileRuleset ruleset : rulesets) {
            this.rulesets.add(Objects.requireNonNull(ruleset, "Ruleset cannot be null."));
        }
        this.autotiles = new AutoTile[tilemap.getWidth() * tilemap.getHeight()];
        Arrays.fill(this.autotiles, AutoTile.NONE);
    }

    /**
     * Recomputes the tile of every cell from the current occupancy and rulesets and writes
     * the result into the tile grid. Occupancy is not modified, so repeated calls without
     * intervening edits produce the same tiles.
     *
     * @throws org.tessera.tilemap.TileBoundsException if the tile grid rejects a cell.
     */
    public void bake() {
        long start = System.nanoTime();
        int assigned = 0;
        for (int x = 0; x < getWidth(); x++) {
            for (int y = 0; y < getHeight(); y++) {
                Optional<TileId> tileId = computeTileId(x, y);
                tilemap.setTile(x, y, tileId.orElse(null));
                if (tileId.isPresent()) {
                    assigned++;
                }
            }
        }
        log.debug("Baked {}x{} autotilemap with {} rulesets: {} of {} cells assigned in {} us",
            getWidth(), getHeight(), rulesets.size(), assigned, autotiles.length,
            (System.nanoTime() - start) / 1_000);
    }

    /**
     * Computes the tile for one cell without touching the tile grid.
     *
     * @param x The column.
     * @param y The row.
     * @return The tile id of the first matching ruleset, or empty if the cell is unoccupied
     *         or no ruleset matches.
     * @throws org.tessera.tilemap.TileBoundsException if the cell is outside the map.
     */
    public Optional<TileId> computeTileId(int x, int y) {
        // Rulesets report an off-map cell as a plain miss; callers get the bounds error instead.
        GridIndexer.index(x, y, getWidth(), getHeight());
        for (AutoTileRuleset ruleset : rulesets) {
            if (ruleset.matches(autotiles, getWidth(), getHeight(), x, y)) {
                return Optional.of(ruleset.getTileId());
            }
        }
        return Optional.empty();
    }

    /**
     * Gets the tile last baked into the given cell.
     *
     * @param x The column.
     * @param y The row.
     * @return The baked tile id, or empty.
     * @throws org.tessera.tilemap.TileBoundsException if the cell is outside the map.
     */
    public Optional<TileId> getTileId(int x, int y) {
        return tilemap.getTile(x, y);
    }

    /**
     * @return The tile grid this autotilemap bakes into.
     */
    public ITileGrid getTilemap() {
        return tilemap;
    }

    /**
     * @return The baked tiles of every cell in row-major order.
     */
    public List<Optional<TileId>> tiles() {
        return tilemap.tiles();
    }

    public AutoTile getAutotile(int x, int y) {
        return autotiles[GridIndexer.index(x, y, getWidth(), getHeight())];
    }

    public void setTile(int x, int y) {
        setAutotile(x, y, AutoTile.TILE);
    }

    public void setNone(int x, int y) {
        setAutotile(x, y, AutoTile.NONE);
    }

    /**
     * Sets the occupancy of one cell. The tile grid is updated on the next {@link #bake()}.
     *
     * @param x The column.
     * @param y The row.
     * @param autotile The new occupancy.
     * @throws org.tessera.tilemap.TileBoundsException if the cell is outside the map.
     */
    public void setAutotile(int x, int y, AutoTile autotile) {
        Objects.requireNonNull(autotile, "Autotile cannot be null.");
        autotiles[GridIndexer.index(x, y, getWidth(), getHeight())] = autotile;
    }

    /**
     * Appends a ruleset. It has lower precedence than every ruleset added before it.
     *
     * @param ruleset The ruleset to add.
     */
    public void addRuleset(AutoTileRuleset ruleset) {
        Objects.requireNonNull(ruleset, "Ruleset cannot be null.");
        rulesets.add(ruleset);
        log.debug("Added ruleset for tile {} at precedence {}", ruleset.getTileId(), rulesets.size() - 1);
    }

    /**
     * Finds the first ruleset producing the given tile.
     *
     * @param tileId The tile id to look for.
     * @return The first ruleset with that tile id, or empty.
     */
    public Optional<AutoTileRuleset> getRuleset(TileId tileId) {
        return rulesets.stream()
            .filter(ruleset -> ruleset.getTileId().equals(tileId))
            .findFirst();
    }

    /**
     * Removes the first ruleset producing the given tile. The remaining rulesets keep their order.
     *
     * @param tileId The tile id to look for.
     * @return The removed ruleset, or empty if none had that tile id.
     */
    public Optional<AutoTileRuleset> removeRuleset(TileId tileId) {
        Iterator<AutoTileRuleset> it = rulesets.iterator();
        while (it.hasNext()) {
            AutoTileRuleset ruleset = it.next();
            if (ruleset.getTileId().equals(tileId)) {
                it.remove();
                log.debug("Removed ruleset for tile {}", tileId);
                return Optional.of(ruleset);
            }
        }
        return Optional.empty();
    }

    /**
     * @return The rulesets in precedence order, read-only.
     */
    public List<AutoTileRuleset> getRulesets() {
        return Collections.unmodifiableList(rulesets);
    }

    public int getWidth() {
        return tilemap.getWidth();
    }

    public int getHeight() {
        return tilemap.getHeight();
    }

    public TextureKey getTilesheet() {
        return tilemap.getTilesheet();
    }

    public TileSize getTileSize() {
        return tilemap.getTileSize();
    }
}
