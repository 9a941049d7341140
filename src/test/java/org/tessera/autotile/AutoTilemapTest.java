package org.tessera.autotile;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.tessera.junit.extensions.logging.ExpectLog;
import org.tessera.junit.extensions.logging.LogLevel;
import org.tessera.junit.extensions.logging.LogWatchExtension;
import org.tessera.tilemap.TextureKey;
import org.tessera.tilemap.TileBoundsException;
import org.tessera.tilemap.TileId;
import org.tessera.tilemap.TileSize;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Contains unit tests for {@link AutoTilemap}: occupancy edits, ruleset precedence and baking.
 * All tests run against the in-memory tilemap.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class AutoTilemapTest {

    private static final TextureKey SHEET = new TextureKey("terrain");
    private static final TileSize TILE_SIZE = new TileSize(16, 16);

    private static final TileId ISOLATED = new TileId(10);
    private static final TileId FILL = new TileId(20);
    private static final TileId HORIZONTAL = new TileId(30);

    private static final AutoTileRuleset ISOLATED_RULESET = RulesetPatternParser.parse(ISOLATED, List.of(
        "?????",
        "??.??",
        "?.@.?",
        "??.??",
        "?????"));

    private static final AutoTileRuleset FILL_RULESET = RulesetPatternParser.parse(FILL, List.of(
        "?????",
        "?????",
        "??@??",
        "?????",
        "?????"));

    private static final AutoTileRuleset HORIZONTAL_RULESET = RulesetPatternParser.parse(HORIZONTAL, List.of(
        "?????",
        "?????",
        "?#@??",
        "?????",
        "?????"));

    private AutoTilemap autotilemap;

    @BeforeEach
    void setUp() {
        autotilemap = new AutoTilemap(SHEET, TILE_SIZE, 3, 3, List.of(ISOLATED_RULESET));
    }

    private List<Optional<TileId>> bakedTiles() {
        return new ArrayList<>(autotilemap.tiles());
    }

    @Test
    void newAutotilemapStartsEmpty() {
        assertEquals(3, autotilemap.getWidth());
        assertEquals(3, autotilemap.getHeight());
        assertEquals(SHEET, autotilemap.getTilesheet());
        assertEquals(TILE_SIZE, autotilemap.getTileSize());
        for (int y = 0; y < 3; y++) {
            for (int x = 0; x < 3; x++) {
                assertEquals(AutoTile.NONE, autotilemap.getAutotile(x, y));
                assertTrue(autotilemap.getTileId(x, y).isEmpty());
            }
        }
    }

    @Test
    void isolatedCenterGetsIsolatedTile() {
        autotilemap.setTile(1, 1);

        autotilemap.bake();

        for (int y = 0; y < 3; y++) {
            for (int x = 0; x < 3; x++) {
                Optional<TileId> expected = (x == 1 && y == 1) ? Optional.of(ISOLATED) : Optional.empty();
                assertEquals(expected, autotilemap.getTileId(x, y), "cell (" + x + ", " + y + ")");
            }
        }
    }

    @Test
    void occupiedRightNeighborBreaksIsolatedMatch() {
        autotilemap.setTile(1, 1);
        autotilemap.setTile(2, 1);

        autotilemap.bake();

        assertThat(autotilemap.getTileId(1, 1)).isEmpty();
        // (2,1) sits on the right edge, so its off-map right neighbor cannot satisfy NONE.
        assertThat(autotilemap.getTileId(2, 1)).isEmpty();
    }

    @Test
    void unoccupiedCellsNeverGetATile() {
        autotilemap.addRuleset(FILL_RULESET);
        autotilemap.setTile(0, 0);

        autotilemap.bake();

        assertThat(autotilemap.computeTileId(0, 0)).contains(FILL);
        assertThat(autotilemap.computeTileId(1, 1)).isEmpty();
        assertThat(bakedTiles().stream().filter(Optional::isPresent).count()).isEqualTo(1);
    }

    @Test
    void occupancyEditsAreInvisibleUntilBake() {
        autotilemap.setTile(1, 1);
        assertThat(autotilemap.getTileId(1, 1)).isEmpty();
        assertThat(autotilemap.computeTileId(1, 1)).contains(ISOLATED);

        autotilemap.bake();
        autotilemap.setNone(1, 1);

        assertThat(autotilemap.getTileId(1, 1)).contains(ISOLATED);
        autotilemap.bake();
        assertThat(autotilemap.getTileId(1, 1)).isEmpty();
    }

    @Test
    void firstMatchingRulesetWins() {
        AutoTilemap map = new AutoTilemap(SHEET, TILE_SIZE, 3, 3, List.of(ISOLATED_RULESET, FILL_RULESET));
        map.setTile(1, 1);

        assertThat(map.computeTileId(1, 1)).contains(ISOLATED);

        AutoTilemap reversed = new AutoTilemap(SHEET, TILE_SIZE, 3, 3, List.of(FILL_RULESET, ISOLATED_RULESET));
        reversed.setTile(1, 1);

        assertThat(reversed.computeTileId(1, 1)).contains(FILL);
    }

    @Test
    void addedRulesetsHaveLowestPrecedence() {
        autotilemap.addRuleset(HORIZONTAL_RULESET);
        autotilemap.addRuleset(FILL_RULESET);
        autotilemap.setTile(0, 1);
        autotilemap.setTile(1, 1);
        autotilemap.setTile(1, 0);

        autotilemap.bake();

        assertThat(autotilemap.getTileId(1, 1)).contains(HORIZONTAL);
        assertThat(autotilemap.getTileId(1, 0)).contains(FILL);
        assertThat(autotilemap.getTileId(0, 1)).contains(FILL);
    }

    @Test
    void bakeIsIdempotent() {
        autotilemap.addRuleset(HORIZONTAL_RULESET);
        autotilemap.setTile(0, 0);
        autotilemap.setTile(1, 0);
        autotilemap.setTile(1, 1);

        autotilemap.bake();
        List<Optional<TileId>> first = bakedTiles();
        autotilemap.bake();

        assertThat(bakedTiles()).isEqualTo(first);
        assertThat(autotilemap.getAutotile(1, 1)).isEqualTo(AutoTile.TILE);
    }

    @Test
    void removingRulesetFallsBackToNextMatch() {
        autotilemap.addRuleset(FILL_RULESET);
        autotilemap.setTile(1, 1);
        autotilemap.bake();
        assertThat(autotilemap.getTileId(1, 1)).contains(ISOLATED);

        Optional<AutoTileRuleset> removed = autotilemap.removeRuleset(ISOLATED);
        autotilemap.bake();

        assertThat(removed).containsSame(ISOLATED_RULESET);
        assertThat(autotilemap.getTileId(1, 1)).contains(FILL);

        autotilemap.removeRuleset(FILL);
        autotilemap.bake();
        assertThat(autotilemap.getTileId(1, 1)).isEmpty();
    }

    @Test
    void removeRulesetRemovesOnlyTheFirstWithThatId() {
        AutoTileRuleset shadowed = RulesetPatternParser.parse(ISOLATED, List.of(
            "?????", "?????", "??@??", "?????", "?????"));
        autotilemap.addRuleset(FILL_RULESET);
        autotilemap.addRuleset(shadowed);

        assertThat(autotilemap.getRuleset(ISOLATED)).containsSame(ISOLATED_RULESET);
        assertThat(autotilemap.removeRuleset(ISOLATED)).containsSame(ISOLATED_RULESET);

        assertThat(autotilemap.getRulesets()).containsExactly(FILL_RULESET, shadowed);
        assertThat(autotilemap.getRuleset(ISOLATED)).containsSame(shadowed);
    }

    @Test
    void missingRulesetLookupsAreEmpty() {
        assertThat(autotilemap.getRuleset(new TileId(99))).isEmpty();
        assertThat(autotilemap.removeRuleset(new TileId(99))).isEmpty();
        assertThat(autotilemap.getRulesets()).containsExactly(ISOLATED_RULESET);
    }

    @Test
    void rulesetViewIsReadOnly() {
        assertThatThrownBy(() -> autotilemap.getRulesets().add(FILL_RULESET))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void outOfBoundsCoordinatesThrow() {
        assertThatThrownBy(() -> autotilemap.setTile(3, 0)).isInstanceOf(TileBoundsException.class);
        assertThatThrownBy(() -> autotilemap.setNone(0, 3)).isInstanceOf(TileBoundsException.class);
        assertThatThrownBy(() -> autotilemap.setAutotile(-1, 0, AutoTile.TILE)).isInstanceOf(TileBoundsException.class);
        assertThatThrownBy(() -> autotilemap.getAutotile(0, -1)).isInstanceOf(TileBoundsException.class);
        assertThatThrownBy(() -> autotilemap.computeTileId(5, 5)).isInstanceOf(TileBoundsException.class);
        assertThatThrownBy(() -> autotilemap.getTileId(3, 3)).isInstanceOf(TileBoundsException.class);
    }

    @Test
    void rulesetsCanChangeWithoutTouchingOccupancy() {
        autotilemap.setTile(2, 2);
        autotilemap.removeRuleset(ISOLATED);
        autotilemap.addRuleset(FILL_RULESET);

        assertThat(autotilemap.getAutotile(2, 2)).isEqualTo(AutoTile.TILE);
        assertThat(autotilemap.computeTileId(2, 2)).contains(FILL);
    }

    @Test
    void zeroSizedMapBakesToNothing() {
        AutoTilemap empty = new AutoTilemap(SHEET, TILE_SIZE, 0, 0, List.of(FILL_RULESET));

        empty.bake();

        assertThat(empty.tiles()).isEmpty();
    }

    @Test
    @ExpectLog(level = LogLevel.DEBUG, loggerPattern = "org\\.tessera\\.autotile\\.AutoTilemap",
               messagePattern = "Baked 3x3 autotilemap with 1 rulesets: 1 of 9 cells assigned in \\d+ us")
    void bakeLogsSummary() {
        autotilemap.setTile(1, 1);

        autotilemap.bake();
    }
}
