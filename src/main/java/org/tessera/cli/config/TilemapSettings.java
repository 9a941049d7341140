package org.tessera.cli.config;

import com.typesafe.config.Config;
import org.tessera.autotile.AutoTileRuleset;
import org.tessera.autotile.AutoTileRulesetLoader;
import org.tessera.tilemap.TextureKey;
import org.tessera.tilemap.TileSize;

import java.util.List;

/**
 * Tilesheet, tile size and rulesets read from the {@code tessera} configuration block.
 * @param tilesheet The tilesheet handle.
 * @param tileSize The pixel size of one tile.
 * @param rulesets The rulesets in precedence order.
 */
public record TilemapSettings(TextureKey tilesheet, TileSize tileSize, List<AutoTileRuleset> rulesets) {

    private static final String ROOT = "tessera";

    public TilemapSettings {
        rulesets = List.copyOf(rulesets);
    }

    /**
     * Reads the settings from the full application configuration.
     *
     * @param config The resolved application configuration.
     * @return The settings.
     * @throws com.typesafe.config.ConfigException if a required key is missing.
     * @throws IllegalArgumentException if a ruleset is malformed.
     */
    public static TilemapSettings from(Config config) {
        Config root = config.getConfig(ROOT);
        Config tilemap = root.getConfig("tilemap");
        return new TilemapSettings(
            new TextureKey(tilemap.getString("tilesheet")),
            new TileSize(tilemap.getInt("tile-size.width"), tilemap.getInt("tile-size.height")),
            AutoTileRulesetLoader.load(root.getConfig("autotile")));
    }
}
