package org.tessera.autotile;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tessera.tilemap.TileId;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads an ordered ruleset list from HOCON configuration.
 * <p>
 * Expected structure, in precedence order:
 * <pre>
 * rulesets = [
 *   { tile-id = 4, pattern = ["?????", "?.#.?", "?.@.?", "?...?", "?????"] }
 *   { tile-id = 0, pattern = ["?????", "?????", "??@??", "?????", "?????"] }
 * ]
 * </pre>
 */
public final class AutoTileRulesetLoader {

    private static final Logger log = LoggerFactory.getLogger(AutoTileRulesetLoader.class);

    public static final String RULESETS_KEY = "rulesets";
    private static final String TILE_ID_KEY = "tile-id";
    private static final String PATTERN_KEY = "pattern";

    private AutoTileRulesetLoader() {
        // Utility class
    }

    /**
     * Loads the {@code rulesets} list from the given config.
     *
     * @param config The config holding a {@code rulesets} list, typically {@code tessera.autotile}.
     * @return The rulesets in list order, empty if the list is absent.
     * @throws IllegalArgumentException if an entry is incomplete or its pattern is malformed.
     */
    public static List<AutoTileRuleset> load(Config config) {
        if (!config.hasPath(RULESETS_KEY)) {
            log.debug("No '{}' list configured, starting without rulesets.", RULESETS_KEY);
            return List.of();
        }

        List<? extends Config> entries = config.getConfigList(RULESETS_KEY);
        List<AutoTileRuleset> rulesets = new ArrayList<>(entries.size());
        Set<TileId> seen = new HashSet<>();
        for (int i = 0; i < entries.size(); i++) {
            AutoTileRuleset ruleset = loadEntry(entries.get(i), i);
            if (!seen.add(ruleset.getTileId())) {
                log.debug("Ruleset #{} reuses tile {}; lookups by tile id resolve to the earlier entry.",
                    i, ruleset.getTileId());
            }
            rulesets.add(ruleset);
        }
        log.debug("Loaded {} rulesets from configuration.", rulesets.size());
        return rulesets;
    }

    private static AutoTileRuleset loadEntry(Config entry, int position) {
        try {
            int tileId = entry.getInt(TILE_ID_KEY);
            List<String> pattern = entry.getStringList(PATTERN_KEY);
            return RulesetPatternParser.parse(new TileId(tileId), pattern);
        } catch (ConfigException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid ruleset #" + position + ": " + e.getMessage(), e);
        }
    }
}
