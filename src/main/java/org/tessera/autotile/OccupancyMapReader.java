package org.tessera.autotile;

import org.tessera.tilemap.TextureKey;
import org.tessera.tilemap.TileSize;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds an {@link AutoTilemap} from a plain-text occupancy map.
 * <p>
 * One line per row, top row first. {@code '#'} marks an occupied cell, {@code '.'} an empty
 * one. Lines starting with {@code ';'} are comments. Blank lines before the first row and after
 * the last row are dropped, and row numbers in errors count from the first non-blank row.
 */
public final class OccupancyMapReader {

    private OccupancyMapReader() {
        // Utility class
    }

    /**
     * Reads an occupancy map file.
     *
     * @param file The UTF-8 map file.
     * @param tilesheet The tilesheet for the resulting tilemap.
     * @param tileSize The tile size for the resulting tilemap.
     * @param rulesets The rulesets in precedence order.
     * @return An unbaked autotilemap sized to the map.
     * @throws IOException if the file cannot be read.
     * @throws IllegalArgumentException if the map is malformed.
     */
    public static AutoTilemap read(Path file, TextureKey tilesheet, TileSize tileSize,
                                   List<AutoTileRuleset> rulesets) throws IOException {
        return read(Files.readAllLines(file, StandardCharsets.UTF_8), tilesheet, tileSize, rulesets);
    }

    /**
     * Builds an autotilemap from map lines.
     *
     * @param lines The map lines, top row first.
     * @param tilesheet The tilesheet for the resulting tilemap.
     * @param tileSize The tile size for the resulting tilemap.
     * @param rulesets The rulesets in precedence order.
     * @return An unbaked autotilemap sized to the map.
     * @throws IllegalArgumentException if rows differ in length or contain unknown characters.
     */
    public static AutoTilemap read(List<String> lines, TextureKey tilesheet, TileSize tileSize,
                                   List<AutoTileRuleset> rulesets) {
        List<String> rows = new ArrayList<>();
        for (String line : lines) {
            if (!line.startsWith(";")) {
                rows.add(line.stripTrailing());
            }
        }
        while (!rows.isEmpty() && rows.get(0).isEmpty()) {
            rows.remove(0);
        }
        while (!rows.isEmpty() && rows.get(rows.size() - 1).isEmpty()) {
            rows.remove(rows.size() - 1);
        }

        int width = rows.isEmpty() ? 0 : rows.get(0).length();
        for (int y = 0; y < rows.size(); y++) {
            if (rows.get(y).length() != width) {
                throw new IllegalArgumentException(
                    "Map row " + y + " has " + rows.get(y).length() + " cells, expected " + width);
            }
        }

        AutoTilemap autotilemap = new AutoTilemap(tilesheet, tileSize, width, rows.size(), rulesets);
        for (int y = 0; y < rows.size(); y++) {
            String row = rows.get(y);
            for (int x = 0; x < width; x++) {
                char c = row.charAt(x);
                switch (c) {
                    case '#' -> autotilemap.setTile(x, y);
                    case '.' -> autotilemap.setNone(x, y);
                    default -> throw new IllegalArgumentException(
                        "Unknown map character '" + c + "' at row " + y + ", column " + x);
                }
            }
        }
        return autotilemap;
    }
}
