package org.tessera.autotile;

import org.tessera.tilemap.TileId;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts between rulesets and a five-row text form that reads the way the tiles appear
 * on screen.
 * <p>
 * Rows run top to bottom and characters left to right, each covering offsets -2..+2 around
 * the evaluated cell:
 * <pre>
 *   ?????
 *   ?.#.?      '#' = TILE, '.' = NONE, '?' or '*' = ANY
 *   ?.@.?      the center character is never read
 *   ?...?
 *   ?????
 * </pre>
 * Whitespace inside a row is ignored, so {@code "? . # . ?"} is equivalent to {@code "?.#.?"}.
 */
public final class RulesetPatternParser {

    private static final int SIZE = AutoTileRuleset.GRID_SIZE;

    private RulesetPatternParser() {
        // Utility class
    }

    /**
     * Parses a pattern into a ruleset.
     *
     * @param tileId The tile shown where the pattern matches.
     * @param rows Five rows of five pattern characters each.
     * @return The new ruleset.
     * @throws IllegalArgumentException if the pattern is malformed.
     */
    public static AutoTileRuleset parse(TileId tileId, List<String> rows) {
        return new AutoTileRuleset(tileId, parseGrid(rows));
    }

    /**
     * Parses a pattern into a grid addressed {@code grid[x][y]}.
     *
     * @param rows Five rows of five pattern characters each.
     * @return The transposed pattern grid.
     * @throws IllegalArgumentException if the pattern is malformed.
     */
    public static AutoTileRulesetValue[][] parseGrid(List<String> rows) {
        Objects.requireNonNull(rows, "Pattern rows cannot be null.");
        if (rows.size() != SIZE) {
            throw new IllegalArgumentException("Pattern must have " + SIZE + " rows, got " + rows.size());
        }
        AutoTileRulesetValue[][] grid = new AutoTileRulesetValue[SIZE][SIZE];
        for (int y = 0; y < SIZE; y++) {
            String row = Objects.requireNonNull(rows.get(y), "Pattern row " + y + " cannot be null.").replaceAll("\\s", "");
            if (row.length() != SIZE) {
                throw new IllegalArgumentException(
                    "Pattern row " + y + " must have " + SIZE + " cells, got " + row.length() + ": '" + rows.get(y) + "'");
            }
            for (int x = 0; x < SIZE; x++) {
                grid[x][y] = (x == SIZE / 2 && y == SIZE / 2) ? AutoTileRulesetValue.ANY : toValue(row.charAt(x), x, y);
            }
        }
        return grid;
    }

    /**
     * Renders a ruleset back into its five-row form. The center is shown as {@code '@'}.
     *
     * @param ruleset The ruleset to render.
     * @return Five rows of five characters, top row first.
     */
    public static List<String> format(AutoTileRuleset ruleset) {
        List<String> rows = new ArrayList<>(SIZE);
        for (int y = 0; y < SIZE; y++) {
            StringBuilder sb = new StringBuilder(SIZE);
            for (int x = 0; x < SIZE; x++) {
                if (x == SIZE / 2 && y == SIZE / 2) {
                    sb.append('@');
                } else {
                    sb.append(toChar(ruleset.getValue(x, y)));
                }
            }
            rows.add(sb.toString());
        }
        return rows;
    }

    private static AutoTileRulesetValue toValue(char c, int x, int y) {
        return switch (c) {
            case '#' -> AutoTileRulesetValue.TILE;
            case '.' -> AutoTileRulesetValue.NONE;
            case '?', '*' -> AutoTileRulesetValue.ANY;
            default -> throw new IllegalArgumentException(
                "Unknown pattern character '" + c + "' at row " + y + ", column " + x);
        };
    }

    private static char toChar(AutoTileRulesetValue value) {
        return switch (value) {
            case TILE -> '#';
            case NONE -> '.';
            case ANY -> '?';
        };
    }
}
