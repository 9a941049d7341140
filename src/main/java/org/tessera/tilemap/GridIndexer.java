package org.tessera.tilemap;

/**
 * Coordinate linearization shared by the tile grid and the autotile occupancy grid.
 * <p>
 * Cells are stored row-major: {@code index = y * width + x}.
 */
public final class GridIndexer {

    private GridIndexer() {
        // Utility class
    }

    /**
     * Converts a 2D coordinate to a flat storage index.
     *
     * @param x The column.
     * @param y The row.
     * @param width The grid width.
     * @param height The grid height.
     * @return The flat index of the cell.
     * @throws TileBoundsException if the coordinate is negative or not below width/height.
     */
    public static int index(int x, int y, int width, int height) {
        if (!contains(x, y, width, height)) {
            throw new TileBoundsException(x, y, width, height);
        }
        return y * width + x;
    }

    /**
     * Checks whether a coordinate lies inside the grid without raising.
     *
     * @param x The column.
     * @param y The row.
     * @param width The grid width.
     * @param height The grid height.
     * @return true if {@link #index(int, int, int, int)} would succeed.
     */
    public static boolean contains(int x, int y, int width, int height) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }

    /**
     * Converts a flat index back to its {@code [x, y]} coordinate.
     * This is the inverse of {@link #index(int, int, int, int)}.
     *
     * @param flatIndex The flat index (must be inside the grid).
     * @param width The grid width.
     * @param height The grid height.
     * @return A new array {@code [x, y]}.
     * @throws IllegalArgumentException if the index is negative or past the last cell.
     */
    public static int[] coordinates(int flatIndex, int width, int height) {
        if (flatIndex < 0 || flatIndex >= width * height) {
            throw new IllegalArgumentException(
                "Flat index " + flatIndex + " is outside a grid of " + (width * height) + " cells");
        }
        return new int[]{flatIndex % width, flatIndex / width};
    }
}
