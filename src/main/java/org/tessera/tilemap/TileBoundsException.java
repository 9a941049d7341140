package org.tessera.tilemap;

/**
 * Thrown when a cell coordinate lies outside {@code [0, width) x [0, height)}.
 * <p>
 * Bounds violations are programmer errors, so this exception is unchecked and is
 * propagated unchanged by every tilemap operation that takes cell coordinates.
 */
public class TileBoundsException extends IndexOutOfBoundsException {

    private final int x;
    private final int y;
    private final int width;
    private final int height;

    /**
     * Creates a new TileBoundsException for the given coordinate and grid dimensions.
     *
     * @param x The requested column.
     * @param y The requested row.
     * @param width The grid width.
     * @param height The grid height.
     */
    public TileBoundsException(int x, int y, int width, int height) {
        super(String.format("Tile (%d, %d) is outside the %dx%d grid", x, y, width, height));
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }
}
