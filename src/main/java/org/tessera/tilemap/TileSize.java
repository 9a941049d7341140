package org.tessera.tilemap;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pixel size of a single tile in the tilesheet.
 * @param width The tile width in pixels.
 * @param height The tile height in pixels.
 */
public record TileSize(int width, int height) {

    @JsonCreator
    public TileSize(@JsonProperty("width") int width, @JsonProperty("height") int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Tile size must be positive, got " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
    }
}
