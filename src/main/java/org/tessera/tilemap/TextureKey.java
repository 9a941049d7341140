package org.tessera.tilemap;

import java.util.Objects;

/**
 * Opaque handle to a tilesheet texture owned by the rendering layer.
 * @param label The name the asset layer registered the texture under.
 */
public record TextureKey(String label) {

    public TextureKey {
        Objects.requireNonNull(label, "Texture label cannot be null.");
    }
}
