package de.kherud.halftone.codec;

import de.kherud.halftone.EncodeException;

/**
 * Serializes a pixel buffer into container bytes.
 */
@FunctionalInterface
public interface ImageEncoder {

	byte[] encode(PixelBuffer pixels) throws EncodeException;
}
