package de.kherud.halftone.codec;

import de.kherud.halftone.DecodeException;

/**
 * Turns encoded image bytes into an RGBA pixel buffer.
 */
@FunctionalInterface
public interface ImageDecoder {

	PixelBuffer decode(byte[] encoded) throws DecodeException;
}
