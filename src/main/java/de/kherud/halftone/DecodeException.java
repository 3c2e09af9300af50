package de.kherud.halftone;

/**
 * Input bytes are not a valid or supported image.
 */
public class DecodeException extends HalftoneException {

	public DecodeException(String message) {
		super(message);
	}

	public DecodeException(String message, Throwable cause) {
		super(message, cause);
	}
}
