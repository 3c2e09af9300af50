package de.kherud.halftone;

/**
 * A pixel buffer could not be serialized into the output container.
 */
public class EncodeException extends HalftoneException {

	public EncodeException(String message) {
		super(message);
	}

	public EncodeException(String message, Throwable cause) {
		super(message, cause);
	}
}
