package de.kherud.halftone;

/**
 * Processing options outside their documented range. Fatal to a whole batch,
 * raised before any job runs.
 */
public class InvalidOptionsException extends IllegalArgumentException {

	public InvalidOptionsException(String message) {
		super(message);
	}
}
