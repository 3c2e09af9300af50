package de.kherud.halftone;

/**
 * Base class for failures that abort the pipeline of a single image.
 * The batch orchestrator catches these per job and degrades to a fallback result.
 */
public class HalftoneException extends Exception {

	public HalftoneException(String message) {
		super(message);
	}

	public HalftoneException(String message, Throwable cause) {
		super(message, cause);
	}
}
