package de.kherud.halftone.resample;

import java.awt.RenderingHints;

/**
 * Java2D interpolation used when scaling.
 */
public enum Interpolation {
	BICUBIC(RenderingHints.VALUE_INTERPOLATION_BICUBIC),
	BILINEAR(RenderingHints.VALUE_INTERPOLATION_BILINEAR),
	NEAREST(RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR);

	private final Object hint;

	Interpolation(Object hint) {
		this.hint = hint;
	}

	Object getHint() {
		return hint;
	}
}
