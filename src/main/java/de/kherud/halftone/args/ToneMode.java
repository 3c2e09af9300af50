package de.kherud.halftone.args;

/**
 * Output tone of a processed image.
 */
public enum ToneMode {

	/**
	 * Pure black and white, produced by the selected {@link DitherMode}.
	 */
	MONOCHROME("bw", "Black and white halftone"),

	/**
	 * Contrast-adjusted luminance without dithering.
	 */
	GRAYSCALE("gray", "Grayscale"),

	/**
	 * Resized original colours, tone mapping skipped.
	 */
	COLOR_PASSTHROUGH("color", "Original colour");

	private final String key;
	private final String description;

	ToneMode(String key, String description) {
		this.key = key;
		this.description = description;
	}

	public String getKey() {
		return key;
	}

	public String getDescription() {
		return description;
	}

	public static ToneMode fromKey(String value) {
		for (ToneMode mode : values()) {
			if (mode.key.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value)) {
				return mode;
			}
		}
		throw new IllegalArgumentException("Unknown color mode: " + value);
	}
}
