package de.kherud.halftone.args;

/**
 * How a luminance buffer is reduced to black and white.
 */
public enum DitherMode {

	/**
	 * Floyd-Steinberg error diffusion. Each pixel's quantization error is pushed
	 * onto its not-yet-visited neighbours.
	 */
	DIFFUSED("floyd", "Floyd-Steinberg error diffusion"),

	/**
	 * Plain per-pixel threshold.
	 */
	FLAT("binary", "Flat threshold");

	private final String key;
	private final String description;

	DitherMode(String key, String description) {
		this.key = key;
		this.description = description;
	}

	public String getKey() {
		return key;
	}

	public String getDescription() {
		return description;
	}

	/**
	 * Resolve a mode from its configuration key or enum name, case-insensitive.
	 *
	 * @param value the key, e.g. {@code floyd}
	 * @return the matching mode
	 * @throws IllegalArgumentException if nothing matches
	 */
	public static DitherMode fromKey(String value) {
		for (DitherMode mode : values()) {
			if (mode.key.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value)) {
				return mode;
			}
		}
		throw new IllegalArgumentException("Unknown dither mode: " + value);
	}
}
