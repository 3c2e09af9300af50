package de.kherud.halftone.tone;

import de.kherud.halftone.codec.PixelBuffer;

/**
 * Luminance extraction and contrast remapping.
 */
public final class ColorReducer {

	public static final double RED_WEIGHT = 0.299;
	public static final double GREEN_WEIGHT = 0.587;
	public static final double BLUE_WEIGHT = 0.114;
	public static final double MIDPOINT = 128.0;

	private ColorReducer() {
	}

	/**
	 * Weighted luminance {@code 0.299 R + 0.587 G + 0.114 B}. Alpha is ignored.
	 * One-channel buffers are copied as they are.
	 *
	 * @param pixels RGBA or gray buffer
	 * @return a new unrounded luminance buffer
	 */
	public static LuminanceBuffer toLuminance(PixelBuffer pixels) {
		int count = pixels.getPixelCount();
		double[] gray = new double[count];

		if (pixels.getChannels() == PixelBuffer.GRAY) {
			for (int i = 0; i < count; i++) {
				gray[i] = pixels.sample(i);
			}
		} else {
			byte[] data = pixels.getData();
			for (int i = 0; i < count; i++) {
				int base = i * PixelBuffer.RGBA;
				gray[i] = luminance(data[base] & 0xFF, data[base + 1] & 0xFF, data[base + 2] & 0xFF);
			}
		}
		return new LuminanceBuffer(pixels.getWidth(), pixels.getHeight(), gray);
	}

	public static double luminance(int r, int g, int b) {
		return RED_WEIGHT * r + GREEN_WEIGHT * g + BLUE_WEIGHT * b;
	}

	/**
	 * Scale every sample about the midpoint and clamp to [0, 255], in place.
	 *
	 * @param luminance buffer to modify
	 * @param factor multiplier, 1.0 leaves values unchanged
	 * @return the same buffer
	 */
	public static LuminanceBuffer applyContrast(LuminanceBuffer luminance, double factor) {
		double[] samples = luminance.getSamples();
		for (int i = 0; i < samples.length; i++) {
			double adjusted = (samples[i] - MIDPOINT) * factor + MIDPOINT;
			samples[i] = Math.max(0.0, Math.min(255.0, adjusted));
		}
		return luminance;
	}
}
