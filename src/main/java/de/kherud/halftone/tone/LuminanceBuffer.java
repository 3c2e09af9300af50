package de.kherud.halftone.tone;

import java.util.Arrays;

/**
 * Single-channel floating point brightness, row-major.
 *
 * This is the mutable working set of tone mapping: error diffusion writes into
 * samples it has not visited yet, so values may leave [0, 255] while a scan is running.
 */
public final class LuminanceBuffer {

	private final int width;
	private final int height;
	private final double[] samples;

	public LuminanceBuffer(int width, int height, double[] samples) {
		if (width <= 0 || height <= 0) {
			throw new IllegalArgumentException("Image dimensions must be positive");
		}
		if (samples == null || samples.length != width * height) {
			throw new IllegalArgumentException(
				String.format("Luminance size mismatch: expected %d samples, got %d",
					width * height, samples == null ? 0 : samples.length));
		}
		this.width = width;
		this.height = height;
		this.samples = samples;
	}

	public static LuminanceBuffer uniform(int width, int height, double value) {
		double[] samples = new double[width * height];
		Arrays.fill(samples, value);
		return new LuminanceBuffer(width, height, samples);
	}

	public int getWidth() { return width; }
	public int getHeight() { return height; }

	/**
	 * Backing array. Not copied.
	 */
	public double[] getSamples() { return samples; }

	public double get(int x, int y) {
		return samples[y * width + x];
	}

	public LuminanceBuffer copy() {
		return new LuminanceBuffer(width, height, samples.clone());
	}
}
