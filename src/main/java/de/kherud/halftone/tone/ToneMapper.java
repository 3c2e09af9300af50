package de.kherud.halftone.tone;

import de.kherud.halftone.args.DitherMode;
import de.kherud.halftone.codec.PixelBuffer;

/**
 * Reduces a luminance buffer to pure black (0) and white (255).
 *
 * A sample equal to the threshold maps to black; only values strictly above it become white.
 */
public final class ToneMapper {

	public static final int BLACK = 0;
	public static final int WHITE = 255;

	private ToneMapper() {
	}

	/**
	 * Quantize with the given mode.
	 *
	 * @return one-channel buffer holding only 0 and 255
	 */
	public static PixelBuffer quantize(LuminanceBuffer luminance, int threshold, DitherMode mode) {
		switch (mode) {
			case DIFFUSED:
				return floydSteinberg(luminance, threshold);
			case FLAT:
				return threshold(luminance, threshold);
			default:
				throw new IllegalArgumentException("Unsupported dither mode: " + mode);
		}
	}

	/**
	 * Per-pixel threshold. Does not modify the input.
	 */
	public static PixelBuffer threshold(LuminanceBuffer luminance, int threshold) {
		double[] gray = luminance.getSamples();
		byte[] out = new byte[gray.length];
		for (int i = 0; i < gray.length; i++) {
			out[i] = (byte) (gray[i] > threshold ? WHITE : BLACK);
		}
		return new PixelBuffer(luminance.getWidth(), luminance.getHeight(), PixelBuffer.GRAY, out);
	}

	/**
	 * Floyd-Steinberg error diffusion.
	 *
	 * Consumes the luminance buffer: quantization error is added to the right, lower-left,
	 * lower and lower-right neighbours (7/16, 3/16, 5/16, 1/16) in the buffer itself, so the
	 * scan must stay row-major and the buffer must not be shared. Error falling outside the
	 * image is dropped. The accumulator is never clamped.
	 */
	public static PixelBuffer floydSteinberg(LuminanceBuffer luminance, int threshold) {
		int width = luminance.getWidth();
		int height = luminance.getHeight();
		double[] gray = luminance.getSamples();
		byte[] out = new byte[width * height];

		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				int idx = y * width + x;
				double oldPixel = gray[idx];
				int newPixel = oldPixel > threshold ? WHITE : BLACK;
				out[idx] = (byte) newPixel;

				double error = oldPixel - newPixel;

				if (x + 1 < width) {
					gray[idx + 1] += error * 7 / 16;
				}
				if (y + 1 < height) {
					if (x > 0) {
						gray[idx + width - 1] += error * 3 / 16;
					}
					gray[idx + width] += error * 5 / 16;
					if (x + 1 < width) {
						gray[idx + width + 1] += error * 1 / 16;
					}
				}
			}
		}

		return new PixelBuffer(width, height, PixelBuffer.GRAY, out);
	}

	/**
	 * Broadcast a one-channel buffer to opaque RGBA.
	 */
	public static PixelBuffer toRgba(PixelBuffer gray) {
		if (gray.getChannels() == PixelBuffer.RGBA) {
			return gray;
		}
		byte[] src = gray.getData();
		byte[] rgba = new byte[src.length * PixelBuffer.RGBA];
		for (int i = 0; i < src.length; i++) {
			int base = i * PixelBuffer.RGBA;
			rgba[base] = src[i];
			rgba[base + 1] = src[i];
			rgba[base + 2] = src[i];
			rgba[base + 3] = (byte) 0xFF;
		}
		return new PixelBuffer(gray.getWidth(), gray.getHeight(), PixelBuffer.RGBA, rgba);
	}
}
