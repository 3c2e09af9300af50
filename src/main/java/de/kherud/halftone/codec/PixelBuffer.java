package de.kherud.halftone.codec;

/**
 * Rectangular grid of 8-bit samples, row-major, {@code channels} samples per pixel.
 * Only 1 (luminance) and 4 (RGBA) channels are used.
 *
 * The sample array is not copied; a buffer is owned by whichever pipeline stage holds it.
 */
public final class PixelBuffer {

	public static final int GRAY = 1;
	public static final int RGBA = 4;

	private final int width;
	private final int height;
	private final int channels;
	private final byte[] data;

	public PixelBuffer(int width, int height, int channels, byte[] data) {
		if (width <= 0 || height <= 0) {
			throw new IllegalArgumentException("Image dimensions must be positive");
		}
		if (channels != GRAY && channels != RGBA) {
			throw new IllegalArgumentException("Channels must be 1 or 4, got " + channels);
		}
		if (data == null) {
			throw new IllegalArgumentException("Pixel data cannot be null");
		}
		long expectedSize = (long) width * height * channels;
		if (data.length != expectedSize) {
			throw new IllegalArgumentException(
				String.format("Pixel data size mismatch: expected %d bytes, got %d", expectedSize, data.length));
		}
		this.width = width;
		this.height = height;
		this.channels = channels;
		this.data = data;
	}

	public static PixelBuffer rgba(int width, int height) {
		return new PixelBuffer(width, height, RGBA, new byte[width * height * RGBA]);
	}

	/**
	 * Create an opaque RGBA buffer filled with a single colour.
	 */
	public static PixelBuffer filled(int width, int height, int r, int g, int b) {
		PixelBuffer buffer = rgba(width, height);
		byte[] data = buffer.data;
		for (int i = 0; i < data.length; i += RGBA) {
			data[i] = (byte) r;
			data[i + 1] = (byte) g;
			data[i + 2] = (byte) b;
			data[i + 3] = (byte) 0xFF;
		}
		return buffer;
	}

	public int getWidth() { return width; }
	public int getHeight() { return height; }
	public int getChannels() { return channels; }
	public int getPixelCount() { return width * height; }

	/**
	 * Raw sample array, shared with this buffer.
	 */
	public byte[] getData() { return data; }

	/**
	 * Unsigned sample value at a flat index.
	 */
	public int sample(int index) {
		return data[index] & 0xFF;
	}

	/**
	 * Unsigned sample for pixel (x, y), channel c.
	 */
	public int sample(int x, int y, int c) {
		return data[(y * width + x) * channels + c] & 0xFF;
	}

	@Override
	public String toString() {
		return String.format("PixelBuffer{size=%dx%d, channels=%d}", width, height, channels);
	}
}
