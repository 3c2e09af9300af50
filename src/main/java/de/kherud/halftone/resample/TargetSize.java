package de.kherud.halftone.resample;

import de.kherud.halftone.ProcessingOptions;

/**
 * Output pixel size for a source image at the requested physical width.
 * Height always follows the source aspect ratio.
 */
public final class TargetSize {

	private final int width;
	private final int height;
	private final double widthCm;
	private final double heightCm;
	private final int dpi;

	private TargetSize(int width, int height, double widthCm, double heightCm, int dpi) {
		this.width = width;
		this.height = height;
		this.widthCm = widthCm;
		this.heightCm = heightCm;
		this.dpi = dpi;
	}

	/**
	 * {@code width = round(widthCm / 2.54 * dpi)}, {@code height = round(width * srcH / srcW)}.
	 */
	public static TargetSize compute(int sourceWidth, int sourceHeight, ProcessingOptions options) {
		if (sourceWidth <= 0 || sourceHeight <= 0) {
			throw new IllegalArgumentException("Source dimensions must be positive");
		}
		int width = options.targetWidthPx();
		int height = heightFor(width, sourceWidth, sourceHeight);
		double heightCm = (double) height / options.getPrintDpi() * ProcessingOptions.CM_PER_INCH;
		return new TargetSize(width, height, options.getOutputWidthCm(), heightCm, options.getPrintDpi());
	}

	public static int heightFor(int targetWidth, int sourceWidth, int sourceHeight) {
		double aspectRatio = (double) sourceHeight / sourceWidth;
		return (int) Math.round(targetWidth * aspectRatio);
	}

	public int getWidth() { return width; }
	public int getHeight() { return height; }
	public double getWidthCm() { return widthCm; }
	public double getHeightCm() { return heightCm; }
	public int getDpi() { return dpi; }

	@Override
	public String toString() {
		return String.format("%dx%d px (%.1f x %.1f cm @ %d DPI)", width, height, widthCm, heightCm, dpi);
	}
}
