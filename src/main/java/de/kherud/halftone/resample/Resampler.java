package de.kherud.halftone.resample;

import de.kherud.halftone.codec.ImageIoCodec;
import de.kherud.halftone.codec.PixelBuffer;

import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Scales RGBA buffers with Java2D.
 */
public class Resampler {

	private final Interpolation interpolation;

	public Resampler() {
		this(Interpolation.BILINEAR);
	}

	public Resampler(Interpolation interpolation) {
		this.interpolation = interpolation;
	}

	public Interpolation getInterpolation() {
		return interpolation;
	}

	/**
	 * Scale to exactly {@code targetWidth x targetHeight}. A buffer that already has the
	 * target size is returned as is.
	 *
	 * @throws IllegalArgumentException if a target dimension is not positive
	 */
	public PixelBuffer resize(PixelBuffer source, int targetWidth, int targetHeight) {
		if (targetWidth <= 0 || targetHeight <= 0) {
			throw new IllegalArgumentException(
				String.format("Target dimensions must be positive, got %dx%d", targetWidth, targetHeight));
		}
		if (source.getWidth() == targetWidth && source.getHeight() == targetHeight) {
			return source;
		}

		BufferedImage original = ImageIoCodec.toBufferedImage(source);
		BufferedImage resized = new BufferedImage(targetWidth, targetHeight, BufferedImage.TYPE_INT_ARGB);
		Graphics2D g2d = resized.createGraphics();
		try {
			setRenderingHints(g2d);
			g2d.setComposite(AlphaComposite.Src);
			g2d.drawImage(original, 0, 0, targetWidth, targetHeight, null);
		} finally {
			g2d.dispose();
		}

		return ImageIoCodec.fromBufferedImage(resized);
	}

	private void setRenderingHints(Graphics2D g2d) {
		g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, interpolation.getHint());
		g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
	}
}
