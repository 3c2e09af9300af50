package de.kherud.halftone.tone;

import de.kherud.halftone.ProcessingOptions;
import de.kherud.halftone.args.ToneMode;
import de.kherud.halftone.codec.PixelBuffer;

/**
 * Applies the tone stage of the pipeline to an already resized RGBA buffer.
 *
 * <ul>
 *   <li>{@link ToneMode#COLOR_PASSTHROUGH}: the input buffer is returned untouched</li>
 *   <li>{@link ToneMode#GRAYSCALE}: contrast-adjusted luminance, rounded</li>
 *   <li>{@link ToneMode#MONOCHROME}: contrast-adjusted luminance, then thresholded or diffused</li>
 * </ul>
 * Every non-passthrough result is opaque RGBA.
 */
public final class HalftoneProcessor {

	private HalftoneProcessor() {
	}

	public static PixelBuffer process(PixelBuffer rgba, ProcessingOptions options) {
		if (options.getToneMode() == ToneMode.COLOR_PASSTHROUGH) {
			return rgba;
		}

		LuminanceBuffer gray = ColorReducer.toLuminance(rgba);
		ColorReducer.applyContrast(gray, options.getContrast());

		if (options.getToneMode() == ToneMode.GRAYSCALE) {
			return ToneMapper.toRgba(round(gray));
		}

		PixelBuffer bw = ToneMapper.quantize(gray, options.getThreshold(), options.getMode());
		return ToneMapper.toRgba(bw);
	}

	private static PixelBuffer round(LuminanceBuffer gray) {
		double[] samples = gray.getSamples();
		byte[] out = new byte[samples.length];
		for (int i = 0; i < samples.length; i++) {
			out[i] = (byte) Math.round(samples[i]);
		}
		return new PixelBuffer(gray.getWidth(), gray.getHeight(), PixelBuffer.GRAY, out);
	}
}
