package de.kherud.halftone.batch;

import de.kherud.halftone.HalftoneException;
import de.kherud.halftone.ProcessingOptions;
import de.kherud.halftone.codec.ImageDecoder;
import de.kherud.halftone.codec.ImageEncoder;
import de.kherud.halftone.codec.ImageIoCodec;
import de.kherud.halftone.codec.PixelBuffer;
import de.kherud.halftone.png.PngPhysicalResolution;
import de.kherud.halftone.resample.Resampler;
import de.kherud.halftone.resample.TargetSize;
import de.kherud.halftone.tone.HalftoneProcessor;

import java.util.Objects;

/**
 * Pipeline for a single image: decode, resize to the physical target, tone map,
 * encode and embed the print resolution.
 */
public class HalftonePipeline {
	private static final System.Logger logger = System.getLogger(HalftonePipeline.class.getName());

	/**
	 * Largest output raster a job may request, about 4000 x 4000 px.
	 */
	public static final long DEFAULT_MAX_PIXELS = 16_000_000L;

	private final ImageDecoder decoder;
	private final ImageEncoder encoder;
	private final Resampler resampler;
	private final long maxPixels;

	public HalftonePipeline() {
		this(new ImageIoCodec());
	}

	public HalftonePipeline(ImageIoCodec codec) {
		this(codec, codec, new Resampler());
	}

	public HalftonePipeline(ImageDecoder decoder, ImageEncoder encoder, Resampler resampler) {
		this(decoder, encoder, resampler, DEFAULT_MAX_PIXELS);
	}

	/**
	 * @param maxPixels upper bound on {@code width * height} of the resized image
	 */
	public HalftonePipeline(ImageDecoder decoder, ImageEncoder encoder, Resampler resampler, long maxPixels) {
		if (maxPixels < 1) {
			throw new IllegalArgumentException("Pixel limit must be positive, got " + maxPixels);
		}
		this.maxPixels = maxPixels;
		this.decoder = Objects.requireNonNull(decoder, "Decoder cannot be null");
		this.encoder = Objects.requireNonNull(encoder, "Encoder cannot be null");
		this.resampler = Objects.requireNonNull(resampler, "Resampler cannot be null");
	}

	public long getMaxPixels() {
		return maxPixels;
	}

	/**
	 * Run the whole pipeline for one job.
	 *
	 * @throws HalftoneException if decoding or encoding fails, or the target raster exceeds the pixel limit
	 */
	public HalftoneResult process(HalftoneJob job, ProcessingOptions options) throws HalftoneException {
		PixelBuffer source = decoder.decode(job.getSourceBytes());
		TargetSize target = TargetSize.compute(source.getWidth(), source.getHeight(), options);

		logger.log(System.Logger.Level.DEBUG, String.format("Job %s: %dx%d -> %s",
			job.getId(), source.getWidth(), source.getHeight(), target));

		long targetPixels = (long) target.getWidth() * target.getHeight();
		if (targetPixels > maxPixels) {
			throw new HalftoneException(String.format("Target size %dx%d exceeds the limit of %d pixels",
				target.getWidth(), target.getHeight(), maxPixels));
		}

		PixelBuffer resized = resampler.resize(source, target.getWidth(), target.getHeight());
		PixelBuffer toned = HalftoneProcessor.process(resized, options);
		byte[] encoded = encoder.encode(toned);
		byte[] output = PngPhysicalResolution.embed(encoded, options.getPrintDpi());

		return HalftoneResult.processed(job, output, toned.getWidth(), toned.getHeight());
	}
}
