package de.kherud.halftone;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.kherud.halftone.args.DitherMode;
import de.kherud.halftone.args.ToneMode;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Immutable settings for one batch run.
 *
 * <pre>{@code
 * ProcessingOptions options = ProcessingOptions.builder()
 *     .contrast(1.4)
 *     .threshold(120)
 *     .mode(DitherMode.DIFFUSED)
 *     .toneMode(ToneMode.MONOCHROME)
 *     .outputWidthCm(8.5)
 *     .printDpi(600)
 *     .build();
 * }</pre>
 */
public final class ProcessingOptions {

	public static final double CM_PER_INCH = 2.54;

	public static final double MIN_CONTRAST = 0.8;
	public static final double MAX_CONTRAST = 2.0;
	public static final int MAX_DPI = 4800;

	private final double contrast;
	private final int threshold;
	private final DitherMode mode;
	private final ToneMode toneMode;
	private final double outputWidthCm;
	private final int printDpi;

	private ProcessingOptions(Builder builder) {
		this.contrast = builder.contrast;
		this.threshold = builder.threshold;
		this.mode = builder.mode;
		this.toneMode = builder.toneMode;
		this.outputWidthCm = builder.outputWidthCm;
		this.printDpi = builder.printDpi;
	}

	public static Builder builder() {
		return new Builder();
	}

	public static ProcessingOptions defaults() {
		return new Builder().build();
	}

	public double getContrast() { return contrast; }
	public int getThreshold() { return threshold; }
	public DitherMode getMode() { return mode; }
	public ToneMode getToneMode() { return toneMode; }
	public double getOutputWidthCm() { return outputWidthCm; }
	public int getPrintDpi() { return printDpi; }

	/**
	 * Target output width in pixels, {@code round(widthCm / 2.54 * dpi)}.
	 */
	public int targetWidthPx() {
		return (int) Math.round(outputWidthCm / CM_PER_INCH * printDpi);
	}

	/**
	 * Check every numeric field against its documented range.
	 *
	 * @throws InvalidOptionsException on the first violation found
	 */
	public void validate() {
		if (!Double.isFinite(contrast) || contrast < MIN_CONTRAST || contrast > MAX_CONTRAST) {
			throw new InvalidOptionsException(
				String.format("Contrast must be between %.1f and %.1f, got %s", MIN_CONTRAST, MAX_CONTRAST, contrast));
		}
		if (threshold < 0 || threshold > 255) {
			throw new InvalidOptionsException("Threshold must be between 0 and 255, got " + threshold);
		}
		if (mode == null || toneMode == null) {
			throw new InvalidOptionsException("Dither mode and color mode are required");
		}
		if (!Double.isFinite(outputWidthCm) || outputWidthCm <= 0) {
			throw new InvalidOptionsException("Output width must be a positive number of centimetres, got " + outputWidthCm);
		}
		if (printDpi < 1 || printDpi > MAX_DPI) {
			throw new InvalidOptionsException("Print DPI must be between 1 and " + MAX_DPI + ", got " + printDpi);
		}
		if (targetWidthPx() < 1) {
			throw new InvalidOptionsException(
				String.format("Output width %.3f cm at %d DPI is smaller than one pixel", outputWidthCm, printDpi));
		}
	}

	public Builder toBuilder() {
		return new Builder()
			.contrast(contrast)
			.threshold(threshold)
			.mode(mode)
			.toneMode(toneMode)
			.outputWidthCm(outputWidthCm)
			.printDpi(printDpi);
	}

	/**
	 * Load options from a JSON file. Missing keys keep their defaults, unknown keys are ignored.
	 */
	public static ProcessingOptions fromJson(Path jsonPath) throws IOException {
		return builderFromJson(jsonPath).build();
	}

	/**
	 * Same as {@link #fromJson(Path)} but leaves the builder open so callers can override values.
	 */
	public static Builder builderFromJson(Path jsonPath) throws IOException {
		ObjectMapper mapper = new ObjectMapper();
		JsonNode root = mapper.readTree(jsonPath.toFile());
		if (root == null || !root.isObject()) {
			throw new IOException("Expected a JSON object in " + jsonPath);
		}

		Builder builder = new Builder();
		if (root.has("contrast")) {
			builder.contrast(root.get("contrast").asDouble());
		}
		if (root.has("threshold")) {
			builder.threshold(root.get("threshold").asInt());
		}
		if (root.has("mode")) {
			builder.mode(DitherMode.fromKey(root.get("mode").asText()));
		}
		if (root.has("colorMode")) {
			builder.toneMode(ToneMode.fromKey(root.get("colorMode").asText()));
		}
		if (root.has("outputWidthCm")) {
			builder.outputWidthCm(root.get("outputWidthCm").asDouble());
		}
		if (root.has("printDpi")) {
			builder.printDpi(root.get("printDpi").asInt());
		}
		return builder;
	}

	@Override
	public String toString() {
		return String.format("ProcessingOptions{contrast=%.2f, threshold=%d, mode=%s, toneMode=%s, width=%.2fcm, dpi=%d}",
			contrast, threshold, mode != null ? mode.getKey() : null, toneMode != null ? toneMode.getKey() : null,
			outputWidthCm, printDpi);
	}

	public static class Builder {
		private double contrast = 1.2;
		private int threshold = 128;
		private DitherMode mode = DitherMode.DIFFUSED;
		private ToneMode toneMode = ToneMode.MONOCHROME;
		private double outputWidthCm = 10.0;
		private int printDpi = 300;

		public Builder contrast(double contrast) { this.contrast = contrast; return this; }
		public Builder threshold(int threshold) { this.threshold = threshold; return this; }
		public Builder mode(DitherMode mode) { this.mode = mode; return this; }
		public Builder toneMode(ToneMode toneMode) { this.toneMode = toneMode; return this; }
		public Builder outputWidthCm(double outputWidthCm) { this.outputWidthCm = outputWidthCm; return this; }
		public Builder printDpi(int printDpi) { this.printDpi = printDpi; return this; }

		public ProcessingOptions build() {
			return new ProcessingOptions(this);
		}
	}
}
