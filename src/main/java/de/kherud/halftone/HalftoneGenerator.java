package de.kherud.halftone;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.kherud.halftone.archive.ZipResultArchiver;
import de.kherud.halftone.args.DitherMode;
import de.kherud.halftone.args.ToneMode;
import de.kherud.halftone.batch.BatchOrchestrator;
import de.kherud.halftone.batch.BatchProgress;
import de.kherud.halftone.batch.BatchRequest;
import de.kherud.halftone.batch.BatchResponse;
import de.kherud.halftone.batch.HalftoneJob;
import de.kherud.halftone.batch.HalftonePipeline;
import de.kherud.halftone.batch.HalftoneResult;
import de.kherud.halftone.codec.ImageIoCodec;
import de.kherud.halftone.png.PngPhysicalResolution;
import de.kherud.halftone.resample.TargetSize;
import de.kherud.halftone.util.CliRunner;

import java.awt.Dimension;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Command-line front end: converts images into print-ready halftones sized to a physical width.
 */
public class HalftoneGenerator {
	private static final System.Logger logger = System.getLogger(HalftoneGenerator.class.getName());

	static final List<String> IMAGE_EXTENSIONS = Arrays.asList("png", "jpg", "jpeg", "bmp", "gif");

	public static void main(String[] args) {
		CliRunner.runWithExit(HalftoneGenerator::runCli, args);
	}

	/**
	 * CLI runner that can be tested without System.exit
	 */
	public static void runCli(String[] args) throws Exception {
		if (args.length < 1) {
			printUsage();
			throw new IllegalArgumentException("No command specified");
		}

		String command = args[0];
		if (command.equals("--help") || command.equals("-h")) {
			printUsage();
			return;
		}

		CliArguments parsed = CliArguments.parse(Arrays.copyOfRange(args, 1, args.length));
		if (parsed.help) {
			printUsage();
			return;
		}

		switch (command) {
			case "process":
				handleProcessCommand(parsed);
				break;
			case "info":
				handleInfoCommand(parsed);
				break;
			default:
				printUsage();
				throw new IllegalArgumentException("Unknown command: " + command);
		}
	}

	private static void handleProcessCommand(CliArguments parsed) throws Exception {
		if (parsed.inputs.isEmpty()) {
			throw new IllegalArgumentException("At least one input image or directory is required");
		}
		if (parsed.outputDir == null && parsed.zipFile == null) {
			throw new IllegalArgumentException("Either --out <dir> or --zip <file> is required");
		}

		ProcessingOptions options = parsed.buildOptions();
		options.validate();

		List<HalftoneJob> jobs = loadJobs(collectImages(parsed.inputs));
		if (jobs.isEmpty()) {
			throw new IllegalArgumentException("No readable images found");
		}

		System.out.println("Processing " + jobs.size() + " image(s) with " + options);

		BatchResponse response;
		try (BatchOrchestrator orchestrator = new BatchOrchestrator(new HalftonePipeline(),
				HalftoneGenerator::printProgress)) {
			response = orchestrator.submit(new BatchRequest(jobs, options)).join();
		}

		if (parsed.zipFile != null) {
			Path zipFile = resolveArchivePath(parsed.zipFile, System.currentTimeMillis());
			Path parent = zipFile.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			try (OutputStream out = Files.newOutputStream(zipFile)) {
				new ZipResultArchiver().write(response.getResults(), out);
			}
			System.out.println("Archive written: " + zipFile);
		}
		if (parsed.outputDir != null) {
			writeResults(response.getResults(), parsed.outputDir);
			System.out.println("Results written to: " + parsed.outputDir);
		}
		if (parsed.reportFile != null) {
			writeReport(response, options, parsed.reportFile);
			System.out.println("Report written: " + parsed.reportFile);
		}

		System.out.printf(Locale.ROOT, "Done in %.2fs: %d processed, %d kept original%n",
			response.getDurationMs() / 1000.0, response.getProcessedCount(),
			response.getFallbackCount() + response.getCancelledCount());
	}

	private static void printProgress(BatchProgress progress) {
		System.out.printf(Locale.ROOT, "%s (%d%%)%n", progress, progress.getPercent());
	}

	/**
	 * An existing directory receives a timestamped archive name inside it.
	 */
	static Path resolveArchivePath(Path zipArgument, long epochMillis) {
		if (Files.isDirectory(zipArgument)) {
			return zipArgument.resolve(ZipResultArchiver.defaultArchiveName(epochMillis));
		}
		return zipArgument;
	}

	private static void handleInfoCommand(CliArguments parsed) throws Exception {
		if (parsed.inputs.size() != 1) {
			throw new IllegalArgumentException("Exactly one image path required for info command");
		}
		ProcessingOptions options = parsed.buildOptions();
		options.validate();

		Path imagePath = parsed.inputs.get(0);
		byte[] bytes = Files.readAllBytes(imagePath);
		Dimension size = ImageIoCodec.readSize(bytes);
		TargetSize target = TargetSize.compute(size.width, size.height, options);

		System.out.println("=== HALFTONE OUTPUT INFO ===");
		System.out.println("Image: " + imagePath.getFileName());
		System.out.println("Source size: " + size.width + "x" + size.height);
		System.out.println("Output: " + target);
		System.out.println("Embedded resolution: " + PngPhysicalResolution.read(bytes)
			.map(Object::toString)
			.orElse("none"));
	}

	static List<Path> collectImages(List<Path> inputs) throws IOException {
		List<Path> images = new ArrayList<>();
		for (Path input : inputs) {
			if (Files.isDirectory(input)) {
				try (Stream<Path> entries = Files.list(input)) {
					images.addAll(entries
						.filter(Files::isRegularFile)
						.filter(HalftoneGenerator::hasImageExtension)
						.sorted()
						.collect(Collectors.toList()));
				}
			} else if (Files.isRegularFile(input)) {
				images.add(input);
			} else {
				throw new IllegalArgumentException("Input does not exist: " + input);
			}
		}
		return images;
	}

	static boolean hasImageExtension(Path path) {
		String name = path.getFileName().toString();
		int lastDot = name.lastIndexOf('.');
		return lastDot > 0 && IMAGE_EXTENSIONS.contains(name.substring(lastDot + 1).toLowerCase(Locale.ROOT));
	}

	private static List<HalftoneJob> loadJobs(List<Path> images) throws IOException {
		List<HalftoneJob> jobs = new ArrayList<>();
		for (Path image : images) {
			byte[] bytes = Files.readAllBytes(image);
			try {
				Dimension size = ImageIoCodec.readSize(bytes);
				jobs.add(new HalftoneJob(image.getFileName().toString(), bytes, size.width, size.height));
			} catch (DecodeException e) {
				logger.log(System.Logger.Level.WARNING, "Skipping unreadable image " + image + ": " + e.getMessage());
				System.out.println("Skipping unreadable image: " + image.getFileName());
			}
		}
		return jobs;
	}

	private static void writeResults(List<HalftoneResult> results, Path outputDir) throws IOException {
		Files.createDirectories(outputDir);
		for (int i = 0; i < results.size(); i++) {
			HalftoneResult result = results.get(i);
			Files.write(outputDir.resolve(ZipResultArchiver.entryName(i + 1, result)), result.getOutputBytes());
		}
	}

	static void writeReport(BatchResponse response, ProcessingOptions options, Path reportFile) throws IOException {
		Map<String, Object> report = new LinkedHashMap<>();
		Map<String, Object> optionsJson = new LinkedHashMap<>();
		optionsJson.put("contrast", options.getContrast());
		optionsJson.put("threshold", options.getThreshold());
		optionsJson.put("mode", options.getMode().getKey());
		optionsJson.put("colorMode", options.getToneMode().getKey());
		optionsJson.put("outputWidthCm", options.getOutputWidthCm());
		optionsJson.put("printDpi", options.getPrintDpi());
		report.put("options", optionsJson);
		report.put("durationMs", response.getDurationMs());
		report.put("total", response.getTotal());
		report.put("processed", response.getProcessedCount());
		report.put("fallback", response.getFallbackCount());
		report.put("cancelled", response.getCancelledCount());

		List<Map<String, Object>> results = new ArrayList<>();
		for (HalftoneResult result : response.getResults()) {
			Map<String, Object> entry = new LinkedHashMap<>();
			entry.put("id", result.getId());
			entry.put("status", result.getStatus().name());
			entry.put("width", result.getWidth());
			entry.put("height", result.getHeight());
			entry.put("bytes", result.getOutputBytes().length);
			result.getMessage().ifPresent(message -> entry.put("message", message));
			results.add(entry);
		}
		report.put("results", results);

		Path parent = reportFile.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		new ObjectMapper().writerWithDefaultPrettyPrinter().writeValue(reportFile.toFile(), report);
	}

	private static void printUsage() {
		System.out.println("Usage: HalftoneGenerator <command> [options] [args]");
		System.out.println();
		System.out.println("Convert images into print-ready halftones at a physical output width.");
		System.out.println();
		System.out.println("Commands:");
		System.out.println("  process <input...>          Process images or directories of images");
		System.out.println("  info <image>                Show target size and embedded resolution");
		System.out.println();
		System.out.println("Options:");
		System.out.println("  --out <dir>                 Write halftone_<n>_<w>x<h>.png files here");
		System.out.println("  --zip <file|dir>            Write all results into a ZIP archive");
		System.out.println("  --report <file>             Write a JSON report of the batch");
		System.out.println("  --config <json>             Load options from a JSON file");
		System.out.println("  --contrast <factor>         Contrast about mid-gray, 0.8-2.0 (default: 1.2)");
		System.out.println("  --threshold <0-255>         Black/white split point (default: 128)");
		System.out.println("  --mode <floyd|binary>       Error diffusion or flat threshold (default: floyd)");
		System.out.println("  --color-mode <bw|gray|color> Output tone (default: bw)");
		System.out.println("  --width-cm <cm>             Physical output width (default: 10)");
		System.out.println("  --dpi <dpi>                 Print resolution (default: 300)");
		System.out.println("  --help, -h                  Show this help");
		System.out.println();
		System.out.println("Examples:");
		System.out.println("  HalftoneGenerator process photo.jpg --out out/");
		System.out.println("  HalftoneGenerator process photos/ --width-cm 8 --dpi 600 --zip batch.zip");
		System.out.println("  HalftoneGenerator info photo.jpg --width-cm 15");
	}

	/**
	 * Parsed flags. Values given on the command line override those from {@code --config}.
	 */
	static final class CliArguments {
		final List<Path> inputs = new ArrayList<>();
		Path outputDir;
		Path zipFile;
		Path reportFile;
		Path configFile;
		Double contrast;
		Integer threshold;
		DitherMode mode;
		ToneMode toneMode;
		Double widthCm;
		Integer dpi;
		boolean help;

		static CliArguments parse(String[] args) {
			CliArguments parsed = new CliArguments();
			for (int i = 0; i < args.length; i++) {
				String arg = args[i];
				switch (arg) {
					case "--out":
						parsed.outputDir = Path.of(value(args, ++i, arg));
						break;
					case "--zip":
						parsed.zipFile = Path.of(value(args, ++i, arg));
						break;
					case "--report":
						parsed.reportFile = Path.of(value(args, ++i, arg));
						break;
					case "--config":
						parsed.configFile = Path.of(value(args, ++i, arg));
						break;
					case "--contrast":
						parsed.contrast = parseDouble(value(args, ++i, arg), arg);
						break;
					case "--threshold":
						parsed.threshold = parseInt(value(args, ++i, arg), arg);
						break;
					case "--mode":
						parsed.mode = DitherMode.fromKey(value(args, ++i, arg));
						break;
					case "--color-mode":
						parsed.toneMode = ToneMode.fromKey(value(args, ++i, arg));
						break;
					case "--width-cm":
						parsed.widthCm = parseDouble(value(args, ++i, arg), arg);
						break;
					case "--dpi":
						parsed.dpi = parseInt(value(args, ++i, arg), arg);
						break;
					case "--help":
					case "-h":
						parsed.help = true;
						break;
					default:
						if (arg.startsWith("--")) {
							throw new IllegalArgumentException("Unknown option: " + arg);
						}
						parsed.inputs.add(Path.of(arg));
				}
			}
			return parsed;
		}

		ProcessingOptions buildOptions() throws IOException {
			ProcessingOptions.Builder builder = configFile != null
				? ProcessingOptions.builderFromJson(configFile)
				: ProcessingOptions.builder();
			if (contrast != null) builder.contrast(contrast);
			if (threshold != null) builder.threshold(threshold);
			if (mode != null) builder.mode(mode);
			if (toneMode != null) builder.toneMode(toneMode);
			if (widthCm != null) builder.outputWidthCm(widthCm);
			if (dpi != null) builder.printDpi(dpi);
			return builder.build();
		}

		private static String value(String[] args, int index, String option) {
			if (index >= args.length) {
				throw new IllegalArgumentException("Missing value for " + option);
			}
			return args[index];
		}

		private static double parseDouble(String value, String option) {
			try {
				return Double.parseDouble(value);
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("Invalid number for " + option + ": " + value);
			}
		}

		private static int parseInt(String value, String option) {
			try {
				return Integer.parseInt(value);
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("Invalid integer for " + option + ": " + value);
			}
		}
	}
}
