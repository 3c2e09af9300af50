package de.kherud.halftone;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.kherud.halftone.png.PngPhysicalResolution;
import de.kherud.halftone.util.CliRunner;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.awt.Color;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

public class HalftoneGeneratorTest {

	@Rule
	public TemporaryFolder tempDir = new TemporaryFolder();

	private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
	private PrintStream originalOut;
	private Path inputDir;

	@Before
	public void setUp() throws IOException {
		originalOut = System.out;
		System.setOut(new PrintStream(stdout, true, StandardCharsets.UTF_8));

		inputDir = tempDir.newFolder("input").toPath();
		Files.write(inputDir.resolve("a.png"), TestImages.gradientPng(40, 20));
		Files.write(inputDir.resolve("b.png"), TestImages.solidPng(20, 20, Color.GRAY));
		Files.write(inputDir.resolve("notes.txt"), "not an image".getBytes(StandardCharsets.UTF_8));
	}

	@After
	public void tearDown() {
		System.setOut(originalOut);
	}

	@Test
	public void testProcessWritesLooseFiles() throws Exception {
		Path out = tempDir.getRoot().toPath().resolve("out");

		HalftoneGenerator.runCli(new String[]{
			"process", inputDir.toString(), "--out", out.toString(), "--width-cm", "2.54", "--dpi", "20"
		});

		Assert.assertEquals(Arrays.asList("halftone_1_20x10.png", "halftone_2_20x20.png"), listNames(out));
		byte[] first = Files.readAllBytes(out.resolve("halftone_1_20x10.png"));
		Assert.assertEquals(20, TestImages.decode(first).getWidth());
		Assert.assertEquals("20 DPI is 787 pixels per meter",
			787, PngPhysicalResolution.read(first).get().getPixelsPerUnitX());
		Assert.assertTrue(stdout.toString(StandardCharsets.UTF_8).contains("[2/2]"));
	}

	@Test
	public void testProcessWritesZipAndReport() throws Exception {
		Path zip = tempDir.getRoot().toPath().resolve("results/batch.zip");
		Path report = tempDir.getRoot().toPath().resolve("results/report.json");

		HalftoneGenerator.runCli(new String[]{
			"process", inputDir.resolve("a.png").toString(), inputDir.resolve("b.png").toString(),
			"--zip", zip.toString(), "--report", report.toString(),
			"--width-cm", "2.54", "--dpi", "20", "--mode", "binary", "--color-mode", "gray"
		});

		List<String> entries = new ArrayList<>();
		try (InputStream in = Files.newInputStream(zip); ZipInputStream zipIn = new ZipInputStream(in)) {
			ZipEntry entry;
			while ((entry = zipIn.getNextEntry()) != null) {
				entries.add(entry.getName());
			}
		}
		Assert.assertEquals(Arrays.asList("halftone_1_20x10.png", "halftone_2_20x20.png"), entries);

		JsonNode json = new ObjectMapper().readTree(report.toFile());
		Assert.assertEquals(2, json.get("total").asInt());
		Assert.assertEquals(2, json.get("processed").asInt());
		Assert.assertEquals(0, json.get("fallback").asInt());
		Assert.assertEquals("binary", json.get("options").get("mode").asText());
		Assert.assertEquals("gray", json.get("options").get("colorMode").asText());
		Assert.assertEquals(20, json.get("options").get("printDpi").asInt());
		Assert.assertEquals("a.png", json.get("results").get(0).get("id").asText());
		Assert.assertEquals("PROCESSED", json.get("results").get(0).get("status").asText());
		Assert.assertEquals(10, json.get("results").get(0).get("height").asInt());
		Assert.assertTrue(json.get("durationMs").asDouble() >= 0);
	}

	@Test
	public void testZipIntoDirectoryUsesTimestampedName() throws Exception {
		Path archives = tempDir.newFolder("archives").toPath();

		HalftoneGenerator.runCli(new String[]{
			"process", inputDir.resolve("b.png").toString(), "--zip", archives.toString(),
			"--width-cm", "2.54", "--dpi", "20"
		});

		List<String> names = listNames(archives);
		Assert.assertEquals(1, names.size());
		Assert.assertTrue(names.get(0), names.get(0).matches("halftone_batch_\\d+\\.zip"));
		Assert.assertTrue(stdout.toString(StandardCharsets.UTF_8).contains("[1/1] b.png PROCESSED (100%)"));
	}

	@Test
	public void testResolveArchivePath() throws IOException {
		Path dir = tempDir.newFolder("target").toPath();
		Assert.assertEquals(dir.resolve("halftone_batch_42.zip"), HalftoneGenerator.resolveArchivePath(dir, 42));
		Path file = dir.resolve("named.zip");
		Assert.assertEquals(file, HalftoneGenerator.resolveArchivePath(file, 42));
	}

	@Test
	public void testFallbackFilesKeepSourceFormat() throws Exception {
		Path out = tempDir.getRoot().toPath().resolve("out");

		HalftoneGenerator.runCli(new String[]{
			"process", inputDir.resolve("a.png").toString(), "--out", out.toString(),
			"--width-cm", "13.23", "--dpi", "4800"
		});

		Assert.assertEquals(Arrays.asList("halftone_1_40x20_original.png"), listNames(out));
		Assert.assertArrayEquals(Files.readAllBytes(inputDir.resolve("a.png")),
			Files.readAllBytes(out.resolve("halftone_1_40x20_original.png")));
	}

	@Test
	public void testCommandLineOverridesConfigFile() throws Exception {
		Path config = tempDir.newFile("options.json").toPath();
		Files.write(config, "{\"contrast\": 1.5, \"threshold\": 90, \"printDpi\": 20, \"outputWidthCm\": 2.54}"
			.getBytes(StandardCharsets.UTF_8));
		Path report = tempDir.getRoot().toPath().resolve("report.json");

		HalftoneGenerator.runCli(new String[]{
			"process", inputDir.resolve("b.png").toString(), "--config", config.toString(),
			"--contrast", "1.0", "--out", tempDir.newFolder("out").toString(), "--report", report.toString()
		});

		JsonNode options = new ObjectMapper().readTree(report.toFile()).get("options");
		Assert.assertEquals(1.0, options.get("contrast").asDouble(), 1e-9);
		Assert.assertEquals(90, options.get("threshold").asInt());
		Assert.assertEquals("floyd", options.get("mode").asText());
	}

	@Test
	public void testUnreadableImagesAreSkipped() throws Exception {
		Files.write(inputDir.resolve("broken.png"), "garbage".getBytes(StandardCharsets.US_ASCII));
		Path out = tempDir.getRoot().toPath().resolve("out");

		HalftoneGenerator.runCli(new String[]{
			"process", inputDir.toString(), "--out", out.toString(), "--width-cm", "2.54", "--dpi", "20"
		});

		Assert.assertEquals(2, listNames(out).size());
		Assert.assertTrue(stdout.toString(StandardCharsets.UTF_8).contains("Skipping unreadable image: broken.png"));
	}

	@Test
	public void testNoReadableImages() throws IOException {
		Path empty = tempDir.newFolder("empty").toPath();
		Files.write(empty.resolve("broken.jpg"), new byte[]{1, 2, 3});
		assertUsageError("No readable images", "process", empty.toString(), "--out", "unused");
	}

	@Test
	public void testInfo() throws Exception {
		HalftoneGenerator.runCli(new String[]{
			"info", inputDir.resolve("a.png").toString(), "--width-cm", "2.54", "--dpi", "20"
		});

		String output = stdout.toString(StandardCharsets.UTF_8);
		Assert.assertTrue(output, output.contains("Source size: 40x20"));
		Assert.assertTrue(output, output.contains("Output: 20x10 px"));
		Assert.assertTrue(output, output.contains("Embedded resolution: none"));
	}

	@Test
	public void testArgumentErrors() {
		assertUsageError("No command");
		assertUsageError("Unknown command", "render", "a.png");
		assertUsageError("At least one input", "process", "--out", "x");
		assertUsageError("--out <dir> or --zip", "process", inputDir.toString());
		assertUsageError("Unknown option", "process", inputDir.toString(), "--colour", "bw");
		assertUsageError("Missing value for --dpi", "process", inputDir.toString(), "--dpi");
		assertUsageError("Invalid integer", "process", inputDir.toString(), "--threshold", "half");
		assertUsageError("Unknown dither mode", "process", inputDir.toString(), "--mode", "atkinson");
		assertUsageError("Threshold", "process", inputDir.toString(), "--out", "x", "--threshold", "300");
		assertUsageError("does not exist", "process", "missing-dir", "--out", "x");
		assertUsageError("Exactly one image", "info");
	}

	@Test
	public void testHelpIsNotAnError() throws Exception {
		HalftoneGenerator.runCli(new String[]{"--help"});
		HalftoneGenerator.runCli(new String[]{"process", "-h"});
		Assert.assertTrue(stdout.toString(StandardCharsets.UTF_8).contains("Usage: HalftoneGenerator"));
	}

	@Test
	public void testExitCodes() {
		Assert.assertEquals(CliRunner.EXIT_OK,
			CliRunner.runWithoutExit(HalftoneGenerator::runCli, new String[]{"--help"}));
		Assert.assertEquals(CliRunner.EXIT_USAGE,
			CliRunner.runWithoutExit(HalftoneGenerator::runCli, new String[]{"frobnicate"}));
		Assert.assertEquals(CliRunner.EXIT_USAGE,
			CliRunner.runWithoutExit(HalftoneGenerator::runCli, new String[]{
				"process", inputDir.toString(), "--out", "x", "--contrast", "5"}));
	}

	@Test
	public void testImageExtensionFilter() {
		Assert.assertTrue(HalftoneGenerator.hasImageExtension(Path.of("photo.JPG")));
		Assert.assertTrue(HalftoneGenerator.hasImageExtension(Path.of("scan.jpeg")));
		Assert.assertFalse(HalftoneGenerator.hasImageExtension(Path.of("notes.txt")));
		Assert.assertFalse(HalftoneGenerator.hasImageExtension(Path.of(".png")));
		Assert.assertFalse(HalftoneGenerator.hasImageExtension(Path.of("README")));
	}

	@Test
	public void testCollectImagesSortsDirectoryEntries() throws IOException {
		List<Path> images = HalftoneGenerator.collectImages(Arrays.asList(inputDir, inputDir.resolve("notes.txt")));
		Assert.assertEquals(3, images.size());
		Assert.assertEquals("a.png", images.get(0).getFileName().toString());
		Assert.assertEquals("b.png", images.get(1).getFileName().toString());
		Assert.assertEquals("Explicit files are taken as given", "notes.txt", images.get(2).getFileName().toString());
	}

	private static void assertUsageError(String expectedMessage, String... args) {
		try {
			HalftoneGenerator.runCli(args);
			Assert.fail("Expected IllegalArgumentException for " + Arrays.toString(args));
		} catch (IllegalArgumentException e) {
			Assert.assertTrue(e.getMessage(), e.getMessage().contains(expectedMessage));
		} catch (Exception e) {
			throw new AssertionError("Unexpected exception for " + Arrays.toString(args), e);
		}
	}

	private static List<String> listNames(Path dir) throws IOException {
		try (Stream<Path> files = Files.list(dir)) {
			return files.map(path -> path.getFileName().toString()).sorted().collect(Collectors.toList());
		}
	}
}
