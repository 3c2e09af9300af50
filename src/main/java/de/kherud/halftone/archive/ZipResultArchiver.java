package de.kherud.halftone.archive;

import de.kherud.halftone.batch.HalftoneResult;
import de.kherud.halftone.codec.ImageIoCodec;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Writes each result's output under {@link #entryName(int, HalftoneResult)}, numbered from 1 in result order.
 */
public class ZipResultArchiver implements ResultArchiver {

	public static final int DEFAULT_LEVEL = 6;

	private final int level;

	public ZipResultArchiver() {
		this(DEFAULT_LEVEL);
	}

	public ZipResultArchiver(int level) {
		if (level < 0 || level > 9) {
			throw new IllegalArgumentException("Compression level must be between 0 and 9");
		}
		this.level = level;
	}

	@Override
	public void write(List<HalftoneResult> results, OutputStream out) throws IOException {
		ZipOutputStream zip = new ZipOutputStream(out);
		zip.setLevel(level);
		for (int i = 0; i < results.size(); i++) {
			HalftoneResult result = results.get(i);
			zip.putNextEntry(new ZipEntry(entryName(i + 1, result)));
			zip.write(result.getOutputBytes());
			zip.closeEntry();
		}
		zip.finish();
	}

	/**
	 * {@code halftone_<n>_<w>x<h>.png} for processed results. Fallback and cancelled results carry
	 * the source bytes and are named {@code halftone_<n>_<w>x<h>_original.<ext>} after their actual format.
	 */
	public static String entryName(int index, HalftoneResult result) {
		if (result.isProcessed()) {
			return String.format("halftone_%d_%dx%d.png", index, result.getWidth(), result.getHeight());
		}
		String extension = ImageIoCodec.detectFormat(result.getOutputBytes())
			.map(ZipResultArchiver::extensionFor)
			.orElse("bin");
		return String.format("halftone_%d_%dx%d_original.%s", index, result.getWidth(), result.getHeight(), extension);
	}

	private static String extensionFor(String formatName) {
		return formatName.equals("jpeg") ? "jpg" : formatName;
	}

	public static String defaultArchiveName(long epochMillis) {
		return "halftone_batch_" + epochMillis + ".zip";
	}
}
