package de.kherud.halftone.codec;

import de.kherud.halftone.DecodeException;
import de.kherud.halftone.EncodeException;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.Dimension;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;
import java.util.Optional;

/**
 * {@link ImageDecoder} and {@link ImageEncoder} backed by {@link ImageIO}.
 *
 * Decodes anything ImageIO can read (PNG, JPEG, BMP, GIF) to RGBA and encodes to PNG by default.
 */
public class ImageIoCodec implements ImageDecoder, ImageEncoder {
	private static final System.Logger logger = System.getLogger(ImageIoCodec.class.getName());

	private final String formatName;

	public ImageIoCodec() {
		this("png");
	}

	public ImageIoCodec(String formatName) {
		this.formatName = formatName;
	}

	public String getFormatName() {
		return formatName;
	}

	@Override
	public PixelBuffer decode(byte[] encoded) throws DecodeException {
		if (encoded == null || encoded.length == 0) {
			throw new DecodeException("No image data");
		}

		BufferedImage image;
		try {
			image = ImageIO.read(new ByteArrayInputStream(encoded));
		} catch (IOException e) {
			throw new DecodeException("Failed to read image: " + e.getMessage(), e);
		}
		if (image == null) {
			throw new DecodeException("Invalid or unsupported image format");
		}

		logger.log(System.Logger.Level.DEBUG, String.format("Decoded image %dx%d (type %d)",
			image.getWidth(), image.getHeight(), image.getType()));
		return fromBufferedImage(image);
	}

	@Override
	public byte[] encode(PixelBuffer pixels) throws EncodeException {
		BufferedImage image = toBufferedImage(pixels);
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		try {
			if (!ImageIO.write(image, formatName, out)) {
				throw new EncodeException("No ImageIO writer for format: " + formatName);
			}
		} catch (IOException e) {
			throw new EncodeException("Failed to write " + formatName + " image: " + e.getMessage(), e);
		}
		return out.toByteArray();
	}

	/**
	 * Read only the pixel size of an encoded image, without decoding its pixels.
	 *
	 * @throws DecodeException if no ImageIO reader recognizes the bytes
	 */
	public static Dimension readSize(byte[] encoded) throws DecodeException {
		try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(encoded))) {
			Iterator<ImageReader> readers = input != null ? ImageIO.getImageReaders(input) : null;
			if (readers == null || !readers.hasNext()) {
				throw new DecodeException("Invalid or unsupported image format");
			}
			ImageReader reader = readers.next();
			try {
				reader.setInput(input, true, true);
				return new Dimension(reader.getWidth(0), reader.getHeight(0));
			} finally {
				reader.dispose();
			}
		} catch (IOException e) {
			throw new DecodeException("Failed to read image header: " + e.getMessage(), e);
		}
	}

	/**
	 * Lower-case format name of the first ImageIO reader that accepts the bytes, for example
	 * {@code png} or {@code jpeg}. Empty when no reader recognizes them.
	 */
	public static Optional<String> detectFormat(byte[] encoded) {
		if (encoded == null || encoded.length == 0) {
			return Optional.empty();
		}
		try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(encoded))) {
			if (input == null) {
				return Optional.empty();
			}
			Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
			if (!readers.hasNext()) {
				return Optional.empty();
			}
			return Optional.of(readers.next().getFormatName().toLowerCase(Locale.ROOT));
		} catch (IOException e) {
			logger.log(System.Logger.Level.DEBUG, "Could not detect image format: " + e.getMessage());
			return Optional.empty();
		}
	}

	/**
	 * Copy any BufferedImage into a fresh RGBA buffer.
	 */
	public static PixelBuffer fromBufferedImage(BufferedImage image) {
		int width = image.getWidth();
		int height = image.getHeight();
		int[] row = new int[width];
		byte[] data = new byte[width * height * PixelBuffer.RGBA];

		int index = 0;
		for (int y = 0; y < height; y++) {
			image.getRGB(0, y, width, 1, row, 0, width);
			for (int x = 0; x < width; x++) {
				int argb = row[x];
				data[index++] = (byte) ((argb >> 16) & 0xFF);
				data[index++] = (byte) ((argb >> 8) & 0xFF);
				data[index++] = (byte) (argb & 0xFF);
				data[index++] = (byte) ((argb >>> 24) & 0xFF);
			}
		}
		return new PixelBuffer(width, height, PixelBuffer.RGBA, data);
	}

	/**
	 * Build a BufferedImage holding the buffer's samples. One-channel buffers become
	 * {@link BufferedImage#TYPE_BYTE_GRAY}, RGBA buffers {@link BufferedImage#TYPE_INT_ARGB}.
	 */
	public static BufferedImage toBufferedImage(PixelBuffer pixels) {
		int width = pixels.getWidth();
		int height = pixels.getHeight();

		if (pixels.getChannels() == PixelBuffer.GRAY) {
			BufferedImage gray = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
			gray.getRaster().setDataElements(0, 0, width, height, pixels.getData().clone());
			return gray;
		}

		BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
		byte[] data = pixels.getData();
		int[] row = new int[width];
		int index = 0;
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				int r = data[index++] & 0xFF;
				int g = data[index++] & 0xFF;
				int b = data[index++] & 0xFF;
				int a = data[index++] & 0xFF;
				row[x] = (a << 24) | (r << 16) | (g << 8) | b;
			}
			image.setRGB(0, y, width, 1, row, 0, width);
		}
		return image;
	}
}
