package de.kherud.halftone;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Encoded test images built with ImageIO.
 */
public final class TestImages {

	private TestImages() {
	}

	public static byte[] solidPng(int width, int height, Color color) throws IOException {
		BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
		Graphics2D g2d = image.createGraphics();
		g2d.setColor(color);
		g2d.fillRect(0, 0, width, height);
		g2d.dispose();
		return encode(image, "png");
	}

	/**
	 * Horizontal black-to-white ramp.
	 */
	public static byte[] gradientPng(int width, int height) throws IOException {
		BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				int v = width > 1 ? x * 255 / (width - 1) : 0;
				image.setRGB(x, y, (v << 16) | (v << 8) | v);
			}
		}
		return encode(image, "png");
	}

	public static byte[] encode(BufferedImage image, String format) throws IOException {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		if (!ImageIO.write(image, format, out)) {
			throw new IOException("No writer for " + format);
		}
		return out.toByteArray();
	}

	public static BufferedImage decode(byte[] bytes) throws IOException {
		BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
		if (image == null) {
			throw new IOException("Not an image");
		}
		return image;
	}
}
