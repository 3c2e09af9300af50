package de.kherud.halftone.png;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.zip.CRC32;

/**
 * Reads and embeds the PNG {@code pHYs} chunk directly in an encoded byte stream,
 * so print and office tools lay the image out at its physical size.
 *
 * Chunk layout: {@code [length:4][type:4][data:length][crc:4]}, big-endian, CRC over type and data.
 * Neither operation throws on malformed input; bytes that are not a PNG pass through.
 */
public final class PngPhysicalResolution {
	private static final System.Logger logger = System.getLogger(PngPhysicalResolution.class.getName());

	static final byte[] SIGNATURE = {(byte) 137, 80, 78, 71, 13, 10, 26, 10};
	static final String IHDR = "IHDR";
	static final String PHYS = "pHYs";
	static final String IEND = "IEND";

	static final int CHUNK_OVERHEAD = 12;
	static final int PHYS_LENGTH = 9;

	private PngPhysicalResolution() {
	}

	/**
	 * Insert a {@code pHYs} chunk declaring {@code dpi} right after the IHDR chunk.
	 *
	 * Returns the input array itself when it is not a PNG, when its header chunk is
	 * unreadable or when a {@code pHYs} chunk already exists; an existing declaration
	 * is never overwritten.
	 *
	 * @param png encoded container bytes
	 * @param dpi resolution in dots per inch
	 * @return new bytes with the chunk spliced in, or {@code png} unchanged
	 */
	public static byte[] embed(byte[] png, double dpi) {
		if (!isPng(png)) {
			logger.log(System.Logger.Level.DEBUG, "Not a PNG stream, leaving resolution untouched");
			return png;
		}
		if (findChunk(png, PHYS) >= 0) {
			return png;
		}

		int ihdrEnd = headerChunkEnd(png);
		if (ihdrEnd < 0) {
			logger.log(System.Logger.Level.DEBUG, "PNG header chunk missing or truncated, leaving resolution untouched");
			return png;
		}

		byte[] chunk = physChunk(PhysicalResolution.ofDpi(dpi));
		byte[] out = new byte[png.length + chunk.length];
		System.arraycopy(png, 0, out, 0, ihdrEnd);
		System.arraycopy(chunk, 0, out, ihdrEnd, chunk.length);
		System.arraycopy(png, ihdrEnd, out, ihdrEnd + chunk.length, png.length - ihdrEnd);
		return out;
	}

	/**
	 * First {@code pHYs} record before IEND, if any.
	 */
	public static Optional<PhysicalResolution> read(byte[] png) {
		if (!isPng(png)) {
			return Optional.empty();
		}
		int offset = findChunk(png, PHYS);
		if (offset < 0) {
			return Optional.empty();
		}
		ByteBuffer buffer = ByteBuffer.wrap(png);
		long length = Integer.toUnsignedLong(buffer.getInt(offset));
		if (length < PHYS_LENGTH || offset + 8 + PHYS_LENGTH > png.length) {
			return Optional.empty();
		}
		int data = offset + 8;
		long x = Integer.toUnsignedLong(buffer.getInt(data));
		long y = Integer.toUnsignedLong(buffer.getInt(data + 4));
		int unit = png[data + 8] & 0xFF;
		return Optional.of(new PhysicalResolution(x, y, unit));
	}

	public static boolean isPng(byte[] bytes) {
		if (bytes == null || bytes.length < SIGNATURE.length) {
			return false;
		}
		for (int i = 0; i < SIGNATURE.length; i++) {
			if (bytes[i] != SIGNATURE[i]) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Offset of the first chunk of the given type, scanning from byte 8 and stopping at IEND.
	 *
	 * @return chunk start offset, or -1 if absent or the stream ends first
	 */
	static int findChunk(byte[] png, String wanted) {
		ByteBuffer buffer = ByteBuffer.wrap(png);
		long offset = SIGNATURE.length;
		while (offset + 8 <= png.length) {
			int position = (int) offset;
			long length = Integer.toUnsignedLong(buffer.getInt(position));
			String type = new String(png, position + 4, 4, StandardCharsets.ISO_8859_1);
			if (type.equals(wanted)) {
				return position;
			}
			if (type.equals(IEND)) {
				break;
			}
			offset += CHUNK_OVERHEAD + length;
		}
		return -1;
	}

	/**
	 * End offset of chunk 0, which must be IHDR.
	 */
	private static int headerChunkEnd(byte[] png) {
		int start = SIGNATURE.length;
		if (start + 8 > png.length) {
			return -1;
		}
		String type = new String(png, start + 4, 4, StandardCharsets.ISO_8859_1);
		if (!type.equals(IHDR)) {
			return -1;
		}
		long length = Integer.toUnsignedLong(ByteBuffer.wrap(png).getInt(start));
		long end = start + CHUNK_OVERHEAD + length;
		return end <= png.length ? (int) end : -1;
	}

	static byte[] physChunk(PhysicalResolution resolution) {
		ByteBuffer chunk = ByteBuffer.allocate(CHUNK_OVERHEAD + PHYS_LENGTH);
		chunk.putInt(PHYS_LENGTH);
		chunk.put(PHYS.getBytes(StandardCharsets.ISO_8859_1));
		chunk.putInt((int) resolution.getPixelsPerUnitX());
		chunk.putInt((int) resolution.getPixelsPerUnitY());
		chunk.put((byte) resolution.getUnit());

		CRC32 crc = new CRC32();
		crc.update(chunk.array(), 4, 4 + PHYS_LENGTH);
		chunk.putInt((int) crc.getValue());
		return chunk.array();
	}
}
