package de.kherud.halftone.batch;

import java.util.Objects;

/**
 * One image admitted to a batch: a stable id, its encoded bytes and its native size.
 */
public final class HalftoneJob {

	private final String id;
	private final byte[] sourceBytes;
	private final int width;
	private final int height;

	public HalftoneJob(String id, byte[] sourceBytes, int width, int height) {
		this.id = Objects.requireNonNull(id, "Job id cannot be null");
		this.sourceBytes = Objects.requireNonNull(sourceBytes, "Source bytes cannot be null");
		this.width = width;
		this.height = height;
	}

	public String getId() { return id; }
	public byte[] getSourceBytes() { return sourceBytes; }
	public int getWidth() { return width; }
	public int getHeight() { return height; }

	@Override
	public String toString() {
		return String.format("HalftoneJob{id='%s', size=%dx%d, bytes=%d}", id, width, height, sourceBytes.length);
	}
}
