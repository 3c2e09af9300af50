package de.kherud.halftone.batch;

import java.util.Optional;

/**
 * Outcome of one job. Produced exactly once per {@link HalftoneJob}.
 *
 * A result that is not {@link Status#PROCESSED} carries the job's original bytes as output
 * and the job's original dimensions.
 */
public final class HalftoneResult {

	public enum Status {
		/** Pipeline completed. */
		PROCESSED,
		/** Pipeline failed; output is the original input. */
		FALLBACK,
		/** Batch was cancelled before this job ran; output is the original input. */
		CANCELLED
	}

	private final String id;
	private final byte[] originalBytes;
	private final byte[] outputBytes;
	private final int width;
	private final int height;
	private final Status status;
	private final String message;

	private HalftoneResult(String id, byte[] originalBytes, byte[] outputBytes, int width, int height,
						   Status status, String message) {
		this.id = id;
		this.originalBytes = originalBytes;
		this.outputBytes = outputBytes;
		this.width = width;
		this.height = height;
		this.status = status;
		this.message = message;
	}

	public static HalftoneResult processed(HalftoneJob job, byte[] outputBytes, int width, int height) {
		return new HalftoneResult(job.getId(), job.getSourceBytes(), outputBytes, width, height, Status.PROCESSED, null);
	}

	public static HalftoneResult fallback(HalftoneJob job, String message) {
		return new HalftoneResult(job.getId(), job.getSourceBytes(), job.getSourceBytes(),
			job.getWidth(), job.getHeight(), Status.FALLBACK, message);
	}

	public static HalftoneResult cancelled(HalftoneJob job) {
		return new HalftoneResult(job.getId(), job.getSourceBytes(), job.getSourceBytes(),
			job.getWidth(), job.getHeight(), Status.CANCELLED, "Batch cancelled");
	}

	public String getId() { return id; }
	public byte[] getOriginalBytes() { return originalBytes; }
	public byte[] getOutputBytes() { return outputBytes; }
	public int getWidth() { return width; }
	public int getHeight() { return height; }
	public Status getStatus() { return status; }
	public Optional<String> getMessage() { return Optional.ofNullable(message); }

	public boolean isProcessed() {
		return status == Status.PROCESSED;
	}

	@Override
	public String toString() {
		if (isProcessed()) {
			return String.format("HalftoneResult{id='%s', status=%s, size=%dx%d, bytes=%d}",
				id, status, width, height, outputBytes.length);
		}
		return String.format("HalftoneResult{id='%s', status=%s, message='%s'}", id, status, message);
	}
}
