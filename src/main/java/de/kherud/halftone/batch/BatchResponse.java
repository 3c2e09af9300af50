package de.kherud.halftone.batch;

import java.util.Collections;
import java.util.List;

/**
 * Terminal message of a batch: one result per submitted job, in submission order,
 * and the wall-clock time the batch took.
 */
public final class BatchResponse {

	private final List<HalftoneResult> results;
	private final double durationMs;

	public BatchResponse(List<HalftoneResult> results, double durationMs) {
		this.results = Collections.unmodifiableList(results);
		this.durationMs = Math.max(0.0, durationMs);
	}

	public List<HalftoneResult> getResults() { return results; }
	public double getDurationMs() { return durationMs; }

	public int getTotal() {
		return results.size();
	}

	public long count(HalftoneResult.Status status) {
		return results.stream().filter(r -> r.getStatus() == status).count();
	}

	public int getProcessedCount() {
		return (int) count(HalftoneResult.Status.PROCESSED);
	}

	public int getFallbackCount() {
		return (int) count(HalftoneResult.Status.FALLBACK);
	}

	public int getCancelledCount() {
		return (int) count(HalftoneResult.Status.CANCELLED);
	}

	public boolean isComplete() {
		return getProcessedCount() == results.size();
	}

	@Override
	public String toString() {
		return String.format("BatchResponse{total=%d, processed=%d, fallback=%d, cancelled=%d, duration=%.1fms}",
			getTotal(), getProcessedCount(), getFallbackCount(), getCancelledCount(), durationMs);
	}
}
