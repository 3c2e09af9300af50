package de.kherud.halftone.batch;

/**
 * Emitted once per finished job; {@code current} runs from 1 to {@code total}.
 */
public final class BatchProgress {

	private final int current;
	private final int total;
	private final String jobId;
	private final HalftoneResult.Status status;

	public BatchProgress(int current, int total, String jobId, HalftoneResult.Status status) {
		this.current = current;
		this.total = total;
		this.jobId = jobId;
		this.status = status;
	}

	public int getCurrent() { return current; }
	public int getTotal() { return total; }
	public String getJobId() { return jobId; }
	public HalftoneResult.Status getStatus() { return status; }

	public double getFraction() {
		return total > 0 ? (double) current / total : 1.0;
	}

	public int getPercent() {
		return (int) Math.round(getFraction() * 100);
	}

	@Override
	public String toString() {
		return String.format("[%d/%d] %s %s", current, total, jobId, status);
	}
}
