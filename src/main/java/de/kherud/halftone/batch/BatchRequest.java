package de.kherud.halftone.batch;

import de.kherud.halftone.ProcessingOptions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Jobs to run under one shared set of options.
 */
public final class BatchRequest {

	private final List<HalftoneJob> jobs;
	private final ProcessingOptions options;

	public BatchRequest(List<HalftoneJob> jobs, ProcessingOptions options) {
		this.jobs = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(jobs, "Jobs cannot be null")));
		this.options = Objects.requireNonNull(options, "Options cannot be null");
	}

	public List<HalftoneJob> getJobs() { return jobs; }
	public ProcessingOptions getOptions() { return options; }
	public int size() { return jobs.size(); }
}
