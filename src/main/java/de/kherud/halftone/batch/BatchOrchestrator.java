package de.kherud.halftone.batch;

import de.kherud.halftone.HalftoneException;
import de.kherud.halftone.ProcessingOptions;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Runs batches of halftone jobs on a dedicated worker thread.
 *
 * Jobs run strictly one after another in submission order. Each finished job produces
 * one {@link BatchProgress} on the listener, and the returned future completes with one
 * {@link BatchResponse} holding a result for every job. A job that fails degrades to a
 * fallback result; it never aborts the batch.
 *
 * Only one batch may run at a time; {@link #submit(BatchRequest)} rejects a second one.
 *
 * <pre>{@code
 * try (BatchOrchestrator orchestrator = new BatchOrchestrator(new HalftonePipeline(),
 *         progress -> System.out.println(progress))) {
 *     BatchResponse response = orchestrator.submit(new BatchRequest(jobs, options)).join();
 * }
 * }</pre>
 */
public class BatchOrchestrator implements AutoCloseable {
	private static final System.Logger logger = System.getLogger(BatchOrchestrator.class.getName());

	public enum State {
		IDLE, RUNNING, COMPLETED
	}

	private final HalftonePipeline pipeline;
	private final Consumer<BatchProgress> progressListener;
	private final ExecutorService executor;
	private final boolean ownsExecutor;
	private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
	private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

	public BatchOrchestrator(HalftonePipeline pipeline, Consumer<BatchProgress> progressListener) {
		this(pipeline, progressListener, createExecutor(), true);
	}

	/**
	 * Use a caller-supplied worker. The executor is not shut down by {@link #close()}.
	 */
	public BatchOrchestrator(HalftonePipeline pipeline, Consumer<BatchProgress> progressListener,
							 ExecutorService executor) {
		this(pipeline, progressListener, executor, false);
	}

	private BatchOrchestrator(HalftonePipeline pipeline, Consumer<BatchProgress> progressListener,
							  ExecutorService executor, boolean ownsExecutor) {
		this.pipeline = Objects.requireNonNull(pipeline, "Pipeline cannot be null");
		this.progressListener = progressListener != null ? progressListener : progress -> { };
		this.executor = Objects.requireNonNull(executor, "Executor cannot be null");
		this.ownsExecutor = ownsExecutor;
	}

	private static ExecutorService createExecutor() {
		ThreadFactory threadFactory = new ThreadFactory() {
			private final AtomicInteger counter = new AtomicInteger(0);
			@Override
			public Thread newThread(Runnable r) {
				Thread thread = new Thread(r);
				thread.setName("halftone-worker-" + counter.getAndIncrement());
				thread.setDaemon(true);
				return thread;
			}
		};
		return Executors.newSingleThreadExecutor(threadFactory);
	}

	/**
	 * Validate the options and start the batch on the worker.
	 *
	 * @return future completed with the batch response
	 * @throws de.kherud.halftone.InvalidOptionsException if the options are out of range; no job runs
	 * @throws IllegalStateException if another batch is still running
	 */
	public CompletableFuture<BatchResponse> submit(BatchRequest request) {
		Objects.requireNonNull(request, "Request cannot be null");
		request.getOptions().validate();

		State previous = state.get();
		if (previous == State.RUNNING) {
			throw new IllegalStateException("A batch is already running");
		}
		cancelRequested.set(false);
		if (!state.compareAndSet(previous, State.RUNNING)) {
			throw new IllegalStateException("A batch is already running");
		}

		try {
			return CompletableFuture.supplyAsync(() -> execute(request), executor);
		} catch (RejectedExecutionException e) {
			state.set(previous);
			throw e;
		}
	}

	/**
	 * Ask the running batch to stop. Checked between jobs; jobs not yet started
	 * get {@link HalftoneResult.Status#CANCELLED} results.
	 */
	public void cancel() {
		if (state.get() == State.RUNNING) {
			cancelRequested.set(true);
		}
	}

	public State getState() {
		return state.get();
	}

	public boolean isRunning() {
		return state.get() == State.RUNNING;
	}

	private BatchResponse execute(BatchRequest request) {
		long start = System.nanoTime();
		ProcessingOptions options = request.getOptions();
		List<HalftoneJob> jobs = request.getJobs();
		int total = jobs.size();
		List<HalftoneResult> results = new ArrayList<>(total);

		logger.log(System.Logger.Level.INFO, String.format("Starting batch of %d images with %s", total, options));

		try {
			for (int i = 0; i < total; i++) {
				HalftoneJob job = jobs.get(i);
				HalftoneResult result = cancelRequested.get()
					? HalftoneResult.cancelled(job)
					: runJob(job, options);
				results.add(result);
				notifyProgress(new BatchProgress(i + 1, total, job.getId(), result.getStatus()));
			}
		} finally {
			state.set(State.COMPLETED);
		}

		double durationMs = (System.nanoTime() - start) / 1_000_000.0;
		BatchResponse response = new BatchResponse(results, durationMs);
		logger.log(System.Logger.Level.INFO, "Batch finished: " + response);
		return response;
	}

	private HalftoneResult runJob(HalftoneJob job, ProcessingOptions options) {
		try {
			return pipeline.process(job, options);
		} catch (HalftoneException e) {
			logger.log(System.Logger.Level.WARNING, String.format("Job %s failed, keeping original: %s",
				job.getId(), e.getMessage()));
			return HalftoneResult.fallback(job, e.getMessage());
		} catch (RuntimeException | OutOfMemoryError | StackOverflowError e) {
			logger.log(System.Logger.Level.ERROR, "Unexpected failure in job " + job.getId(), e);
			return HalftoneResult.fallback(job, e.getClass().getSimpleName() + ": " + e.getMessage());
		}
	}

	private void notifyProgress(BatchProgress progress) {
		try {
			progressListener.accept(progress);
		} catch (RuntimeException e) {
			logger.log(System.Logger.Level.WARNING, "Progress listener failed at " + progress, e);
		}
	}

	@Override
	public void close() {
		if (ownsExecutor) {
			executor.shutdown();
		}
	}
}
