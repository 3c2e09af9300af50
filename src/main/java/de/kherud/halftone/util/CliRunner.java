package de.kherud.halftone.util;

import java.io.PrintStream;

/**
 * Runs command-line entry points and maps their exceptions to exit codes,
 * so the entry points themselves can throw instead of calling System.exit.
 */
public final class CliRunner {

	public static final int EXIT_OK = 0;
	/** Invalid arguments or processing options. */
	public static final int EXIT_USAGE = 1;
	public static final int EXIT_FATAL = 2;

	private CliRunner() {
	}

	@FunctionalInterface
	public interface CliApplication {
		void run(String[] args) throws Exception;
	}

	/**
	 * Run and terminate the JVM with the mapped exit code on failure.
	 */
	public static void runWithExit(CliApplication app, String[] args) {
		int code = run(app, args, System.err, true);
		if (code != EXIT_OK) {
			System.exit(code);
		}
	}

	/**
	 * Run without System.exit, for tests and embedding.
	 *
	 * @return {@link #EXIT_OK}, {@link #EXIT_USAGE} or {@link #EXIT_FATAL}
	 */
	public static int runWithoutExit(CliApplication app, String[] args) {
		return run(app, args, System.err, false);
	}

	static int run(CliApplication app, String[] args, PrintStream err, boolean printStackTrace) {
		try {
			app.run(args);
			return EXIT_OK;
		} catch (IllegalArgumentException e) {
			err.println("Error: " + e.getMessage());
			return EXIT_USAGE;
		} catch (Exception e) {
			err.println("Fatal error: " + e.getMessage());
			if (printStackTrace) {
				e.printStackTrace(err);
			}
			return EXIT_FATAL;
		}
	}
}
