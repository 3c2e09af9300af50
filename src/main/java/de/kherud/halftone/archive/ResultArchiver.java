package de.kherud.halftone.archive;

import de.kherud.halftone.batch.HalftoneResult;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/**
 * Packages batch results into a single downloadable stream.
 */
public interface ResultArchiver {

	void write(List<HalftoneResult> results, OutputStream out) throws IOException;
}
