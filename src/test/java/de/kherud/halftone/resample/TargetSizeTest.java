package de.kherud.halftone.resample;

import de.kherud.halftone.ProcessingOptions;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class TargetSizeTest {

	@Test
	public void testPhysicalWidthToPixels() {
		ProcessingOptions options = ProcessingOptions.builder().outputWidthCm(10).printDpi(300).build();
		TargetSize size = TargetSize.compute(4000, 3000, options);
		assertEquals(1181, size.getWidth());
		assertEquals(886, size.getHeight());
		assertEquals(886 / 300.0 * 2.54, size.getHeightCm(), 1e-9);
		assertEquals(10.0, size.getWidthCm(), 1e-9);
		assertEquals(300, size.getDpi());
	}

	@Test
	public void testHeightFollowsSourceAspect() {
		ProcessingOptions options = ProcessingOptions.builder().outputWidthCm(2.54).printDpi(100).build();
		assertEquals(50, TargetSize.compute(200, 100, options).getHeight());
		assertEquals(200, TargetSize.compute(100, 200, options).getHeight());
		assertEquals(100, TargetSize.compute(7, 7, options).getHeight());
	}

	@Test
	public void testToStringShowsPhysicalSize() {
		ProcessingOptions options = ProcessingOptions.builder().outputWidthCm(2.54).printDpi(100).build();
		String text = TargetSize.compute(200, 100, options).toString();
		assertTrue(text, text.contains("100x50 px"));
		assertTrue(text, text.contains("100 DPI"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testRejectsEmptySource() {
		TargetSize.compute(0, 10, ProcessingOptions.defaults());
	}
}
