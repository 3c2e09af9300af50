package de.kherud.halftone.png;

/**
 * Contents of a PNG {@code pHYs} chunk.
 */
public final class PhysicalResolution {

	public static final int UNIT_UNKNOWN = 0;
	public static final int UNIT_METER = 1;

	private static final double METERS_PER_INCH = 0.0254;

	private final long pixelsPerUnitX;
	private final long pixelsPerUnitY;
	private final int unit;

	public PhysicalResolution(long pixelsPerUnitX, long pixelsPerUnitY, int unit) {
		this.pixelsPerUnitX = pixelsPerUnitX;
		this.pixelsPerUnitY = pixelsPerUnitY;
		this.unit = unit;
	}

	/**
	 * Resolution in dots per inch, stored as pixels per meter: {@code round(dpi / 0.0254)} on both axes.
	 */
	public static PhysicalResolution ofDpi(double dpi) {
		long ppm = Math.round(dpi / METERS_PER_INCH);
		return new PhysicalResolution(ppm, ppm, UNIT_METER);
	}

	public long getPixelsPerUnitX() { return pixelsPerUnitX; }
	public long getPixelsPerUnitY() { return pixelsPerUnitY; }
	public int getUnit() { return unit; }

	public boolean isMetric() {
		return unit == UNIT_METER;
	}

	/**
	 * Horizontal resolution in DPI, or -1 when the unit is not meters (aspect ratio only).
	 */
	public double getDpiX() {
		return isMetric() ? pixelsPerUnitX * METERS_PER_INCH : -1;
	}

	public double getDpiY() {
		return isMetric() ? pixelsPerUnitY * METERS_PER_INCH : -1;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof PhysicalResolution)) return false;
		PhysicalResolution that = (PhysicalResolution) o;
		return pixelsPerUnitX == that.pixelsPerUnitX && pixelsPerUnitY == that.pixelsPerUnitY && unit == that.unit;
	}

	@Override
	public int hashCode() {
		int result = Long.hashCode(pixelsPerUnitX);
		result = 31 * result + Long.hashCode(pixelsPerUnitY);
		return 31 * result + unit;
	}

	@Override
	public String toString() {
		if (isMetric()) {
			return String.format("PhysicalResolution{%dx%d px/m, %.1fx%.1f DPI}",
				pixelsPerUnitX, pixelsPerUnitY, getDpiX(), getDpiY());
		}
		return String.format("PhysicalResolution{%dx%d px/unit, unit=%d}", pixelsPerUnitX, pixelsPerUnitY, unit);
	}
}
