package org.doube.dicompng;

/**
 * Range of sample values that is stretched over the full 8-bit output range.
 * Samples below low map to 0, samples above high map to 255.
 */
public class IntensityWindow {

	private final double low;
	private final double high;

	public IntensityWindow(final double low, final double high) {
		if (!(low <= high))
			throw new IllegalArgumentException("Window low bound " + low + " exceeds high bound " + high);
		this.low = low;
		this.high = high;
	}

	public double getLow() {
		return low;
	}

	public double getHigh() {
		return high;
	}

	public double getWidth() {
		return high - low;
	}

	/**
	 * @return true if all windowed samples share a single value
	 */
	public boolean isDegenerate() {
		return low == high;
	}

	@Override
	public String toString() {
		return "[" + low + ", " + high + "]";
	}
}
