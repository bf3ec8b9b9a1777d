package org.doube.dicompng;

import org.doube.util.Percentiles;

/**
 * Rescales a sample grid to 8 bits through a percentile window.
 *
 * The window's bounds are the low and high percentiles of the grid's own
 * values. Any window or level stored in the file's header is ignored. Each
 * sample s becomes
 *
 * <pre>
 * (int) (255 * clamp((s - low) / (high - low + EPSILON), 0, 1))
 * </pre>
 *
 * so a constant grid maps to 0 everywhere.
 */
public class IntensityNormalizer {

	/** Added to the window width so a zero-width window is still divisible */
	public static final double EPSILON = 1e-6;

	public static final double DEFAULT_LOW_PERCENTILE = 1;

	public static final double DEFAULT_HIGH_PERCENTILE = 99;

	private final double lowPercentile;
	private final double highPercentile;

	public IntensityNormalizer() {
		this(DEFAULT_LOW_PERCENTILE, DEFAULT_HIGH_PERCENTILE);
	}

	/**
	 * @param lowPercentile
	 *            percentile that maps to 0, in [0, 100]
	 * @param highPercentile
	 *            percentile that maps to 255, in [lowPercentile, 100]
	 */
	public IntensityNormalizer(final double lowPercentile, final double highPercentile) {
		if (!(lowPercentile >= 0 && lowPercentile <= highPercentile && highPercentile <= 100))
			throw new IllegalArgumentException("Percentiles must satisfy 0 <= low <= high <= 100, got "
					+ lowPercentile + " and " + highPercentile);
		this.lowPercentile = lowPercentile;
		this.highPercentile = highPercentile;
	}

	/**
	 * Work out the window of a grid
	 *
	 * @param grid
	 * @return the window between the low and high percentiles of the grid's
	 *         values
	 * @throws IllegalArgumentException
	 *             if the grid holds no numeric values
	 */
	public IntensityWindow window(final SampleGrid grid) {
		final double[] bounds = Percentiles.percentiles(grid.getSamples(), lowPercentile, highPercentile);
		return new IntensityWindow(bounds[0], bounds[1]);
	}

	/**
	 * Normalize a grid through its own percentile window
	 *
	 * @param grid
	 * @return an image with the grid's dimensions
	 */
	public NormalizedImage normalize(final SampleGrid grid) {
		return normalize(grid, window(grid));
	}

	/**
	 * Normalize a grid through a given window
	 *
	 * @param grid
	 * @param window
	 * @return an image with the grid's dimensions
	 */
	public NormalizedImage normalize(final SampleGrid grid, final IntensityWindow window) {
		final float[] samples = grid.getSamples();
		final int n = samples.length;
		final byte[] pixels = new byte[n];
		final double low = window.getLow();
		final double range = window.getWidth() + EPSILON;
		for (int i = 0; i < n; i++)
			pixels[i] = (byte) scale(samples[i], low, range);
		return new NormalizedImage(grid.getWidth(), grid.getHeight(), pixels);
	}

	/**
	 * Map one sample into [0, 255]
	 *
	 * @param sample
	 * @param window
	 * @return the 8-bit value; NaN maps to 0
	 */
	public static int scale(final double sample, final IntensityWindow window) {
		return scale(sample, window.getLow(), window.getWidth() + EPSILON);
	}

	private static int scale(final double sample, final double low, final double range) {
		double v = (sample - low) / range;
		if (!(v > 0))
			return 0;
		if (v > 1)
			v = 1;
		return (int) (v * 255);
	}

	public double getLowPercentile() {
		return lowPercentile;
	}

	public double getHighPercentile() {
		return highPercentile;
	}
}
