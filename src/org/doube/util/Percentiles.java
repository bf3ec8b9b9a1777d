package org.doube.util;

import java.util.Arrays;

/**
 * Percentiles of pixel value distributions
 */
public class Percentiles {

	/**
	 * Calculate several percentiles of an array of pixel values in one pass.
	 * NaN values are ignored. The input array is not modified.
	 *
	 * @param values
	 *            pixel values in any order
	 * @param percentiles
	 *            requested percentiles, each in the range [0, 100]
	 * @return the percentile values, in the order requested
	 * @throws IllegalArgumentException
	 *             if there are no non-NaN values or a percentile is out of
	 *             range
	 */
	public static double[] percentiles(final float[] values, final double... percentiles) {
		final float[] sorted = sortedFinite(values);
		final double[] result = new double[percentiles.length];
		for (int i = 0; i < percentiles.length; i++)
			result[i] = percentileOfSorted(sorted, percentiles[i]);
		return result;
	}

	/**
	 * Calculate a single percentile of an array of pixel values
	 *
	 * @param values
	 * @param percentile
	 *            in the range [0, 100]
	 * @return the percentile value
	 */
	public static double percentile(final float[] values, final double percentile) {
		return percentiles(values, percentile)[0];
	}

	/**
	 * Percentile of an already sorted array, interpolating linearly between
	 * the two closest ranks. Rank is percentile / 100 * (n - 1), so the 0th
	 * percentile is the minimum and the 100th the maximum.
	 *
	 * @param sorted
	 *            values in ascending order
	 * @param percentile
	 *            in the range [0, 100]
	 * @return interpolated value at the requested percentile
	 */
	public static double percentileOfSorted(final float[] sorted, final double percentile) {
		if (sorted.length == 0)
			throw new IllegalArgumentException("Cannot take a percentile of no values");
		if (!(percentile >= 0 && percentile <= 100))
			throw new IllegalArgumentException("Percentile must be between 0 and 100, got " + percentile);
		final double rank = percentile / 100 * (sorted.length - 1);
		final int below = (int) Math.floor(rank);
		final int above = Math.min(below + 1, sorted.length - 1);
		final double fraction = rank - below;
		final double lower = sorted[below];
		return lower + (sorted[above] - lower) * fraction;
	}

	private static float[] sortedFinite(final float[] values) {
		final float[] copy = new float[values.length];
		int n = 0;
		for (final float v : values) {
			if (!Float.isNaN(v))
				copy[n++] = v;
		}
		final float[] sorted = n == copy.length ? copy : Arrays.copyOf(copy, n);
		Arrays.sort(sorted);
		return sorted;
	}
}
