package org.doube.dicompng;

import ij.Prefs;

/**
 * Settings for a batch conversion, stored in ImageJ's preferences
 */
public class ConversionOptions {

	public static final String LOW_PERCENTILE_KEY = "dicompng.percentile.low";
	public static final String HIGH_PERCENTILE_KEY = "dicompng.percentile.high";
	public static final String THREADS_KEY = "dicompng.threads";

	private double lowPercentile = IntensityNormalizer.DEFAULT_LOW_PERCENTILE;
	private double highPercentile = IntensityNormalizer.DEFAULT_HIGH_PERCENTILE;
	private int threads = 1;

	/**
	 * @return options with the values in ImageJ's preferences, or the
	 *         defaults where no preference is set
	 */
	public static ConversionOptions fromPrefs() {
		final ConversionOptions options = new ConversionOptions();
		options.setLowPercentile(Prefs.get(LOW_PERCENTILE_KEY, options.lowPercentile));
		options.setHighPercentile(Prefs.get(HIGH_PERCENTILE_KEY, options.highPercentile));
		options.setThreads((int) Prefs.get(THREADS_KEY, options.threads));
		return options;
	}

	/**
	 * Override values with Java system properties of the same keys as the
	 * preferences, e.g. -Ddicompng.threads=4
	 *
	 * @return this
	 * @throws IllegalArgumentException
	 *             if a percentile is not a number or the thread count is
	 *             not an integer
	 */
	public ConversionOptions withSystemProperties() {
		setLowPercentile(doubleProperty(LOW_PERCENTILE_KEY, lowPercentile));
		setHighPercentile(doubleProperty(HIGH_PERCENTILE_KEY, highPercentile));
		setThreads(intProperty(THREADS_KEY, threads));
		return this;
	}

	/**
	 * Store the current values in ImageJ's preferences
	 */
	public void savePrefs() {
		Prefs.set(LOW_PERCENTILE_KEY, lowPercentile);
		Prefs.set(HIGH_PERCENTILE_KEY, highPercentile);
		Prefs.set(THREADS_KEY, threads);
		Prefs.savePreferences();
	}

	/**
	 * @throws IllegalArgumentException
	 *             if the percentiles are out of order or out of [0, 100], or
	 *             there is less than one thread
	 */
	public void validate() {
		if (!(lowPercentile >= 0 && lowPercentile <= highPercentile && highPercentile <= 100))
			throw new IllegalArgumentException("Percentiles must satisfy 0 <= low <= high <= 100, got "
					+ lowPercentile + " and " + highPercentile);
		if (threads < 1)
			throw new IllegalArgumentException("Need at least one thread, got " + threads);
	}

	private static double doubleProperty(final String key, final double defaultValue) {
		final String value = System.getProperty(key);
		if (value == null || value.trim().isEmpty())
			return defaultValue;
		try {
			return Double.parseDouble(value.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("System property " + key + " is not a number: " + value, e);
		}
	}

	private static int intProperty(final String key, final int defaultValue) {
		final String value = System.getProperty(key);
		if (value == null || value.trim().isEmpty())
			return defaultValue;
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("System property " + key + " is not an integer: " + value, e);
		}
	}

	public double getLowPercentile() {
		return lowPercentile;
	}

	public void setLowPercentile(final double lowPercentile) {
		this.lowPercentile = lowPercentile;
	}

	public double getHighPercentile() {
		return highPercentile;
	}

	public void setHighPercentile(final double highPercentile) {
		this.highPercentile = highPercentile;
	}

	public int getThreads() {
		return threads;
	}

	public void setThreads(final int threads) {
		this.threads = threads;
	}
}
