package org.doube.dicompng;

/**
 * Raw samples of one decoded source image. Only the first frame of a
 * multi-frame source is held.
 */
public class SampleGrid {

	private final int width;
	private final int height;
	private final float[] samples;
	private final int bitDepth;
	private final double pixelWidth;
	private final double pixelHeight;
	private final String unit;
	private final int frames;

	/**
	 * Uncalibrated single-frame grid
	 *
	 * @param width
	 * @param height
	 * @param samples
	 *            row-major, width * height values
	 * @param bitDepth
	 *            native bits per sample
	 */
	public SampleGrid(final int width, final int height, final float[] samples, final int bitDepth) {
		this(width, height, samples, bitDepth, 1, 1, "pixel", 1);
	}

	/**
	 * @param width
	 * @param height
	 * @param samples
	 *            row-major, width * height values
	 * @param bitDepth
	 *            native bits per sample
	 * @param pixelWidth
	 *            spacing between columns
	 * @param pixelHeight
	 *            spacing between rows
	 * @param unit
	 *            unit of the pixel spacing
	 * @param frames
	 *            number of frames in the source; only the first is held
	 */
	public SampleGrid(final int width, final int height, final float[] samples, final int bitDepth,
			final double pixelWidth, final double pixelHeight, final String unit, final int frames) {
		if (width < 1 || height < 1)
			throw new IllegalArgumentException("Grid must be at least 1 x 1, got " + width + " x " + height);
		if (samples == null || samples.length != width * height)
			throw new IllegalArgumentException("Expected " + width * height + " samples for a " + width + " x "
					+ height + " grid");
		this.width = width;
		this.height = height;
		this.samples = samples;
		this.bitDepth = bitDepth;
		this.pixelWidth = pixelWidth;
		this.pixelHeight = pixelHeight;
		this.unit = unit;
		this.frames = frames;
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	/**
	 * @return the row-major samples; callers must not modify them
	 */
	public float[] getSamples() {
		return samples;
	}

	public float get(final int x, final int y) {
		return samples[y * width + x];
	}

	public int getBitDepth() {
		return bitDepth;
	}

	public double getPixelWidth() {
		return pixelWidth;
	}

	public double getPixelHeight() {
		return pixelHeight;
	}

	public String getUnit() {
		return unit;
	}

	public int getFrames() {
		return frames;
	}
}
