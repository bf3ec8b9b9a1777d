package org.doube.dicompng;

/**
 * 8-bit unsigned grid ready for encoding
 */
public class NormalizedImage {

	private final int width;
	private final int height;
	private final byte[] pixels;

	/**
	 * @param width
	 * @param height
	 * @param pixels
	 *            row-major unsigned bytes, width * height values
	 */
	public NormalizedImage(final int width, final int height, final byte[] pixels) {
		if (pixels == null || pixels.length != width * height)
			throw new IllegalArgumentException("Expected " + width * height + " pixels for a " + width + " x "
					+ height + " image");
		this.width = width;
		this.height = height;
		this.pixels = pixels;
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	public byte[] getPixels() {
		return pixels;
	}

	/**
	 * @param x
	 * @param y
	 * @return pixel value in [0, 255]
	 */
	public int get(final int x, final int y) {
		return pixels[y * width + x] & 0xff;
	}
}
