package org.doube.dicompng;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Random;

/**
 * Static methods to generate sample grids and DICOM files for testing
 */
public class TestDataMaker {

	/**
	 * Grid of integer samples drawn uniformly from [0, max]
	 *
	 * @param width
	 * @param height
	 * @param max
	 * @param seed
	 * @return a 16-bit grid
	 */
	public static SampleGrid uniform(final int width, final int height, final int max, final long seed) {
		final Random random = new Random(seed);
		final float[] samples = new float[width * height];
		for (int i = 0; i < samples.length; i++)
			samples[i] = random.nextInt(max + 1);
		return new SampleGrid(width, height, samples, 16);
	}

	/**
	 * @param width
	 * @param height
	 * @param value
	 * @return grid with the same value everywhere
	 */
	public static SampleGrid constant(final int width, final int height, final float value) {
		final float[] samples = new float[width * height];
		java.util.Arrays.fill(samples, value);
		return new SampleGrid(width, height, samples, 16);
	}

	/**
	 * Horizontal ramp, sample value equal to x * step
	 *
	 * @param width
	 * @param height
	 * @param step
	 * @return grid increasing from left to right
	 */
	public static SampleGrid ramp(final int width, final int height, final float step) {
		final float[] samples = new float[width * height];
		for (int y = 0; y < height; y++)
			for (int x = 0; x < width; x++)
				samples[y * width + x] = x * step;
		return new SampleGrid(width, height, samples, 16);
	}

	/**
	 * Unsigned 16-bit pixel values drawn uniformly from [0, max]
	 *
	 * @param n
	 * @param max
	 * @param seed
	 * @return pixel values
	 */
	public static short[] uniformPixels(final int n, final int max, final long seed) {
		final Random random = new Random(seed);
		final short[] pixels = new short[n];
		for (int i = 0; i < n; i++)
			pixels[i] = (short) random.nextInt(max + 1);
		return pixels;
	}

	/**
	 * Write a minimal single-frame, explicit VR little endian, 16-bit
	 * MONOCHROME2 DICOM file
	 *
	 * @param file
	 * @param width
	 * @param height
	 * @param bitsStored
	 * @param pixels
	 *            row-major, width * height values
	 * @throws IOException
	 */
	public static void writeDicom(final File file, final int width, final int height, final int bitsStored,
			final short[] pixels) throws IOException {
		writeDicom(file, width, height, bitsStored, 1, pixels);
	}

	/**
	 * Write a minimal explicit VR little endian, 16-bit MONOCHROME2 DICOM file
	 * with pixel spacing 0.5 mm
	 *
	 * @param file
	 * @param width
	 * @param height
	 * @param bitsStored
	 * @param frames
	 * @param pixels
	 *            frame after frame, row-major, width * height * frames values
	 * @throws IOException
	 */
	public static void writeDicom(final File file, final int width, final int height, final int bitsStored,
			final int frames, final short[] pixels) throws IOException {
		if (pixels.length != width * height * frames)
			throw new IllegalArgumentException("Wrong number of pixels");
		final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		bytes.write(new byte[128]);
		bytes.write("DICM".getBytes(StandardCharsets.US_ASCII));

		stringElement(bytes, 0x0002, 0x0010, "UI", "1.2.840.10008.1.2.1");
		stringElement(bytes, 0x0008, 0x0060, "CS", "OT");
		ushortElement(bytes, 0x0028, 0x0002, 1);
		stringElement(bytes, 0x0028, 0x0004, "CS", "MONOCHROME2");
		if (frames > 1)
			stringElement(bytes, 0x0028, 0x0008, "IS", Integer.toString(frames));
		ushortElement(bytes, 0x0028, 0x0010, height);
		ushortElement(bytes, 0x0028, 0x0011, width);
		stringElement(bytes, 0x0028, 0x0030, "DS", "0.5\\0.5");
		ushortElement(bytes, 0x0028, 0x0100, 16);
		ushortElement(bytes, 0x0028, 0x0101, bitsStored);
		ushortElement(bytes, 0x0028, 0x0102, bitsStored - 1);
		ushortElement(bytes, 0x0028, 0x0103, 0);

		tag(bytes, 0x7FE0, 0x0010);
		bytes.write("OW".getBytes(StandardCharsets.US_ASCII));
		le16(bytes, 0);
		le32(bytes, pixels.length * 2);
		for (final short p : pixels)
			le16(bytes, p);

		final OutputStream out = new FileOutputStream(file);
		try {
			bytes.writeTo(out);
		} finally {
			out.close();
		}
	}

	private static void stringElement(final ByteArrayOutputStream out, final int group, final int element,
			final String vr, final String value) throws IOException {
		byte[] v = value.getBytes(StandardCharsets.US_ASCII);
		if (v.length % 2 != 0) {
			final byte[] padded = java.util.Arrays.copyOf(v, v.length + 1);
			padded[v.length] = (byte) ("UI".equals(vr) ? 0 : ' ');
			v = padded;
		}
		tag(out, group, element);
		out.write(vr.getBytes(StandardCharsets.US_ASCII));
		le16(out, v.length);
		out.write(v);
	}

	private static void ushortElement(final ByteArrayOutputStream out, final int group, final int element,
			final int value) {
		tag(out, group, element);
		out.write('U');
		out.write('S');
		le16(out, 2);
		le16(out, value);
	}

	private static void tag(final ByteArrayOutputStream out, final int group, final int element) {
		le16(out, group);
		le16(out, element);
	}

	private static void le16(final ByteArrayOutputStream out, final int value) {
		out.write(value & 0xff);
		out.write((value >> 8) & 0xff);
	}

	private static void le32(final ByteArrayOutputStream out, final int value) {
		le16(out, value & 0xffff);
		le16(out, (value >> 16) & 0xffff);
	}
}
