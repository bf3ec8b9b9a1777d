package org.doube.dicompng.io;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

import javax.imageio.ImageIO;

import org.doube.dicompng.NormalizedImage;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class PngWriterTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private final PngWriter writer = new PngWriter();

	private static NormalizedImage gradient(final int width, final int height, final boolean descending) {
		final byte[] pixels = new byte[width * height];
		for (int y = 0; y < height; y++)
			for (int x = 0; x < width; x++)
				pixels[y * width + x] = (byte) ((descending ? width - 1 - x : x) * 255 / (width - 1));
		return new NormalizedImage(width, height, pixels);
	}

	@Test
	public void testEncodeWritesEightBitGrey() throws IOException {
		final NormalizedImage image = gradient(40, 10, false);
		final File file = new File(folder.getRoot(), "out.png");
		writer.encode(image, file);

		final BufferedImage png = ImageIO.read(file);
		assertEquals(40, png.getWidth());
		assertEquals(10, png.getHeight());
		final Raster raster = png.getRaster();
		assertEquals(1, raster.getNumBands());
		assertEquals(8, png.getColorModel().getPixelSize());
		for (int y = 0; y < 10; y++)
			for (int x = 0; x < 40; x++)
				assertEquals(image.get(x, y), raster.getSample(x, y, 0));
	}

	@Test
	public void testEncodeOverwrites() throws IOException {
		final File file = new File(folder.getRoot(), "out.png");
		writer.encode(gradient(16, 4, false), file);
		writer.encode(gradient(16, 4, true), file);
		final Raster raster = ImageIO.read(file).getRaster();
		assertEquals(255, raster.getSample(0, 0, 0));
		assertEquals(0, raster.getSample(15, 0, 0));
	}

	@Test
	public void testEncodeIsRepeatable() throws IOException {
		final File first = new File(folder.getRoot(), "first.png");
		final File second = new File(folder.getRoot(), "second.png");
		writer.encode(gradient(33, 17, false), first);
		writer.encode(gradient(33, 17, false), second);
		assertArrayEquals(Files.readAllBytes(first.toPath()), Files.readAllBytes(second.toPath()));
	}

	@Test
	public void testExtension() {
		assertTrue(writer.getExtension().equals(".png"));
	}

	@Test(expected = IOException.class)
	public void testEncodeIntoMissingDirectory() throws IOException {
		final File file = new File(new File(folder.getRoot(), "absent"), "out.png");
		writer.encode(gradient(4, 4, false), file);
	}
}
