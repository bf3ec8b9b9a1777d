package org.doube.dicompng.io;

import java.io.File;
import java.io.IOException;

import org.doube.dicompng.NormalizedImage;

import ij.IJ;
import ij.ImagePlus;
import ij.io.FileSaver;
import ij.process.ByteProcessor;

/**
 * Writes normalized images as 8-bit greyscale PNG with ImageJ's FileSaver
 */
public class PngWriter implements RasterEncoder {

	public static final String EXTENSION = ".png";

	@Override
	public void encode(final NormalizedImage image, final File destination) throws IOException {
		final ByteProcessor bp = new ByteProcessor(image.getWidth(), image.getHeight(), image.getPixels());
		final ImagePlus imp = new ImagePlus(destination.getName(), bp);
		IJ.redirectErrorMessages();
		// FileSaver reports some failures only to the log
		if (!new FileSaver(imp).saveAsPng(destination.getPath()) || !destination.isFile())
			throw new IOException("Could not write " + destination.getPath());
	}

	@Override
	public String getExtension() {
		return EXTENSION;
	}
}
