package org.doube.dicompng.io;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;

import org.doube.dicompng.SampleGrid;
import org.doube.util.ImageCheck;

import ij.IJ;
import ij.ImagePlus;
import ij.measure.Calibration;
import ij.plugin.DICOM;
import ij.process.ImageProcessor;

/**
 * Decodes DICOM files with ImageJ's DICOM reader. Only the first frame is
 * kept; colour images are reduced to their luminance.
 */
public class DicomSampleReader implements SampleDecoder {

	/** Bits Stored */
	private static final String BITS_STORED = "0028,0101";

	@Override
	public SampleGrid decode(final File source) throws IOException {
		if (!source.isFile())
			throw new FileNotFoundException(source.getPath());
		final ImagePlus imp = open(source);
		final int frames = imp.getStackSize();
		final ImageProcessor ip = imp.getStack().getProcessor(1);
		final float[] samples = toFloat(ip);
		final int bitDepth = ImageCheck.getDicomInt(imp, BITS_STORED, imp.getBitDepth());
		final Calibration cal = imp.getCalibration();
		return new SampleGrid(ip.getWidth(), ip.getHeight(), samples, bitDepth, cal.pixelWidth,
				cal.pixelHeight, cal.getUnit(), frames);
	}

	/**
	 * Open a file with ImageJ's DICOM reader, sending its error dialogs to
	 * the log
	 *
	 * @param source
	 * @return the opened image
	 * @throws IOException
	 *             if ImageJ could not read any pixels from the file
	 */
	private static ImagePlus open(final File source) throws IOException {
		final DICOM dicom = new DICOM();
		IJ.redirectErrorMessages();
		try {
			dicom.open(source.getPath());
		} catch (final RuntimeException e) {
			throw new IOException("Cannot decode " + source.getName() + ": " + e, e);
		}
		if (dicom.getWidth() == 0 || dicom.getHeight() == 0 || dicom.getStackSize() == 0)
			throw new IOException("Not a readable DICOM file: " + source.getName());
		return dicom;
	}

	/**
	 * Copy of the processor's raw values as floats. Calibration is not
	 * applied, the values are the stored samples.
	 *
	 * @param ip
	 * @return row-major float samples
	 */
	private static float[] toFloat(final ImageProcessor ip) {
		final int n = ip.getPixelCount();
		final Object pixels = ip.getPixels();
		final float[] samples = new float[n];
		if (pixels instanceof byte[]) {
			final byte[] b = (byte[]) pixels;
			for (int i = 0; i < n; i++)
				samples[i] = b[i] & 0xff;
		} else if (pixels instanceof short[]) {
			final short[] s = (short[]) pixels;
			for (int i = 0; i < n; i++)
				samples[i] = s[i] & 0xffff;
		} else if (pixels instanceof float[]) {
			System.arraycopy((float[]) pixels, 0, samples, 0, n);
		} else {
			// RGB
			final float[] luminance = (float[]) ip.convertToFloat().getPixels();
			System.arraycopy(luminance, 0, samples, 0, n);
		}
		return samples;
	}
}
