import java.io.File;
import java.io.IOException;

import org.doube.dicompng.BatchConverter;
import org.doube.dicompng.ConversionOptions;
import org.doube.dicompng.ConversionReport;
import org.doube.util.ImageCheck;

import ij.IJ;
import ij.gui.GenericDialog;
import ij.plugin.PlugIn;

/**
 * Converts a directory tree of DICOM files to 8-bit PNG previews, stretching
 * each image between percentiles of its own pixel values.
 */
public class DICOM_To_PNG implements PlugIn {

	public void run(String arg) {
		if (!ImageCheck.checkIJVersion())
			return;
		final String inputDir = IJ.getDirectory("Choose the DICOM directory");
		if (inputDir == null)
			return;
		final String outputDir = IJ.getDirectory("Choose the PNG output directory");
		if (outputDir == null)
			return;

		final ConversionOptions options = ConversionOptions.fromPrefs();
		GenericDialog gd = new GenericDialog("DICOM to PNG");
		gd.addNumericField("Low percentile", options.getLowPercentile(), 1, 5, "%");
		gd.addNumericField("High percentile", options.getHighPercentile(), 1, 5, "%");
		gd.addNumericField("Threads", options.getThreads(), 0);
		gd.addMessage("Files in subdirectories are all written to the\n"
				+ "output directory; files with the same name overwrite each other.");
		gd.showDialog();
		if (gd.wasCanceled())
			return;
		options.setLowPercentile(gd.getNextNumber());
		options.setHighPercentile(gd.getNextNumber());
		options.setThreads((int) gd.getNextNumber());
		try {
			options.validate();
		} catch (IllegalArgumentException e) {
			IJ.error("DICOM to PNG", e.getMessage());
			return;
		}
		options.savePrefs();

		final long start = System.currentTimeMillis();
		ConversionReport report;
		try {
			report = new BatchConverter(options).convert(new File(inputDir), new File(outputDir));
		} catch (IOException e) {
			IJ.error("DICOM to PNG", "Conversion failed:\n" + e);
			return;
		}
		IJ.log(report.summary());
		IJ.showStatus("DICOM to PNG done in " + IJ.d2s((System.currentTimeMillis() - start) / 1000.0, 1) + " s");
		return;
	}
}
