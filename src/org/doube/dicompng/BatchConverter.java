package org.doube.dicompng;

import java.io.File;
import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.util.concurrent.atomic.AtomicReference;

import org.doube.dicompng.io.DicomSampleReader;
import org.doube.dicompng.io.DicomScanner;
import org.doube.dicompng.io.PngWriter;
import org.doube.dicompng.io.RasterEncoder;
import org.doube.dicompng.io.SampleDecoder;
import org.doube.util.Multithreader;

import ij.IJ;

/**
 * Converts every DICOM file under an input directory to an 8-bit PNG in a
 * single output directory.
 *
 * Outputs are named after their source with the extension replaced, and
 * subdirectories are flattened, so sources with the same name overwrite each
 * other's output and the last one converted wins.
 *
 * A file that cannot be decoded or written is logged and skipped. Problems
 * with the input or output directory, and errors reading the directory tree,
 * stop the whole run.
 */
public class BatchConverter {

	private final SampleDecoder decoder;
	private final RasterEncoder encoder;
	private final IntensityNormalizer normalizer;
	private final int threads;
	private volatile boolean cancelled;

	/**
	 * Converter using ImageJ's DICOM reader and PNG writer
	 *
	 * @param options
	 */
	public BatchConverter(final ConversionOptions options) {
		this(new DicomSampleReader(), new PngWriter(), options);
	}

	/**
	 * @param decoder
	 *            reads source samples
	 * @param encoder
	 *            writes the normalized images
	 * @param options
	 * @throws IllegalArgumentException
	 *             if the options are invalid
	 */
	public BatchConverter(final SampleDecoder decoder, final RasterEncoder encoder,
			final ConversionOptions options) {
		options.validate();
		this.decoder = decoder;
		this.encoder = encoder;
		this.normalizer = new IntensityNormalizer(options.getLowPercentile(), options.getHighPercentile());
		this.threads = options.getThreads();
	}

	/**
	 * Convert all DICOM files below inputRoot
	 *
	 * @param inputRoot
	 *            directory to scan recursively
	 * @param outputRoot
	 *            directory to write into, created if absent
	 * @return counts of converted and skipped files
	 * @throws IOException
	 *             if the input root is missing or unreadable, the output root
	 *             cannot be created or written, or the directory tree cannot
	 *             be read
	 */
	public ConversionReport convert(final File inputRoot, final File outputRoot) throws IOException {
		checkInputRoot(inputRoot);
		createOutputRoot(outputRoot);

		final ConversionReport report = new ConversionReport(outputRoot);
		final AtomicReference<IOException> scanFailure = new AtomicReference<IOException>();
		final DicomScanner scanner = new DicomScanner(inputRoot);
		try {
			Multithreader.startTask(new Runnable() {
				@Override
				public void run() {
					while (scanFailure.get() == null) {
						if (isCancelled()) {
							report.cancelled();
							return;
						}
						final File source;
						try {
							source = scanner.next();
						} catch (final IOException e) {
							scanFailure.compareAndSet(null, e);
							return;
						}
						if (source == null)
							return;
						convertFile(source, outputRoot, report);
					}
				}
			}, threads);
		} finally {
			scanner.close();
		}

		final IOException e = scanFailure.get();
		if (e != null)
			throw e;
		IJ.showStatus("Converted " + report.getConverted() + " files");
		return report;
	}

	/**
	 * Convert one file, recording the outcome in the report. Decode and write
	 * failures are logged rather than thrown.
	 *
	 * @param source
	 * @param outputRoot
	 * @param report
	 */
	void convertFile(final File source, final File outputRoot, final ConversionReport report) {
		IJ.showStatus("Converting " + source.getName());
		final File destination = outputFile(source, outputRoot, encoder.getExtension());
		try {
			final SampleGrid grid = decoder.decode(source);
			if (grid.getFrames() > 1)
				IJ.log(source.getName() + ": " + grid.getFrames() + " frames, converting the first only");
			if (grid.getPixelWidth() != grid.getPixelHeight())
				IJ.log(source.getName() + ": pixels are " + grid.getPixelWidth() + " x " + grid.getPixelHeight() + " "
						+ grid.getUnit() + ", preview is not resampled");
			encoder.encode(normalizer.normalize(grid), destination);
			report.converted();
		} catch (final IOException e) {
			skip(source, e, report);
		} catch (final RuntimeException e) {
			skip(source, e, report);
		}
	}

	private static void skip(final File source, final Exception e, final ConversionReport report) {
		final String reason = e.getMessage() != null ? e.getMessage() : e.toString();
		IJ.log("Skipped " + source.getPath() + ": " + reason);
		report.failed(source, reason);
	}

	/**
	 * Output file for a source: its base name with the given extension, placed
	 * directly in the output root
	 *
	 * @param source
	 * @param outputRoot
	 * @param extension
	 *            including the dot
	 * @return the destination file
	 */
	public static File outputFile(final File source, final File outputRoot, final String extension) {
		final String name = source.getName();
		final int dot = name.lastIndexOf('.');
		final String base = dot > 0 ? name.substring(0, dot) : name;
		return new File(outputRoot, base + extension);
	}

	private static void checkInputRoot(final File inputRoot) throws IOException {
		if (!inputRoot.exists())
			throw new NoSuchFileException(inputRoot.getPath(), null, "Input directory does not exist");
		if (!inputRoot.isDirectory())
			throw new NotDirectoryException(inputRoot.getPath());
		if (!Files.isReadable(inputRoot.toPath()))
			throw new AccessDeniedException(inputRoot.getPath(), null, "Input directory is not readable");
	}

	/**
	 * Create the output root if it is absent. Safe to call concurrently, an
	 * existing directory is not an error.
	 *
	 * @param outputRoot
	 * @throws IOException
	 *             if the directory cannot be created or is not writable
	 */
	static void createOutputRoot(final File outputRoot) throws IOException {
		Files.createDirectories(outputRoot.toPath());
		if (!Files.isWritable(outputRoot.toPath()))
			throw new AccessDeniedException(outputRoot.getPath(), null, "Output directory is not writable");
	}

	/**
	 * Stop the run before the next file. Files already being converted are
	 * finished.
	 */
	public void cancel() {
		cancelled = true;
	}

	/**
	 * @return true if {@link #cancel()} was called or the running thread was
	 *         interrupted
	 */
	public boolean isCancelled() {
		return cancelled || Thread.currentThread().isInterrupted();
	}
}
