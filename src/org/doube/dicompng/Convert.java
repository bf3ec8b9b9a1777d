package org.doube.dicompng;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;

/**
 * Command line entry point:
 *
 * <pre>
 * convert &lt;input_root&gt; &lt;output_root&gt;
 * </pre>
 *
 * Exits 0 when the batch completes, even if some files were skipped, 1 if
 * the settings or directories could not be used or the batch failed, and 2 on
 * bad arguments.
 */
public class Convert {

	public static final int OK = 0;
	public static final int FAILED = 1;
	public static final int USAGE = 2;

	public static void main(final String[] args) {
		System.exit(run(args, System.out, System.err));
	}

	/**
	 * Run a conversion and print its summary
	 *
	 * @param args
	 *            input root and output root
	 * @param out
	 *            receives the summary
	 * @param err
	 *            receives usage and fatal errors
	 * @return the exit status
	 */
	public static int run(final String[] args, final PrintStream out, final PrintStream err) {
		if (args.length != 2) {
			err.println("Usage: convert <input_root> <output_root>");
			return USAGE;
		}
		final BatchConverter converter;
		try {
			converter = new BatchConverter(ConversionOptions.fromPrefs().withSystemProperties());
		} catch (final IllegalArgumentException e) {
			err.println("Invalid settings: " + e.getMessage());
			return FAILED;
		}
		return run(converter, new File(args[0]), new File(args[1]), out, err);
	}

	/**
	 * Run a conversion with the given converter. Any error that stops the
	 * whole batch is printed and gives {@link #FAILED}.
	 */
	static int run(final BatchConverter converter, final File inputRoot, final File outputRoot,
			final PrintStream out, final PrintStream err) {
		final ConversionReport report;
		try {
			report = converter.convert(inputRoot, outputRoot);
		} catch (final IOException e) {
			err.println("Conversion failed: " + describe(e));
			return FAILED;
		} catch (final RuntimeException e) {
			err.println("Conversion failed: " + describe(e));
			return FAILED;
		}
		out.println(report.summary());
		return OK;
	}

	private static String describe(final Exception e) {
		final String message = e.getMessage();
		if (message == null)
			return e.getClass().getSimpleName();
		return e.getClass().getSimpleName() + ": " + message;
	}
}
