package org.doube.dicompng;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Outcome of one batch run: how many files were converted and which were
 * skipped, and why. Safe to update from several worker threads.
 */
public class ConversionReport {

	/**
	 * A source file that could not be converted
	 */
	public static class Failure {
		private final File source;
		private final String reason;

		public Failure(final File source, final String reason) {
			this.source = source;
			this.reason = reason;
		}

		public File getSource() {
			return source;
		}

		public String getReason() {
			return reason;
		}

		@Override
		public String toString() {
			return source.getName() + ": " + reason;
		}
	}

	private final File outputRoot;
	private final AtomicInteger converted = new AtomicInteger();
	private final List<Failure> failures = Collections.synchronizedList(new ArrayList<Failure>());
	private volatile boolean cancelled;

	public ConversionReport(final File outputRoot) {
		this.outputRoot = outputRoot;
	}

	void converted() {
		converted.incrementAndGet();
	}

	void failed(final File source, final String reason) {
		failures.add(new Failure(source, reason));
	}

	void cancelled() {
		cancelled = true;
	}

	public int getConverted() {
		return converted.get();
	}

	public int getSkipped() {
		return failures.size();
	}

	/**
	 * @return a snapshot of the failures in the order they were recorded
	 */
	public List<Failure> getFailures() {
		synchronized (failures) {
			return new ArrayList<Failure>(failures);
		}
	}

	public boolean isCancelled() {
		return cancelled;
	}

	/**
	 * @return "Converted N files to: outputRoot", followed by skipped and
	 *         cancelled lines where they apply
	 */
	public String summary() {
		final StringBuilder sb = new StringBuilder();
		sb.append("Converted ").append(getConverted()).append(" files to: ").append(outputRoot.getPath());
		final int skipped = getSkipped();
		if (skipped > 0)
			sb.append("\nSkipped ").append(skipped).append(" files");
		if (cancelled)
			sb.append("\nConversion was cancelled");
		return sb.toString();
	}

	@Override
	public String toString() {
		return summary();
	}
}
