package org.doube.dicompng.io;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Walks a directory tree and hands out DICOM files one at a time, in the
 * order the file system lists them. The tree is read as it is consumed, so
 * conversion can start before the whole tree has been visited.
 *
 * {@link #next()} may be called from several threads.
 */
public class DicomScanner implements Closeable {

	public static final String EXTENSION = ".dcm";

	private final Stream<Path> walk;
	private final Iterator<Path> paths;

	/**
	 * @param root
	 *            directory to scan
	 * @throws IOException
	 *             if the root cannot be opened
	 */
	public DicomScanner(final File root) throws IOException {
		walk = Files.walk(root.toPath());
		paths = walk.iterator();
	}

	/**
	 * Check if a file name has the DICOM extension, ignoring case
	 *
	 * @param name
	 * @return true if name ends with .dcm
	 */
	public static boolean isDicomName(final String name) {
		return name.toLowerCase(Locale.ROOT).endsWith(EXTENSION);
	}

	/**
	 * @return the next DICOM file, or null when the tree is exhausted
	 * @throws IOException
	 *             if a directory in the tree cannot be read
	 */
	public synchronized File next() throws IOException {
		try {
			while (paths.hasNext()) {
				final Path path = paths.next();
				final Path name = path.getFileName();
				if (name != null && isDicomName(name.toString()) && Files.isRegularFile(path))
					return path.toFile();
			}
		} catch (final UncheckedIOException e) {
			throw e.getCause();
		}
		return null;
	}

	@Override
	public void close() {
		walk.close();
	}
}
