package org.doube.dicompng.io;

import java.io.File;
import java.io.IOException;

import org.doube.dicompng.NormalizedImage;

/**
 * Writes an 8-bit single-channel image to a file
 */
public interface RasterEncoder {

	/**
	 * Create or overwrite the destination file
	 *
	 * @param image
	 * @param destination
	 * @throws IOException
	 *             if the file cannot be written
	 */
	void encode(NormalizedImage image, File destination) throws IOException;

	/**
	 * @return file extension of written files, including the dot
	 */
	String getExtension();
}
