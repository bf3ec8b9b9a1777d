package org.doube.dicompng.io;

import java.io.File;
import java.io.IOException;

import org.doube.dicompng.SampleGrid;

/**
 * Reads the raw samples of one image file
 */
public interface SampleDecoder {

	/**
	 * @param source
	 * @return the samples of the first frame
	 * @throws IOException
	 *             if the file cannot be read or is not in the expected format
	 */
	SampleGrid decode(File source) throws IOException;
}
