package org.doube.util;

import ij.IJ;
import ij.ImagePlus;
import ij.ImageStack;

/**
 * Checks on the ImageJ environment and on DICOM header contents.
 */
public class ImageCheck {

	/**
	 * Minimal ImageJ version required for DICOM decoding and PNG writing
	 */
	public static final String requiredIJVersion = "1.52a";

	/**
	 * Get the value associated with a DICOM tag from an image's header. The
	 * header is the "Info" property that ImageJ's DICOM reader attaches to
	 * single images, or the slice label of the first slice of a stack.
	 *
	 * @param imp
	 * @param tag
	 *            in 0000,0000 format
	 * @return the trimmed value, or null if the image has no header or the
	 *         tag is absent
	 */
	public static String getDicomAttribute(ImagePlus imp, String tag) {
		if (imp == null)
			return null;
		Object info = imp.getProperty("Info");
		if (info instanceof String) {
			String value = getDicomAttribute((String) info, tag);
			if (value != null)
				return value;
		}
		ImageStack stack = imp.getImageStack();
		if (stack == null || stack.getSize() < 1)
			return null;
		return getDicomAttribute(stack.getSliceLabel(1), tag);
	}

	/**
	 * Get the value associated with a DICOM tag from header text in ImageJ's
	 * "0028,0101  Bits Stored: 12" line format
	 *
	 * @param header
	 * @param tag
	 *            in 0000,0000 format
	 * @return the trimmed value, or null if the tag is absent
	 */
	public static String getDicomAttribute(String header, String tag) {
		if (header == null || tag == null)
			return null;
		int idx1 = header.indexOf(tag);
		if (idx1 < 0)
			return null;
		int idx2 = header.indexOf(":", idx1);
		if (idx2 < 0)
			return null;
		int idx3 = header.indexOf("\n", idx2);
		if (idx3 < 0)
			idx3 = header.length();
		return header.substring(idx2 + 1, idx3).trim();
	}

	/**
	 * Parse an integer DICOM attribute
	 *
	 * @param imp
	 * @param tag
	 * @param defaultValue
	 *            returned if the tag is absent or not an integer
	 * @return the attribute's value
	 */
	public static int getDicomInt(ImagePlus imp, String tag, int defaultValue) {
		String value = getDicomAttribute(imp, tag);
		if (value == null || value.isEmpty())
			return defaultValue;
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			return defaultValue;
		}
	}

	/**
	 * Show a message and return false if the version of IJ is too old
	 *
	 * @return false if the IJ version is older than {@link #requiredIJVersion}
	 */
	public static boolean checkIJVersion() {
		if (requiredIJVersion.compareTo(IJ.getVersion()) > 0) {
			IJ.error("Update ImageJ", "You are using an old version of ImageJ, v" + IJ.getVersion() + ".\n"
					+ "Please update to at least ImageJ v" + requiredIJVersion + " using Help-Update ImageJ.");
			return false;
		}
		return true;
	}
}
