package com.googlecode.epubtastic.core.processing;

import java.io.ByteArrayOutputStream;
import java.util.List;

/**
 * Allows access to the underlying buf without doing deep copies on it
 *
 * @author ray
 */
public class PngByteArrayOutputStream extends ByteArrayOutputStream {

	public PngByteArrayOutputStream(byte[] initial) {
		buf = initial;
		count = initial.length;
	}

	/**
	 * Concatenate equally sized scanlines into one buffer.
	 */
	public static PngByteArrayOutputStream serialize(List<byte[]> scanlines) {
		final int scanlineLength = scanlines.get(0).length;
		final byte[] imageData = new byte[scanlineLength * scanlines.size()];
		for (int i = 0; i < scanlines.size(); i++) {
			System.arraycopy(scanlines.get(i), 0, imageData, i * scanlineLength, scanlineLength);
		}
		return new PngByteArrayOutputStream(imageData);
	}

	public byte[] get() {
		return buf;
	}

	public int len() {
		return count;
	}
}
