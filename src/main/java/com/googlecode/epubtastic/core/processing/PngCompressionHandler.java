package com.googlecode.epubtastic.core.processing;

import java.io.IOException;

/**
 * Apply PNG compression. Implies zlib format, aka LZ77.
 *
 * @author rayvanderborght
 */
public interface PngCompressionHandler {

	/**
	 * Deflate (compress) the inflated data using the given compression level.
	 * If compressionLevel is null then do a brute force trial of all
	 * compression levels to find the best one.
	 *
	 * @param inflatedImageData A PngByteArrayOutputStream containing the uncompressed image data
	 * @param compressionLevel The compression level to use
	 * @return A byte array containing the compressed image data
	 */
	public byte[] deflate(PngByteArrayOutputStream inflatedImageData, Integer compressionLevel) throws IOException;
}
