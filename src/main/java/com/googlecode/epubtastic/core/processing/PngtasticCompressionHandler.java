package com.googlecode.epubtastic.core.processing;

import com.googlecode.epubtastic.core.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.zip.Deflater;
import java.util.zip.DeflaterOutputStream;

/**
 * Implements PNG compression. Strategies are tried one after the other on the
 * calling thread and the smallest result wins.
 *
 * @author rayvanderborght
 */
public class PngtasticCompressionHandler implements PngCompressionHandler {

	private final Logger log;

	private static final List<Integer> compressionStrategies = Arrays.asList(
			Deflater.DEFAULT_STRATEGY,
			Deflater.FILTERED,
			Deflater.HUFFMAN_ONLY);

	/** */
	public PngtasticCompressionHandler(Logger log) {
		this.log = log;
	}

	/**
	 * {@inheritDoc}
	 */
	@Override
	public byte[] deflate(PngByteArrayOutputStream inflatedImageData, Integer compressionLevel) throws IOException {
		byte[] result = null;
		for (final int strategy : compressionStrategies) {
			final byte[] data = deflateImageData(inflatedImageData, strategy, compressionLevel);
			if (result == null || data.length < result.length) {
				result = data;
			}
		}
		log.debug("Image bytes=%d", (result == null) ? -1 : result.length);

		return result;
	}

	/* */
	private byte[] deflateImageData(PngByteArrayOutputStream inflatedImageData, int strategy, Integer compressionLevel) throws IOException {
		byte[] result = null;
		int bestCompression = Deflater.BEST_COMPRESSION;

		if (compressionLevel == null || compressionLevel > Deflater.BEST_COMPRESSION || compressionLevel < Deflater.NO_COMPRESSION) {
			for (int compression = Deflater.BEST_COMPRESSION; compression > Deflater.NO_COMPRESSION; compression--) {
				final ByteArrayOutputStream deflatedOut = deflate(inflatedImageData, strategy, compression);

				if (result == null || (result.length > deflatedOut.size())) {
					result = deflatedOut.toByteArray();
					bestCompression = compression;
				}
			}
		} else {
			result = deflate(inflatedImageData, strategy, compressionLevel).toByteArray();
			bestCompression = compressionLevel;
		}
		log.debug("Compression strategy: %s, compression level=%d, bytes=%d", strategy, bestCompression, result.length);

		return result;
	}

	/* */
	private ByteArrayOutputStream deflate(PngByteArrayOutputStream inflatedImageData, int strategy, int compression) throws IOException {
		final ByteArrayOutputStream deflatedOut = new ByteArrayOutputStream();
		final Deflater deflater = new Deflater(compression);
		deflater.setStrategy(strategy);

		try (DeflaterOutputStream stream = new DeflaterOutputStream(deflatedOut, deflater)) {
			stream.write(inflatedImageData.get(), 0, inflatedImageData.len());
		} finally {
			deflater.end();
		}

		return deflatedOut;
	}
}
