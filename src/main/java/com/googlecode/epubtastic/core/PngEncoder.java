package com.googlecode.epubtastic.core;

import com.googlecode.epubtastic.core.processing.PngByteArrayOutputStream;
import com.googlecode.epubtastic.core.processing.PngCompressionHandler;
import com.googlecode.epubtastic.core.processing.PngFilterHandler;
import com.googlecode.epubtastic.core.processing.PngtasticCompressionHandler;
import com.googlecode.epubtastic.core.processing.PngtasticFilterHandler;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

/**
 * Encodes quantized images as the smallest png this code can find. Only the
 * critical chunks are written, so there is never a color profile, gamma or text
 * chunk in the output.
 *
 * @author rayvanderborght
 */
public class PngEncoder {

	private final Logger log;
	private final PngFilterHandler pngFilterHandler;
	private final PngCompressionHandler pngCompressionHandler;

	private final Integer compressionLevel;

	/**
	 * @param compressionLevel 0-9, or null to try every level
	 */
	public PngEncoder(Logger log, Integer compressionLevel) {
		this.log = log;
		this.compressionLevel = compressionLevel;
		this.pngFilterHandler = new PngtasticFilterHandler(log);
		this.pngCompressionHandler = new PngtasticCompressionHandler(log);
	}

	/** */
	public byte[] encode(QuantizedImage image) throws IOException {
		final PngImage result = toPngImage(image);

		final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		result.writeDataOutputStream(bytes);
		return bytes.toByteArray();
	}

	/** */
	public PngImage toPngImage(QuantizedImage image) throws IOException {
		final PngImage result = new PngImage(log);
		result.addChunk(PngChunk.header(image.getWidth(), image.getHeight(), image.getBitDepth(), image.getImageType()));

		if (image.getImageType() == PngImageType.INDEXED_COLOR) {
			final int entries = 1 << image.getBitDepth();
			result.addChunk(new PngChunk(PngChunk.PALETTE, Arrays.copyOf(image.getPalette(), entries * 3)));
		}

		final int sampleBitCount = image.getSampleBitCount();
		final List<byte[]> originalScanlines = getScanlines(image);

		// apply each type of filtering
		final Map<PngFilterType, List<byte[]>> filteredScanlines = new EnumMap<>(PngFilterType.class);
		for (PngFilterType filterType : PngFilterType.standardValues()) {
			final List<byte[]> scanlines = copyScanlines(originalScanlines);
			pngFilterHandler.applyFiltering(filterType, scanlines, sampleBitCount);
			filteredScanlines.put(filterType, scanlines);
		}

		// pick the filter that compresses best
		PngFilterType bestFilterType = null;
		byte[] deflatedImageData = null;
		for (Entry<PngFilterType, List<byte[]>> entry : filteredScanlines.entrySet()) {
			final byte[] imageResult = pngCompressionHandler.deflate(PngByteArrayOutputStream.serialize(entry.getValue()), compressionLevel);
			if (deflatedImageData == null || imageResult.length < deflatedImageData.length) {
				deflatedImageData = imageResult;
				bestFilterType = entry.getKey();
			}
		}

		// see if adaptive filtering results in even better compression
		final List<byte[]> adaptiveScanlines = pngFilterHandler.applyAdaptiveFiltering(filteredScanlines);
		final byte[] adaptiveImageData = pngCompressionHandler.deflate(PngByteArrayOutputStream.serialize(adaptiveScanlines), compressionLevel);
		log.debug("Adaptive=%d, %s=%d", adaptiveImageData.length, bestFilterType, deflatedImageData.length);

		if (adaptiveImageData.length < deflatedImageData.length) {
			deflatedImageData = adaptiveImageData;
			bestFilterType = PngFilterType.ADAPTIVE;
		}
		log.debug("Chose filter %s", bestFilterType);

		result.addChunk(new PngChunk(PngChunk.IMAGE_DATA, deflatedImageData));
		result.addChunk(new PngChunk(PngChunk.IMAGE_TRAILER, new byte[] { }));

		return result;
	}

	/**
	 * Pack the samples into unfiltered scanlines, most significant bits first,
	 * each prefixed with a zero filter type byte.
	 */
	List<byte[]> getScanlines(QuantizedImage image) {
		final int width = image.getWidth();
		final int bitDepth = image.getBitDepth();
		final int scanlineLength = (int) Math.ceil(width * image.getSampleBitCount() / 8D) + 1;
		final int mask = (1 << bitDepth) - 1;

		final List<byte[]> scanlines = new ArrayList<>(image.getHeight());
		for (int y = 0; y < image.getHeight(); y++) {
			final byte[] line = new byte[scanlineLength];
			for (int x = 0; x < width; x++) {
				final int bit = x * bitDepth;
				final int shift = 8 - bitDepth - (bit % 8);
				line[1 + bit / 8] |= (byte) ((image.getSample(x, y) & mask) << shift);
			}
			scanlines.add(line);
		}
		return scanlines;
	}

	/* */
	private List<byte[]> copyScanlines(List<byte[]> original) {
		final List<byte[]> copy = new ArrayList<>(original.size());
		for (byte[] scanline : original) {
			copy.add(scanline.clone());
		}
		return copy;
	}
}
