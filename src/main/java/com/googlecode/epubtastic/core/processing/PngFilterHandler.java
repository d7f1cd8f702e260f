package com.googlecode.epubtastic.core.processing;

import com.googlecode.epubtastic.core.PngFilterType;

import java.util.List;
import java.util.Map;

/**
 * Apply PNG filtering
 *
 * @author rayvanderborght
 */
public interface PngFilterHandler {

	/**
	 * Apply the given filter type to the scanlines provided, in place.
	 *
	 * @param filterType The filter for every scanline
	 * @param scanlines Unfiltered scanlines, each starting with a filter type byte
	 * @param sampleBitCount Bits per pixel
	 */
	public void applyFiltering(PngFilterType filterType, List<byte[]> scanlines, int sampleBitCount);

	/**
	 * Apply adaptive filtering as described in the png spec: for every scanline pick
	 * the filtered version with the smallest sum of absolute differences.
	 *
	 * @param filteredScanlines The scanlines already filtered with each standard filter type
	 * @return One scanline per row, taken from whichever filter scored best for that row
	 */
	public List<byte[]> applyAdaptiveFiltering(Map<PngFilterType, List<byte[]>> filteredScanlines);

	/**
	 * Do filtering as described in the png spec:
	 * The scanline starts with a filter type byte, then continues with the image data.
	 */
	public void filter(byte[] line, byte[] previousLine, int sampleBitCount);
}
