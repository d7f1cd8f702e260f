package com.googlecode.epubtastic.core.processing;

import com.googlecode.epubtastic.core.QuantizedImage;
import com.googlecode.epubtastic.core.Raster;

/**
 * Reduce an 8-bit greyscale raster to a small number of grey levels.
 * Implementations must be deterministic: the same pixels always give the same output.
 */
public interface Quantizer {

	/**
	 * Quantize the raster. The raster may be modified in place.
	 *
	 * @param raster The greyscale image
	 * @return The reduced image, ready for png encoding
	 */
	public QuantizedImage quantize(Raster raster);

	/**
	 * A short human readable description used in log output.
	 */
	public String describe();
}
