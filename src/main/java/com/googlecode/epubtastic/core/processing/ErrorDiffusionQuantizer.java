package com.googlecode.epubtastic.core.processing;

import com.googlecode.epubtastic.core.PngImageType;
import com.googlecode.epubtastic.core.QuantizedImage;
import com.googlecode.epubtastic.core.Raster;

/**
 * Floyd-Steinberg error diffusion to a fixed number of evenly spaced grey levels.
 * <pre>
 *       x   7
 *   3   5   1    (sixteenths)
 * </pre>
 * Pixels are visited top to bottom, left to right, so every pixel sees the error
 * already pushed into it by its predecessors. Error that would land outside the
 * raster is dropped, not redistributed.
 */
public class ErrorDiffusionQuantizer implements Quantizer {

	private final int levels;
	public int getLevels() { return levels; }

	private final double step;

	/** */
	public ErrorDiffusionQuantizer(int levels) {
		if (levels < 2 || levels > 256) {
			throw new IllegalArgumentException("Grey levels must be between 2 and 256, got " + levels);
		}
		this.levels = levels;
		this.step = 255D / (levels - 1);
	}

	/** {@inheritDoc} */
	@Override
	public QuantizedImage quantize(Raster raster) {
		final int width = raster.getWidth();
		final int height = raster.getHeight();

		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				ditherPixel(raster, x, y);
			}
		}

		final int bitDepth = getBitDepth();
		final int[] samples = new int[width * height];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				final int value = raster.get(x, y);
				samples[y * width + x] = (bitDepth == 8) ? value : (int) Math.rint(value / step);
			}
		}
		return new QuantizedImage(width, height, bitDepth, PngImageType.GREYSCALE, samples, null);
	}

	/**
	 * Round one pixel to its nearest level and push the rounding error onto the
	 * unvisited neighbours.
	 *
	 * @return the error, original value minus the chosen level
	 */
	double ditherPixel(Raster raster, int x, int y) {
		final double oldValue = raster.get(x, y);
		final double newValue = Math.rint(oldValue / step) * step;
		raster.set(x, y, truncate(newValue));

		final double error = oldValue - newValue;
		spread(raster, x + 1, y, error * 7 / 16);
		spread(raster, x - 1, y + 1, error * 3 / 16);
		spread(raster, x, y + 1, error * 5 / 16);
		spread(raster, x + 1, y + 1, error * 1 / 16);

		return error;
	}

	/**
	 * The png sample depth: levels 2, 4, 16 and 256 map exactly onto 1, 2, 4 and 8 bit
	 * grey samples, anything else is written as plain 8-bit grey.
	 */
	public int getBitDepth() {
		switch (levels) {
			case 2:
				return 1;
			case 4:
				return 2;
			case 16:
				return 4;
			default:
				return 8;
		}
	}

	/** {@inheritDoc} */
	@Override
	public String describe() {
		return String.format("%d-level greyscale with Floyd-Steinberg dithering", levels);
	}

	/* */
	private static void spread(Raster raster, int x, int y, double error) {
		if (raster.contains(x, y)) {
			raster.set(x, y, truncate(raster.get(x, y) + error));
		}
	}

	/* clamp first so the cast never sees a negative number */
	private static int truncate(double value) {
		return (int) Math.max(0D, Math.min(255D, value));
	}
}
