package com.googlecode.epubtastic.core.processing;

import com.googlecode.epubtastic.core.PngImageType;
import com.googlecode.epubtastic.core.QuantizedImage;
import com.googlecode.epubtastic.core.Raster;

import java.util.ArrayList;
import java.util.List;

/**
 * Median cut quantization of the intensity histogram down to 16 entries, written
 * as a 4-bit indexed png. Once the boxes are chosen the palette itself is replaced
 * by the even ramp {@code i * 255 / 15}, so the clustering only decides which pixels
 * share an index, not the grey they end up as.
 */
public class MedianCutQuantizer implements Quantizer {

	public static final int COLORS = 16;
	public static final int PALETTE_SIZE = 256;

	/** {@inheritDoc} */
	@Override
	public QuantizedImage quantize(Raster raster) {
		final int width = raster.getWidth();
		final int height = raster.getHeight();

		final long[] histogram = new long[256];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				histogram[raster.get(x, y)]++;
			}
		}

		final int[] lookup = buildLookup(histogram, COLORS);
		final int[] samples = new int[width * height];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				samples[y * width + x] = lookup[raster.get(x, y)];
			}
		}

		return new QuantizedImage(width, height, 4, PngImageType.INDEXED_COLOR, samples, rampPalette(COLORS));
	}

	/**
	 * Map every intensity to the index of the box it falls in. Boxes never overlap,
	 * so ordering them along the intensity axis gives dark pixels low indexes.
	 */
	int[] buildLookup(long[] histogram, int colors) {
		final List<Box> boxes = new ArrayList<>();
		final Box all = Box.trimmed(histogram, 0, 255);
		if (all != null) {
			boxes.add(all);
		}

		while (boxes.size() < colors) {
			int candidate = -1;
			for (int i = 0; i < boxes.size(); i++) {
				final Box box = boxes.get(i);
				if (box.isSplittable() && (candidate < 0 || box.population > boxes.get(candidate).population)) {
					candidate = i;
				}
			}
			if (candidate < 0) {
				break;
			}

			final Box box = boxes.remove(candidate);
			final int cut = box.median(histogram);
			boxes.add(candidate, Box.trimmed(histogram, cut + 1, box.high));
			boxes.add(candidate, Box.trimmed(histogram, box.low, cut));
		}

		final int[] lookup = new int[256];
		for (int index = 0; index < boxes.size(); index++) {
			final Box box = boxes.get(index);
			for (int value = box.low; value <= box.high; value++) {
				lookup[value] = index;
			}
		}
		return lookup;
	}

	/**
	 * The forced grey ramp, zero filled past the active entries.
	 *
	 * @return rgb triplets for {@link #PALETTE_SIZE} entries
	 */
	static byte[] rampPalette(int colors) {
		final byte[] palette = new byte[PALETTE_SIZE * 3];
		for (int i = 0; i < colors; i++) {
			final byte grey = (byte) (i * 255 / (colors - 1));
			palette[i * 3] = grey;
			palette[i * 3 + 1] = grey;
			palette[i * 3 + 2] = grey;
		}
		return palette;
	}

	/** {@inheritDoc} */
	@Override
	public String describe() {
		return String.format("%d-level greyscale palette", COLORS);
	}

	/**
	 * A closed interval of intensities, trimmed so both ends are populated
	 */
	private static class Box {
		private final int low;
		private final int high;
		private final long population;

		private Box(int low, int high, long population) {
			this.low = low;
			this.high = high;
			this.population = population;
		}

		static Box trimmed(long[] histogram, int from, int to) {
			int low = from;
			while (low <= to && histogram[low] == 0) {
				low++;
			}
			if (low > to) {
				return null;
			}
			int high = to;
			while (histogram[high] == 0) {
				high--;
			}
			long population = 0;
			for (int v = low; v <= high; v++) {
				population += histogram[v];
			}
			return new Box(low, high, population);
		}

		boolean isSplittable() {
			return high > low;
		}

		/**
		 * The last intensity of the lower half. Always below {@code high}, so both halves keep pixels.
		 */
		int median(long[] histogram) {
			long seen = 0;
			for (int v = low; v < high; v++) {
				seen += histogram[v];
				if (seen * 2 >= population) {
					return v;
				}
			}
			int last = high - 1;
			while (histogram[last] == 0) {
				last--;
			}
			return last;
		}
	}
}
