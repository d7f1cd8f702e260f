package com.googlecode.epubtastic.core.processing;

import com.googlecode.epubtastic.core.PngImageType;
import com.googlecode.epubtastic.core.QuantizedImage;
import com.googlecode.epubtastic.core.Raster;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 *
 */
class ErrorDiffusionQuantizerTest {

	@Test
	void outputsOnlyQuantizationLevels() {
		for (int levels : new int[] { 2, 3, 4, 16 }) {
			final double step = 255D / (levels - 1);
			final Set<Integer> allowed = new HashSet<>();
			for (int k = 0; k < levels; k++) {
				allowed.add((int) (k * step));
			}

			final Raster raster = gradient(64, 8);
			new ErrorDiffusionQuantizer(levels).quantize(raster);
			for (int y = 0; y < raster.getHeight(); y++) {
				for (int x = 0; x < raster.getWidth(); x++) {
					assertTrue(allowed.contains(raster.get(x, y)),
							levels + " levels produced " + raster.get(x, y));
				}
			}
		}
	}

	@Test
	void samplesMatchDitheredGreys() {
		final Raster raster = gradient(30, 5);
		final QuantizedImage image = new ErrorDiffusionQuantizer(4).quantize(raster);

		assertEquals(2, image.getBitDepth());
		assertEquals(PngImageType.GREYSCALE, image.getImageType());
		for (int y = 0; y < raster.getHeight(); y++) {
			for (int x = 0; x < raster.getWidth(); x++) {
				assertEquals(raster.get(x, y), image.getGrey(x, y));
				assertTrue(image.getSample(x, y) >= 0 && image.getSample(x, y) <= 3);
			}
		}
	}

	@Test
	void spreadsWholeErrorToInteriorNeighbours() {
		final Raster raster = new Raster(3, 2);
		raster.set(1, 0, 32);

		final double error = new ErrorDiffusionQuantizer(4).ditherPixel(raster, 1, 0);

		assertEquals(32D, error, 0D);
		assertEquals(0, raster.get(1, 0));
		assertEquals(14, raster.get(2, 0));
		assertEquals(6, raster.get(0, 1));
		assertEquals(10, raster.get(1, 1));
		assertEquals(2, raster.get(2, 1));
	}

	@Test
	void dropsErrorOutsideTheRaster() {
		final ErrorDiffusionQuantizer quantizer = new ErrorDiffusionQuantizer(4);

		final Raster left = new Raster(3, 2);
		left.set(0, 0, 32);
		quantizer.ditherPixel(left, 0, 0);
		assertEquals(26, left.get(1, 0) + left.get(0, 1) + left.get(1, 1));

		final Raster right = new Raster(3, 2);
		right.set(2, 0, 32);
		quantizer.ditherPixel(right, 2, 0);
		assertEquals(6, right.get(1, 1));
		assertEquals(10, right.get(2, 1));

		final Raster bottom = new Raster(3, 2);
		bottom.set(1, 1, 32);
		quantizer.ditherPixel(bottom, 1, 1);
		assertEquals(14, bottom.get(2, 1));
		assertEquals(14, sum(bottom));
	}

	@Test
	void uniformMidGreyAlternatesBetweenAdjacentLevels() {
		final Raster raster = new Raster(50, 50, 128);
		new ErrorDiffusionQuantizer(4).quantize(raster);

		final Set<Integer> seen = new HashSet<>();
		for (int y = 0; y < 50; y++) {
			for (int x = 0; x < 50; x++) {
				seen.add(raster.get(x, y));
			}
		}
		assertTrue(seen.contains(85));
		assertTrue(seen.contains(170));
		assertEquals(2, seen.size());

		final double mean = sum(raster) / 2500D;
		assertTrue(Math.abs(mean - 128) < 3, "mean was " + mean);
	}

	@Test
	void deterministic() {
		final Raster first = gradient(40, 10);
		final Raster second = first.copy();

		final QuantizedImage a = new ErrorDiffusionQuantizer(4).quantize(first);
		final QuantizedImage b = new ErrorDiffusionQuantizer(4).quantize(second);
		for (int y = 0; y < 10; y++) {
			for (int x = 0; x < 40; x++) {
				assertEquals(a.getSample(x, y), b.getSample(x, y));
			}
		}
	}

	@Test
	void bitDepthFollowsLevels() {
		assertEquals(1, new ErrorDiffusionQuantizer(2).getBitDepth());
		assertEquals(2, new ErrorDiffusionQuantizer(4).getBitDepth());
		assertEquals(4, new ErrorDiffusionQuantizer(16).getBitDepth());
		assertEquals(8, new ErrorDiffusionQuantizer(256).getBitDepth());
		assertEquals(8, new ErrorDiffusionQuantizer(3).getBitDepth());
		assertEquals(8, new ErrorDiffusionQuantizer(100).getBitDepth());
	}

	@Test
	void eightBitSamplesAreTheGreysThemselves() {
		final Raster raster = gradient(20, 3);
		final QuantizedImage image = new ErrorDiffusionQuantizer(3).quantize(raster);
		for (int x = 0; x < 20; x++) {
			assertEquals(raster.get(x, 1), image.getSample(x, 1));
		}
	}

	@Test
	void rejectsBadLevels() {
		assertThrows(IllegalArgumentException.class, () -> new ErrorDiffusionQuantizer(1));
		assertThrows(IllegalArgumentException.class, () -> new ErrorDiffusionQuantizer(257));
	}

	/* */
	private static Raster gradient(int width, int height) {
		final Raster raster = new Raster(width, height);
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				raster.set(x, y, x * 255 / (width - 1));
			}
		}
		return raster;
	}

	/* */
	private static int sum(Raster raster) {
		int total = 0;
		for (int y = 0; y < raster.getHeight(); y++) {
			for (int x = 0; x < raster.getWidth(); x++) {
				total += raster.get(x, y);
			}
		}
		return total;
	}
}
