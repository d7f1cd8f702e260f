package com.googlecode.epubtastic.core;

import java.util.Arrays;

/**
 * A single channel 8-bit image held as ints so that error diffusion can
 * read and write neighbouring samples in place. Values stay in [0, 255].
 */
public class Raster {

	private final int width;
	public int getWidth() { return this.width; }

	private final int height;
	public int getHeight() { return this.height; }

	private final int[] samples;

	/** */
	public Raster(int width, int height) {
		if (width <= 0 || height <= 0) {
			throw new IllegalArgumentException(String.format("Bad raster dimensions %dx%d", width, height));
		}
		this.width = width;
		this.height = height;
		this.samples = new int[width * height];
	}

	/** */
	public Raster(int width, int height, int fill) {
		this(width, height);
		Arrays.fill(this.samples, clamp(fill));
	}

	/** */
	public int get(int x, int y) {
		return this.samples[y * this.width + x];
	}

	/** Stores the value clamped to [0, 255] */
	public void set(int x, int y, int value) {
		this.samples[y * this.width + x] = clamp(value);
	}

	/** */
	public boolean contains(int x, int y) {
		return x >= 0 && y >= 0 && x < this.width && y < this.height;
	}

	/** */
	public Raster copy() {
		final Raster copy = new Raster(this.width, this.height);
		System.arraycopy(this.samples, 0, copy.samples, 0, this.samples.length);
		return copy;
	}

	/* */
	private static int clamp(int value) {
		return (value < 0) ? 0 : (value > 255) ? 255 : value;
	}
}
