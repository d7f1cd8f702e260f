package com.googlecode.epubtastic.core;

/**
 * The output of a quantizer: one sample per pixel at the given bit depth,
 * either a grey level or an index into the palette.
 */
public class QuantizedImage {

	private final int width;
	public int getWidth() { return this.width; }

	private final int height;
	public int getHeight() { return this.height; }

	private final int bitDepth;
	public int getBitDepth() { return this.bitDepth; }

	private final PngImageType imageType;
	public PngImageType getImageType() { return this.imageType; }

	private final int[] samples;

	/** RGB triplets, only for indexed images */
	private final byte[] palette;
	public byte[] getPalette() { return this.palette; }

	/** */
	public QuantizedImage(int width, int height, int bitDepth, PngImageType imageType, int[] samples, byte[] palette) {
		if (samples.length != width * height) {
			throw new IllegalArgumentException("Expected " + (width * height) + " samples but got " + samples.length);
		}
		if (imageType == PngImageType.INDEXED_COLOR && palette == null) {
			throw new IllegalArgumentException("Indexed images need a palette");
		}
		this.width = width;
		this.height = height;
		this.bitDepth = bitDepth;
		this.imageType = imageType;
		this.samples = samples;
		this.palette = palette;
	}

	/** */
	public int getSample(int x, int y) {
		return this.samples[y * this.width + x];
	}

	/** */
	public int getSampleBitCount() {
		return this.imageType.channelCount() * this.bitDepth;
	}

	/**
	 * The 8-bit grey value a viewer shows for the given pixel.
	 */
	public int getGrey(int x, int y) {
		final int sample = getSample(x, y);
		if (this.imageType == PngImageType.INDEXED_COLOR) {
			return 0xFF & this.palette[sample * 3];
		}
		return sample * 255 / ((1 << this.bitDepth) - 1);
	}
}
