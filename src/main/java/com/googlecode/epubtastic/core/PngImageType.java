package com.googlecode.epubtastic.core;

/**
 * The png color types and the number of samples each stores per pixel.
 * @see <a href="http://www.w3.org/TR/PNG/#11IHDR">IHDR</a>
 */
public enum PngImageType {
	GREYSCALE(0, 1),
	TRUECOLOR(2, 3),
	INDEXED_COLOR(3, 1),
	GREYSCALE_ALPHA(4, 2),
	TRUECOLOR_ALPHA(6, 4);

	private final byte colorType;
	public byte getColorType() { return this.colorType; }

	private final int channelCount;
	public int channelCount() { return this.channelCount; }

	PngImageType(int colorType, int channelCount) {
		this.colorType = (byte) colorType;
		this.channelCount = channelCount;
	}

	/** */
	public static PngImageType forColorType(int colorType) {
		for (PngImageType type : values()) {
			if (type.colorType == colorType) {
				return type;
			}
		}
		throw new EpubException(EpubException.Kind.IMAGE_DECODE, "Unknown png color type " + colorType);
	}
}
