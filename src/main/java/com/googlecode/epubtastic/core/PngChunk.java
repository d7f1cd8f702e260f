package com.googlecode.epubtastic.core;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * A single png chunk: length, 4 byte type, data and crc.
 * @see <a href="http://www.w3.org/TR/PNG/#5Chunk-layout">Chunk layout</a>
 *
 * @author rayvanderborght
 */
public class PngChunk {

	public static final String IMAGE_HEADER = "IHDR";
	public static final String PALETTE = "PLTE";
	public static final String IMAGE_DATA = "IDAT";
	public static final String IMAGE_TRAILER = "IEND";

	private final byte[] type;
	public byte[] getType() { return this.type; }

	private final byte[] data;
	public byte[] getData() { return this.data; }

	/** */
	public PngChunk(byte[] type, byte[] data) {
		if (type.length != 4) {
			throw new IllegalArgumentException("Chunk type must be 4 bytes");
		}
		this.type = type;
		this.data = data;
	}

	/** */
	public PngChunk(String type, byte[] data) {
		this(type.getBytes(StandardCharsets.US_ASCII), data);
	}

	/**
	 * Build a non interlaced IHDR using the default compression and filter methods.
	 */
	public static PngChunk header(int width, int height, int bitDepth, PngImageType imageType) {
		final ByteBuffer buffer = ByteBuffer.allocate(13);
		buffer.putInt(width);
		buffer.putInt(height);
		buffer.put((byte) bitDepth);
		buffer.put(imageType.getColorType());
		buffer.put((byte) 0);	// compression
		buffer.put((byte) 0);	// filter
		buffer.put((byte) 0);	// interlace
		return new PngChunk(IMAGE_HEADER, buffer.array());
	}

	/** */
	public int getLength() {
		return this.data.length;
	}

	/** */
	public String getTypeString() {
		return new String(this.type, StandardCharsets.US_ASCII);
	}

	/** */
	public long getCRC() {
		final CRC32 crc = new CRC32();
		crc.update(this.type);
		crc.update(this.data);
		return crc.getValue();
	}

	/** */
	public long getWidth() {
		return readInt(0);
	}

	/** */
	public long getHeight() {
		return readInt(4);
	}

	/** */
	public short getBitDepth() {
		return (short) (this.data[8] & 0xFF);
	}

	/** */
	public short getColorType() {
		return (short) (this.data[9] & 0xFF);
	}

	/* */
	private long readInt(int offset) {
		return ByteBuffer.wrap(this.data, offset, 4).getInt() & 0xFFFFFFFFL;
	}

	@Override
	public String toString() {
		return getTypeString() + "[" + getLength() + "]";
	}
}
