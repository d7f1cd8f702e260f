package com.googlecode.epubtastic.core;

import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Represents a png image as its list of chunks
 *
 * @author rayvanderborght
 */
public class PngImage {

	private final Logger log;

	public static final long SIGNATURE = 0x89504e470d0a1a0aL;

	private final List<PngChunk> chunks = new ArrayList<>();
	public List<PngChunk> getChunks() { return this.chunks; }

	private long width;
	public long getWidth() { return this.width; }

	private long height;
	public long getHeight() { return this.height; }

	private short bitDepth;
	public short getBitDepth() { return this.bitDepth; }

	private short colorType;
	public short getColorType() { return this.colorType; }

	private PngChunk palette;
	public PngChunk getPalette() { return palette; }

	/** */
	public PngImage(Logger log) {
		this.log = log;
	}

	/** */
	public void addChunk(PngChunk chunk) {
		switch (chunk.getTypeString()) {
			case PngChunk.IMAGE_HEADER:
				this.width = chunk.getWidth();
				this.height = chunk.getHeight();
				this.bitDepth = chunk.getBitDepth();
				this.colorType = chunk.getColorType();
				break;

			case PngChunk.PALETTE:
				this.palette = chunk;
				break;

			default:
				break;
		}

		this.chunks.add(chunk);
	}

	/** */
	public DataOutputStream writeDataOutputStream(OutputStream output) throws IOException {
		final DataOutputStream outs = new DataOutputStream(output);
		outs.writeLong(PngImage.SIGNATURE);

		for (PngChunk chunk : chunks) {
			log.debug("export: %s", chunk);
			outs.writeInt(chunk.getLength());
			outs.write(chunk.getType());
			outs.write(chunk.getData());
			outs.writeInt((int) chunk.getCRC());
		}
		outs.close();

		return outs;
	}

	/** */
	public int getSampleBitCount() {
		return PngImageType.forColorType(this.colorType).channelCount() * this.bitDepth;
	}
}
