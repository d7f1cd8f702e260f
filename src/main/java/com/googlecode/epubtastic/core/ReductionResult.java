package com.googlecode.epubtastic.core;

import java.io.File;

/**
 * Holds the outcome of one archive run
 */
public class ReductionResult {

	private final boolean success;
	public boolean isSuccess() { return success; }

	private final File output;
	public File getOutput() { return output; }

	private final long originalSize;
	public long getOriginalSize() { return originalSize; }

	private final long newSize;
	public long getNewSize() { return newSize; }

	private final int convertedImages;
	public int getConvertedImages() { return convertedImages; }

	private final String error;
	public String getError() { return error; }

	/** */
	public ReductionResult(File output, long originalSize, long newSize, int convertedImages) {
		this(true, output, originalSize, newSize, convertedImages, null);
	}

	/* */
	private ReductionResult(boolean success, File output, long originalSize, long newSize, int convertedImages, String error) {
		this.success = success;
		this.output = output;
		this.originalSize = originalSize;
		this.newSize = newSize;
		this.convertedImages = convertedImages;
		this.error = error;
	}

	/** */
	public static ReductionResult failed(long originalSize, String error) {
		return new ReductionResult(false, null, originalSize, 0, 0, error);
	}

	/** Bytes saved; negative when the archive grew */
	public long getSizeDifference() {
		return originalSize - newSize;
	}

	/** Percentage of the original size saved, truncated toward zero */
	public int getPercentage() {
		return (originalSize > 0) ? (int) (getSizeDifference() * 100 / originalSize) : 0;
	}

	/** */
	public boolean isReduction() {
		return newSize < originalSize;
	}

	@Override
	public String toString() {
		if (!success) {
			return "Failed: " + error;
		}
		final double mib = 1024D * 1024D;
		return String.format("Created: %s%nOriginal size: %.1f MiB%nNew size: %.1f MiB%n%s: %.1f MiB (%d%%)",
				output, originalSize / mib, newSize / mib,
				isReduction() ? "Size reduction" : "Size increase",
				Math.abs(getSizeDifference()) / mib, Math.abs(getPercentage()));
	}
}
