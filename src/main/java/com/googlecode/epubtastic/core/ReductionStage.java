package com.googlecode.epubtastic.core;

/**
 * The stages an archive run passes through, in order. A run never goes back to
 * an earlier stage; it ends in COMPLETED or FAILED.
 */
public enum ReductionStage {
	OPEN,
	EXTRACTED,
	IMAGES_CONVERTED,
	REFERENCES_REWRITTEN,
	REPACKAGED,
	COMPLETED,
	FAILED;

	/** */
	public boolean isTerminal() {
		return this == COMPLETED || this == FAILED;
	}
}
