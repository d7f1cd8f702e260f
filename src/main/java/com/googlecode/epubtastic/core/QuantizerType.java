package com.googlecode.epubtastic.core;

import com.googlecode.epubtastic.core.processing.ErrorDiffusionQuantizer;
import com.googlecode.epubtastic.core.processing.MedianCutQuantizer;
import com.googlecode.epubtastic.core.processing.Quantizer;

/**
 * The available bit depth reduction strategies.
 */
public enum QuantizerType {
	DITHER("dither"),
	PALETTE("palette");

	public static final int DEFAULT_DITHER_LEVELS = 4;

	private final String option;

	QuantizerType(String option) {
		this.option = option;
	}

	public String getOption() {
		return option;
	}

	/**
	 * Create the quantizer, levels is only used for dithering and may be null
	 */
	public Quantizer create(Integer levels) {
		switch (this) {
			case PALETTE:
				return new MedianCutQuantizer();
			case DITHER:
			default:
				return new ErrorDiffusionQuantizer((levels == null) ? DEFAULT_DITHER_LEVELS : levels);
		}
	}

	/** Defaults to dithering for null or unknown names */
	public static QuantizerType forOption(String option) {
		for (QuantizerType type : values()) {
			if (type.option.equalsIgnoreCase(option)) {
				return type;
			}
		}
		return DITHER;
	}
}
