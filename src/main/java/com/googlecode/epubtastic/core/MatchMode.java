package com.googlecode.epubtastic.core;

/**
 * How a reference found in a content file is compared with the renamed images.
 */
public enum MatchMode {
	/** The last path segment equals an old file name, wherever the image lives */
	FILENAME("filename"),
	/** The reference resolves, relative to its document, to an old image path */
	FULL_PATH("path");

	private final String option;

	MatchMode(String option) {
		this.option = option;
	}

	public String getOption() {
		return option;
	}

	/** Defaults to file name matching for null or unknown names */
	public static MatchMode forOption(String option) {
		for (MatchMode mode : values()) {
			if (mode.option.equalsIgnoreCase(option)) {
				return mode;
			}
		}
		return FILENAME;
	}
}
