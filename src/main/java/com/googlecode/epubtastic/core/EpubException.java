package com.googlecode.epubtastic.core;

/**
 * Exception type for epubtastic code. The kind tells callers whether the
 * failure ends the whole archive run or only skips one image or file.
 *
 * @author rayvanderborght
 */
public class EpubException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	/** */
	public enum Kind {
		ARCHIVE_READ(true),
		ARCHIVE_WRITE(true),
		IMAGE_DECODE(false),
		IMAGE_ENCODE(false),
		MANIFEST_PARSE(false),
		REFERENCE_REWRITE(false);

		private final boolean fatal;

		Kind(boolean fatal) {
			this.fatal = fatal;
		}

		/** True when the failure aborts the run for the whole archive */
		public boolean isFatal() {
			return fatal;
		}
	}

	private final Kind kind;
	public Kind getKind() { return kind; }

	/** */
	public EpubException(Kind kind, String message) {
		super(message);
		this.kind = kind;
	}

	/** */
	public EpubException(Kind kind, String message, Throwable cause) {
		super(message, cause);
		this.kind = kind;
	}
}
