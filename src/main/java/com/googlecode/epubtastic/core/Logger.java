package com.googlecode.epubtastic.core;

import java.io.PrintStream;

/**
 * Custom logger because I want to have zero dependencies; perhaps to be replaced with java.util logging.
 *
 * @author rayvanderborght
 */
public class Logger {

	static final String NONE = "NONE";

	/** Ordered from quietest to most verbose */
	private enum Level { NONE, ERROR, INFO, DEBUG }

	private final Level level;
	private final PrintStream out;
	private final PrintStream err;

	/** */
	public Logger(String logLevel) {
		this(logLevel, System.out, System.err);
	}

	/** */
	public Logger(String logLevel, PrintStream out, PrintStream err) {
		this.level = parse(logLevel);
		this.out = out;
		this.err = err;
	}

	/** */
	public boolean isDebugEnabled() {
		return this.level == Level.DEBUG;
	}

	/**
	 * Write debug messages.
	 * Takes a varags list of args so that string concatenation only happens if the logging level applies.
	 */
	public void debug(String message, Object... args) {
		if (this.level.compareTo(Level.DEBUG) >= 0) {
			this.out.println(String.format(message, args));
		}
	}

	/**
	 * Write info messages.
	 * Takes a varags list of args so that string concatenation only happens if the logging level applies.
	 */
	public void info(String message, Object... args) {
		if (this.level.compareTo(Level.INFO) >= 0) {
			this.out.println(String.format(message, args));
		}
	}

	/**
	 * Write error messages, these go to the error stream.
	 * Takes a varags list of args so that string concatenation only happens if the logging level applies.
	 */
	public void error(String message, Object... args) {
		if (this.level.compareTo(Level.ERROR) >= 0) {
			this.err.println(String.format(message, args));
		}
	}

	/* */
	private static Level parse(String logLevel) {
		if (logLevel == null) {
			return Level.NONE;
		}
		try {
			return Level.valueOf(logLevel.trim().toUpperCase());
		} catch (IllegalArgumentException e) {
			return Level.NONE;
		}
	}
}
