package com.googlecode.epubtastic.core;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 *
 */
class LoggerTest {

	@Test
	void infoLevelSkipsDebug() {
		final ByteArrayOutputStream out = new ByteArrayOutputStream();
		final ByteArrayOutputStream err = new ByteArrayOutputStream();
		final Logger log = new Logger("info", new PrintStream(out, true), new PrintStream(err, true));

		log.debug("hidden %d", 1);
		log.info("shown %d", 2);
		log.error("broken %s", "x");

		assertEquals("shown 2" + System.lineSeparator(), out.toString());
		assertEquals("broken x" + System.lineSeparator(), err.toString());
		assertFalse(log.isDebugEnabled());
	}

	@Test
	void unknownLevelIsSilent() {
		final ByteArrayOutputStream out = new ByteArrayOutputStream();
		final Logger log = new Logger("chatty", new PrintStream(out, true), new PrintStream(out, true));

		log.error("nothing");
		log.info("nothing");

		assertEquals(0, out.size());
	}

	@Test
	void debugIsCaseInsensitive() {
		assertTrue(new Logger("DEBUG").isDebugEnabled());
	}
}
