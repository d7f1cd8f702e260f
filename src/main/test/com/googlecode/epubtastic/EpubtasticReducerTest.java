package com.googlecode.epubtastic;

import com.googlecode.epubtastic.core.EpubFixtures;
import com.googlecode.epubtastic.core.MatchMode;
import com.googlecode.epubtastic.core.QuantizerType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 *
 */
class EpubtasticReducerTest {

	@TempDir
	File dir;

	@Test
	void printsResultsAndSummary() throws Exception {
		final File good = EpubFixtures.writeEpub(new File(dir, "good.epub"), EpubFixtures.book(true));
		final File missing = new File(dir, "missing.epub");
		final File out = new File(dir, "out");
		final ByteArrayOutputStream bytes = new ByteArrayOutputStream();

		final EpubtasticReducer reducer = new EpubtasticReducer(out.getPath(), new String[] { good.getPath(), missing.getPath() },
				QuantizerType.DITHER, 4, 9, MatchMode.FILENAME, "none", new PrintStream(bytes, true));

		assertEquals(1, reducer.getResult().getSuccessful());
		assertEquals(1, reducer.getResult().getFailed());
		assertTrue(new File(out, "good.epub").isFile());

		final String printed = bytes.toString();
		assertTrue(printed.contains("Created: " + new File(out, "good.epub").getPath()), printed);
		assertTrue(printed.contains("SUMMARY:"), printed);
		assertTrue(printed.contains("Successfully processed: 1"), printed);
		assertTrue(printed.contains("Failed: 1"), printed);
	}
}
