package com.googlecode.epubtastic.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 *
 */
class PathMappingTest {

	@Test
	void keepsInsertionOrder() {
		final PathMapping mapping = new PathMapping();
		mapping.put("OEBPS/images/b.jpg", "OEBPS/images/b.png");
		mapping.put("OEBPS/images/a.jpeg", "OEBPS/images/a.png");

		assertEquals(Arrays.asList("OEBPS/images/b.jpg", "OEBPS/images/a.jpeg"), new ArrayList<>(mapping.asMap().keySet()));
		assertEquals(2, mapping.size());
	}

	@Test
	void rejectsSecondMappingForSamePath() {
		final PathMapping mapping = new PathMapping();
		mapping.put("cover.jpg", "cover.png");

		assertThrows(IllegalArgumentException.class, () -> mapping.put("cover.jpg", "other.png"));
	}

	@Test
	void fileNamesLeaveOutUnchangedNames() {
		final PathMapping mapping = new PathMapping();
		mapping.put("OEBPS/images/cover.jpg", "OEBPS/images/cover.png");
		mapping.put("OEBPS/images/logo.png", "OEBPS/images/logo.png");

		final Map<String, String> names = mapping.fileNames();

		assertEquals(1, names.size());
		assertEquals("cover.png", names.get("cover.jpg"));
	}

	@Test
	void fileNameIsLastSegment() {
		assertEquals("c.jpg", PathMapping.fileName("a/b/c.jpg"));
		assertEquals("c.jpg", PathMapping.fileName("c.jpg"));
	}
}
