package com.googlecode.epubtastic.core.rewrite;

import com.googlecode.epubtastic.core.MatchMode;
import com.googlecode.epubtastic.core.PathMapping;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;

/**
 *
 */
class MarkupReferenceRewriterTest {

	private static final String DOCUMENT = "OEBPS/text/ch1.xhtml";

	private final ReferenceRewriter rewriter = new MarkupReferenceRewriter();
	private final ReferenceMatcher matcher = new ReferenceMatcher(mapping(), MatchMode.FILENAME);

	@Test
	void rewritesSrcKeepingQuotes() {
		final String html = "<img src=\"../images/cover.jpg\"/><img src='../images/cover.jpg' alt='x'/>";

		final RewriteResult result = rewriter.rewrite(DOCUMENT, html, matcher);

		assertEquals("<img src=\"../images/cover.png\"/><img src='../images/cover.png' alt='x'/>", result.getContent());
		assertEquals(2, result.getReplacements());
	}

	@Test
	void rewritesHrefAndXlinkHref() {
		final String svg = "<a href=\"cover.jpg\">c</a><image xlink:href=\"./cover.jpg\" width=\"10\"/>";

		final RewriteResult result = rewriter.rewrite(DOCUMENT, svg, matcher);

		assertEquals("<a href=\"cover.png\">c</a><image xlink:href=\"./cover.png\" width=\"10\"/>", result.getContent());
	}

	@Test
	void toleratesSpacingAndCase() {
		final RewriteResult result = rewriter.rewrite(DOCUMENT, "<IMG SRC = \"cover.jpg\">", matcher);

		assertEquals("<IMG SRC = \"cover.png\">", result.getContent());
	}

	@Test
	void leavesOtherAttributesAlone() {
		final String html = "<img data-src=\"cover.jpg\" src=\"mycover.jpg\"/><p>cover.jpg</p>";

		final RewriteResult result = rewriter.rewrite(DOCUMENT, html, matcher);

		assertFalse(result.isChanged());
		assertSame(html, result.getContent());
	}

	@Test
	void secondPassChangesNothing() {
		final String html = "<img src=\"../images/cover.jpg\"/>";

		final String once = rewriter.rewrite(DOCUMENT, html, matcher).getContent();
		final RewriteResult twice = rewriter.rewrite(DOCUMENT, once, matcher);

		assertFalse(twice.isChanged());
		assertEquals(once, twice.getContent());
	}

	/* */
	private static PathMapping mapping() {
		final PathMapping mapping = new PathMapping();
		mapping.put("OEBPS/images/cover.jpg", "OEBPS/images/cover.png");
		return mapping;
	}
}
