package com.googlecode.epubtastic.core.rewrite;

import com.googlecode.epubtastic.core.MatchMode;
import com.googlecode.epubtastic.core.PathMapping;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

/**
 *
 */
class StyleReferenceRewriterTest {

	private static final String DOCUMENT = "OEBPS/styles/style.css";

	private final ReferenceRewriter rewriter = new StyleReferenceRewriter();
	private final ReferenceMatcher matcher = new ReferenceMatcher(mapping(), MatchMode.FILENAME);

	@Test
	void singleQuotedUrlIsNormalised() {
		final RewriteResult result = rewriter.rewrite(DOCUMENT, "background: url('../images/bg.jpg');", matcher);

		assertEquals("background: url(\"../images/bg.png\");", result.getContent());
		assertEquals(1, result.getReplacements());
	}

	@Test
	void unquotedAndDoubleQuotedUrls() {
		final String css = "a { background: url(bg.jpg) } b { background: url( \"../images/bg.jpg\" ) }";

		final RewriteResult result = rewriter.rewrite(DOCUMENT, css, matcher);

		assertEquals("a { background: url(\"bg.png\") } b { background: url(\"../images/bg.png\") }", result.getContent());
		assertEquals(2, result.getReplacements());
	}

	@Test
	void otherUrlsAreUntouched() {
		final String css = "@font-face { src: url('fonts/a.woff'); } p { background: url(  'x.jpg' ); }";

		final RewriteResult result = rewriter.rewrite(DOCUMENT, css, matcher);

		assertFalse(result.isChanged());
		assertEquals(css, result.getContent());
	}

	@Test
	void secondPassChangesNothing() {
		final String once = rewriter.rewrite(DOCUMENT, "div { background-image: url('../images/bg.jpg') }", matcher).getContent();

		assertFalse(rewriter.rewrite(DOCUMENT, once, matcher).isChanged());
	}

	/* */
	private static PathMapping mapping() {
		final PathMapping mapping = new PathMapping();
		mapping.put("OEBPS/images/bg.jpg", "OEBPS/images/bg.png");
		return mapping;
	}
}
