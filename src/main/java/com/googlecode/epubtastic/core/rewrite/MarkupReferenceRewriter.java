package com.googlecode.epubtastic.core.rewrite;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites image references held in {@code src}, {@code href} and {@code xlink:href}
 * attributes of html and xhtml documents. The quote character and everything but the
 * file name are left exactly as they were.
 */
public class MarkupReferenceRewriter implements ReferenceRewriter {

	private static final Pattern ATTRIBUTE = Pattern.compile(
			"(?<![\\w:.-])((?:xlink:)?(?:src|href)\\s*=\\s*)(?:\"([^\"]*)\"|'([^']*)')",
			Pattern.CASE_INSENSITIVE);

	/** {@inheritDoc} */
	@Override
	public RewriteResult rewrite(String documentPath, String content, ReferenceMatcher matcher) {
		final Matcher m = ATTRIBUTE.matcher(content);
		final StringBuffer result = new StringBuffer(content.length());
		int replacements = 0;

		while (m.find()) {
			final boolean doubleQuoted = m.group(2) != null;
			final String value = doubleQuoted ? m.group(2) : m.group(3);
			final String renamed = matcher.rename(documentPath, value);
			if (renamed == null) {
				m.appendReplacement(result, Matcher.quoteReplacement(m.group()));
				continue;
			}
			final char quote = doubleQuoted ? '"' : '\'';
			m.appendReplacement(result, Matcher.quoteReplacement(m.group(1) + quote + renamed + quote));
			replacements++;
		}
		m.appendTail(result);

		return (replacements == 0) ? RewriteResult.unchanged(content) : new RewriteResult(result.toString(), replacements);
	}
}
