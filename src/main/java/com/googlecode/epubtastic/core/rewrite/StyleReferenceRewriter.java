package com.googlecode.epubtastic.core.rewrite;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites {@code url(...)} references in style sheets. Quoted and unquoted forms are
 * recognised; every rewritten reference comes out as {@code url("...")}.
 */
public class StyleReferenceRewriter implements ReferenceRewriter {

	private static final Pattern URL = Pattern.compile(
			"url\\(\\s*(?:\"([^\"]*)\"|'([^']*)'|([^)'\"\\s]*))\\s*\\)",
			Pattern.CASE_INSENSITIVE);

	/** {@inheritDoc} */
	@Override
	public RewriteResult rewrite(String documentPath, String content, ReferenceMatcher matcher) {
		final Matcher m = URL.matcher(content);
		final StringBuffer result = new StringBuffer(content.length());
		int replacements = 0;

		while (m.find()) {
			final String value = (m.group(1) != null) ? m.group(1) : (m.group(2) != null) ? m.group(2) : m.group(3);
			final String renamed = matcher.rename(documentPath, value);
			if (renamed == null) {
				m.appendReplacement(result, Matcher.quoteReplacement(m.group()));
				continue;
			}
			m.appendReplacement(result, Matcher.quoteReplacement("url(\"" + renamed + "\")"));
			replacements++;
		}
		m.appendTail(result);

		return (replacements == 0) ? RewriteResult.unchanged(content) : new RewriteResult(result.toString(), replacements);
	}
}
