package com.googlecode.epubtastic.core;

import com.googlecode.epubtastic.core.rewrite.ManifestReferenceRewriter;
import com.googlecode.epubtastic.core.rewrite.MarkupReferenceRewriter;
import com.googlecode.epubtastic.core.rewrite.ReferenceRewriter;
import com.googlecode.epubtastic.core.rewrite.StyleReferenceRewriter;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * The kinds of content file that can reference an image, by file extension.
 */
public enum ReferenceDialect {
	MARKUP(".htm", ".html", ".xhtml"),
	STYLE(".css"),
	MANIFEST(".opf");

	private final List<String> extensions;

	ReferenceDialect(String... extensions) {
		this.extensions = Arrays.asList(extensions);
	}

	/** */
	public ReferenceRewriter createRewriter(Logger log) {
		switch (this) {
			case STYLE:
				return new StyleReferenceRewriter();
			case MANIFEST:
				return new ManifestReferenceRewriter(log);
			case MARKUP:
			default:
				return new MarkupReferenceRewriter();
		}
	}

	/**
	 * @return the dialect for the file name, or null if it can't hold image references
	 */
	public static ReferenceDialect forFileName(String fileName) {
		final String lower = fileName.toLowerCase(Locale.ROOT);
		for (ReferenceDialect dialect : values()) {
			for (String extension : dialect.extensions) {
				if (lower.endsWith(extension)) {
					return dialect;
				}
			}
		}
		return null;
	}
}
