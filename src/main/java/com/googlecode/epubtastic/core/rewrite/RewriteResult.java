package com.googlecode.epubtastic.core.rewrite;

/**
 * Holds the outcome of rewriting one file
 */
public class RewriteResult {

	private final String content;
	public String getContent() { return content; }

	private final int replacements;
	public int getReplacements() { return replacements; }

	/** */
	public RewriteResult(String content, int replacements) {
		this.content = content;
		this.replacements = replacements;
	}

	/** */
	public static RewriteResult unchanged(String content) {
		return new RewriteResult(content, 0);
	}

	/** */
	public boolean isChanged() {
		return replacements > 0;
	}
}
