package com.googlecode.epubtastic.core.rewrite;

/**
 * Rewrite the image references of one content file dialect. Running a rewriter
 * over its own output changes nothing.
 */
public interface ReferenceRewriter {

	/**
	 * @param documentPath The path of the file being rewritten, relative to the archive root
	 * @param content The file content
	 * @param matcher Decides which references point at renamed images
	 * @return The new content and whether anything changed
	 */
	public RewriteResult rewrite(String documentPath, String content, ReferenceMatcher matcher);
}
