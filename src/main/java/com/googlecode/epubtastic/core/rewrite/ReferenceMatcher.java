package com.googlecode.epubtastic.core.rewrite;

import com.googlecode.epubtastic.core.MatchMode;
import com.googlecode.epubtastic.core.PathMapping;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;

/**
 * Decides whether a reference found in a content file points at a renamed image
 * and, if it does, what the reference should become. Only the file name segment
 * is ever replaced; directories, query and fragment are kept as written.
 */
public class ReferenceMatcher {

	private final PathMapping mapping;
	private final MatchMode mode;
	private final Map<String, String> fileNames;

	/** */
	public ReferenceMatcher(PathMapping mapping, MatchMode mode) {
		this.mapping = mapping;
		this.mode = mode;
		this.fileNames = mapping.fileNames();
	}

	/**
	 * @param documentPath Archive relative path of the file holding the reference
	 * @param reference The reference as written in the file
	 * @return The rewritten reference, or null if it doesn't point at a renamed image
	 */
	public String rename(String documentPath, String reference) {
		if (reference == null || reference.isEmpty() || reference.contains("://") || reference.startsWith("data:")) {
			return null;
		}

		int end = reference.length();
		for (char c : new char[] { '?', '#' }) {
			final int i = reference.indexOf(c);
			if (i >= 0 && i < end) {
				end = i;
			}
		}
		final String path = reference.substring(0, end);
		final String suffix = reference.substring(end);
		final String oldName = PathMapping.fileName(path);
		final String directory = path.substring(0, path.length() - oldName.length());

		final String newName;
		if (mode == MatchMode.FULL_PATH) {
			final String resolved = resolve(documentPath, path);
			final String newPath = (resolved == null) ? null : mapping.get(resolved);
			newName = (newPath == null) ? null : PathMapping.fileName(newPath);
		} else {
			newName = fileNames.get(oldName);
		}

		if (newName == null || newName.equals(oldName)) {
			return null;
		}
		return directory + newName + suffix;
	}

	/**
	 * Resolve a reference against the directory of its document, folding {@code .} and {@code ..}.
	 *
	 * @return the archive relative path, or null if the reference climbs above the root
	 */
	static String resolve(String documentPath, String reference) {
		final Deque<String> segments = new ArrayDeque<>();
		if (!reference.startsWith("/")) {
			final int slash = documentPath.lastIndexOf('/');
			if (slash > 0) {
				for (String segment : documentPath.substring(0, slash).split("/")) {
					segments.addLast(segment);
				}
			}
		}

		for (String segment : reference.split("/")) {
			if (segment.isEmpty() || ".".equals(segment)) {
				continue;
			}
			if ("..".equals(segment)) {
				if (segments.isEmpty()) {
					return null;
				}
				segments.removeLast();
			} else {
				segments.addLast(segment);
			}
		}
		return String.join("/", segments);
	}
}
