package com.googlecode.epubtastic.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The renames made to images during one archive run, old relative path to new
 * relative path, in the order the images were converted. Paths are relative to
 * the extraction root and always use {@code /} separators.
 */
public class PathMapping {

	private final Map<String, String> paths = new LinkedHashMap<>();

	/**
	 * @throws IllegalArgumentException if the old path was already mapped, one source converts to exactly one destination
	 */
	public void put(String oldPath, String newPath) {
		if (paths.containsKey(oldPath)) {
			throw new IllegalArgumentException("Path already mapped: " + oldPath);
		}
		paths.put(oldPath, newPath);
	}

	/** */
	public String get(String oldPath) {
		return paths.get(oldPath);
	}

	/** */
	public boolean isEmpty() {
		return paths.isEmpty();
	}

	/** */
	public int size() {
		return paths.size();
	}

	/** Read only view in insertion order */
	public Map<String, String> asMap() {
		return Collections.unmodifiableMap(paths);
	}

	/**
	 * Old file name to new file name, leaving out images whose name did not change.
	 * When two images in different directories share a file name both resolve to
	 * the same entry.
	 */
	public Map<String, String> fileNames() {
		final Map<String, String> names = new LinkedHashMap<>();
		for (Map.Entry<String, String> entry : paths.entrySet()) {
			final String oldName = fileName(entry.getKey());
			final String newName = fileName(entry.getValue());
			if (!oldName.equals(newName)) {
				names.put(oldName, newName);
			}
		}
		return names;
	}

	/** The last path segment */
	public static String fileName(String path) {
		return path.substring(path.lastIndexOf('/') + 1);
	}

	@Override
	public String toString() {
		return paths.toString();
	}
}
