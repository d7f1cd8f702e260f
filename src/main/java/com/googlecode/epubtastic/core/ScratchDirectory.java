package com.googlecode.epubtastic.core;

import java.io.File;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * A uniquely named temporary directory owned by one archive run. Closing it
 * removes the directory and everything in it.
 */
public class ScratchDirectory implements AutoCloseable {

	private final Logger log;

	private final File root;
	public File getRoot() { return root; }

	/** */
	public ScratchDirectory(Logger log) throws IOException {
		this.log = log;
		this.root = Files.createTempDirectory("epubtastic-").toFile();
	}

	/**
	 * Delete the tree. Failures are logged, the run result does not depend on them.
	 */
	@Override
	public void close() {
		if (!root.exists()) {
			return;
		}
		try {
			Files.walkFileTree(root.toPath(), new SimpleFileVisitor<Path>() {
				@Override
				public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
					Files.delete(file);
					return FileVisitResult.CONTINUE;
				}

				@Override
				public FileVisitResult postVisitDirectory(Path dir, IOException e) throws IOException {
					if (e != null) {
						throw e;
					}
					Files.delete(dir);
					return FileVisitResult.CONTINUE;
				}
			});
		} catch (IOException e) {
			log.error("Couldn't remove scratch directory %s: %s", root, e.getMessage());
		}
	}
}
