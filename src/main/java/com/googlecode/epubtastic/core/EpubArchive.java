package com.googlecode.epubtastic.core;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Enumeration;
import java.util.List;
import java.util.zip.CRC32;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import java.util.zip.ZipOutputStream;

/**
 * Unpacks and repacks the zip container. The {@code mimetype} entry, when there is
 * one, goes first and is stored uncompressed so readers can sniff the file type;
 * everything else is deflated.
 */
public class EpubArchive {

	public static final String MIMETYPE = "mimetype";

	private final Logger log;

	/** */
	public EpubArchive(Logger log) {
		this.log = log;
	}

	/**
	 * @throws EpubException of kind ARCHIVE_READ if the file is missing, not a zip, or has an entry outside the root
	 */
	public void extract(File archive, File toDir) {
		if (!archive.isFile()) {
			throw new EpubException(EpubException.Kind.ARCHIVE_READ, "File '" + archive + "' not found");
		}

		final Path root = toDir.toPath().toAbsolutePath().normalize();
		try (ZipFile zip = new ZipFile(archive)) {
			final Enumeration<? extends ZipEntry> entries = zip.entries();
			while (entries.hasMoreElements()) {
				final ZipEntry entry = entries.nextElement();
				final Path target = root.resolve(entry.getName().replace('\\', '/')).normalize();
				if (!target.startsWith(root) || target.equals(root)) {
					throw new EpubException(EpubException.Kind.ARCHIVE_READ, "Entry outside the archive root: " + entry.getName());
				}

				if (entry.isDirectory()) {
					Files.createDirectories(target);
					continue;
				}
				Files.createDirectories(target.getParent());
				try (InputStream ins = zip.getInputStream(entry)) {
					Files.copy(ins, target);
				}
				log.debug("extracted: %s", entry.getName());
			}
		} catch (IOException e) {
			throw new EpubException(EpubException.Kind.ARCHIVE_READ, "Error reading " + archive.getName() + ": " + e.getMessage(), e);
		}
	}

	/**
	 * @throws EpubException of kind ARCHIVE_WRITE
	 */
	public void repack(File fromDir, File archive) {
		final File mimetype = new File(fromDir, MIMETYPE);

		try (ZipOutputStream zip = new ZipOutputStream(new FileOutputStream(archive))) {
			zip.setMethod(ZipOutputStream.DEFLATED);

			if (mimetype.isFile()) {
				writeStored(zip, MIMETYPE, mimetype);
			} else {
				log.debug("No %s entry, writing archive without it", MIMETYPE);
			}

			for (File file : listFiles(fromDir)) {
				if (file.equals(mimetype)) {
					continue;
				}
				final ZipEntry entry = new ZipEntry(relativePath(fromDir, file));
				zip.putNextEntry(entry);
				copy(file, zip);
				zip.closeEntry();
			}
		} catch (IOException e) {
			throw new EpubException(EpubException.Kind.ARCHIVE_WRITE, "Error writing " + archive.getName() + ": " + e.getMessage(), e);
		}
	}

	/**
	 * Every regular file below the directory, depth first with names sorted so the
	 * output does not depend on directory listing order.
	 */
	public static List<File> listFiles(File dir) {
		final List<File> files = new ArrayList<>();
		collect(dir, files);
		return files;
	}

	/** Path below the root with {@code /} separators */
	public static String relativePath(File root, File file) {
		return root.toPath().relativize(file.toPath()).toString().replace(File.separatorChar, '/');
	}

	/* */
	private static void collect(File dir, List<File> files) {
		final File[] children = dir.listFiles();
		if (children == null) {
			return;
		}
		Arrays.sort(children);
		for (File child : children) {
			if (child.isDirectory()) {
				collect(child, files);
			} else if (child.isFile()) {
				files.add(child);
			}
		}
	}

	/* stored entries need their size and crc up front */
	private void writeStored(ZipOutputStream zip, String name, File file) throws IOException {
		final byte[] bytes = Files.readAllBytes(file.toPath());
		final CRC32 crc = new CRC32();
		crc.update(bytes);

		final ZipEntry entry = new ZipEntry(name);
		entry.setMethod(ZipEntry.STORED);
		entry.setSize(bytes.length);
		entry.setCompressedSize(bytes.length);
		entry.setCrc(crc.getValue());

		zip.putNextEntry(entry);
		zip.write(bytes);
		zip.closeEntry();
	}

	/* */
	private static void copy(File file, OutputStream out) throws IOException {
		try (InputStream ins = new FileInputStream(file)) {
			final byte[] block = new byte[8192];
			int readLength;
			while ((readLength = ins.read(block)) != -1) {
				out.write(block, 0, readLength);
			}
		}
	}
}
