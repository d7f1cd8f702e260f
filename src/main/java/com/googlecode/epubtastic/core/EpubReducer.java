package com.googlecode.epubtastic.core;

import com.googlecode.epubtastic.core.processing.Quantizer;
import com.googlecode.epubtastic.core.rewrite.ReferenceMatcher;
import com.googlecode.epubtastic.core.rewrite.ReferenceRewriter;
import com.googlecode.epubtastic.core.rewrite.RewriteResult;

import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.zip.Deflater;

/**
 * Shrinks epub files by converting their images to low bit depth greyscale png
 * and fixing every reference to the renamed files.
 *
 * <p>A run extracts the archive into its own scratch directory, converts all
 * images (collecting the old to new path mapping without touching any content
 * file), then applies the mapping to every markup, style and manifest file, and
 * finally repacks. Image and content file failures are logged and skipped; only
 * failing to read or write the archive fails the run. The scratch directory is
 * removed however the run ends.
 *
 * @author rayvanderborght
 */
public class EpubReducer {

	public static final String OUTPUT_EXTENSION = ".epub";

	private static final String BYTE_ORDER_MARK = "\uFEFF";

	private final Logger log;
	private final EpubArchive archive;

	private QuantizerType quantizerType = QuantizerType.DITHER;
	public QuantizerType getQuantizerType() { return quantizerType; }
	public void setQuantizerType(QuantizerType quantizerType) { this.quantizerType = quantizerType; }

	private Integer levels = QuantizerType.DEFAULT_DITHER_LEVELS;
	public Integer getLevels() { return levels; }
	/** Grey levels for dithering, 2-256, or null for the default */
	public void setLevels(Integer levels) {
		if (levels != null && (levels < 2 || levels > 256)) {
			throw new IllegalArgumentException("Grey levels must be between 2 and 256, got " + levels);
		}
		this.levels = levels;
	}

	private Integer compressionLevel = Deflater.BEST_COMPRESSION;
	public Integer getCompressionLevel() { return compressionLevel; }
	/** 0-9, or null to brute force every level */
	public void setCompressionLevel(Integer compressionLevel) { this.compressionLevel = compressionLevel; }

	private MatchMode matchMode = MatchMode.FILENAME;
	public MatchMode getMatchMode() { return matchMode; }
	public void setMatchMode(MatchMode matchMode) { this.matchMode = matchMode; }

	private ReductionListener listener = ReductionListener.NONE;
	public void setListener(ReductionListener listener) { this.listener = (listener == null) ? ReductionListener.NONE : listener; }

	public EpubReducer() {
		this(Logger.NONE);
	}

	public EpubReducer(String logLevel) {
		this(new Logger(logLevel));
	}

	public EpubReducer(Logger log) {
		this.log = log;
		this.archive = new EpubArchive(log);
	}

	/**
	 * Reduce each archive in turn. A failed archive never stops the ones after it.
	 */
	public BatchResult processArchives(List<File> inputs, File outputDir) {
		final BatchResult batch = new BatchResult();
		for (File input : inputs) {
			batch.add(processArchive(input, outputDir));
		}
		log.info("Processed %d archives: %d succeeded, %d failed, saving %d bytes",
				inputs.size(), batch.getSuccessful(), batch.getFailed(), batch.getTotalSavings());
		return batch;
	}

	/**
	 * Reduce one archive, writing {@code <outputDir>/<name>.epub}.
	 */
	public ReductionResult processArchive(File input, File outputDir) {
		final String name = input.getName();
		final long originalSize = input.length();
		log.info("Processing: %s", name);
		publish(name, ReductionStage.OPEN, null, null);

		try (ScratchDirectory scratch = new ScratchDirectory(log)) {
			final ReductionResult result = reduce(input, outputDir, scratch.getRoot());
			publish(name, ReductionStage.COMPLETED, null, result);
			return result;

		} catch (EpubException e) {
			log.error("Error processing %s: %s", name, e.getMessage());
			publish(name, ReductionStage.FAILED, e.getMessage(), null);
			return ReductionResult.failed(originalSize, e.getMessage());

		} catch (IOException e) {
			log.error("Error processing %s: couldn't create scratch directory: %s", name, e.getMessage());
			publish(name, ReductionStage.FAILED, e.getMessage(), null);
			return ReductionResult.failed(originalSize, e.getMessage());

		} catch (RuntimeException e) {
			log.error("Unexpected error processing %s: %s", name, e);
			publish(name, ReductionStage.FAILED, e.toString(), null);
			return ReductionResult.failed(originalSize, e.toString());
		}
	}

	/* */
	private ReductionResult reduce(File input, File outputDir, File scratch) {
		final String name = input.getName();
		final long originalSize = input.length();

		log.info("Extracting epub...");
		archive.extract(input, scratch);
		publish(name, ReductionStage.EXTRACTED, null, null);

		log.info("Processing images...");
		final PathMapping mapping = convertImages(name, scratch);
		publish(name, ReductionStage.IMAGES_CONVERTED, mapping.size() + " images converted", null);

		if (mapping.isEmpty()) {
			log.info("  No images found to process");
			publish(name, ReductionStage.REFERENCES_REWRITTEN, "No images found to process", null);
		} else {
			log.info("Updating file references...");
			final int rewritten = rewriteReferences(scratch, mapping);
			publish(name, ReductionStage.REFERENCES_REWRITTEN, rewritten + " files updated", null);
		}

		log.info("Repackaging epub...");
		final File output = outputFile(input, outputDir);
		try {
			archive.repack(scratch, output);
		} catch (RuntimeException e) {
			output.delete();
			throw e;
		}
		publish(name, ReductionStage.REPACKAGED, output.getPath(), null);

		final ReductionResult result = new ReductionResult(output, originalSize, output.length(), mapping.size());
		log.debug("%s", result);
		return result;
	}

	/**
	 * Convert every image below the root, collecting the renames.
	 */
	PathMapping convertImages(String archiveName, File root) {
		final ImageConverter converter = new ImageConverter(log, createQuantizer(), new PngEncoder(log, compressionLevel));
		final PathMapping mapping = new PathMapping();

		for (File file : EpubArchive.listFiles(root)) {
			if (!ImageConverter.isImage(file.getName())) {
				continue;
			}
			final String oldPath = EpubArchive.relativePath(root, file);
			log.debug("  Processing %s:", file.getName());
			try {
				final File converted = converter.convert(file);
				final String newPath = EpubArchive.relativePath(root, converted);
				mapping.put(oldPath, newPath);
				log.info("  Converted %s -> %s", file.getName(), converted.getName());
				publish(archiveName, ReductionStage.IMAGES_CONVERTED, oldPath + " -> " + newPath, null);

			} catch (RuntimeException e) {
				log.error("  Skipping %s: %s", oldPath, e.getMessage());
			}
		}
		return mapping;
	}

	/**
	 * Apply the mapping to every content file that can reference an image. Files
	 * without a match are not written.
	 *
	 * @return the number of files changed
	 */
	int rewriteReferences(File root, PathMapping mapping) {
		final ReferenceMatcher matcher = new ReferenceMatcher(mapping, matchMode);
		final Map<ReferenceDialect, ReferenceRewriter> rewriters = new EnumMap<>(ReferenceDialect.class);
		for (ReferenceDialect dialect : ReferenceDialect.values()) {
			rewriters.put(dialect, dialect.createRewriter(log));
		}

		int rewritten = 0;
		for (File file : EpubArchive.listFiles(root)) {
			final ReferenceDialect dialect = ReferenceDialect.forFileName(file.getName());
			if (dialect == null) {
				continue;
			}
			final String path = EpubArchive.relativePath(root, file);
			try {
				if (rewrite(file, path, rewriters.get(dialect), matcher)) {
					rewritten++;
				}
			} catch (RuntimeException e) {
				log.error("  Skipping %s: %s", path, e.getMessage());
			}
		}
		return rewritten;
	}

	/* */
	private boolean rewrite(File file, String path, ReferenceRewriter rewriter, ReferenceMatcher matcher) {
		String content;
		try {
			content = decode(Files.readAllBytes(file.toPath()));
		} catch (CharacterCodingException e) {
			throw new EpubException(EpubException.Kind.REFERENCE_REWRITE, "Not valid UTF-8, leaving " + path + " as it is", e);
		} catch (IOException e) {
			throw new EpubException(EpubException.Kind.REFERENCE_REWRITE, "Error reading " + path + ": " + e.getMessage(), e);
		}

		// the byte order mark goes back on when the file is written
		final boolean byteOrderMark = content.startsWith(BYTE_ORDER_MARK);
		if (byteOrderMark) {
			content = content.substring(BYTE_ORDER_MARK.length());
		}

		final RewriteResult result = rewriter.rewrite(path, content, matcher);
		if (!result.isChanged()) {
			return false;
		}

		final String rewritten = byteOrderMark ? BYTE_ORDER_MARK + result.getContent() : result.getContent();
		try {
			Files.write(file.toPath(), rewritten.getBytes(StandardCharsets.UTF_8));
		} catch (IOException e) {
			throw new EpubException(EpubException.Kind.REFERENCE_REWRITE, "Error writing " + path + ": " + e.getMessage(), e);
		}
		log.debug("  Updated %d references in %s", result.getReplacements(), path);
		return true;
	}

	/* malformed input is an error rather than a replacement character */
	private static String decode(byte[] bytes) throws CharacterCodingException {
		return StandardCharsets.UTF_8.newDecoder()
				.onMalformedInput(CodingErrorAction.REPORT)
				.onUnmappableCharacter(CodingErrorAction.REPORT)
				.decode(ByteBuffer.wrap(bytes))
				.toString();
	}

	/** */
	Quantizer createQuantizer() {
		return quantizerType.create(levels);
	}

	/* */
	private File outputFile(File input, File outputDir) {
		if (!outputDir.isDirectory() && !outputDir.mkdirs()) {
			throw new EpubException(EpubException.Kind.ARCHIVE_WRITE, "Couldn't create path: " + outputDir);
		}
		final String name = input.getName();
		final int dot = name.lastIndexOf('.');
		final File output = new File(outputDir, ((dot > 0) ? name.substring(0, dot) : name) + OUTPUT_EXTENSION);
		if (output.getAbsoluteFile().equals(input.getAbsoluteFile())) {
			throw new EpubException(EpubException.Kind.ARCHIVE_WRITE, "Output would overwrite the input: " + output);
		}
		return output;
	}

	/* */
	private void publish(String archiveName, ReductionStage stage, String detail, ReductionResult result) {
		listener.onEvent(new ReductionEvent(archiveName, stage, detail, result));
	}
}
