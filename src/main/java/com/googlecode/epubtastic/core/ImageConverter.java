package com.googlecode.epubtastic.core;

import com.googlecode.epubtastic.core.processing.Quantizer;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.awt.image.WritableRaster;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.Iterator;
import java.util.Locale;

/**
 * Converts one image file to a quantized greyscale png next to it.
 */
public class ImageConverter {

	public static final String OUTPUT_EXTENSION = ".png";

	private final Logger log;
	private final Quantizer quantizer;
	private final PngEncoder encoder;

	/** */
	public ImageConverter(Logger log, Quantizer quantizer, PngEncoder encoder) {
		this.log = log;
		this.quantizer = quantizer;
		this.encoder = encoder;
	}

	/**
	 * Decode, reduce to grey, quantize and write {@code <stem>.png} beside the source.
	 * A source with a different name is deleted afterwards, a png of the same name is
	 * overwritten.
	 *
	 * @return the converted file
	 * @throws EpubException of kind IMAGE_DECODE or IMAGE_ENCODE, the source is then left as it was
	 */
	public File convert(File source) {
		final File target = new File(source.getParentFile(), stem(source.getName()) + OUTPUT_EXTENSION);
		final boolean renamed = !target.getName().equals(source.getName());
		if (renamed && target.exists() && !isSameFile(source, target)) {
			throw new EpubException(EpubException.Kind.IMAGE_ENCODE,
					String.format("Not converting %s, %s already exists", source.getName(), target.getName()));
		}

		final BufferedImage image = decode(source);
		final Raster raster;
		try {
			raster = toGreyscale(image);
		} catch (RuntimeException e) {
			throw new EpubException(EpubException.Kind.IMAGE_DECODE, "Error reading pixels of " + source.getName() + ": " + e, e);
		}

		final byte[] bytes;
		try {
			bytes = encoder.encode(quantizer.quantize(raster));
		} catch (EpubException e) {
			throw e;
		} catch (IOException | RuntimeException e) {
			throw new EpubException(EpubException.Kind.IMAGE_ENCODE, "Error encoding " + source.getName() + ": " + e, e);
		}

		try {
			Files.write(target.toPath(), bytes);
		} catch (IOException e) {
			throw new EpubException(EpubException.Kind.IMAGE_ENCODE, "Error writing " + target.getName() + ": " + e.getMessage(), e);
		}

		if (renamed && !isSameFile(source, target)) {
			try {
				Files.delete(source.toPath());
			} catch (IOException e) {
				target.delete();
				throw new EpubException(EpubException.Kind.IMAGE_ENCODE, "Error removing " + source.getName() + ": " + e.getMessage(), e);
			}
		}

		log.debug("    Converted: %s (%.1f KB)", quantizer.describe(), bytes.length / 1024D);
		return target;
	}

	/**
	 * Read the first image of the file with whichever ImageIO reader claims it.
	 */
	BufferedImage decode(File source) {
		try (ImageInputStream ins = ImageIO.createImageInputStream(source)) {
			if (ins == null) {
				throw new EpubException(EpubException.Kind.IMAGE_DECODE, "Can't open " + source.getName());
			}
			final Iterator<ImageReader> readers = ImageIO.getImageReaders(ins);
			if (!readers.hasNext()) {
				throw new EpubException(EpubException.Kind.IMAGE_DECODE, "Unsupported image format: " + source.getName());
			}

			final ImageReader reader = readers.next();
			try {
				reader.setInput(ins, true, true);
				final BufferedImage image = reader.read(0);
				log.debug("    Original: %s %dx%d (%.1f KB)", reader.getFormatName().toUpperCase(Locale.ROOT),
						image.getWidth(), image.getHeight(), source.length() / 1024D);
				return image;
			} finally {
				reader.dispose();
			}
		} catch (EpubException e) {
			throw e;
		} catch (IOException | RuntimeException e) {
			// image plugins also fail with unchecked exceptions, e.g. CMMException for a broken icc profile
			throw new EpubException(EpubException.Kind.IMAGE_DECODE, "Error decoding " + source.getName() + ": " + e, e);
		}
	}

	/**
	 * Reduce to one 8-bit luminance channel, dropping alpha. Grey rasters are read
	 * directly so no color space conversion touches them.
	 */
	static Raster toGreyscale(BufferedImage image) {
		final int width = image.getWidth();
		final int height = image.getHeight();
		final Raster result = new Raster(width, height);

		final ColorModel colorModel = image.getColorModel();
		final WritableRaster data = image.getRaster();
		if (!(colorModel instanceof IndexColorModel) && colorModel.getColorSpace().getType() == ColorSpace.TYPE_GRAY) {
			final int max = (1 << colorModel.getComponentSize(0)) - 1;
			for (int y = 0; y < height; y++) {
				for (int x = 0; x < width; x++) {
					result.set(x, y, (int) ((data.getSample(x, y, 0) * 255L + max / 2) / max));
				}
			}
			return result;
		}

		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				final int rgb = image.getRGB(x, y);
				result.set(x, y, luminance((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF));
			}
		}
		return result;
	}

	/** ITU-R 601-2 luma in 16.16 fixed point */
	static int luminance(int r, int g, int b) {
		return (r * 19595 + g * 38470 + b * 7471 + 0x8000) >> 16;
	}

	/** */
	public static boolean isImage(String fileName) {
		final String lower = fileName.toLowerCase(Locale.ROOT);
		return lower.endsWith(".png") || lower.endsWith(".jpg") || lower.endsWith(".jpeg");
	}

	/* */
	private static String stem(String fileName) {
		final int dot = fileName.lastIndexOf('.');
		return (dot > 0) ? fileName.substring(0, dot) : fileName;
	}

	/* */
	private static boolean isSameFile(File a, File b) {
		try {
			return b.exists() && Files.isSameFile(a.toPath(), b.toPath());
		} catch (IOException e) {
			return false;
		}
	}
}
