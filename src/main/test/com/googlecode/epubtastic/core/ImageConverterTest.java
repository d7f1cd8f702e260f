package com.googlecode.epubtastic.core;

import com.googlecode.epubtastic.core.processing.ErrorDiffusionQuantizer;
import com.googlecode.epubtastic.core.processing.MedianCutQuantizer;
import com.googlecode.epubtastic.core.processing.Quantizer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.File;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 *
 */
class ImageConverterTest {

	@TempDir
	File dir;

	private final Logger log = new Logger("none");

	@Test
	void jpegBecomesPngAndOriginalIsRemoved() throws Exception {
		final File jpeg = write("cover.jpg", EpubFixtures.imageBytes(EpubFixtures.gradient(40, 20, BufferedImage.TYPE_INT_RGB), "jpg"));

		final File result = converter(new ErrorDiffusionQuantizer(4)).convert(jpeg);

		assertEquals(new File(dir, "cover.png"), result);
		assertFalse(jpeg.exists());
		final BufferedImage decoded = ImageIO.read(result);
		assertEquals(40, decoded.getWidth());
		assertEquals(20, decoded.getHeight());

		final Set<Integer> allowed = new HashSet<>(Arrays.asList(0, 85, 170, 255));
		for (int y = 0; y < 20; y++) {
			for (int x = 0; x < 40; x++) {
				assertTrue(allowed.contains(decoded.getRGB(x, y) & 0xFF));
			}
		}
	}

	@Test
	void pngIsOverwrittenInPlace() throws Exception {
		final File png = write("logo.png", EpubFixtures.imageBytes(EpubFixtures.gradient(16, 16, BufferedImage.TYPE_INT_ARGB), "png"));

		final File result = converter(new MedianCutQuantizer()).convert(png);

		assertEquals(png, result);
		assertTrue(png.exists());
		final PngImage image = PngImageReader.read(Files.readAllBytes(png.toPath()));
		assertEquals(4, image.getBitDepth());
		assertEquals(PngImageType.INDEXED_COLOR.getColorType(), image.getColorType());
		for (PngChunk chunk : image.getChunks()) {
			assertTrue(PngImageReader.isCritical(chunk), chunk.getTypeString());
		}
	}

	@Test
	void undecodableImageIsLeftAlone() throws Exception {
		final byte[] junk = "not an image".getBytes("US-ASCII");
		final File broken = write("broken.jpg", junk);

		final EpubException e = assertThrows(EpubException.class, () -> converter(new ErrorDiffusionQuantizer(4)).convert(broken));

		assertEquals(EpubException.Kind.IMAGE_DECODE, e.getKind());
		assertFalse(e.getKind().isFatal());
		assertArrayEquals(junk, Files.readAllBytes(broken.toPath()));
		assertFalse(new File(dir, "broken.png").exists());
	}

	@Test
	void quantizerFailureIsAnEncodeError() throws Exception {
		final byte[] jpegBytes = EpubFixtures.imageBytes(EpubFixtures.gradient(8, 8, BufferedImage.TYPE_INT_RGB), "jpg");
		final File jpeg = write("cover.jpg", jpegBytes);
		final Quantizer failing = new Quantizer() {
			@Override
			public QuantizedImage quantize(Raster raster) {
				throw new ArrayIndexOutOfBoundsException(99);
			}

			@Override
			public String describe() {
				return "failing";
			}
		};

		final EpubException e = assertThrows(EpubException.class, () -> converter(failing).convert(jpeg));

		assertEquals(EpubException.Kind.IMAGE_ENCODE, e.getKind());
		assertArrayEquals(jpegBytes, Files.readAllBytes(jpeg.toPath()));
		assertFalse(new File(dir, "cover.png").exists());
	}

	@Test
	void existingTargetIsNotOverwritten() throws Exception {
		final byte[] jpegBytes = EpubFixtures.imageBytes(EpubFixtures.gradient(8, 8, BufferedImage.TYPE_INT_RGB), "jpg");
		final byte[] pngBytes = EpubFixtures.imageBytes(EpubFixtures.gradient(8, 8, BufferedImage.TYPE_INT_RGB), "png");
		final File jpeg = write("a.jpg", jpegBytes);
		final File png = write("a.png", pngBytes);

		final EpubException e = assertThrows(EpubException.class, () -> converter(new ErrorDiffusionQuantizer(4)).convert(jpeg));

		assertEquals(EpubException.Kind.IMAGE_ENCODE, e.getKind());
		assertArrayEquals(jpegBytes, Files.readAllBytes(jpeg.toPath()));
		assertArrayEquals(pngBytes, Files.readAllBytes(png.toPath()));
	}

	@Test
	void greyRasterIsReadDirectly() {
		final BufferedImage grey = new BufferedImage(3, 2, BufferedImage.TYPE_BYTE_GRAY);
		grey.getRaster().setSample(1, 1, 0, 200);
		grey.getRaster().setSample(2, 0, 0, 37);

		final Raster raster = ImageConverter.toGreyscale(grey);

		assertEquals(200, raster.get(1, 1));
		assertEquals(37, raster.get(2, 0));
		assertEquals(0, raster.get(0, 0));
	}

	@Test
	void colorPixelsUseLuma() {
		final BufferedImage rgb = new BufferedImage(2, 1, BufferedImage.TYPE_INT_ARGB);
		rgb.setRGB(0, 0, 0x80FF0000);
		rgb.setRGB(1, 0, 0xFFFFFFFF);

		final Raster raster = ImageConverter.toGreyscale(rgb);

		assertEquals(76, raster.get(0, 0));
		assertEquals(255, raster.get(1, 0));
	}

	@Test
	void luminance() {
		assertEquals(0, ImageConverter.luminance(0, 0, 0));
		assertEquals(255, ImageConverter.luminance(255, 255, 255));
		assertEquals(76, ImageConverter.luminance(255, 0, 0));
		assertEquals(150, ImageConverter.luminance(0, 255, 0));
		assertEquals(29, ImageConverter.luminance(0, 0, 255));
	}

	@Test
	void recognisesImageNames() {
		assertTrue(ImageConverter.isImage("a/b/Cover.JPG"));
		assertTrue(ImageConverter.isImage("photo.jpeg"));
		assertTrue(ImageConverter.isImage("logo.png"));
		assertFalse(ImageConverter.isImage("anim.gif"));
		assertFalse(ImageConverter.isImage("style.css"));
	}

	/* */
	private ImageConverter converter(Quantizer quantizer) {
		return new ImageConverter(log, quantizer, new PngEncoder(log, 9));
	}

	/* */
	private File write(String name, byte[] bytes) throws Exception {
		final File file = new File(dir, name);
		Files.write(file.toPath(), bytes);
		return file;
	}
}
