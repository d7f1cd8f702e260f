package com.googlecode.epubtastic.core.processing;

import com.googlecode.epubtastic.core.EpubException;
import com.googlecode.epubtastic.core.Logger;
import com.googlecode.epubtastic.core.PngFilterType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Implement PNG filtering
 *
 * @author rayvanderborght
 */
public class PngtasticFilterHandler implements PngFilterHandler {

	private final Logger log;

	/** */
	public PngtasticFilterHandler(Logger log) {
		this.log = log;
	}

	/**
	 * {@inheritDoc}
	 *
	 * Works from the last scanline up so every line is filtered against an unfiltered predecessor.
	 */
	@Override
	public void applyFiltering(PngFilterType filterType, List<byte[]> scanlines, int sampleBitCount) {
		for (int i = scanlines.size() - 1; i >= 0; i--) {
			final byte[] line = scanlines.get(i);
			final byte[] previousLine = (i == 0) ? new byte[line.length] : scanlines.get(i - 1);
			line[0] = filterType.getValue();
			filter(line, previousLine, sampleBitCount);
		}
	}

	/** {@inheritDoc} */
	@Override
	public List<byte[]> applyAdaptiveFiltering(Map<PngFilterType, List<byte[]>> filteredScanlines) {
		final int rows = filteredScanlines.values().iterator().next().size();
		final List<byte[]> result = new ArrayList<>(rows);

		for (int row = 0; row < rows; row++) {
			byte[] best = null;
			long bestSum = Long.MAX_VALUE;
			for (PngFilterType filterType : PngFilterType.standardValues()) {
				final List<byte[]> scanlines = filteredScanlines.get(filterType);
				if (scanlines == null) {
					continue;
				}
				final byte[] line = scanlines.get(row);
				final long sum = absoluteSum(line);
				if (sum < bestSum) {
					bestSum = sum;
					best = line;
				}
			}
			result.add(best.clone());
		}
		log.debug("Adaptive filtering chose per scanline filters for %d rows", rows);

		return result;
	}

	/**
	 * {@inheritDoc}
	 *
	 * The bytes are named as follows (x = current, a = previous, b = above, c = previous and above)
	 * <pre>
	 * c b
	 * a x
	 * </pre>
	 */
	@Override
	public void filter(byte[] line, byte[] previousLine, int sampleBitCount) {
		final PngFilterType filterType = PngFilterType.forValue(line[0]);
		final int bpp = Math.max(1, sampleBitCount / 8);
		final byte[] original = line.clone();

		switch (filterType) {
			case NONE:
				break;

			case SUB:
				for (int x = 1; x < line.length; x++) {
					line[x] = (byte) (original[x] - left(original, x, bpp));
				}
				break;

			case UP:
				for (int x = 1; x < line.length; x++) {
					line[x] = (byte) (original[x] - previousLine[x]);
				}
				break;

			case AVERAGE:
				for (int x = 1; x < line.length; x++) {
					line[x] = (byte) (original[x] - (left(original, x, bpp) + (0xFF & previousLine[x])) / 2);
				}
				break;

			case PAETH:
				for (int x = 1; x < line.length; x++) {
					final int a = left(original, x, bpp);
					final int b = 0xFF & previousLine[x];
					final int c = left(previousLine, x, bpp);
					line[x] = (byte) (original[x] - paethPredictor(a, b, c));
				}
				break;

			default:
				throw new EpubException(EpubException.Kind.IMAGE_ENCODE, "Unrecognized filter type " + filterType);
		}
	}

	/* the byte one pixel to the left, zero before the start of the line */
	private static int left(byte[] line, int x, int bpp) {
		return (x - bpp < 1) ? 0 : (0xFF & line[x - bpp]);
	}

	/* */
	private static int paethPredictor(int a, int b, int c) {
		final int p = a + b - c;
		final int pa = Math.abs(p - a);
		final int pb = Math.abs(p - b);
		final int pc = Math.abs(p - c);

		if (pa <= pb && pa <= pc) {
			return a;
		}
		return (pb <= pc) ? b : c;
	}

	/* */
	private static long absoluteSum(byte[] line) {
		long sum = 0;
		for (int x = 1; x < line.length; x++) {
			sum += Math.abs((int) line[x]);
		}
		return sum;
	}
}
