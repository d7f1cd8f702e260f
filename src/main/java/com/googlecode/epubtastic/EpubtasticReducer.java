package com.googlecode.epubtastic;

import com.googlecode.epubtastic.core.BatchResult;
import com.googlecode.epubtastic.core.EpubReducer;
import com.googlecode.epubtastic.core.MatchMode;
import com.googlecode.epubtastic.core.QuantizerType;
import com.googlecode.epubtastic.core.ReductionEvent;
import com.googlecode.epubtastic.core.ReductionListener;
import com.googlecode.epubtastic.core.ReductionStage;

import java.io.File;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces epub file sizes by converting their images to low bit depth greyscale png
 *
 * @see <a href="https://www.w3.org/TR/epub-33/#sec-container-zip">EPUB zip container</a>
 * @see <a href="http://www.w3.org/TR/PNG">PNG spec</a>
 *
 * @author rayvanderborght
 */
public class EpubtasticReducer {
	/** */
	private static final String HELP = "java -cp epubtastic-x.x.jar com.googlecode.epubtastic.EpubtasticReducer [options] file1.epub [file2.epub ..]\n"
			+ "Options:\n"
			+ "  --toDir            the directory where reduced files go (default: output, will be created if it doesn't exist)\n"
			+ "  --mode             dither for n-level Floyd-Steinberg dithering, palette for a 16 level palette (default: dither)\n"
			+ "  --levels           grey levels when dithering, 2-256 (default: 4, i.e. 2 bits per pixel)\n"
			+ "  --compressionLevel the png compression level; 0-9 allowed (default 9, anything else tries them all by brute force)\n"
			+ "  --matchMode        filename to match references by file name, path to match by full path (default: filename)\n"
			+ "  --logLevel         the level of logging output (none, debug, info, or error; default: info)\n";

	private static final String SEPARATOR = "==================================================";

	private final BatchResult result;
	public BatchResult getResult() { return result; }

	/** */
	public EpubtasticReducer(String toDir, String[] fileNames, QuantizerType mode, Integer levels,
			Integer compressionLevel, MatchMode matchMode, String logLevel, final PrintStream out) {

		final long start = System.currentTimeMillis();

		final EpubReducer reducer = new EpubReducer(logLevel);
		reducer.setQuantizerType(mode);
		reducer.setLevels(levels);
		reducer.setCompressionLevel(compressionLevel);
		reducer.setMatchMode(matchMode);
		reducer.setListener(new ReductionListener() {
			@Override
			public void onEvent(ReductionEvent event) {
				if (event.getStage() == ReductionStage.OPEN) {
					out.println(SEPARATOR);
				} else if (event.getStage() == ReductionStage.COMPLETED) {
					out.println(event.getResult());
				}
			}
		});

		final List<File> files = new ArrayList<>();
		for (String fileName : fileNames) {
			files.add(new File(fileName));
		}
		result = reducer.processArchives(files, new File(toDir));

		if (fileNames.length > 1) {
			out.println(SEPARATOR);
			out.println("SUMMARY:");
			out.println("Successfully processed: " + result.getSuccessful());
			out.println("Failed: " + result.getFailed());
		}
		out.println(String.format("Processed %d files in %d milliseconds, saving %d bytes",
				fileNames.length, System.currentTimeMillis() - start, result.getTotalSavings()));
	}

	/** */
	public static void main(String[] args) {
		Map<String, String> options = new HashMap<>();
		int last = 0;
		for (int i = 0; i < args.length; i++) {
			String arg = args[i];
			if (arg.startsWith("--")) {
				int next = i + 1;
				if (next < args.length) {
					options.put(arg, args[next]);
					last = next + 1;
				} else {
					options.put(arg, null);
					last = next;
				}
			}
		}
		String[] files = Arrays.copyOfRange(args, last, args.length);

		if (files.length == 0) {
			System.out.println("No files to process");
			System.out.println(HELP);
			return;
		}

		String toDir = (options.get("--toDir") == null) ? "output" : options.get("--toDir");
		QuantizerType mode = QuantizerType.forOption(options.get("--mode"));
		Integer levels = safeInteger(options.get("--levels"), QuantizerType.DEFAULT_DITHER_LEVELS);
		Integer compressionLevel = options.containsKey("--compressionLevel")
				? safeInteger(options.get("--compressionLevel"), null) : Integer.valueOf(9);
		MatchMode matchMode = MatchMode.forOption(options.get("--matchMode"));
		String logLevel = (options.get("--logLevel") == null) ? "info" : options.get("--logLevel");

		if (levels < 2 || levels > 256) {
			System.out.println("--levels must be between 2 and 256");
			System.out.println(HELP);
			return;
		}

		EpubtasticReducer reducer = new EpubtasticReducer(toDir, files, mode, levels, compressionLevel, matchMode, logLevel, System.out);
		if (reducer.getResult().getFailed() > 0) {
			System.exit(1);
		}
	}

	/* */
	private static Integer safeInteger(String input, Integer dflt) {
		try {
			return Integer.valueOf(input);
		} catch (Exception e) {
			return dflt;
		}
	}
}
