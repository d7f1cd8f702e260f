package com.googlecode.epubtastic.ant;

import com.googlecode.epubtastic.core.BatchResult;
import com.googlecode.epubtastic.core.EpubReducer;
import com.googlecode.epubtastic.core.MatchMode;
import com.googlecode.epubtastic.core.QuantizerType;
import com.googlecode.epubtastic.core.ReductionEvent;
import com.googlecode.epubtastic.core.ReductionListener;
import org.apache.tools.ant.BuildException;
import org.apache.tools.ant.DirectoryScanner;
import org.apache.tools.ant.Project;
import org.apache.tools.ant.Task;
import org.apache.tools.ant.types.FileSet;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Epubtastic reducer ant task
 * <pre>
 * &lt;epubreducer toDir="build/reduced" mode="palette"&gt;
 *     &lt;fileset dir="books" includes="**&#47;*.epub"/&gt;
 * &lt;/epubreducer&gt;
 * </pre>
 *
 * @author rayvanderborght
 */
public class EpubReducerTask extends Task {

	private String toDir;
	public String getToDir() { return this.toDir; }
	public void setToDir(String toDir) { this.toDir = toDir; }

	private String mode = QuantizerType.DITHER.getOption();
	public String getMode() { return mode; }
	public void setMode(String mode) { this.mode = mode; }

	private Integer levels = QuantizerType.DEFAULT_DITHER_LEVELS;
	public Integer getLevels() { return levels; }
	public void setLevels(Integer levels) { this.levels = levels; }

	private Integer compressionLevel = 9;
	public Integer getCompressionLevel() { return this.compressionLevel; }
	public void setCompressionLevel(Integer compressionLevel) { this.compressionLevel = compressionLevel; }

	private String matchMode = MatchMode.FILENAME.getOption();
	public String getMatchMode() { return matchMode; }
	public void setMatchMode(String matchMode) { this.matchMode = matchMode; }

	private Boolean failOnError = Boolean.FALSE;
	public Boolean getFailOnError() { return failOnError; }
	public void setFailOnError(Boolean failOnError) { this.failOnError = failOnError; }

	private String logLevel;
	public String getLogLevel() { return this.logLevel; }
	public void setLogLevel(String logLevel) { this.logLevel = logLevel; }

	private final List<FileSet> filesets = new ArrayList<>();
	public void addFileset(FileSet fileset) {
		if (!this.filesets.contains(fileset)) {
			this.filesets.add(fileset);
		}
	}

	@Override
	public void execute() throws BuildException {
		if (toDir == null) {
			throw new BuildException("toDir is required");
		}

		final long start = System.currentTimeMillis();
		final EpubReducer reducer = new EpubReducer(logLevel);
		try {
			reducer.setQuantizerType(QuantizerType.forOption(mode));
			reducer.setLevels(levels);
			reducer.setCompressionLevel(compressionLevel);
			reducer.setMatchMode(MatchMode.forOption(matchMode));
		} catch (IllegalArgumentException e) {
			throw new BuildException(e.getMessage(), e);
		}
		reducer.setListener(new ReductionListener() {
			@Override
			public void onEvent(ReductionEvent event) {
				switch (event.getStage()) {
					case OPEN:
						log("Processing: " + event.getArchiveName());
						break;
					case COMPLETED:
						log(event.getResult().toString());
						break;
					case FAILED:
						log(String.format("Problem reducing %s. Caught %s", event.getArchiveName(), event.getDetail()), Project.MSG_ERR);
						break;
					default:
						log(event.toString(), Project.MSG_VERBOSE);
						break;
				}
			}
		});

		final BatchResult result = new BatchResult();
		for (FileSet fileset : filesets) {
			final DirectoryScanner ds = fileset.getDirectoryScanner(getProject());
			for (String src : ds.getIncludedFiles()) {
				final File input = new File(fileset.getDir(getProject()), src);

				// keep nested dirs of a **/* fileset so same named books don't collide
				final String parent = new File(src).getParent();
				final File outputDir = (parent == null) ? new File(toDir) : new File(toDir, parent);

				result.add(reducer.processArchive(input, outputDir));
			}
		}

		final int total = result.getResults().size();
		log(String.format("Processed %d files in %d milliseconds, saving %d bytes",
				total, System.currentTimeMillis() - start, result.getTotalSavings()));

		if (failOnError && result.getFailed() > 0) {
			throw new BuildException(result.getFailed() + " of " + total + " files could not be reduced");
		}
	}
}
