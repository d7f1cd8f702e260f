package com.googlecode.epubtastic.core;

/**
 * A progress notification for one archive run.
 */
public class ReductionEvent {

	private final String archiveName;
	public String getArchiveName() { return archiveName; }

	private final ReductionStage stage;
	public ReductionStage getStage() { return stage; }

	/** Human readable specifics, may be null */
	private final String detail;
	public String getDetail() { return detail; }

	/** Size stats, only set once the stage is COMPLETED */
	private final ReductionResult result;
	public ReductionResult getResult() { return result; }

	/** */
	public ReductionEvent(String archiveName, ReductionStage stage, String detail, ReductionResult result) {
		this.archiveName = archiveName;
		this.stage = stage;
		this.detail = detail;
		this.result = result;
	}

	@Override
	public String toString() {
		return archiveName + " " + stage + ((detail == null) ? "" : ": " + detail);
	}
}
