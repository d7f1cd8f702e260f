package com.googlecode.epubtastic.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The tally of a run over several archives
 */
public class BatchResult {

	private final List<ReductionResult> results = new ArrayList<>();
	public List<ReductionResult> getResults() { return Collections.unmodifiableList(results); }

	/** */
	public void add(ReductionResult result) {
		results.add(result);
	}

	/** */
	public int getSuccessful() {
		int count = 0;
		for (ReductionResult result : results) {
			if (result.isSuccess()) {
				count++;
			}
		}
		return count;
	}

	/** */
	public int getFailed() {
		return results.size() - getSuccessful();
	}

	/**
	 * Get the number of bytes saved over all successful archives
	 */
	public long getTotalSavings() {
		long totalSavings = 0;
		for (ReductionResult result : results) {
			if (result.isSuccess()) {
				totalSavings += result.getSizeDifference();
			}
		}
		return totalSavings;
	}
}
