package com.googlecode.epubtastic.core;

/**
 * Callback for tracking archive runs.
 */
public interface ReductionListener {

	/** Does nothing */
	ReductionListener NONE = new ReductionListener() {
		@Override
		public void onEvent(ReductionEvent event) { }
	};

	/**
	 * Called on every stage change and for each converted image, on the thread doing the work.
	 */
	void onEvent(ReductionEvent event);
}
