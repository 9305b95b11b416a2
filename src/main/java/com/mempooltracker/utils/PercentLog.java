package com.mempooltracker.utils;

import java.util.function.Consumer;

/**
 * Reports the progress of a long loop every time it crosses a new step of ten percent.
 */
public class PercentLog {

	private static final int STEP = 10;

	private final int total;
	private int lastReported = -1;

	public PercentLog(int total) {
		this.total = total;
	}

	/**
	 * @param index zero based index of the element just processed
	 */
	public void update(int index, Consumer<String> reporter) {
		if (total <= 0) {
			return;
		}
		int percent = (int) (((long) Math.min(index + 1, total) * 100) / total);
		int step = percent / STEP;
		if (step > lastReported) {
			lastReported = step;
			reporter.accept(step * STEP + "%");
		}
	}
}
