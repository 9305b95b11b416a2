package com.mempooltracker.events;

import java.util.Optional;

import org.apache.commons.lang3.Validate;

import lombok.Getter;

/**
 * Unit of work on the task queue: newly observed transaction bytes, or a trigger for one of the periodic
 * reconciliations.
 */
@Getter
public class Task {

	public enum TaskType {
		RAW_TX, PRUNE_CHECK, MEMPOOL_STATE
	}

	private static final Task PRUNE_CHECK = new Task(TaskType.PRUNE_CHECK, null);
	private static final Task MEMPOOL_STATE = new Task(TaskType.MEMPOOL_STATE, null);

	private final TaskType taskType;
	private final byte[] rawTx;

	private Task(TaskType taskType, byte[] rawTx) {
		this.taskType = taskType;
		this.rawTx = rawTx;
	}

	public static Task rawTx(byte[] rawTx) {
		Validate.notNull(rawTx, "rawTx can't be null");
		return new Task(TaskType.RAW_TX, rawTx);
	}

	public static Task pruneCheck() {
		return PRUNE_CHECK;
	}

	public static Task mempoolState() {
		return MEMPOOL_STATE;
	}

	public Optional<byte[]> tryGetRawTx() {
		if (this.taskType == TaskType.RAW_TX) {
			return Optional.ofNullable(rawTx);
		}
		return Optional.empty();
	}

	@Override
	public String toString() {
		if (taskType == TaskType.RAW_TX) {
			return "Task(RAW_TX, " + rawTx.length + " bytes)";
		}
		return "Task(" + taskType + ")";
	}
}
