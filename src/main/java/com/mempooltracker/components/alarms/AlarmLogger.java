package com.mempooltracker.components.alarms;

import java.util.List;

/**
 * Operational anomalies worth a human look, kept in memory alongside the log.
 */
public interface AlarmLogger {

	void addAlarm(String alarm);

	List<String> getAlarmList();

}
