package com.mempooltracker.components.alarms;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
public class AlarmLoggerImpl implements AlarmLogger {

	static final int MAX_ALARMS = 1000;

	private final Deque<String> alarms = new ConcurrentLinkedDeque<>();
	private final AtomicInteger alarmCount = new AtomicInteger();
	private final Clock clock;

	public AlarmLoggerImpl(Clock clock) {
		this.clock = clock;
	}

	@Override
	public void addAlarm(String alarm) {
		log.warn("ALARM: {}", alarm);
		alarms.addLast(Instant.now(clock) + " " + alarm);
		// Oldest alarms go first.
		if (alarmCount.incrementAndGet() > MAX_ALARMS && alarms.pollFirst() != null) {
			alarmCount.decrementAndGet();
		}
	}

	@Override
	public List<String> getAlarmList() {
		return new ArrayList<>(alarms);
	}

}
