package com.mempooltracker.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.mempooltracker.components.containers.TaskQueue;

@Configuration
public class WorkerConfig {

	@Bean
	public TaskQueue taskQueue(MempoolTrackerProperties properties) {
		return new TaskQueue(properties.getQueue().getCapacity());
	}
}
