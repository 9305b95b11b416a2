package com.mempooltracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.ConfigurableApplicationContext;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@SpringBootApplication
@EnableFeignClients
@ConfigurationPropertiesScan
public class MempoolTrackerApplication {

	private static ConfigurableApplicationContext context;

	public static void main(String[] args) {
		context = SpringApplication.run(MempoolTrackerApplication.class, args);
	}

	// Runs on its own thread: closing the context joins worker and listener threads, one of which may be the caller.
	public static void exit() {
		Thread exitThread = new Thread(() -> {
			log.info("Shutting down mempoolTracker.");
			int exitCode = 1;
			if (context != null) {
				exitCode = SpringApplication.exit(context, () -> 1);
			}
			System.exit(exitCode);
		}, "mempool-tracker-exit");
		exitThread.start();
	}

}
