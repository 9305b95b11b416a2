package com.mempooltracker.config;

import org.springframework.boot.autoconfigure.mongo.MongoClientSettingsBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.mongodb.WriteConcern;

/**
 * Every acknowledged write is in the on-disk journal, so a crash loses at most the in-flight task.
 */
@Configuration
public class MongoConfig {

	@Bean
	public MongoClientSettingsBuilderCustomizer journaledWriteConcern() {
		return builder -> builder.writeConcern(WriteConcern.JOURNALED);
	}
}
