package com.newsagent.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;

// the ingestion worker is a one-shot process
@Configuration
@EnableScheduling
@Profile("!ingestion")
public class SchedulingConfig {
}
