package com.newsagent.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsagent.cache.DeploymentMode;
import com.newsagent.cache.HeadlineCache;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class CacheConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public HeadlineCache headlineCache(@Value("${news.cache.mode:development}") String mode,
                                       @Value("${news.cache.dir:cache}") String cacheDir,
                                       ObjectMapper objectMapper,
                                       Clock clock) {
        return HeadlineCache.create(DeploymentMode.fromSetting(mode), Path.of(cacheDir), objectMapper, clock);
    }
}
