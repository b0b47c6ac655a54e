package com.newsagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Profiles;

@SpringBootApplication
public class NewsAgentApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(NewsAgentApplication.class, args);
        if (context.getEnvironment().acceptsProfiles(Profiles.of("ingestion"))) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
