package com.newsagent.ingestion;

import com.newsagent.model.BatchPipelineResult;
import com.newsagent.model.PipelineResult;
import com.newsagent.model.PipelineStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Command-line entry point of the ingestion worker, active under the {@code ingestion} profile.
 *
 * <pre>
 * --mode=topic|headlines|domain|batch
 * --topics=a,b   --domain=example.com   --country=us   --category=technology
 * --from-date=2024-01-31   --language=en   --sort-by=publishedAt
 * </pre>
 */
@Component
@Profile("ingestion")
public class PipelineRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    private final NewsPipelineService pipeline;
    private int exitCode = 0;

    public PipelineRunner(NewsPipelineService pipeline) {
        this.pipeline = pipeline;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(ApplicationArguments args) {
        String mode = option(args, "mode", null);
        if (mode == null) {
            log.error("Missing --mode (topic, headlines, domain or batch)");
            return 1;
        }

        PipelineStatus status = pipeline.pipelineStatus();
        if (!status.success()) {
            log.error("Pipeline status check failed: {}", status.error());
            return 1;
        }
        log.info("Pipeline status check passed");

        String fromDate = option(args, "from-date", null);
        List<String> topics = topics(args);

        switch (mode.toLowerCase(Locale.ROOT)) {
            case "topic": {
                if (topics.size() != 1) {
                    log.error("Topic mode requires exactly one topic");
                    return 1;
                }
                return report(pipeline.processTopic(topics.get(0), fromDate,
                        option(args, "language", "en"), option(args, "sort-by", "publishedAt")));
            }
            case "headlines":
                return report(pipeline.processTopHeadlines(option(args, "country", "us"), option(args, "category", null)));
            case "domain": {
                String domain = option(args, "domain", null);
                if (domain == null) {
                    log.error("Domain mode requires --domain parameter");
                    return 1;
                }
                return report(pipeline.processDomain(domain, fromDate));
            }
            case "batch": {
                if (topics.isEmpty()) {
                    log.error("Batch mode requires --topics parameter");
                    return 1;
                }
                BatchPipelineResult result = pipeline.batchProcessTopics(topics, fromDate);
                log.info("Pipeline completed successfully! Topics: {}, total processed: {}, total failed: {}, timestamp: {}",
                        result.topicsProcessed(), result.totalArticlesProcessed(), result.totalArticlesFailed(),
                        result.timestamp());
                return result.success() ? 0 : 1;
            }
            default:
                log.error("Unknown mode '{}' (expected topic, headlines, domain or batch)", mode);
                return 1;
        }
    }

    private int report(PipelineResult result) {
        if (!result.success()) {
            log.error("Pipeline failed: {}", result.error() != null ? result.error() : "Unknown error");
            return 1;
        }
        log.info("Pipeline completed successfully! Articles fetched: {}, processed: {}, failed: {}, timestamp: {}",
                result.articlesFetched(), result.articlesProcessed(), result.articlesFailed(), result.timestamp());
        return 0;
    }

    private static List<String> topics(ApplicationArguments args) {
        List<String> topics = new ArrayList<>();
        List<String> values = args.getOptionValues("topics");
        if (values == null) {
            return topics;
        }
        for (String value : values) {
            for (String topic : value.split(",")) {
                if (!topic.isBlank()) {
                    topics.add(topic.trim());
                }
            }
        }
        return topics;
    }

    private static String option(ApplicationArguments args, String name, String fallback) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return fallback;
        }
        return values.get(0).trim();
    }
}
