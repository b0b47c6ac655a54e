package com.newsagent.ingestion;

import com.newsagent.model.BatchPipelineResult;
import com.newsagent.model.NewsApiStatus;
import com.newsagent.model.PipelineResult;
import com.newsagent.model.PipelineStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineRunnerTest {

    private static final PipelineStatus HEALTHY =
            new PipelineStatus(true, NewsApiStatus.ok(10, 10), Map.of(), null, "2026-10-19T06:00");

    @Mock
    private NewsPipelineService pipeline;

    @InjectMocks
    private PipelineRunner runner;

    @Test
    void topicMode_shouldExitZeroOnSuccess() {
        when(pipeline.pipelineStatus()).thenReturn(HEALTHY);
        when(pipeline.processTopic("ai", null, "en", "publishedAt"))
                .thenReturn(PipelineResult.completed("topic:ai", 5, 5, 0, "2026-10-19T06:00"));

        runner.run(args("--mode=topic", "--topics=ai"));

        assertEquals(0, runner.getExitCode());
    }

    @Test
    void topicMode_shouldPassLanguageAndSort() {
        when(pipeline.pipelineStatus()).thenReturn(HEALTHY);
        when(pipeline.processTopic("ki", "2026-10-01", "de", "relevancy"))
                .thenReturn(PipelineResult.completed("topic:ki", 1, 1, 0, "t"));

        assertEquals(0, runner.execute(args("--mode=topic", "--topics=ki", "--from-date=2026-10-01",
                "--language=de", "--sort-by=relevancy")));
    }

    @Test
    void topicMode_shouldRejectSeveralTopics() {
        when(pipeline.pipelineStatus()).thenReturn(HEALTHY);

        assertEquals(1, runner.execute(args("--mode=topic", "--topics=ai,climate")));
        verify(pipeline, never()).processTopic(anyString(), any(), any(), any());
    }

    @Test
    void failedPipeline_shouldExitOne() {
        when(pipeline.pipelineStatus()).thenReturn(HEALTHY);
        when(pipeline.processTopHeadlines("us", null))
                .thenReturn(PipelineResult.failure("headlines:us", "No headlines found", "t"));

        assertEquals(1, runner.execute(args("--mode=headlines")));
    }

    @Test
    void headlinesMode_shouldUseCountryAndCategory() {
        when(pipeline.pipelineStatus()).thenReturn(HEALTHY);
        when(pipeline.processTopHeadlines("gb", "business"))
                .thenReturn(PipelineResult.completed("headlines:gb/business", 3, 3, 0, "t"));

        assertEquals(0, runner.execute(args("--mode=headlines", "--country=gb", "--category=business")));
    }

    @Test
    void batchMode_shouldSplitTopics() {
        when(pipeline.pipelineStatus()).thenReturn(HEALTHY);
        when(pipeline.batchProcessTopics(List.of("ai", "climate", "markets"), "2026-10-01"))
                .thenReturn(new BatchPipelineResult(true, 3, 12, 1, List.of(), "t"));

        assertEquals(0, runner.execute(args("--mode=batch", "--topics=ai, climate", "--topics=markets",
                "--from-date=2026-10-01")));
    }

    @Test
    void domainMode_shouldRequireDomain() {
        when(pipeline.pipelineStatus()).thenReturn(HEALTHY);

        assertEquals(1, runner.execute(args("--mode=domain")));
        verify(pipeline, never()).processDomain(anyString(), any());
    }

    @Test
    void domainMode_shouldProcessDomain() {
        when(pipeline.pipelineStatus()).thenReturn(HEALTHY);
        when(pipeline.processDomain("bbc.co.uk", null))
                .thenReturn(PipelineResult.completed("domain:bbc.co.uk", 2, 2, 0, "t"));

        assertEquals(0, runner.execute(args("--mode=domain", "--domain=bbc.co.uk")));
    }

    @Test
    void unhealthyStatus_shouldStopBeforeProcessing() {
        when(pipeline.pipelineStatus())
                .thenReturn(new PipelineStatus(false, NewsApiStatus.error("down"), Map.of(), "down", "t"));

        assertEquals(1, runner.execute(args("--mode=topic", "--topics=ai")));
        verify(pipeline, never()).processTopic(anyString(), any(), any(), any());
    }

    @Test
    void missingMode_shouldExitOneWithoutCallingUpstreams() {
        assertEquals(1, runner.execute(args("--topics=ai")));
        verifyNoInteractions(pipeline);
    }

    @Test
    void unknownMode_shouldExitOne() {
        when(pipeline.pipelineStatus()).thenReturn(HEALTHY);

        assertEquals(1, runner.execute(args("--mode=rss")));
    }

    private static DefaultApplicationArguments args(String... args) {
        return new DefaultApplicationArguments(args);
    }
}
