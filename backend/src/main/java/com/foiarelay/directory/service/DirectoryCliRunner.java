package com.foiarelay.directory.service;

import com.foiarelay.config.DirectoryProperties;
import com.foiarelay.directory.model.PipelineRunRequest;
import com.foiarelay.directory.model.PipelineRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class DirectoryCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(DirectoryCliRunner.class);

    private final DirectoryProperties properties;
    private final DirectoryPipelineService pipelineService;
    private final ConfigurableApplicationContext applicationContext;

    public DirectoryCliRunner(
        DirectoryProperties properties,
        DirectoryPipelineService pipelineService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.pipelineService = pipelineService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        int limit = properties.getCli().getLimit();
        PipelineRunRequest request = new PipelineRunRequest(limit > 0 ? limit : null, null, null);
        PipelineRunSummary summary = pipelineService.run(request);
        log.info(
            "Directory run {} completed with status {}: {} registry units, {} scraped, {} with email, {} canonical records",
            summary.runId(),
            summary.status(),
            summary.registryCount(),
            summary.scrapedCount(),
            summary.withEmailCount(),
            summary.canonicalCount()
        );

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> DirectoryPipelineService.STATUS_FAILED.equals(summary.status()) ? 1 : 0);
            System.exit(exitCode);
        }
    }
}
