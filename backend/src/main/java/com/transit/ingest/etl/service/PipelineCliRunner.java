package com.transit.ingest.etl.service;

import com.transit.ingest.config.IngestProperties;
import com.transit.ingest.etl.model.RejectedRecord;
import com.transit.ingest.etl.model.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class PipelineCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(PipelineCliRunner.class);
    private static final int SAMPLE_REJECTS = 10;

    private final IngestProperties properties;
    private final PipelineOrchestratorService orchestratorService;
    private final ConfigurableApplicationContext applicationContext;

    public PipelineCliRunner(
        IngestProperties properties,
        PipelineOrchestratorService orchestratorService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestratorService = orchestratorService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        String dataset = properties.getCli().getDataset();
        List<String> datasetArgs = args.getOptionValues("dataset");
        if (datasetArgs != null && !datasetArgs.isEmpty()) {
            dataset = datasetArgs.get(0);
        }

        int exitCode;
        try {
            RunSummary summary = orchestratorService.run(dataset);
            logSummary(summary);
            exitCode = summary.load().failedBatches().isEmpty() ? 0 : 2;
        } catch (PipelineFailedException e) {
            log.error("Run for {} failed during {}", e.dataset(), e.failedStage(), e.getCause());
            exitCode = 1;
        }

        if (properties.getCli().isExitAfterRun()) {
            int code = exitCode;
            System.exit(SpringApplication.exit(applicationContext, () -> code));
        }
    }

    private void logSummary(RunSummary summary) {
        log.info(
            "Summary {}: status={}, pages={}, truncated={}, extracted={}, clean={}, rejected={}, duplicates={}",
            summary.dataset(),
            summary.status(),
            summary.pagesFetched(),
            summary.truncated(),
            summary.extractedCount(),
            summary.cleanedCount(),
            summary.rejectedCount(),
            summary.duplicatesCollapsed()
        );
        log.info(
            "Load {}: persisted={} (inserted={}, updated={}, unchanged={}), failedBatches={}, failedRecords={}",
            summary.dataset(),
            summary.load().persistedCount(),
            summary.load().insertedCount(),
            summary.load().updatedCount(),
            summary.load().unchangedCount(),
            summary.load().failedBatches().size(),
            summary.load().failedRecordCount()
        );
        if (!summary.rejected().isEmpty()) {
            log.info("Rejects by reason for {}: {}", summary.dataset(), summary.rejectsByReason());
            for (RejectedRecord rejected : summary.rejected().subList(0, Math.min(SAMPLE_REJECTS, summary.rejectedCount()))) {
                log.info("Rejected {}: {}", rejected.reason().describe(), rejected.raw().payload());
            }
        }
    }
}
