package com.transit.ingest.etl.service;

import com.transit.ingest.etl.contract.ContractRegistry;
import com.transit.ingest.etl.contract.DataContract;
import com.transit.ingest.etl.extract.ApiExtractor;
import com.transit.ingest.etl.model.ExtractionResult;
import com.transit.ingest.etl.model.LoadResult;
import com.transit.ingest.etl.model.PipelineState;
import com.transit.ingest.etl.model.RunSummary;
import com.transit.ingest.etl.model.TransformResult;
import com.transit.ingest.etl.transform.RecordTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.function.Supplier;

@Service
public class PipelineOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestratorService.class);

    private final ContractRegistry contractRegistry;
    private final SourceConfigFactory sourceConfigFactory;
    private final ApiExtractor extractor;
    private final RecordTransformer transformer;
    private final RecordLoaderService loader;

    public PipelineOrchestratorService(
        ContractRegistry contractRegistry,
        SourceConfigFactory sourceConfigFactory,
        ApiExtractor extractor,
        RecordTransformer transformer,
        RecordLoaderService loader
    ) {
        this.contractRegistry = contractRegistry;
        this.sourceConfigFactory = sourceConfigFactory;
        this.extractor = extractor;
        this.transformer = transformer;
        this.loader = loader;
    }

    public RunSummary run(String dataset) {
        return execute(newRun(dataset));
    }

    public PipelineRun newRun(String dataset) {
        contractRegistry.get(dataset);
        return new PipelineRun(dataset.trim());
    }

    /**
     * Runs extraction, transformation and load in order. A stage failure (or a stop request)
     * fails the run and is rethrown as {@link PipelineFailedException}; later stages never run.
     * A {@link PipelineRun} is single-use; use {@link #newRun(String)} for every execution.
     *
     * @throws IllegalStateException if the run has already been executed
     */
    public RunSummary execute(PipelineRun run) {
        PipelineState current = run.state();
        if (current != PipelineState.IDLE) {
            throw new IllegalStateException(
                "Run for " + run.dataset() + " was already executed (state " + current + "); a PipelineRun is single-use"
            );
        }
        Instant startedAt = Instant.now();
        DataContract contract = contractRegistry.get(run.dataset());
        log.info("Pipeline run for {} started", run.dataset());

        ExtractionResult extraction = runStage(
            run,
            PipelineState.EXTRACTING,
            () -> extractor.extract(sourceConfigFactory.sourceFor(contract), run::isStopRequested)
        );
        TransformResult transformed = runStage(
            run,
            PipelineState.TRANSFORMING,
            () -> transformer.transform(extraction.records(), contract)
        );
        LoadResult load = runStage(
            run,
            PipelineState.LOADING,
            () -> loader.load(transformed.clean(), sourceConfigFactory.loadTargetFor(contract), run::isStopRequested)
        );
        run.advanceTo(PipelineState.DONE);

        RunSummary summary = new RunSummary(
            run.dataset(),
            PipelineState.DONE,
            startedAt,
            Instant.now(),
            extraction.pagesFetched(),
            extraction.truncated(),
            extraction.records().size(),
            transformed.clean().size(),
            transformed.duplicatesCollapsed(),
            transformed.rejected(),
            load
        );
        log.info(
            "Pipeline run for {} done: pages={}, extracted={}, clean={}, rejected={}, duplicates={}, inserted={}, updated={}, unchanged={}, failedBatches={}",
            summary.dataset(),
            summary.pagesFetched(),
            summary.extractedCount(),
            summary.cleanedCount(),
            summary.rejectedCount(),
            summary.duplicatesCollapsed(),
            load.insertedCount(),
            load.updatedCount(),
            load.unchangedCount(),
            load.failedBatches().size()
        );
        return summary;
    }

    private <T> T runStage(PipelineRun run, PipelineState stage, Supplier<T> work) {
        if (run.isStopRequested()) {
            PipelineCancelledException stopped = new PipelineCancelledException(
                "Run for " + run.dataset() + " stopped before " + stage
            );
            run.fail(stopped);
            throw new PipelineFailedException(run.dataset(), run.failedStage(), stopped);
        }
        run.advanceTo(stage);
        try {
            return work.get();
        } catch (RuntimeException e) {
            run.fail(e);
            log.warn("Pipeline run for {} failed during {}: {}", run.dataset(), stage, e.getMessage());
            throw new PipelineFailedException(run.dataset(), stage, e);
        }
    }
}
