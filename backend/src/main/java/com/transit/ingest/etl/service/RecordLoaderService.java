package com.transit.ingest.etl.service;

import com.transit.ingest.etl.contract.ContractField;
import com.transit.ingest.etl.contract.DataContract;
import com.transit.ingest.etl.model.CleanRecord;
import com.transit.ingest.etl.model.FailedBatch;
import com.transit.ingest.etl.model.LoadResult;
import com.transit.ingest.etl.model.LoadTarget;
import com.transit.ingest.etl.model.UpsertOutcome;
import com.transit.ingest.etl.persistence.ContractTableRepository;
import com.transit.ingest.etl.persistence.SchemaMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedRuntimeException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Persists clean records into the contract's table. The table is checked (and created when
 * absent) before any write. Records are upserted in fixed-size batches, one transaction per
 * batch, applied sequentially.
 */
@Service
public class RecordLoaderService {
    private static final Logger log = LoggerFactory.getLogger(RecordLoaderService.class);

    private final ContractTableRepository repository;
    private final TransactionTemplate transactionTemplate;

    public RecordLoaderService(ContractTableRepository repository, TransactionTemplate transactionTemplate) {
        this.repository = repository;
        this.transactionTemplate = transactionTemplate;
    }

    public LoadResult load(List<CleanRecord> records, LoadTarget target) {
        return load(records, target, () -> false);
    }

    public LoadResult load(List<CleanRecord> records, LoadTarget target, BooleanSupplier stopRequested) {
        DataContract contract = target.contract();
        ensureTable(contract);

        int inserted = 0;
        int updated = 0;
        int unchanged = 0;
        List<FailedBatch> failedBatches = new ArrayList<>();
        int batchCount = (records.size() + target.batchSize() - 1) / target.batchSize();

        for (int batchIndex = 0; batchIndex < batchCount; batchIndex++) {
            if (stopRequested != null && stopRequested.getAsBoolean()) {
                throw new PipelineCancelledException(
                    "Load of " + contract.tableName() + " stopped before batch " + batchIndex + " of " + batchCount
                );
            }
            int from = batchIndex * target.batchSize();
            List<CleanRecord> batch = records.subList(from, Math.min(records.size(), from + target.batchSize()));
            try {
                Map<UpsertOutcome, Integer> outcomes = transactionTemplate.execute(status -> applyBatch(contract, batch));
                inserted += outcomes.getOrDefault(UpsertOutcome.INSERTED, 0);
                updated += outcomes.getOrDefault(UpsertOutcome.UPDATED, 0);
                unchanged += outcomes.getOrDefault(UpsertOutcome.UNCHANGED, 0);
            } catch (DataAccessException | TransactionException e) {
                FailedBatch failed = new FailedBatch(batchIndex, batch, rootMessage(e));
                if (target.failFast()) {
                    log.warn("Batch {} of {} failed; aborting load (fail-fast)", batchIndex, contract.tableName());
                    throw new BatchWriteException(failed, e);
                }
                log.warn(
                    "Batch {} of {} rolled back ({} records): {}",
                    batchIndex,
                    contract.tableName(),
                    batch.size(),
                    failed.errorMessage()
                );
                failedBatches.add(failed);
            }
        }

        LoadResult result = new LoadResult(inserted, updated, unchanged, failedBatches);
        log.info(
            "Loaded {} into {}: inserted={}, updated={}, unchanged={}, failedBatches={}",
            contract.name(),
            contract.tableName(),
            inserted,
            updated,
            unchanged,
            failedBatches.size()
        );
        return result;
    }

    void ensureTable(DataContract contract) {
        if (!repository.tableExists(contract.tableName())) {
            repository.createTable(contract);
            return;
        }
        Set<String> columns = repository.existingColumns(contract.tableName());
        List<String> missing = new ArrayList<>();
        for (ContractField field : contract.fields()) {
            if (!columns.contains(field.name().toLowerCase(Locale.ROOT))) {
                missing.add(field.name());
            }
        }
        if (!missing.isEmpty()) {
            throw new SchemaMismatchException(contract.tableName(), missing);
        }
    }

    private Map<UpsertOutcome, Integer> applyBatch(DataContract contract, List<CleanRecord> batch) {
        Map<UpsertOutcome, Integer> outcomes = new EnumMap<>(UpsertOutcome.class);
        for (CleanRecord record : batch) {
            outcomes.merge(repository.upsert(contract, record), 1, Integer::sum);
        }
        return outcomes;
    }

    private String rootMessage(NestedRuntimeException e) {
        Throwable root = e.getMostSpecificCause();
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
