package com.gotopipe.stacker.batch;

import com.gotopipe.stacker.model.GroupingKey;
import com.gotopipe.stacker.model.StackGroupUpdate;
import com.gotopipe.stacker.reader.DateWindow;
import com.gotopipe.stacker.reader.PartitionIntegrityException;
import com.gotopipe.stacker.reader.WindowReadResult;
import com.gotopipe.stacker.reader.WindowReader;
import com.gotopipe.stacker.segment.Burst;
import com.gotopipe.stacker.segment.SequenceSegmenter;
import com.gotopipe.stacker.store.ConcurrentObservationUpdateException;
import com.gotopipe.stacker.store.ObservationStore;
import com.gotopipe.stacker.store.ObservationStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Orchestrates a stacking run.
 *
 * <p>For every partition of the observation stream:</p>
 * <ul>
 *   <li>Reading its records within the anchored date window</li>
 *   <li>Segmenting them into bursts</li>
 *   <li>Planning stack groups and pass-throughs</li>
 *   <li>Writing each group back to the store in its own transaction</li>
 * </ul>
 *
 * <p>A partition with inconsistent records, or one whose records changed under a write, is reported
 * and skipped; the other partitions are still processed. Partitions share no mutable state, so they may
 * be processed on several threads.</p>
 */
public class StackingOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(StackingOrchestrator.class);

    private final ObservationStore store;
    private final List<String> independentColumns;
    private final WindowReader windowReader;
    private final SequenceSegmenter segmenter;
    private final StackBatcher batcher;
    private final StackingMetrics metrics;
    private final int parallelism;

    public StackingOrchestrator(
            ObservationStore store,
            List<String> independentColumns,
            WindowReader windowReader,
            SequenceSegmenter segmenter,
            StackBatcher batcher,
            StackingMetrics metrics,
            int parallelism) {
        if (independentColumns == null || independentColumns.isEmpty()) {
            throw new IllegalArgumentException("independent columns are required");
        }
        this.store = store;
        this.independentColumns = List.copyOf(independentColumns);
        this.windowReader = windowReader;
        this.segmenter = segmenter;
        this.batcher = batcher;
        this.metrics = metrics;
        this.parallelism = Math.max(1, parallelism);
    }

    /**
     * Runs the stacker over every partition.
     *
     * @return per-partition outcomes and totals
     * @throws ObservationStoreException if the store fails other than by a conflicting update
     */
    public StackingResult run(RunOptions options) throws ObservationStoreException {
        List<GroupingKey> keys = store.listGroupingKeys(independentColumns);
        if (keys.isEmpty()) {
            LOGGER.info("no partitions found for columns={}", independentColumns);
            return StackingResult.empty(StopReason.NO_PARTITIONS);
        }

        DateWindow window = windowReader.resolveWindow();
        LOGGER.info("starting stacking run: partitions={}, window=[{}, {}], streamClosed={}, parallelism={}",
            keys.size(), window.from(), window.to(), options.streamClosed(), parallelism);

        List<PartitionOutcome> outcomes = parallelism == 1 || keys.size() == 1
            ? processSequentially(keys, window, options)
            : processConcurrently(keys, window, options);

        StackingResult.Builder result = StackingResult.builder();
        outcomes.forEach(result::add);
        StackingResult built = result.build();

        LOGGER.info("stacking run complete: {} partitions processed, {} failed, {} stacks ({} observations), {} passed through, {} deferred",
            built.getPartitionsProcessed(), built.getPartitionsFailed(), built.getStacksPromoted(),
            built.getObservationsPromoted(), built.getObservationsPassedThrough(), built.getChunksDeferred());
        return built;
    }

    public StackingResult run() throws ObservationStoreException {
        return run(RunOptions.DEFAULT);
    }

    private List<PartitionOutcome> processSequentially(List<GroupingKey> keys, DateWindow window, RunOptions options)
            throws ObservationStoreException {
        List<PartitionOutcome> outcomes = new ArrayList<>(keys.size());
        for (GroupingKey key : keys) {
            outcomes.add(processPartition(key, window, options));
        }
        return outcomes;
    }

    private List<PartitionOutcome> processConcurrently(List<GroupingKey> keys, DateWindow window, RunOptions options)
            throws ObservationStoreException {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, keys.size()));
        try {
            List<Callable<PartitionOutcome>> tasks = new ArrayList<>(keys.size());
            for (GroupingKey key : keys) {
                tasks.add(() -> processPartition(key, window, options));
            }
            List<PartitionOutcome> outcomes = new ArrayList<>(keys.size());
            for (Future<PartitionOutcome> future : executor.invokeAll(tasks)) {
                outcomes.add(future.get());
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ObservationStoreException("stacking run interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ObservationStoreException) {
                throw (ObservationStoreException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new ObservationStoreException("partition processing failed: " + cause.getMessage(), cause);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Reads, segments, plans and applies one partition.
     */
    PartitionOutcome processPartition(GroupingKey key, DateWindow window, RunOptions options) throws ObservationStoreException {
        WindowReadResult readResult;
        try {
            readResult = windowReader.read(key, window);
        } catch (PartitionIntegrityException e) {
            LOGGER.error("partition_integrity_error: rejecting partition {}: {}", key, e.getMessage());
            return record(PartitionOutcome.rejected(key, e.getMessage()));
        }

        if (readResult.isEmpty()) {
            return record(PartitionOutcome.empty(key));
        }

        List<Burst> bursts = segmenter.segment(readResult.getObservations());
        int maxSet = store.maxSetId(key);
        BatchPlan plan = batcher.plan(bursts, maxSet, options.streamClosed());

        int stacks = 0;
        int promoted = 0;
        int passedThrough = 0;
        for (StackGroupUpdate group : plan.getGroups()) {
            try {
                store.applyUpdates(group);
            } catch (ConcurrentObservationUpdateException e) {
                LOGGER.warn("store_conflict: partition {} changed during the run, stopping after {} groups: {}",
                    key, stacks, e.getMessage());
                return record(PartitionOutcome.conflict(key, readResult.getObservations().size(), bursts.size(),
                    stacks, promoted, passedThrough, e.getMessage()));
            }
            if (group.getKind() == StackGroupUpdate.Kind.STACK) {
                stacks++;
                promoted += group.size();
                metrics.recordStackPromoted(group.size());
                LOGGER.info("promoted stack set={} of {} observations, partition={}, burst={}",
                    group.getSet(), group.size(), key, group.getBurstId());
            } else {
                passedThrough += group.size();
                metrics.recordPassedThrough(group.size());
                LOGGER.info("passed through {} observations, partition={}, burst={}", group.size(), key, group.getBurstId());
            }
        }

        return record(PartitionOutcome.processed(key, readResult.getObservations().size(), plan));
    }

    private PartitionOutcome record(PartitionOutcome outcome) {
        metrics.recordPartition(outcome);
        return outcome;
    }
}
