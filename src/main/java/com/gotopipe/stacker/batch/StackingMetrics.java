package com.gotopipe.stacker.batch;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;

/**
 * Metrics counters for stacking runs.
 *
 * Tracks:
 * - Number of stack groups created and the observations in them
 * - Number of observations passed through without stacking
 * - Number of partitions processed and rejected
 */
public class StackingMetrics {

    private final Counter stacksPromoted;
    private final Counter observationsPromoted;
    private final Counter observationsPassedThrough;
    private final Counter partitionsProcessed;
    private final Counter partitionsFailed;

    public StackingMetrics() {
        this.stacksPromoted = Counter
            .builder("stacker_stacks_promoted_total")
            .description("counter for how many stack groups were handed to the stacking worker")
            .register(Metrics.globalRegistry);

        this.observationsPromoted = Counter
            .builder("stacker_observations_promoted_total")
            .description("counter for how many observations were added to new stack groups")
            .register(Metrics.globalRegistry);

        this.observationsPassedThrough = Counter
            .builder("stacker_observations_passed_through_total")
            .description("counter for how many observations were finalized without stacking")
            .register(Metrics.globalRegistry);

        this.partitionsProcessed = Counter
            .builder("stacker_partitions_processed_total")
            .description("counter for how many partitions were processed")
            .register(Metrics.globalRegistry);

        this.partitionsFailed = Counter
            .builder("stacker_partitions_failed_total")
            .description("counter for how many partitions were rejected or hit a conflicting update")
            .register(Metrics.globalRegistry);
    }

    public void recordStackPromoted(int observationCount) {
        stacksPromoted.increment();
        observationsPromoted.increment(observationCount);
    }

    public void recordPassedThrough(int observationCount) {
        observationsPassedThrough.increment(observationCount);
    }

    public void recordPartition(PartitionOutcome outcome) {
        if (outcome.isFailed()) {
            partitionsFailed.increment();
        } else {
            partitionsProcessed.increment();
        }
    }
}
