package com.gotopipe.stacker.batch;

import com.gotopipe.stacker.config.StackingConfig;
import com.gotopipe.stacker.model.Observation;
import com.gotopipe.stacker.model.ObservationUpdate;
import com.gotopipe.stacker.model.StackGroupUpdate;
import com.gotopipe.stacker.model.Stage;
import com.gotopipe.stacker.segment.Burst;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns the bursts of one partition into stack groups.
 *
 * <p>The final burst is left alone unless the stream is closed: it may still be receiving exposures.
 * Bursts of a single exposure, or longer than {@code maxseq}, are passed through as {@code notprocessed}.
 * Every other burst is cut into consecutive chunks of up to {@code nstack} exposures; a chunk whose
 * members have all completed stage 3 becomes a new stack group, any other chunk waits for a later run.</p>
 */
public class StackBatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(StackBatcher.class);

    private final int nstack;
    private final int maxseq;

    public StackBatcher(StackingConfig config) {
        this(config.getNstack(), config.getMaxseq());
    }

    public StackBatcher(int nstack, int maxseq) {
        if (nstack < 1 || maxseq < 1) {
            throw new IllegalArgumentException("nstack and maxseq must be positive");
        }
        this.nstack = nstack;
        this.maxseq = maxseq;
    }

    /**
     * Plans the updates for one partition.
     *
     * @param bursts         bursts in ascending id order
     * @param maxExistingSet highest group id already used in the partition
     * @param streamClosed   whether the final burst may be finalized too
     */
    public BatchPlan plan(List<Burst> bursts, int maxExistingSet, boolean streamClosed) {
        int evaluated = streamClosed ? bursts.size() : Math.max(0, bursts.size() - 1);
        List<StackGroupUpdate> groups = new ArrayList<>();
        int nextSet = maxExistingSet;
        int deferred = 0;

        for (Burst burst : bursts.subList(0, evaluated)) {
            if (burst.size() == 1 || burst.size() > maxseq) {
                StackGroupUpdate passThrough = planPassThrough(burst);
                if (passThrough != null) {
                    groups.add(passThrough);
                } else if (hasPending(burst.getMembers())) {
                    deferred++;
                }
                continue;
            }

            List<Observation> members = burst.getMembers();
            for (int pos = 0; pos < members.size(); pos += nstack) {
                List<Observation> chunk = members.subList(pos, Math.min(pos + nstack, members.size()));
                if (!chunk.stream().allMatch(Stage::isReadyForStacking)) {
                    if (hasPending(chunk)) {
                        deferred++;
                    }
                    continue;
                }
                nextSet++;
                groups.add(new StackGroupUpdate(StackGroupUpdate.Kind.STACK, burst.getId(), nextSet,
                    toUpdates(chunk, Stage.STATUS_STARTING, nextSet)));
            }
        }

        BatchPlan plan = new BatchPlan(groups, bursts.size(), evaluated, deferred);
        LOGGER.debug("planned {} stacks ({} observations) and {} passed through, {} deferred, from {} of {} bursts",
            plan.getStacksPromoted(), plan.getObservationsPromoted(), plan.getObservationsPassedThrough(),
            deferred, evaluated, bursts.size());
        return plan;
    }

    public BatchPlan plan(List<Burst> bursts, int maxExistingSet) {
        return plan(bursts, maxExistingSet, false);
    }

    /**
     * Members not yet at stage 4 are finalized as notprocessed once they have all completed stage 3.
     * Returns null when there is nothing to do yet.
     */
    private StackGroupUpdate planPassThrough(Burst burst) {
        List<Observation> pending = burst.getMembers().stream()
            .filter(o -> o.stage() < Stage.STACKING)
            .collect(Collectors.toList());
        if (pending.isEmpty() || !pending.stream().allMatch(Stage::isReadyForStacking)) {
            return null;
        }
        List<ObservationUpdate> updates = new ArrayList<>(pending.size());
        for (Observation observation : pending) {
            updates.add(toUpdate(observation, Stage.STATUS_NOT_PROCESSED, observation.set()));
        }
        return new StackGroupUpdate(StackGroupUpdate.Kind.PASS_THROUGH, burst.getId(), 0, updates);
    }

    private static boolean hasPending(List<Observation> observations) {
        return observations.stream().anyMatch(o -> o.stage() < Stage.STACKING);
    }

    private static List<ObservationUpdate> toUpdates(List<Observation> chunk, String status, int set) {
        List<ObservationUpdate> updates = new ArrayList<>(chunk.size());
        for (Observation observation : chunk) {
            updates.add(toUpdate(observation, status, set));
        }
        return updates;
    }

    private static ObservationUpdate toUpdate(Observation observation, String status, int set) {
        if (observation.stage() >= Stage.STACKING) {
            throw new IllegalStateException("observation " + observation.id() + " is already at stage " + observation.stage());
        }
        return new ObservationUpdate(observation.id(), observation.stage(), Stage.STACKING, status, set);
    }
}
