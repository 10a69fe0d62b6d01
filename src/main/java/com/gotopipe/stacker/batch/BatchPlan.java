package com.gotopipe.stacker.batch;

import com.gotopipe.stacker.model.StackGroupUpdate;

import java.util.List;

/**
 * Update intents produced by the batcher for one partition, in burst order.
 */
public class BatchPlan {
    private final List<StackGroupUpdate> groups;
    private final int burstsSeen;
    private final int burstsEvaluated;
    private final int chunksDeferred;

    public BatchPlan(List<StackGroupUpdate> groups, int burstsSeen, int burstsEvaluated, int chunksDeferred) {
        this.groups = List.copyOf(groups);
        this.burstsSeen = burstsSeen;
        this.burstsEvaluated = burstsEvaluated;
        this.chunksDeferred = chunksDeferred;
    }

    public List<StackGroupUpdate> getGroups() { return groups; }
    public boolean isEmpty() { return groups.isEmpty(); }
    public int getBurstsSeen() { return burstsSeen; }
    /** Bursts considered for stacking; excludes the still-open final burst. */
    public int getBurstsEvaluated() { return burstsEvaluated; }
    /** Chunks or pass-through bursts left unmodified because a member has not completed stage 3. */
    public int getChunksDeferred() { return chunksDeferred; }

    public int getStacksPromoted() {
        return (int) groups.stream().filter(g -> g.getKind() == StackGroupUpdate.Kind.STACK).count();
    }

    public int getObservationsPromoted() {
        return groups.stream().filter(g -> g.getKind() == StackGroupUpdate.Kind.STACK).mapToInt(StackGroupUpdate::size).sum();
    }

    public int getObservationsPassedThrough() {
        return groups.stream().filter(g -> g.getKind() == StackGroupUpdate.Kind.PASS_THROUGH).mapToInt(StackGroupUpdate::size).sum();
    }
}
