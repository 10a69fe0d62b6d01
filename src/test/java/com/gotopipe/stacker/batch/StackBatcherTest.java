package com.gotopipe.stacker.batch;

import com.gotopipe.stacker.model.Observation;
import com.gotopipe.stacker.model.ObservationUpdate;
import com.gotopipe.stacker.model.StackGroupUpdate;
import com.gotopipe.stacker.model.Stage;
import com.gotopipe.stacker.segment.Burst;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.gotopipe.stacker.testutil.ObservationFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class StackBatcherTest {

    private StackBatcher batcher;

    @BeforeEach
    void setUp() {
        batcher = new StackBatcher(4, 12);
    }

    private static Burst burst(int id, List<Observation> members) {
        return new Burst(id, members);
    }

    /** A later burst so that the burst under test is not the final one. */
    private static Burst trailing(int id) {
        return burst(id, sequence(1000, START.plusHours(5), "Field77", "R", 120, 1));
    }

    private static List<Long> ids(StackGroupUpdate group) {
        return group.getUpdates().stream().map(ObservationUpdate::id).collect(Collectors.toList());
    }

    // ==================== Worked examples ====================

    @Test
    void testPlan_sixExposuresBecomeFourAndTwo() {
        List<Burst> bursts = List.of(burst(0, sequence(1, START, "GW123456", "L", 120, 6)), trailing(1));

        BatchPlan plan = batcher.plan(bursts, 0);

        assertEquals(2, plan.getGroups().size());
        StackGroupUpdate first = plan.getGroups().get(0);
        StackGroupUpdate second = plan.getGroups().get(1);
        assertEquals(StackGroupUpdate.Kind.STACK, first.getKind());
        assertEquals(List.of(1L, 2L, 3L, 4L), ids(first));
        assertEquals(List.of(5L, 6L), ids(second));
        assertEquals(1, first.getSet());
        assertEquals(2, second.getSet());
        for (StackGroupUpdate group : plan.getGroups()) {
            for (ObservationUpdate update : group.getUpdates()) {
                assertEquals(Stage.REDUCTION_3, update.expectedStage());
                assertEquals(Stage.STACKING, update.stage());
                assertEquals(Stage.STATUS_STARTING, update.status());
                assertEquals(group.getSet(), update.set());
            }
        }
        assertEquals(2, plan.getStacksPromoted());
        assertEquals(6, plan.getObservationsPromoted());
    }

    @Test
    void testPlan_singleExposureIsPassedThrough() {
        Observation single = observation().id(9).set(3).build();
        List<Burst> bursts = List.of(burst(0, List.of(single)), trailing(1));

        BatchPlan plan = batcher.plan(bursts, 3);

        assertEquals(1, plan.getGroups().size());
        StackGroupUpdate group = plan.getGroups().get(0);
        assertEquals(StackGroupUpdate.Kind.PASS_THROUGH, group.getKind());
        ObservationUpdate update = group.getUpdates().get(0);
        assertEquals(9L, update.id());
        assertEquals(Stage.STACKING, update.stage());
        assertEquals(Stage.STATUS_NOT_PROCESSED, update.status());
        assertEquals(3, update.set());
        assertEquals(0, plan.getStacksPromoted());
        assertEquals(1, plan.getObservationsPassedThrough());
    }

    @Test
    void testPlan_overLongBurstIsPassedThrough() {
        List<Burst> bursts = List.of(burst(0, sequence(1, START, "Ceph", "R", 15, 13)), trailing(1));

        BatchPlan plan = batcher.plan(bursts, 0);

        assertEquals(1, plan.getGroups().size());
        assertEquals(StackGroupUpdate.Kind.PASS_THROUGH, plan.getGroups().get(0).getKind());
        assertEquals(13, plan.getGroups().get(0).size());
        assertTrue(plan.getGroups().get(0).getUpdates().stream().allMatch(u -> Stage.STATUS_NOT_PROCESSED.equals(u.status())));
    }

    @Test
    void testPlan_burstOfExactlyMaxseqIsStacked() {
        List<Burst> bursts = List.of(burst(0, sequence(1, START, "And123", "L", 80, 12)), trailing(1));

        BatchPlan plan = batcher.plan(bursts, 10);

        assertEquals(List.of(11, 12, 13), plan.getGroups().stream().map(StackGroupUpdate::getSet).collect(Collectors.toList()));
        assertTrue(plan.getGroups().stream().allMatch(g -> g.size() == 4));
    }

    // ==================== Final burst ====================

    @Test
    void testPlan_finalBurstIsLeftAlone() {
        List<Burst> bursts = List.of(burst(0, sequence(1, START, "Cas54", "L", 80, 4)));

        BatchPlan plan = batcher.plan(bursts, 0);

        assertTrue(plan.isEmpty());
        assertEquals(1, plan.getBurstsSeen());
        assertEquals(0, plan.getBurstsEvaluated());
    }

    @Test
    void testPlan_streamClosedFinalizesFinalBurst() {
        List<Burst> bursts = List.of(burst(0, sequence(1, START, "Cas54", "L", 80, 4)));

        BatchPlan plan = batcher.plan(bursts, 0, true);

        assertEquals(1, plan.getGroups().size());
        assertEquals(1, plan.getBurstsEvaluated());
    }

    @Test
    void testPlan_noBursts() {
        BatchPlan plan = batcher.plan(List.of(), 0);

        assertTrue(plan.isEmpty());
        assertEquals(0, plan.getBurstsEvaluated());
    }

    // ==================== Readiness ====================

    @Test
    void testPlan_chunkWithUnfinishedMemberIsDeferred() {
        List<Observation> members = new ArrayList<>(sequence(1, START, "GW123456", "L", 120, 6));
        members.set(4, withStage(members.get(4), Stage.REDUCTION_2, Stage.STATUS_COMPLETED));
        List<Burst> bursts = List.of(burst(0, members), trailing(1));

        BatchPlan plan = batcher.plan(bursts, 0);

        assertEquals(1, plan.getGroups().size());
        assertEquals(List.of(1L, 2L, 3L, 4L), ids(plan.getGroups().get(0)));
        assertEquals(1, plan.getChunksDeferred());
    }

    @Test
    void testPlan_laterChunkGetsNextIdAfterEarlierRun() {
        List<Observation> members = new ArrayList<>();
        for (Observation o : sequence(1, START, "GW123456", "L", 120, 6)) {
            members.add(o.id() <= 4 ? stacked(o, 7) : o);
        }
        List<Burst> bursts = List.of(burst(0, members), trailing(1));

        BatchPlan plan = batcher.plan(bursts, 7);

        assertEquals(1, plan.getGroups().size());
        assertEquals(List.of(5L, 6L), ids(plan.getGroups().get(0)));
        assertEquals(8, plan.getGroups().get(0).getSet());
        assertEquals(0, plan.getChunksDeferred());
    }

    @Test
    void testPlan_passThroughWaitsForPendingMembers() {
        List<Observation> members = new ArrayList<>(sequence(1, START, "Ceph", "R", 15, 13));
        members.set(12, withStage(members.get(12), Stage.REDUCTION_3, Stage.STATUS_PROCESSING));
        List<Burst> bursts = List.of(burst(0, members), trailing(1));

        BatchPlan plan = batcher.plan(bursts, 0);

        assertTrue(plan.isEmpty());
        assertEquals(1, plan.getChunksDeferred());
    }

    @Test
    void testPlan_passThroughSkipsMembersAlreadyFinal() {
        List<Observation> members = new ArrayList<>();
        for (Observation o : sequence(1, START, "Ceph", "R", 15, 13)) {
            members.add(o.id() <= 10 ? withStage(o, Stage.STACKING, Stage.STATUS_NOT_PROCESSED) : o);
        }
        List<Burst> bursts = List.of(burst(0, members), trailing(1));

        BatchPlan plan = batcher.plan(bursts, 0);

        assertEquals(1, plan.getGroups().size());
        assertEquals(List.of(11L, 12L, 13L), ids(plan.getGroups().get(0)));
    }

    // ==================== Idempotence ====================

    @Test
    void testPlan_appliedPlanProducesNothingNew() {
        List<Observation> members = sequence(1, START, "GW123456", "L", 120, 6);
        List<Burst> bursts = List.of(burst(0, members), burst(1, List.of(observation().id(7).obsdate(START.plusHours(1)).build())), trailing(2));
        BatchPlan first = batcher.plan(bursts, 0);

        List<Burst> applied = new ArrayList<>();
        for (Burst b : bursts.subList(0, 2)) {
            List<Observation> updated = new ArrayList<>();
            for (Observation o : b.getMembers()) {
                ObservationUpdate u = first.getGroups().stream()
                    .flatMap(g -> g.getUpdates().stream())
                    .filter(x -> x.id() == o.id())
                    .findFirst()
                    .orElseThrow();
                updated.add(new Observation(o.id(), o.telescope(), o.camera(), o.instrument(), o.imagetype(), o.target(),
                    o.filter(), o.exptime(), o.obsdate(), o.iobs(), o.nobs(), u.stage(), u.status(), u.set()));
            }
            applied.add(burst(b.getId(), updated));
        }
        applied.add(bursts.get(2));

        BatchPlan second = batcher.plan(applied, 2);

        assertTrue(second.isEmpty());
        assertEquals(0, second.getChunksDeferred());
    }

    // ==================== Construction ====================

    @Test
    void testConstructor_rejectsNonPositiveSizes() {
        assertThrows(IllegalArgumentException.class, () -> new StackBatcher(0, 12));
        assertThrows(IllegalArgumentException.class, () -> new StackBatcher(4, 0));
    }

    private static Observation stacked(Observation o, int set) {
        return new Observation(o.id(), o.telescope(), o.camera(), o.instrument(), o.imagetype(), o.target(), o.filter(),
            o.exptime(), o.obsdate(), o.iobs(), o.nobs(), Stage.STACKING, Stage.STATUS_STARTING, set);
    }
}
