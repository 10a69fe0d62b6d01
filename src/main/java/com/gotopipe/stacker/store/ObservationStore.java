package com.gotopipe.stacker.store;

import com.gotopipe.stacker.model.GroupingKey;
import com.gotopipe.stacker.model.Observation;
import com.gotopipe.stacker.model.StackGroupUpdate;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Relational store holding the observation records.
 */
public interface ObservationStore {

    /**
     * Distinct values of the given columns, one key per partition, in ascending order.
     */
    List<GroupingKey> listGroupingKeys(List<String> columns) throws ObservationStoreException;

    /**
     * Records of one partition with {@code from <= obsdate <= to}, ordered by obsdate.
     * A null bound leaves that side open.
     */
    List<Observation> query(GroupingKey key, LocalDateTime from, LocalDateTime to) throws ObservationStoreException;

    /**
     * Timestamp of the nearest record that completed stage 3, at or after ({@link AnchorDirection#EARLIEST})
     * or at or before ({@link AnchorDirection#LATEST}) the bound.
     */
    Optional<LocalDateTime> resolveAnchor(AnchorDirection direction, LocalDateTime bound) throws ObservationStoreException;

    /**
     * Highest group id used anywhere in the partition, 0 when there is none.
     */
    int maxSetId(GroupingKey key) throws ObservationStoreException;

    /**
     * Applies all updates of one group in a single transaction.
     *
     * @throws ConcurrentObservationUpdateException if a member is no longer at its expected stage;
     *                                              the group is rolled back
     */
    void applyUpdates(StackGroupUpdate group) throws ObservationStoreException;
}
