package com.gotopipe.stacker.reader;

import com.gotopipe.stacker.config.StackingConfig;
import com.gotopipe.stacker.model.GroupingKey;
import com.gotopipe.stacker.model.Observation;
import com.gotopipe.stacker.model.Stage;
import com.gotopipe.stacker.store.AnchorDirection;
import com.gotopipe.stacker.store.MalformedObservationException;
import com.gotopipe.stacker.store.ObservationStore;
import com.gotopipe.stacker.store.ObservationStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Reads the records of one partition for the configured date window.
 *
 * <p>Requested bounds are not used literally. Each is moved to the nearest record that has completed
 * stage 3: the lower bound to the earliest such record at or after it, the upper bound to the latest
 * such record at or before it. A bound without such a record is dropped.</p>
 */
public class WindowReader {
    private static final Logger LOGGER = LoggerFactory.getLogger(WindowReader.class);

    private final ObservationStore store;
    private final DateBound fromDate;
    private final DateBound toDate;
    private final Clock clock;

    public WindowReader(ObservationStore store, StackingConfig config, Clock clock) {
        this(store, config.getFromDate(), config.getToDate(), clock);
    }

    public WindowReader(ObservationStore store, DateBound fromDate, DateBound toDate, Clock clock) {
        this.store = store;
        this.fromDate = fromDate;
        this.toDate = toDate;
        this.clock = clock;
        LOGGER.info("initialized: fromDate={}, toDate={}", fromDate, toDate);
    }

    /**
     * Resolves both bounds against the store's fully-reduced records.
     */
    public DateWindow resolveWindow() throws ObservationStoreException {
        LocalDateTime from = null;
        LocalDateTime to = null;
        if (fromDate != null) {
            from = resolve(AnchorDirection.EARLIEST, fromDate.resolveLower(clock));
        }
        if (toDate != null) {
            to = resolve(AnchorDirection.LATEST, toDate.resolveUpper(clock));
        }
        return new DateWindow(from, to);
    }

    /**
     * Reads one partition within the resolved window, ordered by obsdate.
     *
     * @throws PartitionIntegrityException if a record of the partition is inconsistent
     */
    public WindowReadResult read(GroupingKey key) throws ObservationStoreException, PartitionIntegrityException {
        return read(key, resolveWindow());
    }

    /**
     * Reads one partition within an already resolved window.
     */
    public WindowReadResult read(GroupingKey key, DateWindow window)
            throws ObservationStoreException, PartitionIntegrityException {
        LocalDateTime from = window.from();
        LocalDateTime to = window.to();
        List<Observation> observations;
        try {
            observations = store.query(key, from, to);
        } catch (MalformedObservationException e) {
            LOGGER.error("partition_integrity_error: {}, partition={}", e.getMessage(), key);
            throw new PartitionIntegrityException(key, e.getObservationId(), e.getMessage());
        }
        if (observations.isEmpty()) {
            LOGGER.debug("no records for partition={} in window [{}, {}]", key, from, to);
            return WindowReadResult.noRecords(key, from, to);
        }
        for (Observation observation : observations) {
            validate(key, observation);
        }
        LOGGER.debug("read {} records for partition={} in window [{}, {}]", observations.size(), key, from, to);
        return WindowReadResult.withObservations(key, observations, from, to);
    }

    private LocalDateTime resolve(AnchorDirection direction, LocalDateTime bound) throws ObservationStoreException {
        Optional<LocalDateTime> anchor = store.resolveAnchor(direction, bound);
        if (anchor.isEmpty()) {
            LOGGER.info("no fully reduced record {} bound {}, window is open on that side",
                direction == AnchorDirection.EARLIEST ? "after" : "before", bound);
            return null;
        }
        return anchor.get();
    }

    static void validate(GroupingKey key, Observation observation) throws PartitionIntegrityException {
        if (!Stage.isValid(observation.stage())) {
            LOGGER.error("partition_integrity_error: stage {} out of range, partition={}, id={}", observation.stage(), key, observation.id());
            throw new PartitionIntegrityException(key, observation.id(), "stage " + observation.stage() + " out of range");
        }
        if (observation.iobs() < 1 || observation.iobs() > observation.nobs()) {
            LOGGER.error("partition_integrity_error: iobs={} nobs={}, partition={}, id={}", observation.iobs(), observation.nobs(), key, observation.id());
            throw new PartitionIntegrityException(key, observation.id(),
                "iobs " + observation.iobs() + " outside 1.." + observation.nobs());
        }
        if (observation.obsdate() == null) {
            LOGGER.error("partition_integrity_error: missing obsdate, partition={}, id={}", key, observation.id());
            throw new PartitionIntegrityException(key, observation.id(), "missing obsdate");
        }
    }
}
