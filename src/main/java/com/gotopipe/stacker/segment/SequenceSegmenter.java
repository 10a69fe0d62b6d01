package com.gotopipe.stacker.segment;

import com.gotopipe.stacker.config.StackingConfig;
import com.gotopipe.stacker.model.Observation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Splits the ordered records of one partition into bursts.
 *
 * <p>A new burst starts before a record when, compared to the previous record:</p>
 * <ul>
 *   <li>imagetype, target, filter or exptime changed,</li>
 *   <li>the previous record was the last of its requested sequence ({@code iobs == nobs}), or</li>
 *   <li>more than the maximum gap passed since the previous record.</li>
 * </ul>
 * Burst ids count the breaks seen so far, starting at 0.
 */
public class SequenceSegmenter {
    private static final Logger LOGGER = LoggerFactory.getLogger(SequenceSegmenter.class);

    static final Comparator<Observation> OBSDATE_ORDER =
        Comparator.comparing(Observation::obsdate).thenComparingLong(Observation::id);

    private final Duration maxGap;

    public SequenceSegmenter(StackingConfig config) {
        this(config.getMaxGap());
    }

    public SequenceSegmenter(Duration maxGap) {
        this.maxGap = maxGap;
    }

    /**
     * @param observations records of a single partition, in any order
     * @return bursts in ascending id order; empty for empty input
     */
    public List<Burst> segment(List<Observation> observations) {
        List<Observation> ordered = new ArrayList<>(observations);
        ordered.sort(OBSDATE_ORDER);

        List<Burst> bursts = new ArrayList<>();
        List<Observation> current = new ArrayList<>();
        Observation previous = null;
        for (Observation observation : ordered) {
            if (previous != null && isBreak(previous, observation)) {
                bursts.add(new Burst(bursts.size(), current));
                current = new ArrayList<>();
            }
            current.add(observation);
            previous = observation;
        }
        if (!current.isEmpty()) {
            bursts.add(new Burst(bursts.size(), current));
        }

        LOGGER.debug("segmented {} records into {} bursts", ordered.size(), bursts.size());
        return bursts;
    }

    boolean isBreak(Observation previous, Observation current) {
        return settingsChanged(previous, current)
            || previous.iobs() == previous.nobs()
            || Duration.between(previous.obsdate(), current.obsdate()).compareTo(maxGap) > 0;
    }

    // exptime is compared exactly: values are set explicitly by the scheduler, not computed
    private static boolean settingsChanged(Observation previous, Observation current) {
        return !Objects.equals(previous.imagetype(), current.imagetype())
            || !Objects.equals(previous.target(), current.target())
            || !Objects.equals(previous.filter(), current.filter())
            || Double.compare(previous.exptime(), current.exptime()) != 0;
    }
}
