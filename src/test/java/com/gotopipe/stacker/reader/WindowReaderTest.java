package com.gotopipe.stacker.reader;

import com.gotopipe.stacker.model.GroupingKey;
import com.gotopipe.stacker.model.Observation;
import com.gotopipe.stacker.store.AnchorDirection;
import com.gotopipe.stacker.store.MalformedObservationException;
import com.gotopipe.stacker.store.ObservationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static com.gotopipe.stacker.testutil.ObservationFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class WindowReaderTest {

    private static final GroupingKey KEY = new GroupingKey(List.of("telescope", "camera", "instrument"), List.of("GOTO1", "UT1", "CCD1"));
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2018-09-10T03:00:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime FROM = LocalDateTime.of(2018, 9, 9, 20, 0);
    private static final LocalDateTime TO = LocalDateTime.of(2018, 9, 9, 23, 0);

    private ObservationStore mockStore;

    @BeforeEach
    void setUp() {
        mockStore = mock(ObservationStore.class);
    }

    // ==================== Window resolution ====================

    @Test
    void testResolveWindow_unboundedQueriesNoAnchor() throws Exception {
        WindowReader reader = new WindowReader(mockStore, null, null, CLOCK);

        DateWindow window = reader.resolveWindow();

        assertNull(window.from());
        assertNull(window.to());
        verify(mockStore, never()).resolveAnchor(any(), any());
    }

    @Test
    void testResolveWindow_boundsMoveToNearestReducedRecord() throws Exception {
        LocalDateTime fromAnchor = FROM.plusMinutes(4);
        LocalDateTime toAnchor = TO.minusMinutes(9);
        when(mockStore.resolveAnchor(AnchorDirection.EARLIEST, FROM)).thenReturn(Optional.of(fromAnchor));
        when(mockStore.resolveAnchor(AnchorDirection.LATEST, TO)).thenReturn(Optional.of(toAnchor));
        WindowReader reader = new WindowReader(mockStore, DateBound.absolute(FROM), DateBound.absolute(TO), CLOCK);

        DateWindow window = reader.resolveWindow();

        assertEquals(fromAnchor, window.from());
        assertEquals(toAnchor, window.to());
    }

    @Test
    void testResolveWindow_missingAnchorLeavesSideOpen() throws Exception {
        when(mockStore.resolveAnchor(AnchorDirection.EARLIEST, FROM)).thenReturn(Optional.empty());
        when(mockStore.resolveAnchor(AnchorDirection.LATEST, TO)).thenReturn(Optional.of(TO.minusHours(1)));
        WindowReader reader = new WindowReader(mockStore, DateBound.absolute(FROM), DateBound.absolute(TO), CLOCK);

        DateWindow window = reader.resolveWindow();

        assertNull(window.from());
        assertEquals(TO.minusHours(1), window.to());
    }

    @Test
    void testResolveWindow_relativeLowerBound() throws Exception {
        LocalDateTime expectedBound = LocalDateTime.of(2018, 9, 9, 3, 0);
        when(mockStore.resolveAnchor(AnchorDirection.EARLIEST, expectedBound)).thenReturn(Optional.of(FROM));
        WindowReader reader = new WindowReader(mockStore, DateBound.parse("-P1D"), null, CLOCK);

        assertEquals(FROM, reader.resolveWindow().from());
        verify(mockStore).resolveAnchor(AnchorDirection.EARLIEST, expectedBound);
    }

    // ==================== Reading ====================

    @Test
    void testRead_emptyPartition() throws Exception {
        when(mockStore.query(eq(KEY), isNull(), isNull())).thenReturn(List.of());
        WindowReader reader = new WindowReader(mockStore, null, null, CLOCK);

        WindowReadResult result = reader.read(KEY);

        assertTrue(result.isEmpty());
        assertEquals(KEY, result.getKey());
    }

    @Test
    void testRead_usesResolvedWindow() throws Exception {
        List<Observation> records = sequence(1, FROM, "Cas54", "L", 80, 4);
        when(mockStore.query(KEY, FROM, TO)).thenReturn(records);
        WindowReader reader = new WindowReader(mockStore, null, null, CLOCK);

        WindowReadResult result = reader.read(KEY, new DateWindow(FROM, TO));

        assertEquals(records, result.getObservations());
        assertEquals(FROM, result.getFrom());
        assertEquals(TO, result.getTo());
    }

    @Test
    void testRead_iobsAboveNobsRejectsPartition() throws Exception {
        Observation bad = observation().id(42).iobs(3).nobs(2).build();
        when(mockStore.query(any(), any(), any())).thenReturn(List.of(observation().id(41).build(), bad));
        WindowReader reader = new WindowReader(mockStore, null, null, CLOCK);

        PartitionIntegrityException e = assertThrows(PartitionIntegrityException.class, () -> reader.read(KEY, DateWindow.UNBOUNDED));

        assertEquals(42L, e.getObservationId());
        assertEquals(KEY, e.getKey());
    }

    @Test
    void testRead_iobsBelowOneRejectsPartition() {
        assertThrows(PartitionIntegrityException.class,
            () -> WindowReader.validate(KEY, observation().iobs(0).nobs(2).build()));
    }

    @Test
    void testRead_stageOutOfRangeRejectsPartition() {
        assertThrows(PartitionIntegrityException.class,
            () -> WindowReader.validate(KEY, observation().stage(5).build()));
        assertThrows(PartitionIntegrityException.class,
            () -> WindowReader.validate(KEY, observation().stage(-1).build()));
    }

    @Test
    void testRead_missingObsdateRejectsPartition() {
        assertThrows(PartitionIntegrityException.class,
            () -> WindowReader.validate(KEY, observation().obsdate(null).build()));
    }

    @Test
    void testRead_undecodableRecordRejectsPartition() throws Exception {
        when(mockStore.query(KEY, FROM, TO)).thenThrow(
            new MalformedObservationException(42, "obsdate '2018-09-09T22:50:00' is not in canonical form", null));
        WindowReader reader = new WindowReader(mockStore, null, null, CLOCK);

        PartitionIntegrityException e = assertThrows(PartitionIntegrityException.class,
            () -> reader.read(KEY, new DateWindow(FROM, TO)));
        assertEquals(42, e.getObservationId());
        assertEquals(KEY, e.getKey());
    }

    @Test
    void testRead_unknownStatusIsTolerated() throws Exception {
        WindowReader.validate(KEY, observation().stage(2).status("weird").build());
    }
}
