package com.kopo.letterrush.service;

import com.kopo.letterrush.entity.Room;
import com.kopo.letterrush.entity.Round;
import com.kopo.letterrush.repository.RoomRepository;
import com.kopo.letterrush.repository.RoundRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledThreadPoolExecutor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RoundTimerSweeperTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 1, 1, 12, 0, 0);

    private RoundRepository roundRepository;
    private RoomRepository roomRepository;
    private RoundService roundService;
    private ScheduledThreadPoolExecutor scheduler;
    private RoundTimerSweeper sweeper;

    @BeforeEach
    void setUp() {
        roundRepository = mock(RoundRepository.class);
        roomRepository = mock(RoomRepository.class);
        roundService = mock(RoundService.class);
        scheduler = new ScheduledThreadPoolExecutor(1);
        Clock clock = Clock.fixed(Instant.parse("2026-01-01T12:00:00Z"), ZoneOffset.UTC);
        sweeper = new RoundTimerSweeper(roundRepository, roomRepository, roundService, scheduler, clock, true, 1000);

        when(roomRepository.findById(1L)).thenReturn(Optional.of(room(1L, 10)));
        when(roomRepository.findById(2L)).thenReturn(Optional.of(room(2L, null)));
        when(roundService.completeRound(anyLong())).thenReturn(true);
    }

    @Test
    @DisplayName("Only rounds whose timer elapsed are completed")
    void completesExpiredRoundsOnly() {
        Round expired = round(11L, 1L, NOW.minusSeconds(10));
        Round running = round(12L, 1L, NOW.minusSeconds(4));
        when(roundRepository.findByStatusAndFirstSubmissionAtIsNotNull(Round.RoundStatus.ACTIVE))
                .thenReturn(List.of(expired, running));

        assertEquals(1, sweeper.sweep());

        verify(roundService).completeRound(11L);
        verify(roundService, never()).completeRound(12L);
    }

    @Test
    void roomWithoutTimerIsCompletedImmediately() {
        when(roundRepository.findByStatusAndFirstSubmissionAtIsNotNull(Round.RoundStatus.ACTIVE))
                .thenReturn(List.of(round(21L, 2L, NOW)));

        assertEquals(1, sweeper.sweep());
    }

    @Test
    @DisplayName("A failing round does not stop the rest of the sweep")
    void failureOnOneRoundIsIsolated() {
        when(roundRepository.findByStatusAndFirstSubmissionAtIsNotNull(Round.RoundStatus.ACTIVE))
                .thenReturn(List.of(round(11L, 1L, NOW.minusSeconds(30)), round(13L, 1L, NOW.minusSeconds(30))));
        when(roundService.completeRound(11L)).thenThrow(new IllegalStateException("lock timeout"));

        assertEquals(1, sweeper.sweep());
        verify(roundService).completeRound(13L);
    }

    @Test
    void lifecycleSchedulesAndCancels() {
        sweeper.start();
        assertTrue(sweeper.isRunning());
        assertEquals(1, scheduler.getQueue().size());

        sweeper.stop();
        assertFalse(sweeper.isRunning());
        scheduler.shutdownNow();
    }

    private static Room room(Long id, Integer timer) {
        Room room = new Room();
        room.setId(id);
        room.setTimerDuration(timer);
        return room;
    }

    private static Round round(Long id, Long roomId, LocalDateTime firstSubmission) {
        Round round = new Round();
        round.setId(id);
        round.setRoomId(roomId);
        round.setStatus(Round.RoundStatus.ACTIVE);
        round.setFirstSubmissionAt(firstSubmission);
        return round;
    }
}
