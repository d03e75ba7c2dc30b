package com.kopo.letterrush.repository;

import com.kopo.letterrush.entity.Player;
import com.kopo.letterrush.entity.Room;
import com.kopo.letterrush.entity.Round;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Conditional updates against a real (H2) database.
 */
@DataJpaTest
class RoundRepositoryTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2026, 1, 1, 12, 0);

    @Autowired
    private RoomRepository roomRepository;
    @Autowired
    private RoundRepository roundRepository;
    @Autowired
    private PlayerRepository playerRepository;

    private Room room;
    private Round round;

    @BeforeEach
    void setUp() {
        room = new Room();
        room.setCode("ABC123");
        room.setStatus(Room.RoomStatus.PLAYING);
        room.setTotalRounds(1);
        room.setRoundNumber(1);
        room.setTimerDuration(10);
        room.setCategories(new ArrayList<>(List.of("miasto")));
        room = roomRepository.saveAndFlush(room);

        round = new Round();
        round.setRoomId(room.getId());
        round.setRoundNumber(1);
        round.setLetter("B");
        round.setStartedAt(T0);
        round = roundRepository.saveAndFlush(round);
    }

    @Test
    @DisplayName("Only the first completion updates the row")
    void completeIfActiveWinsOnce() {
        assertEquals(1, roundRepository.completeIfActive(round.getId(),
                Round.RoundStatus.ACTIVE, Round.RoundStatus.COMPLETED, T0.plusSeconds(5)));
        assertEquals(0, roundRepository.completeIfActive(round.getId(),
                Round.RoundStatus.ACTIVE, Round.RoundStatus.COMPLETED, T0.plusSeconds(6)));

        Round reloaded = roundRepository.findById(round.getId()).orElseThrow();
        assertEquals(Round.RoundStatus.COMPLETED, reloaded.getStatus());
        assertEquals(T0.plusSeconds(5), reloaded.getEndedAt());
    }

    @Test
    void firstSubmissionIsStampedOnce() {
        assertEquals(1, roundRepository.markFirstSubmission(round.getId(), T0.plusSeconds(1)));
        assertEquals(0, roundRepository.markFirstSubmission(round.getId(), T0.plusSeconds(2)));

        assertEquals(T0.plusSeconds(1), roundRepository.findById(round.getId()).orElseThrow().getFirstSubmissionAt());
        assertEquals(1, roundRepository.findByStatusAndFirstSubmissionAtIsNotNull(Round.RoundStatus.ACTIVE).size());
    }

    @Test
    void validationClaimNeedsCompletedRoundAndIsTakenOnce() {
        assertEquals(0, roundRepository.claimValidation(round.getId(), Round.RoundStatus.COMPLETED, T0));

        roundRepository.completeIfActive(round.getId(), Round.RoundStatus.ACTIVE, Round.RoundStatus.COMPLETED, T0);

        assertEquals(1, roundRepository.claimValidation(round.getId(), Round.RoundStatus.COMPLETED, T0.plusSeconds(1)));
        assertEquals(0, roundRepository.claimValidation(round.getId(), Round.RoundStatus.COMPLETED, T0.plusSeconds(2)));
    }

    @Test
    void roomFinishesWhenRoundBudgetIsSpent() {
        assertEquals(1, roomRepository.finishIfRoundBudgetSpent(room.getId(), Room.RoomStatus.FINISHED));
        assertEquals(0, roomRepository.finishIfRoundBudgetSpent(room.getId(), Room.RoomStatus.FINISHED));
        assertEquals(Room.RoomStatus.FINISHED, roomRepository.findById(room.getId()).orElseThrow().getStatus());
    }

    @Test
    void scoreIsIncrementedInPlace() {
        Player player = new Player();
        player.setRoomId(room.getId());
        player.setName("Ala");
        player.setToken(UUID.randomUUID().toString());
        player = playerRepository.saveAndFlush(player);

        playerRepository.addToScore(player.getId(), 10);
        playerRepository.addToScore(player.getId(), 5);

        assertEquals(15, playerRepository.findById(player.getId()).orElseThrow().getScore());
        assertEquals(0, playerRepository.addToScore(-1L, 5));
    }
}
