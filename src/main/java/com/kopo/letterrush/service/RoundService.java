package com.kopo.letterrush.service;

import com.kopo.letterrush.entity.Room;
import com.kopo.letterrush.entity.Round;
import com.kopo.letterrush.event.RoundCompletedEvent;
import com.kopo.letterrush.exception.NotFoundException;
import com.kopo.letterrush.exception.ValidationException;
import com.kopo.letterrush.repository.RoomRepository;
import com.kopo.letterrush.repository.RoundRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Opens and closes rounds. Creation is serialized by a row lock on the room,
 * completion by a conditional update on the round status.
 */
@Service
@RequiredArgsConstructor
public class RoundService {

    private static final Logger logger = LoggerFactory.getLogger(RoundService.class);

    private final RoomRepository roomRepository;
    private final RoundRepository roundRepository;
    private final RoomAccessService roomAccess;
    private final LetterDrawer letterDrawer;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Opens the next round of a playing room.
     *
     * @return the new round, or empty when no letter is left and the room was finished instead
     * @throws ValidationException when the game is finished, a round is still active or every round was played
     */
    @Transactional(noRollbackFor = ValidationException.class)
    public Optional<Round> startNextRound(Long roomId) {
        Room room = roomRepository.findByIdForUpdate(roomId)
                .orElseThrow(() -> new NotFoundException("Room not found: " + roomId));
        if (room.getStatus() == Room.RoomStatus.FINISHED) {
            throw new ValidationException("Game in room " + room.getCode() + " is finished");
        }
        if (roundRepository.existsByRoomIdAndStatus(roomId, Round.RoundStatus.ACTIVE)) {
            throw new ValidationException("Room " + room.getCode() + " already has an active round");
        }
        if (room.getRoundNumber() >= room.getTotalRounds()) {
            finish(room);
            throw new ValidationException("All " + room.getTotalRounds() + " rounds of room " + room.getCode() + " were played");
        }

        Optional<String> letter = letterDrawer.draw(room.getUsedLetters());
        if (letter.isEmpty()) {
            logger.info("Room {} ran out of letters after round {}", room.getCode(), room.getRoundNumber());
            finish(room);
            return Optional.empty();
        }

        room.getUsedLetters().add(letter.get());
        room.setRoundNumber(room.getRoundNumber() + 1);
        roomRepository.save(room);

        Round round = new Round();
        round.setRoomId(roomId);
        round.setRoundNumber(room.getRoundNumber());
        round.setLetter(letter.get());
        round.setStatus(Round.RoundStatus.ACTIVE);
        round.setStartedAt(LocalDateTime.now(clock));
        roundRepository.save(round);

        logger.info("Round {}/{} started in room {} with letter {}",
                round.getRoundNumber(), room.getTotalRounds(), room.getCode(), round.getLetter());
        return Optional.of(round);
    }

    @Transactional
    public boolean completeRound(Long roundId) {
        int updated = roundRepository.completeIfActive(roundId,
                Round.RoundStatus.ACTIVE, Round.RoundStatus.COMPLETED, LocalDateTime.now(clock));
        if (updated == 0) {
            logger.debug("Round {} was already completed", roundId);
            return false;
        }
        Round round = roundRepository.findById(roundId)
                .orElseThrow(() -> new NotFoundException("Round not found: " + roundId));
        if (roomRepository.finishIfRoundBudgetSpent(round.getRoomId(), Room.RoomStatus.FINISHED) > 0) {
            logger.info("Room {} finished after its last round", round.getRoomId());
        }
        logger.info("Round {} (#{}, letter {}) completed in room {}",
                roundId, round.getRoundNumber(), round.getLetter(), round.getRoomId());
        eventPublisher.publishEvent(new RoundCompletedEvent(round.getRoomId(), roundId));
        return true;
    }

    // host only, succeeds whether or not a round is active
    @Transactional
    public void finishRound(String code, String token) {
        Room room = roomAccess.requireRoom(code);
        roomAccess.requireHost(room, token);
        roundRepository.findFirstByRoomIdAndStatus(room.getId(), Round.RoundStatus.ACTIVE)
                .ifPresentOrElse(
                        round -> completeRound(round.getId()),
                        () -> logger.debug("No active round to finish in room {}", room.getCode()));
    }

    @Transactional(noRollbackFor = ValidationException.class)
    public Optional<Round> nextRound(String code) {
        Room room = roomAccess.requireRoom(code);
        if (room.getStatus() == Room.RoomStatus.FINISHED) {
            throw new ValidationException("Game in room " + room.getCode() + " is finished");
        }
        if (room.getStatus() == Room.RoomStatus.WAITING) {
            throw new ValidationException("Game in room " + room.getCode() + " has not started");
        }
        return startNextRound(room.getId());
    }

    private void finish(Room room) {
        room.moveTo(Room.RoomStatus.FINISHED);
        roomRepository.save(room);
        logger.info("Room {} finished", room.getCode());
    }
}
