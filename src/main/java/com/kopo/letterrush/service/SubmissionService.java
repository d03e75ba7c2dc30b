package com.kopo.letterrush.service;

import com.kopo.letterrush.entity.Answer;
import com.kopo.letterrush.entity.Player;
import com.kopo.letterrush.entity.Room;
import com.kopo.letterrush.entity.Round;
import com.kopo.letterrush.exception.ValidationException;
import com.kopo.letterrush.repository.AnswerRepository;
import com.kopo.letterrush.repository.PlayerRepository;
import com.kopo.letterrush.repository.RoundRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Stores a player's answers for the active round and decides whether the round ends right away.
 */
@Service
@RequiredArgsConstructor
public class SubmissionService {

    private static final Logger logger = LoggerFactory.getLogger(SubmissionService.class);

    static final int MAX_WORD_LENGTH = 100;

    private final RoomAccessService roomAccess;
    private final RoundRepository roundRepository;
    private final AnswerRepository answerRepository;
    private final PlayerRepository playerRepository;
    private final RoundService roundService;
    private final Clock clock;

    @Transactional
    public boolean submit(String code, String token, Map<String, String> answers) {
        Room room = roomAccess.requireRoom(code);
        Player player = roomAccess.requirePlayer(room, token);
        if (answers == null) {
            throw new ValidationException("answers are required");
        }
        // held until commit so completion cannot slip in between the answer rows and the completion check
        Round round = roundRepository.findByRoomIdAndStatusForUpdate(room.getId(), Round.RoundStatus.ACTIVE)
                .orElseThrow(() -> new ValidationException("No active round in room " + room.getCode()));
        for (Map.Entry<String, String> entry : answers.entrySet()) {
            if (!room.getCategories().contains(entry.getKey())) {
                throw new ValidationException("Unknown category: " + entry.getKey());
            }
            if (entry.getValue() != null && entry.getValue().trim().length() > MAX_WORD_LENGTH) {
                throw new ValidationException("Answer for " + entry.getKey() + " is longer than " + MAX_WORD_LENGTH + " characters");
            }
        }

        answerRepository.deleteByRoundIdAndPlayerId(round.getId(), player.getId());
        int saved = 0;
        for (Map.Entry<String, String> entry : answers.entrySet()) {
            String word = entry.getValue() == null ? "" : entry.getValue().trim();
            if (word.isEmpty()) {
                continue;
            }
            Answer answer = new Answer();
            answer.setRoundId(round.getId());
            answer.setPlayerId(player.getId());
            answer.setCategory(entry.getKey());
            answer.setWord(word);
            answerRepository.save(answer);
            saved++;
        }
        answerRepository.flush();

        boolean first = roundRepository.markFirstSubmission(round.getId(), LocalDateTime.now(clock)) > 0;
        long submitted = answerRepository.countDistinctPlayersByRoundId(round.getId());
        long players = playerRepository.countByRoomId(room.getId());
        logger.info("Player {} submitted {} answers in room {} round {} ({}/{} players)",
                player.getName(), saved, room.getCode(), round.getRoundNumber(), submitted, players);

        if (submitted >= players) {
            logger.info("All players submitted in room {}", room.getCode());
            return roundService.completeRound(round.getId());
        }
        if (first && !room.hasTimer()) {
            return roundService.completeRound(round.getId());
        }
        return false;
    }
}
