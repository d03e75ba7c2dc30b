package com.kopo.letterrush.service;

import com.kopo.letterrush.entity.Answer;
import com.kopo.letterrush.entity.Room;
import com.kopo.letterrush.entity.Round;
import com.kopo.letterrush.repository.AnswerRepository;
import com.kopo.letterrush.repository.RoomRepository;
import com.kopo.letterrush.repository.RoundRepository;
import com.kopo.letterrush.service.validation.AnswerValidator;
import com.kopo.letterrush.service.validation.AnswerVerdict;
import com.kopo.letterrush.service.validation.FallbackAnswerValidator;
import com.kopo.letterrush.service.validation.ValidationBatch;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;

/**
 * Judges and scores a completed round.
 *
 * <p>The judge call happens outside any transaction. The verdicts are then written in one transaction
 * that first claims the round through {@code validatedAt}; a round is scored at most once even when
 * validation is triggered twice.
 */
@Service
@RequiredArgsConstructor
public class RoundValidationService {

    private static final Logger logger = LoggerFactory.getLogger(RoundValidationService.class);

    static final String NO_VERDICT = "no verdict";

    private final AnswerValidator answerValidator;
    private final FallbackAnswerValidator fallbackValidator;
    private final RoundRepository roundRepository;
    private final RoomRepository roomRepository;
    private final AnswerRepository answerRepository;
    private final ScoringService scoringService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    /**
     * Entry point of the validation pool. Never throws; failures are logged and the round stays unvalidated.
     */
    public void validateRound(Long roundId) {
        try {
            doValidate(roundId);
        } catch (RuntimeException e) {
            logger.error("Validation of round {} failed: {}", roundId, e.getMessage(), e);
        }
    }

    boolean doValidate(Long roundId) {
        Optional<Round> found = roundRepository.findById(roundId);
        if (found.isEmpty()) {
            logger.warn("Round {} vanished before validation", roundId);
            return false;
        }
        Round round = found.get();
        if (round.getStatus() != Round.RoundStatus.COMPLETED || round.getValidatedAt() != null) {
            logger.debug("Round {} is not awaiting validation", roundId);
            return false;
        }
        List<String> categories = roomRepository.findById(round.getRoomId())
                .map(Room::getCategories)
                .map(ArrayList::new)
                .orElseGet(ArrayList::new);
        List<Answer> answers = answerRepository.findByRoundIdOrderByIdAsc(roundId);

        Map<String, Integer> wordCounts = new HashMap<>();
        Map<String, ValidationBatch.Candidate> uniquePairs = new LinkedHashMap<>();
        for (Answer answer : answers) {
            ValidationBatch.Candidate candidate = new ValidationBatch.Candidate(answer.getCategory(), answer.getWord());
            wordCounts.merge(candidate.key(), 1, Integer::sum);
            uniquePairs.putIfAbsent(candidate.key(), candidate);
        }
        ValidationBatch batch = new ValidationBatch(round.getLetter(), categories, new ArrayList<>(uniquePairs.values()));
        Map<String, AnswerVerdict> verdicts = judge(batch, roundId);

        Boolean scored = transactionTemplate.execute(status -> {
            if (roundRepository.claimValidation(roundId, Round.RoundStatus.COMPLETED, LocalDateTime.now(clock)) == 0) {
                logger.info("Round {} was already validated elsewhere", roundId);
                return false;
            }
            int validCount = 0;
            for (Answer answer : answers) {
                String key = ValidationBatch.key(answer.getCategory(), answer.getWord());
                AnswerVerdict verdict = verdicts.getOrDefault(key, AnswerVerdict.invalid(NO_VERDICT));
                int points = ScoringService.pointsFor(verdict.valid(), wordCounts.getOrDefault(key, 1));
                answer.setValid(verdict.valid());
                answer.setValidationReason(verdict.reason());
                answer.setPoints(points);
                answerRepository.recordVerdict(answer.getId(), verdict.valid(), points, verdict.reason());
                scoringService.awardPoints(answer.getPlayerId(), points);
                if (verdict.valid()) {
                    validCount++;
                }
            }
            logger.info("Round {} validated: {} answers, {} valid", roundId, answers.size(), validCount);
            return true;
        });
        return Boolean.TRUE.equals(scored);
    }

    private Map<String, AnswerVerdict> judge(ValidationBatch batch, Long roundId) {
        if (batch.candidates().isEmpty()) {
            return Map.of();
        }
        try {
            return answerValidator.validate(batch);
        } catch (RuntimeException e) {
            logger.warn("Judge {} failed for round {} ({}), falling back to the letter rule",
                    answerValidator.name(), roundId, e.getMessage());
            return fallbackValidator.validate(batch);
        }
    }
}
