package com.kopo.letterrush.service;

import com.kopo.letterrush.exception.NotFoundException;
import com.kopo.letterrush.repository.PlayerRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class ScoringService {

    public static final int UNIQUE_POINTS = 10;
    public static final int SHARED_POINTS = 5;

    private final PlayerRepository playerRepository;

    /**
     * Points for one answer: 10 when valid and nobody else in the room gave the same word for the category,
     * 5 when valid but shared, 0 when invalid.
     */
    public static int pointsFor(boolean valid, int sameWordCount) {
        if (!valid) {
            return 0;
        }
        return sameWordCount > 1 ? SHARED_POINTS : UNIQUE_POINTS;
    }

    @Transactional
    public void awardPoints(Long playerId, int delta) {
        if (delta <= 0) {
            return;
        }
        if (playerRepository.addToScore(playerId, delta) == 0) {
            throw new NotFoundException("Player not found: " + playerId);
        }
    }
}
