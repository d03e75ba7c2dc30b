package com.kopo.letterrush.repository;

import com.kopo.letterrush.entity.Answer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import java.util.List;

@Repository
public interface AnswerRepository extends JpaRepository<Answer, Long> {
    List<Answer> findByRoundIdOrderByIdAsc(Long roundId);

    List<Answer> findByRoundIdAndPlayerIdOrderByIdAsc(Long roundId, Long playerId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Answer a WHERE a.roundId = :roundId AND a.playerId = :playerId")
    int deleteByRoundIdAndPlayerId(@Param("roundId") Long roundId, @Param("playerId") Long playerId);

    /**
     * Writes only the judge's outcome, leaving moderation and votes made meanwhile untouched.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Answer a SET a.valid = :valid, a.points = :points, a.validationReason = :reason WHERE a.id = :id")
    int recordVerdict(@Param("id") Long id,
                      @Param("valid") boolean valid,
                      @Param("points") int points,
                      @Param("reason") String reason);

    @Query("SELECT COUNT(DISTINCT a.playerId) FROM Answer a WHERE a.roundId = :roundId")
    long countDistinctPlayersByRoundId(@Param("roundId") Long roundId);
}
