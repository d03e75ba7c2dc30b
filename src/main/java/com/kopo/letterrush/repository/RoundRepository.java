package com.kopo.letterrush.repository;

import com.kopo.letterrush.entity.Round;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Round storage. Every status change goes through a conditional update so that
 * concurrent triggers (request threads, the timer sweep, other instances) agree on a single winner.
 */
@Repository
public interface RoundRepository extends JpaRepository<Round, Long> {

    Optional<Round> findFirstByRoomIdOrderByIdDesc(Long roomId);

    Optional<Round> findFirstByRoomIdAndStatus(Long roomId, Round.RoundStatus status);

    boolean existsByRoomIdAndStatus(Long roomId, Round.RoundStatus status);

    List<Round> findByStatusAndFirstSubmissionAtIsNotNull(Round.RoundStatus status);

    /**
     * Locks the room's round in the given status; submissions hold this lock so completion waits for them.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Round r WHERE r.roomId = :roomId AND r.status = :status")
    Optional<Round> findByRoomIdAndStatusForUpdate(@Param("roomId") Long roomId,
                                                   @Param("status") Round.RoundStatus status);

    /**
     * @return 1 if this call moved the round from active to completed, 0 if it was already completed
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Round r SET r.status = :completed, r.endedAt = :endedAt " +
           "WHERE r.id = :id AND r.status = :active")
    int completeIfActive(@Param("id") Long id,
                         @Param("active") Round.RoundStatus active,
                         @Param("completed") Round.RoundStatus completed,
                         @Param("endedAt") LocalDateTime endedAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Round r SET r.firstSubmissionAt = :at WHERE r.id = :id AND r.firstSubmissionAt IS NULL")
    int markFirstSubmission(@Param("id") Long id, @Param("at") LocalDateTime at);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Round r SET r.validatedAt = :at " +
           "WHERE r.id = :id AND r.status = :completed AND r.validatedAt IS NULL")
    int claimValidation(@Param("id") Long id,
                        @Param("completed") Round.RoundStatus completed,
                        @Param("at") LocalDateTime at);
}
