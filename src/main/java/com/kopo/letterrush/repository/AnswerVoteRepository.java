package com.kopo.letterrush.repository;

import com.kopo.letterrush.entity.AnswerVote;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface AnswerVoteRepository extends JpaRepository<AnswerVote, Long> {
    Optional<AnswerVote> findByAnswerIdAndPlayerId(Long answerId, Long playerId);

    List<AnswerVote> findByAnswerIdIn(Collection<Long> answerIds);

    long countByAnswerIdAndAcceptedFalse(Long answerId);
}
