package com.kopo.letterrush.service;

import com.kopo.letterrush.entity.Answer;
import com.kopo.letterrush.entity.AnswerVote;
import com.kopo.letterrush.entity.Player;
import com.kopo.letterrush.entity.Room;
import com.kopo.letterrush.entity.Round;
import com.kopo.letterrush.exception.NotFoundException;
import com.kopo.letterrush.exception.ValidationException;
import com.kopo.letterrush.repository.AnswerRepository;
import com.kopo.letterrush.repository.AnswerVoteRepository;
import com.kopo.letterrush.repository.PlayerRepository;
import com.kopo.letterrush.repository.RoundRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Peer votes on answers of a completed round. A rejection is shown next to the answer and does not touch scores.
 */
@Service
@Transactional
@RequiredArgsConstructor
public class VotingService {

    private static final Logger logger = LoggerFactory.getLogger(VotingService.class);

    private final RoomAccessService roomAccess;
    private final AnswerRepository answerRepository;
    private final AnswerVoteRepository voteRepository;
    private final RoundRepository roundRepository;
    private final PlayerRepository playerRepository;
    private final Clock clock;

    public boolean vote(String code, Long answerId, String token, boolean accepted) {
        Room room = roomAccess.requireRoom(code);
        Player voter = roomAccess.requirePlayer(room, token);
        Answer answer = requireAnswerInRoom(room, answerId);
        if (answer.getPlayerId().equals(voter.getId())) {
            throw new ValidationException("Players cannot vote on their own answers");
        }

        AnswerVote vote = voteRepository.findByAnswerIdAndPlayerId(answerId, voter.getId())
                .orElseGet(() -> {
                    AnswerVote created = new AnswerVote();
                    created.setAnswerId(answerId);
                    created.setPlayerId(voter.getId());
                    return created;
                });
        vote.setAccepted(accepted);
        vote.setCreatedAt(LocalDateTime.now(clock));
        voteRepository.saveAndFlush(vote);

        boolean rejected = isRejected(answer, playerRepository.countByRoomId(room.getId()));
        logger.info("Player {} voted {} on answer {} in room {} (rejected: {})",
                voter.getName(), accepted ? "accept" : "reject", answerId, room.getCode(), rejected);
        return rejected;
    }

    // host override of the persisted rejection marker
    public boolean moderate(String code, Long answerId, String token, boolean rejected) {
        Room room = roomAccess.requireRoom(code);
        Player host = roomAccess.requireHost(room, token);
        Answer answer = requireAnswerInRoom(room, answerId);
        answer.setCommunityRejected(rejected);
        answerRepository.save(answer);
        logger.info("Host {} marked answer {} in room {} as {}",
                host.getName(), answerId, room.getCode(), rejected ? "rejected" : "not rejected");
        return isRejected(answer, playerRepository.countByRoomId(room.getId()));
    }

    @Transactional(readOnly = true)
    public boolean isRejected(Answer answer, long playerCount) {
        if (answer.isCommunityRejected()) {
            return true;
        }
        return majorityRejects(voteRepository.countByAnswerIdAndAcceptedFalse(answer.getId()), playerCount);
    }

    // strict majority of all players in the room, voters or not
    public static boolean majorityRejects(long rejectVotes, long playerCount) {
        return rejectVotes * 2 > playerCount;
    }

    private Answer requireAnswerInRoom(Room room, Long answerId) {
        Answer answer = answerRepository.findById(answerId)
                .orElseThrow(() -> new NotFoundException("Answer not found: " + answerId));
        Round round = roundRepository.findById(answer.getRoundId())
                .filter(r -> r.getRoomId().equals(room.getId()))
                .orElseThrow(() -> new NotFoundException("Answer " + answerId + " is not in room " + room.getCode()));
        if (round.getStatus() != Round.RoundStatus.COMPLETED) {
            throw new ValidationException("Votes open once the round is completed");
        }
        return answer;
    }
}
