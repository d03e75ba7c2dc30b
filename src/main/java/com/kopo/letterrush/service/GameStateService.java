package com.kopo.letterrush.service;

import com.kopo.letterrush.dto.RoomStateResponse;
import com.kopo.letterrush.entity.Answer;
import com.kopo.letterrush.entity.AnswerVote;
import com.kopo.letterrush.entity.Player;
import com.kopo.letterrush.entity.Room;
import com.kopo.letterrush.entity.Round;
import com.kopo.letterrush.repository.AnswerRepository;
import com.kopo.letterrush.repository.AnswerVoteRepository;
import com.kopo.letterrush.repository.PlayerRepository;
import com.kopo.letterrush.repository.RoundRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import java.util.*;
import java.util.stream.Collectors;

@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
public class GameStateService {

    private final RoomAccessService roomAccess;
    private final PlayerRepository playerRepository;
    private final RoundRepository roundRepository;
    private final AnswerRepository answerRepository;
    private final AnswerVoteRepository voteRepository;

    public RoomStateResponse getState(String code, String token) {
        Room room = roomAccess.requireRoom(code);
        Optional<Player> caller = roomAccess.findPlayer(room, token);
        List<Player> players = playerRepository.findByRoomIdOrderByIdAsc(room.getId());

        RoomStateResponse response = new RoomStateResponse();
        response.setRoom(new RoomStateResponse.RoomDto(room));
        response.setPlayers(players.stream().map(RoomStateResponse.PlayerDto::new).toList());

        Optional<Round> current = roundRepository.findFirstByRoomIdOrderByIdDesc(room.getId());
        if (current.isEmpty()) {
            return response;
        }
        Round round = current.get();
        response.setCurrentRound(new RoomStateResponse.RoundDto(round));

        caller.ifPresent(player -> response.setMyAnswers(
                answerRepository.findByRoundIdAndPlayerIdOrderByIdAsc(round.getId(), player.getId()).stream()
                        .map(RoomStateResponse.AnswerDto::new)
                        .toList()));

        if (round.getStatus() == Round.RoundStatus.COMPLETED) {
            List<Answer> answers = answerRepository.findByRoundIdOrderByIdAsc(round.getId());
            response.setAllAnswers(answers.stream().map(RoomStateResponse.AnswerDto::new).toList());
            response.setVotes(summarizeVotes(answers, players.size(), caller.map(Player::getId).orElse(null)));
        }
        return response;
    }

    private List<RoomStateResponse.VoteSummaryDto> summarizeVotes(List<Answer> answers, long playerCount, Long callerId) {
        if (answers.isEmpty()) {
            return List.of();
        }
        Map<Long, List<AnswerVote>> votesByAnswer = voteRepository
                .findByAnswerIdIn(answers.stream().map(Answer::getId).toList()).stream()
                .collect(Collectors.groupingBy(AnswerVote::getAnswerId));

        List<RoomStateResponse.VoteSummaryDto> summaries = new ArrayList<>();
        for (Answer answer : answers) {
            List<AnswerVote> votes = votesByAnswer.getOrDefault(answer.getId(), List.of());
            long accepts = votes.stream().filter(AnswerVote::isAccepted).count();
            long rejects = votes.size() - accepts;
            Boolean myVote = votes.stream()
                    .filter(v -> v.getPlayerId().equals(callerId))
                    .map(AnswerVote::isAccepted)
                    .findFirst()
                    .orElse(null);
            boolean rejected = answer.isCommunityRejected() || VotingService.majorityRejects(rejects, playerCount);
            summaries.add(new RoomStateResponse.VoteSummaryDto(answer.getId(), accepts, rejects, rejected, myVote));
        }
        return summaries;
    }
}
