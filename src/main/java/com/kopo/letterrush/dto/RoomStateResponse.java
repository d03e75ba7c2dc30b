package com.kopo.letterrush.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.kopo.letterrush.entity.Answer;
import com.kopo.letterrush.entity.Player;
import com.kopo.letterrush.entity.Room;
import com.kopo.letterrush.entity.Round;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Polling snapshot of a room. Answers of other players and vote tallies appear only once the round is completed.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RoomStateResponse {
    private RoomDto room;
    private List<PlayerDto> players;
    private RoundDto currentRound;
    private List<AnswerDto> myAnswers;
    private List<AnswerDto> allAnswers;
    private List<VoteSummaryDto> votes;

    @Data
    @NoArgsConstructor
    public static class RoomDto {
        private Long id;
        private String code;
        private String status;
        private int roundNumber;
        private int totalRounds;
        private Integer timerDuration;
        private List<String> categories;
        private List<String> usedLetters;
        private LocalDateTime createdAt;

        public RoomDto(Room room) {
            this.id = room.getId();
            this.code = room.getCode();
            this.status = room.getStatus().name().toLowerCase();
            this.roundNumber = room.getRoundNumber();
            this.totalRounds = room.getTotalRounds();
            this.timerDuration = room.getTimerDuration();
            this.categories = new ArrayList<>(room.getCategories());
            this.usedLetters = new ArrayList<>(room.getUsedLetters());
            this.createdAt = room.getCreatedAt();
        }
    }

    @Data
    @NoArgsConstructor
    public static class PlayerDto {
        private Long id;
        private String name;
        private int score;
        private boolean host;

        public PlayerDto(Player player) {
            this.id = player.getId();
            this.name = player.getName();
            this.score = player.getScore();
            this.host = player.isHost();
        }
    }

    @Data
    @NoArgsConstructor
    public static class RoundDto {
        private Long id;
        private int roundNumber;
        private String letter;
        private String status;
        private LocalDateTime firstSubmissionAt;
        private LocalDateTime startedAt;
        private LocalDateTime endedAt;
        private boolean validated;

        public RoundDto(Round round) {
            this.id = round.getId();
            this.roundNumber = round.getRoundNumber();
            this.letter = round.getLetter();
            this.status = round.getStatus().name().toLowerCase();
            this.firstSubmissionAt = round.getFirstSubmissionAt();
            this.startedAt = round.getStartedAt();
            this.endedAt = round.getEndedAt();
            this.validated = round.getValidatedAt() != null;
        }
    }

    @Data
    @NoArgsConstructor
    public static class AnswerDto {
        private Long id;
        private Long playerId;
        private String category;
        private String word;
        private Boolean valid;
        private int points;
        private String validationReason;
        private boolean communityRejected;

        public AnswerDto(Answer answer) {
            this.id = answer.getId();
            this.playerId = answer.getPlayerId();
            this.category = answer.getCategory();
            this.word = answer.getWord();
            this.valid = answer.getValid();
            this.points = answer.getPoints();
            this.validationReason = answer.getValidationReason();
            this.communityRejected = answer.isCommunityRejected();
        }
    }

    @Data
    @NoArgsConstructor
    public static class VoteSummaryDto {
        private Long answerId;
        private long acceptVotes;
        private long rejectVotes;
        private boolean rejected;
        private Boolean myVote;

        public VoteSummaryDto(Long answerId, long acceptVotes, long rejectVotes, boolean rejected, Boolean myVote) {
            this.answerId = answerId;
            this.acceptVotes = acceptVotes;
            this.rejectVotes = rejectVotes;
            this.rejected = rejected;
            this.myVote = myVote;
        }
    }
}
