package com.kopo.letterrush.service;

import com.kopo.letterrush.entity.Answer;
import com.kopo.letterrush.entity.Room;
import com.kopo.letterrush.entity.Round;
import com.kopo.letterrush.repository.AnswerRepository;
import com.kopo.letterrush.repository.PlayerRepository;
import com.kopo.letterrush.repository.RoomRepository;
import com.kopo.letterrush.repository.RoundRepository;
import com.kopo.letterrush.service.validation.AnswerValidator;
import com.kopo.letterrush.service.validation.AnswerVerdict;
import com.kopo.letterrush.service.validation.FallbackAnswerValidator;
import com.kopo.letterrush.service.validation.JudgeUnavailableException;
import com.kopo.letterrush.service.validation.ValidationBatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

class RoundValidationServiceTest {

    private RoundRepository roundRepository;
    private RoomRepository roomRepository;
    private AnswerRepository answerRepository;
    private PlayerRepository playerRepository;
    private List<Answer> answers;

    @BeforeEach
    void setUp() {
        roundRepository = mock(RoundRepository.class);
        roomRepository = mock(RoomRepository.class);
        answerRepository = mock(AnswerRepository.class);
        playerRepository = mock(PlayerRepository.class);

        Round round = new Round();
        round.setId(3L);
        round.setRoomId(1L);
        round.setLetter("B");
        round.setStatus(Round.RoundStatus.COMPLETED);
        Room room = new Room();
        room.setId(1L);
        room.getCategories().add("miasto");

        answers = new ArrayList<>(List.of(
                answer(1L, 101L, "Berlin"),
                answer(2L, 102L, "berlin "),
                answer(3L, 103L, "Boston"),
                answer(4L, 104L, "Paris")));

        when(roundRepository.findById(3L)).thenReturn(Optional.of(round));
        when(roomRepository.findById(1L)).thenReturn(Optional.of(room));
        when(answerRepository.findByRoundIdOrderByIdAsc(3L)).thenReturn(answers);
        when(roundRepository.claimValidation(eq(3L), eq(Round.RoundStatus.COMPLETED), any())).thenReturn(1);
        when(playerRepository.addToScore(anyLong(), anyInt())).thenReturn(1);
    }

    @Test
    @DisplayName("Berlin twice scores 5 each, Boston 10, Paris 0 for letter B")
    void scoresUniqueSharedAndInvalidAnswers() {
        FallbackAnswerValidator fallback = new FallbackAnswerValidator();

        assertTrue(service(fallback, fallback).doValidate(3L));

        assertEquals(5, answers.get(0).getPoints());
        assertEquals(5, answers.get(1).getPoints());
        assertEquals(10, answers.get(2).getPoints());
        assertEquals(0, answers.get(3).getPoints());
        assertTrue(answers.get(0).getValid());
        assertFalse(answers.get(3).getValid());

        verify(playerRepository).addToScore(101L, 5);
        verify(playerRepository).addToScore(102L, 5);
        verify(playerRepository).addToScore(103L, 10);
        verify(playerRepository, never()).addToScore(eq(104L), anyInt());
    }

    @Test
    @DisplayName("Verdicts are written column by column, never by saving the answers read before judging")
    void verdictsDoNotOverwriteWholeAnswers() {
        FallbackAnswerValidator fallback = new FallbackAnswerValidator();

        service(fallback, fallback).doValidate(3L);

        verify(answerRepository).recordVerdict(1L, true, 5, FallbackAnswerValidator.REASON);
        verify(answerRepository).recordVerdict(3L, true, 10, FallbackAnswerValidator.REASON);
        verify(answerRepository).recordVerdict(eq(4L), eq(false), eq(0), any());
        verify(answerRepository, never()).save(any());
    }

    @Test
    @DisplayName("Judge failure sends the whole batch to the fallback rule")
    void judgeFailureFallsBackForWholeBatch() {
        AnswerValidator judge = mock(AnswerValidator.class);
        when(judge.name()).thenReturn("gemini");
        when(judge.validate(any())).thenThrow(new JudgeUnavailableException("timeout"));

        assertTrue(service(judge, new FallbackAnswerValidator()).doValidate(3L));

        for (Answer answer : answers) {
            assertNotNull(answer.getValid());
            assertTrue(answer.getValidationReason().startsWith(FallbackAnswerValidator.REASON));
        }
        assertEquals(10, answers.get(2).getPoints());
    }

    @Test
    void batchHoldsEachPairOnce() {
        AnswerValidator judge = mock(AnswerValidator.class);
        when(judge.validate(any())).thenAnswer(inv -> {
            ValidationBatch batch = inv.getArgument(0);
            assertEquals(List.of("miasto:berlin", "miasto:boston", "miasto:paris"), batch.keys());
            return new FallbackAnswerValidator().validate(batch);
        });

        service(judge, new FallbackAnswerValidator()).doValidate(3L);

        verify(judge).validate(any());
    }

    @Test
    void pairMissingFromVerdictsIsInvalid() {
        AnswerValidator judge = mock(AnswerValidator.class);
        when(judge.validate(any())).thenReturn(Map.of("miasto:boston", AnswerVerdict.valid("city in the US")));

        service(judge, new FallbackAnswerValidator()).doValidate(3L);

        assertEquals(10, answers.get(2).getPoints());
        assertFalse(answers.get(0).getValid());
        assertEquals(RoundValidationService.NO_VERDICT, answers.get(0).getValidationReason());
    }

    @Test
    @DisplayName("A round that was already claimed is not scored again")
    void lostClaimWritesNothing() {
        when(roundRepository.claimValidation(eq(3L), eq(Round.RoundStatus.COMPLETED), any())).thenReturn(0);
        FallbackAnswerValidator fallback = new FallbackAnswerValidator();

        assertFalse(service(fallback, fallback).doValidate(3L));

        verify(answerRepository, never()).recordVerdict(any(), anyBoolean(), anyInt(), any());
        verifyNoInteractions(playerRepository);
    }

    @Test
    void validateRoundNeverThrows() {
        when(roundRepository.findById(3L)).thenThrow(new IllegalStateException("db down"));
        FallbackAnswerValidator fallback = new FallbackAnswerValidator();

        assertDoesNotThrow(() -> service(fallback, fallback).validateRound(3L));
    }

    private RoundValidationService service(AnswerValidator primary, FallbackAnswerValidator fallback) {
        TransactionTemplate transactionTemplate = new TransactionTemplate(mock(PlatformTransactionManager.class));
        Clock clock = Clock.fixed(Instant.parse("2026-01-01T12:00:00Z"), ZoneOffset.UTC);
        return new RoundValidationService(primary, fallback, roundRepository, roomRepository, answerRepository,
                new ScoringService(playerRepository), transactionTemplate, clock);
    }

    private static Answer answer(Long id, Long playerId, String word) {
        Answer answer = new Answer();
        answer.setId(id);
        answer.setRoundId(3L);
        answer.setPlayerId(playerId);
        answer.setCategory("miasto");
        answer.setWord(word);
        return answer;
    }
}
