package com.kopo.letterrush.service.validation;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FallbackAnswerValidatorTest {

    private final FallbackAnswerValidator validator = new FallbackAnswerValidator();

    @Test
    void validWhenWordStartsWithLetterIgnoringCase() {
        ValidationBatch batch = new ValidationBatch("b", List.of("miasto"), List.of(
                new ValidationBatch.Candidate("miasto", "Berlin"),
                new ValidationBatch.Candidate("miasto", "Paris")));

        Map<String, AnswerVerdict> verdicts = validator.validate(batch);

        assertEquals(2, verdicts.size());
        assertTrue(verdicts.get("miasto:berlin").valid());
        assertEquals("fallback", verdicts.get("miasto:berlin").reason());
        assertFalse(verdicts.get("miasto:paris").valid());
        assertTrue(verdicts.get("miasto:paris").reason().startsWith("fallback"));
    }

    @Test
    void emptyWordIsInvalid() {
        AnswerVerdict verdict = validator.judge("", "b");

        assertFalse(verdict.valid());
    }

    @Test
    void candidatesAreNormalized() {
        ValidationBatch.Candidate candidate = new ValidationBatch.Candidate(" Miasto ", "  BERLIN ");

        assertEquals("miasto:berlin", candidate.key());
        assertEquals("miasto:berlin", ValidationBatch.key("MIASTO", "Berlin"));
    }
}
