package com.kopo.letterrush.service.validation;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deterministic judge: a word is valid iff it is non-empty and starts with the round letter, ignoring case.
 */
public class FallbackAnswerValidator implements AnswerValidator {

    public static final String REASON = "fallback";

    @Override
    public Map<String, AnswerVerdict> validate(ValidationBatch batch) {
        String letter = ValidationBatch.normalize(batch.letter());
        Map<String, AnswerVerdict> verdicts = new LinkedHashMap<>();
        for (ValidationBatch.Candidate candidate : batch.candidates()) {
            verdicts.put(candidate.key(), judge(candidate.word(), letter));
        }
        return verdicts;
    }

    AnswerVerdict judge(String word, String letter) {
        if (word.isEmpty()) {
            return AnswerVerdict.invalid(REASON + ": empty word");
        }
        if (letter.isEmpty() || !word.startsWith(letter)) {
            return AnswerVerdict.invalid(REASON + ": wrong letter");
        }
        return AnswerVerdict.valid(REASON);
    }

    @Override
    public String name() {
        return "fallback";
    }
}
