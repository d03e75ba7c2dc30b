package com.kopo.letterrush.service.validation;

import java.util.Map;

/**
 * Judges a batch of unique (category, word) pairs for one round.
 */
public interface AnswerValidator {

    /**
     * @param batch unique pairs with the round letter and the room's categories
     * @return verdicts keyed by {@link ValidationBatch#key(String, String)}
     * @throws JudgeUnavailableException when no trustworthy verdicts could be produced
     */
    Map<String, AnswerVerdict> validate(ValidationBatch batch);

    /**
     * Short label used in logs.
     */
    String name();
}
