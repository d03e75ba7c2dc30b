package com.kopo.letterrush.event;

import com.kopo.letterrush.service.RoundValidationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Hands completed rounds to the validation pool once the completing transaction has committed.
 */
@Component
public class RoundCompletionListener {

    private static final Logger logger = LoggerFactory.getLogger(RoundCompletionListener.class);

    private final RoundValidationService validationService;
    private final ExecutorService validationExecutor;

    public RoundCompletionListener(RoundValidationService validationService,
                                   @Qualifier("validationExecutor") ExecutorService validationExecutor) {
        this.validationService = validationService;
        this.validationExecutor = validationExecutor;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onRoundCompleted(RoundCompletedEvent event) {
        try {
            validationExecutor.execute(() -> validationService.validateRound(event.roundId()));
        } catch (RejectedExecutionException e) {
            logger.error("Validation queue full, round {} of room {} stays unvalidated",
                    event.roundId(), event.roomId(), e);
        }
    }
}
