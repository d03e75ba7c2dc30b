package com.kopo.letterrush.service;

import com.kopo.letterrush.entity.Room;
import com.kopo.letterrush.entity.Round;
import com.kopo.letterrush.repository.RoomRepository;
import com.kopo.letterrush.repository.RoundRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Completes rounds whose timer ran out. Timers start at the first submission of a round;
 * a room without a timer counts as zero seconds, so a missed instant completion is picked up on the next tick.
 */
@Component
public class RoundTimerSweeper implements SmartLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(RoundTimerSweeper.class);

    private final RoundRepository roundRepository;
    private final RoomRepository roomRepository;
    private final RoundService roundService;
    private final ScheduledThreadPoolExecutor scheduler;
    private final Clock clock;
    private final boolean enabled;
    private final long intervalMs;

    private ScheduledFuture<?> task;

    public RoundTimerSweeper(RoundRepository roundRepository,
                             RoomRepository roomRepository,
                             RoundService roundService,
                             @Qualifier("roundClockScheduler") ScheduledThreadPoolExecutor scheduler,
                             Clock clock,
                             @Value("${game.timer.sweep-enabled:true}") boolean enabled,
                             @Value("${game.timer.sweep-interval-ms:1000}") long intervalMs) {
        this.roundRepository = roundRepository;
        this.roomRepository = roomRepository;
        this.roundService = roundService;
        this.scheduler = scheduler;
        this.clock = clock;
        this.enabled = enabled;
        this.intervalMs = intervalMs;
    }

    @Override
    public synchronized void start() {
        if (!enabled) {
            logger.info("Round timer sweep disabled");
            return;
        }
        if (task == null) {
            task = scheduler.scheduleAtFixedRate(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
            logger.info("Round timer sweep started (every {} ms)", intervalMs);
        }
    }

    @Override
    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
            logger.info("Round timer sweep stopped");
        }
    }

    @Override
    public synchronized boolean isRunning() {
        return task != null;
    }

    private void tick() {
        try {
            sweep();
        } catch (RuntimeException e) {
            // an exception escaping here would cancel the periodic task
            logger.error("Round timer sweep failed: {}", e.getMessage(), e);
        }
    }

    public int sweep() {
        List<Round> started = roundRepository.findByStatusAndFirstSubmissionAtIsNotNull(Round.RoundStatus.ACTIVE);
        LocalDateTime now = LocalDateTime.now(clock);
        int completed = 0;
        for (Round round : started) {
            try {
                int timer = roomRepository.findById(round.getRoomId()).map(Room::timerSeconds).orElse(0);
                Duration elapsed = Duration.between(round.getFirstSubmissionAt(), now);
                if (elapsed.compareTo(Duration.ofSeconds(timer)) >= 0 && roundService.completeRound(round.getId())) {
                    logger.info("Timer of round {} in room {} ran out after {}s", round.getId(), round.getRoomId(), timer);
                    completed++;
                }
            } catch (RuntimeException e) {
                logger.error("Could not complete round {}: {}", round.getId(), e.getMessage(), e);
            }
        }
        if (!started.isEmpty()) {
            logger.debug("Sweep checked {} started rounds, completed {}", started.size(), completed);
        }
        return completed;
    }
}
