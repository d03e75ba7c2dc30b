package com.kopo.letterrush.event;

/**
 * Published once per round, by the caller that won the completion race.
 */
public record RoundCompletedEvent(Long roomId, Long roundId) {
}
