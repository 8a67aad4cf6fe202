package com.phillippitts.estatesearch.service.orchestration.event;

import com.phillippitts.estatesearch.domain.CompositeResponse;

import java.time.Duration;

/**
 * Emitted once per session turn, after the composite response was handed to the user channel.
 *
 * @param response the response delivered for the turn
 * @param latency  time from the user message that opened the turn to delivery
 */
public record TurnCompletedEvent(
        CompositeResponse response,
        Duration latency
) {}
