package com.pingponghub.practice.model;

import java.time.LocalDateTime;

/**
 * Anything with a local start and end that can be placed on a calendar grid.
 */
public interface TimedEvent {

    LocalDateTime getStartDateTime();

    LocalDateTime getEndDateTime();
}
