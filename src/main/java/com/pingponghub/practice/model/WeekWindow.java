package com.pingponghub.practice.model;

/**
 * Visible hours of a week view and the height of one row in minutes.
 * Events starting in {@code [startHour, endHour)} are rendered.
 */
public record WeekWindow(int startHour, int endHour, int slotMinutes) {

    public WeekWindow {
        if (startHour < 0 || endHour > 24 || startHour >= endHour) {
            throw new IllegalArgumentException("Invalid week window hours: " + startHour + "-" + endHour);
        }
        if (slotMinutes <= 0) {
            throw new IllegalArgumentException("Slot minutes must be positive: " + slotMinutes);
        }
    }

    public int slotCount() {
        return (endHour - startHour) * 60 / slotMinutes;
    }
}
