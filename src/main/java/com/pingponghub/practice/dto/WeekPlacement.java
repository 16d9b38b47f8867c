package com.pingponghub.practice.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Grid coordinates of one event in a week view.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class WeekPlacement<E> {
    private E event;
    private int dayIndex;       // 0 = week start
    private int slotIndex;      // 0 = first slot of the window
    private int durationSlots;  // at least 1
}
