package com.pingponghub.practice.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * One day of a month grid and the events starting on it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MonthCell<E> {
    private LocalDate date;
    private List<E> events = new ArrayList<>();

    public MonthCell(LocalDate date) {
        this.date = date;
    }
}
