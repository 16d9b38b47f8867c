package com.pingponghub.practice.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Six Monday-first weeks of seven cells. Cells outside the month are {@code null}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MonthLayout<E> {
    private int year;
    private int month;      // 0-based, January = 0
    private List<List<MonthCell<E>>> weeks;
}
