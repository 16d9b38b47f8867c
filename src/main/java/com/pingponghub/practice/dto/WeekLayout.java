package com.pingponghub.practice.dto;

import com.pingponghub.practice.model.WeekWindow;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WeekLayout<E> {
    private LocalDate weekStart;
    private WeekWindow window;
    private List<WeekPlacement<E>> placements;
}
