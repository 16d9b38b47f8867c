package com.pingponghub.practice.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class WeekWindowTest {

    @Test
    void slotCount_CoversVisibleHours() {
        assertThat(new WeekWindow(6, 22, 30).slotCount()).isEqualTo(32);
        assertThat(new WeekWindow(0, 24, 60).slotCount()).isEqualTo(24);
    }

    @Test
    void constructor_RejectsInvertedHours() {
        assertThatThrownBy(() -> new WeekWindow(22, 6, 30))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WeekWindow(8, 25, 30))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_RejectsNonPositiveSlot() {
        assertThatThrownBy(() -> new WeekWindow(6, 22, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Slot minutes");
    }
}
