package com.pingponghub.practice.config;

import com.pingponghub.practice.model.WeekWindow;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class WeekViewPropertiesTest {

    @Test
    void toWindow_UsesDefaults() {
        assertThat(new WeekViewProperties().toWindow()).isEqualTo(new WeekWindow(6, 22, 30));
    }

    @Test
    void toWindow_UsesConfiguredValues() {
        WeekViewProperties properties = new WeekViewProperties();
        properties.setStartHour(8);
        properties.setEndHour(20);
        properties.setSlotMinutes(15);

        assertThat(properties.toWindow()).isEqualTo(new WeekWindow(8, 20, 15));
    }

    @Test
    void toWindow_WithInvalidHours_Fails() {
        WeekViewProperties properties = new WeekViewProperties();
        properties.setStartHour(23);
        properties.setEndHour(7);

        assertThatThrownBy(properties::toWindow).isInstanceOf(IllegalArgumentException.class);
    }
}
