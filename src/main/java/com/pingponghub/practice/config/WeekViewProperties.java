package com.pingponghub.practice.config;

import com.pingponghub.practice.model.WeekWindow;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "calendar.week-view")
public class WeekViewProperties {

    private int startHour = 6;

    private int endHour = 22;

    private int slotMinutes = 30;

    public int getStartHour() {
        return startHour;
    }

    public void setStartHour(int startHour) {
        this.startHour = startHour;
    }

    public int getEndHour() {
        return endHour;
    }

    public void setEndHour(int endHour) {
        this.endHour = endHour;
    }

    public int getSlotMinutes() {
        return slotMinutes;
    }

    public void setSlotMinutes(int slotMinutes) {
        this.slotMinutes = slotMinutes;
    }

    public WeekWindow toWindow() {
        return new WeekWindow(startHour, endHour, slotMinutes);
    }
}
