package tech.taskpilot.platform.calendar;

import java.time.Duration;
import java.time.Instant;

public record CalendarEventRequest(String summary, String description, Instant start, Duration duration) {

    public Instant end() {
        return start.plus(duration);
    }
}
