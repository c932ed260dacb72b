package tech.taskpilot.platform.calendar;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Google Calendar API settings.
 */
@ConfigMapping(prefix = "taskpilot.calendar")
public interface CalendarConfig {

    @WithName("base-url")
    @WithDefault("https://www.googleapis.com/calendar/v3")
    String baseUrl();

    @WithName("calendar-id")
    @WithDefault("primary")
    String calendarId();

    /**
     * Zone the event start and end are expressed in.
     */
    @WithName("default-time-zone")
    @WithDefault("UTC")
    ZoneId defaultTimeZone();

    @WithDefault("PT30S")
    Duration timeout();
}
