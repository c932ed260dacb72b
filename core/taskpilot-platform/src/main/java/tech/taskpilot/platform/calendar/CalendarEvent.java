package tech.taskpilot.platform.calendar;

/**
 * A created calendar event.
 *
 * @param htmlLink link that opens the event in the calendar UI
 */
public record CalendarEvent(String id, String htmlLink) {}
