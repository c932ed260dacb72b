package tech.taskpilot.platform.calendar;

/**
 * Calendar collaborator used by task scheduling.
 */
public interface CalendarClient {

    CalendarEvent createEvent(CalendarCredentials credentials, CalendarEventRequest request) throws CalendarException;

    void deleteEvent(CalendarCredentials credentials, String eventId) throws CalendarException;
}
